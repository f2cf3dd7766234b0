package com.example.ledger.service;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.User;
import com.example.ledger.exception.LedgerValidationException;
import com.example.ledger.exception.UserNotFoundException;
import com.example.ledger.repository.UserRepository;

@Service
@Transactional
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final UserRepository userRepository;
  private final OwnershipService ownershipService;
  private final AuditService auditService;

  public UserService(
      UserRepository userRepository,
      OwnershipService ownershipService,
      AuditService auditService) {
    this.userRepository = userRepository;
    this.ownershipService = ownershipService;
    this.auditService = auditService;
  }

  /**
   * Creates a household member. The very first user becomes the sole owner of every account that
   * has no owner yet.
   *
   * @param name unique login-style name
   * @param displayName optional name shown in reports
   * @return the saved user
   * @throws LedgerValidationException if the name is blank or already taken
   */
  public User createUser(String name, String displayName) {
    if (name == null || name.isBlank()) {
      throw new LedgerValidationException("User name must not be blank");
    }
    String trimmed = name.trim();
    if (userRepository.existsByName(trimmed)) {
      throw new LedgerValidationException("User already exists: " + trimmed);
    }
    boolean first = userRepository.count() == 0;

    User user = userRepository.save(new User(trimmed, displayName));
    auditService.logEvent(user, "USER_CREATED", "User", user.getId(), "Created user: " + trimmed);
    log.info("Created user {}", trimmed);

    if (first) {
      int assigned = ownershipService.assignUnownedAccounts(user);
      log.info("First user {} received ownership of {} unowned account(s)", trimmed, assigned);
    }
    return user;
  }

  public User deactivateUser(User user) {
    user.setActive(false);
    user = userRepository.save(user);
    auditService.logEvent(
        null, "USER_DEACTIVATED", "User", user.getId(), "Deactivated user: " + user.getName());
    return user;
  }

  @Transactional(readOnly = true)
  public Optional<User> findByName(String name) {
    return userRepository.findByName(name);
  }

  @Transactional(readOnly = true)
  public User getByName(String name) {
    return userRepository.findByName(name).orElseThrow(() -> new UserNotFoundException(name));
  }

  @Transactional(readOnly = true)
  public Optional<User> findById(Long id) {
    return userRepository.findById(id);
  }

  /** The earliest-created active user. */
  @Transactional(readOnly = true)
  public Optional<User> findFirstUser() {
    return userRepository.findFirstByActiveTrueOrderByCreatedAtAscIdAsc();
  }

  @Transactional(readOnly = true)
  public List<User> findAllActive() {
    return userRepository.findByActiveTrueOrderByName();
  }
}
