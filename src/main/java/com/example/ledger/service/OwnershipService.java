package com.example.ledger.service;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.config.LedgerProperties.Ownership.DefaultOwnerPolicy;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.OwnershipShare;
import com.example.ledger.domain.User;
import com.example.ledger.exception.AccountNotFoundException;
import com.example.ledger.exception.InvalidPercentageException;
import com.example.ledger.exception.OwnershipExceededException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.OwnershipShareRepository;
import com.example.ledger.repository.UserRepository;

/**
 * Maintains the fractional ownership of accounts by household members.
 *
 * <p>The shares of one account never add up to more than 1 (plus a small rounding epsilon). Every
 * edit locks the account row first, so two concurrent edits of the same account serialize around
 * the ceiling check instead of both passing it.
 */
@Service
@Transactional
public class OwnershipService {

  private static final Logger log = LoggerFactory.getLogger(OwnershipService.class);

  private static final int PERCENTAGE_SCALE = 4;

  private final OwnershipShareRepository shareRepository;
  private final AccountRepository accountRepository;
  private final UserRepository userRepository;
  private final AuditService auditService;
  private final LedgerProperties properties;

  public OwnershipService(
      OwnershipShareRepository shareRepository,
      AccountRepository accountRepository,
      UserRepository userRepository,
      AuditService auditService,
      LedgerProperties properties) {
    this.shareRepository = shareRepository;
    this.accountRepository = accountRepository;
    this.userRepository = userRepository;
    this.auditService = auditService;
    this.properties = properties;
  }

  /**
   * Sets one user's share of an account, replacing any previous share of that user.
   *
   * @param account the owned account
   * @param user the owner
   * @param percentage fraction in (0, 1]
   * @param actor acting user recorded in the audit trail, may be null
   * @return the saved share
   * @throws InvalidPercentageException if the percentage is out of range
   * @throws OwnershipExceededException if the account's total would exceed 1
   */
  public OwnershipShare setOwnership(
      Account account, User user, BigDecimal percentage, User actor) {
    validatePercentage(percentage);
    Account locked = lock(account);

    BigDecimal others = shareRepository.sumForAccountExcludingUser(locked, user);
    BigDecimal total = others.add(percentage);
    checkCeiling(locked, total);

    OwnershipShare share =
        shareRepository
            .findByAccountAndUser(locked, user)
            .orElseGet(() -> new OwnershipShare(user, locked, percentage));
    share.setPercentage(percentage);
    share = shareRepository.save(share);

    auditService.logEvent(
        actor,
        "OWNERSHIP_SET",
        "Account",
        locked.getId(),
        user.getName() + " owns " + percentage.toPlainString() + " of " + locked.getFullPath());
    log.info(
        "Ownership of {} for {} set to {}", locked.getFullPath(), user.getName(), percentage);
    return share;
  }

  /**
   * Replaces every share of an account in one step. Users missing from {@code shares} lose their
   * share; an empty map leaves the account unowned.
   */
  public List<OwnershipShare> replaceOwnership(
      Account account, Map<User, BigDecimal> shares, User actor) {
    BigDecimal total = BigDecimal.ZERO;
    for (BigDecimal percentage : shares.values()) {
      validatePercentage(percentage);
      total = total.add(percentage);
    }
    Account locked = lock(account);
    checkCeiling(locked, total);

    // Update in place rather than delete-then-insert to keep the (user, account) key stable.
    Map<User, BigDecimal> remaining = new LinkedHashMap<>(shares);
    for (OwnershipShare existing : shareRepository.findByAccountOrderByPercentageDesc(locked)) {
      BigDecimal updated = remaining.remove(existing.getUser());
      if (updated == null) {
        shareRepository.delete(existing);
      } else {
        existing.setPercentage(updated);
        shareRepository.save(existing);
      }
    }
    remaining.forEach((user, percentage) ->
        shareRepository.save(new OwnershipShare(user, locked, percentage)));

    Map<String, Object> details = new HashMap<>();
    shares.forEach((user, percentage) -> details.put(user.getName(), percentage.toPlainString()));
    auditService.logEvent(
        actor,
        "OWNERSHIP_REPLACED",
        "Account",
        locked.getId(),
        "Replaced ownership of " + locked.getFullPath(),
        details);
    log.info("Ownership of {} replaced with {} share(s)", locked.getFullPath(), shares.size());
    return shareRepository.findByAccountOrderByPercentageDesc(locked);
  }

  public void removeOwnership(Account account, User user, User actor) {
    Account locked = lock(account);
    shareRepository
        .findByAccountAndUser(locked, user)
        .ifPresent(
            share -> {
              shareRepository.delete(share);
              auditService.logEvent(
                  actor,
                  "OWNERSHIP_REMOVED",
                  "Account",
                  locked.getId(),
                  user.getName() + " no longer owns " + locked.getFullPath());
            });
  }

  /**
   * Combined share of the given users in an account, zero when none of them owns any of it. This
   * is the weight applied to the account's balance when reporting for those users.
   */
  @Transactional(readOnly = true)
  public BigDecimal ownershipWeight(Account account, Collection<User> users) {
    if (users == null || users.isEmpty()) {
      return BigDecimal.ZERO;
    }
    return shareRepository.sumForAccountAndUsers(account, users);
  }

  @Transactional(readOnly = true)
  public List<OwnershipShare> getOwnership(Account account) {
    return shareRepository.findByAccountOrderByPercentageDesc(account);
  }

  @Transactional(readOnly = true)
  public List<OwnershipShare> getUserShares(User user) {
    return shareRepository.findByUser(user);
  }

  @Transactional(readOnly = true)
  public BigDecimal totalAllocated(Account account) {
    return shareRepository.sumForAccount(account);
  }

  /**
   * Gives a freshly created account its default owner according to {@code
   * ledger.ownership.default-owner-policy}. Runs inside the creating unit of work.
   *
   * @param account the new account
   * @param creator acting user, may be null
   * @return the share created, empty when the policy names nobody
   */
  public Optional<OwnershipShare> applyDefaultOwnership(Account account, User creator) {
    DefaultOwnerPolicy policy = properties.getOwnership().getDefaultOwnerPolicy();
    Optional<User> owner;
    switch (policy) {
      case NONE:
        owner = Optional.empty();
        break;
      case CREATOR:
        owner =
            creator != null && creator.isActive()
                ? Optional.of(creator)
                : userRepository.findFirstByActiveTrueOrderByCreatedAtAscIdAsc();
        break;
      case FIRST_USER:
      default:
        owner = userRepository.findFirstByActiveTrueOrderByCreatedAtAscIdAsc();
        break;
    }
    if (owner.isEmpty()) {
      log.debug("No default owner for {} under policy {}", account.getFullPath(), policy);
      return Optional.empty();
    }
    return Optional.of(shareRepository.save(new OwnershipShare(owner.get(), account, BigDecimal.ONE)));
  }

  /**
   * Gives {@code user} all of every account that nobody owns yet.
   *
   * @return number of accounts assigned
   */
  public int assignUnownedAccounts(User user) {
    List<Account> unowned = shareRepository.findAccountsWithoutOwners();
    for (Account account : unowned) {
      shareRepository.save(new OwnershipShare(user, account, BigDecimal.ONE));
    }
    if (!unowned.isEmpty()) {
      auditService.logEvent(
          user,
          "OWNERSHIP_ASSIGNED",
          "User",
          user.getId(),
          "Assigned " + unowned.size() + " unowned account(s) to " + user.getName());
    }
    return unowned.size();
  }

  private Account lock(Account account) {
    return accountRepository
        .findByIdForUpdate(account.getId())
        .orElseThrow(() -> new AccountNotFoundException(String.valueOf(account.getId())));
  }

  private void checkCeiling(Account account, BigDecimal total) {
    BigDecimal ceiling = BigDecimal.ONE.add(properties.getOwnership().getEpsilon());
    if (total.compareTo(ceiling) > 0) {
      log.warn("Rejected ownership of {}: total would be {}", account.getFullPath(), total);
      throw new OwnershipExceededException(account.getFullPath(), total);
    }
  }

  private static void validatePercentage(BigDecimal percentage) {
    if (percentage == null
        || percentage.signum() <= 0
        || percentage.compareTo(BigDecimal.ONE) > 0
        || percentage.stripTrailingZeros().scale() > PERCENTAGE_SCALE) {
      throw new InvalidPercentageException(percentage);
    }
  }
}
