package com.example.ledger.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.service.UserService;

/**
 * Creates the default household user on startup when the user table is empty, so that newly
 * created accounts have someone to receive default ownership. Disabled with {@code
 * ledger.bootstrap.enabled=false}.
 */
@Component
public class DataInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

  private final UserService userService;
  private final boolean enabled;
  private final String defaultUserName;
  private final String defaultDisplayName;

  public DataInitializer(
      UserService userService,
      @Value("${ledger.bootstrap.enabled:true}") boolean enabled,
      @Value("${ledger.bootstrap.default-user:household}") String defaultUserName,
      @Value("${ledger.bootstrap.default-display-name:Household}") String defaultDisplayName) {
    this.userService = userService;
    this.enabled = enabled;
    this.defaultUserName = defaultUserName;
    this.defaultDisplayName = defaultDisplayName;
  }

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    if (!enabled) {
      log.debug("Bootstrap user creation disabled");
      return;
    }
    if (userService.findFirstUser().isPresent()) {
      log.info("Users already exist, skipping bootstrap");
      return;
    }

    log.info("Creating default user: {}", defaultUserName);
    userService.createUser(defaultUserName, defaultDisplayName);
  }
}
