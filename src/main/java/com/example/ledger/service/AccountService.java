package com.example.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountSubtype;
import com.example.ledger.domain.Account.AccountType;
import com.example.ledger.domain.User;
import com.example.ledger.exception.AccountNotFoundException;
import com.example.ledger.exception.AmbiguousAccountPathException;
import com.example.ledger.exception.DuplicateAccountNameException;
import com.example.ledger.exception.InvalidAccountException;
import com.example.ledger.exception.InvalidPathException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.JournalEntryRepository;

/**
 * The chart of accounts: path resolution with on-demand creation, explicit creation with full
 * validation, moves and renames, and soft deletion.
 *
 * <p>Every account creation goes through {@link OwnershipService} in the same unit of work so a
 * new account never exists without its default ownership.
 */
@Service
@Transactional
public class AccountService {

  private static final Logger log = LoggerFactory.getLogger(AccountService.class);

  private static final Map<String, AccountType> ROOT_NAMES =
      Map.ofEntries(
          Map.entry("asset", AccountType.ASSET),
          Map.entry("assets", AccountType.ASSET),
          Map.entry("liability", AccountType.LIABILITY),
          Map.entry("liabilities", AccountType.LIABILITY),
          Map.entry("equity", AccountType.EQUITY),
          Map.entry("income", AccountType.INCOME),
          Map.entry("revenue", AccountType.INCOME),
          Map.entry("expense", AccountType.EXPENSE),
          Map.entry("expenses", AccountType.EXPENSE));

  private final AccountRepository accountRepository;
  private final JournalEntryRepository journalEntryRepository;
  private final OwnershipService ownershipService;
  private final AccountValidator accountValidator;
  private final AuditService auditService;
  private final LedgerProperties properties;

  public AccountService(
      AccountRepository accountRepository,
      JournalEntryRepository journalEntryRepository,
      OwnershipService ownershipService,
      AccountValidator accountValidator,
      AuditService auditService,
      LedgerProperties properties) {
    this.accountRepository = accountRepository;
    this.journalEntryRepository = journalEntryRepository;
    this.ownershipService = ownershipService;
    this.accountValidator = accountValidator;
    this.auditService = auditService;
    this.properties = properties;
  }

  public Account resolveOrCreate(String path, AccountType typeHint) {
    return resolveOrCreate(path, typeHint, AccountSubtype.CATEGORY, null);
  }

  public Account resolveOrCreate(String path, AccountType type, AccountSubtype leafSubtype) {
    return resolveOrCreate(path, type, leafSubtype, null);
  }

  /**
   * Resolves a colon-delimited path, creating every missing segment under the last resolved one.
   * Intermediate accounts are created as CATEGORY; a newly created leaf gets {@code leafSubtype}.
   *
   * <p>New children take their parent's type. A new root takes {@code typeHint}, or, when no hint
   * is given, the type named by the root (Assets, Liabilities, Equity, Income, Expenses).
   *
   * @param path path such as {@code Expenses:Food:Groceries}
   * @param typeHint type for new segments, may be null
   * @param leafSubtype subtype of the leaf if it has to be created
   * @param actor user on whose behalf accounts are created, may be null
   * @return the account at the end of the path
   * @throws InvalidPathException if the path is empty or has an empty segment
   * @throws AmbiguousAccountPathException if a segment matches more than one account
   */
  public Account resolveOrCreate(
      String path, AccountType typeHint, AccountSubtype leafSubtype, User actor) {
    AccountPath parsed = AccountPath.parse(path);
    int maxDepth = properties.getAccounts().getMaxDepth();
    if (parsed.depth() > maxDepth) {
      throw new InvalidPathException(path, "deeper than " + maxDepth + " levels");
    }

    Account current = null;
    List<String> segments = parsed.segments();
    for (int i = 0; i < segments.size(); i++) {
      String segment = segments.get(i);
      Optional<Account> existing = findChild(current, segment, parsed.prefix(i + 1));
      if (existing.isPresent()) {
        current = existing.get();
        continue;
      }
      boolean leaf = i == segments.size() - 1;
      current =
          createSegment(
              current, segment, typeHint, leaf ? leafSubtype : AccountSubtype.CATEGORY, path, actor);
    }
    return current;
  }

  /**
   * Resolves a path without creating anything.
   *
   * @throws AccountNotFoundException if any segment is missing
   */
  @Transactional(readOnly = true)
  public Account resolve(String path) {
    return findByPath(path).orElseThrow(() -> new AccountNotFoundException(path));
  }

  @Transactional(readOnly = true)
  public Optional<Account> findByPath(String path) {
    AccountPath parsed = AccountPath.parse(path);
    Account current = null;
    for (int i = 0; i < parsed.depth(); i++) {
      Optional<Account> child = findChild(current, parsed.segments().get(i), parsed.prefix(i + 1));
      if (child.isEmpty()) {
        return Optional.empty();
      }
      current = child.get();
    }
    return Optional.of(current);
  }

  /**
   * Creates one account with full validation and default ownership.
   *
   * @throws InvalidAccountException if any field is invalid
   * @throws DuplicateAccountNameException if a sibling already has the name
   */
  public Account createAccount(NewAccount request, User actor) {
    Account account = insert(request, actor);
    ownershipService.applyDefaultOwnership(account, actor);
    return account;
  }

  /**
   * Creates one account with the given ownership shares instead of the default owner. Account and
   * shares are written in the same unit of work; an invalid share set leaves no account behind.
   */
  public Account createAccountWithOwnership(
      NewAccount request, Map<User, BigDecimal> shares, User actor) {
    Account account = insert(request, actor);
    ownershipService.replaceOwnership(account, shares, actor);
    return account;
  }

  public Account rename(Account account, String newName, User actor) {
    return moveOrRename(account, newName, account.getParent(), actor);
  }

  public Account move(Account account, Account newParent, User actor) {
    return moveOrRename(account, account.getName(), newParent, actor);
  }

  /**
   * Renames an account and/or moves it under a new parent (null for a root), then recomputes the
   * cached path of the account and of every descendant.
   *
   * @throws InvalidAccountException on an invalid name, an incompatible parent or a cycle
   * @throws DuplicateAccountNameException if the destination already has a sibling of that name
   */
  public Account moveOrRename(Account account, String newName, Account newParent, User actor) {
    String name = newName != null ? newName.trim() : account.getName();
    accountValidator.validatePlacement(name, account.getType(), newParent);

    if (newParent != null) {
      for (Account ancestor = newParent; ancestor != null; ancestor = ancestor.getParent()) {
        if (ancestor.equals(account)) {
          throw new InvalidAccountException(
              List.of(
                  "cannot move " + account.getFullPath() + " under its own descendant "
                      + newParent.getFullPath()));
        }
      }
      int maxDepth = properties.getAccounts().getMaxDepth();
      if (newParent.depth() + subtreeHeight(account) > maxDepth) {
        throw new InvalidAccountException(List.of("hierarchy deeper than " + maxDepth + " levels"));
      }
    }

    List<Account> namesakes =
        newParent == null
            ? accountRepository.findRootsByName(name)
            : accountRepository.findByParentAndName(newParent, name);
    for (Account namesake : namesakes) {
      if (!namesake.equals(account)) {
        throw new DuplicateAccountNameException(
            name, newParent == null ? null : newParent.getFullPath());
      }
    }

    String oldPath = account.getFullPath();
    account.setName(name);
    account.setParent(newParent);
    int updated = recomputePaths(account);

    auditService.logEvent(
        actor,
        "ACCOUNT_MOVED",
        "Account",
        account.getId(),
        "Moved " + oldPath + " to " + account.getFullPath());
    log.info("Moved {} to {} ({} path(s) updated)", oldPath, account.getFullPath(), updated);
    return account;
  }

  /** Applies the non-null fields of {@code updates} and re-validates the result. */
  public Account updateDetails(Account account, AccountUpdates updates, User actor) {
    if (!updates.hasUpdates()) {
      return account;
    }
    if (updates.getNotes() != null) {
      account.setNotes(updates.getNotes());
    }
    if (updates.getCurrency() != null) {
      account.setCurrency(updates.getCurrency());
    }
    if (updates.getSymbol() != null) {
      account.setSymbol(updates.getSymbol());
    }
    if (updates.getQuantity() != null) {
      account.setQuantity(updates.getQuantity());
    }
    if (updates.getAverageCost() != null) {
      account.setAverageCost(updates.getAverageCost());
    }
    if (updates.getAddress() != null) {
      account.setAddress(updates.getAddress());
    }
    if (updates.getPurchaseDate() != null) {
      account.setPurchaseDate(updates.getPurchaseDate());
    }
    if (updates.getPurchasePrice() != null) {
      account.setPurchasePrice(updates.getPurchasePrice());
    }
    accountValidator.validateDetails(account);
    account = accountRepository.save(account);

    auditService.logEvent(
        actor,
        "ACCOUNT_UPDATED",
        "Account",
        account.getId(),
        "Updated account: " + account.getFullPath());
    return account;
  }

  /** Soft delete. Entries posted to the account stay where they are. */
  public Account deactivate(Account account, User actor) {
    account.setActive(false);
    account = accountRepository.save(account);
    auditService.logEvent(
        actor,
        "ACCOUNT_DEACTIVATED",
        "Account",
        account.getId(),
        "Deactivated account: " + account.getFullPath());
    log.info("Deactivated account {}", account.getFullPath());
    return account;
  }

  public Account reactivate(Account account, User actor) {
    account.setActive(true);
    account = accountRepository.save(account);
    auditService.logEvent(
        actor,
        "ACCOUNT_REACTIVATED",
        "Account",
        account.getId(),
        "Reactivated account: " + account.getFullPath());
    return account;
  }

  @Transactional(readOnly = true)
  public Optional<Account> findById(Long id) {
    return accountRepository.findById(id);
  }

  @Transactional(readOnly = true)
  public Account getById(Long id) {
    return accountRepository
        .findById(id)
        .orElseThrow(() -> new AccountNotFoundException(String.valueOf(id)));
  }

  @Transactional(readOnly = true)
  public List<Account> findAllActive() {
    return accountRepository.findByActiveOrderByFullPath(true);
  }

  @Transactional(readOnly = true)
  public List<Account> findByType(AccountType type) {
    return accountRepository.findByTypeAndActiveOrderByFullPath(type, true);
  }

  @Transactional(readOnly = true)
  public List<Account> findRoots() {
    return accountRepository.findRoots();
  }

  @Transactional(readOnly = true)
  public List<Account> findChildren(Account parent) {
    return accountRepository.findByParentOrderByName(parent);
  }

  /**
   * Balance of an account as of a date, counting only visible transactions, in the account's
   * natural sign: positive for a debit balance on assets and expenses and for a credit balance on
   * the other types.
   */
  @Transactional(readOnly = true)
  public BigDecimal getBalance(Account account, LocalDate asOfDate) {
    BigDecimal raw = journalEntryRepository.sumVisibleByAccountAsOf(account, asOfDate);
    return account.getType().increasesWithDebit() ? raw : raw.negate();
  }

  private Optional<Account> findChild(Account parent, String name, String pathSoFar) {
    List<Account> matches =
        parent == null
            ? accountRepository.findRootsByName(name)
            : accountRepository.findByParentAndName(parent, name);
    if (matches.size() > 1) {
      log.error("Chart of accounts is corrupt: {} matches {} accounts", pathSoFar, matches.size());
      throw new AmbiguousAccountPathException(pathSoFar, matches.size());
    }
    return matches.stream().findFirst();
  }

  private Account createSegment(
      Account parent,
      String name,
      AccountType typeHint,
      AccountSubtype subtype,
      String fullPath,
      User actor) {
    accountValidator.validatePathSegment(name);
    AccountType type;
    if (parent != null) {
      type = parent.getType();
      if (typeHint != null && typeHint != type) {
        throw new InvalidAccountException(
            List.of("parent " + parent.getFullPath() + " is " + type + ", not " + typeHint));
      }
    } else if (typeHint != null) {
      type = typeHint;
    } else {
      type = ROOT_NAMES.get(name.toLowerCase(Locale.ROOT));
      if (type == null) {
        throw new InvalidPathException(
            fullPath, "cannot tell the account type of new root '" + name + "'");
      }
    }
    if (!subtype.isValidFor(type)) {
      throw new InvalidAccountException(
          List.of("subtype " + subtype + " is not valid for type " + type));
    }

    Account account = new Account(name, type, subtype, parent);
    account.setCurrency(properties.getAccounts().getDefaultCurrency());
    account.setFullPath(account.derivePath());
    account = accountRepository.save(account);
    ownershipService.applyDefaultOwnership(account, actor);

    auditService.logEvent(
        actor,
        "ACCOUNT_CREATED",
        "Account",
        account.getId(),
        "Created account from path: " + account.getFullPath());
    log.info("Auto-created account {} ({})", account.getFullPath(), type);
    return account;
  }

  private Account insert(NewAccount request, User actor) {
    String currency =
        request.getCurrency() != null
            ? request.getCurrency()
            : properties.getAccounts().getDefaultCurrency();
    accountValidator.validateNew(request, currency);

    String name = request.getName().trim();
    Account parent = request.getParent();
    List<Account> namesakes =
        parent == null
            ? accountRepository.findRootsByName(name)
            : accountRepository.findByParentAndName(parent, name);
    if (!namesakes.isEmpty()) {
      throw new DuplicateAccountNameException(name, parent == null ? null : parent.getFullPath());
    }

    Account account = new Account(name, request.getType(), request.getSubtype(), parent);
    account.setCurrency(currency);
    account.setNotes(request.getNotes());
    account.setSymbol(request.getSymbol());
    account.setQuantity(request.getQuantity());
    account.setAverageCost(request.getAverageCost());
    account.setAddress(request.getAddress());
    account.setPurchaseDate(request.getPurchaseDate());
    account.setPurchasePrice(request.getPurchasePrice());
    account.setFullPath(account.derivePath());
    account = accountRepository.save(account);

    auditService.logEvent(
        actor,
        "ACCOUNT_CREATED",
        "Account",
        account.getId(),
        "Created account: " + account.getFullPath());
    log.info("Created account {}", account.getFullPath());
    return account;
  }

  /** Recomputes the cached path of {@code account} and its descendants; returns how many changed. */
  private int recomputePaths(Account account) {
    account.setFullPath(account.derivePath());
    accountRepository.save(account);
    int count = 1;
    for (Account child : accountRepository.findByParent(account)) {
      count += recomputePaths(child);
    }
    return count;
  }

  private int subtreeHeight(Account account) {
    int height = 0;
    for (Account child : accountRepository.findByParent(account)) {
      height = Math.max(height, subtreeHeight(child));
    }
    return height + 1;
  }
}
