package com.example.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountSubtype;
import com.example.ledger.domain.Account.AccountType;
import com.example.ledger.domain.Transaction;
import com.example.ledger.domain.TransactionMatch;
import com.example.ledger.domain.TransactionMatch.MatchStatus;
import com.example.ledger.domain.TransactionMatch.MatchTier;
import com.example.ledger.domain.User;
import com.example.ledger.exception.InvalidAccountException;
import com.example.ledger.exception.OwnershipExceededException;
import com.example.ledger.exception.UnbalancedTransactionException;
import com.example.ledger.repository.JournalEntryRepository;
import com.example.ledger.repository.OwnershipShareRepository;
import com.example.ledger.repository.TransactionRepository;
import com.example.ledger.service.AccountService;
import com.example.ledger.service.DuplicateCandidate;
import com.example.ledger.service.DuplicateMatcherService;
import com.example.ledger.service.EntryRequest;
import com.example.ledger.service.NewAccount;
import com.example.ledger.service.OwnershipService;
import com.example.ledger.service.PostingRequest;
import com.example.ledger.service.PostingService;
import com.example.ledger.service.UserService;

/**
 * Runs the services against an in-memory H2 database so the JPQL queries behind candidate pools,
 * visible balances, the unbalanced sweep and ownership execute for real.
 *
 * <p>The context and database are shared by all tests and nothing is cleaned up between them, so
 * each test works in its own date window and under its own account paths.
 */
@SpringBootTest
class LedgerIntegrationTest {

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) {
    registry.add(
        "spring.datasource.url",
        () -> "jdbc:h2:mem:ledger-test;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    registry.add("ledger.bootstrap.enabled", () -> "false");
  }

  @Autowired private PostingService postingService;

  @Autowired private AccountService accountService;

  @Autowired private OwnershipService ownershipService;

  @Autowired private UserService userService;

  @Autowired private DuplicateMatcherService matcherService;

  @Autowired private TransactionRepository transactionRepository;

  @Autowired private JournalEntryRepository journalEntryRepository;

  @Autowired private OwnershipShareRepository shareRepository;

  private User user;

  @BeforeEach
  void setUp() {
    user = userService.createUser("member-" + suffix(), null);
  }

  @Test
  void findCandidates_skipsSameSourceAndScoresOtherSource() {
    // Arrange
    LocalDate payday = LocalDate.of(2031, 1, 28);
    Transaction bank = postSalary("VIR SALAIRE", payday, "Assets:Pool Checking", "bank");
    postSalary("VIR SALAIRE", payday, "Assets:Pool Checking", "bank");
    Transaction payslip = postSalary("SALAIRE VIREMENT", payday, "Assets:Pool Checking", "payslip");

    // Act
    List<DuplicateCandidate> candidates = matcherService.findCandidates(bank.getId());

    // Assert
    assertEquals(1, candidates.size());
    DuplicateCandidate candidate = candidates.get(0);
    assertEquals(payslip.getId(), candidate.candidate().getId());
    assertEquals(0, new BigDecimal("0.80").compareTo(candidate.confidence()));
    assertEquals(MatchTier.PROBABLE, candidate.tier());
    assertEquals(11.0 / 17.0, candidate.criteria().getTextSimilarity(), 1e-9);
  }

  @Test
  void findCandidates_treatsMissingSourceAsItsOwnValue() {
    // Arrange
    LocalDate day = LocalDate.of(2032, 5, 1);
    Transaction manual = postRent("Rent", day, null);
    Transaction cash = postRent("Rent cash", day, null);
    Transaction imported = postRent("LOYER MAI", day, "bank");

    // Act
    List<Long> forManual = candidateIds(manual);
    List<Long> forImported = candidateIds(imported);

    // Assert
    assertEquals(List.of(imported.getId()), forManual);
    assertEquals(2, forImported.size());
    assertTrue(forImported.containsAll(List.of(manual.getId(), cash.getId())));
  }

  @Test
  void confirmingDetectedMatch_hidesDuplicateFromBalancesAndListsUntilReverted() {
    // Arrange
    LocalDate payday = LocalDate.of(2033, 3, 28);
    Transaction payslip =
        postSalary("SALAIRE VIREMENT", payday, "Assets:Payroll Checking", "payslip");
    UUID batchId = UUID.randomUUID();
    Transaction bank =
        postingService.post(
            PostingRequest.income(
                    "VIR SALAIRE",
                    payday,
                    "Income:Salary",
                    "Assets:Payroll Checking",
                    new BigDecimal("45.00"))
                .autoCreateAccounts(true)
                .importedFrom("bank", batchId, "BANK-" + batchId),
            null);
    Account checking = accountService.resolve("Assets:Payroll Checking");
    assertEquals(0, new BigDecimal("90.00").compareTo(accountService.getBalance(checking, payday)));

    // Act
    List<TransactionMatch> recorded = matcherService.detectDuplicatesForBatch(batchId, user);
    Long matchId = recorded.get(0).getId();
    matcherService.updateMatchStatus(matchId, MatchStatus.CONFIRMED, user);

    // Assert
    assertEquals(1, recorded.size());
    assertEquals(0, new BigDecimal("0.80").compareTo(recorded.get(0).getConfidence()));
    assertTrue(transactionRepository.findById(payslip.getId()).orElseThrow().isDuplicate());
    assertEquals(0, new BigDecimal("45.00").compareTo(accountService.getBalance(checking, payday)));
    assertEquals(
        List.of(bank.getId()),
        visibleIds(postingService.findVisibleTransactions(payday, payday)));
    assertTrue(
        postingService.findVisibleEntriesForAccount(checking, payday, payday).stream()
            .allMatch(entry -> entry.getAmount().compareTo(new BigDecimal("45.00")) == 0));
    assertEquals(1, postingService.findVisibleEntriesForAccount(checking, payday, payday).size());

    // Act: back to pending makes the payslip visible again
    matcherService.updateMatchStatus(matchId, MatchStatus.PENDING, user);

    // Assert
    assertFalse(transactionRepository.findById(payslip.getId()).orElseThrow().isDuplicate());
    assertEquals(0, new BigDecimal("90.00").compareTo(accountService.getBalance(checking, payday)));
    assertEquals(2, postingService.findVisibleTransactions(payday, payday).size());
  }

  @Test
  void getBalance_ignoresEntriesAfterTheDate() {
    LocalDate day = LocalDate.of(2034, 6, 30);
    postSalary("Salary June", day, "Assets:Dated Checking", null);
    Account checking = accountService.resolve("Assets:Dated Checking");

    BigDecimal dayBefore = accountService.getBalance(checking, day.minusDays(1));

    assertEquals(0, BigDecimal.ZERO.compareTo(dayBefore));
    assertEquals(0, new BigDecimal("45.00").compareTo(accountService.getBalance(checking, day)));
  }

  @Test
  void post_whenLaterEntryFails_persistsNothing() {
    // Arrange
    Account closed = accountService.resolveOrCreate("Assets:Closed Box", AccountType.ASSET);
    accountService.deactivate(closed, user);
    long transactionsBefore = transactionRepository.count();
    PostingRequest request =
        new PostingRequest("Move to closed box", LocalDate.of(2035, 2, 1))
            .entry(EntryRequest.byPath("Assets:Rollback Wallet", new BigDecimal("10.00")))
            .entry(EntryRequest.byId(closed.getId(), new BigDecimal("-10.00")))
            .autoCreateAccounts(true);

    // Act & Assert
    assertThrows(InvalidAccountException.class, () -> postingService.post(request, user));
    assertTrue(accountService.findByPath("Assets:Rollback Wallet").isEmpty());
    assertEquals(transactionsBefore, transactionRepository.count());
  }

  @Test
  void post_unbalanced_persistsNothingAndLedgerStaysBalanced() {
    // Arrange
    long transactionsBefore = transactionRepository.count();
    PostingRequest request =
        new PostingRequest("Typo", LocalDate.of(2035, 3, 1))
            .entry(EntryRequest.byPath("Assets:Typo Wallet", new BigDecimal("10.00")))
            .entry(EntryRequest.byPath("Expenses:Typo", new BigDecimal("-9.99")))
            .autoCreateAccounts(true);

    // Act & Assert
    assertThrows(UnbalancedTransactionException.class, () -> postingService.post(request, user));
    assertEquals(transactionsBefore, transactionRepository.count());
    assertTrue(accountService.findByPath("Assets:Typo Wallet").isEmpty());
    assertTrue(journalEntryRepository.findUnbalancedTransactionIds().isEmpty());
    assertDoesNotThrow(() -> postingService.verifyLedger());
  }

  @Test
  void ownership_ofUnownedAccount_isTrackedAndCapped() {
    // Arrange
    User partner = userService.createUser("partner-" + suffix(), null);
    Account assets = accountService.resolveOrCreate("Assets", AccountType.ASSET);
    NewAccount request =
        new NewAccount("Shoebox " + suffix(), AccountType.ASSET, AccountSubtype.CASH).parent(assets);
    Account shoebox = accountService.createAccountWithOwnership(request, Map.of(), user);
    assertTrue(unownedIds().contains(shoebox.getId()));

    // Act
    ownershipService.setOwnership(shoebox, user, new BigDecimal("0.6"), user);

    // Assert
    assertFalse(unownedIds().contains(shoebox.getId()));
    assertThrows(
        OwnershipExceededException.class,
        () -> ownershipService.setOwnership(shoebox, partner, new BigDecimal("0.5"), user));
    assertEquals(0, new BigDecimal("0.6").compareTo(ownershipService.totalAllocated(shoebox)));
  }

  private Transaction postSalary(String description, LocalDate date, String assetPath, String source) {
    PostingRequest request =
        PostingRequest.income(description, date, "Income:Salary", assetPath, new BigDecimal("45.00"))
            .autoCreateAccounts(true);
    if (source != null) {
      request.importedFrom(source, UUID.randomUUID(), source + "-" + UUID.randomUUID());
    }
    return postingService.post(request, user);
  }

  private Transaction postRent(String description, LocalDate date, String source) {
    PostingRequest request =
        PostingRequest.expense(
                description, date, "Expenses:Rent", "Assets:Rent Checking", new BigDecimal("800.00"))
            .autoCreateAccounts(true);
    if (source != null) {
      request.importedFrom(source, UUID.randomUUID(), null);
    }
    return postingService.post(request, user);
  }

  private List<Long> candidateIds(Transaction reference) {
    return matcherService.findCandidates(reference.getId()).stream()
        .map(candidate -> candidate.candidate().getId())
        .collect(Collectors.toList());
  }

  private static List<Long> visibleIds(List<Transaction> transactions) {
    return transactions.stream().map(Transaction::getId).collect(Collectors.toList());
  }

  private static String suffix() {
    return UUID.randomUUID().toString().substring(0, 8);
  }

  private List<Long> unownedIds() {
    return shareRepository.findAccountsWithoutOwners().stream()
        .map(Account::getId)
        .collect(Collectors.toList());
  }
}
