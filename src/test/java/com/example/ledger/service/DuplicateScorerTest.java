package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.MatchCriteria;
import com.example.ledger.domain.Transaction;
import com.example.ledger.domain.TransactionMatch.MatchTier;

/** Unit tests for DuplicateScorer covering each scoring rule and the tier boundaries. */
class DuplicateScorerTest {

  private static final BigDecimal TOLERANCE = new BigDecimal("0.01");
  private static final LocalDate PAYDAY = LocalDate.of(2024, 3, 28);

  private LedgerProperties properties;
  private DuplicateScorer scorer;
  private Account checking;
  private Account salary;

  @BeforeEach
  void setUp() {
    properties = new LedgerProperties();
    scorer = new DuplicateScorer(properties);
    checking = new Account("Checking", Account.AccountType.ASSET, Account.AccountSubtype.CHECKING);
    salary = new Account("Salary", Account.AccountType.INCOME, Account.AccountSubtype.SALARY);
  }

  @Test
  void score_sameAmountSameDayIdenticalText_isExact() {
    Transaction bank = transaction(1L, "VIR SALAIRE MARS", PAYDAY, "3000.00");
    Transaction payslip = transaction(2L, "Vir salaire mars", PAYDAY, "3000.00");

    DuplicateCandidate result = scorer.score(bank, bank.magnitude(), payslip, TOLERANCE, 3);

    assertEquals(0, new BigDecimal("0.95").compareTo(result.confidence()));
    assertEquals(MatchTier.EXACT, result.tier());
    assertTrue(result.criteria().isSameDate());
    assertTrue(result.criteria().isSameAmount());
  }

  @Test
  void score_reorderedLabelOnSameDay_isProbable() {
    Transaction bank = transaction(1L, "VIR SALAIRE", PAYDAY, "45.00");
    Transaction payslip = transaction(2L, "SALAIRE VIREMENT", PAYDAY, "45.00");

    DuplicateCandidate result = scorer.score(bank, bank.magnitude(), payslip, TOLERANCE, 3);

    assertEquals(0, new BigDecimal("0.80").compareTo(result.confidence()));
    assertEquals(MatchTier.PROBABLE, result.tier());
    assertEquals(11.0 / 17.0, result.criteria().getTextSimilarity(), 1e-9);
  }

  @Test
  void score_unrelatedTextTwoDaysApart_isPossible() {
    Transaction bank = transaction(1L, "CB CARREFOUR", PAYDAY, "45.00");
    Transaction manual = transaction(2L, "Groceries", PAYDAY.plusDays(2), "45.00");

    DuplicateCandidate result = scorer.score(bank, bank.magnitude(), manual, TOLERANCE, 3);

    assertEquals(0, new BigDecimal("0.60").compareTo(result.confidence()));
    assertEquals(MatchTier.POSSIBLE, result.tier());
    assertEquals(2, result.criteria().getDateDeltaDays());
  }

  @Test
  void score_amountDeltaEqualToTolerance_fallsBack() {
    Transaction bank = transaction(1L, "Rent", PAYDAY, "800.00");
    Transaction manual = transaction(2L, "Rent", PAYDAY, "800.01");

    DuplicateCandidate result = scorer.score(bank, bank.magnitude(), manual, TOLERANCE, 3);

    assertEquals(0, new BigDecimal("0.30").compareTo(result.confidence()));
    assertEquals(MatchTier.POSSIBLE, result.tier());
    assertFalse(result.criteria().isSameAmount());
  }

  @Test
  void confidence_dateBeyondTolerance_fallsBack() {
    MatchCriteria criteria = new MatchCriteria(BigDecimal.ZERO, 4, 1.0, false, true);

    assertEquals(0, new BigDecimal("0.30").compareTo(scorer.confidence(criteria, TOLERANCE, 3)));
  }

  @Test
  void tierFor_usesConfiguredConfidenceBoundaries() {
    assertEquals(MatchTier.EXACT, scorer.tierFor(new BigDecimal("0.95")));
    assertEquals(MatchTier.PROBABLE, scorer.tierFor(new BigDecimal("0.94")));
    assertEquals(MatchTier.PROBABLE, scorer.tierFor(new BigDecimal("0.80")));
    assertEquals(MatchTier.POSSIBLE, scorer.tierFor(new BigDecimal("0.79")));
    assertEquals(MatchTier.POSSIBLE, scorer.tierFor(BigDecimal.ZERO));
  }

  @Test
  void confidence_followsConfiguredScores() {
    properties.getDuplicates().setProbableConfidence(new BigDecimal("0.85"));
    MatchCriteria criteria = new MatchCriteria(BigDecimal.ZERO, 1, 0.7, false, true);

    assertEquals(0, new BigDecimal("0.85").compareTo(scorer.confidence(criteria, TOLERANCE, 3)));
  }

  private Transaction transaction(Long id, String description, LocalDate date, String amount) {
    Transaction transaction = new Transaction(description, date);
    transaction.setId(id);
    transaction.addEntry(new JournalEntry(checking, new BigDecimal(amount), null));
    transaction.addEntry(new JournalEntry(salary, new BigDecimal(amount).negate(), null));
    return transaction;
  }
}
