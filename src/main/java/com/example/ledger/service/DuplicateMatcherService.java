package com.example.ledger.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.MatchCriteria;
import com.example.ledger.domain.Transaction;
import com.example.ledger.domain.TransactionMatch;
import com.example.ledger.domain.TransactionMatch.MatchOrigin;
import com.example.ledger.domain.TransactionMatch.MatchStatus;
import com.example.ledger.domain.TransactionMatch.MatchTier;
import com.example.ledger.domain.User;
import com.example.ledger.exception.LedgerValidationException;
import com.example.ledger.exception.MatchNotFoundException;
import com.example.ledger.exception.SelfMergeException;
import com.example.ledger.exception.TransactionNotFoundException;
import com.example.ledger.repository.RowLocker;
import com.example.ledger.repository.TransactionMatchRepository;
import com.example.ledger.repository.TransactionRepository;

/**
 * Finds transactions that probably record the same real-world event as another one, typically the
 * same salary seen once on a bank statement and once on a payslip, and keeps the review state of
 * each proposed pair.
 */
@Service
@Transactional
public class DuplicateMatcherService {

  private static final Logger log = LoggerFactory.getLogger(DuplicateMatcherService.class);

  /** Overview row: a transaction with its amount and the number of matches it takes part in. */
  public record DuplicateSummary(Transaction transaction, BigDecimal amount, long matchCount) {
    public boolean hasDuplicates() {
      return matchCount > 0;
    }
  }

  /** Side-by-side view of a transaction for reviewing a proposed pair. */
  public record TransactionComparison(
      Long id,
      String description,
      LocalDate transactionDate,
      String importSource,
      String entriesSummary) {}

  private static final Comparator<DuplicateCandidate> CANDIDATE_ORDER =
      Comparator.comparing(DuplicateCandidate::confidence)
          .reversed()
          .thenComparingLong(c -> c.criteria().getDateDeltaDays())
          .thenComparing(c -> c.criteria().getAmountDelta())
          .thenComparing(c -> c.candidate().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

  private final TransactionRepository transactionRepository;
  private final TransactionMatchRepository matchRepository;
  private final DuplicateScorer duplicateScorer;
  private final MergeService mergeService;
  private final AuditService auditService;
  private final RowLocker rowLocker;
  private final LedgerProperties.Duplicates settings;

  public DuplicateMatcherService(
      TransactionRepository transactionRepository,
      TransactionMatchRepository matchRepository,
      DuplicateScorer duplicateScorer,
      MergeService mergeService,
      AuditService auditService,
      RowLocker rowLocker,
      LedgerProperties properties) {
    this.transactionRepository = transactionRepository;
    this.matchRepository = matchRepository;
    this.duplicateScorer = duplicateScorer;
    this.mergeService = mergeService;
    this.auditService = auditService;
    this.rowLocker = rowLocker;
    this.settings = properties.getDuplicates();
  }

  @Transactional(readOnly = true)
  public List<DuplicateCandidate> findCandidates(Transaction transaction) {
    return findCandidates(
        transaction, settings.getAmountTolerance(), settings.getDateToleranceDays());
  }

  /**
   * Scores every transaction dated within {@code dateToleranceDays} of the reference whose amount
   * is within {@code amountTolerance} of it and whose import source differs from the reference's
   * (a missing source counts as a value of its own). The amount of a transaction is half the sum
   * of its absolute entry amounts.
   *
   * @return candidates, best first; ties go to the closer date, then the closer amount
   */
  @Transactional(readOnly = true)
  public List<DuplicateCandidate> findCandidates(
      Transaction transaction, BigDecimal amountTolerance, int dateToleranceDays) {
    BigDecimal referenceAmount = transaction.magnitude();
    LocalDate from = transaction.getTransactionDate().minusDays(dateToleranceDays);
    LocalDate to = transaction.getTransactionDate().plusDays(dateToleranceDays);

    List<Transaction> pool =
        transaction.getImportSource() != null
            ? transactionRepository.findCandidatePoolOtherSource(
                transaction.getId(), from, to, transaction.getImportSource())
            : transactionRepository.findCandidatePoolImported(transaction.getId(), from, to);

    List<DuplicateCandidate> candidates = new ArrayList<>();
    for (Transaction other : pool) {
      if (other.magnitude().subtract(referenceAmount).abs().compareTo(amountTolerance) > 0) {
        continue;
      }
      DuplicateCandidate scored =
          duplicateScorer.score(
              transaction, referenceAmount, other, amountTolerance, dateToleranceDays);
      log.debug(
          "Transaction {} vs {}: {} ({})",
          transaction.getId(),
          other.getId(),
          scored.confidence(),
          scored.criteria());
      candidates.add(scored);
    }
    candidates.sort(CANDIDATE_ORDER);
    return candidates;
  }

  @Transactional(readOnly = true)
  public List<DuplicateCandidate> findCandidates(Long transactionId) {
    return findCandidates(load(transactionId));
  }

  /**
   * Records that {@code duplicate} may duplicate {@code primary}. Recording the same ordered pair
   * again updates the existing row's score and criteria and leaves its status alone.
   *
   * @throws SelfMergeException if both are the same transaction
   */
  public TransactionMatch recordMatch(
      Transaction primary, Transaction duplicate, BigDecimal confidence, MatchCriteria criteria) {
    if (primary.equals(duplicate)) {
      throw new SelfMergeException(primary.getId());
    }
    if (confidence == null
        || confidence.signum() < 0
        || confidence.compareTo(BigDecimal.ONE) > 0) {
      throw new LedgerValidationException("Match confidence must be between 0 and 1, got " + confidence);
    }
    BigDecimal score = confidence.setScale(2, RoundingMode.HALF_UP);
    MatchTier tier = duplicateScorer.tierFor(score);

    TransactionMatch match =
        matchRepository
            .findByPrimaryAndDuplicate(primary, duplicate)
            .map(
                existing -> {
                  existing.rescore(score, criteria, tier);
                  return existing;
                })
            .orElseGet(
                () ->
                    new TransactionMatch(
                        primary, duplicate, score, criteria, tier, MatchOrigin.DETECTED));
    return matchRepository.save(match);
  }

  /**
   * Moves a match to a new review status. Confirming merges the pair so that the duplicate is
   * hidden in the same step; leaving CONFIRMED on a merged pair unmerges it first. Every
   * transition can be undone by another call.
   *
   * @throws MatchNotFoundException if no match has the id
   */
  public TransactionMatch updateMatchStatus(Long matchId, MatchStatus status, User actor) {
    TransactionMatch match =
        matchRepository.findById(matchId).orElseThrow(() -> new MatchNotFoundException(matchId));
    Long primaryId = match.getPrimary().getId();
    Long duplicateId = match.getDuplicate().getId();

    // Merge state and match status are only read once both transaction rows are held.
    List<Transaction> locked = mergeService.lockPair(primaryId, duplicateId);
    match = rowLocker.lock(match);
    MatchStatus previous = match.getStatus();
    if (previous == status) {
      return match;
    }

    Transaction primary = locked.get(0).getId().equals(primaryId) ? locked.get(0) : locked.get(1);
    Transaction duplicate = primary == locked.get(0) ? locked.get(1) : locked.get(0);
    boolean merged = mergeService.isMergedPair(primary, duplicate);

    if (status == MatchStatus.CONFIRMED && !merged) {
      mergeService.merge(primary.getId(), duplicate.getId(), actor);
    } else if (status != MatchStatus.CONFIRMED && merged) {
      Transaction hidden = duplicate.isDuplicate() ? duplicate : primary;
      mergeService.unmerge(hidden.getId(), actor, true);
    }
    match.setStatus(status);
    match = matchRepository.save(match);

    auditService.logEvent(
        actor,
        "MATCH_STATUS_CHANGED",
        "TransactionMatch",
        matchId,
        "Match " + matchId + " changed from " + previous + " to " + status);
    log.info("Match {} changed from {} to {}", matchId, previous, status);
    return match;
  }

  /**
   * Runs detection for every transaction of an import batch and records the candidates scoring at
   * least {@code ledger.duplicates.minimum-recorded-confidence}. With {@code autoConfirmExact},
   * exact matches are merged straight away.
   *
   * @return the matches recorded
   */
  public List<TransactionMatch> detectDuplicatesForBatch(
      UUID importBatchId, boolean autoConfirmExact, User actor) {
    List<Transaction> batch =
        transactionRepository.findByImportBatchIdOrderByTransactionDate(importBatchId);
    List<TransactionMatch> recorded = new ArrayList<>();
    int merged = 0;

    for (Transaction transaction : batch) {
      for (DuplicateCandidate candidate : findCandidates(transaction)) {
        if (candidate.confidence().compareTo(settings.getMinimumRecordedConfidence()) < 0) {
          continue;
        }
        TransactionMatch match =
            recordMatch(
                transaction, candidate.candidate(), candidate.confidence(), candidate.criteria());
        recorded.add(match);

        if (autoConfirmExact
            && match.getTier() == MatchTier.EXACT
            && match.getStatus() == MatchStatus.PENDING
            && !transaction.isDuplicate()
            && !candidate.candidate().isDuplicate()) {
          mergeService.merge(transaction.getId(), candidate.candidate().getId(), actor);
          merged++;
        }
      }
    }

    log.info(
        "Duplicate detection for batch {}: {} transaction(s), {} match(es) recorded, {} merged",
        importBatchId,
        batch.size(),
        recorded.size(),
        merged);
    return recorded;
  }

  public List<TransactionMatch> detectDuplicatesForBatch(UUID importBatchId, User actor) {
    return detectDuplicatesForBatch(importBatchId, settings.isAutoConfirmExact(), actor);
  }

  @Transactional(readOnly = true)
  public List<TransactionMatch> getMatchesForTransaction(Long transactionId) {
    return matchRepository.findInvolving(load(transactionId));
  }

  @Transactional(readOnly = true)
  public List<TransactionMatch> findPendingMatches() {
    return matchRepository.findByStatusOrderByConfidenceDesc(MatchStatus.PENDING);
  }

  /**
   * Recent transactions with the number of matches each takes part in.
   *
   * @param onlyWithDuplicates restrict to transactions that have at least one match
   * @param limit maximum number of rows
   */
  @Transactional(readOnly = true)
  public List<DuplicateSummary> findTransactionsWithDuplicates(
      boolean onlyWithDuplicates, int limit) {
    PageRequest page = PageRequest.of(0, limit);
    List<Transaction> transactions =
        onlyWithDuplicates
            ? transactionRepository.findWithMatches(page)
            : transactionRepository.findRecent(page);
    return transactions.stream()
        .map(t -> new DuplicateSummary(t, t.magnitude(), matchRepository.countInvolving(t)))
        .collect(Collectors.toList());
  }

  /** Entries rendered as {@code path: amount | path: amount}, largest amount first. */
  @Transactional(readOnly = true)
  public TransactionComparison describeForComparison(Long transactionId) {
    Transaction transaction = load(transactionId);
    String summary =
        transaction.getEntries().stream()
            .sorted(Comparator.comparing(JournalEntry::getAmount).reversed())
            .map(e -> e.getAccount().getFullPath() + ": " + e.getAmount().toPlainString())
            .collect(Collectors.joining(" | "));
    return new TransactionComparison(
        transaction.getId(),
        transaction.getDescription(),
        transaction.getTransactionDate(),
        transaction.getImportSource(),
        summary.isEmpty() ? "No entries" : summary);
  }

  private Transaction load(Long transactionId) {
    return transactionRepository
        .findWithEntries(transactionId)
        .orElseThrow(() -> new TransactionNotFoundException(transactionId));
  }
}
