package com.example.ledger.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.Transaction;
import com.example.ledger.domain.TransactionMatch;
import com.example.ledger.domain.TransactionMatch.MatchOrigin;
import com.example.ledger.domain.TransactionMatch.MatchTier;
import com.example.ledger.domain.User;
import com.example.ledger.exception.AlreadyMergedException;
import com.example.ledger.exception.NotMergedException;
import com.example.ledger.exception.SelfMergeException;
import com.example.ledger.exception.TransactionNotFoundException;
import com.example.ledger.repository.RowLocker;
import com.example.ledger.repository.TransactionMatchRepository;
import com.example.ledger.repository.TransactionRepository;

/**
 * Hides a duplicate transaction behind the transaction it duplicates, and undoes that.
 *
 * <p>The hidden flag, the merge target and the status of the match rows linking the pair are
 * always changed together in one unit of work, with both transaction rows locked in ascending id
 * order and re-read under the lock. Entries of the hidden transaction are never touched.
 */
@Service
@Transactional
public class MergeService {

  private static final Logger log = LoggerFactory.getLogger(MergeService.class);

  private static final BigDecimal MANUAL_CONFIDENCE = new BigDecimal("1.00");

  private final TransactionRepository transactionRepository;
  private final TransactionMatchRepository matchRepository;
  private final DuplicateScorer duplicateScorer;
  private final AuditService auditService;
  private final RowLocker rowLocker;

  public MergeService(
      TransactionRepository transactionRepository,
      TransactionMatchRepository matchRepository,
      DuplicateScorer duplicateScorer,
      AuditService auditService,
      RowLocker rowLocker) {
    this.transactionRepository = transactionRepository;
    this.matchRepository = matchRepository;
    this.duplicateScorer = duplicateScorer;
    this.auditService = auditService;
    this.rowLocker = rowLocker;
  }

  /**
   * Merges {@code duplicateId} into {@code primaryId}. When no match row links the two, a manual
   * one is created at full confidence; every linking row becomes CONFIRMED.
   *
   * @return the hidden duplicate
   * @throws SelfMergeException if both ids are the same
   * @throws AlreadyMergedException if either transaction is already hidden
   */
  public Transaction merge(Long primaryId, Long duplicateId, User actor) {
    if (primaryId.equals(duplicateId)) {
      throw new SelfMergeException(primaryId);
    }
    List<Transaction> locked = lockPair(primaryId, duplicateId);
    Transaction primary = pick(locked, primaryId);
    Transaction duplicate = pick(locked, duplicateId);

    if (duplicate.isDuplicate()) {
      throw new AlreadyMergedException(duplicateId, duplicate.getMergedInto().getId());
    }
    if (primary.isDuplicate()) {
      throw new AlreadyMergedException(primaryId, primary.getMergedInto().getId());
    }

    List<TransactionMatch> links = new ArrayList<>(matchRepository.findLinking(primary, duplicate));
    if (links.isEmpty()) {
      TransactionMatch manual =
          new TransactionMatch(
              primary,
              duplicate,
              MANUAL_CONFIDENCE,
              duplicateScorer.measure(primary, primary.magnitude(), duplicate),
              MatchTier.EXACT,
              MatchOrigin.MANUAL);
      links.add(manual);
    }
    for (TransactionMatch link : links) {
      link.confirmForMerge();
    }
    matchRepository.saveAll(links);

    duplicate.markMergedInto(primary);
    transactionRepository.save(duplicate);

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("primaryId", primaryId);
    details.put("matchesConfirmed", links.size());
    auditService.logEvent(
        actor,
        "TRANSACTION_MERGED",
        "Transaction",
        duplicateId,
        "Merged transaction " + duplicateId + " into " + primaryId,
        details);
    log.info("Merged transaction {} into {}", duplicateId, primaryId);
    return duplicate;
  }

  /**
   * Makes a hidden transaction visible again. Linking match rows get back the status they had
   * before the merge and a manual row created by the merge is removed, so merge followed by unmerge
   * leaves everything as it was.
   *
   * @return the transaction, visible again
   * @throws NotMergedException if the transaction is not hidden
   */
  public Transaction unmerge(Long transactionId, User actor) {
    return unmerge(transactionId, actor, false);
  }

  /**
   * Variant used when a reviewer moves a merged pair's match away from CONFIRMED: the manual row
   * is kept so that the reviewer's new status has somewhere to live.
   */
  public Transaction unmerge(Long transactionId, User actor, boolean keepManualMatch) {
    Transaction seen =
        transactionRepository
            .findById(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    requireMerged(seen);
    Long primaryId = seen.getMergedInto().getId();

    List<Transaction> locked = lockPair(transactionId, primaryId);
    Transaction hidden = pick(locked, transactionId);
    requireMerged(hidden);
    Transaction primary;
    if (hidden.getMergedInto().getId().equals(primaryId)) {
      primary = pick(locked, primaryId);
    } else {
      // Re-merged elsewhere before the lock; the hidden row is held now, so its target is final.
      log.debug(
          "Transaction {} moved from {} to {} before unmerge",
          transactionId,
          primaryId,
          hidden.getMergedInto().getId());
      primaryId = hidden.getMergedInto().getId();
      primary = lockOne(primaryId);
    }

    int restored = 0;
    for (TransactionMatch link : matchRepository.findLinking(primary, hidden)) {
      if (link.getOrigin() == MatchOrigin.MANUAL && !keepManualMatch) {
        matchRepository.delete(link);
      } else {
        link.restoreAfterUnmerge();
        matchRepository.save(link);
        restored++;
      }
    }

    hidden.clearMerge();
    transactionRepository.save(hidden);

    auditService.logEvent(
        actor,
        "TRANSACTION_UNMERGED",
        "Transaction",
        transactionId,
        "Unmerged transaction " + transactionId + " from " + primaryId);
    log.info(
        "Unmerged transaction {} from {} ({} match row(s) restored)",
        transactionId,
        primaryId,
        restored);
    return hidden;
  }

  /** Whether the two transactions are currently merged, in either direction. */
  @Transactional(readOnly = true)
  public boolean isMergedPair(Transaction a, Transaction b) {
    return (a.isDuplicate() && b.equals(a.getMergedInto()))
        || (b.isDuplicate() && a.equals(b.getMergedInto()));
  }

  /**
   * Locks both transaction rows in ascending id order and reloads them. Callers deciding whether a
   * pair is merged must read the flags from these rows, never from copies loaded earlier.
   *
   * @return the two transactions, lower id first
   */
  public List<Transaction> lockPair(Long first, Long second) {
    Long low = first < second ? first : second;
    Long high = first < second ? second : first;
    return List.of(lockOne(low), lockOne(high));
  }

  private Transaction lockOne(Long id) {
    return rowLocker.lockTransaction(id).orElseThrow(() -> new TransactionNotFoundException(id));
  }

  private static Transaction pick(List<Transaction> locked, Long id) {
    return locked.get(0).getId().equals(id) ? locked.get(0) : locked.get(1);
  }

  private static void requireMerged(Transaction transaction) {
    if (!transaction.isDuplicate() || transaction.getMergedInto() == null) {
      throw new NotMergedException(transaction.getId());
    }
  }
}
