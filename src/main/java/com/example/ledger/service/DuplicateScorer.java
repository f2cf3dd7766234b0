package com.example.ledger.service;

import java.math.BigDecimal;
import java.time.temporal.ChronoUnit;

import org.springframework.stereotype.Component;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.MatchCriteria;
import com.example.ledger.domain.Transaction;
import com.example.ledger.domain.TransactionMatch.MatchTier;

/**
 * Scores a candidate pair. The first rule that applies wins:
 *
 * <ul>
 *   <li>exact: amounts equal within the exact threshold, same date, similarity above the exact
 *       bar;
 *   <li>probable: amounts within tolerance, dates within tolerance, similarity above the probable
 *       bar;
 *   <li>possible: amounts and dates within tolerance;
 *   <li>otherwise the fallback score.
 * </ul>
 *
 * All thresholds come from {@code ledger.duplicates.*}.
 */
@Component
public class DuplicateScorer {

  private final LedgerProperties.Duplicates settings;

  public DuplicateScorer(LedgerProperties properties) {
    this.settings = properties.getDuplicates();
  }

  public DuplicateCandidate score(
      Transaction reference,
      BigDecimal referenceAmount,
      Transaction candidate,
      BigDecimal amountTolerance,
      int dateToleranceDays) {
    MatchCriteria criteria = measure(reference, referenceAmount, candidate);
    BigDecimal confidence = confidence(criteria, amountTolerance, dateToleranceDays);
    return new DuplicateCandidate(candidate, confidence, tierFor(confidence), criteria);
  }

  public MatchCriteria measure(
      Transaction reference, BigDecimal referenceAmount, Transaction candidate) {
    BigDecimal amountDelta = candidate.magnitude().subtract(referenceAmount).abs();
    long dateDelta =
        Math.abs(
            ChronoUnit.DAYS.between(reference.getTransactionDate(), candidate.getTransactionDate()));
    double similarity =
        TextSimilarity.similarity(reference.getDescription(), candidate.getDescription());
    return new MatchCriteria(
        amountDelta,
        dateDelta,
        similarity,
        dateDelta == 0,
        amountDelta.compareTo(settings.getExactAmountThreshold()) < 0);
  }

  public BigDecimal confidence(
      MatchCriteria criteria, BigDecimal amountTolerance, int dateToleranceDays) {
    boolean amountWithin = criteria.getAmountDelta().compareTo(amountTolerance) < 0;
    boolean dateWithin = criteria.getDateDeltaDays() <= dateToleranceDays;
    double similarity = criteria.getTextSimilarity();

    if (criteria.isSameAmount()
        && criteria.isSameDate()
        && similarity > settings.getExactSimilarity()) {
      return settings.getExactConfidence();
    }
    if (amountWithin && dateWithin && similarity > settings.getProbableSimilarity()) {
      return settings.getProbableConfidence();
    }
    if (amountWithin && dateWithin) {
      return settings.getPossibleConfidence();
    }
    return settings.getFallbackConfidence();
  }

  public MatchTier tierFor(BigDecimal confidence) {
    if (confidence.compareTo(settings.getExactConfidence()) >= 0) {
      return MatchTier.EXACT;
    }
    if (confidence.compareTo(settings.getProbableConfidence()) >= 0) {
      return MatchTier.PROBABLE;
    }
    return MatchTier.POSSIBLE;
  }
}
