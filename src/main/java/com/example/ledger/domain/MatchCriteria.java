package com.example.ledger.domain;

import java.math.BigDecimal;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Why two transactions were proposed as duplicates: the raw measurements behind a confidence
 * score, kept with the match so a reviewer can see how it was reached.
 */
@Embeddable
public class MatchCriteria {

  @Column(name = "amount_delta", nullable = false, precision = 19, scale = 4)
  private BigDecimal amountDelta;

  @Column(name = "date_delta_days", nullable = false)
  private long dateDeltaDays;

  @Column(name = "text_similarity", nullable = false)
  private double textSimilarity;

  @Column(name = "same_date", nullable = false)
  private boolean sameDate;

  @Column(name = "same_amount", nullable = false)
  private boolean sameAmount;

  protected MatchCriteria() {}

  public MatchCriteria(
      BigDecimal amountDelta,
      long dateDeltaDays,
      double textSimilarity,
      boolean sameDate,
      boolean sameAmount) {
    this.amountDelta = amountDelta;
    this.dateDeltaDays = dateDeltaDays;
    this.textSimilarity = textSimilarity;
    this.sameDate = sameDate;
    this.sameAmount = sameAmount;
  }

  public BigDecimal getAmountDelta() {
    return amountDelta;
  }

  public long getDateDeltaDays() {
    return dateDeltaDays;
  }

  public double getTextSimilarity() {
    return textSimilarity;
  }

  public boolean isSameDate() {
    return sameDate;
  }

  public boolean isSameAmount() {
    return sameAmount;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MatchCriteria)) return false;
    MatchCriteria that = (MatchCriteria) o;
    return dateDeltaDays == that.dateDeltaDays
        && Double.compare(textSimilarity, that.textSimilarity) == 0
        && sameDate == that.sameDate
        && sameAmount == that.sameAmount
        && (amountDelta == null
            ? that.amountDelta == null
            : that.amountDelta != null && amountDelta.compareTo(that.amountDelta) == 0);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dateDeltaDays, textSimilarity, sameDate, sameAmount);
  }

  @Override
  public String toString() {
    return String.format(
        "amount delta %s, %d day(s) apart, similarity %.2f%s%s",
        amountDelta,
        dateDeltaDays,
        textSimilarity,
        sameDate ? ", same date" : "",
        sameAmount ? ", same amount" : "");
  }
}
