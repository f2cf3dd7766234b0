package com.example.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * A directed assertion that {@code duplicate} records the same real-world event as {@code
 * primary}. There is at most one match per ordered pair. Status changes are always reversible:
 * PENDING moves to CONFIRMED or REJECTED and both can move back to PENDING.
 *
 * <p>While a match is confirmed by a merge, the status it had before the merge is kept in {@code
 * statusBeforeMerge} so that undoing the merge restores it exactly.
 */
@Entity
@Table(
    name = "transaction_match",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uq_transaction_match_pair",
          columnNames = {"primary_transaction_id", "duplicate_transaction_id"})
    },
    indexes = {
      @Index(name = "idx_transaction_match_status", columnList = "status"),
      @Index(name = "idx_transaction_match_duplicate", columnList = "duplicate_transaction_id")
    })
public class TransactionMatch {

  /** Confidence band of a match, derived from its score by the duplicate scorer. */
  public enum MatchTier {
    EXACT,
    PROBABLE,
    POSSIBLE
  }

  public enum MatchStatus {
    PENDING,
    CONFIRMED,
    REJECTED
  }

  /** Whether the match came from duplicate detection or from a user merging two transactions. */
  public enum MatchOrigin {
    DETECTED,
    MANUAL
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "primary_transaction_id", nullable = false)
  private Transaction primary;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "duplicate_transaction_id", nullable = false)
  private Transaction duplicate;

  @NotNull
  @DecimalMin("0")
  @DecimalMax("1")
  @Column(nullable = false, precision = 3, scale = 2)
  private BigDecimal confidence;

  @Embedded private MatchCriteria criteria;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "match_tier", nullable = false, length = 20)
  private MatchTier tier;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private MatchStatus status = MatchStatus.PENDING;

  @Enumerated(EnumType.STRING)
  @Column(name = "status_before_merge", length = 20)
  private MatchStatus statusBeforeMerge;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private MatchOrigin origin = MatchOrigin.DETECTED;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at")
  private Instant updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = Instant.now();
  }

  // Constructors
  public TransactionMatch() {}

  public TransactionMatch(
      Transaction primary,
      Transaction duplicate,
      BigDecimal confidence,
      MatchCriteria criteria,
      MatchTier tier,
      MatchOrigin origin) {
    this.primary = primary;
    this.duplicate = duplicate;
    this.origin = origin;
    rescore(confidence, criteria, tier);
  }

  /** Replaces score, criteria and tier. Status is left alone. */
  public void rescore(BigDecimal confidence, MatchCriteria criteria, MatchTier tier) {
    this.confidence = confidence;
    this.criteria = criteria;
    this.tier = tier;
  }

  /** Whether this match links the two transactions, in either direction. */
  public boolean links(Transaction a, Transaction b) {
    return (primary.equals(a) && duplicate.equals(b)) || (primary.equals(b) && duplicate.equals(a));
  }

  public void confirmForMerge() {
    if (statusBeforeMerge == null) {
      statusBeforeMerge = status;
    }
    status = MatchStatus.CONFIRMED;
  }

  public void restoreAfterUnmerge() {
    status = statusBeforeMerge != null ? statusBeforeMerge : MatchStatus.PENDING;
    statusBeforeMerge = null;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Transaction getPrimary() {
    return primary;
  }

  public Transaction getDuplicate() {
    return duplicate;
  }

  public BigDecimal getConfidence() {
    return confidence;
  }

  public MatchCriteria getCriteria() {
    return criteria;
  }

  public MatchTier getTier() {
    return tier;
  }

  public MatchStatus getStatus() {
    return status;
  }

  public void setStatus(MatchStatus status) {
    this.status = status;
  }

  public MatchStatus getStatusBeforeMerge() {
    return statusBeforeMerge;
  }

  public MatchOrigin getOrigin() {
    return origin;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
