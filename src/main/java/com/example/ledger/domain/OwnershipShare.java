package com.example.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * Fraction of an account attributable to one user, stored as a value in (0, 1]. The shares of an
 * account may add up to less than 1 (unassigned remainder) but never to more.
 */
@Entity
@Table(
    name = "ownership_share",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uq_ownership_user_account",
          columnNames = {"user_id", "account_id"})
    },
    indexes = {
      @Index(name = "idx_ownership_account", columnList = "account_id"),
      @Index(name = "idx_ownership_user", columnList = "user_id")
    })
public class OwnershipShare {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "user_id", nullable = false)
  private User user;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "account_id", nullable = false)
  private Account account;

  @NotNull
  @DecimalMin(value = "0", inclusive = false)
  @DecimalMax("1")
  @Column(nullable = false, precision = 5, scale = 4)
  private BigDecimal percentage;

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
  public OwnershipShare() {}

  public OwnershipShare(User user, Account account, BigDecimal percentage) {
    this.user = user;
    this.account = account;
    this.percentage = percentage;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public User getUser() {
    return user;
  }

  public Account getAccount() {
    return account;
  }

  public BigDecimal getPercentage() {
    return percentage;
  }

  public void setPercentage(BigDecimal percentage) {
    this.percentage = percentage;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
