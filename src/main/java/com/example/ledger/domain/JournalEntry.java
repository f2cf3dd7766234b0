package com.example.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One signed posting of an amount to one account. Positive amounts are debits, negative amounts
 * credits. Entries belong exclusively to their transaction and have no setters for account or
 * amount: corrections replace the transaction's whole entry set.
 */
@Entity
@Table(
    name = "journal_entry",
    indexes = {
      @Index(name = "idx_journal_entry_transaction", columnList = "transaction_id"),
      @Index(name = "idx_journal_entry_account", columnList = "account_id")
    })
public class JournalEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "transaction_id", nullable = false)
  private Transaction transaction;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "account_id", nullable = false)
  private Account account;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 4)
  private BigDecimal amount;

  @Size(max = 500)
  @Column(length = 500)
  private String memo;

  @Column(name = "line_index", nullable = false)
  private int lineIndex;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  protected JournalEntry() {}

  public JournalEntry(Account account, BigDecimal amount, String memo) {
    this.account = account;
    this.amount = amount;
    this.memo = memo;
  }

  void attachTo(Transaction transaction, int lineIndex) {
    this.transaction = transaction;
    this.lineIndex = lineIndex;
  }

  public boolean isDebit() {
    return amount.signum() > 0;
  }

  // Getters only
  public Long getId() {
    return id;
  }

  public Transaction getTransaction() {
    return transaction;
  }

  public Account getAccount() {
    return account;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getMemo() {
    return memo;
  }

  public int getLineIndex() {
    return lineIndex;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
