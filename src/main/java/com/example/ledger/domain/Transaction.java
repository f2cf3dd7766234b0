package com.example.ledger.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A transaction header grouping the journal entries that record one real-world event. The entries
 * of a persisted transaction always sum to zero; they are only ever replaced as a whole set.
 *
 * <p>A transaction recognised as a duplicate of another is hidden rather than deleted: {@code
 * duplicate} is set and {@code mergedInto} points at the surviving transaction. Hidden
 * transactions stay queryable for audit but are excluded from aggregation queries.
 */
@Entity
@Table(
    name = "ledger_transaction",
    indexes = {
      @Index(name = "idx_transaction_date", columnList = "transaction_date"),
      @Index(name = "idx_transaction_import_batch", columnList = "import_batch_id"),
      @Index(name = "idx_transaction_duplicate", columnList = "is_duplicate")
    })
public class Transaction {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Size(max = 500)
  @Column(nullable = false, length = 500)
  private String description;

  @Size(max = 100)
  @Column(length = 100)
  private String reference;

  @NotNull
  @Column(name = "transaction_date", nullable = false)
  private LocalDate transactionDate;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "created_by_id")
  private User createdBy;

  // Import provenance

  @Size(max = 100)
  @Column(name = "import_source", length = 100)
  private String importSource;

  @Column(name = "import_batch_id")
  private UUID importBatchId;

  @Size(max = 255)
  @Column(name = "external_reference")
  private String externalReference;

  // Duplicate tracking

  @Column(name = "is_duplicate", nullable = false)
  private boolean duplicate = false;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "merged_into_id")
  private Transaction mergedInto;

  @OneToMany(mappedBy = "transaction", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("lineIndex ASC")
  private List<JournalEntry> entries = new ArrayList<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public Transaction() {}

  public Transaction(String description, LocalDate transactionDate) {
    this.description = description;
    this.transactionDate = transactionDate;
  }

  /** Appends an entry; only used while the transaction is being assembled. */
  public void addEntry(JournalEntry entry) {
    entry.attachTo(this, entries.size());
    entries.add(entry);
  }

  /** Swaps the whole entry set; the caller has already checked that the new set balances. */
  public void replaceEntries(List<JournalEntry> newEntries) {
    entries.clear();
    for (JournalEntry entry : newEntries) {
      addEntry(entry);
    }
  }

  /** Signed sum of all entries; zero for every balanced transaction. */
  public BigDecimal entrySum() {
    return entries.stream().map(JournalEntry::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  /**
   * Amount moved by this transaction: half the sum of the absolute entry amounts, which for a
   * balanced transaction equals its total debits.
   */
  public BigDecimal magnitude() {
    BigDecimal absolute =
        entries.stream().map(e -> e.getAmount().abs()).reduce(BigDecimal.ZERO, BigDecimal::add);
    return absolute.divide(BigDecimal.valueOf(2), 4, RoundingMode.HALF_EVEN);
  }

  public boolean isBalanced() {
    return entrySum().compareTo(BigDecimal.ZERO) == 0;
  }

  public void markMergedInto(Transaction primary) {
    this.duplicate = true;
    this.mergedInto = primary;
  }

  public void clearMerge() {
    this.duplicate = false;
    this.mergedInto = null;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getReference() {
    return reference;
  }

  public void setReference(String reference) {
    this.reference = reference;
  }

  public LocalDate getTransactionDate() {
    return transactionDate;
  }

  public void setTransactionDate(LocalDate transactionDate) {
    this.transactionDate = transactionDate;
  }

  public User getCreatedBy() {
    return createdBy;
  }

  public void setCreatedBy(User createdBy) {
    this.createdBy = createdBy;
  }

  public String getImportSource() {
    return importSource;
  }

  public void setImportSource(String importSource) {
    this.importSource = importSource;
  }

  public UUID getImportBatchId() {
    return importBatchId;
  }

  public void setImportBatchId(UUID importBatchId) {
    this.importBatchId = importBatchId;
  }

  public String getExternalReference() {
    return externalReference;
  }

  public void setExternalReference(String externalReference) {
    this.externalReference = externalReference;
  }

  public boolean isDuplicate() {
    return duplicate;
  }

  public Transaction getMergedInto() {
    return mergedInto;
  }

  public List<JournalEntry> getEntries() {
    return Collections.unmodifiableList(entries);
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Transaction)) return false;
    Transaction other = (Transaction) o;
    return id != null && id.equals(other.getId());
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
