package com.example.ledger.domain;

import java.time.Instant;
import java.util.UUID;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Record of a statement or payslip file that has been imported, keyed by the SHA-256 of its
 * content so the same file is never imported twice.
 */
@Entity
@Table(
    name = "imported_file",
    indexes = {
      @Index(name = "idx_imported_file_source", columnList = "import_source"),
      @Index(name = "idx_imported_file_path", columnList = "file_path, import_source")
    })
public class ImportedFile {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Size(max = 1000)
  @Column(name = "file_path", nullable = false, length = 1000)
  private String filePath;

  @NotNull
  @Size(max = 255)
  @Column(name = "file_name", nullable = false)
  private String fileName;

  @NotNull
  @Size(min = 64, max = 64)
  @Column(name = "file_hash", nullable = false, unique = true, length = 64)
  private String fileHash;

  @Column(name = "file_size", nullable = false)
  private long fileSize;

  @NotNull
  @Size(max = 100)
  @Column(name = "import_source", nullable = false, length = 100)
  private String importSource;

  @NotNull
  @Column(name = "import_batch_id", nullable = false)
  private UUID importBatchId;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "imported_by_id")
  private User importedBy;

  @Column(name = "transaction_count", nullable = false)
  private int transactionCount;

  @Column(columnDefinition = "TEXT")
  private String notes;

  @Column(name = "imported_at", nullable = false, updatable = false)
  private Instant importedAt;

  @PrePersist
  protected void onCreate() {
    importedAt = Instant.now();
  }

  // Constructors
  public ImportedFile() {}

  public ImportedFile(
      String filePath,
      String fileName,
      String fileHash,
      long fileSize,
      String importSource,
      UUID importBatchId) {
    this.filePath = filePath;
    this.fileName = fileName;
    this.fileHash = fileHash;
    this.fileSize = fileSize;
    this.importSource = importSource;
    this.importBatchId = importBatchId;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public String getFilePath() {
    return filePath;
  }

  public String getFileName() {
    return fileName;
  }

  public String getFileHash() {
    return fileHash;
  }

  public long getFileSize() {
    return fileSize;
  }

  public String getImportSource() {
    return importSource;
  }

  public UUID getImportBatchId() {
    return importBatchId;
  }

  public User getImportedBy() {
    return importedBy;
  }

  public void setImportedBy(User importedBy) {
    this.importedBy = importedBy;
  }

  public int getTransactionCount() {
    return transactionCount;
  }

  public void setTransactionCount(int transactionCount) {
    this.transactionCount = transactionCount;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  public Instant getImportedAt() {
    return importedAt;
  }
}
