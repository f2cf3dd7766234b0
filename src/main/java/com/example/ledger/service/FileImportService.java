package com.example.ledger.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.ImportedFile;
import com.example.ledger.domain.User;
import com.example.ledger.exception.LedgerValidationException;
import com.example.ledger.repository.ImportedFileRepository;

/**
 * Tracks which statement and payslip files have been imported so that importers can refuse to
 * import the same file twice. Files are identified by the SHA-256 of their content.
 */
@Service
@Transactional
public class FileImportService {

  private static final Logger log = LoggerFactory.getLogger(FileImportService.class);

  private static final int DEFAULT_LIST_LIMIT = 50;

  private final ImportedFileRepository importedFileRepository;
  private final AuditService auditService;

  public FileImportService(
      ImportedFileRepository importedFileRepository, AuditService auditService) {
    this.importedFileRepository = importedFileRepository;
    this.auditService = auditService;
  }

  /** Lower-case hex SHA-256 of the file's content. */
  public String calculateFileHash(Path file) throws IOException {
    MessageDigest digest = sha256();
    try (InputStream in = Files.newInputStream(file)) {
      byte[] buffer = new byte[8192];
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
      }
    }
    return toHex(digest.digest());
  }

  public String calculateHash(byte[] content) {
    return toHex(sha256().digest(content));
  }

  public UUID newImportBatchId() {
    return UUID.randomUUID();
  }

  @Transactional(readOnly = true)
  public boolean isFileAlreadyImported(String fileHash) {
    return importedFileRepository.existsByFileHash(fileHash);
  }

  @Transactional(readOnly = true)
  public boolean isFilePathAlreadyImported(String filePath, String importSource) {
    return importedFileRepository.existsByFilePathAndImportSource(filePath, importSource);
  }

  @Transactional(readOnly = true)
  public Optional<ImportedFile> findByHash(String fileHash) {
    return importedFileRepository.findByFileHash(fileHash);
  }

  /**
   * Records a completed import.
   *
   * @throws LedgerValidationException if a file with the same content was already recorded
   */
  public ImportedFile recordFileImport(
      Path file,
      String fileHash,
      long fileSize,
      String importSource,
      UUID importBatchId,
      int transactionCount,
      User importedBy,
      String notes) {
    if (importedFileRepository.existsByFileHash(fileHash)) {
      throw new LedgerValidationException("File already imported: " + file.getFileName());
    }
    ImportedFile record =
        new ImportedFile(
            file.toString(),
            file.getFileName().toString(),
            fileHash,
            fileSize,
            importSource,
            importBatchId);
    record.setTransactionCount(transactionCount);
    record.setImportedBy(importedBy);
    record.setNotes(notes);
    record = importedFileRepository.save(record);

    auditService.logEvent(
        importedBy,
        "FILE_IMPORTED",
        "ImportedFile",
        record.getId(),
        "Imported " + transactionCount + " transaction(s) from " + record.getFileName());
    log.info(
        "Recorded import of {} ({} transactions, batch {})",
        record.getFileName(),
        transactionCount,
        importBatchId);
    return record;
  }

  /** Most recent imports first, optionally for one source only. */
  @Transactional(readOnly = true)
  public List<ImportedFile> listImportedFiles(String importSource, Integer limit) {
    PageRequest page = PageRequest.of(0, limit != null ? limit : DEFAULT_LIST_LIMIT);
    if (importSource == null) {
      return importedFileRepository.findAllByOrderByImportedAtDesc(page);
    }
    return importedFileRepository.findByImportSourceOrderByImportedAtDesc(importSource, page);
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static String toHex(byte[] hash) {
    StringBuilder hex = new StringBuilder();
    for (byte b : hash) {
      hex.append(String.format("%02x", b));
    }
    return hex.toString();
  }
}
