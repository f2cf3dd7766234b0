package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import com.example.ledger.domain.ImportedFile;
import com.example.ledger.domain.User;
import com.example.ledger.exception.LedgerValidationException;
import com.example.ledger.repository.ImportedFileRepository;

@ExtendWith(MockitoExtension.class)
class FileImportServiceTest {

  private static final String ABC_SHA256 =
      "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

  @Mock private ImportedFileRepository importedFileRepository;

  @Mock private AuditService auditService;

  @TempDir Path tempDir;

  private FileImportService fileImportService;

  @BeforeEach
  void setUp() {
    fileImportService = new FileImportService(importedFileRepository, auditService);
  }

  @Test
  void calculateFileHash_returnsLowerCaseSha256OfContent() throws IOException {
    // Arrange
    Path statement = tempDir.resolve("statement.csv");
    Files.write(statement, "abc".getBytes(StandardCharsets.UTF_8));

    // Act
    String hash = fileImportService.calculateFileHash(statement);

    // Assert
    assertEquals(ABC_SHA256, hash);
    assertEquals(hash, fileImportService.calculateHash("abc".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void calculateHash_ofEmptyContent_isWellKnownDigest() {
    assertEquals(
        "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
        fileImportService.calculateHash(new byte[0]));
  }

  @Test
  void recordFileImport_savesRecordAndAudits() {
    // Arrange
    Path statement = tempDir.resolve("march.csv");
    UUID batchId = UUID.randomUUID();
    User user = new User("alice", "Alice");
    user.setId(1L);
    when(importedFileRepository.existsByFileHash(ABC_SHA256)).thenReturn(false);
    when(importedFileRepository.save(any(ImportedFile.class))).thenAnswer(inv -> inv.getArgument(0));

    // Act
    ImportedFile record =
        fileImportService.recordFileImport(statement, ABC_SHA256, 3L, "bank", batchId, 12, user, null);

    // Assert
    assertEquals("march.csv", record.getFileName());
    assertEquals(ABC_SHA256, record.getFileHash());
    assertEquals(batchId, record.getImportBatchId());
    assertEquals(12, record.getTransactionCount());
    assertEquals(user, record.getImportedBy());
    verify(auditService).logEvent(eq(user), eq("FILE_IMPORTED"), eq("ImportedFile"), any(), any());
  }

  @Test
  void recordFileImport_whenContentAlreadyImported_throws() {
    // Arrange
    Path statement = tempDir.resolve("march-copy.csv");
    when(importedFileRepository.existsByFileHash(ABC_SHA256)).thenReturn(true);

    // Act & Assert
    assertThrows(
        LedgerValidationException.class,
        () ->
            fileImportService.recordFileImport(
                statement, ABC_SHA256, 3L, "bank", UUID.randomUUID(), 12, null, null));
    verify(importedFileRepository, never()).save(any());
  }

  @Test
  void listImportedFiles_withoutLimit_returnsFiftyMostRecent() {
    when(importedFileRepository.findAllByOrderByImportedAtDesc(PageRequest.of(0, 50))).thenReturn(List.of());

    assertTrue(fileImportService.listImportedFiles(null, null).isEmpty());
  }

  @Test
  void listImportedFiles_forSource_filtersBySource() {
    when(importedFileRepository.findByImportSourceOrderByImportedAtDesc("bank", PageRequest.of(0, 5)))
        .thenReturn(List.of());

    fileImportService.listImportedFiles("bank", 5);

    verify(importedFileRepository, never()).findAllByOrderByImportedAtDesc(any());
  }
}
