package com.example.ledger.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.ImportedFile;

@Repository
public interface ImportedFileRepository extends JpaRepository<ImportedFile, Long> {

  boolean existsByFileHash(String fileHash);

  boolean existsByFilePathAndImportSource(String filePath, String importSource);

  Optional<ImportedFile> findByFileHash(String fileHash);

  List<ImportedFile> findByImportSourceOrderByImportedAtDesc(String importSource, Pageable pageable);

  List<ImportedFile> findAllByOrderByImportedAtDesc(Pageable pageable);
}
