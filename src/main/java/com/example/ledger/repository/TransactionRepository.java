package com.example.ledger.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.Transaction;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Transaction t WHERE t.id = :id")
  Optional<Transaction> findByIdForUpdate(@Param("id") Long id);

  @Query(
      "SELECT DISTINCT t FROM Transaction t LEFT JOIN FETCH t.entries "
          + "WHERE t.id = :id")
  Optional<Transaction> findWithEntries(@Param("id") Long id);

  List<Transaction> findByImportBatchIdOrderByTransactionDate(UUID importBatchId);

  List<Transaction> findByMergedInto(Transaction primary);

  long countByMergedInto(Transaction primary);

  /**
   * Duplicate-detection pool for a reference transaction with an import source: every other
   * transaction dated within the window whose source is missing or different.
   */
  @Query(
      "SELECT DISTINCT t FROM Transaction t LEFT JOIN FETCH t.entries "
          + "WHERE t.id <> :excludedId "
          + "AND t.transactionDate BETWEEN :from AND :to "
          + "AND (t.importSource IS NULL OR t.importSource <> :source)")
  List<Transaction> findCandidatePoolOtherSource(
      @Param("excludedId") Long excludedId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to,
      @Param("source") String source);

  /** Pool for a manually entered reference transaction: only imported transactions qualify. */
  @Query(
      "SELECT DISTINCT t FROM Transaction t LEFT JOIN FETCH t.entries "
          + "WHERE t.id <> :excludedId "
          + "AND t.transactionDate BETWEEN :from AND :to "
          + "AND t.importSource IS NOT NULL")
  List<Transaction> findCandidatePoolImported(
      @Param("excludedId") Long excludedId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  /** Aggregation-facing view: hidden duplicates are excluded. */
  @Query(
      "SELECT t FROM Transaction t WHERE t.duplicate = false "
          + "AND t.transactionDate BETWEEN :from AND :to "
          + "ORDER BY t.transactionDate DESC, t.id DESC")
  List<Transaction> findVisibleBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);

  /** Transactions that have at least one match row, newest first. */
  @Query(
      "SELECT t FROM Transaction t WHERE EXISTS (SELECT m FROM TransactionMatch m "
          + "WHERE m.primary = t OR m.duplicate = t) "
          + "ORDER BY t.transactionDate DESC, t.id DESC")
  List<Transaction> findWithMatches(Pageable pageable);

  @Query("SELECT t FROM Transaction t ORDER BY t.transactionDate DESC, t.id DESC")
  List<Transaction> findRecent(Pageable pageable);
}
