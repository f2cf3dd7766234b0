package com.example.ledger.repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.Transaction;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, Long> {

  List<JournalEntry> findByTransactionOrderByLineIndex(Transaction transaction);

  boolean existsByAccount(Account account);

  // Aggregation queries below skip entries of hidden (merged) transactions.

  @Query(
      "SELECT je FROM JournalEntry je JOIN je.transaction t "
          + "WHERE je.account = :account AND t.duplicate = false "
          + "AND t.transactionDate BETWEEN :from AND :to "
          + "ORDER BY t.transactionDate, je.id")
  List<JournalEntry> findVisibleByAccountAndDateRange(
      @Param("account") Account account,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query(
      "SELECT COALESCE(SUM(je.amount), 0) FROM JournalEntry je JOIN je.transaction t "
          + "WHERE je.account = :account AND t.duplicate = false "
          + "AND t.transactionDate <= :asOfDate")
  BigDecimal sumVisibleByAccountAsOf(
      @Param("account") Account account, @Param("asOfDate") LocalDate asOfDate);

  /** Transaction ids whose stored entries do not net to zero. Empty unless the store is corrupt. */
  @Query(
      "SELECT je.transaction.id FROM JournalEntry je "
          + "GROUP BY je.transaction.id HAVING SUM(je.amount) <> 0")
  List<Long> findUnbalancedTransactionIds();
}
