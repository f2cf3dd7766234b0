package com.example.ledger.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.Transaction;
import com.example.ledger.domain.TransactionMatch;
import com.example.ledger.domain.TransactionMatch.MatchStatus;

/** Repository for duplicate-candidate matches between transactions. */
@Repository
public interface TransactionMatchRepository extends JpaRepository<TransactionMatch, Long> {

  Optional<TransactionMatch> findByPrimaryAndDuplicate(Transaction primary, Transaction duplicate);

  /** Matches linking the two transactions in either direction. */
  @Query(
      "SELECT m FROM TransactionMatch m "
          + "WHERE (m.primary = :a AND m.duplicate = :b) OR (m.primary = :b AND m.duplicate = :a)")
  List<TransactionMatch> findLinking(@Param("a") Transaction a, @Param("b") Transaction b);

  /** All matches in which the transaction takes part, best first. */
  @Query(
      "SELECT m FROM TransactionMatch m WHERE m.primary = :t OR m.duplicate = :t "
          + "ORDER BY m.confidence DESC, m.id")
  List<TransactionMatch> findInvolving(@Param("t") Transaction transaction);

  List<TransactionMatch> findByStatusOrderByConfidenceDesc(MatchStatus status);

  @Query("SELECT COUNT(m) FROM TransactionMatch m WHERE m.primary = :t OR m.duplicate = :t")
  long countInvolving(@Param("t") Transaction transaction);
}
