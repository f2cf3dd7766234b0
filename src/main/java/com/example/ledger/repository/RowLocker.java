package com.example.ledger.repository;

import java.util.Optional;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;

import org.springframework.stereotype.Component;

import com.example.ledger.domain.Transaction;

/**
 * Takes a pessimistic write lock on a row and reloads the entity from it.
 *
 * <p>A locking finder hands back an entity already managed by the unit of work without re-reading
 * it, so state read before the lock was granted would survive. Everything returned here reflects
 * the row as of the lock.
 */
@Component
public class RowLocker {

  private final EntityManager entityManager;

  public RowLocker(EntityManager entityManager) {
    this.entityManager = entityManager;
  }

  public Optional<Transaction> lockTransaction(Long id) {
    Transaction transaction = entityManager.find(Transaction.class, id);
    if (transaction == null) {
      return Optional.empty();
    }
    entityManager.refresh(transaction, LockModeType.PESSIMISTIC_WRITE);
    return Optional.of(transaction);
  }

  /** Locks the row behind a managed entity and overwrites the entity with the row's state. */
  public <T> T lock(T entity) {
    entityManager.refresh(entity, LockModeType.PESSIMISTIC_WRITE);
    return entity;
  }
}
