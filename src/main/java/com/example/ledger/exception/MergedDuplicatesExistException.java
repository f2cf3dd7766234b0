package com.example.ledger.exception;

/** A transaction still has duplicates merged into it and cannot be deleted. */
public class MergedDuplicatesExistException extends LedgerInvariantException {

  public MergedDuplicatesExistException(Long transactionId, long mergedCount) {
    super(
        "Transaction "
            + transactionId
            + " has "
            + mergedCount
            + " merged duplicate(s); unmerge them before deleting it");
  }
}
