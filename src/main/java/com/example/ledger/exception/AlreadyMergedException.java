package com.example.ledger.exception;

public class AlreadyMergedException extends LedgerInvariantException {

  public AlreadyMergedException(Long transactionId, Long mergedIntoId) {
    super("Transaction " + transactionId + " is already merged into transaction " + mergedIntoId);
  }
}
