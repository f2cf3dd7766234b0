package com.example.ledger.exception;

public class NotMergedException extends LedgerInvariantException {

  public NotMergedException(Long transactionId) {
    super("Transaction " + transactionId + " is not merged into another transaction");
  }
}
