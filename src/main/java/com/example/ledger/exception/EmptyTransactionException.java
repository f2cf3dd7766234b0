package com.example.ledger.exception;

public class EmptyTransactionException extends LedgerValidationException {

  public EmptyTransactionException(int entryCount) {
    super("A transaction needs at least 2 entries, got " + entryCount);
  }
}
