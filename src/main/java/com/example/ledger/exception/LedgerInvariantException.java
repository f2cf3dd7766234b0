package com.example.ledger.exception;

/** A request that would violate a ledger invariant. The whole unit of work is rolled back. */
public class LedgerInvariantException extends LedgerException {

  public LedgerInvariantException(String message) {
    super(ErrorKind.INVARIANT, message);
  }
}
