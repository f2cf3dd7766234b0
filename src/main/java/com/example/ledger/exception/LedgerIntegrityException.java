package com.example.ledger.exception;

/**
 * Stored ledger data violates an invariant that the services maintain, so something outside them
 * has written to the store. Surfaced as-is rather than worked around.
 */
public class LedgerIntegrityException extends LedgerException {

  public LedgerIntegrityException(String message) {
    super(ErrorKind.INTEGRITY, message);
  }
}
