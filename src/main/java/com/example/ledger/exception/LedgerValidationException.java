package com.example.ledger.exception;

/** Input rejected before any persistence. */
public class LedgerValidationException extends LedgerException {

  public LedgerValidationException(String message) {
    super(ErrorKind.VALIDATION, message);
  }
}
