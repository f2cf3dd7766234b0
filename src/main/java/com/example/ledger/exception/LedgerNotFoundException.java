package com.example.ledger.exception;

/** Base class for lookups of entities that do not exist. */
public class LedgerNotFoundException extends LedgerException {

  public LedgerNotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }
}
