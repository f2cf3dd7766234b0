package com.example.ledger.exception;

/** Base exception for errors raised by the ledger services. */
public abstract class LedgerException extends RuntimeException {

  private final ErrorKind kind;

  protected LedgerException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected LedgerException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}
