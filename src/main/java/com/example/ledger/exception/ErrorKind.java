package com.example.ledger.exception;

/** How a caller should treat a {@link LedgerException}. */
public enum ErrorKind {
  /** Bad input, rejected before anything is written. Fix the request and retry. */
  VALIDATION,
  /** The request would break a ledger invariant; the unit of work was rolled back. */
  INVARIANT,
  /** Stored data already violates an invariant. Not recoverable by the caller. */
  INTEGRITY,
  /** A referenced account, transaction, match or user does not exist. */
  NOT_FOUND
}
