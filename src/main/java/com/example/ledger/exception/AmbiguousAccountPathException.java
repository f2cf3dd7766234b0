package com.example.ledger.exception;

/**
 * More than one account answers to the same path segment. Sibling names are unique, so this
 * means the chart of accounts has been corrupted.
 */
public class AmbiguousAccountPathException extends LedgerIntegrityException {

  public AmbiguousAccountPathException(String path, int matches) {
    super("Account path '" + path + "' resolves to " + matches + " accounts");
  }
}
