package com.example.ledger.exception;

/** Another account with the same name already exists under the same parent (or among roots). */
public class DuplicateAccountNameException extends LedgerInvariantException {

  public DuplicateAccountNameException(String name, String parentPath) {
    super(
        "Account name '"
            + name
            + "' already exists "
            + (parentPath == null ? "among root accounts" : "under " + parentPath));
  }
}
