package com.example.ledger.exception;

/** An account path is empty, has an empty segment, or a segment contains the separator. */
public class InvalidPathException extends LedgerValidationException {

  private final String path;

  public InvalidPathException(String path, String reason) {
    super("Invalid account path '" + path + "': " + reason);
    this.path = path;
  }

  public String getPath() {
    return path;
  }
}
