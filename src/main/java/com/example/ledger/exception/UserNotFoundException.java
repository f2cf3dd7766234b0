package com.example.ledger.exception;

public class UserNotFoundException extends LedgerNotFoundException {

  public UserNotFoundException(String reference) {
    super("User not found: " + reference);
  }
}
