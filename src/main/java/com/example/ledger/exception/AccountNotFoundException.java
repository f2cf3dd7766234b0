package com.example.ledger.exception;

public class AccountNotFoundException extends LedgerNotFoundException {

  public AccountNotFoundException(String reference) {
    super("Account not found: " + reference);
  }
}
