package com.example.ledger.exception;

public class InvalidAmountException extends LedgerValidationException {

  public InvalidAmountException(String message) {
    super(message);
  }
}
