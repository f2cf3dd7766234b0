package com.example.ledger.exception;

public class TransactionNotFoundException extends LedgerNotFoundException {

  public TransactionNotFoundException(Long transactionId) {
    super("Transaction not found: " + transactionId);
  }
}
