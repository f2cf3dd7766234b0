package com.example.ledger.exception;

public class SelfMergeException extends LedgerInvariantException {

  public SelfMergeException(Long transactionId) {
    super("Transaction " + transactionId + " cannot be matched or merged with itself");
  }
}
