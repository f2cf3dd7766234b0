package com.example.ledger.exception;

public class MatchNotFoundException extends LedgerNotFoundException {

  public MatchNotFoundException(Long matchId) {
    super("Transaction match not found: " + matchId);
  }
}
