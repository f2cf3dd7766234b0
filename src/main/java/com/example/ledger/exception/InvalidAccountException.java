package com.example.ledger.exception;

import java.util.List;

/**
 * Account data failed field validation. Carries every problem found, not just the first.
 */
public class InvalidAccountException extends LedgerValidationException {

  private final List<String> problems;

  public InvalidAccountException(List<String> problems) {
    super("Invalid account: " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> getProblems() {
    return problems;
  }
}
