package com.example.ledger.exception;

import java.math.BigDecimal;

/** Ownership percentages must lie in (0, 1]. */
public class InvalidPercentageException extends LedgerValidationException {

  public InvalidPercentageException(BigDecimal percentage) {
    super("Ownership percentage must be greater than 0 and at most 1, got " + percentage);
  }
}
