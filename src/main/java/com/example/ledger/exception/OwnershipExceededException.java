package com.example.ledger.exception;

import java.math.BigDecimal;

/** Setting a share would allocate more than 100% of an account. */
public class OwnershipExceededException extends LedgerInvariantException {

  private final BigDecimal attemptedTotal;

  public OwnershipExceededException(String accountPath, BigDecimal attemptedTotal) {
    super(
        "Total ownership of "
            + accountPath
            + " cannot exceed 100%, would be "
            + attemptedTotal.toPlainString());
    this.attemptedTotal = attemptedTotal;
  }

  public BigDecimal getAttemptedTotal() {
    return attemptedTotal;
  }
}
