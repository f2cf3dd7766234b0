package com.example.ledger.exception;

import java.math.BigDecimal;

/** The signed entry amounts of a transaction do not sum to exactly zero. */
public class UnbalancedTransactionException extends LedgerInvariantException {

  private final BigDecimal actualSum;

  public UnbalancedTransactionException(BigDecimal actualSum) {
    super("Transaction does not balance: entries must sum to zero, got " + actualSum.toPlainString());
    this.actualSum = actualSum;
  }

  public BigDecimal getActualSum() {
    return actualSum;
  }
}
