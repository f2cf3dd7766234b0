package com.example.ledger.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the ledger core, bound from {@code ledger.*}. The duplicate-detection numbers are
 * heuristics carried over as defaults; none of them is a hard rule.
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

  private final Accounts accounts = new Accounts();
  private final Ownership ownership = new Ownership();
  private final Duplicates duplicates = new Duplicates();

  public Accounts getAccounts() {
    return accounts;
  }

  public Ownership getOwnership() {
    return ownership;
  }

  public Duplicates getDuplicates() {
    return duplicates;
  }

  public static class Accounts {

    private String defaultCurrency = "EUR";
    private int maxNameLength = 100;
    private int maxDepth = 10;

    public String getDefaultCurrency() {
      return defaultCurrency;
    }

    public void setDefaultCurrency(String defaultCurrency) {
      this.defaultCurrency = defaultCurrency;
    }

    public int getMaxNameLength() {
      return maxNameLength;
    }

    public void setMaxNameLength(int maxNameLength) {
      this.maxNameLength = maxNameLength;
    }

    public int getMaxDepth() {
      return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
      this.maxDepth = maxDepth;
    }
  }

  public static class Ownership {

    /** Who receives 100% of a newly created account. */
    public enum DefaultOwnerPolicy {
      FIRST_USER,
      CREATOR,
      NONE
    }

    /** Rounding slack allowed above 100% when summing shares. */
    private BigDecimal epsilon = new BigDecimal("0.0001");

    private DefaultOwnerPolicy defaultOwnerPolicy = DefaultOwnerPolicy.FIRST_USER;

    public BigDecimal getEpsilon() {
      return epsilon;
    }

    public void setEpsilon(BigDecimal epsilon) {
      this.epsilon = epsilon;
    }

    public DefaultOwnerPolicy getDefaultOwnerPolicy() {
      return defaultOwnerPolicy;
    }

    public void setDefaultOwnerPolicy(DefaultOwnerPolicy defaultOwnerPolicy) {
      this.defaultOwnerPolicy = defaultOwnerPolicy;
    }
  }

  public static class Duplicates {

    private BigDecimal amountTolerance = new BigDecimal("0.01");
    private int dateToleranceDays = 3;

    /** Amount difference below which two transactions count as the same amount. */
    private BigDecimal exactAmountThreshold = new BigDecimal("0.01");

    private double exactSimilarity = 0.8;
    private double probableSimilarity = 0.6;

    private BigDecimal exactConfidence = new BigDecimal("0.95");
    private BigDecimal probableConfidence = new BigDecimal("0.80");
    private BigDecimal possibleConfidence = new BigDecimal("0.60");
    private BigDecimal fallbackConfidence = new BigDecimal("0.30");

    /** Batch detection only records candidates at or above this score. */
    private BigDecimal minimumRecordedConfidence = new BigDecimal("0.60");

    private boolean autoConfirmExact = false;

    public BigDecimal getAmountTolerance() {
      return amountTolerance;
    }

    public void setAmountTolerance(BigDecimal amountTolerance) {
      this.amountTolerance = amountTolerance;
    }

    public int getDateToleranceDays() {
      return dateToleranceDays;
    }

    public void setDateToleranceDays(int dateToleranceDays) {
      this.dateToleranceDays = dateToleranceDays;
    }

    public BigDecimal getExactAmountThreshold() {
      return exactAmountThreshold;
    }

    public void setExactAmountThreshold(BigDecimal exactAmountThreshold) {
      this.exactAmountThreshold = exactAmountThreshold;
    }

    public double getExactSimilarity() {
      return exactSimilarity;
    }

    public void setExactSimilarity(double exactSimilarity) {
      this.exactSimilarity = exactSimilarity;
    }

    public double getProbableSimilarity() {
      return probableSimilarity;
    }

    public void setProbableSimilarity(double probableSimilarity) {
      this.probableSimilarity = probableSimilarity;
    }

    public BigDecimal getExactConfidence() {
      return exactConfidence;
    }

    public void setExactConfidence(BigDecimal exactConfidence) {
      this.exactConfidence = exactConfidence;
    }

    public BigDecimal getProbableConfidence() {
      return probableConfidence;
    }

    public void setProbableConfidence(BigDecimal probableConfidence) {
      this.probableConfidence = probableConfidence;
    }

    public BigDecimal getPossibleConfidence() {
      return possibleConfidence;
    }

    public void setPossibleConfidence(BigDecimal possibleConfidence) {
      this.possibleConfidence = possibleConfidence;
    }

    public BigDecimal getFallbackConfidence() {
      return fallbackConfidence;
    }

    public void setFallbackConfidence(BigDecimal fallbackConfidence) {
      this.fallbackConfidence = fallbackConfidence;
    }

    public BigDecimal getMinimumRecordedConfidence() {
      return minimumRecordedConfidence;
    }

    public void setMinimumRecordedConfidence(BigDecimal minimumRecordedConfidence) {
      this.minimumRecordedConfidence = minimumRecordedConfidence;
    }

    public boolean isAutoConfirmExact() {
      return autoConfirmExact;
    }

    public void setAutoConfirmExact(boolean autoConfirmExact) {
      this.autoConfirmExact = autoConfirmExact;
    }
  }
}
