package com.example.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update of an account's descriptive fields. Null means "leave unchanged". Name and parent
 * are changed through {@link AccountService#moveOrRename} because they affect paths.
 */
public class AccountUpdates {

  private String notes;
  private String currency;
  private String symbol;
  private BigDecimal quantity;
  private BigDecimal averageCost;
  private String address;
  private LocalDate purchaseDate;
  private BigDecimal purchasePrice;

  public boolean hasUpdates() {
    return notes != null
        || currency != null
        || symbol != null
        || quantity != null
        || averageCost != null
        || address != null
        || purchaseDate != null
        || purchasePrice != null;
  }

  public AccountUpdates notes(String notes) {
    this.notes = notes;
    return this;
  }

  public AccountUpdates currency(String currency) {
    this.currency = currency;
    return this;
  }

  public AccountUpdates symbol(String symbol) {
    this.symbol = symbol;
    return this;
  }

  public AccountUpdates quantity(BigDecimal quantity) {
    this.quantity = quantity;
    return this;
  }

  public AccountUpdates averageCost(BigDecimal averageCost) {
    this.averageCost = averageCost;
    return this;
  }

  public AccountUpdates address(String address) {
    this.address = address;
    return this;
  }

  public AccountUpdates purchaseDate(LocalDate purchaseDate) {
    this.purchaseDate = purchaseDate;
    return this;
  }

  public AccountUpdates purchasePrice(BigDecimal purchasePrice) {
    this.purchasePrice = purchasePrice;
    return this;
  }

  public String getNotes() {
    return notes;
  }

  public String getCurrency() {
    return currency;
  }

  public String getSymbol() {
    return symbol;
  }

  public BigDecimal getQuantity() {
    return quantity;
  }

  public BigDecimal getAverageCost() {
    return averageCost;
  }

  public String getAddress() {
    return address;
  }

  public LocalDate getPurchaseDate() {
    return purchaseDate;
  }

  public BigDecimal getPurchasePrice() {
    return purchasePrice;
  }
}
