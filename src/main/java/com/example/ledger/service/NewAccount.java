package com.example.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountSubtype;
import com.example.ledger.domain.Account.AccountType;

/** Input for explicitly creating one account. Optional fields are left null. */
public class NewAccount {

  private final String name;
  private final AccountType type;
  private final AccountSubtype subtype;
  private Account parent;
  private String currency;
  private String notes;

  // Investment fields
  private String symbol;
  private BigDecimal quantity;
  private BigDecimal averageCost;

  // Real estate fields
  private String address;
  private LocalDate purchaseDate;
  private BigDecimal purchasePrice;

  public NewAccount(String name, AccountType type, AccountSubtype subtype) {
    this.name = name;
    this.type = type;
    this.subtype = subtype;
  }

  public NewAccount parent(Account parent) {
    this.parent = parent;
    return this;
  }

  public NewAccount currency(String currency) {
    this.currency = currency;
    return this;
  }

  public NewAccount notes(String notes) {
    this.notes = notes;
    return this;
  }

  public NewAccount investment(String symbol, BigDecimal quantity, BigDecimal averageCost) {
    this.symbol = symbol;
    this.quantity = quantity;
    this.averageCost = averageCost;
    return this;
  }

  public NewAccount realEstate(String address, LocalDate purchaseDate, BigDecimal purchasePrice) {
    this.address = address;
    this.purchaseDate = purchaseDate;
    this.purchasePrice = purchasePrice;
    return this;
  }

  public String getName() {
    return name;
  }

  public AccountType getType() {
    return type;
  }

  public AccountSubtype getSubtype() {
    return subtype;
  }

  public Account getParent() {
    return parent;
  }

  public String getCurrency() {
    return currency;
  }

  public String getNotes() {
    return notes;
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
