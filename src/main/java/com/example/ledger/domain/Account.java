package com.example.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A node in the chart of accounts. Accounts form a forest through the optional parent reference;
 * the colon-delimited {@code fullPath} is a cached value derived from the names along the parent
 * chain and is recomputed by {@link com.example.ledger.service.AccountService} whenever a name or
 * parent changes.
 *
 * <p>Accounts are never hard-deleted while referenced by journal entries; {@link #isActive()} is
 * the soft-delete flag.
 */
@Entity
@Table(
    name = "account",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uq_account_parent_name",
          columnNames = {"parent_id", "name"})
    },
    indexes = {
      @Index(name = "idx_account_full_path", columnList = "full_path"),
      @Index(name = "idx_account_parent", columnList = "parent_id"),
      @Index(name = "idx_account_type", columnList = "account_type")
    })
public class Account {

  public static final char PATH_SEPARATOR = ':';

  public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    INCOME,
    EXPENSE;

    /** Asset and expense balances grow with debits, the others with credits. */
    public boolean increasesWithDebit() {
      return this == ASSET || this == EXPENSE;
    }
  }

  /** Refines {@link AccountType}. CATEGORY is the grouping subtype valid under every type. */
  public enum AccountSubtype {
    // Asset
    CASH(AccountType.ASSET),
    CHECKING(AccountType.ASSET),
    SAVINGS(AccountType.ASSET),
    INVESTMENT_ACCOUNT(AccountType.ASSET),
    STOCKS(AccountType.ASSET),
    ETF(AccountType.ASSET),
    BONDS(AccountType.ASSET),
    MUTUAL_FUND(AccountType.ASSET),
    CRYPTO(AccountType.ASSET),
    REAL_ESTATE(AccountType.ASSET),
    EQUIPMENT(AccountType.ASSET),
    OTHER_ASSET(AccountType.ASSET),
    // Liability
    CREDIT_CARD(AccountType.LIABILITY),
    LOAN(AccountType.LIABILITY),
    MORTGAGE(AccountType.LIABILITY),
    OTHER_LIABILITY(AccountType.LIABILITY),
    // Equity
    OPENING_BALANCE(AccountType.EQUITY),
    RETAINED_EARNINGS(AccountType.EQUITY),
    OWNER_EQUITY(AccountType.EQUITY),
    // Income
    SALARY(AccountType.INCOME),
    BONUS(AccountType.INCOME),
    DIVIDEND(AccountType.INCOME),
    INTEREST(AccountType.INCOME),
    INVESTMENT(AccountType.INCOME),
    RENTAL(AccountType.INCOME),
    CAPITAL_GAINS(AccountType.INCOME),
    OTHER_INCOME(AccountType.INCOME),
    // Expense
    FOOD(AccountType.EXPENSE),
    HOUSING(AccountType.EXPENSE),
    TRANSPORTATION(AccountType.EXPENSE),
    COMMUNICATION(AccountType.EXPENSE),
    ENTERTAINMENT(AccountType.EXPENSE),
    PERSONAL(AccountType.EXPENSE),
    UTILITIES(AccountType.EXPENSE),
    HEALTHCARE(AccountType.EXPENSE),
    TAXES(AccountType.EXPENSE),
    FEES(AccountType.EXPENSE),
    OTHER_EXPENSE(AccountType.EXPENSE),
    // Any type
    CATEGORY(null);

    private static final Set<AccountSubtype> INVESTMENT_SUBTYPES =
        EnumSet.of(INVESTMENT_ACCOUNT, STOCKS, ETF, BONDS, MUTUAL_FUND, CRYPTO);

    private final AccountType type;

    AccountSubtype(AccountType type) {
      this.type = type;
    }

    public boolean isValidFor(AccountType accountType) {
      return type == null || type == accountType;
    }

    public boolean isInvestment() {
      return INVESTMENT_SUBTYPES.contains(this);
    }
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Size(max = 100)
  @Column(nullable = false, length = 100)
  private String name;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "account_type", nullable = false, length = 20)
  private AccountType type;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "account_subtype", nullable = false, length = 30)
  private AccountSubtype subtype;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "parent_id")
  private Account parent;

  @Size(max = 1000)
  @Column(name = "full_path", length = 1000)
  private String fullPath;

  // Investment fields
  @Size(max = 10)
  @Column(length = 10)
  private String symbol;

  @Column(precision = 19, scale = 8)
  private BigDecimal quantity;

  @Column(name = "average_cost", precision = 19, scale = 4)
  private BigDecimal averageCost;

  // Real estate fields
  @Size(max = 500)
  @Column(length = 500)
  private String address;

  @Column(name = "purchase_date")
  private LocalDate purchaseDate;

  @Column(name = "purchase_price", precision = 19, scale = 4)
  private BigDecimal purchasePrice;

  @NotNull
  @Size(min = 3, max = 3)
  @Column(nullable = false, length = 3)
  private String currency = "EUR";

  @Column(name = "is_active", nullable = false)
  private boolean active = true;

  @Column(columnDefinition = "TEXT")
  private String notes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at")
  private Instant updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = Instant.now();
  }

  // Constructors
  public Account() {}

  public Account(String name, AccountType type, AccountSubtype subtype) {
    this.name = name;
    this.type = type;
    this.subtype = subtype;
  }

  public Account(String name, AccountType type, AccountSubtype subtype, Account parent) {
    this(name, type, subtype);
    this.parent = parent;
  }

  /** Path of this account as derived from its parent's cached path and its own name. */
  public String derivePath() {
    if (parent == null) {
      return name;
    }
    String parentPath = parent.getFullPath() != null ? parent.getFullPath() : parent.derivePath();
    return parentPath + PATH_SEPARATOR + name;
  }

  public boolean isRoot() {
    return parent == null;
  }

  public int depth() {
    int depth = 1;
    Account current = parent;
    while (current != null) {
      depth++;
      current = current.getParent();
    }
    return depth;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public AccountType getType() {
    return type;
  }

  public void setType(AccountType type) {
    this.type = type;
  }

  public AccountSubtype getSubtype() {
    return subtype;
  }

  public void setSubtype(AccountSubtype subtype) {
    this.subtype = subtype;
  }

  public Account getParent() {
    return parent;
  }

  public void setParent(Account parent) {
    this.parent = parent;
  }

  public String getFullPath() {
    return fullPath;
  }

  public void setFullPath(String fullPath) {
    this.fullPath = fullPath;
  }

  public String getSymbol() {
    return symbol;
  }

  public void setSymbol(String symbol) {
    this.symbol = symbol;
  }

  public BigDecimal getQuantity() {
    return quantity;
  }

  public void setQuantity(BigDecimal quantity) {
    this.quantity = quantity;
  }

  public BigDecimal getAverageCost() {
    return averageCost;
  }

  public void setAverageCost(BigDecimal averageCost) {
    this.averageCost = averageCost;
  }

  public String getAddress() {
    return address;
  }

  public void setAddress(String address) {
    this.address = address;
  }

  public LocalDate getPurchaseDate() {
    return purchaseDate;
  }

  public void setPurchaseDate(LocalDate purchaseDate) {
    this.purchaseDate = purchaseDate;
  }

  public BigDecimal getPurchasePrice() {
    return purchasePrice;
  }

  public void setPurchasePrice(BigDecimal purchasePrice) {
    this.purchasePrice = purchasePrice;
  }

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Account)) return false;
    Account other = (Account) o;
    return id != null && id.equals(other.getId());
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }

  @Override
  public String toString() {
    return fullPath != null ? fullPath : name;
  }
}
