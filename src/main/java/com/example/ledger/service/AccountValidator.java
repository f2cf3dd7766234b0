package com.example.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.example.ledger.config.LedgerProperties;
import com.example.ledger.domain.Account;
import com.example.ledger.domain.Account.AccountSubtype;
import com.example.ledger.domain.Account.AccountType;
import com.example.ledger.exception.InvalidAccountException;

/**
 * Field-level checks for account creation and updates. Collects every problem before failing so
 * the caller can report them together.
 */
@Component
public class AccountValidator {

  private static final String NAME_PUNCTUATION = " -_.,()";

  private static final Set<String> SUPPORTED_CURRENCIES =
      Set.of(
          "USD", "EUR", "GBP", "JPY", "CHF", "CAD", "AUD", "NZD", "SEK", "NOK", "DKK", "PLN",
          "CZK", "HUF", "BGN", "RON", "HRK", "RUB", "CNY", "INR", "KRW", "SGD", "HKD", "THB",
          "MXN", "BRL", "ZAR", "TRY", "ILS", "AED", "SAR", "QAR");

  private final LedgerProperties properties;

  public AccountValidator(LedgerProperties properties) {
    this.properties = properties;
  }

  /**
   * Validates a new account against its intended parent. Sibling-name uniqueness is checked by the
   * caller against the store.
   *
   * @throws InvalidAccountException listing every problem found
   */
  public void validateNew(NewAccount account, String currency) {
    List<String> problems = new ArrayList<>();
    checkName(account.getName(), problems);
    checkCurrency(currency, problems);
    checkTypeAndSubtype(account.getType(), account.getSubtype(), problems);
    checkInvestmentFields(
        account.getSubtype(),
        account.getSymbol(),
        account.getQuantity(),
        account.getAverageCost(),
        problems);
    checkRealEstateFields(
        account.getSubtype(),
        account.getAddress(),
        account.getPurchaseDate(),
        account.getPurchasePrice(),
        problems);
    if (account.getParent() != null) {
      checkParent(account.getParent(), account.getType(), problems);
    }
    throwIfAny(problems);
  }

  /** Re-validates the descriptive fields of an account after an update has been applied. */
  public void validateDetails(Account account) {
    List<String> problems = new ArrayList<>();
    checkCurrency(account.getCurrency(), problems);
    checkInvestmentFields(
        account.getSubtype(),
        account.getSymbol(),
        account.getQuantity(),
        account.getAverageCost(),
        problems);
    checkRealEstateFields(
        account.getSubtype(),
        account.getAddress(),
        account.getPurchaseDate(),
        account.getPurchasePrice(),
        problems);
    throwIfAny(problems);
  }

  /** Checks a new name and, when given, a new parent for an account being moved or renamed. */
  public void validatePlacement(String name, AccountType type, Account newParent) {
    List<String> problems = new ArrayList<>();
    checkName(name, problems);
    if (newParent != null) {
      checkParent(newParent, type, problems);
    }
    throwIfAny(problems);
  }

  /** Segments created implicitly from a path are only checked for length. */
  public void validatePathSegment(String segment) {
    List<String> problems = new ArrayList<>();
    if (segment.length() > properties.getAccounts().getMaxNameLength()) {
      problems.add(
          "name '"
              + segment
              + "' is longer than "
              + properties.getAccounts().getMaxNameLength()
              + " characters");
    }
    throwIfAny(problems);
  }

  public boolean isSupportedCurrency(String currency) {
    return currency != null && SUPPORTED_CURRENCIES.contains(currency);
  }

  private void checkName(String name, List<String> problems) {
    if (name == null || name.isBlank()) {
      problems.add("name must not be empty");
      return;
    }
    int max = properties.getAccounts().getMaxNameLength();
    if (name.length() > max) {
      problems.add("name is longer than " + max + " characters");
    }
    if (name.indexOf(Account.PATH_SEPARATOR) >= 0) {
      problems.add("name must not contain '" + Account.PATH_SEPARATOR + "'");
    }
    boolean allowed =
        name.chars().allMatch(c -> Character.isLetterOrDigit(c) || NAME_PUNCTUATION.indexOf(c) >= 0);
    if (!allowed) {
      problems.add(
          "name '" + name + "' may only contain letters, digits, spaces and " + NAME_PUNCTUATION.trim());
    }
  }

  private void checkCurrency(String currency, List<String> problems) {
    if (!isSupportedCurrency(currency)) {
      problems.add("unsupported currency: " + currency);
    }
  }

  private static void checkTypeAndSubtype(
      AccountType type, AccountSubtype subtype, List<String> problems) {
    if (type == null || subtype == null) {
      problems.add("type and subtype are required");
      return;
    }
    if (!subtype.isValidFor(type)) {
      problems.add("subtype " + subtype + " is not valid for type " + type);
    }
  }

  private static void checkInvestmentFields(
      AccountSubtype subtype,
      String symbol,
      BigDecimal quantity,
      BigDecimal averageCost,
      List<String> problems) {
    boolean anyPresent = symbol != null || quantity != null || averageCost != null;
    if (subtype == null || !subtype.isInvestment()) {
      if (anyPresent) {
        problems.add("investment fields are only allowed on investment accounts");
      }
      return;
    }
    if (symbol != null) {
      if (symbol.isEmpty() || symbol.length() > 10 || !symbol.matches("[A-Z0-9.]+")) {
        problems.add("invalid symbol '" + symbol + "'");
      }
      if (quantity == null) {
        problems.add("a symbol requires a quantity");
      }
    }
    if (quantity != null && quantity.signum() <= 0) {
      problems.add("quantity must be positive, got " + quantity.toPlainString());
    }
    if (averageCost != null && averageCost.signum() <= 0) {
      problems.add("average cost must be positive, got " + averageCost.toPlainString());
    }
  }

  private static void checkRealEstateFields(
      AccountSubtype subtype,
      String address,
      LocalDate purchaseDate,
      BigDecimal purchasePrice,
      List<String> problems) {
    if (subtype != AccountSubtype.REAL_ESTATE) {
      if (address != null || purchaseDate != null || purchasePrice != null) {
        problems.add("real estate fields are only allowed on real estate accounts");
      }
      return;
    }
    if (address != null && address.isBlank()) {
      problems.add("address must not be blank");
    }
    if (purchasePrice != null && purchasePrice.signum() <= 0) {
      problems.add("purchase price must be positive, got " + purchasePrice.toPlainString());
    }
  }

  private void checkParent(Account parent, AccountType childType, List<String> problems) {
    if (!parent.isActive()) {
      problems.add("parent " + parent.getFullPath() + " is inactive");
    }
    if (childType != null && parent.getType() != childType) {
      problems.add(
          "parent " + parent.getFullPath() + " is " + parent.getType() + ", not " + childType);
    }
    int maxDepth = properties.getAccounts().getMaxDepth();
    if (parent.depth() + 1 > maxDepth) {
      problems.add("hierarchy deeper than " + maxDepth + " levels");
    }
  }

  private static void throwIfAny(List<String> problems) {
    if (!problems.isEmpty()) {
      throw new InvalidAccountException(problems);
    }
  }
}
