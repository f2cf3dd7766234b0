package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.ledger.exception.InvalidPathException;

class AccountPathTest {

  @Test
  void parse_trimsSegments() {
    AccountPath path = AccountPath.parse(" Expenses : Food:Groceries ");

    assertEquals(List.of("Expenses", "Food", "Groceries"), path.segments());
    assertEquals(3, path.depth());
    assertEquals("Groceries", path.leaf());
    assertEquals("Expenses:Food", path.prefix(2));
    assertEquals("Expenses:Food:Groceries", path.toString());
  }

  @Test
  void parse_withEmptySegment_throws() {
    assertThrows(InvalidPathException.class, () -> AccountPath.parse("Assets::Checking"));
    assertThrows(InvalidPathException.class, () -> AccountPath.parse("Assets:"));
    assertThrows(InvalidPathException.class, () -> AccountPath.parse(":Assets"));
    assertThrows(InvalidPathException.class, () -> AccountPath.parse("Assets: :Checking"));
  }

  @Test
  void parse_withNullOrBlank_throws() {
    assertThrows(InvalidPathException.class, () -> AccountPath.parse(null));
    assertThrows(InvalidPathException.class, () -> AccountPath.parse("   "));
  }

  @Test
  void of_joinsSegmentsIntoEqualPath() {
    assertEquals(AccountPath.parse("Assets:Bank"), AccountPath.of(List.of("Assets", "Bank")));
  }
}
