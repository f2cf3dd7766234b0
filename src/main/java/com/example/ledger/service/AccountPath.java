package com.example.ledger.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.example.ledger.domain.Account;
import com.example.ledger.exception.InvalidPathException;

/**
 * A parsed colon-delimited account path such as {@code Expenses:Food:Groceries}. Segments are
 * trimmed; an empty path or an empty segment is rejected.
 */
public final class AccountPath {

  private final List<String> segments;

  private AccountPath(List<String> segments) {
    this.segments = Collections.unmodifiableList(segments);
  }

  /**
   * Parses a path.
   *
   * @throws InvalidPathException if the path is null, blank or has an empty segment
   */
  public static AccountPath parse(String path) {
    if (path == null || path.isBlank()) {
      throw new InvalidPathException(String.valueOf(path), "path is empty");
    }
    List<String> segments = new ArrayList<>();
    for (String raw : path.split(String.valueOf(Account.PATH_SEPARATOR), -1)) {
      String segment = raw.trim();
      if (segment.isEmpty()) {
        throw new InvalidPathException(path, "empty segment");
      }
      segments.add(segment);
    }
    return new AccountPath(segments);
  }

  public static AccountPath of(List<String> segments) {
    return parse(String.join(String.valueOf(Account.PATH_SEPARATOR), segments));
  }

  public List<String> segments() {
    return segments;
  }

  public int depth() {
    return segments.size();
  }

  public String leaf() {
    return segments.get(segments.size() - 1);
  }

  /** Path of the first {@code length} segments. */
  public String prefix(int length) {
    return String.join(String.valueOf(Account.PATH_SEPARATOR), segments.subList(0, length));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AccountPath)) return false;
    return segments.equals(((AccountPath) o).segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    return prefix(segments.size());
  }
}
