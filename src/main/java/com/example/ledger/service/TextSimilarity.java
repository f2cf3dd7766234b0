package com.example.ledger.service;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Trigram similarity of two descriptions, computed the way PostgreSQL's pg_trgm does: the text is
 * lower-cased and split into words of letters and digits, each word is padded with two spaces in
 * front and one behind, and the result is the number of shared trigrams divided by the number of
 * distinct trigrams in either text.
 */
public final class TextSimilarity {

  private TextSimilarity() {}

  /** Similarity in [0, 1]; 0 when either text has no words. */
  public static double similarity(String a, String b) {
    Set<String> left = trigrams(a);
    Set<String> right = trigrams(b);
    if (left.isEmpty() || right.isEmpty()) {
      return 0.0;
    }
    Set<String> shared = new HashSet<>(left);
    shared.retainAll(right);
    int union = left.size() + right.size() - shared.size();
    return (double) shared.size() / union;
  }

  static Set<String> trigrams(String text) {
    Set<String> result = new HashSet<>();
    if (text == null) {
      return result;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    StringBuilder word = new StringBuilder();
    for (int i = 0; i <= lower.length(); i++) {
      char c = i < lower.length() ? lower.charAt(i) : ' ';
      if (Character.isLetterOrDigit(c)) {
        word.append(c);
      } else if (word.length() > 0) {
        addWordTrigrams("  " + word + " ", result);
        word.setLength(0);
      }
    }
    return result;
  }

  private static void addWordTrigrams(String padded, Set<String> out) {
    for (int i = 0; i + 3 <= padded.length(); i++) {
      out.add(padded.substring(i, i + 3));
    }
  }
}
