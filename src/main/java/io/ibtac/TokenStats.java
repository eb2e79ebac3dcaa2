package io.ibtac;

import io.ibtac.lexer.Token;
import io.ibtac.lexer.TokenKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts over the tokens of one scan.
 *
 * @param totalTokens all tokens except END_OF_INPUT
 * @param meaningfulTokens tokens other than whitespace, newlines and END_OF_INPUT
 * @param errorCount the error tokens
 * @param distribution token count per kind, most frequent first, trivia excluded
 */
public record TokenStats(
    int totalTokens, int meaningfulTokens, int errorCount, Map<TokenKind, Integer> distribution) {

  /**
   * Computes the statistics of a token list.
   *
   * @param tokens the tokens of a scan
   * @return the statistics
   */
  public static TokenStats of(List<Token> tokens) {
    int total = 0;
    int meaningful = 0;
    int errors = 0;
    Map<TokenKind, Integer> counts = new EnumMap<>(TokenKind.class);

    for (Token token : tokens) {
      if (token.kind() == TokenKind.END_OF_INPUT) {
        continue;
      }
      total++;
      if (token.isError()) {
        errors++;
      }
      if (token.isMeaningful()) {
        meaningful++;
        counts.merge(token.kind(), 1, Integer::sum);
      }
    }

    // EnumMap iterates in declaration order and List.sort is stable, so ties keep that order
    List<Map.Entry<TokenKind, Integer>> entries = new ArrayList<>(counts.entrySet());
    entries.sort(Map.Entry.<TokenKind, Integer>comparingByValue(Comparator.reverseOrder()));
    Map<TokenKind, Integer> distribution = new LinkedHashMap<>();
    for (Map.Entry<TokenKind, Integer> e : entries) {
      distribution.put(e.getKey(), e.getValue());
    }

    return new TokenStats(total, meaningful, errors, Collections.unmodifiableMap(distribution));
  }

  /**
   * Returns how many tokens of the given kind were found.
   *
   * @param kind the token kind
   * @return the count, 0 for trivia kinds
   */
  public int count(TokenKind kind) {
    return distribution.getOrDefault(kind, 0);
  }
}
