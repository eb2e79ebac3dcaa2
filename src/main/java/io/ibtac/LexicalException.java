package io.ibtac;

import io.ibtac.lexer.ErrorHandler;
import io.ibtac.lexer.Token;
import java.util.Optional;

/** Exception thrown when strict analysis finds a lexical error. */
public final class LexicalException extends Exception {
  /** The first error token of the scan. */
  private final Token token;

  /** The scanned source text. */
  private final String source;

  /** How many errors the scan found in total. */
  private final int errorCount;

  private LexicalException(Token token, String source, int errorCount) {
    super(token.errorDetail() + " at line " + token.line() + ", col " + token.column());
    this.token = token;
    this.source = source;
    this.errorCount = errorCount;
  }

  /**
   * Creates an exception for the given error token.
   *
   * @param token the error token to report
   * @param source the scanned source text, or null if unavailable
   * @param errorCount the total number of errors found by the scan
   * @return a new LexicalException
   * @throws IllegalArgumentException if the token is not an error token
   */
  public static LexicalException of(Token token, String source, int errorCount) {
    if (!token.isError()) {
      throw new IllegalArgumentException("not an error token: " + token);
    }
    return new LexicalException(token, source, errorCount);
  }

  /**
   * Returns the error token being reported.
   *
   * @return the token
   */
  public Token token() {
    return token;
  }

  /**
   * Returns the total number of errors found by the scan.
   *
   * @return the error count, at least 1
   */
  public int errorCount() {
    return errorCount;
  }

  /**
   * Returns the scanned source text, if available.
   *
   * @return the source, or empty if not available
   */
  public Optional<String> source() {
    return Optional.ofNullable(source);
  }

  /**
   * Returns a suggestion for fixing the error, if available.
   *
   * @return the suggestion, or empty if not available
   */
  public Optional<String> suggestion() {
    return ErrorHandler.suggestCorrection(token);
  }

  /**
   * Formats a rich error message with underline and optional suggestion.
   *
   * <p>With the source available, produces output like:
   *
   * <pre>
   * error: Invalid symbol: '@'
   *   071x = 4 @ 2
   *            ^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    String detail = "error: " + token.errorDetail();
    if (source == null) {
      return detail;
    }
    String[] lines = source.split("\n", -1);
    if (token.line() < 1 || token.line() > lines.length) {
      return detail;
    }
    String text = lines[token.line() - 1];
    if (text.endsWith("\r")) {
      text = text.substring(0, text.length() - 1);
    }
    int offset = Math.min(token.column() - 1, text.length());

    // Underline the lexeme, but never past the end of its first line
    int width = token.lexeme().indexOf('\n');
    if (width < 0) {
      width = token.lexeme().length();
    }
    width = Math.max(1, Math.min(width, text.length() - offset));

    StringBuilder sb = new StringBuilder();
    sb.append(detail).append("\n");
    sb.append("  ").append(text).append("\n");
    sb.append(" ".repeat(offset + 2));
    sb.append("^".repeat(width));

    suggestion().ifPresent(s -> sb.append(" try: \"").append(s).append("\""));
    return sb.toString();
  }
}
