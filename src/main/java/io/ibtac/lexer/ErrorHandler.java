package io.ibtac.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the lexical errors of one scan.
 *
 * <p>Every factory method builds an error token, appends it to the log and returns it, so the
 * scanner can hand the same token back as the current token and keep going. Nothing here throws.
 */
public final class ErrorHandler {
  private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

  private static final String PREFIX_RULE = "must start with '071', '070', or '048'";

  private final List<Token> errors = new ArrayList<>();
  private int errorCount;

  /**
   * Records a string literal that hit a newline or the end of input before its closing "$".
   *
   * @param line the line of the opening "$"
   * @param column the column of the opening "$"
   * @param partial the text captured so far, opening "$" included
   * @return the recorded error token
   */
  public Token unterminatedString(int line, int column, String partial) {
    return report(
        TokenKind.UNTERMINATED_STRING,
        "Unterminated string literal: '" + partial + "'",
        line,
        column,
        partial);
  }

  /**
   * Records a malformed numeral.
   *
   * @param line the line of the first character
   * @param column the column of the first character
   * @param numeral the numeral text
   * @return the recorded error token
   */
  public Token invalidNumber(int line, int column, String numeral) {
    return report(
        TokenKind.INVALID_NUMBER,
        "Invalid number format: '" + numeral + "'",
        line,
        column,
        numeral);
  }

  /**
   * Records a character that no token rule accepts.
   *
   * @param line the line of the character
   * @param column the column of the character
   * @param symbol the offending character
   * @return the recorded error token
   */
  public Token invalidSymbol(int line, int column, String symbol) {
    return report(
        TokenKind.INVALID_SYMBOL, "Invalid symbol: '" + symbol + "'", line, column, symbol);
  }

  /**
   * Records a word that is neither a keyword nor prefixed like an identifier.
   *
   * @param line the line of the first character
   * @param column the column of the first character
   * @param identifier the word
   * @return the recorded error token
   */
  public Token invalidIdentifier(int line, int column, String identifier) {
    return report(
        TokenKind.GENERIC_ERROR,
        "Invalid identifier: '" + identifier + "' (" + PREFIX_RULE + ")",
        line,
        column,
        identifier);
  }

  /**
   * Records an identifier-shaped word that begins with an underscore.
   *
   * @param line the line of the underscore
   * @param column the column of the underscore
   * @param identifier the word, underscore included
   * @return the recorded error token
   */
  public Token leadingUnderscore(int line, int column, String identifier) {
    return report(
        TokenKind.GENERIC_ERROR,
        "Invalid identifier: '" + identifier + "' (cannot start with '_'; " + PREFIX_RULE + ")",
        line,
        column,
        identifier);
  }

  /** Records a "/*" found inside an open block comment. */
  public Token nestedComment(int line, int column) {
    return report(
        TokenKind.GENERIC_ERROR,
        "Nested multi-line comments are not supported",
        line,
        column,
        "/*");
  }

  /** Records a block comment still open at the end of input. */
  public Token unterminatedComment(int line, int column) {
    return report(TokenKind.GENERIC_ERROR, "Unterminated multi-line comment", line, column, "/*");
  }

  private Token report(TokenKind kind, String message, int line, int column, String lexeme) {
    Token token = Token.error(kind, lexeme, line, column, message);
    errors.add(token);
    errorCount++;
    log.debug("Lexical error #{}: {}", errorCount, token);
    return token;
  }

  public boolean hasErrors() {
    return errorCount > 0;
  }

  public int errorCount() {
    return errorCount;
  }

  /**
   * Returns the recorded errors in the order they were found.
   *
   * @return an unmodifiable view of the error log
   */
  public List<Token> errors() {
    return Collections.unmodifiableList(errors);
  }

  /**
   * Renders a numbered list of all recorded errors.
   *
   * @return "No lexical errors found." or a header line followed by one line per error
   */
  public String summary() {
    if (errorCount == 0) {
      return "No lexical errors found.";
    }
    StringBuilder sb = new StringBuilder();
    sb.append("Found ").append(errorCount).append(" lexical error(s):\n");
    for (int i = 0; i < errors.size(); i++) {
      sb.append(i + 1).append(". ").append(errors.get(i)).append("\n");
    }
    return sb.toString();
  }

  /** Empties the log and resets the count. */
  public void clear() {
    log.trace("Clearing {} recorded error(s)", errorCount);
    errors.clear();
    errorCount = 0;
  }

  /**
   * Suggests how to fix a common error.
   *
   * @param error the error token
   * @return a suggestion, or empty if there is none for this kind of error
   */
  public static Optional<String> suggestCorrection(Token error) {
    return switch (error.kind()) {
      case GENERIC_ERROR ->
          error.detail().filter(d -> d.contains(PREFIX_RULE)).isPresent()
              ? Optional.of("Try starting the identifier with '071', '070', or '048'.")
              : Optional.empty();
      case UNTERMINATED_STRING ->
          Optional.of("Add closing '$' to complete string: '" + error.lexeme() + "$'");
      case INVALID_NUMBER ->
          Optional.of("Check number format - use digits, decimal point, or exponential notation");
      default -> Optional.empty();
    };
  }
}
