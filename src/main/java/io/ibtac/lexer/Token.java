package io.ibtac.lexer;

import java.util.Objects;
import java.util.Optional;

/**
 * Represents a scanned token.
 *
 * @param kind the type of token
 * @param lexeme the exact source text of the token
 * @param line the 1-based line of the first character
 * @param column the 1-based column of the first character
 * @param errorDetail the diagnostic message (for error kinds only, otherwise null)
 */
public record Token(TokenKind kind, String lexeme, int line, int column, String errorDetail) {

  public Token {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(lexeme, "lexeme");
    if (kind.isError() && (errorDetail == null || errorDetail.isEmpty())) {
      throw new IllegalArgumentException("error token " + kind + " requires a detail message");
    }
    if (!kind.isError() && errorDetail != null) {
      throw new IllegalArgumentException("token " + kind + " cannot carry a detail message");
    }
  }

  /** Creates a well-formed token. */
  public static Token of(TokenKind kind, String lexeme, int line, int column) {
    return new Token(kind, lexeme, line, column, null);
  }

  /** Creates an error token. */
  public static Token error(TokenKind kind, String lexeme, int line, int column, String detail) {
    return new Token(kind, lexeme, line, column, detail);
  }

  /** Creates the end-of-input token. */
  public static Token endOfInput(int line, int column) {
    return new Token(TokenKind.END_OF_INPUT, "", line, column, null);
  }

  /**
   * Returns a copy of this token moved to the given position.
   *
   * @param line the new line
   * @param column the new column
   * @return the repositioned token
   */
  public Token withPosition(int line, int column) {
    if (line == this.line && column == this.column) {
      return this;
    }
    return new Token(kind, lexeme, line, column, errorDetail);
  }

  /**
   * Returns whether this token reports a lexical error.
   *
   * @return true if the kind is an error kind
   */
  public boolean isError() {
    return kind.isError();
  }

  /**
   * Returns whether this token is neither whitespace, a newline nor the end of input.
   *
   * @return true for tokens a consumer would display
   */
  public boolean isMeaningful() {
    return !kind.isTrivia();
  }

  /**
   * Returns the diagnostic message, if this is an error token.
   *
   * @return the detail, or empty for well-formed tokens
   */
  public Optional<String> detail() {
    return Optional.ofNullable(errorDetail);
  }

  @Override
  public String toString() {
    if (errorDetail != null) {
      return "ERROR(" + kind + "): " + errorDetail + " at line " + line + ", col " + column;
    }
    return kind + "(" + lexeme + ") at line " + line + ", col " + column;
  }
}
