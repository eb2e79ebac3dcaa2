package io.ibtac.lexer;

/** The type of token. */
public enum TokenKind {
  // Literals
  /** An identifier carrying one of the legal numeral prefixes (e.g., "071count"). */
  IDENTIFIER(Category.LITERAL),
  /** An integer literal (e.g., "123"). */
  INTEGER(Category.LITERAL),
  /** A floating-point literal (e.g., "3.14", ".5", "2.5e10"). */
  FLOAT(Category.LITERAL),
  /** A dollar-delimited string literal (e.g., "$hello$"). */
  STRING(Category.LITERAL),

  // Keywords
  /** The "if" keyword. */
  IF(Category.KEYWORD),
  /** The "else" keyword. */
  ELSE(Category.KEYWORD),
  /** The "while" keyword. */
  WHILE(Category.KEYWORD),
  /** The "return" keyword. */
  RETURN(Category.KEYWORD),
  /** The "func" keyword. */
  FUNC(Category.KEYWORD),

  // Operators
  /** "+" */
  PLUS(Category.OPERATOR),
  /** "-" */
  MINUS(Category.OPERATOR),
  /** "*" */
  MULTIPLY(Category.OPERATOR),
  /** "/" */
  DIVIDE(Category.OPERATOR),
  /** "==" */
  EQUAL(Category.OPERATOR),
  /** "!=" */
  NOT_EQUAL(Category.OPERATOR),
  /** "&lt;" */
  LESS_THAN(Category.OPERATOR),
  /** "&gt;" */
  GREATER_THAN(Category.OPERATOR),
  /** "&lt;=" */
  LESS_EQUAL(Category.OPERATOR),
  /** "&gt;=" */
  GREATER_EQUAL(Category.OPERATOR),

  // Delimiters
  /** "(" */
  LPAREN(Category.DELIMITER),
  /** ")" */
  RPAREN(Category.DELIMITER),
  /** "{" */
  LBRACE(Category.DELIMITER),
  /** "}" */
  RBRACE(Category.DELIMITER),
  /** ";" */
  SEMICOLON(Category.DELIMITER),
  /** "," */
  COMMA(Category.DELIMITER),

  // Structural
  /** A single-line or block comment, delimiters included. */
  COMMENT(Category.STRUCTURAL),
  /** A run of whitespace. The scanner skips whitespace and never emits this kind. */
  WHITESPACE(Category.STRUCTURAL),
  /** A line feed. */
  NEWLINE(Category.STRUCTURAL),
  /** The end of the input. Always the last token of a scan. */
  END_OF_INPUT(Category.STRUCTURAL),

  // Errors
  /** A malformed identifier or block comment. */
  GENERIC_ERROR(Category.ERROR),
  /** A string literal that reached a newline or the end of input before its closing "$". */
  UNTERMINATED_STRING(Category.ERROR),
  /** A malformed numeral. */
  INVALID_NUMBER(Category.ERROR),
  /** A character that matches no token rule. */
  INVALID_SYMBOL(Category.ERROR);

  /** The group a token kind belongs to. */
  public enum Category {
    LITERAL,
    KEYWORD,
    OPERATOR,
    DELIMITER,
    STRUCTURAL,
    ERROR
  }

  private final Category category;

  TokenKind(Category category) {
    this.category = category;
  }

  /**
   * Returns the group this kind belongs to.
   *
   * @return the category
   */
  public Category category() {
    return category;
  }

  /**
   * Returns true for the error kinds.
   *
   * @return true if tokens of this kind report a lexical error
   */
  public boolean isError() {
    return category == Category.ERROR;
  }

  /**
   * Returns true for kinds that carry no content of their own: whitespace, newlines and the end
   * of input.
   *
   * @return true if this kind is trivia
   */
  public boolean isTrivia() {
    return this == WHITESPACE || this == NEWLINE || this == END_OF_INPUT;
  }
}
