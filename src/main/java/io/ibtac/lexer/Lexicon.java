package io.ibtac.lexer;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/** Reserved words, operator and delimiter spellings, and character classes of IBTAC. */
public final class Lexicon {
  /** The three-character numerals an identifier must start with. */
  public static final List<String> IDENTIFIER_PREFIXES = List.of("071", "070", "048");

  private static final Map<String, TokenKind> KEYWORDS =
      Map.of(
          "if", TokenKind.IF,
          "else", TokenKind.ELSE,
          "while", TokenKind.WHILE,
          "return", TokenKind.RETURN,
          "func", TokenKind.FUNC);

  private static final Map<String, TokenKind> OPERATORS =
      Map.ofEntries(
          Map.entry("+", TokenKind.PLUS),
          Map.entry("-", TokenKind.MINUS),
          Map.entry("*", TokenKind.MULTIPLY),
          Map.entry("/", TokenKind.DIVIDE),
          Map.entry("==", TokenKind.EQUAL),
          Map.entry("!=", TokenKind.NOT_EQUAL),
          Map.entry("<", TokenKind.LESS_THAN),
          Map.entry(">", TokenKind.GREATER_THAN),
          Map.entry("<=", TokenKind.LESS_EQUAL),
          Map.entry(">=", TokenKind.GREATER_EQUAL));

  private static final Map<Character, TokenKind> DELIMITERS =
      Map.of(
          '(', TokenKind.LPAREN,
          ')', TokenKind.RPAREN,
          '{', TokenKind.LBRACE,
          '}', TokenKind.RBRACE,
          ';', TokenKind.SEMICOLON,
          ',', TokenKind.COMMA);

  // digits with an optional fraction, or a leading-dot fraction, then an optional exponent
  private static final Pattern NUMERAL =
      Pattern.compile("(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

  private static final String OPERATOR_START = "+-*/=!<>";

  private Lexicon() {}

  /**
   * Looks up a reserved word, ignoring case.
   *
   * @param word the scanned word
   * @return the keyword kind, or empty if the word is not reserved
   */
  public static Optional<TokenKind> keyword(String word) {
    return Optional.ofNullable(KEYWORDS.get(word.toLowerCase(Locale.ROOT)));
  }

  /**
   * Looks up an operator spelling of one or two characters.
   *
   * @param spelling the candidate operator text
   * @return the operator kind, or empty if the spelling is not an operator
   */
  public static Optional<TokenKind> operator(String spelling) {
    return Optional.ofNullable(OPERATORS.get(spelling));
  }

  /**
   * Looks up a delimiter character.
   *
   * @param c the character
   * @return the delimiter kind, or empty if the character is not a delimiter
   */
  public static Optional<TokenKind> delimiter(char c) {
    return Optional.ofNullable(DELIMITERS.get(c));
  }

  public static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  public static boolean isLetter(char c) {
    return Character.isLetter(c);
  }

  /**
   * Letters, digits and underscores may continue an identifier or a word. Any Unicode digit
   * counts here, while {@link #isDigit(char)} stays ASCII for numerals.
   */
  public static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  /** Space, tab and carriage return. Newlines are significant and excluded. */
  public static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\r';
  }

  public static boolean isNewline(char c) {
    return c == '\n';
  }

  public static boolean isOperatorStart(char c) {
    return OPERATOR_START.indexOf(c) >= 0;
  }

  /**
   * Checks whether a text begins with one of the legal identifier prefixes.
   *
   * @param text the candidate identifier
   * @return true if the text is at least three characters long and starts with a legal prefix
   */
  public static boolean hasIdentifierPrefix(String text) {
    if (text.length() < 3) {
      return false;
    }
    return IDENTIFIER_PREFIXES.contains(text.substring(0, 3));
  }

  /**
   * Checks a complete numeral against the integer and floating-point literal grammar.
   *
   * <p>Accepted shapes: {@code 123}, {@code 3.14}, {@code 3.}, {@code .5}, each optionally
   * followed by an exponent such as {@code e10}, {@code E-5} or {@code e+2}.
   *
   * @param text the numeral text
   * @return true if the text is a well-formed numeral
   */
  public static boolean isValidNumber(String text) {
    return NUMERAL.matcher(text).matches();
  }
}
