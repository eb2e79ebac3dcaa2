package io.ibtac.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizes IBTAC source text into a list of tokens.
 *
 * <p>Scanning never stops at a malformed construct: each one becomes an error token, is recorded
 * in this scanner's {@link ErrorHandler}, and scanning resumes right after it. The returned list
 * always ends with exactly one {@link TokenKind#END_OF_INPUT} token.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Scanner scanner = new Scanner("func 071main() { return .5 }");
 * List<Token> tokens = scanner.tokenize();
 * if (scanner.errorHandler().hasErrors()) {
 *     System.err.println(scanner.errorHandler().summary());
 * }
 * }</pre>
 */
public final class Scanner {
  private static final Logger log = LoggerFactory.getLogger(Scanner.class);

  /** Returned by {@link #peek(int)} and {@link #advance()} past the end of the input. */
  private static final char END = '\0';

  private final String source;
  private final ErrorHandler errorHandler;
  private final List<Token> tokens = new ArrayList<>();

  private int pos;
  private int line;
  private int column;

  // where the token being scanned starts
  private int start;
  private int startLine;
  private int startColumn;

  /**
   * Creates a scanner over the given source text.
   *
   * @param source the text to scan
   */
  public Scanner(String source) {
    this.source = Objects.requireNonNull(source, "source");
    this.errorHandler = new ErrorHandler();
  }

  /**
   * Tokenizes the input string into a list of tokens.
   *
   * @param source the text to scan
   * @return the tokens, ending with END_OF_INPUT
   */
  public static List<Token> tokenize(String source) {
    return new Scanner(source).tokenize();
  }

  /**
   * Scans the whole source from the beginning.
   *
   * <p>The cursor, the token buffer and the error log are reset first, so calling this again on
   * the same scanner gives the same result.
   *
   * @return an unmodifiable list of tokens, ending with END_OF_INPUT
   */
  public List<Token> tokenize() {
    pos = 0;
    line = 1;
    column = 1;
    tokens.clear();
    errorHandler.clear();

    while (!isAtEnd()) {
      start = pos;
      startLine = line;
      startColumn = column;
      Token token = scanToken();
      if (token != null) {
        tokens.add(token.withPosition(startLine, startColumn));
      }
    }
    tokens.add(Token.endOfInput(line, column));

    log.debug(
        "Scanned {} chars into {} tokens with {} error(s)",
        source.length(),
        tokens.size(),
        errorHandler.errorCount());
    return Collections.unmodifiableList(new ArrayList<>(tokens));
  }

  /**
   * Returns the error log of this scanner.
   *
   * @return the error handler, holding the errors of the last scan
   */
  public ErrorHandler errorHandler() {
    return errorHandler;
  }

  /** Scans one token, or returns null for skipped whitespace. */
  private Token scanToken() {
    char c = peek(0);

    if (Lexicon.isWhitespace(c)) {
      advance();
      return null;
    }

    if (Lexicon.isNewline(c)) {
      advance();
      return make(TokenKind.NEWLINE);
    }

    if (c == '/' && peek(1) == '/') {
      return lineComment();
    }

    if (c == '/' && peek(1) == '*') {
      return blockComment();
    }

    if (c == '$') {
      return string();
    }

    // 071, 070 and 048 lead identifiers; any other leading digit is a number
    if (c == '0'
        && ((peek(1) == '7' && (peek(2) == '0' || peek(2) == '1'))
            || (peek(1) == '4' && peek(2) == '8'))) {
      return prefixedIdentifier();
    }

    if (Lexicon.isDigit(c) || c == '.') {
      return number();
    }

    if (c == '_') {
      return underscoreWord();
    }

    if (Lexicon.isLetter(c)) {
      return word();
    }

    if (Lexicon.isOperatorStart(c)) {
      return operator();
    }

    Optional<TokenKind> delimiter = Lexicon.delimiter(c);
    if (delimiter.isPresent()) {
      advance();
      return make(delimiter.get());
    }

    advance();
    return errorHandler.invalidSymbol(startLine, startColumn, String.valueOf(c));
  }

  private Token lineComment() {
    while (!isAtEnd() && !Lexicon.isNewline(peek(0))) {
      advance();
    }
    return make(TokenKind.COMMENT);
  }

  private Token blockComment() {
    advance(); // '/'
    advance(); // '*'
    while (!isAtEnd()) {
      if (peek(0) == '/' && peek(1) == '*') {
        // the nested opener is left in place and scanned as the next token
        return errorHandler.nestedComment(startLine, startColumn);
      }
      if (peek(0) == '*' && peek(1) == '/') {
        advance();
        advance();
        return make(TokenKind.COMMENT);
      }
      advance();
    }
    return errorHandler.unterminatedComment(startLine, startColumn);
  }

  private Token string() {
    advance(); // opening '$'
    while (!isAtEnd() && !Lexicon.isNewline(peek(0))) {
      if (advance() == '$') {
        return make(TokenKind.STRING);
      }
    }
    return errorHandler.unterminatedString(startLine, startColumn, text());
  }

  private Token prefixedIdentifier() {
    advance();
    advance();
    advance();
    while (Lexicon.isIdentifierPart(peek(0))) {
      advance();
    }
    String identifier = text();
    if (!Lexicon.hasIdentifierPrefix(identifier)) {
      return errorHandler.invalidIdentifier(startLine, startColumn, identifier);
    }
    return make(TokenKind.IDENTIFIER);
  }

  private Token number() {
    boolean fraction = false;
    boolean exponent = false;

    if (peek(0) == '.') {
      advance();
      fraction = true;
    }
    while (Lexicon.isDigit(peek(0))) {
      advance();
    }

    if (!fraction && peek(0) == '.') {
      advance();
      fraction = true;
      while (Lexicon.isDigit(peek(0))) {
        advance();
      }
    }

    if (peek(0) == 'e' || peek(0) == 'E') {
      advance();
      exponent = true;
      if (peek(0) == '+' || peek(0) == '-') {
        advance();
      }
      if (!Lexicon.isDigit(peek(0))) {
        return errorHandler.invalidNumber(startLine, startColumn, text());
      }
      while (Lexicon.isDigit(peek(0))) {
        advance();
      }
    }

    String numeral = text();
    if (!Lexicon.isValidNumber(numeral)) {
      return errorHandler.invalidNumber(startLine, startColumn, numeral);
    }
    return make(fraction || exponent ? TokenKind.FLOAT : TokenKind.INTEGER);
  }

  private Token underscoreWord() {
    advance(); // '_'
    while (Lexicon.isIdentifierPart(peek(0))) {
      advance();
    }
    return errorHandler.leadingUnderscore(startLine, startColumn, text());
  }

  private Token word() {
    while (Lexicon.isIdentifierPart(peek(0))) {
      advance();
    }
    String word = text();
    Optional<TokenKind> keyword = Lexicon.keyword(word);
    if (keyword.isEmpty()) {
      return errorHandler.invalidIdentifier(startLine, startColumn, word);
    }
    return make(keyword.get());
  }

  private Token operator() {
    char c = peek(0);
    Optional<TokenKind> twoChar =
        isAtEnd(1) ? Optional.empty() : Lexicon.operator("" + c + peek(1));
    if (twoChar.isPresent()) {
      advance();
      advance();
      return make(twoChar.get());
    }

    Optional<TokenKind> oneChar = Lexicon.operator(String.valueOf(c));
    advance();
    if (oneChar.isPresent()) {
      return make(oneChar.get());
    }
    // "=" and "!" only exist as the first half of "==" and "!="
    return errorHandler.invalidSymbol(startLine, startColumn, String.valueOf(c));
  }

  private Token make(TokenKind kind) {
    return Token.of(kind, text(), startLine, startColumn);
  }

  private String text() {
    return source.substring(start, pos);
  }

  private char peek(int offset) {
    if (isAtEnd(offset)) {
      return END;
    }
    return source.charAt(pos + offset);
  }

  private char advance() {
    if (isAtEnd()) {
      return END;
    }
    char c = source.charAt(pos++);
    if (Lexicon.isNewline(c)) {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private boolean isAtEnd() {
    return isAtEnd(0);
  }

  private boolean isAtEnd(int offset) {
    return pos + offset >= source.length();
  }
}
