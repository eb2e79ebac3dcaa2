package io.ibtac;

import io.ibtac.lexer.ErrorHandler;
import io.ibtac.lexer.Scanner;
import io.ibtac.lexer.Token;
import java.util.List;
import java.util.Objects;

/**
 * The main entry point for lexical analysis of IBTAC source text.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Analysis analysis = Analysis.of("func 071main() { return 071x + .5 }");
 * for (Token token : analysis.meaningfulTokens()) {
 *     System.out.println(token);
 * }
 * if (analysis.hasErrors()) {
 *     System.out.println(analysis.summary());
 * }
 * }</pre>
 */
public final class Analysis {
  private final String source;
  private final List<Token> tokens;
  private final List<Token> errors;
  private final String summary;

  private Analysis(String source, List<Token> tokens, List<Token> errors, String summary) {
    this.source = source;
    this.tokens = tokens;
    this.errors = errors;
    this.summary = summary;
  }

  /**
   * Scans the given source text.
   *
   * @param source the IBTAC source text
   * @return the result of the scan
   */
  public static Analysis of(String source) {
    Objects.requireNonNull(source, "source");
    Scanner scanner = new Scanner(source);
    List<Token> tokens = scanner.tokenize();
    ErrorHandler errorHandler = scanner.errorHandler();
    return new Analysis(
        source, tokens, List.copyOf(errorHandler.errors()), errorHandler.summary());
  }

  /**
   * Checks source text for lexical errors without throwing.
   *
   * @param source the IBTAC source text
   * @return true if the text scans without errors
   */
  public static boolean validate(String source) {
    return !of(source).hasErrors();
  }

  /**
   * Ensures the scan found no errors.
   *
   * @return this analysis
   * @throws LexicalException describing the first error, if there is any
   */
  public Analysis requireValid() throws LexicalException {
    if (hasErrors()) {
      throw LexicalException.of(errors.get(0), source, errors.size());
    }
    return this;
  }

  /**
   * Returns every token of the scan, ending with END_OF_INPUT.
   *
   * @return the tokens
   */
  public List<Token> tokens() {
    return tokens;
  }

  /**
   * Returns the tokens other than whitespace, newlines and END_OF_INPUT.
   *
   * @return the meaningful tokens, errors included
   */
  public List<Token> meaningfulTokens() {
    return tokens.stream().filter(Token::isMeaningful).toList();
  }

  /**
   * Returns the error tokens in source order.
   *
   * @return the errors
   */
  public List<Token> errors() {
    return errors;
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public int errorCount() {
    return errors.size();
  }

  /**
   * Returns the numbered error summary.
   *
   * @return the summary text
   */
  public String summary() {
    return summary;
  }

  /**
   * Computes token counts for this scan.
   *
   * @return the statistics
   */
  public TokenStats stats() {
    return TokenStats.of(tokens);
  }

  /**
   * Returns the scanned source text.
   *
   * @return the source
   */
  public String source() {
    return source;
  }
}
