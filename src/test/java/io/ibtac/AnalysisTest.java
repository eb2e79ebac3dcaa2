package io.ibtac;

import static org.junit.jupiter.api.Assertions.*;

import io.ibtac.lexer.Token;
import io.ibtac.lexer.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Tests for the analysis entry point. */
public class AnalysisTest {
  private static final String PROGRAM = "func 071main() {\n  return 071x + .5\n}";

  @Test
  void testValidProgram() throws LexicalException {
    Analysis analysis = Analysis.of(PROGRAM).requireValid();
    assertFalse(analysis.hasErrors());
    assertEquals(0, analysis.errorCount());
    assertEquals("No lexical errors found.", analysis.summary());
    assertEquals(13, analysis.tokens().size());
    assertEquals(PROGRAM, analysis.source());
  }

  @Test
  void testMeaningfulTokens() {
    List<TokenKind> kinds =
        Analysis.of(PROGRAM).meaningfulTokens().stream()
            .map(Token::kind)
            .collect(Collectors.toList());
    assertEquals(
        List.of(
            TokenKind.FUNC,
            TokenKind.IDENTIFIER,
            TokenKind.LPAREN,
            TokenKind.RPAREN,
            TokenKind.LBRACE,
            TokenKind.RETURN,
            TokenKind.IDENTIFIER,
            TokenKind.PLUS,
            TokenKind.FLOAT,
            TokenKind.RBRACE),
        kinds);
  }

  @Test
  void testStats() {
    TokenStats stats = Analysis.of(PROGRAM).stats();
    assertEquals(12, stats.totalTokens());
    assertEquals(10, stats.meaningfulTokens());
    assertEquals(0, stats.errorCount());
    assertEquals(2, stats.count(TokenKind.IDENTIFIER));
    assertEquals(0, stats.count(TokenKind.NEWLINE));
    assertEquals(
        List.of(
            TokenKind.IDENTIFIER,
            TokenKind.FLOAT,
            TokenKind.RETURN,
            TokenKind.FUNC,
            TokenKind.PLUS,
            TokenKind.LPAREN,
            TokenKind.RPAREN,
            TokenKind.LBRACE,
            TokenKind.RBRACE),
        new ArrayList<>(stats.distribution().keySet()));
  }

  @Test
  void testStatsCountErrors() {
    TokenStats stats = Analysis.of("_a @ @ 071b").stats();
    assertEquals(4, stats.totalTokens());
    assertEquals(3, stats.errorCount());
    assertEquals(TokenKind.INVALID_SYMBOL, stats.distribution().keySet().iterator().next());
    assertEquals(2, stats.count(TokenKind.INVALID_SYMBOL));
  }

  @Test
  void testValidate() {
    assertTrue(Analysis.validate(PROGRAM));
    assertTrue(Analysis.validate(""));
    assertFalse(Analysis.validate("count = 1"));
  }

  @Test
  void testErrorsAndSummary() {
    Analysis analysis = Analysis.of("071a @\n_b");
    assertEquals(2, analysis.errorCount());
    assertEquals(TokenKind.INVALID_SYMBOL, analysis.errors().get(0).kind());
    assertEquals(TokenKind.GENERIC_ERROR, analysis.errors().get(1).kind());
    assertTrue(analysis.summary().startsWith("Found 2 lexical error(s):\n1. "));
  }

  @Test
  void testRequireValidThrowsFirstError() {
    Analysis analysis = Analysis.of("071x + 4 @ 2 #");
    LexicalException e = assertThrows(LexicalException.class, analysis::requireValid);
    assertEquals("@", e.token().lexeme());
    assertEquals(2, e.errorCount());
    assertEquals("Invalid symbol: '@' at line 1, col 10", e.getMessage());
    assertTrue(e.suggestion().isEmpty());
    assertEquals(
        "error: Invalid symbol: '@'\n  071x + 4 @ 2 #\n           ^", e.displayRich());
  }

  @Test
  void testDisplayRichWithSuggestion() {
    LexicalException e =
        assertThrows(
            LexicalException.class, () -> Analysis.of("071a\n$hi there").requireValid());
    assertEquals(
        "error: Unterminated string literal: '$hi there'\n"
            + "  $hi there\n"
            + "  ^^^^^^^^^ try: \"Add closing '$' to complete string: '$hi there$'\"",
        e.displayRich());
  }

  @Test
  void testDisplayRichDropsCarriageReturn() {
    LexicalException e =
        assertThrows(
            LexicalException.class, () -> Analysis.of("071a\r\n071b @\r\n").requireValid());
    assertEquals(2, e.token().line());
    assertEquals(6, e.token().column());
    assertEquals("error: Invalid symbol: '@'\n  071b @\n       ^", e.displayRich());
  }

  @Test
  void testDisplayRichWithoutSource() {
    Token token = Token.error(TokenKind.INVALID_NUMBER, "5e", 1, 1, "Invalid number format: '5e'");
    LexicalException e = LexicalException.of(token, null, 1);
    assertEquals("error: Invalid number format: '5e'", e.displayRich());
    assertTrue(e.source().isEmpty());
  }

  @Test
  void testExceptionRequiresErrorToken() {
    assertThrows(
        IllegalArgumentException.class,
        () -> LexicalException.of(Token.of(TokenKind.IF, "if", 1, 1), "if", 0));
  }
}
