package io.holidays.lexer;

import io.holidays.Span;
import java.time.DayOfWeek;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the input
 * @param dayVal the weekday value (for DAY_NAME tokens)
 * @param numberVal the number value (for NUMBER tokens)
 * @param nameVal the rule name as written (for RULE_NAME tokens)
 */
public record Token(TokenKind kind, Span span, DayOfWeek dayVal, int numberVal, String nameVal) {
  /** Creates a keyword or punctuation token. */
  public static Token keyword(TokenKind kind, Span span) {
    return new Token(kind, span, null, 0, null);
  }

  /** Creates a day name token. */
  public static Token dayName(DayOfWeek day, Span span) {
    return new Token(TokenKind.DAY_NAME, span, day, 0, null);
  }

  /** Creates a number token. */
  public static Token number(int value, Span span) {
    return new Token(TokenKind.NUMBER, span, null, value, null);
  }

  /** Creates a rule name token. */
  public static Token ruleName(String name, Span span) {
    return new Token(TokenKind.RULE_NAME, span, null, 0, name);
  }
}
