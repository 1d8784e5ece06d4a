package io.holidays.lexer;

import io.holidays.HolidayException;
import io.holidays.Span;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tokenizes observed rule texts.
 *
 * <p>A sign directly followed by digits is part of a number ({@code +3}, {@code -7}); a
 * {@code +} followed by anything else is the composition operator.
 */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the input string into a list of tokens.
   *
   * @param input the rule text to tokenize
   * @return a list of tokens
   * @throws HolidayException if the input contains invalid characters or numbers
   */
  public static List<Token> tokenize(String input) throws HolidayException {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() throws HolidayException {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        break;
      }

      int start = pos;
      char ch = input.charAt(pos);

      if (ch == ',') {
        pos++;
        tokens.add(Token.keyword(TokenKind.COMMA, new Span(start, pos)));
        continue;
      }

      if ((ch == '+' || ch == '-') && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
        tokens.add(lexNumber());
        continue;
      }

      if (ch == '+') {
        pos++;
        tokens.add(Token.keyword(TokenKind.PLUS, new Span(start, pos)));
        continue;
      }

      if (isDigit(ch)) {
        tokens.add(lexNumber());
        continue;
      }

      if (isAlpha(ch)) {
        tokens.add(lexWord());
        continue;
      }

      throw HolidayException.lex(
          "unexpected character '" + ch + "'", new Span(start, start + 1), input);
    }

    return tokens;
  }

  private void skipWhitespace() {
    while (pos < input.length() && isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private Token lexNumber() throws HolidayException {
    int start = pos;
    int sign = 1;
    char first = input.charAt(pos);
    if (first == '+' || first == '-') {
      sign = first == '-' ? -1 : 1;
      pos++;
    }

    int digitsStart = pos;
    while (pos < input.length() && isDigit(input.charAt(pos))) {
      pos++;
    }
    String digits = input.substring(digitsStart, pos);
    Span span = new Span(start, pos);

    if (pos < input.length() && isAlpha(input.charAt(pos))) {
      throw HolidayException.lex("expected a number of days", span, input);
    }
    // Three digits at most.
    if (digits.length() > 3) {
      throw HolidayException.lex("day delta out of range", span, input);
    }

    return Token.number(sign * Integer.parseInt(digits), span);
  }

  private Token lexWord() {
    int start = pos;
    while (pos < input.length()
        && (isAlphanumeric(input.charAt(pos)) || input.charAt(pos) == '_')) {
      pos++;
    }
    String word = input.substring(start, pos);
    Span span = new Span(start, pos);

    Token tok = KEYWORD_MAP.get(word.toLowerCase());
    if (tok == null) {
      return Token.ruleName(word, span);
    }

    return switch (tok.kind()) {
      case DAY_NAME -> Token.dayName(tok.dayVal(), span);
      default -> Token.keyword(tok.kind(), span);
    };
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlpha(char c) {
    return Character.isLetter(c);
  }

  private static boolean isAlphanumeric(char c) {
    return isAlpha(c) || isDigit(c);
  }

  private static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r';
  }

  // Keyword map - values have dummy spans, actual spans are set when returning
  private static final Map<String, Token> KEYWORD_MAP;
  private static final Span DUMMY_SPAN = new Span(0, 0);

  static {
    KEYWORD_MAP =
        Map.ofEntries(
            // Keywords
            Map.entry("next", Token.keyword(TokenKind.NEXT, DUMMY_SPAN)),
            Map.entry("prev", Token.keyword(TokenKind.PREV, DUMMY_SPAN)),
            Map.entry("previous", Token.keyword(TokenKind.PREV, DUMMY_SPAN)),
            Map.entry("workday", Token.keyword(TokenKind.WORKDAY, DUMMY_SPAN)),
            Map.entry("none", Token.keyword(TokenKind.NONE, DUMMY_SPAN)),

            // Day names
            Map.entry("monday", Token.dayName(DayOfWeek.MONDAY, DUMMY_SPAN)),
            Map.entry("mon", Token.dayName(DayOfWeek.MONDAY, DUMMY_SPAN)),
            Map.entry("tuesday", Token.dayName(DayOfWeek.TUESDAY, DUMMY_SPAN)),
            Map.entry("tue", Token.dayName(DayOfWeek.TUESDAY, DUMMY_SPAN)),
            Map.entry("wednesday", Token.dayName(DayOfWeek.WEDNESDAY, DUMMY_SPAN)),
            Map.entry("wed", Token.dayName(DayOfWeek.WEDNESDAY, DUMMY_SPAN)),
            Map.entry("thursday", Token.dayName(DayOfWeek.THURSDAY, DUMMY_SPAN)),
            Map.entry("thu", Token.dayName(DayOfWeek.THURSDAY, DUMMY_SPAN)),
            Map.entry("friday", Token.dayName(DayOfWeek.FRIDAY, DUMMY_SPAN)),
            Map.entry("fri", Token.dayName(DayOfWeek.FRIDAY, DUMMY_SPAN)),
            Map.entry("saturday", Token.dayName(DayOfWeek.SATURDAY, DUMMY_SPAN)),
            Map.entry("sat", Token.dayName(DayOfWeek.SATURDAY, DUMMY_SPAN)),
            Map.entry("sunday", Token.dayName(DayOfWeek.SUNDAY, DUMMY_SPAN)),
            Map.entry("sun", Token.dayName(DayOfWeek.SUNDAY, DUMMY_SPAN)));
  }
}
