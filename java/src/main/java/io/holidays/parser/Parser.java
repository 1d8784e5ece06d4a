package io.holidays.parser;

import io.holidays.HolidayException;
import io.holidays.Span;
import io.holidays.lexer.Lexer;
import io.holidays.lexer.Token;
import io.holidays.lexer.TokenKind;
import io.holidays.rule.ObservedRule;
import io.holidays.rule.ObservedRules;
import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser for observed rule texts.
 *
 * <pre>
 * rule  := term ('+' term)*
 * term  := RULE_NAME | 'none' | entry (',' entry)*
 * entry := DAY_NAME delta
 * delta := NUMBER | ('next' | 'prev') 'workday'
 * </pre>
 */
public final class Parser {
  private final String input;
  private final List<Token> tokens;
  private int pos;

  private Parser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses an observed rule text into a transition table.
   *
   * @param input the rule text to parse
   * @return the parsed table
   * @throws HolidayException if the input is invalid
   */
  public static ObservedRule parse(String input) throws HolidayException {
    if (input == null || input.trim().isEmpty()) {
      throw HolidayException.parse("empty input", new Span(0, 0), input, null);
    }

    List<Token> tokens = Lexer.tokenize(input);
    if (tokens.isEmpty()) {
      throw HolidayException.parse("empty input", new Span(0, 0), input, null);
    }

    return new Parser(input, tokens).parseRule();
  }

  private ObservedRule parseRule() throws HolidayException {
    ObservedRule rule = parseTerm();

    while (pos < tokens.size()) {
      Token tok = tokens.get(pos);
      if (tok.kind() != TokenKind.PLUS) {
        throw parseError("expected '+' or ',' but got " + tok.kind(), tok.span());
      }
      pos++;
      rule = rule.plus(parseTerm());
    }

    return rule;
  }

  private ObservedRule parseTerm() throws HolidayException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("expected a rule but reached end of input", endSpan());
    }

    return switch (tok.kind()) {
      case RULE_NAME -> parseRuleName();
      case NONE -> {
        pos++;
        yield ObservedRule.empty();
      }
      case DAY_NAME -> parseEntries();
      default -> throw parseError("expected a weekday or a rule name", tok.span());
    };
  }

  private ObservedRule parseRuleName() throws HolidayException {
    Token tok = expect(TokenKind.RULE_NAME);
    String name = tok.nameVal();
    return ObservedRules.byName(name)
        .orElseThrow(
            () ->
                HolidayException.parse(
                    "unknown rule '" + name + "'", tok.span(), input, closestRuleName(name)));
  }

  private ObservedRule parseEntries() throws HolidayException {
    Map<DayOfWeek, Integer> entries = new EnumMap<>(DayOfWeek.class);
    parseEntry(entries);

    while (check(TokenKind.COMMA)) {
      pos++;
      parseEntry(entries);
    }

    return ObservedRule.of(entries);
  }

  private void parseEntry(Map<DayOfWeek, Integer> entries) throws HolidayException {
    Token dayTok = expect(TokenKind.DAY_NAME);
    DayOfWeek day = dayTok.dayVal();
    if (entries.containsKey(day)) {
      throw parseError("duplicate entry for " + day.name().toLowerCase(), dayTok.span());
    }
    entries.put(day, parseDelta());
  }

  private int parseDelta() throws HolidayException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("expected a day delta but reached end of input", endSpan());
    }

    return switch (tok.kind()) {
      case NUMBER -> {
        pos++;
        if (tok.numberVal() == 0) {
          throw parseError("day delta must not be zero", tok.span());
        }
        yield tok.numberVal();
      }
      case NEXT -> {
        pos++;
        expect(TokenKind.WORKDAY);
        yield ObservedRule.NEXT_WORKDAY;
      }
      case PREV -> {
        pos++;
        expect(TokenKind.WORKDAY);
        yield ObservedRule.PREVIOUS_WORKDAY;
      }
      default -> throw parseError("expected a day delta or next/prev workday", tok.span());
    };
  }

  /** Returns the catalog name with the smallest edit distance, if reasonably close. */
  private static String closestRuleName(String name) {
    String upper = name.toUpperCase();
    String best = null;
    int bestDistance = Integer.MAX_VALUE;
    for (String candidate : ObservedRules.names()) {
      int distance = editDistance(upper, candidate);
      if (distance < bestDistance) {
        best = candidate;
        bestDistance = distance;
      }
    }
    return bestDistance <= 3 ? best : null;
  }

  private static int editDistance(String a, String b) {
    int[] prev = new int[b.length() + 1];
    int[] curr = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      prev[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      curr[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
      }
      int[] tmp = prev;
      prev = curr;
      curr = tmp;
    }
    return prev[b.length()];
  }

  // Helper methods

  private Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  private boolean check(TokenKind kind) {
    Token tok = peek();
    return tok != null && tok.kind() == kind;
  }

  private Token expect(TokenKind kind) throws HolidayException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("expected " + kind + " but reached end of input", endSpan());
    }
    if (tok.kind() != kind) {
      throw parseError("expected " + kind + " but got " + tok.kind(), tok.span());
    }
    pos++;
    return tok;
  }

  private Span endSpan() {
    if (tokens.isEmpty()) {
      return new Span(0, 0);
    }
    Span lastSpan = tokens.get(tokens.size() - 1).span();
    return new Span(lastSpan.end(), lastSpan.end());
  }

  private HolidayException parseError(String message, Span span) {
    return HolidayException.parse(message, span, input, null);
  }
}
