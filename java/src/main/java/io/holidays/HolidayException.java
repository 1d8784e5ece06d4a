package io.holidays;

import java.util.Optional;

/**
 * Thrown when an observed rule cannot be read from its text form.
 *
 * <p>The exception keeps the rule text and the offending {@link Span}, so callers loading rules
 * from configuration can point at the mistake:
 *
 * <pre>
 * error: unknown rule 'SAT_SUN_TO_NEXT_MOM' (line 1, column 1)
 *   SAT_SUN_TO_NEXT_MOM + fri +3
 *   ^^^^^^^^^^^^^^^^^^^
 *   did you mean "SAT_SUN_TO_NEXT_MON"?
 * </pre>
 */
public final class HolidayException extends Exception {
  private final ErrorKind kind;
  private final String input;
  private final Span span;
  private final String suggestion;

  private HolidayException(
      ErrorKind kind, String message, String input, Span span, String suggestion) {
    super(message);
    this.kind = kind;
    this.input = input;
    this.span = span;
    this.suggestion = suggestion;
  }

  /**
   * Creates an error for text that cannot be split into tokens.
   *
   * @param message the error message
   * @param span the offending characters
   * @param input the rule text
   * @return a new exception of kind {@link ErrorKind#LEX}
   */
  public static HolidayException lex(String message, Span span, String input) {
    return new HolidayException(ErrorKind.LEX, message, input, span, null);
  }

  /**
   * Creates an error for tokens that do not form a rule.
   *
   * @param message the error message
   * @param span the offending tokens
   * @param input the rule text
   * @param suggestion a replacement for the offending tokens, or null
   * @return a new exception of kind {@link ErrorKind#PARSE}
   */
  public static HolidayException parse(
      String message, Span span, String input, String suggestion) {
    return new HolidayException(ErrorKind.PARSE, message, input, span, suggestion);
  }

  public ErrorKind kind() {
    return kind;
  }

  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestion);
  }

  /**
   * Returns the 1-based line of the error in the rule text.
   *
   * @return the line, or empty without a span
   */
  public Optional<Integer> line() {
    if (span == null || input == null) {
      return Optional.empty();
    }
    int line = 1;
    for (int i = 0; i < Math.min(span.start(), input.length()); i++) {
      if (input.charAt(i) == '\n') {
        line++;
      }
    }
    return Optional.of(line);
  }

  /**
   * Returns the 1-based column of the error within its line.
   *
   * @return the column, or empty without a span
   */
  public Optional<Integer> column() {
    if (span == null || input == null) {
      return Optional.empty();
    }
    return Optional.of(span.start() - lineStart() + 1);
  }

  /**
   * Formats the error with the offending line of the rule text, a caret underline and the
   * suggestion, if any. Only the line holding the start of the span is shown.
   *
   * @return a multi-line description of the error
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder("error: ").append(getMessage());
    if (span == null || input == null) {
      return sb.toString();
    }

    int from = lineStart();
    int to = input.indexOf('\n', from);
    if (to < 0) {
      to = input.length();
    }
    String text = input.substring(from, to);
    int column = span.start() - from;
    int width = Math.max(1, Math.min(span.length(), text.length() - column));

    sb.append(" (line ").append(line().get()).append(", column ").append(column + 1).append(")");
    sb.append("\n  ").append(text);
    sb.append("\n  ").append(" ".repeat(column)).append("^".repeat(width));
    if (suggestion != null && !suggestion.isEmpty()) {
      sb.append("\n  did you mean \"").append(suggestion).append("\"?");
    }
    return sb.toString();
  }

  private int lineStart() {
    int start = Math.min(span.start(), input.length());
    return input.lastIndexOf('\n', start - 1) + 1;
  }
}
