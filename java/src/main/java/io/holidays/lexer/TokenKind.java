package io.holidays.lexer;

/** The type of token in an observed rule text. */
public enum TokenKind {
  // Keywords
  /** The "next" keyword. */
  NEXT,
  /** The "prev" or "previous" keyword. */
  PREV,
  /** The "workday" keyword. */
  WORKDAY,
  /** The "none" keyword, naming the empty table. */
  NONE,

  // Values
  /** A weekday name (monday, mon, ...). */
  DAY_NAME,
  /** A signed or unsigned day delta. */
  NUMBER,
  /** A catalog rule name (e.g., SAT_SUN_TO_NEXT_MON). */
  RULE_NAME,

  // Punctuation
  /** A comma separator between entries. */
  COMMA,
  /** The composition operator. */
  PLUS
}
