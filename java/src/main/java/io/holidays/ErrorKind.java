package io.holidays;

/** The type of error raised while reading an observed rule from text. */
public enum ErrorKind {
  /** Lexer error - invalid characters or words in the rule text. */
  LEX("lex"),
  /** Parser error - invalid rule structure or unknown rule name. */
  PARSE("parse");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
