package de.example.monthy;

import java.util.Objects;

/**
 * The exact string written once per nesting level of the generated Python.
 */
public record IndentUnit(String text) {

  public static final IndentUnit FOUR_SPACES = spaces(4);

  public IndentUnit {
    Objects.requireNonNull(text, "text");
  }

  public static IndentUnit spaces(int count) {
    return new IndentUnit(" ".repeat(Math.max(0, count)));
  }

  public static IndentUnit tab() {
    return new IndentUnit("\t");
  }

  public static IndentUnit of(int spaces, boolean tabs) {
    return tabs ? tab() : spaces(spaces);
  }

  public String times(int level) {
    return text.repeat(Math.max(0, level));
  }
}
