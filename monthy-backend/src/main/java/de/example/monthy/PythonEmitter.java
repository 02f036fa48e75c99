package de.example.monthy;

import java.util.ArrayList;
import java.util.List;

public final class PythonEmitter {
  private final IndentUnit unit;
  private final List<String> lines = new ArrayList<>();
  private int indent = 0;

  public PythonEmitter(IndentUnit unit) {
    this.unit = unit;
  }

  public void line(String s) {
    lines.add(unit.times(indent) + s);
  }

  public void indent() {
    indent++;
  }

  public void dedent() {
    indent = Math.max(0, indent - 1);
  }

  public void reset() {
    lines.clear();
    indent = 0;
  }

  /** All lines joined with {@code \n}, always ending in exactly one newline. */
  public String finish() {
    return String.join("\n", lines) + "\n";
  }
}
