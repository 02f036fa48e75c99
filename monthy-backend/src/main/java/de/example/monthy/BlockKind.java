package de.example.monthy;

/** Kind of block that is open and waiting for its {@code end}. */
public enum BlockKind {
  IF("if"),
  REPEAT("repeat"),
  DEF("def");

  private final String tag;

  BlockKind(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }
}
