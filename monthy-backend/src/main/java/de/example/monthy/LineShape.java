package de.example.monthy;

import java.util.List;

/**
 * The shape of one source line, as decided by {@link LineClassifier}.
 * Text fields hold the Monthy text before expression rewriting.
 */
public sealed interface LineShape {

  /** Opens a block that stays open until a matching {@code end}. */
  sealed interface Opener extends LineShape {
    BlockKind kind();
  }

  record End() implements LineShape {}

  record SayInterpolated(String text) implements LineShape {}

  record Say(String expr) implements LineShape {}

  record IfThen(String condition, String statement) implements LineShape {}

  record IfBlock(String condition) implements Opener {
    @Override
    public BlockKind kind() {
      return BlockKind.IF;
    }
  }

  record Repeat(String count) implements Opener {
    @Override
    public BlockKind kind() {
      return BlockKind.REPEAT;
    }
  }

  record Def(String name, List<String> args) implements Opener {
    public Def {
      args = List.copyOf(args);
    }

    @Override
    public BlockKind kind() {
      return BlockKind.DEF;
    }
  }

  record Return(String expr) implements LineShape {}

  record Assignment(String name, String expr) implements LineShape {}

  /** Host-language text emitted as-is. */
  record Passthrough(String raw) implements LineShape {}
}
