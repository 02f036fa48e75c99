package de.example.monthy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Mutable state of one compilation run: emitted lines, indent level and the stack of open blocks.
 * The indent level always equals the stack depth once a line has been fully processed.
 */
public final class CompilerState {
  private final PythonEmitter out;
  private final Deque<BlockKind> blocks = new ArrayDeque<>();

  public CompilerState(IndentUnit unit) {
    this.out = new PythonEmitter(unit);
  }

  public PythonEmitter out() {
    return out;
  }

  public void open(BlockKind kind) {
    blocks.push(kind);
    out.indent();
  }

  public BlockKind close() {
    if (blocks.isEmpty()) {
      throw new CompileException(CompileException.Kind.UNEXPECTED_END, "'end' with no open block");
    }
    BlockKind kind = blocks.pop();
    out.dedent();
    return kind;
  }

  public int depth() {
    return blocks.size();
  }

  public boolean hasOpenBlocks() {
    return !blocks.isEmpty();
  }

  /** Open block kinds, outermost first. */
  public List<BlockKind> openBlocks() {
    List<BlockKind> outerFirst = new ArrayList<>(blocks.size());
    for (Iterator<BlockKind> it = blocks.descendingIterator(); it.hasNext(); ) {
      outerFirst.add(it.next());
    }
    return outerFirst;
  }

  public String describeOpenBlocks() {
    return openBlocks().stream().map(BlockKind::tag).collect(Collectors.joining(" > "));
  }

  public void reset() {
    out.reset();
    blocks.clear();
  }
}
