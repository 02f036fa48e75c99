package de.example.monthy;

/**
 * Performs the action of one classified line against the compiler state.
 */
public final class StatementTranslator {
  private final LineClassifier classifier;
  private final ExpressionTranslator expr;

  public StatementTranslator(LineClassifier classifier, ExpressionTranslator expr) {
    this.classifier = classifier;
    this.expr = expr;
  }

  /** Compiles one physical line. Blank and comment-only lines emit nothing. */
  public void emitLine(CompilerState state, String raw) {
    String line = raw == null ? "" : raw.strip();
    if (line.isEmpty()) return;
    line = CommentStripper.strip(line);
    if (line.isEmpty()) return;

    emitShape(state, classifier.classify(line, raw));
  }

  private void emitShape(CompilerState state, LineShape shape) {
    PythonEmitter out = state.out();

    if (shape instanceof LineShape.End) {
      state.close();
      return;
    }

    if (shape instanceof LineShape.SayInterpolated say) {
      out.line("print(f\"" + expr.toFStringBody(say.text()) + "\")");
      return;
    }

    if (shape instanceof LineShape.Say say) {
      out.line("print(" + expr.toPython(say.expr()) + ")");
      return;
    }

    if (shape instanceof LineShape.IfThen ifThen) {
      emitInlineIf(state, ifThen);
      return;
    }

    if (shape instanceof LineShape.IfBlock ifBlock) {
      out.line("if " + expr.toPython(ifBlock.condition()) + ":");
      state.open(ifBlock.kind());
      return;
    }

    if (shape instanceof LineShape.Repeat repeat) {
      out.line("for _ in range(int(" + expr.toPython(repeat.count()) + ")):");
      state.open(repeat.kind());
      return;
    }

    if (shape instanceof LineShape.Def def) {
      out.line("def " + def.name() + "(" + String.join(", ", def.args()) + "):");
      state.open(def.kind());
      return;
    }

    if (shape instanceof LineShape.Return ret) {
      out.line("return " + expr.toPython(ret.expr()));
      return;
    }

    if (shape instanceof LineShape.Assignment assign) {
      out.line(assign.name() + " = " + expr.toPython(assign.expr()));
      return;
    }

    if (shape instanceof LineShape.Passthrough pass) {
      out.line(pass.raw());
      return;
    }

    throw new IllegalStateException("Unhandled line shape: " + shape);
  }

  // if <cond> then <stmt>: open, compile <stmt> one level deeper, close again
  private void emitInlineIf(CompilerState state, LineShape.IfThen ifThen) {
    String stmt = CommentStripper.strip(ifThen.statement());
    LineShape inner = classifier.classify(stmt, ifThen.statement());
    if (inner instanceof LineShape.End || inner instanceof LineShape.Opener) {
      throw new CompileException(CompileException.Kind.MALFORMED_LINE,
          "'then' must be followed by a single statement, not a block keyword");
    }

    state.out().line("if " + expr.toPython(ifThen.condition()) + ":");
    state.open(BlockKind.IF);
    try {
      emitShape(state, inner);
    } finally {
      state.close();
    }
  }
}
