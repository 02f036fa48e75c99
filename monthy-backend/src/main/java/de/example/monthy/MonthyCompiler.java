package de.example.monthy;

import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-pass compiler from Monthy source to Python.
 *
 * <p>Block structure comes from {@code if}, {@code repeat} and {@code def} lines closed by
 * {@code end}; indentation in the input is ignored. An instance may be reused for any number of
 * {@link #compile} calls, each starting from a clean state, but is not safe for concurrent use.
 *
 * <pre>
 *   repeat 3 times          for _ in range(int(3)):
 *     say: hi {n}       =>      print(f"hi {n}")
 *   end
 * </pre>
 */
public final class MonthyCompiler {
  private static final Logger log = LoggerFactory.getLogger(MonthyCompiler.class);

  static final String DEFAULT_FILENAME = "<string>";

  // \r\n, \n, \r, VT, FF, FS, GS, RS, NEL, LINE SEPARATOR, PARAGRAPH SEPARATOR
  private static final Pattern LINE_BREAK =
      Pattern.compile("\\r\\n|[\\n\\r\\x0B\\f\\x1C\\x1D\\x1E\\x85\\u2028\\u2029]");

  private final IndentUnit indentUnit;
  private final CompilerState state;
  private final StatementTranslator statements;

  public MonthyCompiler() {
    this(IndentUnit.FOUR_SPACES);
  }

  public MonthyCompiler(IndentUnit indentUnit) {
    this.indentUnit = indentUnit == null ? IndentUnit.FOUR_SPACES : indentUnit;
    this.state = new CompilerState(this.indentUnit);
    this.statements = new StatementTranslator(new LineClassifier(), new ExpressionTranslator());
  }

  public IndentUnit indentUnit() {
    return indentUnit;
  }

  public String compile(String source) {
    return compile(source, null);
  }

  /**
   * @param source        Monthy source, any line endings
   * @param filenameLabel label used in error locations, {@code <string>} when null
   * @return the Python text, terminated by a single newline
   * @throws CompileException on the first malformed line or on unbalanced blocks
   */
  public String compile(String source, String filenameLabel) {
    state.reset();
    String where = filenameLabel == null ? DEFAULT_FILENAME : filenameLabel;
    List<String> lines = splitLines(source);

    for (int i = 0; i < lines.size(); i++) {
      try {
        statements.emitLine(state, lines.get(i));
      } catch (CompileException e) {
        throw e.at(where, i + 1);
      }
      log.trace("{}:{} -> depth {}", where, i + 1, state.depth());
    }

    if (state.hasOpenBlocks()) {
      throw new CompileException(CompileException.Kind.MISSING_END,
          "Missing 'end' for: " + state.describeOpenBlocks());
    }
    return state.out().finish();
  }

  /** Physical lines of {@code source}; a trailing line break does not start another line. */
  static List<String> splitLines(String source) {
    if (source == null || source.isEmpty()) return List.of();
    return List.of(LINE_BREAK.split(source));
  }
}
