package de.example.monthy;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a comment-free, trimmed, non-empty line to its {@link LineShape}. Rules are tried in a fixed
 * order and the first match wins; keywords are case-insensitive. {@code \s} also matches Unicode
 * spaces such as U+00A0, identifiers stay ASCII.
 */
public final class LineClassifier {

  private static final String IDENT = "[A-Za-z_][A-Za-z0-9_]*";
  private static final Pattern IDENTIFIER = Pattern.compile(IDENT);

  // trailing ':' is optional on every block opener
  private static final String OPT_COLON = "(?::\\s*|\\s*)$";

  private static final Pattern END = p("^end$");
  private static final Pattern SAY_INTERPOLATED = p("^say:\\s*(.*)$");
  private static final Pattern SAY = p("^say\\s+(.+)$");
  private static final Pattern IF_THEN = p("^if\\s+(.+?)\\s+then\\s+(.+)$");
  private static final Pattern IF_BLOCK = p("^if\\s+(.+?)" + OPT_COLON);
  private static final Pattern REPEAT = p("^repeat\\s+(.+?)\\s+times(?:\\s+do)?" + OPT_COLON);
  private static final Pattern DEF = p("^def\\s+(" + IDENT + ")\\s*(.*?)" + OPT_COLON);
  private static final Pattern DEF_PREFIX = p("^def\\s+(\\S+).*$");
  private static final Pattern RETURN = p("^return\\s+(.+)$");
  private static final Pattern ASSIGNMENT = p("^(" + IDENT + ")\\s+is\\s+(.+)$");

  /**
   * @param line comment-stripped and trimmed line
   * @param raw  the line as written, used for passthrough
   */
  public LineShape classify(String line, String raw) {
    if (END.matcher(line).matches()) {
      return new LineShape.End();
    }

    Matcher m = SAY_INTERPOLATED.matcher(line);
    if (m.matches()) return new LineShape.SayInterpolated(m.group(1));

    m = SAY.matcher(line);
    if (m.matches()) return new LineShape.Say(m.group(1));

    m = IF_THEN.matcher(line);
    if (m.matches()) return new LineShape.IfThen(m.group(1), m.group(2).strip());

    m = IF_BLOCK.matcher(line);
    if (m.matches()) return new LineShape.IfBlock(m.group(1));

    m = REPEAT.matcher(line);
    if (m.matches()) return new LineShape.Repeat(m.group(1));

    m = DEF.matcher(line);
    if (m.matches()) return new LineShape.Def(m.group(1), defArgs(m.group(1), m.group(2)));

    m = DEF_PREFIX.matcher(line);
    if (m.matches()) {
      throw new CompileException(CompileException.Kind.MALFORMED_LINE,
          "Invalid function name '" + m.group(1) + "' in def");
    }

    m = RETURN.matcher(line);
    if (m.matches()) return new LineShape.Return(m.group(1));

    m = ASSIGNMENT.matcher(line);
    if (m.matches()) return new LineShape.Assignment(m.group(1), m.group(2));

    return new LineShape.Passthrough(raw == null ? line : raw.strip());
  }

  private List<String> defArgs(String name, String argText) {
    List<String> args = new ArrayList<>();
    for (String a : argText.strip().split("\\s+")) {
      if (a.isEmpty()) continue;
      if (!IDENTIFIER.matcher(a).matches()) {
        throw new CompileException(CompileException.Kind.MALFORMED_LINE,
            "Invalid argument '" + a + "' in def " + name);
      }
      args.add(a);
    }
    return args;
  }

  private static Pattern p(String regex) {
    return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
  }
}
