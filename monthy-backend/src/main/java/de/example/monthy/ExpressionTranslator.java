package de.example.monthy;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites pseudo-English expression fragments into Python expression syntax.
 *
 * <p>Plain substring replacement, no parsing: a variable literally named {@code equals} is
 * rewritten like the comparator.
 */
public final class ExpressionTranslator {

  private record Literal(String word, String python) {}

  private record Phrase(Pattern pattern, String python) {
    static Phrase of(String words, String python) {
      return new Phrase(Pattern.compile("\\b" + words + "\\b",
          Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS),
          Matcher.quoteReplacement(python));
    }
  }

  private static final List<Literal> WORD_OPS = List.of(
      new Literal(" plus ", " + "),
      new Literal(" minus ", " - "),
      new Literal(" times ", " * "),
      new Literal(" over ", " / ")
  );

  // "not equals" must run before "equals"
  private static final List<Phrase> COMPARATORS = List.of(
      Phrase.of("is at least", ">="),
      Phrase.of("is at most", "<="),
      Phrase.of("is greater than", ">"),
      Phrase.of("is less than", "<"),
      Phrase.of("not equals", "!="),
      Phrase.of("equals", "==")
  );

  private static final List<Literal> LITERALS = List.of(
      new Literal(" true ", " True "),
      new Literal(" false ", " False "),
      new Literal(" null ", " None ")
  );

  public String toPython(String expr) {
    if (expr == null) return "";

    String s = " " + expr + " ";
    for (Literal op : WORD_OPS) {
      s = s.replace(op.word(), op.python());
    }
    for (Phrase cmp : COMPARATORS) {
      s = cmp.pattern().matcher(s).replaceAll(cmp.python());
    }
    for (Literal lit : LITERALS) {
      s = s.replace(lit.word(), lit.python());
    }
    return s.strip();
  }

  /** Rewritten text escaped for the body of a double-quoted f-string. */
  public String toFStringBody(String text) {
    return toPython(text).replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
