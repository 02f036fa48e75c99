package de.example.monthy;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LineClassifierTest {

  private final LineClassifier classifier = new LineClassifier();

  private LineShape classify(String line) {
    return classifier.classify(line, line);
  }

  @Test
  void endIsCaseInsensitive() {
    assertInstanceOf(LineShape.End.class, classify("END"));
  }

  @Test
  void sayColonWinsOverPlainSay() {
    assertEquals(new LineShape.SayInterpolated("hello {name}"), classify("say: hello {name}"));
    assertEquals(new LineShape.Say("x plus 1"), classify("Say x plus 1"));
  }

  @Test
  void inlineIfBeforeBlockIf() {
    assertEquals(new LineShape.IfThen("a is at least 5", "say a"), classify("if a is at least 5 then say a"));
    assertEquals(new LineShape.IfBlock("x equals 1"), classify("if x equals 1"));
    assertEquals(new LineShape.IfBlock("x equals 1"), classify("IF x equals 1:"));
  }

  @Test
  void repeatVariants() {
    assertEquals(new LineShape.Repeat("3"), classify("repeat 3 times"));
    assertEquals(new LineShape.Repeat("n plus 1"), classify("repeat n plus 1 times do"));
    assertEquals(new LineShape.Repeat("n"), classify("repeat n times:"));
  }

  @Test
  void defWithArgs() {
    assertEquals(new LineShape.Def("add", List.of("a", "b")), classify("def add a b:"));
    assertEquals(new LineShape.Def("main", List.of()), classify("def main"));
  }

  @Test
  void defWithInvalidArgumentIsMalformed() {
    CompileException e = assertThrows(CompileException.class, () -> classify("def f(x):"));
    assertEquals(CompileException.Kind.MALFORMED_LINE, e.kind());
  }

  @Test
  void defWithInvalidNameIsMalformed() {
    CompileException e = assertThrows(CompileException.class, () -> classify("def 2fast x"));
    assertEquals(CompileException.Kind.MALFORMED_LINE, e.kind());
  }

  @Test
  void returnAndAssignment() {
    assertEquals(new LineShape.Return("a plus b"), classify("return a plus b"));
    assertEquals(new LineShape.Assignment("total", "3 plus 4"), classify("total is 3 plus 4"));
  }

  @Test
  void everythingElseIsPassthroughOfTheRawLine() {
    LineShape shape = classifier.classify("import math", "  import math  # stdlib");
    assertEquals(new LineShape.Passthrough("import math  # stdlib"), shape);
    assertInstanceOf(LineShape.Passthrough.class, classify("print(len([1, 2]))"));
    assertInstanceOf(LineShape.Passthrough.class, classify("saying hello"));
  }
}
