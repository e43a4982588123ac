package de.example.js2py;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementGrouperTest {

  private final Tokenizer tokenizer = new Tokenizer();
  private final StatementGrouper grouper = new StatementGrouper();

  private List<Statement> group(String src) {
    return grouper.group(tokenizer.tokenize(src), src);
  }

  private static String text(Statement s) {
    return Tokens.text(s.tokens(), 0, s.tokens().size());
  }

  @Test
  void terminatorsSplitStatementsOnOneLine() {
    List<Statement> statements = group("var a = 1; var b = 2;");

    assertThat(statements).extracting(StatementGrouperTest::text).containsExactly("var a = 1", "var b = 2");
    assertThat(statements.get(1).start()).isEqualTo(11);
    assertThat(statements.get(1).end()).isEqualTo(21);
  }

  @Test
  void chainBrokenBeforeDotStaysOneStatement() {
    String src = "var c = ee.ImageCollection('X')\n  .filterDate('a', 'b')\n  .sort('t');\nprint(c);";

    List<Statement> statements = group(src);

    assertThat(statements).hasSize(2);
    assertThat(text(statements.get(0))).isEqualTo("var c = ee.ImageCollection('X')\n  .filterDate('a', 'b')\n  .sort('t')");
  }

  @Test
  void openBracketsContinueAcrossLines() {
    List<Statement> statements = group("Map.addLayer(img, {\n  min: 0\n}, 'x')\nprint(img)");

    assertThat(statements).extracting(StatementGrouperTest::text)
        .containsExactly("Map.addLayer(img, {\n  min: 0\n}, 'x')", "print(img)");
  }

  @Test
  void trailingOperatorContinuesStatement() {
    assertThat(group("var x = a +\n  b\nprint(x)")).hasSize(2);
  }

  @Test
  void controlHeaderWaitsForItsBody() {
    assertThat(group("if (x)\n  print(x);")).hasSize(1);
    assertThat(group("if (x) {\n  print(x);\n}\nelse {\n  print(y);\n}")).hasSize(1);
  }

  @Test
  void commentAfterTerminatorTrailsThatStatement() {
    List<Statement> statements = group("foo(); // done\nbar();");

    assertThat(statements).hasSize(2);
    assertThat(statements.get(0).trailingComment().text()).isEqualTo("// done");
    assertThat(statements.get(0).commentGap()).isEqualTo(" ");
    assertThat(statements.get(1).trailingComment()).isNull();
  }

  @Test
  void commentAtEndOfUnterminatedLineTrailsIt() {
    List<Statement> statements = group("foo()   // done\nbar()");

    assertThat(text(statements.get(0))).isEqualTo("foo()");
    assertThat(statements.get(0).trailingComment().text()).isEqualTo("// done");
    assertThat(statements.get(0).commentGap()).isEqualTo("   ");
  }

  @Test
  void standaloneCommentsAndBlankLinesAreKept() {
    List<Statement> statements = group("a()\n\n\n// c\nb()");

    assertThat(statements).hasSize(3);
    assertThat(statements.get(1).isComment()).isTrue();
    assertThat(statements).extracting(Statement::blankLinesBefore).containsExactly(0, 2, 0);
  }

  @Test
  void commentBetweenChainLinksIsAbsorbed() {
    List<Statement> statements = group("var c = a\n  // keep going\n  .b();");

    assertThat(statements).hasSize(1);
  }

  @Test
  void functionDeclarationEndsAtItsClosingBrace() {
    List<Statement> statements = group("function f(a) { return a; } f(1); // call");

    assertThat(statements).extracting(StatementGrouperTest::text)
        .containsExactly("function f(a) { return a; }", "f(1)");
    assertThat(statements.get(1).trailingComment().text()).isEqualTo("// call");
  }

  @Test
  void definitionHeaderJoinsItsReturnLine() {
    List<Statement> statements = group("def f(x):\n    return x.add(1)\nprint(f(1))");

    assertThat(statements).extracting(StatementGrouperTest::text)
        .containsExactly("def f(x):\n    return x.add(1)", "print(f(1))");
  }

  @Test
  void rejectsUnclosedBrace() {
    assertThatThrownBy(() -> group("var d = ee.Dictionary({a: 1;"))
        .isInstanceOf(SnippetSyntaxException.class)
        .hasMessageContaining("'{' is never closed")
        .satisfies(e -> assertThat(((SnippetSyntaxException) e).getColumn()).isEqualTo(23));
  }

  @Test
  void rejectsStrayOrMismatchedClosers() {
    assertThatThrownBy(() -> group("foo())"))
        .isInstanceOf(SnippetSyntaxException.class)
        .hasMessageContaining("unexpected ')'");
    assertThatThrownBy(() -> group("foo([1)"))
        .isInstanceOf(SnippetSyntaxException.class);
  }
}
