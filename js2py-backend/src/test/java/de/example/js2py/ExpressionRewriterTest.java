package de.example.js2py;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionRewriterTest {

  private final Tokenizer tokenizer = new Tokenizer();
  private final ExpressionRewriter rewriter = new ExpressionRewriter();

  private String rewrite(String src) {
    List<Token> tokens = tokenizer.tokenize(src);
    return rewriter.rewrite(tokens, 0, tokens.size(), new TranslationContext(src));
  }

  private UnsupportedCategory rejected(String src) {
    try {
      rewrite(src);
    } catch (UnsupportedConstructException e) {
      return e.category();
    }
    throw new AssertionError("expected " + src + " to be rejected");
  }

  @Test
  void respellsLogicalOperators() {
    assertThat(rewrite("a && !b || c === d")).isEqualTo("a and not b or c == d");
    assertThat(rewrite("a&&b")).isEqualTo("a and b");
    assertThat(rewrite("!(a !== b)")).isEqualTo("not (a != b)");
  }

  @Test
  void renamesMapCallsOnly() {
    assertThat(rewrite("Map.addLayer(x)")).isEqualTo("Map.add_ee_layer(x)");
    assertThat(rewrite("Map.centerObject(x, 9)")).isEqualTo("Map.center_object(x, 9)");
    assertThat(rewrite("layers.addLayer(x)")).isEqualTo("layers.addLayer(x)");
    assertThat(rewrite("foo.Map.addLayer(x)")).isEqualTo("foo.Map.addLayer(x)");
    assertThat(rewrite("f = Map.addLayer")).isEqualTo("f = Map.addLayer");
  }

  @Test
  void remoteApiNamesPassThrough() {
    String src = "image.normalizedDifference(['B8', 'B4']).reduceRegion(ee.Reducer.mean(), geom, 30)";

    assertThat(rewrite(src)).isEqualTo(src);
  }

  @Test
  void dropsNew() {
    assertThat(rewrite("new ee.Image(1)")).isEqualTo("ee.Image(1)");
  }

  @Test
  void singleReturnCallbackBecomesLambda() {
    assertThat(rewrite("col.map(function(img) { return img.clip(geom); })"))
        .isEqualTo("col.map(lambda img: img.clip(geom))");
    assertThat(rewrite("col.filter(function (f) {\n  return f.get('a');\n})"))
        .isEqualTo("col.filter(lambda f: f.get('a'))");
  }

  @Test
  void arrowCallbacksBecomeLambdas() {
    assertThat(rewrite("col.map(img => img.clip(geom))")).isEqualTo("col.map(lambda img: img.clip(geom))");
    assertThat(rewrite("list.map((n) => ee.Number(n).multiply(2))"))
        .isEqualTo("list.map(lambda n: ee.Number(n).multiply(2))");
    assertThat(rewrite("col.map(() => { return 1; })")).isEqualTo("col.map(lambda: 1)");
  }

  @Test
  void commentAfterCallbackReturnMovesClosingBracketToNextLine() {
    assertThat(rewrite("col.map(function(img) {\n  return img.clip(geom) // keep\n})"))
        .isEqualTo("col.map(lambda img: img.clip(geom)  # keep\n)");
    assertThat(rewrite("col.map(function(img) { return img; /* as is */ })"))
        .isEqualTo("col.map(lambda img: img  # as is\n)");
    assertThat(rewrite("col.map(img => img.clip(geom) // keep\n)"))
        .isEqualTo("col.map(lambda img: img.clip(geom) # keep\n)");
  }

  @Test
  void callbackBodiesAreRewrittenToo() {
    assertThat(rewrite("col.map(function(f) { return f.set({valid: true}); })"))
        .isEqualTo("col.map(lambda f: f.set({'valid': True}))");
  }

  @Test
  void flagsCallbacksOutsideTheSupportedSubset() {
    assertThat(rejected("col.map(function(i) { var x = i; return x; })"))
        .isEqualTo(UnsupportedCategory.MULTI_STATEMENT_FUNCTION);
    assertThat(rejected("col.evaluate(function(r) { return r; })"))
        .isEqualTo(UnsupportedCategory.CALLBACK_POSITION);
    assertThat(rejected("col.iterate(function(a, b) { return a; }, first)"))
        .isEqualTo(UnsupportedCategory.CALLBACK_POSITION);
    assertThat(rejected("col.map(function(a = 1) { return a; })"))
        .isEqualTo(UnsupportedCategory.FUNCTION_PARAMETERS);
  }

  @Test
  void flagsConstructsWithoutTargetEquivalent() {
    assertThat(rejected("a ? b : c")).isEqualTo(UnsupportedCategory.CONDITIONAL_EXPRESSION);
    assertThat(rejected("i++")).isEqualTo(UnsupportedCategory.UPDATE_OPERATOR);
    assertThat(rejected("`band ${b}`")).isEqualTo(UnsupportedCategory.TEMPLATE_LITERAL);
    assertThat(rejected("typeof x")).isEqualTo(UnsupportedCategory.KEYWORD);
    assertThat(rejected("a?.b")).isEqualTo(UnsupportedCategory.OPERATOR);
    assertThat(rejected("f(/* why */ 1)")).isEqualTo(UnsupportedCategory.INLINE_BLOCK_COMMENT);
  }

  @Test
  void renameLookupsAreCachedPerContext() {
    String src = "Map.addLayer(a); Map.addLayer(b)";
    List<Token> tokens = tokenizer.tokenize(src);
    TranslationContext ctx = new TranslationContext(src);

    assertThat(rewriter.rewrite(tokens, 0, tokens.size(), ctx))
        .isEqualTo("Map.add_ee_layer(a); Map.add_ee_layer(b)");
    assertThat(ctx.rename("Map", "addLayer")).isEqualTo("add_ee_layer");
  }
}
