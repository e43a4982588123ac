package de.example.js2py;

import java.util.List;

/**
 * Re-spells bracket-matched object and array literals. Entries are rewritten
 * through {@link ExpressionRewriter}, so nested literals are normalized first
 * and the enclosing literal is assembled from their output.
 */
public final class LiteralReformatter {
  private final ExpressionRewriter expr;

  public LiteralReformatter(ExpressionRewriter expr) {
    this.expr = expr;
  }

  /** {@code t[open]} is '{' and {@code t[close]} its matching '}'. */
  public String object(List<Token> t, int open, int close, TranslationContext ctx) {
    return assemble("{", "}", t, open, close, ctx, true);
  }

  /** {@code t[open]} is '[' and {@code t[close]} its matching ']'. */
  public String array(List<Token> t, int open, int close, TranslationContext ctx) {
    return assemble("[", "]", t, open, close, ctx, false);
  }

  private String assemble(String open, String close, List<Token> t, int from, int to,
                          TranslationContext ctx, boolean keyed) {
    List<int[]> parts = Tokens.splitTopLevel(t, from + 1, to, ",");
    int last = parts.size() - 1;
    boolean trailingComma = last > 0 && isEmpty(t, parts.get(last));

    StringBuilder sb = new StringBuilder(open);
    for (int k = 0; k <= last; k++) {
      int[] p = parts.get(k);

      if (k == last && trailingComma) {
        if (DialectRules.TRAILING_COMMA) sb.append(",");
        // blank remainder on the same line goes away together with the comma
        if (DialectRules.TRAILING_COMMA || Tokens.hasNewline(t, p[0], p[1])) {
          sb.append(expr.rewrite(t, p[0], p[1], ctx));
        }
        break;
      }

      if (isEmpty(t, p) && last > 0) throw new UnsupportedConstructException(UnsupportedCategory.SPARSE_ARRAY);
      if (k > 0) sb.append(",");

      int end = p[1];
      String suffix = "";
      if (k == last && DialectRules.TRAILING_COMMA && !isEmpty(t, p) && Tokens.hasNewline(t, p[0], p[1])) {
        end = Tokens.trimEnd(t, p[0], p[1]);
        suffix = "," + Tokens.text(t, end, p[1]);
      }
      sb.append(keyed ? entry(t, p[0], end, ctx) : expr.rewrite(t, p[0], end, ctx)).append(suffix);
    }
    return sb.append(close).toString();
  }

  /** One {@code key: value} entry; bare keys are quoted, shorthand entries expanded. */
  private String entry(List<Token> t, int from, int to, TranslationContext ctx) {
    int k = Tokens.next(t, from, to);
    if (k >= to) return expr.rewrite(t, from, to, ctx);

    Token key = t.get(k);
    if (key.is("...")) throw new UnsupportedConstructException(UnsupportedCategory.SPREAD);
    String lead = expr.rewrite(t, from, k, ctx);

    int colon = Tokens.next(t, k + 1, to);
    if (colon >= to) {
      if (key.kind() != TokenKind.IDENTIFIER) throw new UnsupportedConstructException(UnsupportedCategory.OBJECT_KEY);
      return lead + DialectRules.quoteKey(key.text()) + ": " + key.text() + expr.rewrite(t, k + 1, to, ctx);
    }
    if (!t.get(colon).is(":")) throw new UnsupportedConstructException(UnsupportedCategory.OBJECT_KEY);

    String keyText = switch (key.kind()) {
      case IDENTIFIER, KEYWORD -> DialectRules.quoteKey(key.text());
      case NUMBER -> key.text();
      case STRING -> {
        if (key.text().startsWith("`")) throw new UnsupportedConstructException(UnsupportedCategory.OBJECT_KEY);
        yield key.text();
      }
      default -> throw new UnsupportedConstructException(UnsupportedCategory.OBJECT_KEY);
    };
    return lead + keyText + Tokens.text(t, k + 1, colon) + ":" + expr.rewrite(t, colon + 1, to, ctx);
  }

  private boolean isEmpty(List<Token> t, int[] part) {
    return Tokens.next(t, part[0], part[1]) >= part[1];
  }
}
