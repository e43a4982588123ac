package de.example.js2py;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies the statement-level rules (declarations, function definitions,
 * assignments, comments) to one grouped {@link Statement}. A statement that
 * uses an unsupported construct comes back untouched and flagged.
 */
public final class StatementRewriter {
  private final ExpressionRewriter expr;

  public StatementRewriter(ExpressionRewriter expr) {
    this.expr = expr;
  }

  public List<RewrittenStatement> rewrite(Statement s, TranslationContext ctx) {
    if (s.isComment()) {
      RewrittenStatement c = RewrittenStatement.comment(
          DialectRules.convertComment(s.tokens().get(0).text()), s.blankLinesBefore());
      return List.of(trailing(c, s));
    }

    try {
      List<RewrittenStatement> out = new ArrayList<>(rewriteCode(s.tokens(), ctx));
      out.set(0, out.get(0).withBlankLinesBefore(s.blankLinesBefore()));
      int last = out.size() - 1;
      out.set(last, trailing(out.get(last), s));
      return out;
    } catch (UnsupportedConstructException e) {
      ctx.warn(e.category(), s);
      String original = ctx.source().substring(lineStart(ctx.source(), s.start()), s.end());
      return List.of(RewrittenStatement.unsupported(original, e.category(), s.blankLinesBefore()));
    }
  }

  // =========================================================
  // Statement forms
  // =========================================================
  private List<RewrittenStatement> rewriteCode(List<Token> t, TranslationContext ctx) {
    int first = Tokens.next(t, 0);
    Token head = t.get(first);

    if (head.kind() == TokenKind.KEYWORD) {
      if (DialectRules.isDeclarationKeyword(head.text())) return declaration(t, first + 1, ctx);
      if (head.isKeyword("function")) return List.of(functionDeclaration(t, first, ctx));
      Optional<UnsupportedCategory> unsupported = DialectRules.unsupportedKeyword(head.text());
      if (unsupported.isPresent()) throw new UnsupportedConstructException(unsupported.get());
    }

    if (head.kind() == TokenKind.IDENTIFIER && head.text().equals("def")) {
      RewrittenStatement def = targetDefinition(t, first, ctx);
      if (def != null) return List.of(def);
    }

    int second = Tokens.next(t, first + 1);
    if (head.kind() == TokenKind.IDENTIFIER && second < t.size() && t.get(second).is(":")) {
      throw new UnsupportedConstructException(UnsupportedCategory.LABELED_STATEMENT);
    }
    return List.of(assignmentOrExpression(t, first, t.size(), ctx));
  }

  /** {@code var a = 1, b;} becomes one assignment per declarator. */
  private List<RewrittenStatement> declaration(List<Token> t, int from, TranslationContext ctx) {
    List<RewrittenStatement> out = new ArrayList<>();
    boolean declared = false;
    for (int[] p : Tokens.splitTopLevel(t, from, t.size(), ",")) {
      int name = Tokens.next(t, p[0], p[1]);
      carryComments(t, p[0], name, out);
      if (name >= p[1]) continue;
      if (t.get(name).kind() != TokenKind.IDENTIFIER) {
        throw new UnsupportedConstructException(UnsupportedCategory.DESTRUCTURING);
      }
      declared = true;

      int eq = Tokens.next(t, name + 1, p[1]);
      if (eq >= p[1]) {
        out.add(RewrittenStatement.code(t.get(name).text() + " = ", "None", false));
        continue;
      }
      if (!t.get(eq).is("=")) throw new UnsupportedConstructException(UnsupportedCategory.DESTRUCTURING);
      out.add(assignment(t, name, eq, p[1], ctx));
    }
    if (!declared) throw new UnsupportedConstructException(UnsupportedCategory.DESTRUCTURING);
    return out;
  }

  /**
   * Comments ahead of a declarator name. One on the line of the previous
   * declarator trails its assignment; any other becomes a comment line.
   */
  private void carryComments(List<Token> t, int from, int to, List<RewrittenStatement> out) {
    for (int i = from; i < to; i++) {
      if (t.get(i).kind() != TokenKind.COMMENT) continue;
      String comment = DialectRules.convertComment(t.get(i).text());
      int last = out.size() - 1;
      if (last >= 0 && !Tokens.hasNewline(t, from, i)) {
        String gap = Tokens.text(t, Tokens.trimEnd(t, from, i), i);
        out.set(last, out.get(last).appendTrailingComment(comment, gap));
      } else {
        out.add(RewrittenStatement.comment(comment, 0));
      }
    }
  }

  private RewrittenStatement functionDeclaration(List<Token> t, int first, TranslationContext ctx) {
    FunctionLiteral fn = FunctionLiteral.parse(t, first, t.size());
    if (fn == null || fn.name() == null || Tokens.next(t, fn.end()) < t.size()) {
      throw new UnsupportedConstructException(UnsupportedCategory.CALLBACK_POSITION);
    }
    return definition(fn.name(), fn, t, t.size(), ctx);
  }

  /**
   * A {@code def name(params):} header with an indented {@code return} line is
   * already target text; the header is kept and the returned expression rewritten.
   * Null when the tokens do not have that shape.
   */
  private RewrittenStatement targetDefinition(List<Token> t, int first, TranslationContext ctx) {
    int name = Tokens.next(t, first + 1);
    if (name >= t.size() || t.get(name).kind() != TokenKind.IDENTIFIER) return null;
    int open = Tokens.next(t, name + 1);
    if (open >= t.size() || !t.get(open).is("(")) return null;
    int colon = Tokens.next(t, Tokens.matching(t, open) + 1);
    if (colon >= t.size() || !t.get(colon).is(":")) return null;
    int ret = Tokens.next(t, colon + 1);
    if (ret >= t.size() || !t.get(ret).isKeyword("return") || !Tokens.hasNewline(t, colon + 1, ret)) return null;

    int newline = colon + 1;
    while (!t.get(newline).isNewline()) newline++;
    String header = Tokens.text(t, first, Tokens.trimEnd(t, first, newline));

    int from = Tokens.skipSpaces(t, ret + 1, t.size());
    int to = Tokens.trimEnd(t, from, t.size());
    String returned = from < to ? expr.rewrite(t, from, to, ctx) : "None";
    return RewrittenStatement.function(header, returned, Tokens.hasTopLevelNewline(t, from, to));
  }

  private RewrittenStatement assignmentOrExpression(List<Token> t, int from, int to, TranslationContext ctx) {
    int eq = Tokens.findTopLevel(t, from, to, "=");
    if (eq < 0) {
      return RewrittenStatement.code("", expr.rewrite(t, from, to, ctx), Tokens.hasTopLevelNewline(t, from, to));
    }
    return assignment(t, from, eq, to, ctx);
  }

  /** {@code target = value}; a function literal assigned to a plain name becomes a {@code def}. */
  private RewrittenStatement assignment(List<Token> t, int from, int eq, int to, TranslationContext ctx) {
    int value = Tokens.skipSpaces(t, eq + 1, to);
    int valueStart = Tokens.next(t, value, to);

    int target = Tokens.next(t, from, eq);
    boolean plainName = t.get(target).kind() == TokenKind.IDENTIFIER && Tokens.next(t, target + 1, eq) == eq;
    if (plainName && valueStart < to && FunctionLiteral.mayStart(t.get(valueStart))) {
      FunctionLiteral fn = FunctionLiteral.parse(t, valueStart, to);
      if (fn != null && Tokens.next(t, fn.end(), to) >= to) {
        return definition(t.get(target).text(), fn, t, to, ctx);
      }
    }

    String head = expr.rewrite(t, from, eq, ctx) + "=" + Tokens.text(t, eq + 1, value);
    return RewrittenStatement.code(head, expr.rewrite(t, value, to, ctx), Tokens.hasTopLevelNewline(t, value, to));
  }

  /** Comments left after the returned expression trail the {@code return} line. */
  private RewrittenStatement definition(String name, FunctionLiteral fn, List<Token> t, int to, TranslationContext ctx) {
    if (!fn.singleReturn()) throw new UnsupportedConstructException(UnsupportedCategory.MULTI_STATEMENT_FUNCTION);

    String header = "def " + name + "(" + String.join(", ", fn.params()) + "):";
    boolean chained = fn.returnFrom() < fn.returnTo() && Tokens.hasTopLevelNewline(t, fn.returnFrom(), fn.returnTo());
    RewrittenStatement def = RewrittenStatement.function(header, expr.returned(t, fn, ctx), chained);

    List<Token> comments = new ArrayList<>(fn.comments());
    comments.addAll(Tokens.comments(t, fn.end(), to));
    for (Token c : comments) def = def.appendTrailingComment(DialectRules.convertComment(c.text()), "");
    return def;
  }

  private RewrittenStatement trailing(RewrittenStatement r, Statement s) {
    if (s.trailingComment() == null) return r;
    return r.appendTrailingComment(DialectRules.convertComment(s.trailingComment().text()), s.commentGap());
  }

  /** Start of the statement's line when only indentation precedes it there. */
  private int lineStart(String source, int start) {
    int line = source.lastIndexOf('\n', start - 1) + 1;
    return source.substring(line, start).isBlank() ? line : start;
  }
}
