package de.example.js2py;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code function (...) {...}} or arrow function located in a token window.
 * {@code end} is exclusive. When the body is a single return expression,
 * {@code returnFrom}/{@code returnTo} delimit that expression (ending at its last
 * code token) and {@code comments} holds the comments between it and the closing
 * brace; otherwise both bounds are -1.
 */
record FunctionLiteral(String name, List<String> params, int start, int end, int returnFrom, int returnTo,
                       List<Token> comments) {

  boolean singleReturn() {
    return returnFrom >= 0;
  }

  static boolean mayStart(Token t) {
    return t.isKeyword("function") || t.kind() == TokenKind.IDENTIFIER || t.is("(");
  }

  /** Parses a function literal starting at {@code i}; null when there is none. */
  static FunctionLiteral parse(List<Token> t, int i, int to) {
    Token tok = t.get(i);

    if (tok.isKeyword("function")) {
      int j = Tokens.next(t, i + 1, to);
      String name = null;
      if (j < to && t.get(j).kind() == TokenKind.IDENTIFIER) {
        name = t.get(j).text();
        j = Tokens.next(t, j + 1, to);
      }
      if (j >= to || !t.get(j).is("(")) return null;
      int close = Tokens.matching(t, j);
      int brace = Tokens.next(t, close + 1, to);
      if (brace >= to || !t.get(brace).is("{")) return null;
      return block(name, params(t, j + 1, close), t, i, brace);
    }

    if (tok.kind() == TokenKind.IDENTIFIER) {
      int arrow = Tokens.next(t, i + 1, to);
      if (arrow >= to || !t.get(arrow).is("=>")) return null;
      return arrow(List.of(tok.text()), t, i, arrow, to);
    }

    if (tok.is("(")) {
      int close = Tokens.matching(t, i);
      int arrow = Tokens.next(t, close + 1, to);
      if (arrow >= to || !t.get(arrow).is("=>")) return null;
      return arrow(params(t, i + 1, close), t, i, arrow, to);
    }
    return null;
  }

  // =========================================================
  // Bodies
  // =========================================================
  private static FunctionLiteral arrow(List<String> params, List<Token> t, int start, int arrow, int to) {
    int body = Tokens.next(t, arrow + 1, to);
    if (body < to && t.get(body).is("{")) return block(null, params, t, start, body);

    int end = Math.max(body, Tokens.prev(t, Tokens.expressionEnd(t, body, to)) + 1);
    return new FunctionLiteral(null, params, start, end, body, end, List.of());
  }

  private static FunctionLiteral block(String name, List<String> params, List<Token> t, int start, int brace) {
    int close = Tokens.matching(t, brace);
    int end = close + 1;

    int ret = Tokens.next(t, brace + 1, close);
    if (ret >= close || !t.get(ret).isKeyword("return") || !Tokens.isWhitespaceOnly(t, brace + 1, ret)) {
      return new FunctionLiteral(name, params, start, end, -1, -1, List.of());
    }

    int semi = Tokens.findTopLevel(t, ret + 1, close, ";");
    int exprEnd = semi < 0 ? close : semi;
    int rest = semi < 0 ? close : semi + 1;
    if (Tokens.next(t, rest, close) < close) {
      return new FunctionLiteral(name, params, start, end, -1, -1, List.of());
    }

    int from = Tokens.skipSpaces(t, ret + 1, exprEnd);
    int to = Math.max(from, Tokens.prev(t, exprEnd) + 1);
    return new FunctionLiteral(name, params, start, end, from, to, Tokens.comments(t, to, close));
  }

  private static List<String> params(List<Token> t, int from, int to) {
    List<String> out = new ArrayList<>();
    if (Tokens.next(t, from, to) >= to) return out;

    for (int[] p : Tokens.splitTopLevel(t, from, to, ",")) {
      int k = Tokens.next(t, p[0], p[1]);
      if (k >= p[1] || t.get(k).kind() != TokenKind.IDENTIFIER || Tokens.next(t, k + 1, p[1]) < p[1]) {
        throw new UnsupportedConstructException(UnsupportedCategory.FUNCTION_PARAMETERS);
      }
      out.add(t.get(k).text());
    }
    return out;
  }
}
