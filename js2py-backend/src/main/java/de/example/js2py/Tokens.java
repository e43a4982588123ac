package de.example.js2py;

import java.util.ArrayList;
import java.util.List;

/** Index helpers over a balanced token window. */
final class Tokens {

  private Tokens() {
  }

  static boolean isOpener(Token t) {
    return t.kind() == TokenKind.PUNCTUATION && (t.text().equals("(") || t.text().equals("[") || t.text().equals("{"));
  }

  static boolean isCloser(Token t) {
    return t.kind() == TokenKind.PUNCTUATION && (t.text().equals(")") || t.text().equals("]") || t.text().equals("}"));
  }

  static boolean closes(Token open, Token close) {
    return switch (open.text()) {
      case "(" -> close.text().equals(")");
      case "[" -> close.text().equals("]");
      default -> close.text().equals("}");
    };
  }

  /** First code token at or after {@code from} and before {@code to}; {@code to} if none. */
  static int next(List<Token> t, int from, int to) {
    int i = from;
    while (i < to && t.get(i).isTrivia()) i++;
    return i;
  }

  static int next(List<Token> t, int from) {
    return next(t, from, t.size());
  }

  /** Last code token before {@code before}; -1 if none. */
  static int prev(List<Token> t, int before) {
    int i = before - 1;
    while (i >= 0 && t.get(i).isTrivia()) i--;
    return i;
  }

  /** Index of the bracket closing the opener at {@code open}. */
  static int matching(List<Token> t, int open) {
    int depth = 0;
    for (int i = open; i < t.size(); i++) {
      Token tok = t.get(i);
      if (isOpener(tok)) depth++;
      else if (isCloser(tok) && --depth == 0) return i;
    }
    throw new IllegalStateException("unbalanced token window at " + t.get(open).position());
  }

  /** First depth-zero punctuation {@code text} in [from, to); -1 if none. */
  static int findTopLevel(List<Token> t, int from, int to, String text) {
    int depth = 0;
    for (int i = from; i < to; i++) {
      Token tok = t.get(i);
      if (isOpener(tok)) depth++;
      else if (isCloser(tok)) depth--;
      else if (depth == 0 && tok.kind() == TokenKind.PUNCTUATION && tok.text().equals(text)) return i;
    }
    return -1;
  }

  /** Splits [from, to) at depth-zero separators; ranges exclude the separators. */
  static List<int[]> splitTopLevel(List<Token> t, int from, int to, String separator) {
    List<int[]> parts = new ArrayList<>();
    int start = from;
    int depth = 0;
    for (int i = from; i < to; i++) {
      Token tok = t.get(i);
      if (isOpener(tok)) depth++;
      else if (isCloser(tok)) depth--;
      else if (depth == 0 && tok.kind() == TokenKind.PUNCTUATION && tok.text().equals(separator)) {
        parts.add(new int[]{start, i});
        start = i + 1;
      }
    }
    parts.add(new int[]{start, to});
    return parts;
  }

  /** End of an expression starting at {@code from}: first depth-zero comma, semicolon or unmatched closer. */
  static int expressionEnd(List<Token> t, int from, int to) {
    int depth = 0;
    for (int i = from; i < to; i++) {
      Token tok = t.get(i);
      if (isOpener(tok)) depth++;
      else if (isCloser(tok)) {
        if (depth == 0) return i;
        depth--;
      } else if (depth == 0 && (tok.is(",") || tok.is(";"))) {
        return i;
      }
    }
    return to;
  }

  static boolean hasTopLevelNewline(List<Token> t, int from, int to) {
    int depth = 0;
    for (int i = from; i < to; i++) {
      Token tok = t.get(i);
      if (isOpener(tok)) depth++;
      else if (isCloser(tok)) depth--;
      else if (depth == 0 && tok.isNewline()) return true;
    }
    return false;
  }

  static boolean hasNewline(List<Token> t, int from, int to) {
    for (int i = from; i < to; i++) {
      if (t.get(i).isNewline()) return true;
    }
    return false;
  }

  /** Only whitespace in [from, to); comments count as content. */
  static boolean isWhitespaceOnly(List<Token> t, int from, int to) {
    for (int i = from; i < to; i++) {
      if (t.get(i).kind() != TokenKind.WHITESPACE) return false;
    }
    return true;
  }

  static List<Token> comments(List<Token> t, int from, int to) {
    List<Token> out = new ArrayList<>();
    for (int i = from; i < to; i++) {
      if (t.get(i).kind() == TokenKind.COMMENT) out.add(t.get(i));
    }
    return out;
  }

  static int skipSpaces(List<Token> t, int from, int to) {
    int i = from;
    while (i < to && t.get(i).kind() == TokenKind.WHITESPACE && !t.get(i).isNewline()) i++;
    return i;
  }

  /** Exclusive end of [from, to) with trailing whitespace removed. */
  static int trimEnd(List<Token> t, int from, int to) {
    int i = to;
    while (i > from && t.get(i - 1).kind() == TokenKind.WHITESPACE) i--;
    return i;
  }

  static String text(List<Token> t, int from, int to) {
    StringBuilder sb = new StringBuilder();
    for (int i = from; i < to; i++) sb.append(t.get(i).text());
    return sb.toString();
  }
}
