package de.example.js2py;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a snippet into tokens. Total and lossless: concatenating the token
 * texts reproduces the input exactly.
 */
public final class Tokenizer {

  private static final String[] OPERATORS = {
      "===", "!==", "**=", "...", ">>>",
      "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--",
      "+=", "-=", "*=", "/=", "%=", "**"
  };

  public List<Token> tokenize(String src) {
    String s = src == null ? "" : src;
    List<Token> out = new ArrayList<>();
    Token lastCode = null;

    int i = 0;
    while (i < s.length()) {
      int start = i;
      char c = s.charAt(i);
      TokenKind kind;

      if (c == '\r' || c == '\n') {
        i += (c == '\r' && i + 1 < s.length() && s.charAt(i + 1) == '\n') ? 2 : 1;
        kind = TokenKind.WHITESPACE;
      } else if (Character.isWhitespace(c)) {
        while (i < s.length() && isHorizontalSpace(s.charAt(i))) i++;
        kind = TokenKind.WHITESPACE;
      } else if (s.startsWith("//", i) || c == '#') {
        i = lineEnd(s, i);
        kind = TokenKind.COMMENT;
      } else if (s.startsWith("/*", i)) {
        int close = s.indexOf("*/", i + 2);
        if (close < 0) throw SnippetSyntaxException.at(s, start, "Unterminated block comment");
        i = close + 2;
        kind = TokenKind.COMMENT;
      } else if (c == '\'' || c == '"' || c == '`') {
        i = stringEnd(s, i);
        kind = TokenKind.STRING;
      } else if (Character.isDigit(c)) {
        i = numberEnd(s, i);
        kind = TokenKind.NUMBER;
      } else if (isIdentifierStart(c)) {
        while (i < s.length() && isIdentifierPart(s.charAt(i))) i++;
        String word = s.substring(start, i);
        boolean member = lastCode != null && lastCode.is(".");
        kind = (!member && DialectRules.KEYWORDS.contains(word)) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER;
      } else {
        i += operatorLength(s, i);
        kind = TokenKind.PUNCTUATION;
      }

      Token t = new Token(kind, s.substring(start, i), start);
      out.add(t);
      if (!t.isTrivia()) lastCode = t;
    }
    return out;
  }

  // =========================================================
  // Scanners
  // =========================================================
  private int lineEnd(String s, int from) {
    int i = from;
    while (i < s.length() && s.charAt(i) != '\n' && s.charAt(i) != '\r') i++;
    return i;
  }

  private int stringEnd(String s, int from) {
    char quote = s.charAt(from);
    int i = from + 1;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c == '\\') {
        i += 2;
        continue;
      }
      if (c == quote) return i + 1;
      // only template literals may span lines
      if ((c == '\n' || c == '\r') && quote != '`') break;
      i++;
    }
    throw SnippetSyntaxException.at(s, from, "Unterminated string literal");
  }

  private int numberEnd(String s, int from) {
    int i = from;
    if (s.startsWith("0x", i) || s.startsWith("0X", i)) {
      i += 2;
      while (i < s.length() && Character.digit(s.charAt(i), 16) >= 0) i++;
      return i;
    }

    while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
    if (i + 1 < s.length() && s.charAt(i) == '.' && Character.isDigit(s.charAt(i + 1))) {
      i++;
      while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
    }
    if (i < s.length() && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
      int j = i + 1;
      if (j < s.length() && (s.charAt(j) == '+' || s.charAt(j) == '-')) j++;
      if (j < s.length() && Character.isDigit(s.charAt(j))) {
        i = j;
        while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
      }
    }
    return i;
  }

  private int operatorLength(String s, int from) {
    for (String op : OPERATORS) {
      if (s.startsWith(op, from)) return op.length();
    }
    return 1;
  }

  private boolean isHorizontalSpace(char c) {
    return Character.isWhitespace(c) && c != '\n' && c != '\r';
  }

  private boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '$';
  }

  private boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }
}
