package de.example.js2py;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Groups a token stream into logical statements. A statement ends at a
 * terminator or a newline, but only at bracket depth zero; a newline that
 * merely wraps a chain or an operator is absorbed.
 */
public final class StatementGrouper {

  private static final Set<String> HEADER_KEYWORDS = Set.of("if", "for", "while");
  private static final Set<String> CONTINUATION_KEYWORDS = Set.of("else", "catch", "finally");

  public List<Statement> group(List<Token> tokens, String source) {
    List<Statement> out = new ArrayList<>();
    Deque<Token> open = new ArrayDeque<>();
    List<Token> current = new ArrayList<>();

    int newlines = 0;        // since the previous statement ended
    int blankLines = 0;      // captured when the current statement starts
    String gap = "";         // whitespace after the previous statement on its line

    for (int i = 0; i < tokens.size(); i++) {
      Token t = tokens.get(i);

      if (current.isEmpty()) {
        if (t.isNewline()) {
          newlines++;
          gap = "";
          continue;
        }
        if (t.kind() == TokenKind.WHITESPACE) {
          gap = t.text();
          continue;
        }
        if (t.is(";")) continue;
        if (t.kind() == TokenKind.COMMENT) {
          int last = out.size() - 1;
          if (last >= 0 && newlines == 0 && out.get(last).trailingComment() == null) {
            out.set(last, out.get(last).withTrailingComment(t, gap));
          } else {
            out.add(Statement.comment(t, out.isEmpty() ? 0 : Math.max(0, newlines - 1)));
            newlines = 0;
          }
          continue;
        }
        blankLines = out.isEmpty() ? 0 : Math.max(0, newlines - 1);
      }

      if (Tokens.isOpener(t)) {
        open.push(t);
      } else if (Tokens.isCloser(t)) {
        if (open.isEmpty() || !Tokens.closes(open.peek(), t)) {
          throw SnippetSyntaxException.at(source, t.position(), "Unbalanced brackets: unexpected '" + t.text() + "'");
        }
        open.pop();
      }

      if (open.isEmpty()) {
        if (t.is(";")) {
          out.add(build(current, blankLines, t.end()));
          current.clear();
          newlines = 0;
          gap = "";
          continue;
        }
        if (t.isNewline() && !continues(tokens, i, current)) {
          out.add(build(current, blankLines, -1));
          current.clear();
          newlines = 1;
          gap = "";
          continue;
        }
      }
      current.add(t);

      // a function declaration ends with its body
      if (open.isEmpty() && t.is("}") && current.get(Tokens.next(current, 0)).isKeyword("function")) {
        out.add(build(current, blankLines, t.end()));
        current.clear();
        newlines = 0;
        gap = "";
      }
    }

    if (!open.isEmpty()) {
      Token unclosed = open.peek();
      throw SnippetSyntaxException.at(source, unclosed.position(), "Unbalanced brackets: '" + unclosed.text() + "' is never closed");
    }
    if (!current.isEmpty()) out.add(build(current, blankLines, -1));
    return out;
  }

  // =========================================================
  // Continuation rules for a depth-zero newline
  // =========================================================
  private boolean continues(List<Token> tokens, int newline, List<Token> current) {
    int lastIdx = Tokens.prev(current, current.size());
    if (lastIdx < 0) return true;
    Token last = current.get(lastIdx);
    Token first = current.get(Tokens.next(current, 0));

    if (last.kind() == TokenKind.PUNCTUATION && DialectRules.continuesAfter(last.text())) return true;
    if (last.isKeyword("else")) return true;
    if (last.is(":") && first.kind() == TokenKind.IDENTIFIER && first.text().equals("def")) {
      int body = Tokens.next(tokens, newline + 1);
      if (body < tokens.size() && tokens.get(body).isKeyword("return")) return true;
    }
    if (first.kind() == TokenKind.KEYWORD && HEADER_KEYWORDS.contains(first.text()) && endsHeader(current, lastIdx)) {
      return true;
    }

    int nextIdx = Tokens.next(tokens, newline + 1);
    if (nextIdx >= tokens.size()) return false;
    Token next = tokens.get(nextIdx);

    if (next.kind() == TokenKind.PUNCTUATION) return DialectRules.continuesBefore(next.text());
    if (next.kind() == TokenKind.KEYWORD) {
      return CONTINUATION_KEYWORDS.contains(next.text()) || (next.text().equals("while") && first.isKeyword("do"));
    }
    return false;
  }

  /** True when {@code last} closes the parenthesized header right after the leading keyword. */
  private boolean endsHeader(List<Token> current, int last) {
    if (!current.get(last).is(")")) return false;
    int paren = Tokens.next(current, Tokens.next(current, 0) + 1);
    return paren < current.size() && current.get(paren).is("(") && Tokens.matching(current, paren) == last;
  }

  // =========================================================
  // Statement assembly
  // =========================================================
  private Statement build(List<Token> current, int blankLines, int terminatorEnd) {
    int to = Tokens.trimEnd(current, 0, current.size());
    Token comment = null;
    String commentGap = "";

    if (to > 0 && current.get(to - 1).kind() == TokenKind.COMMENT) {
      int code = Tokens.prev(current, to - 1);
      if (code >= 0 && Tokens.isWhitespaceOnly(current, code + 1, to - 1) && !Tokens.hasNewline(current, code + 1, to - 1)) {
        comment = current.get(to - 1);
        commentGap = Tokens.text(current, code + 1, to - 1);
        to = code + 1;
      }
    }

    List<Token> body = current.subList(0, to);
    int start = body.get(0).position();
    int end = terminatorEnd >= 0 ? terminatorEnd : body.get(body.size() - 1).end();
    if (comment != null) end = Math.max(end, comment.end());
    return new Statement(body, comment, commentGap, blankLines, start, end);
  }
}
