package de.example.js2py;

import java.util.List;

/**
 * One logical source statement: its code tokens (without terminator), an
 * optional comment trailing it on the same line, and its source extent.
 */
public record Statement(List<Token> tokens, Token trailingComment, String commentGap,
                        int blankLinesBefore, int start, int end) {

  public Statement {
    tokens = List.copyOf(tokens);
  }

  public static Statement comment(Token comment, int blankLinesBefore) {
    return new Statement(List.of(comment), null, "", blankLinesBefore, comment.position(), comment.end());
  }

  public boolean isComment() {
    return tokens.size() == 1 && tokens.get(0).kind() == TokenKind.COMMENT;
  }

  public Statement withTrailingComment(Token comment, String gap) {
    return new Statement(tokens, comment, gap, blankLinesBefore, start, comment.end());
  }
}
