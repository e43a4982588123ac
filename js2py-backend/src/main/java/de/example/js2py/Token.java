package de.example.js2py;

/**
 * One lexical token of a source snippet. {@code position} is the offset of the
 * first character in the (newline-normalized) input.
 */
public record Token(TokenKind kind, String text, int position) {

  public int end() {
    return position + text.length();
  }

  public boolean is(String s) {
    return (kind == TokenKind.PUNCTUATION || kind == TokenKind.KEYWORD) && text.equals(s);
  }

  public boolean isKeyword(String s) {
    return kind == TokenKind.KEYWORD && text.equals(s);
  }

  public boolean isNewline() {
    return kind == TokenKind.WHITESPACE && (text.equals("\n") || text.equals("\r\n") || text.equals("\r"));
  }

  /** Whitespace and comments; everything else is code. */
  public boolean isTrivia() {
    return kind == TokenKind.WHITESPACE || kind == TokenKind.COMMENT;
  }
}
