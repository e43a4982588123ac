package de.example.js2py;

/**
 * A single declarative source-to-target mapping. {@code match} is the source
 * spelling (for member calls {@code Receiver.member}), {@code replacement} the
 * target spelling; an empty replacement drops the token.
 */
public record RewriteRule(Category category, String match, String replacement) {

  public enum Category {
    DECLARATION_KEYWORD,
    LITERAL_KEYWORD,
    DROPPED_KEYWORD,
    MEMBER_CALL,
    OPERATOR,
    COMMENT_MARKER
  }

  static RewriteRule of(Category category, String match, String replacement) {
    return new RewriteRule(category, match, replacement);
  }
}
