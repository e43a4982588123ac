package de.example.js2py;

/**
 * A statement in target spelling, ready for the emitter.
 * <ul>
 *   <li>CODE: {@code head} is the assignment target including {@code =} (may be empty), {@code body} the expression</li>
 *   <li>FUNCTION: {@code head} is the {@code def} line, {@code body} the returned expression</li>
 *   <li>COMMENT: {@code body} holds the comment lines</li>
 *   <li>UNSUPPORTED: {@code body} is the untouched source text</li>
 * </ul>
 * {@code chained} marks a body that broke across lines at depth zero and needs wrapping.
 */
public record RewrittenStatement(Kind kind, String head, String body, boolean chained,
                                 UnsupportedCategory category, String trailingComment, String commentGap,
                                 int blankLinesBefore) {

  public enum Kind { CODE, FUNCTION, COMMENT, UNSUPPORTED }

  static RewrittenStatement code(String head, String body, boolean chained) {
    return new RewrittenStatement(Kind.CODE, head, body, chained, null, null, "", 0);
  }

  static RewrittenStatement function(String header, String returned, boolean chained) {
    return new RewrittenStatement(Kind.FUNCTION, header, returned, chained, null, null, "", 0);
  }

  static RewrittenStatement comment(String lines, int blankLinesBefore) {
    return new RewrittenStatement(Kind.COMMENT, "", lines, false, null, null, "", blankLinesBefore);
  }

  static RewrittenStatement unsupported(String source, UnsupportedCategory category, int blankLinesBefore) {
    return new RewrittenStatement(Kind.UNSUPPORTED, "", source, false, category, null, "", blankLinesBefore);
  }

  RewrittenStatement withTrailingComment(String comment, String gap) {
    return new RewrittenStatement(kind, head, body, chained, category, comment, gap, blankLinesBefore);
  }

  /** Adds a comment after any trailing comment already present. */
  RewrittenStatement appendTrailingComment(String comment, String gap) {
    if (trailingComment == null) return withTrailingComment(comment, gap);
    return withTrailingComment(trailingComment + " " + comment, commentGap);
  }

  RewrittenStatement withBlankLinesBefore(int n) {
    return new RewrittenStatement(kind, head, body, chained, category, trailingComment, commentGap, n);
  }

  /** Trailing comment with its separating whitespace, or an empty string. */
  public String trailing() {
    if (trailingComment == null) return "";
    return (commentGap.isEmpty() ? "  " : commentGap) + trailingComment;
  }
}
