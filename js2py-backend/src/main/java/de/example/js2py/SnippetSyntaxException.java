package de.example.js2py;

/**
 * Malformed input that cannot be translated at all: an unterminated string or
 * block comment, or brackets that do not balance. No partial output is produced.
 */
public class SnippetSyntaxException extends RuntimeException {
  private final int position;
  private final int line;
  private final int column;
  private final String sourceLine;

  private SnippetSyntaxException(String message, int position, int line, int column, String sourceLine) {
    super(message + " at line " + line + ", column " + column);
    this.position = position;
    this.line = line;
    this.column = column;
    this.sourceLine = sourceLine;
  }

  public static SnippetSyntaxException at(String source, int position, String message) {
    int p = Math.max(0, Math.min(position, source.length()));
    int lineStart = source.lastIndexOf('\n', p - 1) + 1;
    int lineEnd = source.indexOf('\n', p);
    if (lineEnd < 0) lineEnd = source.length();

    int line = 1;
    for (int i = 0; i < lineStart; i++) {
      if (source.charAt(i) == '\n') line++;
    }
    return new SnippetSyntaxException(message, p, line, p - lineStart + 1, source.substring(lineStart, lineEnd));
  }

  public int getPosition() {
    return position;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  /** The offending source line followed by a caret under the reported column. */
  public String pointer() {
    return sourceLine + "\n" + " ".repeat(column - 1) + "^";
  }
}
