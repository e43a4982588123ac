package de.example.js2py;

/**
 * Writes rewritten statements as Python text, one statement per line, in
 * input order.
 */
public final class PythonEmitter {
  static final String WARNING = "# js2py warning: unsupported ";
  static final String WARNING_END = "# js2py warning: end";
  static final String[] PRELUDE = {"import ee", "ee.Initialize()"};

  private static final String INDENT = "    ";

  private final StringBuilder sb = new StringBuilder();
  private int indent = 0;
  private boolean started = false;

  public void indent(Runnable r) {
    indent++;
    try { r.run(); }
    finally { indent--; }
  }

  public void line(String s) {
    sb.append(INDENT.repeat(Math.max(0, indent))).append(s).append("\n");
  }

  public void blank() {
    sb.append("\n");
  }

  public void prelude() {
    for (String p : PRELUDE) line(p);
    blank();
  }

  public void statement(RewrittenStatement s) {
    if (started) {
      for (int i = 0; i < s.blankLinesBefore(); i++) blank();
    }
    started = true;

    switch (s.kind()) {
      case COMMENT -> line(s.body() + s.trailing());
      case CODE -> line(s.head() + wrap(s.body(), s.chained()) + s.trailing());
      case FUNCTION -> {
        line(s.head());
        indent(() -> line("return " + wrap(s.body(), s.chained()) + s.trailing()));
      }
      case UNSUPPORTED -> {
        line(WARNING + s.category().label() + " (left as-is)");
        line(s.body());
        line(WARNING_END);
      }
    }
  }

  /** A chain broken across lines stays valid Python inside parentheses. */
  private String wrap(String body, boolean chained) {
    return chained ? "(" + body + ")" : body;
  }

  /** The emitted text with exactly one trailing newline. */
  public String finish() {
    String s = sb.toString().stripTrailing();
    return s.isEmpty() ? "\n" : (s + "\n");
  }

  @Override
  public String toString() {
    return sb.toString();
  }
}
