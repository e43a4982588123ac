package de.example.js2py;

/** An unsupported statement that was passed through unchanged. */
public record TranslationWarning(UnsupportedCategory category, int line, int column, String excerpt) {

  @Override
  public String toString() {
    return line + ":" + column + " unsupported " + category.label() + ": " + excerpt;
  }
}
