package de.example.js2py;

/**
 * Raised while rewriting a statement that uses a construct outside the
 * supported subset. Caught per statement; never escapes a translation.
 */
final class UnsupportedConstructException extends RuntimeException {
  private final UnsupportedCategory category;

  UnsupportedConstructException(UnsupportedCategory category) {
    super(category.label(), null, false, false);
    this.category = category;
  }

  UnsupportedCategory category() {
    return category;
  }
}
