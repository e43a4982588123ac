package de.example.js2py;

import java.util.List;

public record TranslationResult(String text, List<TranslationWarning> warnings) {

  public TranslationResult {
    warnings = List.copyOf(warnings);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
