package de.example.js2py;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scratch state of a single translation. Created per call and never shared,
 * which keeps {@link SnippetTranslator} safe to use from many threads.
 */
public final class TranslationContext {
  private final String source;
  private final PythonEmitter out = new PythonEmitter();
  private final Map<String, String> renameCache = new HashMap<>();
  private final List<TranslationWarning> warnings = new ArrayList<>();

  public TranslationContext(String source) {
    this.source = source;
  }

  public String source() {
    return source;
  }

  public PythonEmitter out() {
    return out;
  }

  public List<TranslationWarning> warnings() {
    return warnings;
  }

  /** Target spelling of {@code receiver.member(...)}; the member itself when no rule applies. */
  public String rename(String receiver, String member) {
    return renameCache.computeIfAbsent(receiver + "." + member,
        k -> DialectRules.memberRename(receiver, member).orElse(member));
  }

  void warn(UnsupportedCategory category, Statement s) {
    int lineStart = source.lastIndexOf('\n', s.start() - 1) + 1;
    int line = 1;
    for (int i = 0; i < lineStart; i++) {
      if (source.charAt(i) == '\n') line++;
    }
    String first = source.substring(s.start(), s.end()).lines().findFirst().orElse("").strip();
    warnings.add(new TranslationWarning(category, line, s.start() - lineStart + 1, first));
  }
}
