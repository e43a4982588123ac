package de.example.js2py;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static de.example.js2py.RewriteRule.Category.*;

/**
 * Static JavaScript (Code Editor) to Python (earthengine-api) rule table.
 * Immutable; every lookup is a pure function of its arguments.
 */
public final class DialectRules {

  // =========================================================
  // Rule table
  // =========================================================
  public static final List<RewriteRule> RULES = List.of(
      RewriteRule.of(DECLARATION_KEYWORD, "var", ""),
      RewriteRule.of(DECLARATION_KEYWORD, "let", ""),
      RewriteRule.of(DECLARATION_KEYWORD, "const", ""),

      RewriteRule.of(LITERAL_KEYWORD, "true", "True"),
      RewriteRule.of(LITERAL_KEYWORD, "false", "False"),
      RewriteRule.of(LITERAL_KEYWORD, "null", "None"),
      RewriteRule.of(LITERAL_KEYWORD, "undefined", "None"),

      RewriteRule.of(DROPPED_KEYWORD, "new", ""),

      RewriteRule.of(MEMBER_CALL, "Map.addLayer", "add_ee_layer"),
      RewriteRule.of(MEMBER_CALL, "Map.centerObject", "center_object"),

      RewriteRule.of(OPERATOR, "&&", "and"),
      RewriteRule.of(OPERATOR, "||", "or"),
      RewriteRule.of(OPERATOR, "!", "not"),
      RewriteRule.of(OPERATOR, "===", "=="),
      RewriteRule.of(OPERATOR, "!==", "!="),

      RewriteRule.of(COMMENT_MARKER, "//", "#")
  );

  /** Python accepts both; the converter normalizes to no trailing comma. */
  public static final boolean TRAILING_COMMA = false;

  public static final String KEY_QUOTE = "'";

  /** Calls whose sole function argument may become a lambda. */
  public static final Set<String> HIGHER_ORDER_CALLS = Set.of("map", "filter");

  private static final Map<UnsupportedCategory, Set<String>> UNSUPPORTED_KEYWORDS = Map.of(
      UnsupportedCategory.CONTROL_FLOW, Set.of(
          "if", "else", "for", "while", "do", "switch", "case", "default", "break", "continue",
          "return", "try", "catch", "finally", "throw", "with", "debugger"),
      UnsupportedCategory.KEYWORD, Set.of(
          "this", "typeof", "instanceof", "delete", "void", "class", "extends", "super",
          "yield", "async", "await", "in", "of")
  );

  private static final Map<String, UnsupportedCategory> UNSUPPORTED_OPERATORS = Map.of(
      "?", UnsupportedCategory.CONDITIONAL_EXPRESSION,
      "++", UnsupportedCategory.UPDATE_OPERATOR,
      "--", UnsupportedCategory.UPDATE_OPERATOR,
      "...", UnsupportedCategory.SPREAD,
      "?.", UnsupportedCategory.OPERATOR,
      "??", UnsupportedCategory.OPERATOR,
      ">>>", UnsupportedCategory.OPERATOR
  );

  /** A newline after one of these at depth zero continues the statement. */
  private static final Set<String> TRAILING_CONTINUATIONS = Set.of(
      "=", "+=", "-=", "*=", "/=", "%=", "**=", ".", ",", "+", "-", "*", "/", "%", "**",
      "&&", "||", "??", "?", "==", "===", "!=", "!==", "<", ">", "<=", ">=", "=>",
      "&", "|", "^", "!");

  /** A newline before one of these at depth zero continues the statement. */
  private static final Set<String> LEADING_CONTINUATIONS = Set.of(".", "?.", "&&", "||", "??", "?", ":");

  public static final Set<String> KEYWORDS = keywords();

  private static final Map<String, String> RENAMES = index(MEMBER_CALL);
  private static final Map<String, String> LITERALS = index(LITERAL_KEYWORD);
  private static final Map<String, String> OPERATORS = index(OPERATOR);
  private static final Set<String> DECLARATIONS = index(DECLARATION_KEYWORD).keySet();
  private static final Set<String> DROPPED = index(DROPPED_KEYWORD).keySet();
  private static final Map<String, String> COMMENT_MARKERS = index(COMMENT_MARKER);
  private static final String TARGET_MARKER = "#";

  private DialectRules() {
  }

  // =========================================================
  // Lookups
  // =========================================================
  public static boolean isDeclarationKeyword(String kw) {
    return DECLARATIONS.contains(kw);
  }

  public static boolean isDroppedKeyword(String kw) {
    return DROPPED.contains(kw);
  }

  public static Optional<String> literalKeyword(String kw) {
    return Optional.ofNullable(LITERALS.get(kw));
  }

  public static Optional<String> memberRename(String receiver, String member) {
    return Optional.ofNullable(RENAMES.get(receiver + "." + member));
  }

  public static Optional<String> operator(String op) {
    return Optional.ofNullable(OPERATORS.get(op));
  }

  public static Optional<UnsupportedCategory> unsupportedKeyword(String kw) {
    return UNSUPPORTED_KEYWORDS.entrySet().stream()
        .filter(e -> e.getValue().contains(kw))
        .map(Map.Entry::getKey)
        .findFirst();
  }

  public static Optional<UnsupportedCategory> unsupportedOperator(String op) {
    return Optional.ofNullable(UNSUPPORTED_OPERATORS.get(op));
  }

  public static boolean continuesAfter(String punctuation) {
    return TRAILING_CONTINUATIONS.contains(punctuation);
  }

  public static boolean continuesBefore(String punctuation) {
    return LEADING_CONTINUATIONS.contains(punctuation);
  }

  public static String quoteKey(String name) {
    return KEY_QUOTE + name + KEY_QUOTE;
  }

  /**
   * Re-spells a comment with the target marker. Line comments keep their text;
   * block comments become one {@code #} line per content line.
   */
  public static String convertComment(String text) {
    if (text.startsWith(TARGET_MARKER)) return text;
    for (Map.Entry<String, String> m : COMMENT_MARKERS.entrySet()) {
      if (text.startsWith(m.getKey())) return m.getValue() + text.substring(m.getKey().length());
    }
    if (!text.startsWith("/*")) return text;

    String inner = text.substring(2, Math.max(2, text.length() - 2));
    List<String> lines = inner.lines()
        .map(String::strip)
        .map(l -> l.startsWith("*") ? l.substring(1).strip() : l)
        .collect(Collectors.toCollection(ArrayList::new));
    while (!lines.isEmpty() && lines.get(0).isEmpty()) lines.remove(0);
    while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) lines.remove(lines.size() - 1);
    if (lines.isEmpty()) return TARGET_MARKER;

    return lines.stream()
        .map(l -> l.isEmpty() ? TARGET_MARKER : TARGET_MARKER + " " + l)
        .collect(Collectors.joining("\n"));
  }

  // =========================================================
  // Helpers
  // =========================================================
  private static Map<String, String> index(RewriteRule.Category category) {
    return RULES.stream()
        .filter(r -> r.category() == category)
        .collect(Collectors.toUnmodifiableMap(RewriteRule::match, RewriteRule::replacement));
  }

  private static Set<String> keywords() {
    Set<String> all = RULES.stream()
        .filter(r -> r.category() == DECLARATION_KEYWORD || r.category() == LITERAL_KEYWORD
            || r.category() == DROPPED_KEYWORD)
        .map(RewriteRule::match)
        .collect(Collectors.toCollection(HashSet::new));
    all.add("function");
    UNSUPPORTED_KEYWORDS.values().forEach(all::addAll);
    return Set.copyOf(all);
  }
}
