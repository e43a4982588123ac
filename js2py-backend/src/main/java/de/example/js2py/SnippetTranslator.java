package de.example.js2py;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Earth Engine Code Editor (JavaScript) -> earthengine-api (Python) snippet translator.
 *
 * - Stateless service: every call builds its own {@link TranslationContext}
 * - Pipeline: Tokenizer -> StatementGrouper -> StatementRewriter -> PythonEmitter
 * - Malformed input (unterminated string/comment, unbalanced brackets) throws
 *   {@link SnippetSyntaxException}; unsupported statements pass through flagged
 */
@Service
public class SnippetTranslator {
  private static final Logger LOGGER = LoggerFactory.getLogger(SnippetTranslator.class);

  public static final List<String> MODES = List.of("snippet", "script");

  private final Tokenizer tokenizer = new Tokenizer();
  private final StatementGrouper grouper = new StatementGrouper();
  private final StatementRewriter rewriter = new StatementRewriter(new ExpressionRewriter());

  // =========================================================
  // Public API
  // =========================================================
  public String translate(String snippet) {
    return translateSnippet(snippet);
  }

  /** Statements only, no imports. */
  public String translateSnippet(String snippet) {
    return translateDetailed(snippet, false).text();
  }

  /** A runnable script: statements preceded by {@code import ee} and {@code ee.Initialize()}. */
  public String translateScript(String snippet) {
    return translateDetailed(snippet, true).text();
  }

  /** {@code script} or {@code snippet}; anything else translates as a snippet. */
  public String translate(String snippet, String mode) {
    String m = (mode == null ? "snippet" : mode.trim().toLowerCase(Locale.ROOT));
    return switch (m) {
      case "script" -> translateScript(snippet);
      default -> translateSnippet(snippet);
    };
  }

  public TranslationResult translateDetailed(String snippet, boolean prelude) {
    String src = normalize(snippet);
    TranslationContext ctx = new TranslationContext(src);

    List<Token> tokens = tokenizer.tokenize(src);
    List<Statement> statements = grouper.group(tokens, src);

    if (prelude) ctx.out().prelude();
    for (Statement s : statements) {
      for (RewrittenStatement r : rewriter.rewrite(s, ctx)) {
        ctx.out().statement(r);
      }
    }

    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Translated {} statements from {} tokens, {} unsupported",
          statements.size(), tokens.size(), ctx.warnings().size());
      ctx.warnings().forEach(w -> LOGGER.debug("Unsupported construct at {}", w));
    }
    return new TranslationResult(ctx.out().finish(), ctx.warnings());
  }

  // =========================================================
  // Helpers
  // =========================================================
  private String normalize(String s) {
    if (s == null) return "";
    return s.replace("\r\n", "\n").replace("\r", "\n");
  }
}
