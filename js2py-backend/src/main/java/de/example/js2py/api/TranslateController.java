package de.example.js2py.api;

import de.example.js2py.SnippetTranslator;
import de.example.js2py.TranslationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;

@RestController
@RequestMapping("/api")
public class TranslateController {
  static final String WARNINGS_HEADER = "X-Js2Py-Warnings";

  private static final Logger LOGGER = LoggerFactory.getLogger(TranslateController.class);

  private final SnippetTranslator translator;
  private final ApiProperties properties;

  public TranslateController(SnippetTranslator translator, ApiProperties properties) {
    this.translator = translator;
    this.properties = properties;
  }

  @PostMapping(value = {"/translate", "/translate/"}, consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> translate(
      @RequestParam(name = "mode", defaultValue = "snippet") String mode,
      @RequestBody(required = false) String input
  ) {
    if (input == null || input.isBlank()) return ResponseEntity.ok("");
    if (input.length() > properties.maxInputChars()) return ResponseEntity.badRequest().body("Input too large.");

    String m = mode == null ? "snippet" : mode.trim().toLowerCase(Locale.ROOT);
    if (!SnippetTranslator.MODES.contains(m)) {
      return ResponseEntity.badRequest().body("Unknown mode. Use: " + String.join(" | ", SnippetTranslator.MODES));
    }

    TranslationResult result = translator.translateDetailed(input, m.equals("script"));
    LOGGER.info("Translated {} chars ({} mode), {} unsupported statements",
        input.length(), m, result.warnings().size());

    return ResponseEntity.ok()
        .header(WARNINGS_HEADER, String.valueOf(result.warnings().size()))
        .body(result.text());
  }
}
