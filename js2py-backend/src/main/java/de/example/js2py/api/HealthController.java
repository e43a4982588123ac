package de.example.js2py.api;

import java.time.Instant;
import java.util.Map;

import de.example.js2py.DialectRules;
import de.example.js2py.SnippetTranslator;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
// serves /api/health and /health alike
@RequestMapping({"/api", ""})
public class HealthController {
  private final ApiProperties properties;

  public HealthController(ApiProperties properties) {
    this.properties = properties;
  }

  /** Liveness plus what the front end needs to know before posting a snippet. */
  @GetMapping(value = {"/health", "/health/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, Object> health() {
    return Map.of(
        "status", "ok",
        "service", "js2py-backend",
        "modes", SnippetTranslator.MODES,
        "rules", DialectRules.RULES.size(),
        "maxInputChars", properties.maxInputChars(),
        "time", Instant.now().toString()
    );
  }
}
