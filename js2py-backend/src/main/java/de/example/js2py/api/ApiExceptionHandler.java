package de.example.js2py.api;

import de.example.js2py.SnippetSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SnippetSyntaxException.class)
  public ResponseEntity<String> handleSyntax(SnippetSyntaxException e) {
    LOGGER.debug("Rejected snippet: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .contentType(MediaType.TEXT_PLAIN)
        .body("Syntax error (JavaScript): " + e.getMessage() + "\n\n" + e.pointer());
  }
}
