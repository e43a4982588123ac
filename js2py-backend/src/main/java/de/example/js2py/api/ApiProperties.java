package de.example.js2py.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/** {@code js2py.*} settings of the HTTP front door. */
@ConfigurationProperties(prefix = "js2py")
public record ApiProperties(
    @DefaultValue("200000") int maxInputChars,
    @DefaultValue({"http://localhost:5173", "http://127.0.0.1:5173"}) List<String> allowedOrigins
) {
}
