package de.example.js2py.api;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CorsConfig implements WebMvcConfigurer {
  private final ApiProperties properties;

  public CorsConfig(ApiProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/api/**")
      .allowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new))
      .allowedMethods("GET", "POST", "OPTIONS")
      .allowedHeaders("*")
      // the editor shows the warning count next to the output
      .exposedHeaders(TranslateController.WARNINGS_HEADER)
      .maxAge(3600);
  }
}
