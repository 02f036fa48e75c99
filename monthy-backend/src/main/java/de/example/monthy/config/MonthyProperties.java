package de.example.monthy.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code monthy.*} settings from application.properties.
 *
 * @param indent        spaces per indent level when {@code tabs} is off
 * @param tabs          indent with one tab per level
 * @param maxIndent     largest accepted {@code indent} request parameter
 * @param maxInputChars largest accepted request body
 * @param cors          CORS settings for {@code /api/**}
 */
@ConfigurationProperties(prefix = "monthy")
public record MonthyProperties(
    @DefaultValue("4") int indent,
    @DefaultValue("false") boolean tabs,
    @DefaultValue("16") int maxIndent,
    @DefaultValue("200000") int maxInputChars,
    @DefaultValue Cors cors
) {

  public record Cors(
      @DefaultValue({"http://localhost:5173", "http://127.0.0.1:5173"}) List<String> allowedOriginPatterns
  ) {}
}
