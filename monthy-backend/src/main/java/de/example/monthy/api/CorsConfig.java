package de.example.monthy.api;

import de.example.monthy.config.MonthyProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CorsConfig implements WebMvcConfigurer {

  private final MonthyProperties props;

  public CorsConfig(MonthyProperties props) {
    this.props = props;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/api/**")
      .allowedOriginPatterns(props.cors().allowedOriginPatterns().toArray(String[]::new))
      .allowedMethods("GET", "POST", "OPTIONS")
      .allowedHeaders("*")
      .maxAge(3600);
  }
}
