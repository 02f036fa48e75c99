package de.example.monthy.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import de.example.monthy.CompileException;
import de.example.monthy.IndentUnit;
import de.example.monthy.MonthyCompileService;
import de.example.monthy.config.MonthyProperties;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
// /api/health und /health (ohne Prefix) zeigen auf denselben Endpoint
@RequestMapping({"/api", ""})
public class HealthController {

  static final String SELF_CHECK_SOURCE = "if true then say 1";
  static final String SELF_CHECK_EXPECTED = "if True:\n    print(1)\n";

  private final MonthyCompileService compiler;
  private final MonthyProperties props;

  public HealthController(MonthyCompileService compiler, MonthyProperties props) {
    this.compiler = compiler;
    this.props = props;
  }

  @GetMapping(value = {"/health", "/health/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, Object> health() {
    boolean selfCheck = selfCheck();

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", selfCheck ? "ok" : "degraded");
    body.put("service", "monthy-backend");
    body.put("selfCheck", selfCheck);
    body.put("indent", props.tabs() ? "tab" : props.indent() + " spaces");
    body.put("maxIndent", props.maxIndent());
    body.put("maxInputChars", props.maxInputChars());
    body.put("time", Instant.now().toString());
    return body;
  }

  // kompiliert ein festes Inline-if mit Standard-Einrueckung
  private boolean selfCheck() {
    try {
      return SELF_CHECK_EXPECTED.equals(compiler.compile(SELF_CHECK_SOURCE, "<health>", IndentUnit.FOUR_SPACES));
    } catch (CompileException e) {
      return false;
    }
  }
}
