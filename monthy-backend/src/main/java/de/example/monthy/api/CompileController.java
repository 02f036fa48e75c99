package de.example.monthy.api;

import de.example.monthy.IndentUnit;
import de.example.monthy.MonthyCompileService;
import de.example.monthy.config.MonthyProperties;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class CompileController {

  private final MonthyCompileService compiler;
  private final MonthyProperties props;

  public CompileController(MonthyCompileService compiler, MonthyProperties props) {
    this.compiler = compiler;
    this.props = props;
  }

  @PostMapping(value = {"/compile", "/compile/"}, consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> compile(
      @RequestParam(name = "indent", required = false) Integer indent,
      @RequestParam(name = "tabs", required = false) Boolean tabs,
      @RequestParam(name = "filename", defaultValue = "<request>") String filename,
      @RequestBody(required = false) String input
  ) {
    if (input == null || input.isBlank()) return ResponseEntity.ok("");
    if (input.length() > props.maxInputChars()) return ResponseEntity.badRequest().body("Input too large.");

    // Wichtig: indent vor IndentUnit pruefen, sonst wird der String sofort in voller Laenge gebaut
    int spaces = indent == null ? props.indent() : indent;
    if (spaces > props.maxIndent()) return ResponseEntity.badRequest().body("Indent too large.");

    IndentUnit unit = IndentUnit.of(spaces, tabs == null ? props.tabs() : tabs);
    return ResponseEntity.ok(compiler.compile(input, filename, unit));
  }
}
