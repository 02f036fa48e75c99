package de.example.monthy.api;

import de.example.monthy.CompileException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(CompileException.class)
  public ResponseEntity<String> handleCompile(CompileException e) {
    return ResponseEntity.badRequest()
        .contentType(MediaType.TEXT_PLAIN)
        .body("Compile error (" + e.kind().label() + "): " + e.getMessage() + "\n\nTipp: " + hint(e.kind()));
  }

  private String hint(CompileException.Kind kind) {
    return switch (kind) {
      case UNEXPECTED_END -> "Zu viele 'end'. Jedes 'end' schliesst genau ein if/repeat/def.";
      case MISSING_END -> "Jeder Block (if/repeat/def) braucht ein eigenes 'end'.";
      case MALFORMED_LINE -> "def braucht Namen und Argumente als Bezeichner; nach 'then' nur eine Anweisung.";
    };
  }
}
