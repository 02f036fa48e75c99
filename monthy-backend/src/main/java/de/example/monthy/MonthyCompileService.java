package de.example.monthy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Compiles request bodies. A fresh {@link MonthyCompiler} per call keeps the singleton free of
 * per-compilation state.
 */
@Service
public class MonthyCompileService {
  private static final Logger log = LoggerFactory.getLogger(MonthyCompileService.class);

  public String compile(String source, String filename, IndentUnit indentUnit) {
    MonthyCompiler compiler = new MonthyCompiler(indentUnit);
    try {
      String python = compiler.compile(source, filename);
      log.debug("Compiled {} ({} lines in, {} chars out)", filename, MonthyCompiler.splitLines(source).size(), python.length());
      return python;
    } catch (CompileException e) {
      log.info("Compile of {} failed: {}", filename, e.getMessage());
      throw e;
    }
  }
}
