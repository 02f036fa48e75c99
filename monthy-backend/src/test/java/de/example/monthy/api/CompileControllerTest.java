package de.example.monthy.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "monthy.max-input-chars=64")
class CompileControllerTest {

  @Autowired
  private MockMvc mvc;

  @Test
  void compilesWithConfiguredIndent() throws Exception {
    mvc.perform(post("/api/compile").contentType(MediaType.TEXT_PLAIN).content("if x equals 1\nsay x\nend"))
        .andExpect(status().isOk())
        .andExpect(content().string("if x == 1:\n    print(x)\n"));
  }

  @Test
  void indentAndTabsParams() throws Exception {
    mvc.perform(post("/api/compile/").param("indent", "2").contentType(MediaType.TEXT_PLAIN).content("repeat 2 times\nsay 1\nend"))
        .andExpect(status().isOk())
        .andExpect(content().string("for _ in range(int(2)):\n  print(1)\n"));

    mvc.perform(post("/api/compile").param("tabs", "true").contentType(MediaType.TEXT_PLAIN).content("def f a\nreturn a\nend"))
        .andExpect(status().isOk())
        .andExpect(content().string("def f(a):\n\treturn a\n"));
  }

  @Test
  void compileErrorIsBadRequestWithLocation() throws Exception {
    mvc.perform(post("/api/compile").param("filename", "demo.monthy").contentType(MediaType.TEXT_PLAIN).content("say 1\nend"))
        .andExpect(status().isBadRequest())
        .andExpect(content().string(startsWith("Compile error (UnexpectedEnd): 'end' with no open block (at demo.monthy:2)\n\nTipp: ")));
  }

  @Test
  void missingEndIsBadRequest() throws Exception {
    mvc.perform(post("/api/compile").contentType(MediaType.TEXT_PLAIN).content("if a"))
        .andExpect(status().isBadRequest())
        .andExpect(content().string(startsWith("Compile error (MissingEnd): Missing 'end' for: if")));
  }

  @Test
  void malformedLineCarriesHint() throws Exception {
    mvc.perform(post("/api/compile").contentType(MediaType.TEXT_PLAIN).content("def f(x):"))
        .andExpect(status().isBadRequest())
        .andExpect(content().string(startsWith("Compile error (MalformedLine): ")))
        .andExpect(content().string(containsString("Tipp: def braucht")));
  }

  @Test
  void hugeIndentIsRejectedBeforeBuildingTheIndentUnit() throws Exception {
    mvc.perform(post("/api/compile").param("indent", "2147483647").contentType(MediaType.TEXT_PLAIN).content("say 1"))
        .andExpect(status().isBadRequest())
        .andExpect(content().string("Indent too large."));
  }

  @Test
  void indentAtTheLimitIsAccepted() throws Exception {
    mvc.perform(post("/api/compile").param("indent", "16").contentType(MediaType.TEXT_PLAIN).content("if a\nsay 1\nend"))
        .andExpect(status().isOk())
        .andExpect(content().string("if a:\n" + " ".repeat(16) + "print(1)\n"));
    mvc.perform(post("/api/compile").param("indent", "17").contentType(MediaType.TEXT_PLAIN).content("say 1"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void blankInputGivesEmptyBody() throws Exception {
    mvc.perform(post("/api/compile").contentType(MediaType.TEXT_PLAIN).content("   "))
        .andExpect(status().isOk())
        .andExpect(content().string(""));
  }

  @Test
  void oversizeInputIsRejected() throws Exception {
    mvc.perform(post("/api/compile").contentType(MediaType.TEXT_PLAIN).content("say 1\n".repeat(20)))
        .andExpect(status().isBadRequest())
        .andExpect(content().string("Input too large."));
  }

  @Test
  void health() throws Exception {
    mvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.service").value("monthy-backend"))
        .andExpect(jsonPath("$.selfCheck").value(true))
        .andExpect(jsonPath("$.indent").value("4 spaces"))
        .andExpect(jsonPath("$.maxIndent").value(16))
        .andExpect(jsonPath("$.maxInputChars").value(64));
    mvc.perform(get("/api/health/"))
        .andExpect(status().isOk());
  }
}
