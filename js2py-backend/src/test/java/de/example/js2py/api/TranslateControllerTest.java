package de.example.js2py.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "js2py.max-input-chars=50")
@AutoConfigureMockMvc
class TranslateControllerTest {

  @Autowired
  private MockMvc mvc;

  @Test
  void translatesSnippet() throws Exception {
    mvc.perform(post("/api/translate").contentType(MediaType.TEXT_PLAIN).content("var x = 1;"))
        .andExpect(status().isOk())
        .andExpect(header().string(TranslateController.WARNINGS_HEADER, "0"))
        .andExpect(content().string("x = 1\n"));
  }

  @Test
  void scriptModeAddsImports() throws Exception {
    mvc.perform(post("/api/translate").param("mode", "script")
            .contentType(MediaType.TEXT_PLAIN).content("Map.addLayer(img);"))
        .andExpect(status().isOk())
        .andExpect(content().string(startsWith("import ee\nee.Initialize()\n\n")))
        .andExpect(content().string(containsString("Map.add_ee_layer(img)")));
  }

  @Test
  void reportsUnsupportedCountInHeader() throws Exception {
    mvc.perform(post("/api/translate").contentType(MediaType.TEXT_PLAIN).content("i++;\nvar y = 2;"))
        .andExpect(status().isOk())
        .andExpect(header().string(TranslateController.WARNINGS_HEADER, "1"))
        .andExpect(content().string(containsString("# js2py warning: unsupported increment/decrement operator")));
  }

  @Test
  void rejectsUnknownMode() throws Exception {
    mvc.perform(post("/api/translate").param("mode", "class")
            .contentType(MediaType.TEXT_PLAIN).content("var x = 1;"))
        .andExpect(status().isBadRequest())
        .andExpect(content().string("Unknown mode. Use: snippet | script"));
  }

  @Test
  void rejectsMalformedSnippet() throws Exception {
    mvc.perform(post("/api/translate").contentType(MediaType.TEXT_PLAIN).content("print((1);"))
        .andExpect(status().isBadRequest())
        .andExpect(content().string(startsWith("Syntax error (JavaScript): Unbalanced brackets")))
        .andExpect(content().string(containsString("print((1);\n     ^")));
  }

  @Test
  void blankInputGivesEmptyOutput() throws Exception {
    mvc.perform(post("/api/translate").contentType(MediaType.TEXT_PLAIN).content("   "))
        .andExpect(status().isOk())
        .andExpect(content().string(""));
  }

  @Test
  void rejectsOversizedInput() throws Exception {
    mvc.perform(post("/api/translate").contentType(MediaType.TEXT_PLAIN).content("var x = 1;\n".repeat(10)))
        .andExpect(status().isBadRequest())
        .andExpect(content().string("Input too large."));
  }

  @Test
  void healthEndpoint() throws Exception {
    mvc.perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.service").value("js2py-backend"))
        .andExpect(jsonPath("$.modes[0]").value("snippet"))
        .andExpect(jsonPath("$.modes[1]").value("script"))
        .andExpect(jsonPath("$.maxInputChars").value(50));
  }
}
