package com.flamingo.ai.gedcom.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.gedcom.api.rest.GedcomController;
import com.flamingo.ai.gedcom.api.rest.HealthController;
import java.lang.reflect.Method;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify the controllers are mapped to the documented paths:
 *
 * <ul>
 *   <li>POST /api/gedcom/validate - Report malformed lines
 *   <li>POST /api/gedcom/parse - Load and summarise
 *   <li>POST /api/gedcom/individuals - List or search individuals
 *   <li>POST /api/gedcom/individuals/{individualId}/asciidoc - Render one individual
 *   <li>GET /health - Health check
 * </ul>
 */
class ApiContractTest {

  private static String[] postPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(m -> m.getAnnotation(PostMapping.class))
        .filter(mapping -> mapping != null)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toArray(String[]::new);
  }

  @Nested
  @DisplayName("GedcomController API contract")
  class GedcomControllerContract {

    @Test
    @DisplayName("should be mapped to /api/gedcom")
    void shouldBeMappedToApiGedcom() {
      RequestMapping mapping = GedcomController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/gedcom");
    }

    @Test
    @DisplayName("should expose the upload endpoints")
    void shouldExposeUploadEndpoints() {
      assertThat(postPaths(GedcomController.class))
          .containsExactlyInAnyOrder(
              "/validate", "/parse", "/individuals", "/individuals/{individualId}/asciidoc");
    }

    @Test
    @DisplayName("should accept multipart uploads on every endpoint")
    void shouldAcceptMultipart() {
      for (Method method : GedcomController.class.getDeclaredMethods()) {
        PostMapping mapping = method.getAnnotation(PostMapping.class);
        if (mapping != null) {
          assertThat(mapping.consumes()).containsExactly("multipart/form-data");
        }
      }
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
