package com.flamingo.ai.gedcom.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DepthRepairEngine Tests")
class DepthRepairEngineTest {

  private final DepthRepairEngine engine = new DepthRepairEngine();

  @Test
  @DisplayName("should clamp a jump of three levels to one level")
  void shouldClampJumpOfThree() {
    assertThat(engine.repair(5, 2)).isEqualTo(3);
  }

  @Test
  @DisplayName("should clamp depth 7 after depth 1 to depth 2")
  void shouldClampSevenAfterOne() {
    assertThat(engine.repair(7, 1)).isEqualTo(2);
  }

  @Test
  @DisplayName("should accept arbitrary decreases unchanged")
  void shouldAcceptDecreases() {
    assertThat(engine.repair(1, 6)).isEqualTo(1);
    assertThat(engine.repair(0, 5)).isEqualTo(0);
  }

  @Test
  @DisplayName("should accept siblings and single-level increases unchanged")
  void shouldAcceptLegalTransitions() {
    assertThat(engine.repair(3, 3)).isEqualTo(3);
    assertThat(engine.repair(4, 3)).isEqualTo(4);
  }

  @Test
  @DisplayName("should clamp against the root sentinel depth")
  void shouldClampAgainstRoot() {
    assertThat(engine.repair(2, -1)).isEqualTo(0);
  }
}
