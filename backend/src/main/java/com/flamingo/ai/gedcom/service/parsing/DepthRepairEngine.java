package com.flamingo.ai.gedcom.service.parsing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Clamps illegal upward depth jumps.
 *
 * <p>A line may close any number of open levels at once but may open only one new level. A depth
 * more than one above the last accepted depth is reduced to exactly one above it; every other depth
 * is returned unchanged.
 */
@Component
@Slf4j
public class DepthRepairEngine {

  public int repair(int depth, int lastAcceptedDepth) {
    int limit = lastAcceptedDepth + 1;
    if (depth > limit) {
      log.debug(
          "Clamping depth {} to {} (last accepted depth {})", depth, limit, lastAcceptedDepth);
      return limit;
    }
    return depth;
  }
}
