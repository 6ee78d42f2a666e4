package com.flamingo.ai.gedcom.service.parsing;

import com.flamingo.ai.gedcom.service.parsing.model.BlankLine;
import com.flamingo.ai.gedcom.service.parsing.model.ClassifiedLine;
import com.flamingo.ai.gedcom.service.parsing.model.LeveledLine;
import com.flamingo.ai.gedcom.service.parsing.model.OrphanLine;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Decides whether a physical line is a leveled record line, blank, or an orphan fragment.
 *
 * <p>A leveled line is: one or more digits, whitespace, an optional {@code @pointer@} followed by
 * whitespace, a tag of word characters, and optionally whitespace plus the value. Any other
 * non-blank line is an orphan. Stateless and safe to share.
 */
@Component
public class LineClassifier {

  private static final Pattern LEVELED =
      Pattern.compile("^(\\d+)\\s+(?:(@[^@\\s][^@]*@)\\s+)?(\\w+)(?:\\s+(.*))?$");

  /** Basic prefix test used by the format validator: digits followed by whitespace. */
  private static final Pattern LEVEL_PREFIX = Pattern.compile("^\\d+\\s");

  /**
   * Classifies one line. Surrounding whitespace and line terminators are stripped first.
   *
   * @param rawLine physical line, may be {@code null}
   * @return the classification, never {@code null}
   */
  public ClassifiedLine classify(String rawLine) {
    String line = rawLine == null ? "" : rawLine.strip();
    if (line.isEmpty()) {
      return BlankLine.INSTANCE;
    }
    Matcher m = LEVELED.matcher(line);
    if (!m.matches()) {
      return new OrphanLine(line);
    }
    int depth;
    try {
      depth = Integer.parseInt(m.group(1));
    } catch (NumberFormatException e) {
      // more digits than an int holds; not a usable level
      return new OrphanLine(line);
    }
    String value = m.group(4);
    if (value != null) {
      value = value.strip();
    }
    return new LeveledLine(depth, m.group(2), m.group(3), value);
  }

  /** Returns {@code true} if the line starts with a level number followed by whitespace. */
  public boolean hasLevelPrefix(String rawLine) {
    return rawLine != null && LEVEL_PREFIX.matcher(rawLine).find();
  }
}
