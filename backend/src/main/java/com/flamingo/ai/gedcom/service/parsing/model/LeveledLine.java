package com.flamingo.ai.gedcom.service.parsing.model;

/**
 * A line that satisfies the leveled-line grammar.
 *
 * @param depth nesting level, {@code 0} for top-level records
 * @param pointer identifier including its {@code @} wrappers, or {@code null}
 * @param tag record tag, never blank
 * @param value trailing text, or {@code null} when absent
 */
public record LeveledLine(int depth, String pointer, String tag, String value)
    implements ClassifiedLine {

  public LeveledLine withDepth(int newDepth) {
    return new LeveledLine(newDepth, pointer, tag, value);
  }

  /** Appends {@code text} to the value, separated by a single space. */
  public LeveledLine appendValue(String text) {
    String merged = value == null || value.isEmpty() ? text : value + " " + text;
    return new LeveledLine(depth, pointer, tag, merged);
  }

  @Override
  public String format() {
    StringBuilder sb = new StringBuilder().append(depth).append(' ');
    if (pointer != null) {
      sb.append(pointer).append(' ');
    }
    sb.append(tag);
    if (value != null && !value.isEmpty()) {
      sb.append(' ').append(value);
    }
    return sb.toString();
  }
}
