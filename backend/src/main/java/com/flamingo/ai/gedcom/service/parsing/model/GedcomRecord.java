package com.flamingo.ai.gedcom.service.parsing.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * One record of the leveled format: depth, optional pointer, tag, optional value and the ordered
 * child records nested beneath it.
 *
 * <p>Records are created and linked only while a {@link RecordTree} is assembled by the {@link
 * AncestorStack}; callers receive them read-only. {@link #getParent()} is a navigation link, the
 * tree owns its records through the child lists.
 */
@Getter
public final class GedcomRecord {

  static final int ROOT_DEPTH = -1;
  static final String ROOT_TAG = "ROOT";

  private static final String CONT = "CONT";
  private static final String CONC = "CONC";

  private final int depth;
  private final String pointer;
  private final String tag;
  private final String value;
  private final GedcomRecord parent;

  @Getter(AccessLevel.NONE)
  private final List<GedcomRecord> children = new ArrayList<>();

  GedcomRecord(int depth, String pointer, String tag, String value, GedcomRecord parent) {
    if (tag == null || tag.isBlank()) {
      throw new IllegalArgumentException("Record tag must not be blank");
    }
    this.depth = depth;
    this.pointer = pointer;
    this.tag = tag;
    this.value = value;
    this.parent = parent;
  }

  static GedcomRecord rootSentinel() {
    return new GedcomRecord(ROOT_DEPTH, null, ROOT_TAG, null, null);
  }

  void addChild(GedcomRecord child) {
    children.add(child);
  }

  /** Returns the child records in document order. */
  public List<GedcomRecord> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public boolean isRoot() {
    return parent == null && depth == ROOT_DEPTH;
  }

  public boolean hasPointer() {
    return pointer != null;
  }

  public Optional<GedcomRecord> findChild(String childTag) {
    return children.stream().filter(c -> c.tag.equals(childTag)).findFirst();
  }

  public List<GedcomRecord> findChildren(String childTag) {
    return children.stream().filter(c -> c.tag.equals(childTag)).toList();
  }

  /** Returns the value of the first child with {@code childTag}, or {@code null}. */
  public String getChildValue(String childTag) {
    return findChild(childTag).map(GedcomRecord::getValue).orElse(null);
  }

  /**
   * Returns the value with its continuation children folded in: {@code CONT} starts a new line,
   * {@code CONC} is appended directly.
   */
  public String getFullValue() {
    StringBuilder sb = new StringBuilder(value == null ? "" : value);
    for (GedcomRecord child : children) {
      String text = child.value == null ? "" : child.value;
      if (CONT.equals(child.tag)) {
        sb.append('\n').append(text);
      } else if (CONC.equals(child.tag)) {
        sb.append(text);
      }
    }
    return sb.toString();
  }

  /** Formats this record as a single leveled line. */
  public String toLine() {
    return new LeveledLine(depth, pointer, tag, value).format();
  }

  @Override
  public String toString() {
    return isRoot() ? ROOT_TAG : toLine();
  }
}
