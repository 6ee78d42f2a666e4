package com.flamingo.ai.gedcom.service.parsing.model;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Construction-time stack of open records, innermost on top.
 *
 * <p>Attaching a record first closes every open record at the same or a deeper level, then links
 * the new record under whatever remains on top (or under the root sentinel). One instance serves a
 * single build and is discarded afterwards.
 */
public final class AncestorStack {

  private final GedcomRecord root = GedcomRecord.rootSentinel();
  private final IdentifierIndex index = new IdentifierIndex();
  private final Deque<GedcomRecord> open = new ArrayDeque<>();
  private int attached;

  /**
   * Attaches a record for {@code line} and returns it.
   *
   * @throws IllegalArgumentException if the line carries a negative depth or a blank tag
   */
  public GedcomRecord attach(LeveledLine line) {
    if (line.depth() < 0) {
      throw new IllegalArgumentException("Negative depth " + line.depth());
    }
    while (!open.isEmpty() && open.peek().getDepth() >= line.depth()) {
      open.pop();
    }
    GedcomRecord parent = open.isEmpty() ? root : open.peek();
    GedcomRecord record =
        new GedcomRecord(line.depth(), line.pointer(), line.tag(), line.value(), parent);
    parent.addChild(record);
    index.register(record);
    open.push(record);
    attached++;
    return record;
  }

  public int attachedCount() {
    return attached;
  }

  /** Returns the assembled tree. The stack must not be used afterwards. */
  public RecordTree finish() {
    open.clear();
    return new RecordTree(root, index);
  }
}
