package com.flamingo.ai.gedcom.service.parsing.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed document: the root sentinel whose children are the depth-0 records, and the index of
 * declared pointers.
 *
 * @param root sentinel record at depth {@code -1}; never part of the input
 * @param index pointer lookup built while records were attached
 */
public record RecordTree(GedcomRecord root, IdentifierIndex index) {

  /** Returns the top-level records in document order. */
  public List<GedcomRecord> topLevelRecords() {
    return root.getChildren();
  }

  public List<GedcomRecord> topLevelRecords(String tag) {
    return root.findChildren(tag);
  }

  /** Counts every record below the root sentinel. */
  public int recordCount() {
    return countBelow(root);
  }

  /** Serializes the tree back to leveled lines in document order. */
  public List<String> toLines() {
    List<String> lines = new ArrayList<>();
    appendLines(root, lines);
    return lines;
  }

  private static int countBelow(GedcomRecord record) {
    int count = 0;
    for (GedcomRecord child : record.getChildren()) {
      count += 1 + countBelow(child);
    }
    return count;
  }

  private static void appendLines(GedcomRecord record, List<String> lines) {
    for (GedcomRecord child : record.getChildren()) {
      lines.add(child.toLine());
      appendLines(child, lines);
    }
  }
}
