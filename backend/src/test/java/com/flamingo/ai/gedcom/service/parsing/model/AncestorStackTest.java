package com.flamingo.ai.gedcom.service.parsing.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AncestorStack Tests")
class AncestorStackTest {

  private AncestorStack stack;

  @BeforeEach
  void setUp() {
    stack = new AncestorStack();
  }

  private GedcomRecord attach(int depth, String pointer, String tag, String value) {
    return stack.attach(new LeveledLine(depth, pointer, tag, value));
  }

  @Test
  @DisplayName("should attach siblings to the same parent")
  void shouldAttachSiblings() {
    GedcomRecord indi = attach(0, "@I1@", "INDI", null);
    GedcomRecord name = attach(1, null, "NAME", "John /Smith/");
    GedcomRecord sex = attach(1, null, "SEX", "M");

    assertThat(name.getParent()).isSameAs(indi);
    assertThat(sex.getParent()).isSameAs(indi);
    assertThat(indi.getChildren()).containsExactly(name, sex);
    assertThat(stack.attachedCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("should attach a skipped level under the nearest shallower record")
  void shouldAttachAcrossSkippedLevels() {
    GedcomRecord head = attach(0, null, "HEAD", null);
    GedcomRecord deep = attach(4, null, "VERS", "5.5");

    assertThat(deep.getParent()).isSameAs(head);
  }

  @Test
  @DisplayName("should attach depth 1 records without a depth-0 record to the root")
  void shouldAttachOrphanedDepthToRoot() {
    GedcomRecord cont = attach(1, null, "CONT", "text");
    RecordTree tree = stack.finish();

    assertThat(cont.getParent()).isSameAs(tree.root());
    assertThat(tree.topLevelRecords()).containsExactly(cont);
  }

  @Test
  @DisplayName("should reject negative depths")
  void shouldRejectNegativeDepth() {
    assertThatThrownBy(() -> attach(-2, null, "X", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Negative depth");
    assertThat(stack.attachedCount()).isZero();
  }

  @Test
  @DisplayName("should register pointers and remember redeclarations")
  void shouldRegisterPointers() {
    attach(0, "@F1@", "FAM", null);
    GedcomRecord second = attach(0, "@F1@", "FAM", "again");
    attach(0, "@I1@", "INDI", null);
    IdentifierIndex index = stack.finish().index();

    assertThat(index.resolve("@F1@")).containsSame(second);
    assertThat(index.getRedeclaredPointers()).containsExactly("@F1@");
    assertThat(index.size()).isEqualTo(2);
    assertThat(index.resolve(" ")).isEmpty();
    assertThat(index.resolve(null)).isEmpty();
  }

  @Test
  @DisplayName("should fold CONT and CONC children into the full value")
  void shouldFoldContinuations() {
    GedcomRecord note = attach(1, null, "NOTE", "First");
    attach(2, null, "CONT", "second line");
    attach(2, null, "CONC", " continued");
    attach(2, null, "SOUR", "ignored");

    assertThat(note.getFullValue()).isEqualTo("First\nsecond line continued");
  }

  @Test
  @DisplayName("should find children by tag")
  void shouldFindChildrenByTag() {
    GedcomRecord indi = attach(0, "@I1@", "INDI", null);
    attach(1, null, "FAMS", "@F1@");
    attach(1, null, "FAMS", "@F2@");

    assertThat(indi.findChildren("FAMS"))
        .extracting(GedcomRecord::getValue)
        .containsExactly("@F1@", "@F2@");
    assertThat(indi.getChildValue("FAMS")).isEqualTo("@F1@");
    assertThat(indi.findChild("BIRT")).isEmpty();
    assertThat(indi.getChildValue("BIRT")).isNull();
  }

  @Test
  @DisplayName("should format records as leveled lines")
  void shouldFormatRecords() {
    GedcomRecord indi = attach(0, "@I1@", "INDI", null);
    GedcomRecord name = attach(1, null, "NAME", "John /Smith/");

    assertThat(indi.toLine()).isEqualTo("0 @I1@ INDI");
    assertThat(name.toString()).isEqualTo("1 NAME John /Smith/");
    assertThat(stack.finish().root().toString()).isEqualTo("ROOT");
  }
}
