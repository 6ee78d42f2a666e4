package com.flamingo.ai.gedcom.service.parsing.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps pointers to the record that declared them.
 *
 * <p>A pointer declared twice resolves to the later declaration. Redeclared pointers are remembered
 * so callers can report them; resolution never fails on them.
 */
public final class IdentifierIndex {

  private final Map<String, GedcomRecord> byPointer = new HashMap<>();
  private final Set<String> redeclared = new LinkedHashSet<>();

  void register(GedcomRecord record) {
    if (!record.hasPointer()) {
      return;
    }
    if (byPointer.put(record.getPointer(), record) != null) {
      redeclared.add(record.getPointer());
    }
  }

  /**
   * Looks up a record by pointer. Both the wrapped ({@code @I1@}) and bare ({@code I1}) forms are
   * accepted.
   */
  public Optional<GedcomRecord> resolve(String pointer) {
    if (pointer == null || pointer.isBlank()) {
      return Optional.empty();
    }
    String key = pointer.trim();
    if (!key.startsWith("@")) {
      key = "@" + key + "@";
    }
    return Optional.ofNullable(byPointer.get(key));
  }

  public boolean contains(String pointer) {
    return resolve(pointer).isPresent();
  }

  public int size() {
    return byPointer.size();
  }

  /** Pointers declared by more than one record, in order of first redeclaration. */
  public Set<String> getRedeclaredPointers() {
    return Collections.unmodifiableSet(redeclared);
  }
}
