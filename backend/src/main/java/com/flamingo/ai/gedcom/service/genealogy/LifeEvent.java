package com.flamingo.ai.gedcom.service.genealogy;

import com.flamingo.ai.gedcom.service.parsing.model.GedcomRecord;

/**
 * Date and place of a birth or death event.
 *
 * @param date free-form GEDCOM date, or {@code null}
 * @param place place name, or {@code null}
 */
public record LifeEvent(String date, String place) {

  static LifeEvent from(GedcomRecord event) {
    return new LifeEvent(event.getChildValue("DATE"), event.getChildValue("PLAC"));
  }

  public boolean isEmpty() {
    return isBlank(date) && isBlank(place);
  }

  public boolean hasDate() {
    return !isBlank(date);
  }

  public boolean hasPlace() {
    return !isBlank(place);
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
