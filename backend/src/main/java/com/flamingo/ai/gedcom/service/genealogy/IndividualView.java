package com.flamingo.ai.gedcom.service.genealogy;

import com.flamingo.ai.gedcom.service.parsing.model.GedcomRecord;

/**
 * Read-only projection of an {@code INDI} record.
 *
 * @param pointer the individual's pointer, e.g. {@code @I1@}
 * @param givenName given name(s), empty if unknown
 * @param surname surname, empty if unknown
 * @param gender value of {@code SEX}, or {@code null}
 * @param birth birth event, {@code null} if absent
 * @param death death event, {@code null} if absent
 * @param record the underlying record
 */
public record IndividualView(
    String pointer,
    String givenName,
    String surname,
    String gender,
    LifeEvent birth,
    LifeEvent death,
    GedcomRecord record) {

  static IndividualView from(GedcomRecord indi) {
    String given = "";
    String surname = "";
    GedcomRecord name = indi.findChild("NAME").orElse(null);
    if (name != null) {
      String value = name.getValue() == null ? "" : name.getValue();
      int open = value.indexOf('/');
      if (open >= 0) {
        int close = value.indexOf('/', open + 1);
        given = value.substring(0, open).strip();
        surname =
            (close > open ? value.substring(open + 1, close) : value.substring(open + 1)).strip();
      } else {
        given = value.strip();
      }
      if (given.isEmpty() && name.getChildValue("GIVN") != null) {
        given = name.getChildValue("GIVN").strip();
      }
      if (surname.isEmpty() && name.getChildValue("SURN") != null) {
        surname = name.getChildValue("SURN").strip();
      }
    }
    return new IndividualView(
        indi.getPointer(),
        given,
        surname,
        indi.getChildValue("SEX"),
        indi.findChild("BIRT").map(LifeEvent::from).orElse(null),
        indi.findChild("DEAT").map(LifeEvent::from).orElse(null),
        indi);
  }

  /** Returns "Given Surname", or {@code Unknown} if the individual has no name. */
  public String displayName() {
    String full = (givenName + " " + surname).strip();
    return full.isEmpty() ? "Unknown" : full;
  }
}
