package com.flamingo.ai.gedcom.service.genealogy;

import java.util.List;

/**
 * The immediate family of an individual.
 *
 * @param parents parents with their relation ({@code Father}, {@code Mother} or {@code Parent})
 * @param spouses partners from families where the individual is a spouse
 * @param children children from those families
 */
public record FamilyInfo(
    List<Relative> parents, List<IndividualView> spouses, List<IndividualView> children) {

  /**
   * A parent and how they relate to the individual.
   *
   * @param relation {@code Father}, {@code Mother} or {@code Parent}
   * @param person the parent
   */
  public record Relative(String relation, IndividualView person) {}

  public boolean isEmpty() {
    return parents.isEmpty() && spouses.isEmpty() && children.isEmpty();
  }
}
