package com.flamingo.ai.gedcom.service.genealogy;

import com.flamingo.ai.gedcom.exception.IndividualNotFoundException;
import com.flamingo.ai.gedcom.service.parsing.model.GedcomRecord;
import com.flamingo.ai.gedcom.service.parsing.model.IdentifierIndex;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Genealogical lookups over a loaded {@link RecordTree}: individuals, their names and events, and
 * their parents, spouses and children.
 *
 * <p>Cross-references are resolved through the tree's {@link IdentifierIndex}. Dangling references
 * are ignored.
 */
@Service
@Slf4j
public class GenealogyQueryService {

  static final String INDI = "INDI";
  static final String FAM = "FAM";

  /** Returns every top-level individual in document order. */
  public List<IndividualView> listIndividuals(RecordTree tree) {
    return tree.topLevelRecords(INDI).stream().map(IndividualView::from).toList();
  }

  /**
   * Returns individuals whose "given surname" contains {@code term}, ignoring case.
   *
   * @param tree the loaded tree
   * @param term search term; a blank term matches nobody
   */
  public List<IndividualView> searchIndividuals(RecordTree tree, String term) {
    if (term == null || term.isBlank()) {
      return List.of();
    }
    String needle = term.strip().toLowerCase(Locale.ROOT);
    return listIndividuals(tree).stream()
        .filter(i -> !(i.givenName().isEmpty() && i.surname().isEmpty()))
        .filter(i -> (i.givenName() + " " + i.surname()).toLowerCase(Locale.ROOT).contains(needle))
        .toList();
  }

  /**
   * Finds an individual by id.
   *
   * @param tree the loaded tree
   * @param individualId pointer with or without {@code @} wrappers, e.g. {@code I1} or {@code @I1@}
   * @throws IndividualNotFoundException if the id does not resolve to an {@code INDI} record
   */
  public IndividualView findIndividual(RecordTree tree, String individualId) {
    return tree.index()
        .resolve(individualId)
        .filter(r -> INDI.equals(r.getTag()))
        .map(IndividualView::from)
        .orElseThrow(() -> new IndividualNotFoundException(individualId));
  }

  /**
   * Collects parents (from {@code FAMC} families), spouses and children (from {@code FAMS}
   * families). The individual never appears among their own relatives and nobody is listed twice.
   */
  public FamilyInfo familyInfo(RecordTree tree, IndividualView individual) {
    IdentifierIndex index = tree.index();
    GedcomRecord indi = individual.record();

    List<FamilyInfo.Relative> parents = new ArrayList<>();
    Set<String> seenParents = new LinkedHashSet<>();
    for (GedcomRecord family : families(index, indi, "FAMC")) {
      for (GedcomRecord member : family.getChildren()) {
        if (!"HUSB".equals(member.getTag()) && !"WIFE".equals(member.getTag())) {
          continue;
        }
        Optional<IndividualView> parent = resolveIndividual(index, member.getValue());
        if (parent.isPresent()
            && !parent.get().pointer().equals(individual.pointer())
            && seenParents.add(parent.get().pointer())) {
          parents.add(new FamilyInfo.Relative(relationOf(parent.get()), parent.get()));
        }
      }
    }

    List<IndividualView> spouses = new ArrayList<>();
    List<IndividualView> children = new ArrayList<>();
    Set<String> seenSpouses = new LinkedHashSet<>();
    Set<String> seenChildren = new LinkedHashSet<>();
    for (GedcomRecord family : families(index, indi, "FAMS")) {
      for (GedcomRecord member : family.getChildren()) {
        String ref = member.getValue();
        if (ref == null || ref.equals(individual.pointer())) {
          continue;
        }
        switch (member.getTag()) {
          case "HUSB", "WIFE" -> resolveIndividual(index, ref)
              .filter(s -> seenSpouses.add(s.pointer()))
              .ifPresent(spouses::add);
          case "CHIL" -> resolveIndividual(index, ref)
              .filter(c -> seenChildren.add(c.pointer()))
              .ifPresent(children::add);
          default -> {
            // not a family member reference
          }
        }
      }
    }

    return new FamilyInfo(parents, spouses, children);
  }

  /** Counts records, individuals and families. */
  public TreeStatistics statistics(RecordTree tree) {
    return new TreeStatistics(
        tree.recordCount(), tree.topLevelRecords(INDI).size(), tree.topLevelRecords(FAM).size());
  }

  private List<GedcomRecord> families(IdentifierIndex index, GedcomRecord indi, String linkTag) {
    List<GedcomRecord> families = new ArrayList<>();
    for (GedcomRecord link : indi.findChildren(linkTag)) {
      Optional<GedcomRecord> family =
          index.resolve(link.getValue()).filter(f -> FAM.equals(f.getTag()));
      if (family.isPresent()) {
        families.add(family.get());
      } else {
        log.debug("Unresolved {} reference {} on {}", linkTag, link.getValue(), indi.getPointer());
      }
    }
    return families;
  }

  private Optional<IndividualView> resolveIndividual(IdentifierIndex index, String pointer) {
    return index.resolve(pointer).filter(r -> INDI.equals(r.getTag())).map(IndividualView::from);
  }

  private static String relationOf(IndividualView parent) {
    if ("M".equals(parent.gender())) {
      return "Father";
    }
    if ("F".equals(parent.gender())) {
      return "Mother";
    }
    return "Parent";
  }
}
