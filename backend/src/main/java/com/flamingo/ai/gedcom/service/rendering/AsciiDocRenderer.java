package com.flamingo.ai.gedcom.service.rendering;

import com.flamingo.ai.gedcom.service.genealogy.FamilyInfo;
import com.flamingo.ai.gedcom.service.genealogy.GenealogyQueryService;
import com.flamingo.ai.gedcom.service.genealogy.IndividualView;
import com.flamingo.ai.gedcom.service.genealogy.LifeEvent;
import com.flamingo.ai.gedcom.service.parsing.model.RecordTree;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentRenderer} producing AsciiDoc.
 *
 * <p>Layout: title and document attributes, personal information, birth and death, parents,
 * spouses, children, an optional graphviz family diagram, and a footer. Relatives are listed with
 * their pointer so readers can look them up in the source file.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AsciiDocRenderer implements DocumentRenderer {

  private static final String DIAGRAM_NAME = "family-tree";

  private final GenealogyQueryService genealogyQueryService;

  @Override
  @Timed(value = "gedcom.render", description = "Time to render an AsciiDoc document")
  public String render(RecordTree tree, IndividualView individual, RenderOptions options) {
    List<String> lines = new ArrayList<>();
    String name = individual.displayName();

    lines.add("= " + name);
    if (options.tableOfContents()) {
      lines.add(":toc:");
      lines.add(":toc-title: Table of Contents");
    }
    if (options.numberedSections()) {
      lines.add(":numbered:");
    }
    lines.add("");

    lines.add("== Personal Information");
    lines.add("");
    lines.add("*ID:* " + individual.pointer());
    lines.add("");
    lines.add("*Full Name:* " + name);
    lines.add("");
    if (individual.gender() != null && !individual.gender().isBlank()) {
      lines.add("*Gender:* " + individual.gender());
      lines.add("");
    }
    appendEvent(lines, "Birth", individual.birth());
    appendEvent(lines, "Death", individual.death());

    FamilyInfo family = genealogyQueryService.familyInfo(tree, individual);

    if (!family.parents().isEmpty()) {
      lines.add("== Parents");
      lines.add("");
      for (FamilyInfo.Relative parent : family.parents()) {
        IndividualView p = parent.person();
        lines.add("* *" + parent.relation() + ":* " + p.displayName() + " (" + p.pointer() + ")");
        appendLifeDates(lines, p, true);
      }
      lines.add("");
    }

    if (!family.spouses().isEmpty()) {
      lines.add("== Spouse(s)");
      lines.add("");
      for (IndividualView spouse : family.spouses()) {
        lines.add("* *" + spouse.displayName() + "* (" + spouse.pointer() + ")");
        appendLifeDates(lines, spouse, true);
      }
      lines.add("");
    }

    if (!family.children().isEmpty()) {
      lines.add("== Children");
      lines.add("");
      for (IndividualView child : family.children()) {
        lines.add("* *" + child.displayName() + "* (" + child.pointer() + ")");
        appendLifeDates(lines, child, false);
      }
      lines.add("");
    }

    if (options.familyDiagram() && !family.isEmpty()) {
      appendDiagram(lines, individual, family);
    }

    lines.add("== Document Information");
    lines.add("");
    lines.add(
        "This document was automatically generated from a GEDCOM file "
            + "using the GEDCOM ingest service.");
    lines.add("");

    log.debug("Rendered AsciiDoc for {} ({} lines)", individual.pointer(), lines.size());
    return String.join("\n", lines);
  }

  @Override
  public String suggestedFileName(IndividualView individual) {
    String given = individual.givenName();
    if (given == null || given.isBlank()) {
      return "family_tree.adoc";
    }
    String clean = given.strip().replaceAll("[^\\w\\s-]", "").replaceAll("\\s+", "_");
    return clean.isEmpty() ? "family_tree.adoc" : clean.toLowerCase(Locale.ROOT) + ".adoc";
  }

  private static void appendEvent(List<String> lines, String title, LifeEvent event) {
    if (event == null || event.isEmpty()) {
      return;
    }
    lines.add("=== " + title);
    lines.add("");
    if (event.hasDate()) {
      lines.add("*Date:* " + event.date());
    }
    if (event.hasPlace()) {
      lines.add("*Place:* " + event.place());
    }
    lines.add("");
  }

  private static void appendLifeDates(List<String> lines, IndividualView person, boolean death) {
    if (person.birth() != null && person.birth().hasDate()) {
      lines.add("** Born: " + person.birth().date());
    }
    if (death && person.death() != null && person.death().hasDate()) {
      lines.add("** Died: " + person.death().date());
    }
  }

  private static void appendDiagram(
      List<String> lines, IndividualView individual, FamilyInfo family) {
    lines.add("== Family Diagram");
    lines.add("");
    lines.add("[graphviz, \"" + DIAGRAM_NAME + "\", svg]");
    lines.add("----");
    lines.add("digraph family {");
    lines.add("  rankdir=TB;");
    lines.add("  node [shape=box];");
    lines.add("  " + node(individual) + ", style=bold];");
    List<IndividualView> relatives = new ArrayList<>();
    family.parents().forEach(parent -> relatives.add(parent.person()));
    relatives.addAll(family.spouses());
    relatives.addAll(family.children());
    for (IndividualView relative : relatives) {
      lines.add("  " + node(relative) + "];");
    }
    for (FamilyInfo.Relative parent : family.parents()) {
      lines.add("  " + nodeId(parent.person()) + " -> " + nodeId(individual) + ";");
    }
    for (IndividualView spouse : family.spouses()) {
      lines.add(
          "  " + nodeId(spouse) + " -> " + nodeId(individual) + " [dir=none, style=dashed];");
    }
    for (IndividualView child : family.children()) {
      lines.add("  " + nodeId(individual) + " -> " + nodeId(child) + ";");
    }
    lines.add("}");
    lines.add("----");
    lines.add("");
  }

  /** Node statement without the closing bracket, so callers can add attributes. */
  private static String node(IndividualView person) {
    return nodeId(person) + " [label=\"" + person.displayName().replace("\"", "'") + "\"";
  }

  private static String nodeId(IndividualView person) {
    return "\"" + person.pointer().replace("@", "").replace("\"", "") + "\"";
  }
}
