package com.flamingo.ai.gedcom.api.dto.response;

import com.flamingo.ai.gedcom.service.genealogy.IndividualView;
import com.flamingo.ai.gedcom.service.genealogy.LifeEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one individual. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndividualResponse {

  private String id;
  private String name;
  private String gender;
  private String birthDate;
  private String birthPlace;
  private String deathDate;
  private String deathPlace;

  /** Creates an IndividualResponse from an individual view. */
  public static IndividualResponse fromView(IndividualView view) {
    LifeEvent birth = view.birth();
    LifeEvent death = view.death();
    return IndividualResponse.builder()
        .id(view.pointer())
        .name(view.displayName())
        .gender(view.gender())
        .birthDate(birth != null ? birth.date() : null)
        .birthPlace(birth != null ? birth.place() : null)
        .deathDate(death != null ? death.date() : null)
        .deathPlace(death != null ? death.place() : null)
        .build();
  }
}
