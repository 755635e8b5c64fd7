package com.papertrail.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Publication {
  private BibEntry bib;
  private Integer gsrank;
  private List<String> authorId;
  private Integer numCitations;
  private Map<String, Integer> citesPerYear;
  private String authorPubId;
  private String citedbyUrl;
  private String eprintUrl;
  private String pubUrl;
  private Boolean filled;

  /**
   * Text used to compare the publication against a search query.
   */
  public String describe() {
    String title = bib == null || bib.getTitle() == null ? "" : bib.getTitle();
    String citation = bib == null || bib.getCitation() == null ? "" : bib.getCitation();
    return "title: " + title + ". citation: " + citation;
  }
}
