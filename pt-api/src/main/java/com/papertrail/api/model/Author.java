package com.papertrail.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Author profile as found by a scholar search. Search results carry only the basic profile; publications are present
 * once the author has been filled, and {@link #summary} once a blurb has been written for a query.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Author {
  private String scholarId;
  private String name;
  private String affiliation;
  private String emailDomain;
  private String urlPicture;
  private String homepage;
  private Integer citedby;
  private Integer hindex;
  private List<String> interests;
  private Map<String, Integer> citesPerYear;
  private List<Publication> publications;
  private List<String> filled;
  private String summary;
}
