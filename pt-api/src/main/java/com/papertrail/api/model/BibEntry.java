package com.papertrail.api.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bibliographic entry of a publication. Sources send the author either as a single string or as a list of names;
 * both are read into {@link #author}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BibEntry {
  private String pubType;
  private String bibId;
  @JsonProperty("abstract")
  private String abstractText;
  private String title;
  @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
  private List<String> author;
  private String pubYear;
  private String venue;
  private String journal;
  private String publisher;
  private String citation;
}
