package com.papertrail.api.service;

import com.papertrail.api.model.Author;
import java.util.concurrent.CompletionStage;

public interface AuthorSummarizer {

  /**
   * Writes a short blurb about the research of an author in the context of a query.
   *
   * @param author a filled author whose publications are already ranked and trimmed
   * @param query  search query
   * @return the blurb
   */
  CompletionStage<String> summarize(Author author, String query);
}
