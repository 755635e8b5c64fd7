package com.papertrail.api.service;

import com.papertrail.api.model.Author;
import com.papertrail.api.model.Publication;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Access to a scholar index. Implementations decide how many results a search returns.
 */
public interface ScholarSearchService {

  /**
   * Finds authors whose interests match the keywords.
   *
   * @param keywords trimmed, non-blank keywords
   * @return basic author profiles, without publications
   */
  CompletionStage<List<Author>> searchAuthors(List<String> keywords);

  /**
   * Finds publications matching a free text query.
   *
   * @param query search query
   * @return matching publications
   */
  CompletionStage<List<Publication>> searchPublications(String query);

  /**
   * Loads the full profile of an author found by {@link #searchAuthors(List)}, publications included.
   *
   * @param author an author with at least the scholar id set
   * @return a filled copy of the author
   */
  CompletionStage<Author> fillAuthor(Author author);
}
