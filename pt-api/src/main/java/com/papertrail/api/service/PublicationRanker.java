package com.papertrail.api.service;

import com.papertrail.api.model.Publication;
import java.util.List;

/**
 * Orders publications by their relevance to a query. Ranking is CPU-bound and blocking; callers run it off the
 * threads that drive streams.
 */
public interface PublicationRanker {

  /**
   * @param query        search query
   * @param publications candidates, compared by {@link Publication#describe()}
   * @param topK         maximum number of publications to return
   * @return at most {@code topK} publications, most relevant first
   */
  List<Publication> rank(String query, List<Publication> publications, int topK);
}
