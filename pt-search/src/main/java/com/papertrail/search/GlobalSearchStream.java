package com.papertrail.search;

import akka.NotUsed;
import akka.actor.typed.ActorSystem;
import akka.stream.javadsl.Source;
import com.papertrail.api.model.Author;
import com.papertrail.api.model.Publication;
import com.papertrail.api.model.stream.SetAuthorList;
import com.papertrail.api.model.stream.SetPublicationList;
import com.papertrail.api.model.stream.Streamable;
import com.papertrail.api.model.stream.UpdateAuthor;
import com.papertrail.api.service.AuthorSummarizer;
import com.papertrail.api.service.PublicationRanker;
import com.papertrail.api.service.ScholarSearchService;
import com.papertrail.core.configuration.StreamingSettings;
import com.papertrail.core.task.DynamicStreamingIterator;
import com.papertrail.core.task.StreamingTasks;
import com.papertrail.core.task.model.StreamingTask;
import com.papertrail.core.task.model.TaskResult;
import com.papertrail.search.configuration.SearchSettings;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Streams the results of a global search: the author list and the publication list as soon as each search is done,
 * then every listed author again once its profile is filled, ranked against the query and summarized.
 */
@Slf4j
public class GlobalSearchStream {
  public static final String SEARCH_AUTHORS_TASK = "search-authors";
  public static final String SEARCH_PUBLICATIONS_TASK = "search-publications";
  public static final String FILL_AUTHOR_TASK_PREFIX = "fill-author-";

  private final ActorSystem<?> actorSystem;
  private final ScholarSearchService scholarSearchService;
  private final PublicationRanker publicationRanker;
  private final AuthorSummarizer authorSummarizer;
  private final Executor rankingExecutor;
  private final SearchSettings settings;
  private final StreamingSettings streamingSettings;

  /**
   * @param rankingExecutor runs publication ranking, which blocks while it computes
   */
  public GlobalSearchStream(ActorSystem<?> actorSystem, ScholarSearchService scholarSearchService,
                            PublicationRanker publicationRanker, AuthorSummarizer authorSummarizer,
                            Executor rankingExecutor, SearchSettings settings, StreamingSettings streamingSettings) {
    this.actorSystem = actorSystem;
    this.scholarSearchService = scholarSearchService;
    this.publicationRanker = publicationRanker;
    this.authorSummarizer = authorSummarizer;
    this.rankingExecutor = rankingExecutor;
    this.settings = settings;
    this.streamingSettings = streamingSettings;
  }

  public Source<Streamable, NotUsed> search(String query) {
    return iterator(query).source();
  }

  DynamicStreamingIterator<Streamable> iterator(String query) {
    if (StringUtils.isBlank(query)) {
      throw new IllegalArgumentException("Search query must not be blank");
    }
    log.debug("Searching for query: {}", query);
    List<StreamingTask<Streamable>> initialTasks = List.of(
        StreamingTasks.task(SEARCH_AUTHORS_TASK, () -> searchAuthors(query), settings.getSearchTimeout()),
        StreamingTasks.task(SEARCH_PUBLICATIONS_TASK, () -> searchPublications(query), settings.getSearchTimeout()));
    return new DynamicStreamingIterator<>(actorSystem, initialTasks,
        settings.getMaxConcurrentTasks(), settings.getMaxTotalTasks(), streamingSettings);
  }

  List<String> keywords(String query) {
    return Arrays.stream(query.split(Pattern.quote(settings.getKeywordSeparator())))
        .map(String::trim)
        .filter(StringUtils::isNotBlank)
        .toList();
  }

  private CompletionStage<TaskResult<Streamable>> searchAuthors(String query) {
    return scholarSearchService.searchAuthors(keywords(query)).thenApply(authors -> {
      List<StreamingTask<Streamable>> fillTasks = authors.stream()
          .filter(author -> {
            if (StringUtils.isBlank(author.getScholarId())) {
              log.debug("Author {} has no scholar id and will not be filled", author.getName());
              return false;
            }
            return true;
          })
          .map(author -> fillAuthorTask(author, query))
          .toList();
      log.debug("Found {} authors for query: {}", authors.size(), query);
      return TaskResult.<Streamable>of(new SetAuthorList(authors), fillTasks);
    });
  }

  private CompletionStage<TaskResult<Streamable>> searchPublications(String query) {
    return scholarSearchService.searchPublications(query)
        .thenApply(publications -> TaskResult.<Streamable>of(new SetPublicationList(publications)));
  }

  private StreamingTask<Streamable> fillAuthorTask(Author author, String query) {
    return StreamingTasks.task(FILL_AUTHOR_TASK_PREFIX + author.getScholarId(),
        () -> fillAuthor(author, query), settings.getFillTimeout());
  }

  private CompletionStage<TaskResult<Streamable>> fillAuthor(Author author, String query) {
    return scholarSearchService.fillAuthor(author)
        .thenApplyAsync(filled -> rankPublications(filled, query), rankingExecutor)
        .thenCompose(ranked -> summarize(ranked, query))
        .thenApply(summarized -> TaskResult.<Streamable>of(new UpdateAuthor(summarized)));
  }

  private Author rankPublications(Author author, String query) {
    List<Publication> publications = author.getPublications() == null ? List.of() : author.getPublications();
    List<Publication> candidates = publications.subList(0, Math.min(publications.size(), settings.getMaxPublications()));
    List<Publication> ranked = candidates.isEmpty()
        ? List.of()
        : publicationRanker.rank(query, candidates, settings.getTopKPublications());
    return author.toBuilder().publications(ranked).build();
  }

  /**
   * Adds a summary to the author. An author whose summary cannot be written is published without one.
   */
  private CompletionStage<Author> summarize(Author author, String query) {
    return CompletableFuture.completedFuture(author)
        .thenCompose(ranked -> authorSummarizer.summarize(ranked, query))
        .handle((summary, error) -> {
          if (error != null) {
            log.warn("Cannot summarize author {} for query: {}", author.getScholarId(), query, error);
            return author;
          }
          return author.toBuilder().summary(summary).build();
        });
  }
}
