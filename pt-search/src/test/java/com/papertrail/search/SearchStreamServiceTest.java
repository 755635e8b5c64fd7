package com.papertrail.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.stream.javadsl.Sink;
import akka.stream.javadsl.Source;
import com.papertrail.api.model.Author;
import com.papertrail.api.model.stream.SetAuthorList;
import com.papertrail.api.model.stream.SetPublicationList;
import com.papertrail.api.model.stream.StreamMessage;
import com.papertrail.api.model.stream.Streamable;
import com.papertrail.api.service.AuthorSummarizer;
import com.papertrail.api.service.PublicationRanker;
import com.papertrail.api.service.ScholarSearchService;
import com.papertrail.core.configuration.StreamingSettings;
import com.papertrail.search.configuration.SearchSettings;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class SearchStreamServiceTest {
  static final ActorTestKit testKit = ActorTestKit.create();

  @AfterAll
  static void teardown() {
    testKit.shutdownTestKit();
  }

  @Test
  void valuesAreWrappedAndFollowedByFinish() throws Exception {
    GlobalSearchStream globalSearchStream = Mockito.mock(GlobalSearchStream.class);
    when(globalSearchStream.search("engines")).thenReturn(Source.from(List.<Streamable>of(
        new SetAuthorList(List.of()), new SetPublicationList(List.of()))));
    var service = new SearchStreamService(globalSearchStream, SearchSettings.builder().build());

    List<StreamMessage> messages = run(service, "engines");

    assertThat(messages).extracting(StreamMessage::getEvent).containsExactly("message", "message", "finish");
    assertThat(messages.get(0).getData()).isInstanceOf(SetAuthorList.class);
    assertThat(messages.get(2).getData()).isNull();
  }

  @Test
  void streamThatRunsOutOfTimeEndsWithFinish() throws Exception {
    GlobalSearchStream globalSearchStream = Mockito.mock(GlobalSearchStream.class);
    when(globalSearchStream.search("engines")).thenReturn(
        Source.<Streamable>single(new SetAuthorList(List.of())).concat(Source.never()));
    var service = new SearchStreamService(globalSearchStream,
        SearchSettings.builder().streamTimeout(Duration.ofMillis(300)).build());

    List<StreamMessage> messages = run(service, "engines");

    assertThat(messages).extracting(StreamMessage::getEvent).containsExactly("message", "finish");
  }

  @Test
  void pendingFillsDoNotHoldTheStreamPastItsTimeout() throws Exception {
    ScholarSearchService scholarSearchService = Mockito.mock(ScholarSearchService.class);
    when(scholarSearchService.searchAuthors(anyList())).thenReturn(CompletableFuture.completedFuture(
        List.of(Author.builder().scholarId("ada").name("Ada").build())));
    when(scholarSearchService.searchPublications(any())).thenReturn(CompletableFuture.completedFuture(List.of()));
    when(scholarSearchService.fillAuthor(any())).thenReturn(new CompletableFuture<>());
    SearchSettings settings = SearchSettings.builder().streamTimeout(Duration.ofMillis(500)).build();
    var globalSearchStream = new GlobalSearchStream(testKit.system(), scholarSearchService,
        Mockito.mock(PublicationRanker.class), Mockito.mock(AuthorSummarizer.class), Runnable::run, settings,
        StreamingSettings.builder().build());
    var service = new SearchStreamService(globalSearchStream, settings);

    long start = System.nanoTime();
    List<StreamMessage> messages = run(service, "engines");

    assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(5_000);
    assertThat(messages).extracting(StreamMessage::getEvent).containsExactly("message", "message", "finish");
  }

  private static List<StreamMessage> run(SearchStreamService service, String query) throws Exception {
    return service.search(query)
        .runWith(Sink.seq(), testKit.system())
        .toCompletableFuture()
        .get(10, TimeUnit.SECONDS);
  }
}
