package com.papertrail.search;

import akka.NotUsed;
import akka.japi.pf.PFBuilder;
import akka.stream.javadsl.Source;
import com.papertrail.api.model.stream.StreamMessage;
import com.papertrail.search.configuration.SearchSettings;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Search stream as it is sent to a client: every published value as a {@value StreamMessage#MESSAGE_EVENT} message,
 * followed by a single {@value StreamMessage#FINISH_EVENT} message. A stream that runs longer than the configured
 * stream timeout is cut short and still ends with the finish message.
 */
@Slf4j
public class SearchStreamService {
  private final GlobalSearchStream globalSearchStream;
  private final SearchSettings settings;

  public SearchStreamService(GlobalSearchStream globalSearchStream, SearchSettings settings) {
    this.globalSearchStream = globalSearchStream;
    this.settings = settings;
  }

  public Source<StreamMessage, NotUsed> search(String query) {
    return globalSearchStream.search(query)
        .map(StreamMessage::message)
        .concat(Source.single(StreamMessage.finish()))
        .completionTimeout(settings.getStreamTimeout())
        .recover(new PFBuilder<Throwable, StreamMessage>()
            .match(TimeoutException.class, e -> {
              log.warn("Search stream for query '{}' did not finish in {}", query, settings.getStreamTimeout());
              return StreamMessage.finish();
            })
            .build());
  }
}
