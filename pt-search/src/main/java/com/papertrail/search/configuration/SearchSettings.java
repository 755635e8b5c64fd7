package com.papertrail.search.configuration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SearchSettings {
  public static final String CONFIG_PATH = "papertrail.search";

  @Builder.Default
  String keywordSeparator = ",";
  @Builder.Default
  Duration searchTimeout = Duration.ofSeconds(30);
  @Builder.Default
  Duration fillTimeout = Duration.ofSeconds(60);
  @Builder.Default
  int maxPublications = 50;
  @Builder.Default
  int topKPublications = 10;
  @Builder.Default
  int maxConcurrentTasks = 10;
  @Builder.Default
  int maxTotalTasks = 200;
  @Builder.Default
  Duration streamTimeout = Duration.ofSeconds(120);

  public static SearchSettings load() {
    return fromConfig(ConfigFactory.load());
  }

  public static SearchSettings fromConfig(Config config) {
    Config search = config.getConfig(CONFIG_PATH);
    return SearchSettings.builder()
        .keywordSeparator(search.getString("keyword-separator"))
        .searchTimeout(search.getDuration("search-timeout"))
        .fillTimeout(search.getDuration("fill-timeout"))
        .maxPublications(search.getInt("max-publications"))
        .topKPublications(search.getInt("top-k-publications"))
        .maxConcurrentTasks(search.getInt("max-concurrent-tasks"))
        .maxTotalTasks(search.getInt("max-total-tasks"))
        .streamTimeout(search.getDuration("stream-timeout"))
        .build();
  }
}
