package com.papertrail.core.configuration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Sizing and timing defaults of the streaming engine, read from the {@code papertrail.streaming} config section.
 */
@Value
@Builder
public class StreamingSettings {
  public static final String CONFIG_PATH = "papertrail.streaming";
  public static final int DEFAULT_MAX_CONCURRENT_TASKS = 10;
  public static final int DEFAULT_MAX_TOTAL_TASKS = 1000;

  @Builder.Default
  int maxConcurrentTasks = DEFAULT_MAX_CONCURRENT_TASKS;
  @Builder.Default
  int maxTotalTasks = DEFAULT_MAX_TOTAL_TASKS;
  @Builder.Default
  Duration defaultTaskTimeout = Duration.ofSeconds(30);
  /**
   * Timeout of pool control requests. Waiting for the next completion uses the longest task timeout plus this value.
   */
  @Builder.Default
  Duration askTimeout = Duration.ofSeconds(5);

  public static StreamingSettings load() {
    return fromConfig(ConfigFactory.load());
  }

  public static StreamingSettings fromConfig(Config config) {
    Config streaming = config.getConfig(CONFIG_PATH);
    return StreamingSettings.builder()
        .maxConcurrentTasks(streaming.getInt("max-concurrent-tasks"))
        .maxTotalTasks(streaming.getInt("max-total-tasks"))
        .defaultTaskTimeout(streaming.getDuration("default-task-timeout"))
        .askTimeout(streaming.getDuration("ask-timeout"))
        .build();
  }
}
