package com.papertrail.core.task.model;

import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Outcome of one task operation: an optional value for the stream consumer and the follow-up tasks to enqueue.
 *
 * @param <T> type of the published value
 */
@ToString
@EqualsAndHashCode
public final class TaskResult<T> {
  private final T publishable;
  private final List<StreamingTask<T>> next;

  private TaskResult(T publishable, List<StreamingTask<T>> next) {
    this.publishable = publishable;
    this.next = next == null ? List.of() : List.copyOf(next);
  }

  public static <T> TaskResult<T> empty() {
    return new TaskResult<>(null, List.of());
  }

  public static <T> TaskResult<T> of(T publishable) {
    return new TaskResult<>(publishable, List.of());
  }

  public static <T> TaskResult<T> of(T publishable, List<StreamingTask<T>> next) {
    return new TaskResult<>(publishable, next);
  }

  /**
   * A result that publishes nothing and only spawns follow-up tasks.
   */
  public static <T> TaskResult<T> spawn(List<StreamingTask<T>> next) {
    return new TaskResult<>(null, next);
  }

  public Optional<T> getPublishable() {
    return Optional.ofNullable(publishable);
  }

  public List<StreamingTask<T>> getNext() {
    return next;
  }

  public boolean hasNext() {
    return !next.isEmpty();
  }
}
