package com.papertrail.core.task.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import lombok.ToString;
import lombok.Value;

/**
 * An immutable unit of schedulable work: an id, a factory for its operation and a timeout.
 *
 * <p>The task keeps only the recipe of the operation. A pool invokes the factory when the task is started, so a task
 * waiting in a pending queue does not hold a running operation.
 *
 * @param <T> type of the published value
 */
@Value
public class StreamingTask<T> {
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  String id;
  @ToString.Exclude
  TaskOperationFactory<T> operationFactory;
  Duration timeout;
  Instant createdAt;

  public StreamingTask(String id, TaskOperationFactory<T> operationFactory, Duration timeout) {
    this.id = Objects.requireNonNull(id, "id");
    this.operationFactory = Objects.requireNonNull(operationFactory, "operationFactory");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("Task timeout must be positive: " + timeout);
    }
    this.createdAt = Instant.now();
  }

  public StreamingTask(String id, TaskOperationFactory<T> operationFactory) {
    this(id, operationFactory, DEFAULT_TIMEOUT);
  }

  /**
   * Creates a fresh operation from the factory.
   */
  public CompletionStage<TaskResult<T>> createOperation() {
    return operationFactory.create();
  }
}
