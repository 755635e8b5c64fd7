package com.papertrail.core.task.model;

import java.util.Optional;

/**
 * A resolved task as reported by the pool. The result is present only for {@link TaskOutcome#COMPLETED}.
 */
public record TaskCompletion<T>(String taskId, TaskOutcome outcome, TaskResult<T> result, Throwable cause) {

  public static <T> TaskCompletion<T> completed(String taskId, TaskResult<T> result) {
    return new TaskCompletion<>(taskId, TaskOutcome.COMPLETED, result, null);
  }

  public static <T> TaskCompletion<T> failed(String taskId, Throwable cause) {
    return new TaskCompletion<>(taskId, TaskOutcome.FAILED, null, cause);
  }

  public static <T> TaskCompletion<T> timedOut(String taskId) {
    return new TaskCompletion<>(taskId, TaskOutcome.TIMED_OUT, null, null);
  }

  public Optional<TaskResult<T>> getResult() {
    return Optional.ofNullable(result);
  }
}
