package com.papertrail.core.task.model;

import java.util.concurrent.CompletionStage;

/**
 * Recipe for a task's asynchronous operation. Every call must return a fresh, not yet consumed operation.
 *
 * @param <T> type of the published value
 */
@FunctionalInterface
public interface TaskOperationFactory<T> {
  CompletionStage<TaskResult<T>> create();
}
