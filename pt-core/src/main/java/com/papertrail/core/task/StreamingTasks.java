package com.papertrail.core.task;

import akka.actor.typed.ActorSystem;
import com.papertrail.core.configuration.StreamingSettings;
import com.papertrail.core.task.model.StreamingTask;
import com.papertrail.core.task.model.TaskOperationFactory;
import com.papertrail.core.task.model.TaskResult;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionStage;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

/**
 * Shortcuts for building streaming tasks and iterators.
 */
@UtilityClass
public class StreamingTasks {

  /**
   * Task with {@link StreamingTask#DEFAULT_TIMEOUT}. Specs without a timeout given to {@code iterator} take
   * {@link StreamingSettings#getDefaultTaskTimeout()} instead.
   */
  public static <T> StreamingTask<T> task(String taskId, TaskOperationFactory<T> factory) {
    return task(taskId, factory, StreamingTask.DEFAULT_TIMEOUT);
  }

  public static <T> StreamingTask<T> task(String taskId, TaskOperationFactory<T> factory, Duration timeout) {
    if (StringUtils.isBlank(taskId)) {
      throw new IllegalArgumentException("Task id must not be blank");
    }
    if (factory == null) {
      throw new IllegalArgumentException("Task " + taskId + " must have an operation factory");
    }
    return new StreamingTask<>(taskId, factory, timeout);
  }

  /**
   * Always fails: an operation that is already created can be consumed only once, so it cannot back a task.
   *
   * @throws IllegalArgumentException always
   */
  public static <T> StreamingTask<T> task(String taskId, CompletionStage<TaskResult<T>> operation, Duration timeout) {
    throw new IllegalArgumentException("Cannot create a streaming task from an already-created operation. "
        + "Provide a factory that returns a fresh operation (task " + taskId + ")");
  }

  public static <T> DynamicStreamingIterator<T> iterator(ActorSystem<?> actorSystem, List<TaskSpec<T>> specs,
                                                         int maxConcurrentTasks, int maxTotalTasks,
                                                         StreamingSettings settings) {
    List<StreamingTask<T>> initialTasks = specs.stream()
        .map(spec -> task(spec.taskId(), spec.factory(),
            spec.timeout() == null ? settings.getDefaultTaskTimeout() : spec.timeout()))
        .toList();
    return new DynamicStreamingIterator<>(actorSystem, initialTasks, maxConcurrentTasks, maxTotalTasks, settings);
  }

  public static <T> DynamicStreamingIterator<T> iterator(ActorSystem<?> actorSystem, List<TaskSpec<T>> specs,
                                                         int maxConcurrentTasks, int maxTotalTasks) {
    return iterator(actorSystem, specs, maxConcurrentTasks, maxTotalTasks, StreamingSettings.load());
  }

  /**
   * Iterator sized by the {@code papertrail.streaming} configuration.
   */
  public static <T> DynamicStreamingIterator<T> iterator(ActorSystem<?> actorSystem, List<TaskSpec<T>> specs) {
    StreamingSettings settings = StreamingSettings.load();
    return iterator(actorSystem, specs, settings.getMaxConcurrentTasks(), settings.getMaxTotalTasks(), settings);
  }

  /**
   * Id, operation factory and timeout of one initial task. A {@code null} timeout stands for the configured
   * {@code default-task-timeout}.
   */
  public static record TaskSpec<T>(String taskId, TaskOperationFactory<T> factory, Duration timeout) {

    public static <T> TaskSpec<T> of(String taskId, TaskOperationFactory<T> factory) {
      return new TaskSpec<>(taskId, factory, null);
    }

    public static <T> TaskSpec<T> of(String taskId, TaskOperationFactory<T> factory, Duration timeout) {
      return new TaskSpec<>(taskId, factory, timeout);
    }
  }
}
