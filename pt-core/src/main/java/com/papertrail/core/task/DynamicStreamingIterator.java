package com.papertrail.core.task;

import akka.Done;
import akka.NotUsed;
import akka.actor.typed.ActorSystem;
import akka.stream.javadsl.Source;
import com.papertrail.core.configuration.StreamingSettings;
import com.papertrail.core.task.model.StreamingTask;
import com.papertrail.core.task.model.TaskCompletion;
import com.papertrail.core.task.model.TaskResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a list of initial tasks into a stream of published values, in the order the tasks complete.
 *
 * <p>Follow-up tasks returned by completed tasks are fed back into the same pool while the cumulative number of
 * admitted tasks stays below {@code maxTotalTasks}; tasks over that cap are dropped. Failed and timed out tasks publish
 * nothing. The pool is shut down when the stream completes, fails or is cancelled by its consumer, so no task keeps
 * running after the stream is gone.
 *
 * <p>The source can be materialized only once.
 *
 * @param <T> type of the published value
 */
@Slf4j
public class DynamicStreamingIterator<T> {
  private final ActorSystem<?> actorSystem;
  private final List<StreamingTask<T>> initialTasks;
  private final int maxConcurrentTasks;
  private final int maxTotalTasks;
  private final StreamingSettings settings;
  private final AtomicBoolean consumed = new AtomicBoolean(false);
  private final AtomicInteger totalTasksCreated = new AtomicInteger(0);
  private volatile StreamingTaskPool<T> taskPool;

  public DynamicStreamingIterator(ActorSystem<?> actorSystem, List<StreamingTask<T>> initialTasks,
                                  int maxConcurrentTasks, int maxTotalTasks, StreamingSettings settings) {
    if (maxTotalTasks < 0) {
      throw new IllegalArgumentException("maxTotalTasks must not be negative: " + maxTotalTasks);
    }
    this.actorSystem = actorSystem;
    this.initialTasks = List.copyOf(initialTasks);
    this.maxConcurrentTasks = maxConcurrentTasks;
    this.maxTotalTasks = maxTotalTasks;
    this.settings = settings;
  }

  public DynamicStreamingIterator(ActorSystem<?> actorSystem, List<StreamingTask<T>> initialTasks,
                                  StreamingSettings settings) {
    this(actorSystem, initialTasks, settings.getMaxConcurrentTasks(), settings.getMaxTotalTasks(), settings);
  }

  public Source<T, NotUsed> source() {
    return Source.unfoldResourceAsync(this::open, this::readNext, this::close);
  }

  public int getTotalTasksCreated() {
    return totalTasksCreated.get();
  }

  /**
   * The pool serving this iterator, present once the source has been materialized.
   */
  public Optional<StreamingTaskPool<T>> getTaskPool() {
    return Optional.ofNullable(taskPool);
  }

  private CompletionStage<StreamingTaskPool<T>> open() {
    if (!consumed.compareAndSet(false, true)) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("Dynamic streaming iterator can be consumed only once"));
    }
    StreamingTaskPool<T> pool = StreamingTaskPool.create(actorSystem, maxConcurrentTasks, settings);
    taskPool = pool;
    totalTasksCreated.addAndGet(initialTasks.size());
    return pool.addTasks(initialTasks).handle((done, error) -> {
      if (error != null) {
        pool.shutdown();
        throw new CompletionException("Cannot submit initial tasks", error);
      }
      log.info("Started streaming iterator with {} initial tasks", initialTasks.size());
      return pool;
    });
  }

  private CompletionStage<Optional<T>> readNext(StreamingTaskPool<T> pool) {
    return pool.hasActiveTasks().thenCompose(hasActiveTasks -> {
      if (!hasActiveTasks) {
        return pool.getStats().thenApply(stats -> {
          log.info("Streaming completed. Stats: {}, total tasks created: {}", stats, totalTasksCreated.get());
          return Optional.<T>empty();
        });
      }
      return pool.waitForNextCompletion()
          .thenCompose(completion -> accept(pool, completion))
          .handle((publishable, error) -> {
            if (error != null) {
              log.error("Error in streaming iterator", error);
              return Optional.<T>empty();
            }
            return publishable;
          })
          .thenCompose(publishable -> {
            if (publishable.isPresent()) {
              return CompletableFuture.completedFuture(publishable);
            }
            // nothing to emit for this completion, keep pulling
            return readNext(pool);
          });
    });
  }

  /**
   * Admits the follow-ups of a completed task and returns its published value, if any. Follow-ups count against
   * {@code maxTotalTasks} only once the pool has accepted them; follow-ups the pool rejects are logged and lost.
   */
  CompletionStage<Optional<T>> accept(StreamingTaskPool<T> pool, TaskCompletion<T> completion) {
    Optional<TaskResult<T>> result = completion.getResult();
    if (result.isEmpty()) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    Optional<T> publishable = result.get().getPublishable();
    if (!result.get().hasNext()) {
      return CompletableFuture.completedFuture(publishable);
    }
    List<StreamingTask<T>> admitted = admit(completion.taskId(), result.get().getNext());
    if (admitted.isEmpty()) {
      return CompletableFuture.completedFuture(publishable);
    }
    return pool.addTasks(admitted).handle((done, error) -> {
      if (error != null) {
        log.warn("Cannot add tasks {} spawned by {}", admitted.stream().map(StreamingTask::getId).toList(),
            completion.taskId(), error);
      } else {
        totalTasksCreated.addAndGet(admitted.size());
        log.debug("Added {} new tasks from {}", admitted.size(), completion.taskId());
      }
      return publishable;
    });
  }

  private List<StreamingTask<T>> admit(String parentId, List<StreamingTask<T>> followUps) {
    int room = Math.max(0, maxTotalTasks - totalTasksCreated.get());
    List<StreamingTask<T>> admitted = new ArrayList<>();
    for (StreamingTask<T> task : followUps) {
      if (admitted.size() < room) {
        admitted.add(task);
      } else {
        log.warn("Max tasks limit ({}) reached, skipping new task {} spawned by {}",
            maxTotalTasks, task.getId(), parentId);
      }
    }
    return admitted;
  }

  private CompletionStage<Done> close(StreamingTaskPool<T> pool) {
    return pool.shutdown().handle((stats, error) -> {
      if (error != null) {
        log.error("Streaming iterator could not shut down its task pool", error);
      }
      return Done.getInstance();
    });
  }
}
