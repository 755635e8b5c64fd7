package com.papertrail.core.task;

import akka.Done;
import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.Props;
import akka.actor.typed.javadsl.AskPattern;
import com.papertrail.core.configuration.StreamingSettings;
import com.papertrail.core.task.actor.StreamingTaskPoolActor;
import com.papertrail.core.task.model.StreamingPoolException;
import com.papertrail.core.task.model.StreamingTask;
import com.papertrail.core.task.model.TaskCompletion;
import com.papertrail.core.task.model.TaskPoolStats;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Asynchronous view of a {@link StreamingTaskPoolActor}. One pool serves one streaming operation and is discarded
 * after {@link #shutdown()}.
 *
 * @param <T> type of the published value
 */
@Slf4j
public class StreamingTaskPool<T> {
  private final ActorSystem<?> actorSystem;
  private final ActorRef<StreamingTaskPoolActor.Command> poolActorRef;
  private final int maxConcurrentTasks;
  private final Duration askTimeout;
  private final AtomicReference<Duration> longestTaskTimeout = new AtomicReference<>(Duration.ZERO);
  private final AtomicReference<CompletableFuture<TaskPoolStats>> shutdownStage = new AtomicReference<>();

  StreamingTaskPool(ActorSystem<?> actorSystem, ActorRef<StreamingTaskPoolActor.Command> poolActorRef,
                    int maxConcurrentTasks, Duration askTimeout) {
    this.actorSystem = actorSystem;
    this.poolActorRef = poolActorRef;
    this.maxConcurrentTasks = maxConcurrentTasks;
    this.askTimeout = askTimeout;
  }

  public static <T> StreamingTaskPool<T> create(ActorSystem<?> actorSystem, int maxConcurrentTasks,
                                                StreamingSettings settings) {
    ActorRef<StreamingTaskPoolActor.Command> ref = actorSystem.systemActorOf(
        StreamingTaskPoolActor.create(maxConcurrentTasks),
        "streaming-task-pool-" + UUID.randomUUID(),
        Props.empty());
    return new StreamingTaskPool<>(actorSystem, ref, maxConcurrentTasks, settings.getAskTimeout());
  }

  public CompletionStage<Done> addTask(StreamingTask<T> task) {
    return addTasks(List.of(task));
  }

  /**
   * Starts the tasks while there are free slots and queues the rest, in the given order.
   */
  public CompletionStage<Done> addTasks(List<StreamingTask<T>> tasks) {
    if (shutdownStage.get() != null) {
      return CompletableFuture.failedFuture(new StreamingPoolException("Task pool is shut down"));
    }
    tasks.forEach(task -> longestTaskTimeout.accumulateAndGet(task.getTimeout(),
        (current, candidate) -> candidate.compareTo(current) > 0 ? candidate : current));
    return AskPattern.<StreamingTaskPoolActor.Command, Done>askWithStatus(
        poolActorRef,
        replyTo -> new StreamingTaskPoolActor.AddTasks(List.<StreamingTask<?>>copyOf(tasks), replyTo),
        askTimeout,
        actorSystem.scheduler());
  }

  /**
   * Completes with the next resolved task, in completion order. The returned completion is already removed from the
   * active tasks. Fails with {@link StreamingPoolException} when the pool has no tasks.
   */
  public CompletionStage<TaskCompletion<T>> waitForNextCompletion() {
    if (shutdownStage.get() != null) {
      return CompletableFuture.failedFuture(new StreamingPoolException("Task pool is shut down"));
    }
    // any active task settles within its own timeout
    Duration timeout = longestTaskTimeout.get().plus(askTimeout);
    return AskPattern.<StreamingTaskPoolActor.Command, TaskCompletion<?>>askWithStatus(
            poolActorRef,
            StreamingTaskPoolActor.WaitForNextCompletion::new,
            timeout,
            actorSystem.scheduler())
        .thenApply(StreamingTaskPool::<T>narrow);
  }

  // the pool only holds tasks submitted through this facade, so every completion carries T
  @SuppressWarnings("unchecked")
  private static <V> TaskCompletion<V> narrow(TaskCompletion<?> completion) {
    return (TaskCompletion<V>) completion;
  }

  public CompletionStage<Boolean> hasActiveTasks() {
    if (shutdownStage.get() != null) {
      return CompletableFuture.completedFuture(false);
    }
    return AskPattern.ask(
        poolActorRef,
        StreamingTaskPoolActor.HasActiveTasks::new,
        askTimeout,
        actorSystem.scheduler());
  }

  public CompletionStage<TaskPoolStats> getStats() {
    CompletableFuture<TaskPoolStats> shutdown = shutdownStage.get();
    if (shutdown != null) {
      return shutdown;
    }
    return AskPattern.ask(
        poolActorRef,
        StreamingTaskPoolActor.GetStats::new,
        askTimeout,
        actorSystem.scheduler());
  }

  /**
   * Cancels all active tasks, waits for them to settle and clears the pool. Only the first call reaches the pool,
   * later calls return the same stage.
   */
  public CompletionStage<TaskPoolStats> shutdown() {
    var stage = new CompletableFuture<TaskPoolStats>();
    if (!shutdownStage.compareAndSet(null, stage)) {
      return shutdownStage.get();
    }
    AskPattern.<StreamingTaskPoolActor.Command, TaskPoolStats>askWithStatus(
            poolActorRef,
            StreamingTaskPoolActor.Shutdown::new,
            longestTaskTimeout.get().plus(askTimeout),
            actorSystem.scheduler())
        .whenComplete((stats, error) -> {
          if (error != null) {
            log.error("Cannot shut down the task pool {}", poolActorRef, error);
            stage.completeExceptionally(new StreamingPoolException("Task pool shutdown failed", error));
          } else {
            log.debug("Task pool {} shut down with stats {}", poolActorRef.path().name(), stats);
            stage.complete(stats);
          }
        });
    return stage;
  }

  public boolean isShutdown() {
    return shutdownStage.get() != null;
  }

  public int getMaxConcurrentTasks() {
    return maxConcurrentTasks;
  }
}
