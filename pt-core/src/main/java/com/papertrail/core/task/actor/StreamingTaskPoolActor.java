package com.papertrail.core.task.actor;

import akka.Done;
import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import akka.actor.typed.javadsl.TimerScheduler;
import akka.pattern.StatusReply;
import com.papertrail.core.task.model.StreamingPoolException;
import com.papertrail.core.task.model.StreamingTask;
import com.papertrail.core.task.model.TaskCompletion;
import com.papertrail.core.task.model.TaskPoolStats;
import com.papertrail.core.task.model.TaskResult;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the running and pending tasks of one streaming operation.
 *
 * <p>At most {@code maxConcurrentTasks} tasks are active; the rest wait in a FIFO queue. A task stays active from
 * its start until its outcome has been reported through {@link WaitForNextCompletion}, and outcomes are reported one
 * at a time in the order they happened. Pending tasks are promoted only after a completion has been reported.
 *
 * <p>The actor never looks at published values, so its commands carry tasks and completions of any value type.
 * {@link com.papertrail.core.task.StreamingTaskPool} keeps the value type for its callers.
 *
 * <p>Once a shutdown starts, the actor neither reports nor promotes: the parked waiter is failed, pending tasks are
 * dropped and active operations are cancelled and awaited.
 */
public class StreamingTaskPoolActor extends AbstractBehavior<StreamingTaskPoolActor.Command> {
  private static final Logger logger = LoggerFactory.getLogger(StreamingTaskPoolActor.class);

  private final TimerScheduler<Command> timers;
  private final int maxConcurrentTasks;
  private final Map<String, RunningTask> active = new LinkedHashMap<>();
  private final Deque<StreamingTask<?>> pending = new ArrayDeque<>();
  private final Deque<RunningTask> settled = new ArrayDeque<>();
  private long completedCount = 0;
  private long failedCount = 0;
  private long timedOutCount = 0;
  private ActorRef<StatusReply<TaskCompletion<?>>> waitingReplyTo;
  private boolean shuttingDown = false;

  private StreamingTaskPoolActor(ActorContext<Command> context, TimerScheduler<Command> timers,
                                 int maxConcurrentTasks) {
    super(context);
    this.timers = timers;
    this.maxConcurrentTasks = maxConcurrentTasks;
    logger.debug("Create streaming task pool [maxConcurrentTasks={}]", maxConcurrentTasks);
  }

  public static Behavior<Command> create(int maxConcurrentTasks) {
    if (maxConcurrentTasks < 1) {
      throw new IllegalArgumentException("maxConcurrentTasks must be positive: " + maxConcurrentTasks);
    }
    return Behaviors.setup(ctx ->
        Behaviors.withTimers(timers -> new StreamingTaskPoolActor(ctx, timers, maxConcurrentTasks)));
  }

  @Override
  public Receive<Command> createReceive() {
    return newReceiveBuilder()
        .onMessage(AddTasks.class, this::onAddTasks)
        .onMessage(WaitForNextCompletion.class, this::onWaitForNextCompletion)
        .onMessage(HasActiveTasks.class, this::onHasActiveTasks)
        .onMessage(GetStats.class, this::onGetStats)
        .onMessage(Shutdown.class, this::onShutdown)
        .onMessage(OperationSettled.class, this::onOperationSettled)
        .onMessage(TaskTimedOut.class, this::onTaskTimedOut)
        .onMessage(ShutdownSettled.class, this::onShutdownSettled)
        .build();
  }

  private Behavior<Command> onAddTasks(AddTasks cmd) {
    if (shuttingDown) {
      cmd.replyTo().tell(StatusReply.error(new StreamingPoolException("Task pool is shutting down")));
      return this;
    }
    cmd.tasks().forEach(this::addTask);
    cmd.replyTo().tell(StatusReply.ack());
    return this;
  }

  private void addTask(StreamingTask<?> task) {
    if (active.size() < maxConcurrentTasks) {
      startTask(task);
    } else {
      pending.add(task);
      logger.debug("Task {} queued [pending={}]", task.getId(), pending.size());
    }
  }

  private void startTask(StreamingTask<?> task) {
    String taskId = task.getId();
    if (active.containsKey(taskId)) {
      logger.debug("Task {} is already active, the duplicate is not started", taskId);
      return;
    }

    CompletableFuture<? extends TaskResult<?>> operation;
    try {
      operation = Objects.requireNonNull(task.createOperation(), "Operation factory returned null")
          .toCompletableFuture();
    } catch (RuntimeException e) {
      logger.error("Failed to start task {}", taskId, e);
      RunningTask handle = new RunningTask(task, null);
      active.put(taskId, handle);
      settle(handle, TaskCompletion.failed(taskId, e));
      return;
    }

    RunningTask handle = new RunningTask(task, operation);
    active.put(taskId, handle);
    timers.startSingleTimer(handle, new TaskTimedOut(handle), task.getTimeout());
    getContext().pipeToSelf(operation, (result, error) -> new OperationSettled(handle, result, error));
    logger.debug("Started task {}", taskId);
  }

  private void startPendingTasks() {
    while (!shuttingDown && active.size() < maxConcurrentTasks && !pending.isEmpty()) {
      startTask(pending.poll());
    }
  }

  private Behavior<Command> onOperationSettled(OperationSettled cmd) {
    RunningTask handle = cmd.handle();
    if (shuttingDown || !isUnsettledActive(handle)) {
      logger.trace("Ignoring late completion of task {}", handle.task.getId());
      return this;
    }
    timers.cancel(handle);
    String taskId = handle.task.getId();
    if (cmd.error() == null) {
      TaskResult<?> result = cmd.result() == null ? TaskResult.empty() : cmd.result();
      settle(handle, TaskCompletion.completed(taskId, result));
    } else {
      settle(handle, TaskCompletion.failed(taskId, unwrap(cmd.error())));
    }
    return this;
  }

  private Behavior<Command> onTaskTimedOut(TaskTimedOut cmd) {
    RunningTask handle = cmd.handle();
    if (shuttingDown || !isUnsettledActive(handle)) {
      return this;
    }
    // a reported timeout implies a cancelled operation; cancellation is only a signal, the operation may keep running
    handle.operation.cancel(true);
    settle(handle, TaskCompletion.timedOut(handle.task.getId()));
    return this;
  }

  private boolean isUnsettledActive(RunningTask handle) {
    return handle.completion == null && active.get(handle.task.getId()) == handle;
  }

  private void settle(RunningTask handle, TaskCompletion<?> completion) {
    handle.completion = completion;
    settled.add(handle);
    if (waitingReplyTo != null) {
      var replyTo = waitingReplyTo;
      waitingReplyTo = null;
      replyTo.tell(StatusReply.success(report(settled.poll())));
    }
  }

  private TaskCompletion<?> report(RunningTask handle) {
    TaskCompletion<?> completion = handle.completion;
    active.remove(completion.taskId(), handle);
    switch (completion.outcome()) {
      case COMPLETED -> {
        completedCount++;
        logger.debug("Task {} completed successfully", completion.taskId());
      }
      case TIMED_OUT -> {
        timedOutCount++;
        logger.warn("Task {} timed out after {}", completion.taskId(), handle.task.getTimeout());
      }
      case FAILED -> {
        failedCount++;
        logger.error("Task {} failed", completion.taskId(), completion.cause());
      }
    }
    startPendingTasks();
    return completion;
  }

  private Behavior<Command> onWaitForNextCompletion(WaitForNextCompletion cmd) {
    if (shuttingDown) {
      cmd.replyTo().tell(StatusReply.error(new StreamingPoolException("Task pool is shutting down")));
      return this;
    }
    if (!settled.isEmpty()) {
      cmd.replyTo().tell(StatusReply.success(report(settled.poll())));
      return this;
    }
    if (active.isEmpty() && pending.isEmpty()) {
      cmd.replyTo().tell(StatusReply.error(new StreamingPoolException("No active tasks")));
      return this;
    }
    if (waitingReplyTo != null) {
      logger.debug("Replacing an abandoned completion waiter");
    }
    waitingReplyTo = cmd.replyTo();
    return this;
  }

  private Behavior<Command> onHasActiveTasks(HasActiveTasks cmd) {
    cmd.replyTo().tell(!active.isEmpty() || !pending.isEmpty());
    return this;
  }

  private Behavior<Command> onGetStats(GetStats cmd) {
    cmd.replyTo().tell(stats());
    return this;
  }

  private Behavior<Command> onShutdown(Shutdown cmd) {
    if (shuttingDown) {
      logger.debug("Task pool is already shutting down");
      cmd.replyTo().tell(StatusReply.success(stats()));
      return this;
    }
    logger.debug("Shutting down task pool [active={}, pending={}]", active.size(), pending.size());
    shuttingDown = true;
    active.values().forEach(timers::cancel);
    pending.clear();
    failWaiter("Task pool is shutting down");
    List<CompletableFuture<? extends TaskResult<?>>> operations = new ArrayList<>();
    for (RunningTask handle : active.values()) {
      if (handle.completion == null && handle.operation != null) {
        operations.add(handle.operation);
      }
    }

    operations.forEach(operation -> operation.cancel(true));
    CompletableFuture<?>[] settling = operations.stream()
        .map(operation -> operation.handle((result, error) -> {
          Throwable cause = unwrap(error);
          if (cause != null && !(cause instanceof CancellationException)) {
            logger.warn("Task finished with exception during shutdown", cause);
          }
          return Done.getInstance();
        }))
        .toArray(CompletableFuture[]::new);
    getContext().pipeToSelf(CompletableFuture.allOf(settling), (ignored, error) -> new ShutdownSettled(cmd.replyTo()));
    return this;
  }

  private Behavior<Command> onShutdownSettled(ShutdownSettled cmd) {
    active.clear();
    pending.clear();
    settled.clear();
    failWaiter("Task pool was shut down");
    TaskPoolStats stats = stats();
    logger.debug("Task pool was shut down: {}", stats);
    cmd.replyTo().tell(StatusReply.success(stats));
    return Behaviors.stopped();
  }

  private void failWaiter(String message) {
    if (waitingReplyTo != null) {
      waitingReplyTo.tell(StatusReply.error(new StreamingPoolException(message)));
      waitingReplyTo = null;
    }
  }

  private TaskPoolStats stats() {
    return new TaskPoolStats(active.size(), pending.size(), completedCount, failedCount, timedOutCount);
  }

  private static Throwable unwrap(Throwable error) {
    Throwable cause = error;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  private static final class RunningTask {
    private final StreamingTask<?> task;
    private final CompletableFuture<? extends TaskResult<?>> operation;
    private TaskCompletion<?> completion;

    private RunningTask(StreamingTask<?> task, CompletableFuture<? extends TaskResult<?>> operation) {
      this.task = task;
      this.operation = operation;
    }
  }

  public interface Command {
  }

  public static record AddTasks(List<StreamingTask<?>> tasks,
                                ActorRef<StatusReply<Done>> replyTo) implements Command {
  }

  public static record WaitForNextCompletion(
      ActorRef<StatusReply<TaskCompletion<?>>> replyTo) implements Command {
  }

  public static record HasActiveTasks(ActorRef<Boolean> replyTo) implements Command {
  }

  public static record GetStats(ActorRef<TaskPoolStats> replyTo) implements Command {
  }

  public static record Shutdown(ActorRef<StatusReply<TaskPoolStats>> replyTo) implements Command {
  }

  private static record OperationSettled(RunningTask handle, TaskResult<?> result,
                                         Throwable error) implements Command {
  }

  private static record TaskTimedOut(RunningTask handle) implements Command {
  }

  private static record ShutdownSettled(ActorRef<StatusReply<TaskPoolStats>> replyTo) implements Command {
  }
}
