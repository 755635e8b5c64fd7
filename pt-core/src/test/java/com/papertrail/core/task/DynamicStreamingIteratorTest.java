package com.papertrail.core.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.stream.javadsl.Sink;
import com.papertrail.core.configuration.StreamingSettings;
import com.papertrail.core.task.model.StreamingTask;
import com.papertrail.core.task.model.TaskCompletion;
import com.papertrail.core.task.model.TaskPoolStats;
import com.papertrail.core.task.model.TaskResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

class DynamicStreamingIteratorTest {
  static final ActorTestKit testKit = ActorTestKit.create();
  static final StreamingSettings settings = StreamingSettings.builder().build();

  @AfterAll
  static void teardown() {
    testKit.shutdownTestKit();
  }

  @Test
  void fanOutWithSpawnPublishesRootAndChildren() throws Exception {
    List<StreamingTask<String>> children = IntStream.range(0, 3)
        .mapToObj(i -> TestOperations.publishing("child-" + i, "child-" + i, 10L * (3 - i)))
        .toList();
    var iterator = new DynamicStreamingIterator<>(testKit.system(),
        List.of(TestOperations.spawning("root", "root", 10, children)), 5, 10, settings);

    List<String> results = run(iterator);

    assertThat(results).hasSize(4).containsExactlyInAnyOrder("root", "child-0", "child-1", "child-2");
    assertThat(iterator.getTotalTasksCreated()).isEqualTo(4);
  }

  @Test
  void followUpsOverTheCapAreDropped() throws Exception {
    Set<String> started = ConcurrentHashMap.newKeySet();
    List<StreamingTask<String>> children = IntStream.range(0, 10)
        .mapToObj(i -> TestOperations.<String>task("child-" + i, () -> {
          started.add("child-" + i);
          return TestOperations.delayed(TaskResult.of("child-" + i), 5);
        }, 1_000))
        .toList();
    StreamingTask<String> root = TestOperations.task("root", () -> {
      started.add("root");
      return TestOperations.delayed(TaskResult.spawn(children), 5);
    }, 1_000);
    var iterator = new DynamicStreamingIterator<>(testKit.system(), List.of(root), 5, 5, settings);

    List<String> results = run(iterator);

    assertThat(results).hasSize(4).allMatch(value -> value.startsWith("child-"));
    assertThat(started).hasSize(5).contains("root");
    assertThat(iterator.getTotalTasksCreated()).isEqualTo(5);
  }

  @Test
  void selfExpandingTasksStopAtTheCap() throws Exception {
    Set<String> started = ConcurrentHashMap.newKeySet();
    var iterator = new DynamicStreamingIterator<>(testKit.system(),
        List.of(expanding("node", started)), 4, 20, settings);

    List<String> results = run(iterator);

    assertThat(started).hasSize(20);
    assertThat(results).hasSameSizeAs(started);
    assertThat(iterator.getTotalTasksCreated()).isEqualTo(20);
  }

  @Test
  void resultsStreamInCompletionOrder() throws Exception {
    var iterator = new DynamicStreamingIterator<>(testKit.system(), List.of(
        TestOperations.publishing("slow", "slow", 200),
        TestOperations.publishing("fast", "fast", 10)), 5, 10, settings);

    assertThat(run(iterator)).containsExactly("fast", "slow");
  }

  @Test
  void failedTaskDoesNotStopSiblings() throws Exception {
    var iterator = new DynamicStreamingIterator<>(testKit.system(), List.of(
        TestOperations.<String>task("broken", () -> TestOperations.failing(5, "boom"), 1_000),
        TestOperations.publishing("a", "a", 20),
        TestOperations.publishing("b", "b", 10),
        TestOperations.publishing("c", "c", 15)), 1, 10, settings);

    List<String> results = run(iterator);

    assertThat(results).containsExactlyInAnyOrder("a", "b", "c");
    StreamingTaskPool<String> pool = iterator.getTaskPool().orElseThrow();
    await().atMost(Duration.ofSeconds(2)).until(pool::isShutdown);
    TaskPoolStats stats = pool.getStats().toCompletableFuture().get(5, TimeUnit.SECONDS);
    assertThat(stats.failed()).isEqualTo(1);
    assertThat(stats.completed()).isEqualTo(3);
  }

  @Test
  void timedOutTaskPublishesNothing() throws Exception {
    var stuck = new CompletableFuture<TaskResult<String>>();
    var iterator = new DynamicStreamingIterator<>(testKit.system(), List.of(
        TestOperations.task("stuck", () -> stuck, 100),
        TestOperations.publishing("ok", "ok", 20)), 5, 10, settings);

    long start = System.nanoTime();
    List<String> results = run(iterator);

    assertThat(results).containsExactly("ok");
    assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(3_000);
    assertThat(stuck).isCancelled();
  }

  @Test
  void poolIsShutDownAfterTheStreamDrains() throws Exception {
    var iterator = new DynamicStreamingIterator<>(testKit.system(), List.of(
        TestOperations.publishing("a", "a", 5),
        TestOperations.publishing("b", "b", 5)), 1, 10, settings);

    run(iterator);

    StreamingTaskPool<String> pool = iterator.getTaskPool().orElseThrow();
    await().atMost(Duration.ofSeconds(2)).until(pool::isShutdown);
    assertThat(pool.hasActiveTasks().toCompletableFuture().get()).isFalse();
    TaskPoolStats stats = pool.getStats().toCompletableFuture().get(5, TimeUnit.SECONDS);
    assertThat(stats.activeTasks()).isZero();
    assertThat(stats.pendingTasks()).isZero();
    assertThat(stats.completed()).isEqualTo(2);
  }

  @Test
  void abandonedStreamCancelsInFlightTasks() throws Exception {
    var first = new CompletableFuture<TaskResult<String>>();
    var second = new CompletableFuture<TaskResult<String>>();
    var iterator = new DynamicStreamingIterator<>(testKit.system(), List.of(
        TestOperations.publishing("fast", "fast", 5),
        TestOperations.task("never-1", () -> first, 30_000),
        TestOperations.task("never-2", () -> second, 30_000)), 5, 10, settings);

    List<String> results = iterator.source()
        .take(1)
        .runWith(Sink.seq(), testKit.system())
        .toCompletableFuture()
        .get(5, TimeUnit.SECONDS);

    assertThat(results).containsExactly("fast");
    await().atMost(Duration.ofSeconds(5)).until(() -> first.isCancelled() && second.isCancelled());
    StreamingTaskPool<String> pool = iterator.getTaskPool().orElseThrow();
    assertThat(pool.isShutdown()).isTrue();
    assertThat(pool.hasActiveTasks().toCompletableFuture().get()).isFalse();
  }

  @Test
  void sourceCanBeConsumedOnlyOnce() throws Exception {
    var iterator = new DynamicStreamingIterator<>(testKit.system(),
        List.of(TestOperations.publishing("a", "a", 5)), 5, 10, settings);
    assertThat(run(iterator)).containsExactly("a");

    assertThatThrownBy(() -> run(iterator))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void emptyInitialTaskListCompletesImmediately() throws Exception {
    var iterator = new DynamicStreamingIterator<String>(testKit.system(), List.of(), 5, 10, settings);

    assertThat(run(iterator)).isEmpty();
    assertThat(iterator.getTotalTasksCreated()).isZero();
  }

  @Test
  void rejectedFollowUpsDoNotUseUpTheCap() throws Exception {
    var iterator = new DynamicStreamingIterator<String>(testKit.system(), List.of(), 5, 10, settings);
    StreamingTaskPool<String> pool = StreamingTaskPool.create(testKit.system(), 5, settings);
    pool.shutdown().toCompletableFuture().get(5, TimeUnit.SECONDS);
    List<StreamingTask<String>> children = List.of(
        TestOperations.publishing("child-0", "child-0", 5),
        TestOperations.publishing("child-1", "child-1", 5));

    Optional<String> published = iterator
        .accept(pool, TaskCompletion.completed("root", TaskResult.of("root", children)))
        .toCompletableFuture()
        .get(5, TimeUnit.SECONDS);

    assertThat(published).contains("root");
    assertThat(iterator.getTotalTasksCreated()).isZero();
  }

  private static StreamingTask<String> expanding(String id, Set<String> started) {
    return TestOperations.task(id, () -> {
      started.add(id);
      List<StreamingTask<String>> next = new ArrayList<>();
      next.add(expanding(id + ".0", started));
      next.add(expanding(id + ".1", started));
      return TestOperations.delayed(TaskResult.of(id, next), 2);
    }, 1_000);
  }

  private static List<String> run(DynamicStreamingIterator<String> iterator) throws Exception {
    return iterator.source()
        .runWith(Sink.seq(), testKit.system())
        .toCompletableFuture()
        .get(10, TimeUnit.SECONDS);
  }
}
