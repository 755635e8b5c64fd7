package com.papertrail.core.task.model;

public record TaskPoolStats(int activeTasks, int pendingTasks, long completed, long failed, long timedOut) {

  public long totalProcessed() {
    return completed + failed + timedOut;
  }
}
