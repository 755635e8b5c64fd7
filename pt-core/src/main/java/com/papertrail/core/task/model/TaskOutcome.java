package com.papertrail.core.task.model;

public enum TaskOutcome {
  COMPLETED, FAILED, TIMED_OUT
}
