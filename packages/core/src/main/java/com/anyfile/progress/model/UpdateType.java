package com.anyfile.progress.model;

/** Kinds of progress events delivered to consumers. */
public enum UpdateType {
  /** First move away from zero, or a reset back to zero. */
  STARTED,
  PROGRESS,
  TOTAL_CHANGED,
  COMPLETED,
  /** Reserved for consumer-side signalling; emitters never produce it. */
  ERROR;

  /** Boundary events are delivered regardless of throttling. */
  public boolean isBoundary() {
    return this == STARTED || this == TOTAL_CHANGED || this == COMPLETED;
  }
}
