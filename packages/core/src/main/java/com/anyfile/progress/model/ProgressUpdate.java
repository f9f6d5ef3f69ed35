package com.anyfile.progress.model;

import java.util.Objects;

/**
 * Event payload delivered to consumers.
 *
 * @param state snapshot taken when the event was emitted
 * @param delta signed change of {@code current} that produced this event, 0 for total changes and
 *     completion
 * @param updateType event kind
 */
public record ProgressUpdate(ProgressState state, long delta, UpdateType updateType) {
  public ProgressUpdate {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(updateType, "updateType");
  }
}
