package com.anyfile.progress.consumer;

import com.anyfile.progress.model.ProgressState;
import com.anyfile.progress.model.ProgressUpdate;

/**
 * Receiver of progress notifications (terminal renderer, structured logger, user callback).
 *
 * <p>This decouples pipelines (producers of progress) from how progress is shown. Implementations
 * are invoked synchronously on the thread driving the emitter, so they should be lightweight and
 * non-blocking. A runtime exception thrown from either method is logged by the emitter and does
 * not reach the pipeline; the consumer simply misses that event.
 */
public interface ProgressConsumer {

  /**
   * Handle a progress event. Called for every event that passes the emitter's throttle,
   * including the final {@code COMPLETED} event.
   */
  void onProgress(ProgressUpdate update);

  /** Called once per {@code complete()}, after {@link #onProgress} has seen the COMPLETED event. */
  void onComplete(ProgressState state);
}
