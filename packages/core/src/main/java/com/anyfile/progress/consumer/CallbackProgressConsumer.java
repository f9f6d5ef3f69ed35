package com.anyfile.progress.consumer;

import com.anyfile.progress.model.ProgressState;
import com.anyfile.progress.model.ProgressUpdate;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Adapts legacy {@code callback(current, total)} hooks to the consumer contract.
 *
 * <p>The callback receives {@code null} as total for indeterminate progress. Failures inside the
 * callback are logged here and never escape.
 */
public class CallbackProgressConsumer implements ProgressConsumer {
  private static final org.slf4j.Logger log =
      com.anyfile.progress.logging.LoggingService.getLogger(CallbackProgressConsumer.class);

  private final BiConsumer<Long, Long> callback;

  public CallbackProgressConsumer(BiConsumer<Long, Long> callback) {
    this.callback = Objects.requireNonNull(callback, "callback");
  }

  @Override
  public void onProgress(ProgressUpdate update) {
    invoke(update.state(), "progress");
  }

  @Override
  public void onComplete(ProgressState state) {
    invoke(state, "complete");
  }

  private void invoke(ProgressState state, String phase) {
    try {
      callback.accept(state.current(), state.total());
    } catch (RuntimeException e) {
      log.error("Progress callback failed on {}: {}", phase, e.getMessage(), e);
    }
  }
}
