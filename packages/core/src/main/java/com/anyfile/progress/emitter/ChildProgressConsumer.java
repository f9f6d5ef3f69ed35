package com.anyfile.progress.emitter;

import com.anyfile.progress.consumer.ProgressConsumer;
import com.anyfile.progress.model.ProgressState;
import com.anyfile.progress.model.ProgressUpdate;

/**
 * Consumer the parent installs on each child. It holds only an opaque recompute handle, never
 * the parent itself.
 */
final class ChildProgressConsumer implements ProgressConsumer {
  private final Runnable recompute;

  ChildProgressConsumer(Runnable recompute) {
    this.recompute = recompute;
  }

  @Override
  public void onProgress(ProgressUpdate update) {
    recompute.run();
  }

  @Override
  public void onComplete(ProgressState state) {
    recompute.run();
  }
}
