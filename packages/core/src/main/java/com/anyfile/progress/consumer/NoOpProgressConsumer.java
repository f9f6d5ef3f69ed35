package com.anyfile.progress.consumer;

import com.anyfile.progress.model.ProgressState;
import com.anyfile.progress.model.ProgressUpdate;

/** No-op implementation used when progress reporting is disabled. */
public final class NoOpProgressConsumer implements ProgressConsumer {
  public static final NoOpProgressConsumer INSTANCE = new NoOpProgressConsumer();

  private NoOpProgressConsumer() {}

  @Override
  public void onProgress(ProgressUpdate update) {}

  @Override
  public void onComplete(ProgressState state) {}
}
