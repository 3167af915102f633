package tools.pixelcraft.domain.batch;

/**
 * Observer of a batch run. Every callback runs on the batch worker thread, in this order: progress
 * and item notifications as the run advances, then a final {@code onProgress(100)}, then exactly
 * one {@link #onFinished}. Exceptions thrown by a callback are logged and otherwise ignored.
 */
public interface BatchListener {
  /**
   * @param percent Coarse progress in [0,100], never decreasing within a run.
   */
  default void onProgress(int percent) {
    // Deliberately empty
  }

  /**
   * @param item The item that just reached a terminal status.
   */
  default void onItemDone(BatchItem item) {
    // Deliberately empty
  }

  /**
   * @param summary Tally of the run, emitted after completion and after cancellation alike.
   */
  default void onFinished(BatchSummary summary) {
    // Deliberately empty
  }
}
