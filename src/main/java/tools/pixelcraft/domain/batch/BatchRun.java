package tools.pixelcraft.domain.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one pass of a {@link BatchRequest} over its sources. A run executes at most once.
 *
 * <p>
 * The cancellation flag is the only state the caller writes; the worker reads it between items.
 * Cancelling and finishing exclude each other, so a cancellation accepted by {@link #cancel} is
 * always reflected in the summary.
 */
public class BatchRun {
  private static final Logger logger = LoggerFactory.getLogger(BatchRun.class);

  /**
   * Lifecycle of a run.
   */
  public enum State {
    READY, RUNNING, FINISHED
  }

  private final BatchRequest request;
  private final List<BatchItem> items;
  private final AtomicBoolean cancellationRequested = new AtomicBoolean();
  private final AtomicReference<State> state = new AtomicReference<>(State.READY);
  private volatile int progress;

  /**
   * Creates a run, deriving every item's output path from the request's naming policy.
   *
   * @param request The batch to run.
   */
  public BatchRun(BatchRequest request) {
    this.request = request;

    List<BatchItem> batchItems = new ArrayList<>(request.getSources().size());
    for (var source : request.getSources()) {
      batchItems.add(new BatchItem(source, request.getNamingPolicy().outputFor(source,
          request.getOutputDirectory(), request.getFilter())));
    }
    this.items = Collections.unmodifiableList(batchItems);
  }

  /**
   * Asks the run to stop before its next item. The item in flight, if any, still completes.
   *
   * @return {@code false} if the run had already finished, in which case nothing changes.
   */
  public synchronized boolean cancel() {
    if (state.get() == State.FINISHED) {
      logger.debug("Ignoring cancellation of a finished run");
      return false;
    }

    cancellationRequested.set(true);
    return true;
  }

  public boolean isCancellationRequested() {
    return cancellationRequested.get();
  }

  public BatchRequest getRequest() {
    return request;
  }

  public List<BatchItem> getItems() {
    return items;
  }

  public State getState() {
    return state.get();
  }

  public int getProgress() {
    return progress;
  }

  void start() {
    if (!state.compareAndSet(State.READY, State.RUNNING)) {
      throw new IllegalStateException("A batch run can only be executed once, this one is "
          + state.get());
    }
  }

  void setProgress(int progress) {
    this.progress = progress;
  }

  synchronized BatchSummary finish() {
    BatchSummary summary = BatchSummary.of(items, cancellationRequested.get());
    state.set(State.FINISHED);

    return summary;
  }
}
