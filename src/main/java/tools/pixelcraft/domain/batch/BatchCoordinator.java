package tools.pixelcraft.domain.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.pixelcraft.domain.image.RasterBuffer;
import tools.pixelcraft.domain.similarity.SimilarityScorer;
import tools.pixelcraft.io.RasterIo;

/**
 * Applies one filter to many images on a single background worker.
 *
 * <p>
 * Items are processed strictly in order, one at a time. A failing item is recorded as
 * {@link BatchItemStatus#FAILED} and the run moves on. Cancellation is polled between items only,
 * so an item already started always completes. A stuck read or write stalls the run, there is no
 * timeout. An {@link Error} raised by an item fails that item and ends the run early; it is
 * rethrown once the finish events were delivered.
 */
public class BatchCoordinator implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(BatchCoordinator.class);
  static final String SAVE_FAILURE_REASON = "Failed to save processed image";

  private final RasterIo rasterIo;
  private final SimilarityScorer similarityScorer;
  private final ExecutorService worker;

  /**
   * Creates a new coordinator with its own worker thread.
   *
   * @param rasterIo Image loader and writer.
   * @param similarityScorer Scorer used when a request asks for a similarity readout.
   */
  public BatchCoordinator(RasterIo rasterIo, SimilarityScorer similarityScorer) {
    this.rasterIo = rasterIo;
    this.similarityScorer = similarityScorer;
    this.worker = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "batch-worker");
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Starts a run on the worker and returns immediately.
   *
   * @param run The run to execute. Must not have been executed before.
   * @param listener Receives progress, item and completion events on the worker thread.
   * @return Completes with the run's summary once {@link BatchListener#onFinished} was delivered.
   * @throws IllegalStateException if the run was already executed.
   */
  public CompletableFuture<BatchSummary> submit(BatchRun run, BatchListener listener) {
    run.start();

    return CompletableFuture.supplyAsync(() -> execute(run, listener), worker);
  }

  /**
   * Executes a run on the calling thread.
   *
   * @param run The run to execute. Must not have been executed before.
   * @param listener Receives progress, item and completion events.
   * @return The run's summary.
   * @throws IllegalStateException if the run was already executed.
   */
  public BatchSummary process(BatchRun run, BatchListener listener) {
    run.start();

    return execute(run, listener);
  }

  private BatchSummary execute(BatchRun run, BatchListener listener) {
    BatchRequest request = run.getRequest();
    List<BatchItem> items = run.getItems();
    int total = items.size();
    logger.info("Processing {} images with the {} filter into {}", total,
        request.getFilter().getDisplayName(), request.getOutputDirectory());

    try {
      Files.createDirectories(request.getOutputDirectory());
    } catch (IOException e) {
      logger.error("Could not create output directory {}", request.getOutputDirectory(), e);
    }

    Error fatal = null;
    for (int i = 0; i < total && fatal == null; i++) {
      if (run.isCancellationRequested()) {
        logger.info("Batch canceled, {} of {} images not started", total - i, total);
        break;
      }

      reportProgress(run, listener, (int) ((long) i * 100 / total));
      BatchItem item = items.get(i);
      try {
        processItem(item, request);
      } catch (Error e) {
        logger.error("Aborting batch on {}", item.getSource(), e);
        if (item.getStatus() == BatchItemStatus.PENDING) {
          item.fail(FailureKind.of(e), e.toString());
        }
        fatal = e;
      }
      notify(listener, l -> l.onItemDone(item));
    }

    reportProgress(run, listener, 100);
    BatchSummary summary = run.finish();
    logger.info("Processing complete - {} succeeded, {} failed, {} not started",
        summary.succeeded(), summary.failed(), summary.pending());
    notify(listener, l -> l.onFinished(summary));

    // Finish events precede the rethrow
    if (fatal != null) {
      throw fatal;
    }

    return summary;
  }

  private void processItem(BatchItem item, BatchRequest request) {
    try {
      RasterBuffer source = rasterIo.load(item.getSource());
      RasterBuffer processed = request.getFilter().apply(source);

      if (!rasterIo.save(processed, item.getOutput())) {
        logger.warn("Error processing {}: {}", item.getSource(), SAVE_FAILURE_REASON);
        item.fail(FailureKind.WRITE_FAILURE, SAVE_FAILURE_REASON);
        return;
      }

      Integer similarity = request.isCompareWithSource()
          ? similarityScorer.score(source, processed, request.getSensitivity())
          : null;
      item.succeed(similarity);
      logger.debug("Processed {} -> {}", item.getSource(), item.getOutput());
    } catch (RuntimeException e) {
      logger.warn("Error processing {}: {}", item.getSource(), e.getMessage());
      item.fail(FailureKind.of(e), e.getMessage());
    }
  }

  private void reportProgress(BatchRun run, BatchListener listener, int percent) {
    run.setProgress(percent);
    logger.debug("Batch progress {}%", percent);
    notify(listener, l -> l.onProgress(percent));
  }

  private void notify(BatchListener listener, Consumer<BatchListener> event) {
    try {
      event.accept(listener);
    } catch (RuntimeException e) {
      logger.warn("Batch listener failed", e);
    }
  }

  /**
   * Stops accepting runs and waits briefly for the current one. A run still going after that is
   * left to finish on its daemon thread.
   */
  @Override
  public void close() {
    worker.shutdown();
    try {
      if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
        logger.warn("Batch worker still busy after shutdown request");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
