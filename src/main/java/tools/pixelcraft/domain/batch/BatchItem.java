package tools.pixelcraft.domain.batch;

import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One source image of a batch run. Starts {@link BatchItemStatus#PENDING} and moves to a terminal
 * status exactly once.
 */
public class BatchItem {
  private final Path source;
  private final Path output;

  private BatchItemStatus status = BatchItemStatus.PENDING;
  private FailureKind failureKind;
  private String failureReason;
  private Integer similarity;

  BatchItem(Path source, Path output) {
    this.source = source;
    this.output = output;
  }

  public Path getSource() {
    return source;
  }

  public Path getOutput() {
    return output;
  }

  public synchronized BatchItemStatus getStatus() {
    return status;
  }

  public synchronized Optional<FailureKind> getFailureKind() {
    return Optional.ofNullable(failureKind);
  }

  public synchronized Optional<String> getFailureReason() {
    return Optional.ofNullable(failureReason);
  }

  /**
   * @return The similarity of the output to its source, present only for succeeded items of a run
   *         that asked for comparison.
   */
  public synchronized OptionalInt getSimilarity() {
    return similarity == null ? OptionalInt.empty() : OptionalInt.of(similarity);
  }

  synchronized void succeed(Integer similarity) {
    requirePending();
    this.status = BatchItemStatus.SUCCEEDED;
    this.similarity = similarity;
  }

  synchronized void fail(FailureKind kind, String reason) {
    requirePending();
    this.status = BatchItemStatus.FAILED;
    this.failureKind = kind;
    this.failureReason = reason;
  }

  private void requirePending() {
    if (status.isTerminal()) {
      throw new IllegalStateException(source + " was already processed: " + status);
    }
  }

  @Override
  public synchronized String toString() {
    switch (status) {
      case SUCCEEDED:
        return source + " -> " + output;
      case FAILED:
        return source + " failed (" + failureKind + "): " + failureReason;
      default:
        return source + " pending";
    }
  }
}
