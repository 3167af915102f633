package tools.pixelcraft.domain.batch;

import java.util.List;

/**
 * Final tally of a batch run.
 *
 * @param total Number of items in the run.
 * @param succeeded Items written successfully.
 * @param failed Items that failed.
 * @param pending Items never started because the run was canceled.
 * @param canceled Whether cancellation was requested before the run finished.
 */
public record BatchSummary(int total, int succeeded, int failed, int pending, boolean canceled) {
  static BatchSummary of(List<BatchItem> items, boolean canceled) {
    int succeeded = 0;
    int failed = 0;
    int pending = 0;
    for (BatchItem item : items) {
      switch (item.getStatus()) {
        case SUCCEEDED:
          succeeded++;
          break;
        case FAILED:
          failed++;
          break;
        default:
          pending++;
      }
    }

    return new BatchSummary(items.size(), succeeded, failed, pending, canceled);
  }

  public boolean hasFailures() {
    return failed > 0;
  }
}
