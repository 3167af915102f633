package tools.pixelcraft.domain.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class BatchRunTest {
  private final BatchRequest request = BatchRequest
      .of(List.of(Path.of("in", "a.jpg"), Path.of("in", "b.png")), "laplacian", 16, Path.of("out"));

  @Test
  void whenRunIsCreatedThenEveryItemIsPendingWithItsDerivedOutput() {
    var run = new BatchRun(request);

    assertEquals(BatchRun.State.READY, run.getState());
    assertEquals(2, run.getItems().size());
    assertTrue(run.getItems().stream().allMatch(i -> i.getStatus() == BatchItemStatus.PENDING));
    assertEquals(Path.of("out", "a_Laplacian.jpg"), run.getItems().get(0).getOutput());
    assertEquals(Path.of("out", "b_Laplacian.png"), run.getItems().get(1).getOutput());
  }

  @Test
  void whenRunHasFinishedThenCancellationIsIgnored() {
    var run = new BatchRun(request);
    run.start();
    run.finish();

    assertFalse(run.cancel());
    assertFalse(run.isCancellationRequested());
  }

  @Test
  void whenRunIsStartedTwiceThenSecondStartFails() {
    var run = new BatchRun(request);
    run.start();

    assertThrows(IllegalStateException.class, run::start);
  }

  @Test
  void whenItemIsAlreadyTerminalThenItCannotTransitionAgain() {
    var item = new BatchRun(request).getItems().get(0);
    item.fail(FailureKind.NOT_FOUND, "missing");

    assertThrows(IllegalStateException.class, () -> item.succeed(null));
    assertThrows(IllegalStateException.class, () -> item.fail(FailureKind.DECODE, "again"));
    assertEquals("missing", item.getFailureReason().get());
  }

  @Test
  void whenItemsAreListedThenTheListIsReadOnly() {
    var run = new BatchRun(request);

    assertThrows(UnsupportedOperationException.class, () -> run.getItems().clear());
  }

  @Test
  void whenCancelRacesWithFinishThenAcceptedCancellationIsAlwaysInTheSummary() throws Exception {
    for (int attempt = 0; attempt < 200; attempt++) {
      var run = new BatchRun(request);
      run.start();
      var accepted = new CompletableFuture<Boolean>();
      var canceller = new Thread(() -> accepted.complete(run.cancel()));

      canceller.start();
      BatchSummary summary = run.finish();
      canceller.join();

      assertEquals(accepted.get(), summary.canceled());
      assertFalse(run.cancel());
    }
  }
}
