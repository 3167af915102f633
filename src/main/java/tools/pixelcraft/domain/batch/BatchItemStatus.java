package tools.pixelcraft.domain.batch;

public enum BatchItemStatus {
  PENDING, SUCCEEDED, FAILED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
