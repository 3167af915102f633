package tools.pixelcraft.domain.batch;

import tools.pixelcraft.exceptions.ImageDecodingException;
import tools.pixelcraft.exceptions.ImageNotFoundException;
import tools.pixelcraft.exceptions.InvalidInputException;
import tools.pixelcraft.exceptions.ShapeMismatchException;
import tools.pixelcraft.exceptions.WriteFailureException;

/**
 * Why a batch item failed.
 */
public enum FailureKind {
  NOT_FOUND, DECODE, INVALID_INPUT, WRITE_FAILURE, UNEXPECTED;

  /**
   * Classifies an exception raised while processing an item.
   *
   * @param throwable The failure.
   * @return The matching kind, {@link #UNEXPECTED} for anything outside the engine's taxonomy.
   */
  public static FailureKind of(Throwable throwable) {
    if (throwable instanceof ImageNotFoundException) {
      return NOT_FOUND;
    }
    if (throwable instanceof ImageDecodingException) {
      return DECODE;
    }
    if (throwable instanceof InvalidInputException
        || throwable instanceof ShapeMismatchException) {
      return INVALID_INPUT;
    }
    if (throwable instanceof WriteFailureException) {
      return WRITE_FAILURE;
    }

    return UNEXPECTED;
  }
}
