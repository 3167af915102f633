package tools.pixelcraft.domain.image;

import java.util.Arrays;

/**
 * Immutable square weight matrix with an odd size, applied with its center over each pixel.
 */
public final class Kernel {
  private final int size;
  private final double[] weights;

  private Kernel(int size, double[] weights) {
    this.size = size;
    this.weights = weights;
  }

  /**
   * Creates a kernel from a square matrix. The matrix is copied.
   *
   * @param matrix Rows of weights. Must be square with an odd size.
   * @return The new kernel.
   */
  public static Kernel of(double[][] matrix) {
    int size = matrix.length;
    if (size == 0 || size % 2 == 0) {
      throw new IllegalArgumentException("Kernel size must be odd, got " + size);
    }

    double[] weights = new double[size * size];
    for (int row = 0; row < size; row++) {
      if (matrix[row].length != size) {
        throw new IllegalArgumentException("Kernel must be square, row " + row + " has "
            + matrix[row].length + " weights instead of " + size);
      }
      System.arraycopy(matrix[row], 0, weights, row * size, size);
    }

    return new Kernel(size, weights);
  }

  /**
   * Creates a normalized box kernel, every weight being {@code 1 / (size * size)}.
   *
   * @param size Odd side length.
   * @return The new kernel.
   */
  public static Kernel box(int size) {
    double[][] matrix = new double[size][size];
    for (double[] row : matrix) {
      Arrays.fill(row, 1.0 / (size * size));
    }

    return of(matrix);
  }

  public int getSize() {
    return size;
  }

  public double getWeight(int row, int column) {
    return weights[row * size + column];
  }
}
