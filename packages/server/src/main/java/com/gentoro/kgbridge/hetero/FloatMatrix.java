package com.gentoro.kgbridge.hetero;

import com.gentoro.kgbridge.exception.ShapeMismatchException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** Dense row-major {@code float} matrix. Immutable. */
public final class FloatMatrix {
  private final int rows;
  private final int cols;
  private final float[] data;

  private FloatMatrix(int rows, int cols, float[] data) {
    this.rows = rows;
    this.cols = cols;
    this.data = data;
  }

  /**
   * Build from row buffers, all of which must have the same width.
   *
   * @param what name used in the error message, e.g. {@code node features of 'Person'}
   * @throws ShapeMismatchException on ragged rows
   */
  public static FloatMatrix fromRows(List<double[]> source, String what) {
    int rows = source.size();
    int cols = rows == 0 ? 0 : source.get(0).length;
    float[] data = new float[rows * cols];
    for (int r = 0; r < rows; r++) {
      double[] row = source.get(r);
      if (row.length != cols) {
        throw new ShapeMismatchException(
            "Ragged " + what + ": row " + r + " has " + row.length + " values, expected " + cols,
            Map.of("row", r, "width", row.length, "expected", cols));
      }
      for (int c = 0; c < cols; c++) {
        data[r * cols + c] = (float) row[c];
      }
    }
    return new FloatMatrix(rows, cols, data);
  }

  public int rows() {
    return rows;
  }

  public int cols() {
    return cols;
  }

  public float get(int row, int col) {
    if (row < 0 || row >= rows || col < 0 || col >= cols) {
      throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + shape());
    }
    return data[row * cols + col];
  }

  public float[] row(int row) {
    if (row < 0 || row >= rows) {
      throw new IndexOutOfBoundsException("row " + row + " outside " + shape());
    }
    return Arrays.copyOfRange(data, row * cols, (row + 1) * cols);
  }

  public String shape() {
    return rows + "x" + cols;
  }

  @Override
  public String toString() {
    return "FloatMatrix[" + shape() + "]";
  }
}
