package org.servekit.scoring;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.servekit.utils.SerializationUtils;

/**
 * A tabular batch in split-oriented JSON format: an object with a {@code columns} list of column
 * names and a {@code data} list of rows, e.g.
 *
 * <pre>
 *   {"columns": ["sepal_length", "sepal_width"], "data": [[5.1, 3.5], [4.9, 3.0]]}
 * </pre>
 *
 * An optional {@code index} entry is accepted and ignored. Every cell must be numeric.
 */
public class SplitOrientedDataFrame {
  private static final String FRAME_KEY_COLUMN_NAMES = "columns";
  private static final String FRAME_KEY_ROWS = "data";

  private final List<String> columnNames;
  private final double[][] rows;

  private SplitOrientedDataFrame(List<?> columns, List<?> rows) {
    List<String> names = new ArrayList<>(columns.size());
    for (Object column : columns) {
      if (!(column instanceof String)) {
        throw new InvalidSchemaException(
            String.format("Column names of the DataFrame must be strings, found `%s`", column));
      }
      names.add((String) column);
    }
    this.columnNames = Collections.unmodifiableList(names);
    this.rows = new double[rows.size()][];
    for (int rowIndex = 0; rowIndex < rows.size(); ++rowIndex) {
      if (!(rows.get(rowIndex) instanceof List)) {
        throw new InvalidSchemaException(
            String.format(
                "Row %d of the DataFrame is not a list of values: `%s`",
                rowIndex, rows.get(rowIndex)));
      }
      List<?> row = (List<?>) rows.get(rowIndex);
      if (row.size() != names.size()) {
        throw new IllegalArgumentException(
            String.format(
                "Row %d of the DataFrame does not contain the expected number of columns! Found %d"
                    + " columns, expected %d columns",
                rowIndex, row.size(), names.size()));
      }
      double[] values = new double[row.size()];
      for (int i = 0; i < row.size(); ++i) {
        Object cell = row.get(i);
        if (!(cell instanceof Number)) {
          throw new InvalidSchemaException(
              String.format(
                  "Column `%s` of row %d is not numeric: `%s`", names.get(i), rowIndex, cell));
        }
        values[i] = ((Number) cell).doubleValue();
      }
      this.rows[rowIndex] = values;
    }
  }

  /**
   * Constructs a {@link SplitOrientedDataFrame}
   *
   * @param frameJson A representation of the DataFrame
   * @throws IOException If the text is not valid JSON
   * @throws InvalidSchemaException If the JSON does not follow the split orientation
   */
  public static SplitOrientedDataFrame fromJson(String frameJson) throws IOException {
    Map<?, ?> parsedFrame = SerializationUtils.fromJson(frameJson, Map.class);
    validateSplitOrientation(parsedFrame);
    return new SplitOrientedDataFrame(
        (List<?>) parsedFrame.get(FRAME_KEY_COLUMN_NAMES),
        (List<?>) parsedFrame.get(FRAME_KEY_ROWS));
  }

  private static void validateSplitOrientation(Map<?, ?> parsedFrame) {
    if (parsedFrame == null) {
      throw new InvalidSchemaException(
          "The JSON representation of the DataFrame must be an object, found `null`.");
    }
    String[] expectedKeys = new String[] {FRAME_KEY_COLUMN_NAMES, FRAME_KEY_ROWS};
    for (String key : expectedKeys) {
      if (!(parsedFrame.get(key) instanceof List)) {
        throw new InvalidSchemaException(
            String.format(
                "The JSON representation of the DataFrame is missing an expected list with name:"
                    + " `%s` that is required by the `split` orientation.",
                key));
      }
    }
  }

  /** @return The number of rows contained in the DataFrame */
  public int size() {
    return rows.length;
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  /** @return A copy of the frame's cells, one array per row in column order */
  public double[][] toMatrix() {
    double[][] matrix = new double[rows.length][];
    for (int i = 0; i < rows.length; ++i) {
      matrix[i] = rows[i].clone();
    }
    return matrix;
  }
}
