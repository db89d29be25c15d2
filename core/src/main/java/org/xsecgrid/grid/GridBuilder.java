/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.xsecgrid.grid;

import org.xsecgrid.descriptor.ParameterInfo;
import org.xsecgrid.reader.CellValue;
import org.xsecgrid.reader.Row;
import org.xsecgrid.reader.TableParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.TreeMap;

/**
 * Indexes table rows by their rounded parameter values.
 *
 * <h3>Duplicate keys</h3>
 * <p>Tables are sometimes stored at a finer resolution than the declared
 * granularity, so that several rows round to one key. Under the default
 * {@link DuplicateKeyPolicy#LAST_WINS} policy the grid keeps the row read
 * last: a later row overwrites an earlier one, in file order. This is the
 * only consistency rule the grid has, and callers may rely on it (a table
 * can append corrected rows). {@link DuplicateKeyPolicy#ERROR} rejects such
 * tables instead. Rows are never averaged.
 */
public class GridBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(GridBuilder.class);

  private final List<ParameterInfo> parameters;
  private final DuplicateKeyPolicy policy;

  public GridBuilder(List<ParameterInfo> parameters) {
    this(parameters, DuplicateKeyPolicy.LAST_WINS);
  }

  public GridBuilder(List<ParameterInfo> parameters, DuplicateKeyPolicy policy) {
    if (parameters.isEmpty()) {
      throw new IllegalArgumentException("At least one parameter is required");
    }
    this.parameters = parameters;
    this.policy = policy;
  }

  /**
   * Builds the grid.
   *
   * @param rows Rows in file order
   * @param source Table name used in messages
   * @return Immutable grid
   * @throws TableParseException if a parameter field is not a finite number
   * @throws DuplicateGridKeyException on a duplicate key under the ERROR policy
   */
  public ParameterGrid build(List<Row> rows, String source)
      throws TableParseException, DuplicateGridKeyException {
    TreeMap<GridKey, Row> index = new TreeMap<GridKey, Row>();
    int overwritten = 0;
    for (Row row : rows) {
      GridKey key = keyOf(row, source);
      Row previous = index.put(key, row);
      if (previous != null) {
        if (policy == DuplicateKeyPolicy.ERROR) {
          throw new DuplicateGridKeyException(key,
              previous.getLineNumber(), row.getLineNumber());
        }
        LOGGER.debug("Row at line {} replaces line {} for key {}",
            row.getLineNumber(), previous.getLineNumber(), key);
        overwritten++;
      }
    }
    if (overwritten > 0) {
      LOGGER.info("{} row(s) of {} were replaced by later rows with the same grid key",
          overwritten, source);
    }
    return new ParameterGrid(parameters, index, overwritten);
  }

  private GridKey keyOf(Row row, String source) throws TableParseException {
    double[] values = new double[parameters.size()];
    for (int i = 0; i < values.length; i++) {
      String column = parameters.get(i).getColumn();
      CellValue cell = row.get(column);
      if (cell == null) {
        throw new TableParseException(source, row.getLineNumber(), rawLineOf(row),
            "row has no parameter column '" + column + "'");
      }
      if (!cell.isNumber() || Double.isNaN(cell.asDouble())
          || Double.isInfinite(cell.asDouble())) {
        throw new TableParseException(source, row.getLineNumber(), rawLineOf(row),
            "parameter '" + column + "' is not a finite number: " + cell);
      }
      values[i] = parameters.get(i).round(cell.asDouble());
    }
    return GridKey.of(values);
  }

  /** The physical line, or a rendering of the fields for rows built in memory. */
  private static String rawLineOf(Row row) {
    String rawLine = row.getRawLine();
    return rawLine != null ? rawLine : row.toString();
  }
}
