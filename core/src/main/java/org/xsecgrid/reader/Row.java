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
package org.xsecgrid.reader;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One parsed record of a raw table, aligned to the descriptor's columns.
 */
public final class Row {
  private final int lineNumber;
  private final @Nullable String rawLine;
  private final ImmutableList<CellValue> cells;
  private final ImmutableMap<String, Integer> columnIndex;

  /**
   * Creates a row.
   *
   * @param lineNumber 1-based physical line the row was read from, 0 if the
   *     row was not read from a file
   * @param cells Fields in column order
   * @param columnIndex Column name to position
   */
  public Row(int lineNumber, List<CellValue> cells, ImmutableMap<String, Integer> columnIndex) {
    this(lineNumber, null, cells, columnIndex);
  }

  /**
   * Creates a row read from a physical line.
   *
   * @param lineNumber 1-based physical line the row was read from
   * @param rawLine The line as it appears in the file, or null
   * @param cells Fields in column order
   * @param columnIndex Column name to position
   */
  public Row(int lineNumber, @Nullable String rawLine, List<CellValue> cells,
      ImmutableMap<String, Integer> columnIndex) {
    if (cells.size() != columnIndex.size()) {
      throw new IllegalArgumentException("Row has " + cells.size()
          + " fields but " + columnIndex.size() + " columns");
    }
    this.lineNumber = lineNumber;
    this.rawLine = rawLine;
    this.cells = ImmutableList.copyOf(cells);
    this.columnIndex = columnIndex;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  /**
   * Returns the physical line the row was read from, or null if the row was
   * not read from a file.
   */
  public @Nullable String getRawLine() {
    return rawLine;
  }

  /**
   * Returns the field of the named column, or null if the row has no such
   * column.
   */
  public @Nullable CellValue get(String column) {
    Integer index = columnIndex.get(column);
    return index == null ? null : cells.get(index);
  }

  public CellValue get(int index) {
    return cells.get(index);
  }

  public List<CellValue> getCells() {
    return cells;
  }

  public int size() {
    return cells.size();
  }

  /**
   * Returns the row as a column-name to field map, in column order.
   */
  public Map<String, CellValue> asMap() {
    Map<String, CellValue> map = new LinkedHashMap<String, CellValue>();
    for (Map.Entry<String, Integer> e : columnIndex.entrySet()) {
      map.put(e.getKey(), cells.get(e.getValue()));
    }
    return map;
  }

  @Override public String toString() {
    return "Row{line=" + lineNumber + ", " + asMap() + "}";
  }
}
