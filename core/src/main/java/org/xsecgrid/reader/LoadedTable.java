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

import java.util.List;

/**
 * Rows of a raw table together with the kind decided for each column.
 */
public final class LoadedTable {
  private final ImmutableList<Row> rows;
  private final ImmutableList<CellValue.Kind> columnKinds;
  private final LoadReport report;

  public LoadedTable(List<Row> rows, List<CellValue.Kind> columnKinds, LoadReport report) {
    this.rows = ImmutableList.copyOf(rows);
    this.columnKinds = ImmutableList.copyOf(columnKinds);
    this.report = report;
  }

  /**
   * Returns the rows in file order.
   */
  public List<Row> getRows() {
    return rows;
  }

  /**
   * Returns the kind of each column, in column order.
   */
  public List<CellValue.Kind> getColumnKinds() {
    return columnKinds;
  }

  public CellValue.Kind getColumnKind(int index) {
    return columnKinds.get(index);
  }

  public LoadReport getReport() {
    return report;
  }
}
