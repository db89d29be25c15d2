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

/**
 * Counters collected while a dataset is loaded.
 */
public final class LoadReport {
  private final String source;
  private final int rowsRead;
  private final int rowsSkipped;
  private final int keysOverwritten;

  public LoadReport(String source, int rowsRead, int rowsSkipped, int keysOverwritten) {
    this.source = source;
    this.rowsRead = rowsRead;
    this.rowsSkipped = rowsSkipped;
    this.keysOverwritten = keysOverwritten;
  }

  public String getSource() {
    return source;
  }

  /**
   * Returns the number of well-formed rows.
   */
  public int getRowsRead() {
    return rowsRead;
  }

  /**
   * Returns the number of malformed rows skipped in lenient mode.
   */
  public int getRowsSkipped() {
    return rowsSkipped;
  }

  /**
   * Returns the number of rows replaced by a later row with the same grid key.
   */
  public int getKeysOverwritten() {
    return keysOverwritten;
  }

  /**
   * Returns a copy with the grid builder's overwrite count.
   */
  public LoadReport withKeysOverwritten(int count) {
    return new LoadReport(source, rowsRead, rowsSkipped, count);
  }

  @Override public String toString() {
    return "LoadReport{source='" + source + "', rowsRead=" + rowsRead
        + ", rowsSkipped=" + rowsSkipped + ", keysOverwritten=" + keysOverwritten + "}";
  }
}
