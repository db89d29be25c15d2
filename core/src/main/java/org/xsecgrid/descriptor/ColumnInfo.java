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
package org.xsecgrid.descriptor;

/**
 * A column of the raw table.
 *
 * <p>The name is the identifier used by parameters and values; the unit is
 * informational text such as {@code fb}, {@code pb}, {@code GeV} or {@code %},
 * empty when the column has no unit.
 */
public final class ColumnInfo {
  private final int index;
  private final String name;
  private final String unit;

  public ColumnInfo(int index, String name, String unit) {
    this.index = index;
    this.name = name;
    this.unit = unit == null ? "" : unit;
  }

  /**
   * Returns the zero-based position of the column in a raw row.
   */
  public int getIndex() {
    return index;
  }

  public String getName() {
    return name;
  }

  public String getUnit() {
    return unit;
  }

  @Override public String toString() {
    return unit.isEmpty() ? name : name + " [" + unit + "]";
  }
}
