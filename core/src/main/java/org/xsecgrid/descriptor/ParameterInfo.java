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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A column used as a query parameter, with its rounding granularity.
 *
 * <p>Parameter values read from ASCII tables carry round-off noise, so that
 * {@code 299.99999} and {@code 300.0} would otherwise index different grid
 * points. Values are snapped to the nearest multiple of the granularity:
 * <pre>{@code
 * round(value / granularity) * granularity
 * }</pre>
 * For a grid {@code [10, 20, 30, 50, 70]} a granularity of 10, 5 or 1 works;
 * for {@code [33.3, 50, 90]} it should be 0.1 or finer.
 */
public final class ParameterInfo {
  private final String column;
  private final @Nullable Double granularity;

  public ParameterInfo(String column, @Nullable Double granularity) {
    this.column = column;
    this.granularity = granularity;
  }

  public String getColumn() {
    return column;
  }

  /**
   * Returns the granularity, or null if the axis is indexed on raw values.
   */
  public @Nullable Double getGranularity() {
    return granularity;
  }

  /**
   * Snaps a raw parameter value onto this axis.
   */
  public double round(double value) {
    if (granularity == null) {
      return value + 0.0;
    }
    double g = granularity;
    // "+ 0.0" folds -0.0 into 0.0 so that keys compare equal
    return Math.round(value / g) * g + 0.0;
  }

  @Override public String toString() {
    return granularity == null ? column : column + " (granularity " + granularity + ")";
  }
}
