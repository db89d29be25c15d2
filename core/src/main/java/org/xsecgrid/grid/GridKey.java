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

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;

/**
 * A point of the parameter grid: one rounded value per parameter, in the
 * order the descriptor declares its parameters.
 *
 * <p>Keys order lexicographically, first axis most significant.
 */
public final class GridKey implements Comparable<GridKey> {
  private final double[] values;

  private GridKey(double[] values) {
    this.values = values;
  }

  /**
   * Creates a key from already rounded values.
   */
  public static GridKey of(double... values) {
    double[] copy = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      copy[i] = values[i] + 0.0;
    }
    return new GridKey(copy);
  }

  public int size() {
    return values.length;
  }

  public double get(int axis) {
    return values[axis];
  }

  public List<Double> toList() {
    ImmutableList.Builder<Double> builder = ImmutableList.builder();
    for (double v : values) {
      builder.add(v);
    }
    return builder.build();
  }

  @Override public int compareTo(GridKey o) {
    int n = Math.min(values.length, o.values.length);
    for (int i = 0; i < n; i++) {
      int c = Double.compare(values[i], o.values[i]);
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(values.length, o.values.length);
  }

  @Override public boolean equals(Object o) {
    return this == o || o instanceof GridKey && Arrays.equals(values, ((GridKey) o).values);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < values.length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(values[i]);
    }
    return sb.append(')').toString();
  }
}
