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
import org.xsecgrid.reader.Row;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Immutable index of table rows by {@link GridKey}.
 *
 * <p>Built by {@link GridBuilder}; safe to read from many threads.
 */
public final class ParameterGrid {
  private final ImmutableList<ParameterInfo> parameters;
  private final ImmutableSortedMap<GridKey, Row> rows;
  private final ImmutableList<ImmutableList<Double>> axisValues;
  private final int keysOverwritten;

  ParameterGrid(List<ParameterInfo> parameters, SortedMap<GridKey, Row> rows,
      int keysOverwritten) {
    this.parameters = ImmutableList.copyOf(parameters);
    this.rows = ImmutableSortedMap.copyOfSorted(rows);
    this.keysOverwritten = keysOverwritten;

    ImmutableList.Builder<ImmutableList<Double>> axes = ImmutableList.builder();
    for (int axis = 0; axis < parameters.size(); axis++) {
      TreeSet<Double> distinct = new TreeSet<Double>();
      for (GridKey key : rows.keySet()) {
        distinct.add(key.get(axis));
      }
      axes.add(ImmutableList.copyOf(distinct));
    }
    this.axisValues = axes.build();
  }

  public List<ParameterInfo> getParameters() {
    return parameters;
  }

  public int dimensions() {
    return parameters.size();
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * Rounds raw parameter values to the key they fall on.
   *
   * @throws IllegalArgumentException if the number of values does not match
   *     the number of parameters
   */
  public GridKey keyFor(double... parameterValues) {
    if (parameterValues.length != parameters.size()) {
      throw new IllegalArgumentException("Expected " + parameters.size()
          + " parameter value(s) but got " + parameterValues.length);
    }
    double[] rounded = new double[parameterValues.length];
    for (int i = 0; i < rounded.length; i++) {
      rounded[i] = parameters.get(i).round(parameterValues[i]);
    }
    return GridKey.of(rounded);
  }

  public Optional<Row> get(GridKey key) {
    return Optional.ofNullable(rows.get(key));
  }

  public boolean contains(GridKey key) {
    return rows.containsKey(key);
  }

  /**
   * Returns all keys in ascending lexicographic order.
   */
  public List<GridKey> keys() {
    return rows.keySet().asList();
  }

  /**
   * Returns the entries in ascending key order.
   */
  public Iterable<Map.Entry<GridKey, Row>> entries() {
    return rows.entrySet();
  }

  /**
   * Returns the distinct known coordinates of an axis, ascending.
   */
  public List<Double> axisValues(int axis) {
    return axisValues.get(axis);
  }

  /**
   * Returns the smallest known coordinate of an axis.
   *
   * @throws IllegalStateException if the grid is empty
   */
  public double min(int axis) {
    requireNonEmpty();
    return axisValues.get(axis).get(0);
  }

  /**
   * Returns the largest known coordinate of an axis.
   *
   * @throws IllegalStateException if the grid is empty
   */
  public double max(int axis) {
    requireNonEmpty();
    List<Double> values = axisValues.get(axis);
    return values.get(values.size() - 1);
  }

  /**
   * Returns how many rows were replaced by later rows with the same key.
   */
  public int getKeysOverwritten() {
    return keysOverwritten;
  }

  private void requireNonEmpty() {
    if (rows.isEmpty()) {
      throw new IllegalStateException("Grid is empty");
    }
  }

  @Override public String toString() {
    return "ParameterGrid{parameters=" + parameters + ", points=" + rows.size() + "}";
  }
}
