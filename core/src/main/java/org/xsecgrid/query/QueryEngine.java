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
package org.xsecgrid.query;

import org.xsecgrid.QueryException;
import org.xsecgrid.grid.GridKey;
import org.xsecgrid.grid.ParameterGrid;
import org.xsecgrid.resolve.ResolvedRecord;
import org.xsecgrid.resolve.ResolvedTable;
import org.xsecgrid.resolve.UncertaintyConfigException;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Answers lookups against a parameter grid and its resolved values.
 *
 * <p>The engine holds only immutable data, so its methods may be called
 * concurrently without locking.
 *
 * <h3>Lookups</h3>
 * <ul>
 *   <li>{@link #lookupExact}: the query point is rounded to the axis
 *       granularities and must be a grid key.</li>
 *   <li>{@link #lookupInterpolated}: a grid key is returned as is; otherwise
 *       the point must lie within the grid's extent on every axis, and is
 *       then snapped to the nearest key or interpolated multilinearly between
 *       the bracketing keys.</li>
 * </ul>
 */
public class QueryEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(QueryEngine.class);

  private final ParameterGrid grid;
  private final ImmutableList<ResolvedTable> tables;

  public QueryEngine(ParameterGrid grid, List<ResolvedTable> tables) {
    this.grid = grid;
    this.tables = ImmutableList.copyOf(tables);
  }

  /**
   * Lists every value specification with its merged attributes.
   */
  public List<ValueSpecSummary> listValueSpecs() {
    ImmutableList.Builder<ValueSpecSummary> result = ImmutableList.builder();
    for (ResolvedTable table : tables) {
      UncertaintyConfigException failure = table.getFailure();
      result.add(new ValueSpecSummary(table.getIndex(), table.getSpec().getColumn(),
          table.getUnit(), table.getAttributes(),
          failure == null ? null : failure.getMessage()));
    }
    return result.build();
  }

  /**
   * Looks up the grid point the query falls on.
   *
   * @param parameters Raw parameter values, in descriptor order
   * @param valueIndex Index of the value specification
   * @return Record stored at the rounded point
   * @throws GridKeyNotFoundException if no row has that key
   * @throws OutOfRangeException if a coordinate is NaN or infinite
   * @throws UncertaintyConfigException if the value failed to resolve
   */
  public ResolvedRecord lookupExact(double[] parameters, int valueIndex)
      throws QueryException, UncertaintyConfigException {
    ResolvedTable table = availableTable(valueIndex);
    GridKey key = grid.keyFor(parameters);
    requireFinite(parameters);
    ResolvedRecord record = table.get(key);
    if (record == null) {
      throw new GridKeyNotFoundException(key);
    }
    return record;
  }

  /**
   * Looks up or interpolates a value on linear axes.
   *
   * @see #lookupInterpolated(double[], int, InterpolationMethod, AxisScaling)
   */
  public ResolvedRecord lookupInterpolated(double[] parameters, int valueIndex,
      InterpolationMethod method) throws QueryException, UncertaintyConfigException {
    return lookupInterpolated(parameters, valueIndex, method, AxisScaling.LINEAR);
  }

  /**
   * Looks up or interpolates a value.
   *
   * @param parameters Raw parameter values, in descriptor order
   * @param valueIndex Index of the value specification
   * @param method Matching method
   * @param scaling Coordinate transformation for {@link InterpolationMethod#LINEAR}
   * @return Record at the grid point, or an interpolated record
   * @throws OutOfRangeException if the point is outside the grid on some axis
   * @throws GridKeyNotFoundException if a grid point needed for
   *     interpolation is missing
   * @throws InterpolationUnsupportedException if the value holds labels or
   *     logarithmic scaling meets a non-positive number
   * @throws UncertaintyConfigException if the value failed to resolve
   */
  public ResolvedRecord lookupInterpolated(double[] parameters, int valueIndex,
      InterpolationMethod method, AxisScaling scaling)
      throws QueryException, UncertaintyConfigException {
    if (method == InterpolationMethod.EXACT) {
      return lookupExact(parameters, valueIndex);
    }
    ResolvedTable table = availableTable(valueIndex);
    GridKey key = grid.keyFor(parameters);
    requireFinite(parameters);
    ResolvedRecord record = table.get(key);
    if (record != null) {
      return record;
    }
    if (grid.isEmpty()) {
      throw new GridKeyNotFoundException(key, "Grid is empty; no point at " + key);
    }
    checkRange(parameters);

    if (method == InterpolationMethod.NEAREST) {
      return nearest(parameters, table);
    }
    if (!table.isNumeric()) {
      throw new InterpolationUnsupportedException("Column '" + table.getSpec().getColumn()
          + "' holds labels and cannot be interpolated");
    }
    return linear(parameters, table, scaling);
  }

  private ResolvedTable availableTable(int valueIndex) throws UncertaintyConfigException {
    if (valueIndex < 0 || valueIndex >= tables.size()) {
      throw new IllegalArgumentException("No value #" + valueIndex + "; the dataset has "
          + tables.size() + " value(s)");
    }
    ResolvedTable table = tables.get(valueIndex);
    UncertaintyConfigException failure = table.getFailure();
    if (failure != null) {
      throw failure;
    }
    return table;
  }

  /**
   * Rejects NaN and infinite coordinates, which rounding would otherwise map
   * onto a finite key.
   */
  private void requireFinite(double[] parameters) throws OutOfRangeException {
    for (int axis = 0; axis < parameters.length; axis++) {
      double p = parameters[axis];
      if (Double.isNaN(p) || Double.isInfinite(p)) {
        double min = grid.isEmpty() ? Double.NaN : grid.min(axis);
        double max = grid.isEmpty() ? Double.NaN : grid.max(axis);
        throw new OutOfRangeException(grid.getParameters().get(axis).getColumn(), p, min, max);
      }
    }
  }

  private void checkRange(double[] parameters) throws OutOfRangeException {
    for (int axis = 0; axis < parameters.length; axis++) {
      double min = grid.min(axis);
      double max = grid.max(axis);
      double p = parameters[axis];
      if (Double.isNaN(p) || p < min || p > max) {
        throw new OutOfRangeException(grid.getParameters().get(axis).getColumn(), p, min, max);
      }
    }
  }

  private ResolvedRecord nearest(double[] parameters, ResolvedTable table)
      throws GridKeyNotFoundException {
    double[] extent = new double[parameters.length];
    for (int axis = 0; axis < extent.length; axis++) {
      double e = grid.max(axis) - grid.min(axis);
      extent[axis] = e > 0 ? e : 1;
    }
    GridKey best = null;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (GridKey key : grid.keys()) {
      double distance = 0;
      for (int axis = 0; axis < extent.length; axis++) {
        double d = (parameters[axis] - key.get(axis)) / extent[axis];
        distance += d * d;
      }
      // strict comparison keeps the first key in ascending order on ties
      if (distance < bestDistance) {
        bestDistance = distance;
        best = key;
      }
    }
    ResolvedRecord record = best == null ? null : table.get(best);
    if (record == null) {
      throw new GridKeyNotFoundException(grid.keyFor(parameters));
    }
    LOGGER.debug("Nearest grid point to {} is {}", Arrays.toString(parameters), best);
    return record;
  }

  private ResolvedRecord linear(double[] parameters, ResolvedTable table, AxisScaling scaling)
      throws QueryException {
    int dims = parameters.length;
    double[] lo = new double[dims];
    double[] hi = new double[dims];
    double[] t = new double[dims];
    for (int axis = 0; axis < dims; axis++) {
      bracket(axis, parameters[axis], lo, hi);
      if (lo[axis] == hi[axis]) {
        t[axis] = 0;
      } else {
        double x = scaleParameter(parameters[axis], axis, scaling);
        double x0 = scaleParameter(lo[axis], axis, scaling);
        double x1 = scaleParameter(hi[axis], axis, scaling);
        t[axis] = (x - x0) / (x1 - x0);
      }
    }

    // sums of f(central), f(central + upper), f(central - lower) in value space
    double central = 0;
    double upperEdge = 0;
    double lowerEdge = 0;
    double[] corner = new double[dims];
    for (int mask = 0; mask < (1 << dims); mask++) {
      double weight = 1;
      boolean duplicate = false;
      for (int axis = 0; axis < dims; axis++) {
        boolean high = (mask & (1 << axis)) != 0;
        if (high && lo[axis] == hi[axis]) {
          duplicate = true;
          break;
        }
        corner[axis] = high ? hi[axis] : lo[axis];
        weight *= high ? t[axis] : 1 - t[axis];
      }
      if (duplicate) {
        continue;
      }
      GridKey key = GridKey.of(corner);
      ResolvedRecord record = table.get(key);
      if (record == null) {
        throw new GridKeyNotFoundException(key, "Grid point " + key
            + " needed to interpolate at " + GridKey.of(parameters) + " is missing");
      }
      if (weight == 0) {
        continue;
      }
      double c = record.getCentralValue();
      if (scaling.isLogValue()) {
        central += weight * log(c, key);
        upperEdge += weight * log(c + record.getUpperUncertainty(), key);
        lowerEdge += weight * log(c - record.getLowerUncertainty(), key);
      } else {
        central += weight * c;
        upperEdge += weight * record.getUpperUncertainty();
        lowerEdge += weight * record.getLowerUncertainty();
      }
    }

    double value;
    double upper;
    double lower;
    if (scaling.isLogValue()) {
      value = Math.exp(central);
      upper = Math.exp(upperEdge) - value;
      lower = value - Math.exp(lowerEdge);
    } else {
      value = central;
      upper = upperEdge;
      lower = lowerEdge;
    }
    return ResolvedRecord.interpolated(parameters, value, table.getUnit(),
        lower, upper, table.getAttributes());
  }

  /**
   * Finds the nearest known coordinates below and above {@code p}; both are
   * the same coordinate when {@code p} falls on one.
   */
  private void bracket(int axis, double p, double[] lo, double[] hi) {
    List<Double> values = grid.axisValues(axis);
    double rounded = grid.getParameters().get(axis).round(p);
    int at = Collections.binarySearch(values, rounded);
    if (at >= 0) {
      lo[axis] = values.get(at);
      hi[axis] = values.get(at);
      return;
    }
    int insertion = -at - 1;
    // checkRange guarantees 0 < insertion < size
    lo[axis] = values.get(Math.max(insertion - 1, 0));
    hi[axis] = values.get(Math.min(insertion, values.size() - 1));
  }

  private double scaleParameter(double x, int axis, AxisScaling scaling)
      throws InterpolationUnsupportedException {
    if (!scaling.isLogParameters()) {
      return x;
    }
    if (!(x > 0)) {
      throw new InterpolationUnsupportedException("Parameter '"
          + grid.getParameters().get(axis).getColumn()
          + "' = " + x + " cannot be placed on a logarithmic axis");
    }
    return Math.log(x);
  }

  private static double log(double y, GridKey key) throws InterpolationUnsupportedException {
    if (!(y > 0)) {
      throw new InterpolationUnsupportedException("Value " + y + " at " + key
          + " cannot be interpolated on a logarithmic scale");
    }
    return Math.log(y);
  }
}
