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
import org.xsecgrid.descriptor.Descriptor;
import org.xsecgrid.descriptor.ParameterInfo;
import org.xsecgrid.grid.ParameterGrid;
import org.xsecgrid.reader.LoadReport;
import org.xsecgrid.resolve.ResolvedRecord;
import org.xsecgrid.resolve.ResolvedTable;
import org.xsecgrid.resolve.UncertaintyConfigException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A loaded dataset: descriptor, grid and resolved values, ready for queries.
 *
 * <p>Handles are immutable and may be shared between threads; callers
 * typically load each dataset once and cache the handle.
 *
 * @see CrossSectionTables#load
 */
public final class DatasetHandle {
  private final Descriptor descriptor;
  private final ParameterGrid grid;
  private final QueryEngine engine;
  private final LoadReport report;

  DatasetHandle(Descriptor descriptor, ParameterGrid grid, List<ResolvedTable> tables,
      LoadReport report) {
    this.descriptor = descriptor;
    this.grid = grid;
    this.engine = new QueryEngine(grid, tables);
    this.report = report;
  }

  public Descriptor getDescriptor() {
    return descriptor;
  }

  public ParameterGrid getGrid() {
    return grid;
  }

  public LoadReport getLoadReport() {
    return report;
  }

  public QueryEngine getEngine() {
    return engine;
  }

  /**
   * Lists the value specifications of the dataset with their attributes.
   */
  public List<ValueSpecSummary> valueSpecs() {
    return engine.listValueSpecs();
  }

  /**
   * Returns the first available value whose attributes match all criteria.
   *
   * @return the value's index, or -1 if none matches
   */
  public int findValueSpec(Map<String, String> criteria) {
    for (ValueSpecSummary summary : valueSpecs()) {
      if (summary.isAvailable() && summary.matches(criteria)) {
        return summary.getIndex();
      }
    }
    return -1;
  }

  /**
   * Queries a value at a parameter point.
   *
   * @param valueIndex Index from {@link #valueSpecs()}
   * @param parameters Parameter values in descriptor order
   * @param method Matching method
   * @return Resolved record
   * @throws QueryException if the point cannot be answered
   * @throws UncertaintyConfigException if the value failed to resolve at load
   */
  public ResolvedRecord query(int valueIndex, double[] parameters, InterpolationMethod method)
      throws QueryException, UncertaintyConfigException {
    return engine.lookupInterpolated(parameters, valueIndex, method);
  }

  /**
   * Queries a value with a coordinate transformation for interpolation.
   */
  public ResolvedRecord query(int valueIndex, double[] parameters, InterpolationMethod method,
      AxisScaling scaling) throws QueryException, UncertaintyConfigException {
    return engine.lookupInterpolated(parameters, valueIndex, method, scaling);
  }

  /**
   * Queries a value with parameters bound by column name, e.g.
   * {@code {"m_gluino": 1500, "m_squark": 1200}}.
   *
   * @throws IllegalArgumentException if a parameter is missing or unknown
   */
  public ResolvedRecord query(int valueIndex, Map<String, Double> parameters,
      InterpolationMethod method) throws QueryException, UncertaintyConfigException {
    return query(valueIndex, bind(parameters), method);
  }

  private double[] bind(Map<String, Double> named) {
    List<ParameterInfo> parameters = descriptor.getParameters();
    Set<String> known = new HashSet<String>();
    double[] values = new double[parameters.size()];
    for (int i = 0; i < values.length; i++) {
      String column = parameters.get(i).getColumn();
      known.add(column);
      Double value = named.get(column);
      if (value == null) {
        throw new IllegalArgumentException("Missing parameter '" + column + "'");
      }
      values[i] = value;
    }
    for (String name : named.keySet()) {
      if (!known.contains(name)) {
        throw new IllegalArgumentException("Unknown parameter '" + name
            + "'; expected " + known);
      }
    }
    return values;
  }

  @Override public String toString() {
    return "DatasetHandle{" + descriptor + ", " + grid + "}";
  }
}
