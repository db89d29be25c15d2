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
package org.xsecgrid.resolve;

import org.xsecgrid.descriptor.AttributeValue;
import org.xsecgrid.grid.GridKey;
import org.xsecgrid.reader.CellValue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A value with its combined uncertainty band at one parameter point,
 * annotated with the attributes of its value specification.
 *
 * <p>Records read from the grid carry their {@link GridKey}; interpolated
 * records carry only the queried parameters.
 */
public final class ResolvedRecord {
  private final @Nullable GridKey gridKey;
  private final ImmutableList<Double> parameters;
  private final CellValue value;
  private final String unit;
  private final double lowerUncertainty;
  private final double upperUncertainty;
  private final ImmutableMap<String, AttributeValue> attributes;
  private final boolean interpolated;

  private ResolvedRecord(@Nullable GridKey gridKey, List<Double> parameters, CellValue value,
      String unit, double lowerUncertainty, double upperUncertainty,
      Map<String, AttributeValue> attributes, boolean interpolated) {
    this.gridKey = gridKey;
    this.parameters = ImmutableList.copyOf(parameters);
    this.value = value;
    this.unit = unit;
    this.lowerUncertainty = lowerUncertainty;
    this.upperUncertainty = upperUncertainty;
    this.attributes = ImmutableMap.copyOf(attributes);
    this.interpolated = interpolated;
  }

  /**
   * Creates a record for a grid point.
   */
  public static ResolvedRecord atGridPoint(GridKey gridKey, CellValue value, String unit,
      double lowerUncertainty, double upperUncertainty,
      Map<String, AttributeValue> attributes) {
    return new ResolvedRecord(gridKey, gridKey.toList(), value, unit,
        lowerUncertainty, upperUncertainty, attributes, false);
  }

  /**
   * Creates a record computed between grid points.
   */
  public static ResolvedRecord interpolated(double[] parameters, double value, String unit,
      double lowerUncertainty, double upperUncertainty,
      Map<String, AttributeValue> attributes) {
    ImmutableList.Builder<Double> params = ImmutableList.builder();
    for (double p : parameters) {
      params.add(p);
    }
    return new ResolvedRecord(null, params.build(), CellValue.number(value), unit,
        lowerUncertainty, upperUncertainty, attributes, true);
  }

  /**
   * Returns the grid key, or null for an interpolated record.
   */
  public @Nullable GridKey getGridKey() {
    return gridKey;
  }

  /**
   * Returns the parameter point: the grid key's coordinates, or the queried
   * values of an interpolated record.
   */
  public List<Double> getParameters() {
    return parameters;
  }

  /**
   * Returns the value as read, which is a label for a non-numeric column.
   */
  public CellValue getValue() {
    return value;
  }

  public boolean isNumeric() {
    return value.isNumber();
  }

  /**
   * Returns the central value.
   *
   * @throws IllegalStateException if the value column holds labels
   */
  public double getCentralValue() {
    return value.asDouble();
  }

  /**
   * Returns the unit of the value column, empty if it has none.
   */
  public String getUnit() {
    return unit;
  }

  /**
   * Returns the magnitude of the lower band (non-negative).
   */
  public double getLowerUncertainty() {
    return lowerUncertainty;
  }

  /**
   * Returns the magnitude of the upper band (non-negative).
   */
  public double getUpperUncertainty() {
    return upperUncertainty;
  }

  public Map<String, AttributeValue> getAttributes() {
    return attributes;
  }

  /**
   * Returns the attribute with the given key, or null.
   */
  public @Nullable AttributeValue getAttribute(String key) {
    return attributes.get(key);
  }

  public boolean isInterpolated() {
    return interpolated;
  }

  /**
   * Returns the value shifted by a number of standard deviations: upwards by
   * the upper band for a positive level, downwards by the lower band for a
   * negative level.
   *
   * @param sigmaLevel e.g. {@code 1} for central + 1 sigma, {@code -2} for
   *     central - 2 sigma
   */
  public double valueAt(double sigmaLevel) {
    double central = getCentralValue();
    if (sigmaLevel > 0) {
      return central + sigmaLevel * upperUncertainty;
    }
    if (sigmaLevel < 0) {
      return central + sigmaLevel * lowerUncertainty;
    }
    return central;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(parameters).append(": ").append(value);
    if (lowerUncertainty != 0 || upperUncertainty != 0) {
      sb.append(" -").append(lowerUncertainty).append(" +").append(upperUncertainty);
    }
    if (!unit.isEmpty()) {
      sb.append(' ').append(unit);
    }
    if (interpolated) {
      sb.append(" (interpolated)");
    }
    return sb.toString();
  }
}
