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

import org.xsecgrid.descriptor.UncertaintyComponent;
import org.xsecgrid.descriptor.UncertaintyType;
import org.xsecgrid.descriptor.ValueSpec;
import org.xsecgrid.reader.CellValue;
import org.xsecgrid.reader.Row;

import java.util.List;

/**
 * Combines the uncertainty components of a value into one lower and one
 * upper band.
 *
 * <p>Each component contributes a magnitude according to its
 * {@link UncertaintyType}:
 * <ul>
 *   <li>{@code relative}: {@code |c| / 100 * |central|}</li>
 *   <li>{@code absolute}: {@code |c|}</li>
 *   <li>{@code absolute,signed}: each of the two shifts goes to the lower
 *       band if negative and to the upper band if positive, whichever block
 *       declared the pair; a zero shift contributes nothing</li>
 * </ul>
 * Independent sources add in quadrature per side. A symmetric {@code unc}
 * block feeds both sides; a signed pair in it is still routed only once.
 */
public final class UncertaintyCombiner {

  private UncertaintyCombiner() {
    // Utility class - no instances
  }

  /**
   * Lower and upper band magnitudes, both non-negative.
   */
  public static final class Band {
    private final double lower;
    private final double upper;

    public Band(double lower, double upper) {
      this.lower = lower;
      this.upper = upper;
    }

    public double getLower() {
      return lower;
    }

    public double getUpper() {
      return upper;
    }

    @Override public String toString() {
      return "-" + lower + "/+" + upper;
    }
  }

  private enum Side {
    LOWER(true, false),
    UPPER(false, true),
    BOTH(true, true);

    final boolean lower;
    final boolean upper;

    Side(boolean lower, boolean upper) {
      this.lower = lower;
      this.upper = upper;
    }
  }

  /** Sums of squares per side. */
  private static final class Accumulator {
    double lowerSquares;
    double upperSquares;

    void add(Side side, double magnitude) {
      double square = magnitude * magnitude;
      if (side.lower) {
        lowerSquares += square;
      }
      if (side.upper) {
        upperSquares += square;
      }
    }

    Band toBand() {
      return new Band(Math.sqrt(lowerSquares), Math.sqrt(upperSquares));
    }
  }

  /**
   * Computes the band of a value on one row.
   *
   * @param row Table row
   * @param central Central value of the row
   * @param spec Value specification declaring the components
   * @return Combined band
   * @throws UncertaintyConfigException if a component cannot be applied
   */
  public static Band combine(Row row, CellValue central, ValueSpec spec)
      throws UncertaintyConfigException {
    if (!spec.hasUncertainties()) {
      return new Band(0, 0);
    }
    if (!central.isNumber()) {
      throw new UncertaintyConfigException(spec.getColumn(),
          "central value '" + central + "' is not a number but uncertainties are declared");
    }
    double value = central.asDouble();
    Accumulator acc = new Accumulator();
    if (spec.isSymmetric()) {
      addAll(acc, Side.BOTH, spec.getUncPlus(), row, value, spec);
    } else {
      addAll(acc, Side.LOWER, spec.getUncMinus(), row, value, spec);
      addAll(acc, Side.UPPER, spec.getUncPlus(), row, value, spec);
    }
    return acc.toBand();
  }

  private static void addAll(Accumulator acc, Side side, List<UncertaintyComponent> components,
      Row row, double central, ValueSpec spec) throws UncertaintyConfigException {
    for (UncertaintyComponent component : components) {
      switch (component.getType()) {
        case RELATIVE:
          acc.add(side, relative(single(component, row, spec), central));
          break;
        case ABSOLUTE:
          acc.add(side, absolute(single(component, row, spec)));
          break;
        case ABSOLUTE_SIGNED:
          signed(acc, component, row, spec);
          break;
        default:
          throw new AssertionError(component.getType());
      }
    }
  }

  static double relative(double percent, double central) {
    return Math.abs(percent) / 100d * Math.abs(central);
  }

  static double absolute(double shift) {
    return Math.abs(shift);
  }

  private static void signed(Accumulator acc, UncertaintyComponent component, Row row,
      ValueSpec spec) throws UncertaintyConfigException {
    List<String> columns = component.getColumns();
    if (columns.size() != 2) {
      throw new UncertaintyConfigException(spec.getColumn(),
          "absolute,signed needs exactly two columns but got " + columns);
    }
    for (String column : columns) {
      double shift = number(row, column, spec);
      if (shift < 0) {
        acc.add(Side.LOWER, -shift);
      } else if (shift > 0) {
        acc.add(Side.UPPER, shift);
      }
    }
  }

  private static double single(UncertaintyComponent component, Row row, ValueSpec spec)
      throws UncertaintyConfigException {
    if (component.getColumns().size() != 1) {
      throw new UncertaintyConfigException(spec.getColumn(), component.getType()
          + " needs exactly one column but got " + component.getColumns());
    }
    return number(row, component.getColumns().get(0), spec);
  }

  private static double number(Row row, String column, ValueSpec spec)
      throws UncertaintyConfigException {
    CellValue cell = row.get(column);
    if (cell == null) {
      throw new UncertaintyConfigException(spec.getColumn(),
          "uncertainty column '" + column + "' is absent from row " + row.getLineNumber());
    }
    if (!cell.isNumber()) {
      throw new UncertaintyConfigException(spec.getColumn(),
          "uncertainty column '" + column + "' holds a non-numeric value: " + cell);
    }
    return cell.asDouble();
  }
}
