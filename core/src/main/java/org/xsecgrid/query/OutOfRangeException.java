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

/**
 * Indicates that a query point lies outside the extent of the known grid
 * on some axis. The engine does not extrapolate.
 */
public class OutOfRangeException extends QueryException {
  private final String parameter;
  private final double value;
  private final double min;
  private final double max;

  public OutOfRangeException(String parameter, double value, double min, double max) {
    super("Parameter '" + parameter + "' = " + value
        + " is outside the grid range [" + min + ", " + max + "]");
    this.parameter = parameter;
    this.value = value;
    this.min = min;
    this.max = max;
  }

  public String getParameter() {
    return parameter;
  }

  public double getValue() {
    return value;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }
}
