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

/**
 * Coordinate transformation applied around {@link InterpolationMethod#LINEAR}.
 *
 * <p>Cross sections fall roughly exponentially with mass, so interpolating
 * the logarithm of the value is usually closer to the truth between grid
 * points than interpolating the value itself.
 */
public enum AxisScaling {
  /** Parameters and values as tabulated. */
  LINEAR(false, false),
  /** Logarithm of the value (and of the band edges). */
  LOG_VALUE(false, true),
  /** Logarithm of the parameters. */
  LOG_PARAMETERS(true, false),
  /** Logarithm of both. */
  LOG_LOG(true, true);

  private final boolean logParameters;
  private final boolean logValue;

  AxisScaling(boolean logParameters, boolean logValue) {
    this.logParameters = logParameters;
    this.logValue = logValue;
  }

  public boolean isLogParameters() {
    return logParameters;
  }

  public boolean isLogValue() {
    return logValue;
  }
}
