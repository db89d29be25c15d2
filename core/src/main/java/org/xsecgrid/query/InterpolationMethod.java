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

import java.util.Locale;

/**
 * How a query point is matched against the grid.
 */
public enum InterpolationMethod {
  /** The rounded point must be a grid key. */
  EXACT,
  /** Snap to the closest grid key. */
  NEAREST,
  /** Multilinear interpolation between the bracketing grid keys. */
  LINEAR;

  /**
   * Parses a method name, case-insensitively.
   *
   * @throws IllegalArgumentException for an unknown name
   */
  public static InterpolationMethod fromString(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Interpolation method is required");
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown interpolation method: " + name, e);
    }
  }
}
