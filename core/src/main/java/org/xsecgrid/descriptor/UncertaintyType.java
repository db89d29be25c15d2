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

import java.util.Locale;

/**
 * Ways an uncertainty column contributes to a band.
 *
 * <p>The tag is declared per component in the descriptor:
 * <pre>{@code
 * "unc+": [
 *   {"column": "unc+_scale", "type": "relative"},
 *   {"column": "unc+_pdf", "type": "absolute"},
 *   {"column": ["mu1", "mu2"], "type": "absolute,signed"}
 * ]
 * }</pre>
 *
 * @see UncertaintyComponent
 */
public enum UncertaintyType {
  /** Column holds a percentage of the central value. */
  RELATIVE("relative", 1),

  /** Column holds a shift in the unit of the central value. */
  ABSOLUTE("absolute", 1),

  /**
   * Two columns each holding a signed shift; negative shifts widen the lower
   * band and positive ones the upper band, whatever block declares them.
   */
  ABSOLUTE_SIGNED("absolute,signed", 2);

  private final String tag;
  private final int columnCount;

  UncertaintyType(String tag, int columnCount) {
    this.tag = tag;
    this.columnCount = columnCount;
  }

  /**
   * Returns the tag used in descriptor documents.
   */
  public String getTag() {
    return tag;
  }

  /**
   * Returns how many columns a component of this type references.
   */
  public int getColumnCount() {
    return columnCount;
  }

  /**
   * Parses a descriptor tag; blanks around the comma are tolerated.
   *
   * @param tag Tag such as {@code relative} or {@code absolute,signed}
   * @return Matching type, or null if the tag is not recognized
   */
  public static @Nullable UncertaintyType fromTag(@Nullable String tag) {
    if (tag == null) {
      return null;
    }
    String normalized = tag.replace(" ", "").toLowerCase(Locale.ROOT);
    for (UncertaintyType type : values()) {
      if (type.tag.equals(normalized)) {
        return type;
      }
    }
    return null;
  }

  @Override public String toString() {
    return tag;
  }
}
