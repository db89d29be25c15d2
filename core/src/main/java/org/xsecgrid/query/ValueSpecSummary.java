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

import org.xsecgrid.descriptor.AttributeValue;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Listing entry for one value specification of a dataset, used to choose
 * between e.g. LO, NLO and NLO+NLL variants before querying.
 */
public final class ValueSpecSummary {
  private final int index;
  private final String column;
  private final String unit;
  private final ImmutableMap<String, AttributeValue> attributes;
  private final @Nullable String failure;

  public ValueSpecSummary(int index, String column, String unit,
      Map<String, AttributeValue> attributes, @Nullable String failure) {
    this.index = index;
    this.column = column;
    this.unit = unit;
    this.attributes = ImmutableMap.copyOf(attributes);
    this.failure = failure;
  }

  /**
   * Returns the index to pass to queries.
   */
  public int getIndex() {
    return index;
  }

  public String getColumn() {
    return column;
  }

  public String getUnit() {
    return unit;
  }

  /**
   * Returns the merged attributes of the value.
   */
  public Map<String, AttributeValue> getAttributes() {
    return attributes;
  }

  public boolean isAvailable() {
    return failure == null;
  }

  /**
   * Returns why the value could not be resolved, or null.
   */
  public @Nullable String getFailure() {
    return failure;
  }

  /**
   * Returns whether every given attribute matches: equal strings, or the
   * string contained in a list attribute.
   */
  public boolean matches(Map<String, String> criteria) {
    for (Map.Entry<String, String> e : criteria.entrySet()) {
      AttributeValue value = attributes.get(e.getKey());
      if (value == null || !value.matches(e.getValue())) {
        return false;
      }
    }
    return true;
  }

  @Override public String toString() {
    return "#" + index + " " + column + (unit.isEmpty() ? "" : " [" + unit + "]")
        + " " + attributes + (failure != null ? " (unavailable: " + failure + ")" : "");
  }
}
