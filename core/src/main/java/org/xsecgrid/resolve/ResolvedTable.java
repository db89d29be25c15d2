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
import org.xsecgrid.descriptor.ValueSpec;
import org.xsecgrid.grid.GridKey;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.Map;
import java.util.SortedMap;

/**
 * Resolved records of one value specification, keyed by grid point.
 *
 * <p>A value specification whose uncertainties could not be applied is kept
 * as an unavailable table carrying the failure, so that it still shows up in
 * listings.
 */
public final class ResolvedTable {
  private final int index;
  private final ValueSpec spec;
  private final String unit;
  private final ImmutableMap<String, AttributeValue> attributes;
  private final boolean numeric;
  private final ImmutableSortedMap<GridKey, ResolvedRecord> records;
  private final @Nullable UncertaintyConfigException failure;

  private ResolvedTable(int index, ValueSpec spec, String unit,
      Map<String, AttributeValue> attributes, boolean numeric,
      SortedMap<GridKey, ResolvedRecord> records, @Nullable UncertaintyConfigException failure) {
    this.index = index;
    this.spec = spec;
    this.unit = unit;
    this.attributes = ImmutableMap.copyOf(attributes);
    this.numeric = numeric;
    this.records = ImmutableSortedMap.copyOfSorted(records);
    this.failure = failure;
  }

  static ResolvedTable of(int index, ValueSpec spec, String unit,
      Map<String, AttributeValue> attributes, boolean numeric,
      SortedMap<GridKey, ResolvedRecord> records) {
    return new ResolvedTable(index, spec, unit, attributes, numeric, records, null);
  }

  static ResolvedTable failed(int index, ValueSpec spec, String unit,
      Map<String, AttributeValue> attributes, boolean numeric,
      UncertaintyConfigException failure) {
    return new ResolvedTable(index, spec, unit, attributes, numeric,
        ImmutableSortedMap.<GridKey, ResolvedRecord>of(), failure);
  }

  /**
   * Returns the position of the value specification in its descriptor.
   */
  public int getIndex() {
    return index;
  }

  public ValueSpec getSpec() {
    return spec;
  }

  public String getUnit() {
    return unit;
  }

  /**
   * Returns the merged attributes shared by all records.
   */
  public Map<String, AttributeValue> getAttributes() {
    return attributes;
  }

  /**
   * Returns whether the value column holds numbers; label columns can be
   * looked up but not interpolated.
   */
  public boolean isNumeric() {
    return numeric;
  }

  public boolean isAvailable() {
    return failure == null;
  }

  /**
   * Returns why the value could not be resolved, or null if it is available.
   */
  public @Nullable UncertaintyConfigException getFailure() {
    return failure;
  }

  public @Nullable ResolvedRecord get(GridKey key) {
    return records.get(key);
  }

  /**
   * Returns all records in ascending key order.
   */
  public Collection<ResolvedRecord> records() {
    return records.values();
  }

  public int size() {
    return records.size();
  }

  @Override public String toString() {
    return "ResolvedTable{index=" + index + ", column='" + spec.getColumn() + "'"
        + (failure != null ? ", failed" : ", records=" + records.size()) + "}";
  }
}
