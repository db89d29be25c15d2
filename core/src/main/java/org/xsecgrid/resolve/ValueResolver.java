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
import org.xsecgrid.descriptor.Attributes;
import org.xsecgrid.descriptor.ColumnInfo;
import org.xsecgrid.descriptor.Descriptor;
import org.xsecgrid.descriptor.ValueSpec;
import org.xsecgrid.grid.GridKey;
import org.xsecgrid.grid.ParameterGrid;
import org.xsecgrid.reader.CellValue;
import org.xsecgrid.reader.LoadedTable;
import org.xsecgrid.reader.Row;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns grid rows into {@link ResolvedRecord}s, one table per value
 * specification of a descriptor.
 */
public class ValueResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(ValueResolver.class);

  private final Descriptor descriptor;

  public ValueResolver(Descriptor descriptor) {
    this.descriptor = descriptor;
  }

  /**
   * Resolves one row for one value specification.
   *
   * @param row Table row
   * @param key Grid key of the row
   * @param valueIndex Index of the value specification in the descriptor
   * @return Resolved record
   * @throws UncertaintyConfigException if the value's uncertainties cannot
   *     be applied to the row
   */
  public ResolvedRecord resolve(Row row, GridKey key, int valueIndex)
      throws UncertaintyConfigException {
    ValueSpec spec = descriptor.getValues().get(valueIndex);
    return resolve(row, key, spec, unitOf(spec), descriptor.attributesOf(valueIndex));
  }

  private static ResolvedRecord resolve(Row row, GridKey key, ValueSpec spec, String unit,
      Map<String, AttributeValue> attributes) throws UncertaintyConfigException {
    CellValue central = row.get(spec.getColumn());
    if (central == null) {
      throw new UncertaintyConfigException(spec.getColumn(),
          "value column is absent from row " + row.getLineNumber());
    }
    UncertaintyCombiner.Band band = UncertaintyCombiner.combine(row, central, spec);
    return ResolvedRecord.atGridPoint(key, central, unit,
        band.getLower(), band.getUpper(), attributes);
  }

  /**
   * Resolves every value specification over the whole grid.
   *
   * <p>A value specification that fails is returned as an unavailable
   * {@link ResolvedTable}; the others are unaffected.
   *
   * @param grid Parameter grid
   * @param table Loaded table, used for column kinds
   * @return One table per value specification, in declaration order
   */
  public List<ResolvedTable> resolveAll(ParameterGrid grid, LoadedTable table) {
    ImmutableList.Builder<ResolvedTable> result = ImmutableList.builder();
    List<ValueSpec> values = descriptor.getValues();
    for (int i = 0; i < values.size(); i++) {
      ValueSpec spec = values.get(i);
      String unit = unitOf(spec);
      Map<String, AttributeValue> attributes =
          Attributes.merge(descriptor.getAttributes(), spec.getAttributes());
      ColumnInfo column = descriptor.getColumn(spec.getColumn());
      boolean numeric = column == null
          || table.getColumnKind(column.getIndex()) == CellValue.Kind.NUMBER;

      TreeMap<GridKey, ResolvedRecord> records = new TreeMap<GridKey, ResolvedRecord>();
      try {
        for (Map.Entry<GridKey, Row> e : grid.entries()) {
          records.put(e.getKey(), resolve(e.getValue(), e.getKey(), spec, unit, attributes));
        }
        result.add(ResolvedTable.of(i, spec, unit, attributes, numeric, records));
        LOGGER.debug("Resolved value #{} ({}) at {} point(s)", i, spec.getColumn(),
            records.size());
      } catch (UncertaintyConfigException e) {
        LOGGER.error("Value #{} of {} is unavailable: {}", i, descriptor, e.getMessage());
        result.add(ResolvedTable.failed(i, spec, unit, attributes, numeric, e));
      }
    }
    return result.build();
  }

  private String unitOf(ValueSpec spec) {
    ColumnInfo column = descriptor.getColumn(spec.getColumn());
    return column == null ? "" : column.getUnit();
  }
}
