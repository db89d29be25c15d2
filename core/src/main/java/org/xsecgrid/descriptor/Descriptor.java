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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable annotation of a raw cross-section table.
 *
 * <p>Structure is given by {@link #getColumns()} and
 * {@link #getReaderOptions()}; semantics by {@link #getParameters()}, the
 * columns spanning the grid, and {@link #getValues()}, the quantities looked
 * up on it. {@link #getDocument()} is for display only and never changes how
 * a table is read or resolved.
 *
 * <p>Instances are validated on {@link Builder#build()}: column names are
 * unique and every column referenced by a parameter or a value exists.
 *
 * @see DescriptorParser
 */
public final class Descriptor {
  private final Map<String, Object> document;
  private final ImmutableMap<String, AttributeValue> attributes;
  private final ImmutableList<ColumnInfo> columns;
  private final ImmutableMap<String, ColumnInfo> columnsByName;
  private final ReaderOptions readerOptions;
  private final ImmutableList<ParameterInfo> parameters;
  private final ImmutableList<ValueSpec> values;

  private Descriptor(Builder builder, ImmutableMap<String, ColumnInfo> columnsByName) {
    this.document = Collections.unmodifiableMap(
        new LinkedHashMap<String, Object>(builder.document));
    this.attributes = ImmutableMap.copyOf(builder.attributes);
    this.columns = ImmutableList.copyOf(columnsByName.values());
    this.columnsByName = columnsByName;
    this.readerOptions = builder.readerOptions;
    this.parameters = ImmutableList.copyOf(builder.parameters);
    this.values = ImmutableList.copyOf(builder.values);
  }

  /**
   * Returns the informational document block (title, authors, calculator,
   * source, version).
   */
  public Map<String, Object> getDocument() {
    return document;
  }

  /**
   * Returns the base attributes shared by every value of the table.
   */
  public Map<String, AttributeValue> getAttributes() {
    return attributes;
  }

  public List<ColumnInfo> getColumns() {
    return columns;
  }

  /**
   * Returns the column with the given name, or null.
   */
  public @Nullable ColumnInfo getColumn(String name) {
    return columnsByName.get(name);
  }

  public List<String> getColumnNames() {
    return columnsByName.keySet().asList();
  }

  public ReaderOptions getReaderOptions() {
    return readerOptions;
  }

  public List<ParameterInfo> getParameters() {
    return parameters;
  }

  public List<ValueSpec> getValues() {
    return values;
  }

  /**
   * Returns the attributes of the value at {@code index}: the base attributes
   * with the value's own override merged on top.
   */
  public Map<String, AttributeValue> attributesOf(int index) {
    return Attributes.merge(attributes, values.get(index).getAttributes());
  }

  /**
   * Renders a human-readable summary of the descriptor.
   */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("[Document]\n");
    for (Map.Entry<String, Object> e : document.entrySet()) {
      sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
    }
    sb.append("[Attributes]\n");
    for (Map.Entry<String, AttributeValue> e : attributes.entrySet()) {
      sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
    }
    sb.append("[Parameters]\n");
    for (ParameterInfo p : parameters) {
      sb.append("  ").append(p).append('\n');
    }
    sb.append("[Values]\n");
    for (int i = 0; i < values.size(); i++) {
      ValueSpec v = values.get(i);
      ColumnInfo column = columnsByName.get(v.getColumn());
      sb.append("  #").append(i).append(' ').append(column);
      Map<String, AttributeValue> merged = attributesOf(i);
      if (!merged.isEmpty()) {
        sb.append(' ').append(merged);
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    Object title = document.get("title");
    return "Descriptor{" + (title != null ? "title='" + title + "', " : "")
        + "columns=" + columns.size()
        + ", parameters=" + parameters
        + ", values=" + values.size() + "}";
  }

  /**
   * Builder for Descriptor.
   */
  public static class Builder {
    private final Map<String, Object> document = new LinkedHashMap<String, Object>();
    private final Map<String, AttributeValue> attributes =
        new LinkedHashMap<String, AttributeValue>();
    private final List<ColumnInfo> columns = new ArrayList<ColumnInfo>();
    private ReaderOptions readerOptions = ReaderOptions.defaults();
    private final List<ParameterInfo> parameters = new ArrayList<ParameterInfo>();
    private final List<ValueSpec> values = new ArrayList<ValueSpec>();

    public Builder document(Map<String, Object> document) {
      this.document.putAll(document);
      return this;
    }

    public Builder attribute(String key, AttributeValue value) {
      this.attributes.put(key, value);
      return this;
    }

    public Builder attributes(Map<String, AttributeValue> attributes) {
      this.attributes.putAll(attributes);
      return this;
    }

    /**
     * Appends a column; its index is its position.
     */
    public Builder column(String name, String unit) {
      this.columns.add(new ColumnInfo(columns.size(), name, unit));
      return this;
    }

    public Builder readerOptions(ReaderOptions readerOptions) {
      this.readerOptions = readerOptions;
      return this;
    }

    public Builder parameter(String column, @Nullable Double granularity) {
      this.parameters.add(new ParameterInfo(column, granularity));
      return this;
    }

    public Builder value(ValueSpec value) {
      this.values.add(value);
      return this;
    }

    /**
     * Validates cross references and builds the descriptor.
     *
     * @throws SchemaException naming the first offending field
     */
    public Descriptor build() throws SchemaException {
      if (columns.isEmpty()) {
        throw new SchemaException("columns", "at least one column is required");
      }
      Map<String, ColumnInfo> byName = new LinkedHashMap<String, ColumnInfo>();
      for (ColumnInfo column : columns) {
        String field = "columns[" + column.getIndex() + "].name";
        if (column.getName() == null || column.getName().isEmpty()) {
          throw new SchemaException(field, "column name is missing");
        }
        if (byName.put(column.getName(), column) != null) {
          throw new SchemaException(field, "duplicated column name: " + column.getName());
        }
      }

      if (parameters.isEmpty()) {
        throw new SchemaException("parameters", "at least one parameter is required");
      }
      for (int i = 0; i < parameters.size(); i++) {
        ParameterInfo p = parameters.get(i);
        requireColumn(byName, "parameters[" + i + "].column", p.getColumn());
        Double g = p.getGranularity();
        if (g != null && !(g > 0 && !g.isInfinite())) {
          throw new SchemaException("parameters[" + i + "].granularity",
              "must be strictly positive: " + g);
        }
      }

      for (int i = 0; i < values.size(); i++) {
        validateValue(byName, "values[" + i + "]", values.get(i));
      }
      return new Descriptor(this, ImmutableMap.copyOf(byName));
    }

    private static void validateValue(Map<String, ColumnInfo> byName, String path,
        ValueSpec value) throws SchemaException {
      requireColumn(byName, path + ".column", value.getColumn());
      if (value.isSymmetric()) {
        validateComponents(byName, path + ".unc", value.getUncPlus());
      } else {
        validateComponents(byName, path + ".unc-", value.getUncMinus());
        validateComponents(byName, path + ".unc+", value.getUncPlus());
      }
    }

    private static void validateComponents(Map<String, ColumnInfo> byName, String path,
        List<UncertaintyComponent> components) throws SchemaException {
      for (int j = 0; j < components.size(); j++) {
        UncertaintyComponent c = components.get(j);
        String field = path + "[" + j + "].column";
        if (c.getColumns().size() != c.getType().getColumnCount()) {
          throw new SchemaException(field, "type " + c.getType() + " needs "
              + c.getType().getColumnCount() + " column(s) but got " + c.getColumns());
        }
        for (String column : c.getColumns()) {
          requireColumn(byName, field, column);
        }
      }
    }

    private static void requireColumn(Map<String, ColumnInfo> byName, String field,
        @Nullable String column) throws SchemaException {
      if (column == null || column.isEmpty()) {
        throw new SchemaException(field, "column name is missing");
      }
      if (!byName.containsKey(column)) {
        throw new SchemaException(field, "unknown column name: " + column);
      }
    }
  }
}
