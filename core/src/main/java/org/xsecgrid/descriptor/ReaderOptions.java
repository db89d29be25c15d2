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

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;
import java.util.Set;

/**
 * How the raw table of a descriptor is tokenized.
 *
 * <pre>{@code
 * "reader_options": {
 *   "skiprows": 4,
 *   "delim_whitespace": true
 * }
 * }</pre>
 *
 * <p>Recognized keys are {@code skiprows}, {@code delim_whitespace},
 * {@code skipinitialspace}, {@code sep} (alias {@code delimiter}) and
 * {@code comment}. Any other key is rejected so that a table written under a
 * new convention is not parsed silently wrong.
 */
public final class ReaderOptions {

  /** Keys accepted in the {@code reader_options} block. */
  public static final Set<String> RECOGNIZED_KEYS = ImmutableSet.of(
      "skiprows", "delim_whitespace", "skipinitialspace", "sep", "delimiter", "comment");

  private static final ReaderOptions DEFAULTS = builder().build();

  private final int skipRows;
  private final boolean delimWhitespace;
  private final boolean skipInitialSpace;
  private final @Nullable Character delimiter;
  private final @Nullable Character comment;

  private ReaderOptions(Builder builder) {
    this.skipRows = builder.skipRows;
    this.delimWhitespace = builder.delimWhitespace;
    this.skipInitialSpace = builder.skipInitialSpace;
    this.delimiter = builder.delimiter;
    this.comment = builder.comment;
  }

  public static ReaderOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Returns the number of physical lines discarded from the top of the file.
   */
  public int getSkipRows() {
    return skipRows;
  }

  public boolean isDelimWhitespace() {
    return delimWhitespace;
  }

  public boolean isSkipInitialSpace() {
    return skipInitialSpace;
  }

  /**
   * Returns the declared delimiter, or null to use the loader's default.
   */
  public @Nullable Character getDelimiter() {
    return delimiter;
  }

  public @Nullable Character getComment() {
    return comment;
  }

  /**
   * Creates ReaderOptions from the {@code reader_options} map of a descriptor.
   *
   * @param map Options map, may be null
   * @return ReaderOptions instance
   * @throws SchemaException on an unknown key or a mistyped value
   */
  public static ReaderOptions fromMap(@Nullable Map<String, Object> map)
      throws SchemaException {
    if (map == null || map.isEmpty()) {
      return DEFAULTS;
    }
    for (String key : map.keySet()) {
      if (!RECOGNIZED_KEYS.contains(key)) {
        throw new SchemaException("reader_options." + key,
            "unrecognized option; expected one of " + RECOGNIZED_KEYS);
      }
    }

    Builder builder = builder();

    Object skipRowsObj = map.get("skiprows");
    if (skipRowsObj != null) {
      if (!(skipRowsObj instanceof Integer) || (Integer) skipRowsObj < 0) {
        throw new SchemaException("reader_options.skiprows",
            "must be a non-negative integer: " + skipRowsObj);
      }
      builder.skipRows((Integer) skipRowsObj);
    }

    builder.delimWhitespace(booleanOption(map, "delim_whitespace"));
    builder.skipInitialSpace(booleanOption(map, "skipinitialspace"));

    if (map.containsKey("sep") && map.containsKey("delimiter")) {
      throw new SchemaException("reader_options.delimiter", "duplicates sep");
    }
    String delimiterKey = map.containsKey("sep") ? "sep" : "delimiter";
    Character delimiter = charOption(map, delimiterKey);
    if (delimiter != null) {
      if (builder.delimWhitespace) {
        throw new SchemaException("reader_options." + delimiterKey,
            "cannot be combined with delim_whitespace");
      }
      builder.delimiter(delimiter);
    }
    builder.comment(charOption(map, "comment"));

    return builder.build();
  }

  private static boolean booleanOption(Map<String, Object> map, String key)
      throws SchemaException {
    Object value = map.get(key);
    if (value == null) {
      return false;
    }
    if (!(value instanceof Boolean)) {
      throw new SchemaException("reader_options." + key, "must be a boolean: " + value);
    }
    return (Boolean) value;
  }

  private static @Nullable Character charOption(Map<String, Object> map, String key)
      throws SchemaException {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String) || ((String) value).length() != 1) {
      throw new SchemaException("reader_options." + key,
          "must be a single character: " + value);
    }
    return ((String) value).charAt(0);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "ReaderOptions{skiprows=" + skipRows
        + ", delim_whitespace=" + delimWhitespace
        + ", skipinitialspace=" + skipInitialSpace
        + (delimiter != null ? ", sep='" + delimiter + "'" : "")
        + (comment != null ? ", comment='" + comment + "'" : "")
        + "}";
  }

  /**
   * Builder for ReaderOptions.
   */
  public static class Builder {
    private int skipRows;
    private boolean delimWhitespace;
    private boolean skipInitialSpace;
    private @Nullable Character delimiter;
    private @Nullable Character comment;

    public Builder skipRows(int skipRows) {
      this.skipRows = skipRows;
      return this;
    }

    public Builder delimWhitespace(boolean delimWhitespace) {
      this.delimWhitespace = delimWhitespace;
      return this;
    }

    public Builder skipInitialSpace(boolean skipInitialSpace) {
      this.skipInitialSpace = skipInitialSpace;
      return this;
    }

    public Builder delimiter(@Nullable Character delimiter) {
      this.delimiter = delimiter;
      return this;
    }

    public Builder comment(@Nullable Character comment) {
      this.comment = comment;
      return this;
    }

    public ReaderOptions build() {
      if (skipRows < 0) {
        throw new IllegalArgumentException("skiprows must be non-negative: " + skipRows);
      }
      return new ReaderOptions(this);
    }
  }
}
