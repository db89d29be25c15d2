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
package org.xsecgrid;

import org.xsecgrid.grid.DuplicateKeyPolicy;
import org.xsecgrid.reader.ParseMode;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Engine options applied while a dataset is loaded.
 *
 * <p>These complement the per-table {@code reader_options} of a descriptor
 * with choices that belong to the caller rather than to the table:
 * <pre>{@code
 * load:
 *   duplicateKeys: last_wins   # or: error
 *   parseMode: strict          # or: lenient
 *   defaultDelimiter: ","
 *   charset: UTF-8
 * }</pre>
 */
public class LoadOptions {

  private static final LoadOptions DEFAULTS = builder().build();

  private final DuplicateKeyPolicy duplicateKeyPolicy;
  private final ParseMode parseMode;
  private final char defaultDelimiter;
  private final Charset charset;

  private LoadOptions(Builder builder) {
    this.duplicateKeyPolicy = builder.duplicateKeyPolicy;
    this.parseMode = builder.parseMode;
    this.defaultDelimiter = builder.defaultDelimiter;
    this.charset = builder.charset;
  }

  /**
   * Returns the defaults: last row wins on duplicate grid keys, strict
   * parsing, comma delimiter, UTF-8.
   */
  public static LoadOptions defaults() {
    return DEFAULTS;
  }

  public DuplicateKeyPolicy getDuplicateKeyPolicy() {
    return duplicateKeyPolicy;
  }

  public ParseMode getParseMode() {
    return parseMode;
  }

  /**
   * Returns the delimiter used when a descriptor declares neither
   * {@code delim_whitespace} nor {@code sep}.
   */
  public char getDefaultDelimiter() {
    return defaultDelimiter;
  }

  public Charset getCharset() {
    return charset;
  }

  /**
   * Creates LoadOptions from a YAML/JSON map.
   *
   * @param map Configuration map with keys duplicateKeys, parseMode,
   *     defaultDelimiter, charset; may be null
   * @return LoadOptions instance
   */
  public static LoadOptions fromMap(Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }

    Builder builder = builder();

    Object duplicatesObj = map.get("duplicateKeys");
    if (duplicatesObj instanceof String) {
      builder.duplicateKeyPolicy(
          DuplicateKeyPolicy.valueOf(((String) duplicatesObj).toUpperCase(Locale.ROOT)));
    }

    Object modeObj = map.get("parseMode");
    if (modeObj instanceof String) {
      builder.parseMode(ParseMode.valueOf(((String) modeObj).toUpperCase(Locale.ROOT)));
    }

    Object delimiterObj = map.get("defaultDelimiter");
    if (delimiterObj instanceof String) {
      String delimiter = (String) delimiterObj;
      if (delimiter.length() != 1) {
        throw new IllegalArgumentException(
            "defaultDelimiter must be a single character: " + delimiter);
      }
      builder.defaultDelimiter(delimiter.charAt(0));
    }

    Object charsetObj = map.get("charset");
    if (charsetObj instanceof String) {
      builder.charset(Charset.forName((String) charsetObj));
    }

    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    return "LoadOptions{duplicateKeys=" + duplicateKeyPolicy
        + ", parseMode=" + parseMode
        + ", defaultDelimiter='" + defaultDelimiter + "'"
        + ", charset=" + charset + "}";
  }

  /**
   * Builder for LoadOptions.
   */
  public static class Builder {
    private DuplicateKeyPolicy duplicateKeyPolicy = DuplicateKeyPolicy.LAST_WINS;
    private ParseMode parseMode = ParseMode.STRICT;
    private char defaultDelimiter = ',';
    private Charset charset = StandardCharsets.UTF_8;

    public Builder duplicateKeyPolicy(DuplicateKeyPolicy duplicateKeyPolicy) {
      this.duplicateKeyPolicy = duplicateKeyPolicy;
      return this;
    }

    public Builder parseMode(ParseMode parseMode) {
      this.parseMode = parseMode;
      return this;
    }

    public Builder defaultDelimiter(char defaultDelimiter) {
      this.defaultDelimiter = defaultDelimiter;
      return this;
    }

    public Builder charset(Charset charset) {
      this.charset = charset;
      return this;
    }

    public LoadOptions build() {
      if (duplicateKeyPolicy == null || parseMode == null || charset == null) {
        throw new IllegalArgumentException("LoadOptions fields must not be null");
      }
      return new LoadOptions(this);
    }
  }
}
