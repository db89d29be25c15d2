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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses descriptor documents into validated {@link Descriptor} instances.
 *
 * <p>A descriptor is a JSON (or YAML) object with the blocks
 * {@code document}, {@code attributes}, {@code columns},
 * {@code reader_options}, {@code parameters} and {@code values}:
 * <pre>{@code
 * {
 *   "document": {"title": "NLO+NLL degenerate higgsino", "calculator": "Resummino"},
 *   "attributes": {"processes": ["pp>n1n2", "pp>n1x1+"], "collider": "pp",
 *                  "ecm": "13TeV", "order": "NLO+NLL", "pdf_name": "PDF4LHC15"},
 *   "columns": [
 *     {"name": "m_hino", "unit": "GeV"},
 *     {"name": "xsec", "unit": "fb"},
 *     {"name": "unc-_scale", "unit": "%"}, {"name": "unc-_pdf", "unit": "%"},
 *     {"name": "unc+_scale", "unit": "%"}, {"name": "unc+_pdf", "unit": "%"}
 *   ],
 *   "reader_options": {"skiprows": 1, "delim_whitespace": true},
 *   "parameters": [{"column": "m_hino", "granularity": 1}],
 *   "values": [{
 *     "column": "xsec",
 *     "unc-": [{"column": "unc-_scale", "type": "relative"},
 *              {"column": "unc-_pdf", "type": "relative"}],
 *     "unc+": [{"column": "unc+_scale", "type": "relative"},
 *              {"column": "unc+_pdf", "type": "relative"}]
 *   }]
 * }
 * }</pre>
 *
 * <p>Every violation is reported as a {@link SchemaException} carrying the
 * path of the offending field. Unknown top-level blocks are ignored with a
 * warning; unknown {@code reader_options} keys are rejected.
 */
public final class DescriptorParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(DescriptorParser.class);

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
  private static final TypeReference<Map<String, Object>> MAP_TYPE =
      new TypeReference<Map<String, Object>>() { };

  private static final Set<String> TOP_LEVEL_KEYS = ImmutableSet.of(
      "document", "attributes", "columns", "reader_options", "parameters", "values");
  private static final Set<String> VALUE_KEYS = ImmutableSet.of(
      "column", "unc", "unc+", "unc-", "attributes");

  /**
   * Serialization of a descriptor document.
   */
  public enum Format {
    JSON,
    YAML;

    /**
     * Detects the format from a file name; YAML for {@code .yaml} and
     * {@code .yml}, JSON otherwise (including the {@code .info} convention).
     */
    public static Format fromFileName(String fileName) {
      String lower = fileName.toLowerCase(Locale.ROOT);
      return lower.endsWith(".yaml") || lower.endsWith(".yml") ? YAML : JSON;
    }
  }

  private DescriptorParser() {
    // Utility class - no instances
  }

  /**
   * Parses a descriptor file, detecting the format from its extension.
   *
   * @param path Descriptor file
   * @return Validated descriptor
   * @throws IOException if the file cannot be read
   * @throws SchemaException if the document is malformed
   */
  public static Descriptor parse(Path path) throws IOException, SchemaException {
    LOGGER.debug("Parsing descriptor {}", path);
    try (InputStream in = Files.newInputStream(path)) {
      return parse(in, Format.fromFileName(path.getFileName().toString()));
    }
  }

  /**
   * Parses a descriptor from a stream. The stream is not closed.
   */
  public static Descriptor parse(InputStream in, Format format)
      throws IOException, SchemaException {
    Map<String, Object> map;
    try {
      map = mapper(format).readValue(in, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new SchemaException("$", "not a valid " + format + " document: "
          + e.getOriginalMessage(), e);
    }
    return fromMap(map);
  }

  /**
   * Parses a descriptor held in a string.
   */
  public static Descriptor parse(String content, Format format) throws SchemaException {
    Map<String, Object> map;
    try {
      map = mapper(format).readValue(content, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new SchemaException("$", "not a valid " + format + " document: "
          + e.getOriginalMessage(), e);
    }
    return fromMap(map);
  }

  private static ObjectMapper mapper(Format format) {
    return format == Format.YAML ? YAML_MAPPER : JSON_MAPPER;
  }

  /**
   * Builds a descriptor from an already-deserialized document.
   *
   * @param map Document as nested maps and lists
   * @return Validated descriptor
   * @throws SchemaException if the document is malformed
   */
  public static Descriptor fromMap(@Nullable Map<String, Object> map) throws SchemaException {
    if (map == null) {
      throw new SchemaException("$", "descriptor document is empty");
    }
    for (String key : map.keySet()) {
      if (!TOP_LEVEL_KEYS.contains(key)) {
        LOGGER.warn("Ignoring unrecognized descriptor block '{}'", key);
      }
    }

    Descriptor.Builder builder = Descriptor.builder();

    Map<String, Object> document = asMap(map.get("document"), "document");
    if (document == null || document.isEmpty()) {
      LOGGER.warn("Descriptor has no document block");
    } else {
      builder.document(document);
    }

    builder.attributes(parseAttributes(map.get("attributes"), "attributes"));

    List<Object> columns = asList(map.get("columns"), "columns");
    if (columns == null) {
      throw new SchemaException("columns", "block is missing");
    }
    for (int i = 0; i < columns.size(); i++) {
      parseColumn(builder, columns.get(i), i);
    }

    builder.readerOptions(
        ReaderOptions.fromMap(asMap(map.get("reader_options"), "reader_options")));

    List<Object> parameters = asList(map.get("parameters"), "parameters");
    if (parameters != null) {
      for (int i = 0; i < parameters.size(); i++) {
        parseParameter(builder, parameters.get(i), "parameters[" + i + "]");
      }
    }

    List<Object> values = asList(map.get("values"), "values");
    if (values == null || values.isEmpty()) {
      LOGGER.warn("Descriptor declares no values");
    } else {
      for (int i = 0; i < values.size(); i++) {
        builder.value(parseValue(values.get(i), "values[" + i + "]"));
      }
    }

    Descriptor descriptor = builder.build();
    LOGGER.debug("Parsed {}", descriptor);
    return descriptor;
  }

  private static void parseColumn(Descriptor.Builder builder, Object obj, int index)
      throws SchemaException {
    String path = "columns[" + index + "]";
    Map<String, Object> column = asMap(obj, path);
    if (column == null) {
      throw new SchemaException(path, "column entry is null");
    }
    Object indexObj = column.get("index");
    if (indexObj != null && !Integer.valueOf(index).equals(indexObj)) {
      throw new SchemaException(path + ".index",
          "mismatched column index: position " + index + " declares " + indexObj);
    }
    for (String key : column.keySet()) {
      if (!"name".equals(key) && !"unit".equals(key) && !"index".equals(key)) {
        LOGGER.warn("Ignoring unknown key '{}' in {}", key, path);
      }
    }
    builder.column(asString(column.get("name"), path + ".name"),
        asString(column.get("unit"), path + ".unit"));
  }

  private static void parseParameter(Descriptor.Builder builder, Object obj, String path)
      throws SchemaException {
    Map<String, Object> parameter = asMap(obj, path);
    if (parameter == null) {
      throw new SchemaException(path, "parameter entry is null");
    }
    Object granularity = parameter.get("granularity");
    if (granularity != null && !(granularity instanceof Number)) {
      throw new SchemaException(path + ".granularity", "must be a number: " + granularity);
    }
    builder.parameter(asString(parameter.get("column"), path + ".column"),
        granularity == null ? null : ((Number) granularity).doubleValue());
  }

  private static ValueSpec parseValue(Object obj, String path) throws SchemaException {
    Map<String, Object> value = asMap(obj, path);
    if (value == null) {
      throw new SchemaException(path, "value entry is null");
    }
    for (String key : value.keySet()) {
      if (!VALUE_KEYS.contains(key)) {
        LOGGER.warn("Ignoring unknown key '{}' in {}", key, path);
      }
    }
    String column = asString(value.get("column"), path + ".column");
    if (column == null || column.isEmpty()) {
      throw new SchemaException(path + ".column", "column name is missing");
    }

    ValueSpec.Builder builder = ValueSpec.builder().column(column);
    boolean symmetric = value.containsKey("unc");
    if (symmetric && (value.containsKey("unc+") || value.containsKey("unc-"))) {
      throw new SchemaException(path + ".unc", "cannot be combined with unc+ or unc-");
    }
    if (symmetric) {
      for (UncertaintyComponent c : parseComponents(value.get("unc"), path + ".unc")) {
        builder.unc(c);
      }
    } else {
      for (UncertaintyComponent c : parseComponents(value.get("unc-"), path + ".unc-")) {
        builder.uncMinus(c);
      }
      for (UncertaintyComponent c : parseComponents(value.get("unc+"), path + ".unc+")) {
        builder.uncPlus(c);
      }
    }
    builder.attributes(parseAttributes(value.get("attributes"), path + ".attributes"));

    ValueSpec spec = builder.build();
    if (!spec.hasUncertainties()) {
      LOGGER.warn("Value {} ({}) lacks uncertainties", path, column);
    }
    return spec;
  }

  private static List<UncertaintyComponent> parseComponents(@Nullable Object obj, String path)
      throws SchemaException {
    List<Object> list = asList(obj, path);
    if (list == null) {
      return ImmutableList.of();
    }
    List<UncertaintyComponent> result = new ArrayList<UncertaintyComponent>();
    for (int i = 0; i < list.size(); i++) {
      String itemPath = path + "[" + i + "]";
      Map<String, Object> item = asMap(list.get(i), itemPath);
      if (item == null) {
        throw new SchemaException(itemPath, "uncertainty entry is null");
      }
      String tag = asString(item.get("type"), itemPath + ".type");
      UncertaintyType type = UncertaintyType.fromTag(tag);
      if (type == null) {
        throw new SchemaException(itemPath + ".type", "unknown uncertainty type: " + tag
            + "; expected relative, absolute or absolute,signed");
      }
      result.add(new UncertaintyComponent(
          parseColumnRefs(item.get("column"), itemPath + ".column"), type));
    }
    return result;
  }

  private static List<String> parseColumnRefs(@Nullable Object obj, String path)
      throws SchemaException {
    if (obj instanceof String) {
      return ImmutableList.of((String) obj);
    }
    if (obj instanceof List) {
      List<String> columns = new ArrayList<String>();
      for (Object item : (List<?>) obj) {
        if (!(item instanceof String)) {
          throw new SchemaException(path, "column reference must be a string: " + item);
        }
        columns.add((String) item);
      }
      return columns;
    }
    throw new SchemaException(path, "must be a column name or a list of column names: " + obj);
  }

  private static Map<String, AttributeValue> parseAttributes(@Nullable Object obj, String path)
      throws SchemaException {
    Map<String, Object> map = asMap(obj, path);
    Map<String, AttributeValue> result = new LinkedHashMap<String, AttributeValue>();
    if (map == null) {
      return result;
    }
    for (Map.Entry<String, Object> e : map.entrySet()) {
      Object v = e.getValue();
      String field = path + "." + e.getKey();
      if (v instanceof String) {
        result.put(e.getKey(), AttributeValue.of((String) v));
      } else if (v instanceof Number || v instanceof Boolean) {
        result.put(e.getKey(), AttributeValue.of(String.valueOf(v)));
      } else if (v instanceof List) {
        List<String> items = new ArrayList<String>();
        for (Object item : (List<?>) v) {
          if (!(item instanceof String)) {
            throw new SchemaException(field, "list items must be strings: " + item);
          }
          items.add((String) item);
        }
        result.put(e.getKey(), AttributeValue.of(items));
      } else {
        throw new SchemaException(field, "must be a string or a list of strings: " + v);
      }
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  private static @Nullable Map<String, Object> asMap(@Nullable Object obj, String path)
      throws SchemaException {
    if (obj == null) {
      return null;
    }
    if (!(obj instanceof Map)) {
      throw new SchemaException(path, "must be an object");
    }
    return (Map<String, Object>) obj;
  }

  @SuppressWarnings("unchecked")
  private static @Nullable List<Object> asList(@Nullable Object obj, String path)
      throws SchemaException {
    if (obj == null) {
      return null;
    }
    if (!(obj instanceof List)) {
      throw new SchemaException(path, "must be a list");
    }
    return (List<Object>) obj;
  }

  private static @Nullable String asString(@Nullable Object obj, String path)
      throws SchemaException {
    if (obj == null) {
      return null;
    }
    if (!(obj instanceof String)) {
      throw new SchemaException(path, "must be a string: " + obj);
    }
    return (String) obj;
  }
}
