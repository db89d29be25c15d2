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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Descriptors bundled with the library on the classpath.
 *
 * <p>The catalog file {@code /xsecgrid/descriptors/catalog.json} maps a
 * dataset name to its descriptor resource in the same directory:
 * <pre>{@code
 * {
 *   "descriptors": {
 *     "13TeV.n2x1.hino.deg": "13TeV.n2x1.hino.deg.info",
 *     "13TeV.slepslep.ll": "13TeV.slepslep.ll.yaml"
 *   }
 * }
 * }</pre>
 *
 * <p>Only descriptors are bundled; the raw tables they describe are obtained
 * separately and loaded with
 * {@link org.xsecgrid.query.CrossSectionTables#load(Descriptor, java.nio.file.Path)}.
 */
public final class DescriptorCatalog {
  private static final Logger LOGGER = LoggerFactory.getLogger(DescriptorCatalog.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Classpath directory of the bundled descriptors. */
  public static final String BASE_PATH = "/xsecgrid/descriptors/";

  private final String basePath;
  private final ImmutableMap<String, String> entries;

  private DescriptorCatalog(String basePath, Map<String, String> entries) {
    this.basePath = basePath;
    this.entries = ImmutableMap.copyOf(entries);
  }

  /**
   * Reads the bundled catalog.
   *
   * @throws IOException if the catalog is missing or unreadable
   */
  public static DescriptorCatalog bundled() throws IOException {
    return fromClasspath(BASE_PATH);
  }

  /**
   * Reads a catalog from a classpath directory containing {@code catalog.json}.
   */
  public static DescriptorCatalog fromClasspath(String basePath) throws IOException {
    String base = basePath.endsWith("/") ? basePath : basePath + "/";
    String catalogPath = base + "catalog.json";
    try (InputStream is = findResource(catalogPath)) {
      if (is == null) {
        throw new FileNotFoundException("Descriptor catalog not found: " + catalogPath);
      }
      JsonNode descriptors = MAPPER.readTree(is).path("descriptors");
      ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
      Iterator<Map.Entry<String, JsonNode>> fields = descriptors.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        builder.put(field.getKey(), field.getValue().asText());
      }
      DescriptorCatalog catalog = new DescriptorCatalog(base, builder.build());
      LOGGER.debug("Read {} descriptor(s) from {}", catalog.entries.size(), catalogPath);
      return catalog;
    }
  }

  /**
   * Returns the dataset names in catalog order.
   */
  public Set<String> names() {
    return entries.keySet();
  }

  public boolean contains(String name) {
    return entries.containsKey(name);
  }

  /**
   * Parses the descriptor of a dataset.
   *
   * @param name Dataset name from {@link #names()}
   * @return Validated descriptor
   * @throws IllegalArgumentException if the name is not in the catalog
   * @throws IOException if the resource is missing
   * @throws SchemaException if the descriptor is malformed
   */
  public Descriptor load(String name) throws IOException, SchemaException {
    String fileName = entries.get(name);
    if (fileName == null) {
      throw new IllegalArgumentException("Unknown dataset '" + name + "'; known: " + names());
    }
    String resourcePath = basePath + fileName;
    try (InputStream is = findResource(resourcePath)) {
      if (is == null) {
        throw new FileNotFoundException("Descriptor resource not found: " + resourcePath);
      }
      return DescriptorParser.parse(is, DescriptorParser.Format.fromFileName(fileName));
    }
  }

  /**
   * Finds a resource through this class, then the thread context class
   * loader, then the system class loader.
   */
  private static @Nullable InputStream findResource(String resourcePath) {
    InputStream is = DescriptorCatalog.class.getResourceAsStream(resourcePath);
    if (is != null) {
      return is;
    }
    String cleanPath = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
    ClassLoader contextClassLoader = Thread.currentThread().getContextClassLoader();
    if (contextClassLoader != null) {
      is = contextClassLoader.getResourceAsStream(cleanPath);
      if (is != null) {
        LOGGER.debug("Found resource via context classloader: {}", resourcePath);
        return is;
      }
    }
    is = ClassLoader.getSystemResourceAsStream(cleanPath);
    if (is == null) {
      LOGGER.warn("Resource not found via any classloader: {}", resourcePath);
    }
    return is;
  }
}
