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

import org.xsecgrid.LoadException;
import org.xsecgrid.LoadOptions;
import org.xsecgrid.descriptor.Descriptor;
import org.xsecgrid.descriptor.DescriptorParser;
import org.xsecgrid.grid.GridBuilder;
import org.xsecgrid.grid.ParameterGrid;
import org.xsecgrid.reader.LoadReport;
import org.xsecgrid.reader.LoadedTable;
import org.xsecgrid.reader.TableLoader;
import org.xsecgrid.resolve.ResolvedTable;
import org.xsecgrid.resolve.ValueResolver;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point: loads a raw table with its descriptor into a
 * {@link DatasetHandle}.
 *
 * <p>Loading runs the whole pipeline once (parse, read, index, resolve) and
 * performs no I/O besides reading the two files. Failures are not retried.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * DatasetHandle handle = CrossSectionTables.load(Paths.get("13TeV.slepslep.csv"));
 * for (ValueSpecSummary spec : handle.valueSpecs()) {
 *   System.out.println(spec);
 * }
 * ResolvedRecord r = handle.query(0, new double[] {420}, InterpolationMethod.LINEAR);
 * }</pre>
 */
public final class CrossSectionTables {
  private static final Logger LOGGER = LoggerFactory.getLogger(CrossSectionTables.class);

  /** Extensions tried, in order, when looking for a table's descriptor. */
  public static final List<String> DESCRIPTOR_EXTENSIONS =
      ImmutableList.of(".info", ".json", ".yaml", ".yml");

  private CrossSectionTables() {
    // Utility class - no instances
  }

  /**
   * Loads a table whose descriptor sits next to it with the same stem, e.g.
   * {@code 13TeV.n2x1.csv} and {@code 13TeV.n2x1.info}.
   */
  public static DatasetHandle load(Path table) throws IOException, LoadException {
    return load(findDescriptor(table), table);
  }

  /**
   * Loads a table with the descriptor file given.
   */
  public static DatasetHandle load(Path descriptorFile, Path table)
      throws IOException, LoadException {
    return load(DescriptorParser.parse(descriptorFile), table, LoadOptions.defaults());
  }

  public static DatasetHandle load(Descriptor descriptor, Path table)
      throws IOException, LoadException {
    return load(descriptor, table, LoadOptions.defaults());
  }

  public static DatasetHandle load(Descriptor descriptor, Path table, LoadOptions options)
      throws IOException, LoadException {
    LoadedTable loaded = new TableLoader(descriptor, options).load(table);
    return build(descriptor, loaded, table.toString(), options);
  }

  /**
   * Loads a table from a reader. The reader is not closed.
   */
  public static DatasetHandle load(Descriptor descriptor, Reader table, String source,
      LoadOptions options) throws IOException, LoadException {
    LoadedTable loaded = new TableLoader(descriptor, options).load(table, source);
    return build(descriptor, loaded, source, options);
  }

  private static DatasetHandle build(Descriptor descriptor, LoadedTable loaded, String source,
      LoadOptions options) throws LoadException {
    ParameterGrid grid = new GridBuilder(descriptor.getParameters(),
        options.getDuplicateKeyPolicy()).build(loaded.getRows(), source);
    List<ResolvedTable> tables = new ValueResolver(descriptor).resolveAll(grid, loaded);
    LoadReport report = loaded.getReport().withKeysOverwritten(grid.getKeysOverwritten());
    LOGGER.info("Loaded {}: {} grid point(s), {} value(s)", source, grid.size(), tables.size());
    return new DatasetHandle(descriptor, grid, tables, report);
  }

  /**
   * Finds the descriptor of a table by replacing its extension with each of
   * {@link #DESCRIPTOR_EXTENSIONS}.
   *
   * @throws FileNotFoundException if none exists
   */
  public static Path findDescriptor(Path table) throws FileNotFoundException {
    String fileName = table.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    for (String extension : DESCRIPTOR_EXTENSIONS) {
      Path candidate = table.resolveSibling(stem + extension);
      if (!candidate.equals(table) && Files.isRegularFile(candidate)) {
        LOGGER.debug("Using descriptor {} for {}", candidate, table);
        return candidate;
      }
    }
    throw new FileNotFoundException("No descriptor found for " + table
        + "; tried " + stem + " with " + DESCRIPTOR_EXTENSIONS);
  }
}
