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
package org.xsecgrid.reader;

import org.xsecgrid.LoadOptions;
import org.xsecgrid.descriptor.ColumnInfo;
import org.xsecgrid.descriptor.Descriptor;
import org.xsecgrid.descriptor.ReaderOptions;

import com.google.common.collect.ImmutableMap;
import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads a raw table under the reader options of its descriptor.
 *
 * <p>Processing of the file, line by line:
 * <ol>
 *   <li>the first {@code skiprows} physical lines are discarded
 *       unconditionally (headers, banners);</li>
 *   <li>text from the {@code comment} character onwards is dropped;</li>
 *   <li>blank lines are skipped;</li>
 *   <li>the line is split on runs of whitespace when
 *       {@code delim_whitespace} is set, otherwise on the delimiter with
 *       quoted fields honored;</li>
 *   <li>with {@code skipinitialspace}, leading whitespace of each field is
 *       trimmed.</li>
 * </ol>
 *
 * <p>A row must have exactly one field per column; the loader never pads or
 * truncates. Once all rows are read, each column is typed: NUMBER if every
 * field parses as a number, STRING otherwise (e.g. a process label).
 */
public class TableLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(TableLoader.class);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final Descriptor descriptor;
  private final LoadOptions options;
  private final ImmutableMap<String, Integer> columnIndex;

  public TableLoader(Descriptor descriptor) {
    this(descriptor, LoadOptions.defaults());
  }

  public TableLoader(Descriptor descriptor, LoadOptions options) {
    this.descriptor = descriptor;
    this.options = options;
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (ColumnInfo column : descriptor.getColumns()) {
      builder.put(column.getName(), column.getIndex());
    }
    this.columnIndex = builder.build();
  }

  /**
   * Loads a raw table file.
   *
   * @param path Raw table
   * @return Typed rows and load counters
   * @throws IOException if the file cannot be read
   * @throws TableParseException on a malformed row in strict mode
   */
  public LoadedTable load(Path path) throws IOException, TableParseException {
    LOGGER.debug("Reading table {} with {}", path, descriptor.getReaderOptions());
    try (Reader reader = Files.newBufferedReader(path, options.getCharset())) {
      return load(reader, path.toString());
    }
  }

  /**
   * Loads a raw table from a reader. The reader is not closed.
   *
   * @param reader Table content
   * @param source Name used in messages
   */
  public LoadedTable load(Reader reader, String source) throws IOException, TableParseException {
    ReaderOptions readerOptions = descriptor.getReaderOptions();
    int columnCount = columnIndex.size();
    CSVParser csvParser = readerOptions.isDelimWhitespace() ? null : csvParser(readerOptions);

    List<String[]> records = new ArrayList<String[]>();
    List<Integer> lineNumbers = new ArrayList<Integer>();
    List<String> rawLines = new ArrayList<String>();
    int skipped = 0;

    BufferedReader in = reader instanceof BufferedReader
        ? (BufferedReader) reader : new BufferedReader(reader);
    String line;
    int lineNumber = 0;
    while ((line = in.readLine()) != null) {
      lineNumber++;
      if (lineNumber <= readerOptions.getSkipRows()) {
        continue;
      }
      String content = stripComment(line, readerOptions.getComment());
      if (content.trim().isEmpty()) {
        continue;
      }

      String[] fields = null;
      String message;
      IOException cause = null;
      try {
        fields = split(content, csvParser, readerOptions);
        message = fields.length == columnCount
            ? null : "expected " + columnCount + " fields but found " + fields.length;
      } catch (IOException e) {
        // opencsv reports unbalanced quotes this way
        message = "malformed field: " + e.getMessage();
        cause = e;
      }
      if (message != null) {
        if (options.getParseMode() == ParseMode.STRICT) {
          throw new TableParseException(source, lineNumber, line, message, cause);
        }
        LOGGER.debug("Skipping malformed row {}:{}: {}", source, lineNumber, message);
        skipped++;
        continue;
      }
      records.add(fields);
      lineNumbers.add(lineNumber);
      rawLines.add(line);
    }

    if (skipped > 0) {
      LOGGER.warn("Skipped {} malformed row(s) in {}", skipped, source);
    }

    List<CellValue.Kind> kinds = inferKinds(records, columnCount);
    List<Row> rows = new ArrayList<Row>(records.size());
    for (int r = 0; r < records.size(); r++) {
      rows.add(toRow(records.get(r), lineNumbers.get(r), rawLines.get(r), kinds));
    }

    LOGGER.info("Loaded {} row(s) from {}", rows.size(), source);
    return new LoadedTable(rows, kinds, new LoadReport(source, rows.size(), skipped, 0));
  }

  private CSVParser csvParser(ReaderOptions readerOptions) {
    Character declared = readerOptions.getDelimiter();
    char separator = declared != null ? declared : options.getDefaultDelimiter();
    return new CSVParserBuilder()
        .withSeparator(separator)
        .withIgnoreLeadingWhiteSpace(readerOptions.isSkipInitialSpace())
        .build();
  }

  private static String stripComment(String line, @Nullable Character comment) {
    if (comment == null) {
      return line;
    }
    int at = line.indexOf(comment);
    return at < 0 ? line : line.substring(0, at);
  }

  private static String[] split(String content, @Nullable CSVParser csvParser,
      ReaderOptions readerOptions) throws IOException {
    if (csvParser == null) {
      return WHITESPACE.split(content.trim());
    }
    String[] fields = csvParser.parseLine(content);
    if (readerOptions.isSkipInitialSpace()) {
      for (int i = 0; i < fields.length; i++) {
        fields[i] = stripLeading(fields[i]);
      }
    }
    return fields;
  }

  private static String stripLeading(String field) {
    int i = 0;
    while (i < field.length() && Character.isWhitespace(field.charAt(i))) {
      i++;
    }
    return field.substring(i);
  }

  private List<CellValue.Kind> inferKinds(List<String[]> records, int columnCount) {
    List<CellValue.Kind> kinds = new ArrayList<CellValue.Kind>(columnCount);
    for (int c = 0; c < columnCount; c++) {
      CellValue.Kind kind = CellValue.Kind.NUMBER;
      for (String[] record : records) {
        if (CellValue.tryParse(record[c]) == null) {
          kind = CellValue.Kind.STRING;
          break;
        }
      }
      if (kind == CellValue.Kind.STRING) {
        LOGGER.debug("Column '{}' holds labels", descriptor.getColumns().get(c).getName());
      }
      kinds.add(kind);
    }
    return kinds;
  }

  private Row toRow(String[] record, int lineNumber, String rawLine,
      List<CellValue.Kind> kinds) {
    List<CellValue> cells = new ArrayList<CellValue>(record.length);
    for (int c = 0; c < record.length; c++) {
      String text = record[c];
      if (kinds.get(c) == CellValue.Kind.NUMBER) {
        Double value = CellValue.tryParse(text);
        cells.add(CellValue.number(text.trim(), value));
      } else {
        cells.add(CellValue.string(text));
      }
    }
    return new Row(lineNumber, rawLine, cells, columnIndex);
  }
}
