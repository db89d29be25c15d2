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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ReaderOptions.
 */
@Tag("unit")
public class ReaderOptionsTest {

  @Test void testDefaults() throws Exception {
    ReaderOptions options = ReaderOptions.fromMap(null);
    assertSame(ReaderOptions.defaults(), options);
    assertEquals(0, options.getSkipRows());
    assertFalse(options.isDelimWhitespace());
    assertFalse(options.isSkipInitialSpace());
    assertNull(options.getDelimiter());
    assertNull(options.getComment());
  }

  @Test void testFromMap() throws Exception {
    Map<String, Object> map = new HashMap<>();
    map.put("skiprows", 3);
    map.put("delimiter", ";");
    map.put("skipinitialspace", true);
    map.put("comment", "#");

    ReaderOptions options = ReaderOptions.fromMap(map);
    assertEquals(3, options.getSkipRows());
    assertEquals(Character.valueOf(';'), options.getDelimiter());
    assertTrue(options.isSkipInitialSpace());
    assertEquals(Character.valueOf('#'), options.getComment());
  }

  @Test void testUnknownKey() {
    Map<String, Object> map = new HashMap<>();
    map.put("header", 0);
    SchemaException e = assertThrows(SchemaException.class, () -> ReaderOptions.fromMap(map));
    assertEquals("reader_options.header", e.getField());
  }

  @Test void testNegativeSkipRows() {
    Map<String, Object> map = new HashMap<>();
    map.put("skiprows", -1);
    SchemaException e = assertThrows(SchemaException.class, () -> ReaderOptions.fromMap(map));
    assertEquals("reader_options.skiprows", e.getField());
  }

  @Test void testFlagMustBeBoolean() {
    Map<String, Object> map = new HashMap<>();
    map.put("delim_whitespace", "yes");
    SchemaException e = assertThrows(SchemaException.class, () -> ReaderOptions.fromMap(map));
    assertEquals("reader_options.delim_whitespace", e.getField());
  }

  @Test void testSepAndDelimiterConflict() {
    Map<String, Object> map = new HashMap<>();
    map.put("sep", ",");
    map.put("delimiter", ";");
    assertThrows(SchemaException.class, () -> ReaderOptions.fromMap(map));
  }

  @Test void testDelimiterWithWhitespaceSplitting() {
    Map<String, Object> map = new HashMap<>();
    map.put("sep", ",");
    map.put("delim_whitespace", true);
    SchemaException e = assertThrows(SchemaException.class, () -> ReaderOptions.fromMap(map));
    assertEquals("reader_options.sep", e.getField());
  }

  @Test void testMultiCharacterSeparator() {
    Map<String, Object> map = new HashMap<>();
    map.put("sep", "\\s+");
    assertThrows(SchemaException.class, () -> ReaderOptions.fromMap(map));
  }
}
