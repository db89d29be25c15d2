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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for LoadOptions.
 */
@Tag("unit")
public class LoadOptionsTest {

  @Test void testDefaults() {
    LoadOptions options = LoadOptions.defaults();
    assertEquals(DuplicateKeyPolicy.LAST_WINS, options.getDuplicateKeyPolicy());
    assertEquals(ParseMode.STRICT, options.getParseMode());
    assertEquals(',', options.getDefaultDelimiter());
    assertEquals(StandardCharsets.UTF_8, options.getCharset());
  }

  @Test void testFromMap() {
    Map<String, Object> map = new HashMap<>();
    map.put("duplicateKeys", "error");
    map.put("parseMode", "lenient");
    map.put("defaultDelimiter", ";");
    map.put("charset", "ISO-8859-1");

    LoadOptions options = LoadOptions.fromMap(map);

    assertEquals(DuplicateKeyPolicy.ERROR, options.getDuplicateKeyPolicy());
    assertEquals(ParseMode.LENIENT, options.getParseMode());
    assertEquals(';', options.getDefaultDelimiter());
    assertEquals(StandardCharsets.ISO_8859_1, options.getCharset());
  }

  @Test void testFromNullMap() {
    assertEquals(ParseMode.STRICT, LoadOptions.fromMap(null).getParseMode());
  }

  @Test void testInvalidValues() {
    Map<String, Object> map = new HashMap<>();
    map.put("defaultDelimiter", "::");
    assertThrows(IllegalArgumentException.class, () -> LoadOptions.fromMap(map));

    Map<String, Object> policy = new HashMap<>();
    policy.put("duplicateKeys", "first_wins");
    assertThrows(IllegalArgumentException.class, () -> LoadOptions.fromMap(policy));
  }
}
