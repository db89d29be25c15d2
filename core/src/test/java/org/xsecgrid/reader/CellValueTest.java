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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CellValue parsing.
 */
@Tag("unit")
public class CellValueTest {

  @Test void testTryParse() {
    assertEquals(Double.valueOf(1.5), CellValue.tryParse(" 1.5 "));
    assertEquals(Double.valueOf(-2.3e-4), CellValue.tryParse("-2.3E-4"));
    assertTrue(Double.isNaN(CellValue.tryParse("NaN")));
    assertTrue(Double.isNaN(CellValue.tryParse("")));
    assertEquals(Double.valueOf(Double.POSITIVE_INFINITY), CellValue.tryParse("inf"));
    assertEquals(Double.valueOf(Double.NEGATIVE_INFINITY), CellValue.tryParse("-Infinity"));
    assertNull(CellValue.tryParse("gg"));
    assertNull(CellValue.tryParse("1d"));
    assertNull(CellValue.tryParse("1.2.3"));
  }

  @Test void testEquality() {
    assertEquals(CellValue.number(1.0), CellValue.number("1.00", 1.0));
    assertEquals(CellValue.string("gg"), CellValue.string("gg"));
    assertNotEquals(CellValue.string("1.0"), CellValue.number(1.0));
  }
}
