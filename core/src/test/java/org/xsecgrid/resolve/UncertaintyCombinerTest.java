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
package org.xsecgrid.resolve;

import org.xsecgrid.descriptor.UncertaintyComponent;
import org.xsecgrid.descriptor.UncertaintyType;
import org.xsecgrid.descriptor.ValueSpec;
import org.xsecgrid.reader.CellValue;
import org.xsecgrid.reader.Row;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for UncertaintyCombiner.
 */
@Tag("unit")
public class UncertaintyCombinerTest {

  private static final double EPS = 1e-9;

  /** Builds a row from alternating column names and numbers. */
  private static Row row(Object... namesAndValues) {
    ImmutableMap.Builder<String, Integer> index = ImmutableMap.builder();
    List<CellValue> cells = new ArrayList<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      index.put((String) namesAndValues[i], i / 2);
      Object v = namesAndValues[i + 1];
      cells.add(v instanceof String
          ? CellValue.string((String) v) : CellValue.number(((Number) v).doubleValue()));
    }
    return new Row(1, cells, index.build());
  }

  @Test void testRelativeComponentsAddInQuadrature() throws Exception {
    Row r = row("xsec", 100, "scale", 5, "pdf", 12);
    ValueSpec spec = ValueSpec.builder()
        .column("xsec")
        .unc(UncertaintyComponent.of("scale", UncertaintyType.RELATIVE))
        .unc(UncertaintyComponent.of("pdf", UncertaintyType.RELATIVE))
        .build();

    UncertaintyCombiner.Band band = UncertaintyCombiner.combine(r, r.get("xsec"), spec);

    assertEquals(12.99, band.getLower(), 0.015);
    assertEquals(12.99, band.getUpper(), 0.015);
    assertEquals(Math.sqrt(5 * 5 + 12 * 12), band.getUpper(), EPS);
  }

  @Test void testAsymmetricSides() throws Exception {
    Row r = row("xsec", 12.4, "lo_scale", 4, "lo_pdf", 3, "hi_scale", 5, "hi_pdf", 3);
    ValueSpec spec = ValueSpec.builder()
        .column("xsec")
        .uncMinus(UncertaintyComponent.of("lo_scale", UncertaintyType.RELATIVE))
        .uncMinus(UncertaintyComponent.of("lo_pdf", UncertaintyType.RELATIVE))
        .uncPlus(UncertaintyComponent.of("hi_scale", UncertaintyType.RELATIVE))
        .uncPlus(UncertaintyComponent.of("hi_pdf", UncertaintyType.RELATIVE))
        .build();

    UncertaintyCombiner.Band band = UncertaintyCombiner.combine(r, r.get("xsec"), spec);

    assertEquals(0.62, band.getLower(), 1e-9);
    assertEquals(0.723, band.getUpper(), 5e-4);
  }

  @Test void testNegativeRelativeIsMagnitude() throws Exception {
    Row r = row("xsec", 200, "d", -10);
    ValueSpec spec = ValueSpec.builder()
        .column("xsec")
        .uncMinus(UncertaintyComponent.of("d", UncertaintyType.RELATIVE))
        .build();

    UncertaintyCombiner.Band band = UncertaintyCombiner.combine(r, r.get("xsec"), spec);

    assertEquals(20, band.getLower(), EPS);
    assertEquals(0, band.getUpper(), EPS);
  }

  @Test void testAbsoluteComponent() throws Exception {
    Row r = row("xsec", 368, "unc", 9.5);
    ValueSpec spec = ValueSpec.builder()
        .column("xsec")
        .unc(UncertaintyComponent.of("unc", UncertaintyType.ABSOLUTE))
        .build();

    UncertaintyCombiner.Band band = UncertaintyCombiner.combine(r, r.get("xsec"), spec);

    assertEquals(9.5, band.getLower(), EPS);
    assertEquals(9.5, band.getUpper(), EPS);
  }

  @Test void testSignedPairIsRoutedBySign() throws Exception {
    Row r = row("xsec", 50, "mu1", -3.1, "mu2", 4.7);
    UncertaintyComponent pair = new UncertaintyComponent(
        ImmutableList.of("mu1", "mu2"), UncertaintyType.ABSOLUTE_SIGNED);
    ValueSpec spec = ValueSpec.builder().column("xsec").uncPlus(pair).build();

    UncertaintyCombiner.Band band = UncertaintyCombiner.combine(r, r.get("xsec"), spec);

    assertEquals(3.1, band.getLower(), EPS);
    assertEquals(4.7, band.getUpper(), EPS);
  }

  @Test void testSignedPairOrderDoesNotMatter() throws Exception {
    Row r = row("xsec", 50, "mu1", 4.7, "mu2", -3.1);
    UncertaintyComponent pair = new UncertaintyComponent(
        ImmutableList.of("mu1", "mu2"), UncertaintyType.ABSOLUTE_SIGNED);
    ValueSpec spec = ValueSpec.builder().column("xsec").uncMinus(pair).build();

    UncertaintyCombiner.Band band = UncertaintyCombiner.combine(r, r.get("xsec"), spec);

    assertEquals(3.1, band.getLower(), EPS);
    assertEquals(4.7, band.getUpper(), EPS);
  }

  @Test void testSignedPairSameSignAddsOnOneSide() throws Exception {
    Row r = row("xsec", 50, "mu1", 3, "mu2", 4);
    UncertaintyComponent pair = new UncertaintyComponent(
        ImmutableList.of("mu1", "mu2"), UncertaintyType.ABSOLUTE_SIGNED);
    ValueSpec spec = ValueSpec.builder().column("xsec").uncPlus(pair).build();

    UncertaintyCombiner.Band band = UncertaintyCombiner.combine(r, r.get("xsec"), spec);

    assertEquals(0, band.getLower(), EPS);
    assertEquals(5, band.getUpper(), EPS);
  }

  @Test void testSignedPairWithOneColumnFails() {
    Row r = row("xsec", 50, "mu1", -3.1);
    UncertaintyComponent single = UncertaintyComponent.of("mu1", UncertaintyType.ABSOLUTE_SIGNED);
    ValueSpec spec = ValueSpec.builder().column("xsec").uncPlus(single).build();

    UncertaintyConfigException e = assertThrows(UncertaintyConfigException.class,
        () -> UncertaintyCombiner.combine(r, r.get("xsec"), spec));
    assertEquals("xsec", e.getValueColumn());
  }

  @Test void testMissingUncertaintyColumnFails() {
    Row r = row("xsec", 50);
    ValueSpec spec = ValueSpec.builder()
        .column("xsec")
        .unc(UncertaintyComponent.of("unc", UncertaintyType.ABSOLUTE))
        .build();

    UncertaintyConfigException e = assertThrows(UncertaintyConfigException.class,
        () -> UncertaintyCombiner.combine(r, r.get("xsec"), spec));
    assertTrue(e.getMessage().contains("unc"));
  }

  @Test void testLabelUncertaintyColumnFails() {
    Row r = row("xsec", 50, "unc", "n/a");
    ValueSpec spec = ValueSpec.builder()
        .column("xsec")
        .unc(UncertaintyComponent.of("unc", UncertaintyType.ABSOLUTE))
        .build();

    assertThrows(UncertaintyConfigException.class,
        () -> UncertaintyCombiner.combine(r, r.get("xsec"), spec));
  }

  @Test void testNoUncertaintiesGiveZeroBand() throws Exception {
    Row r = row("channel", "gg");
    ValueSpec spec = ValueSpec.builder().column("channel").build();

    UncertaintyCombiner.Band band = UncertaintyCombiner.combine(r, r.get("channel"), spec);

    assertEquals(0d, band.getLower());
    assertEquals(0d, band.getUpper());
  }
}
