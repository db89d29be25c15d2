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

import java.io.FileNotFoundException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for DescriptorCatalog against the bundled descriptors.
 */
@Tag("unit")
public class DescriptorCatalogTest {

  @Test void testBundledNames() throws Exception {
    DescriptorCatalog catalog = DescriptorCatalog.bundled();
    assertEquals(4, catalog.names().size());
    assertTrue(catalog.contains("13TeV.n2x1.hino.deg"));
    assertTrue(catalog.contains("13TeV.slepslep.ll"));
    assertTrue(catalog.contains("8TeV.sq_gl.nllfast"));
    assertTrue(catalog.contains("13TeV.gg.scale_pair"));
    assertFalse(catalog.contains("14TeV.unknown"));
  }

  @Test void testEveryBundledDescriptorParses() throws Exception {
    DescriptorCatalog catalog = DescriptorCatalog.bundled();
    for (String name : catalog.names()) {
      Descriptor d = catalog.load(name);
      assertFalse(d.getColumns().isEmpty(), name);
      assertFalse(d.getParameters().isEmpty(), name);
      assertFalse(d.getValues().isEmpty(), name);
    }
  }

  @Test void testNllFastDescriptor() throws Exception {
    Descriptor d = DescriptorCatalog.bundled().load("8TeV.sq_gl.nllfast");
    assertEquals(13, d.getColumns().size());
    assertEquals(2, d.getParameters().size());
    assertEquals(3, d.getValues().size());
    assertEquals(Character.valueOf('#'), d.getReaderOptions().getComment());
    assertEquals("LO", d.attributesOf(2).get("order").asString());
    assertEquals("MSTW2008lo", d.attributesOf(2).get("pdf_name").asString());
    assertEquals("MSTW2008", d.attributesOf(1).get("pdf_name").asString());
  }

  @Test void testYamlDescriptorFromCatalog() throws Exception {
    Descriptor d = DescriptorCatalog.bundled().load("13TeV.slepslep.ll");
    assertTrue(d.getValues().get(0).isSymmetric());
    assertEquals("pp>slep_L slep_L*", d.getAttributes().get("processes").asString());
  }

  @Test void testSignedPairDescriptor() throws Exception {
    Descriptor d = DescriptorCatalog.bundled().load("13TeV.gg.scale_pair");
    UncertaintyComponent pair = d.getValues().get(0).getUncPlus().get(0);
    assertEquals(UncertaintyType.ABSOLUTE_SIGNED, pair.getType());
    assertEquals(2, pair.getColumns().size());
  }

  @Test void testUnknownDataset() throws Exception {
    DescriptorCatalog catalog = DescriptorCatalog.bundled();
    assertThrows(IllegalArgumentException.class, () -> catalog.load("nope"));
  }

  @Test void testMissingCatalog() {
    assertThrows(FileNotFoundException.class,
        () -> DescriptorCatalog.fromClasspath("/xsecgrid/no-such-dir"));
  }
}
