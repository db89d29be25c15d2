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

import org.xsecgrid.LoadOptions;
import org.xsecgrid.descriptor.Descriptor;
import org.xsecgrid.descriptor.ReaderOptions;
import org.xsecgrid.descriptor.UncertaintyComponent;
import org.xsecgrid.descriptor.UncertaintyType;
import org.xsecgrid.descriptor.ValueSpec;
import org.xsecgrid.grid.GridKey;
import org.xsecgrid.resolve.ResolvedRecord;
import org.xsecgrid.resolve.UncertaintyConfigException;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for QueryEngine.
 */
@Tag("unit")
public class QueryEngineTest {

  private static final double EPS = 1e-9;

  private static final String MASS_TABLE = "100 10.0 10 gg 1\n"
      + "200 20.0 10 qq 2\n"
      + "300 40.0 10 gg x\n";

  /** One parameter; values: xsec (10% band), channel (labels), broken band. */
  private static QueryEngine massEngine() throws Exception {
    Descriptor d = Descriptor.builder()
        .column("mass", "GeV")
        .column("xsec", "fb")
        .column("unc", "%")
        .column("channel", null)
        .column("flag", null)
        .readerOptions(ReaderOptions.builder().delimWhitespace(true).build())
        .parameter("mass", 1.0)
        .value(ValueSpec.builder()
            .column("xsec")
            .unc(UncertaintyComponent.of("unc", UncertaintyType.RELATIVE))
            .build())
        .value(ValueSpec.builder().column("channel").build())
        .value(ValueSpec.builder()
            .column("xsec")
            .unc(UncertaintyComponent.of("flag", UncertaintyType.ABSOLUTE))
            .build())
        .build();
    return CrossSectionTables.load(d, new StringReader(MASS_TABLE), "mass",
        LoadOptions.defaults()).getEngine();
  }

  /** Two parameters on a 2x2 grid, optionally without the (400, 400) corner. */
  private static QueryEngine planeEngine(boolean complete) throws Exception {
    Descriptor d = Descriptor.builder()
        .column("ms", "GeV")
        .column("mgl", "GeV")
        .column("xsec", "pb")
        .readerOptions(ReaderOptions.builder().delimWhitespace(true).build())
        .parameter("ms", 1.0)
        .parameter("mgl", 1.0)
        .value(ValueSpec.builder().column("xsec").build())
        .build();
    String table = "200 200 1.0\n"
        + "200 400 2.0\n"
        + "400 200 3.0\n"
        + (complete ? "400 400 4.0\n" : "400 600 5.0\n");
    return CrossSectionTables.load(d, new StringReader(table), "plane",
        LoadOptions.defaults()).getEngine();
  }

  @Test void testExactLookupIsIdempotent() throws Exception {
    QueryEngine engine = massEngine();

    ResolvedRecord first = engine.lookupExact(new double[] {200.3}, 0);
    ResolvedRecord second = engine.lookupExact(new double[] {200.3}, 0);

    assertEquals(first.getCentralValue(), second.getCentralValue());
    assertEquals(first.getLowerUncertainty(), second.getLowerUncertainty());
    assertEquals(first.getUpperUncertainty(), second.getUpperUncertainty());
    assertEquals(first.getAttributes(), second.getAttributes());
    assertEquals(GridKey.of(200), first.getGridKey());
    assertEquals(20.0, first.getCentralValue());
    assertEquals(2.0, first.getUpperUncertainty(), EPS);
  }

  @Test void testExactLookupMissingKey() throws Exception {
    QueryEngine engine = massEngine();

    GridKeyNotFoundException e = assertThrows(GridKeyNotFoundException.class,
        () -> engine.lookupExact(new double[] {250}, 0));
    assertEquals(GridKey.of(250), e.getKey());
    assertThrows(GridKeyNotFoundException.class,
        () -> engine.lookupInterpolated(new double[] {250}, 0, InterpolationMethod.EXACT));
  }

  @Test void testOutOfRange() throws Exception {
    QueryEngine engine = massEngine();

    OutOfRangeException below = assertThrows(OutOfRangeException.class,
        () -> engine.lookupInterpolated(new double[] {99}, 0, InterpolationMethod.LINEAR));
    assertEquals("mass", below.getParameter());
    assertEquals(100d, below.getMin());
    assertEquals(300d, below.getMax());
    assertThrows(OutOfRangeException.class,
        () -> engine.lookupInterpolated(new double[] {301}, 0, InterpolationMethod.NEAREST));
    assertThrows(OutOfRangeException.class,
        () -> engine.lookupInterpolated(new double[] {Double.NaN}, 0,
            InterpolationMethod.LINEAR));
  }

  @Test void testNonFiniteCoordinatesNeverMatchKeyZero() throws Exception {
    Descriptor d = Descriptor.builder()
        .column("mass", "GeV")
        .column("xsec", "fb")
        .readerOptions(ReaderOptions.builder().delimiter(',').build())
        .parameter("mass", 1.0)
        .value(ValueSpec.builder().column("xsec").build())
        .build();
    QueryEngine engine = CrossSectionTables.load(d, new StringReader("0,1.0\n100,2.0\n"),
        "zero", LoadOptions.defaults()).getEngine();
    double[] nan = {Double.NaN};

    assertEquals(1.0, engine.lookupExact(new double[] {0.3}, 0).getCentralValue());
    OutOfRangeException e = assertThrows(OutOfRangeException.class,
        () -> engine.lookupExact(nan, 0));
    assertEquals("mass", e.getParameter());
    assertEquals(0d, e.getMin());
    assertEquals(100d, e.getMax());
    assertThrows(OutOfRangeException.class,
        () -> engine.lookupInterpolated(nan, 0, InterpolationMethod.LINEAR));
    assertThrows(OutOfRangeException.class,
        () -> engine.lookupInterpolated(nan, 0, InterpolationMethod.NEAREST));
    assertThrows(OutOfRangeException.class,
        () -> engine.lookupInterpolated(new double[] {Double.POSITIVE_INFINITY}, 0,
            InterpolationMethod.EXACT));
  }

  @Test void testBoundariesAreInRange() throws Exception {
    QueryEngine engine = massEngine();

    assertEquals(10.0, engine.lookupInterpolated(new double[] {100}, 0,
        InterpolationMethod.LINEAR).getCentralValue());
    assertEquals(40.0, engine.lookupInterpolated(new double[] {300}, 0,
        InterpolationMethod.LINEAR).getCentralValue());
    assertEquals(40.0, engine.lookupInterpolated(new double[] {300}, 0,
        InterpolationMethod.NEAREST).getCentralValue());
  }

  @Test void testLinearInterpolation() throws Exception {
    ResolvedRecord r = massEngine().lookupInterpolated(new double[] {150}, 0,
        InterpolationMethod.LINEAR);

    assertTrue(r.isInterpolated());
    assertNull(r.getGridKey());
    assertEquals(15.0, r.getCentralValue(), EPS);
    assertEquals(1.5, r.getLowerUncertainty(), EPS);
    assertEquals(1.5, r.getUpperUncertainty(), EPS);
    assertEquals("fb", r.getUnit());
    assertEquals(150d, r.getParameters().get(0));
  }

  @Test void testNearest() throws Exception {
    QueryEngine engine = massEngine();

    assertEquals(20.0, engine.lookupInterpolated(new double[] {240}, 0,
        InterpolationMethod.NEAREST).getCentralValue());
    assertEquals(40.0, engine.lookupInterpolated(new double[] {260}, 0,
        InterpolationMethod.NEAREST).getCentralValue());
    // ties go to the lower grid point
    assertEquals(20.0, engine.lookupInterpolated(new double[] {250}, 0,
        InterpolationMethod.NEAREST).getCentralValue());
    ResolvedRecord label = engine.lookupInterpolated(new double[] {130}, 1,
        InterpolationMethod.NEAREST);
    assertFalse(label.isNumeric());
    assertEquals("gg", label.getValue().asString());
  }

  @Test void testLabelsCannotBeInterpolated() throws Exception {
    QueryEngine engine = massEngine();

    assertThrows(InterpolationUnsupportedException.class,
        () -> engine.lookupInterpolated(new double[] {150}, 1, InterpolationMethod.LINEAR));
    assertEquals("qq", engine.lookupInterpolated(new double[] {200}, 1,
        InterpolationMethod.LINEAR).getValue().asString());
  }

  @Test void testLogScaling() throws Exception {
    QueryEngine engine = massEngine();

    ResolvedRecord logValue = engine.lookupInterpolated(new double[] {250}, 0,
        InterpolationMethod.LINEAR, AxisScaling.LOG_VALUE);
    assertEquals(Math.sqrt(20.0 * 40.0), logValue.getCentralValue(), 1e-9);
    assertEquals(Math.sqrt(22.0 * 44.0) - Math.sqrt(800), logValue.getUpperUncertainty(), 1e-9);

    ResolvedRecord logParameters = engine.lookupInterpolated(new double[] {150}, 0,
        InterpolationMethod.LINEAR, AxisScaling.LOG_PARAMETERS);
    double t = Math.log(1.5) / Math.log(2);
    assertEquals(10 + 10 * t, logParameters.getCentralValue(), 1e-9);
  }

  @Test void testBilinearInterpolation() throws Exception {
    QueryEngine engine = planeEngine(true);

    assertEquals(2.5, engine.lookupInterpolated(new double[] {300, 300}, 0,
        InterpolationMethod.LINEAR).getCentralValue(), EPS);
    assertEquals(2.0, engine.lookupInterpolated(new double[] {300, 200}, 0,
        InterpolationMethod.LINEAR).getCentralValue(), EPS);
    assertEquals(2.25, engine.lookupInterpolated(new double[] {250, 350}, 0,
        InterpolationMethod.LINEAR).getCentralValue(), EPS);
  }

  @Test void testMissingCornerFailsInterpolation() throws Exception {
    QueryEngine engine = planeEngine(false);

    GridKeyNotFoundException e = assertThrows(GridKeyNotFoundException.class,
        () -> engine.lookupInterpolated(new double[] {300, 300}, 0,
            InterpolationMethod.LINEAR));
    assertEquals(GridKey.of(400, 400), e.getKey());
  }

  @Test void testFailedValueSurfacesOnQuery() throws Exception {
    QueryEngine engine = massEngine();

    assertThrows(UncertaintyConfigException.class,
        () -> engine.lookupExact(new double[] {100}, 2));
    // the other values still answer
    assertEquals(10.0, engine.lookupExact(new double[] {100}, 0).getCentralValue());
  }

  @Test void testListValueSpecs() throws Exception {
    List<ValueSpecSummary> specs = massEngine().listValueSpecs();

    assertEquals(3, specs.size());
    assertEquals("xsec", specs.get(0).getColumn());
    assertEquals("fb", specs.get(0).getUnit());
    assertTrue(specs.get(0).isAvailable());
    assertEquals("channel", specs.get(1).getColumn());
    assertFalse(specs.get(2).isAvailable());
  }

  @Test void testBadValueIndex() throws Exception {
    QueryEngine engine = massEngine();

    assertThrows(IllegalArgumentException.class,
        () -> engine.lookupExact(new double[] {100}, 3));
    assertThrows(IllegalArgumentException.class,
        () -> engine.lookupExact(new double[] {100, 200}, 0));
  }

  @Test void testInterpolationMethodFromString() {
    assertEquals(InterpolationMethod.LINEAR, InterpolationMethod.fromString("linear"));
    assertEquals(InterpolationMethod.NEAREST, InterpolationMethod.fromString(" Nearest "));
    assertThrows(IllegalArgumentException.class, () -> InterpolationMethod.fromString("cubic"));
  }
}
