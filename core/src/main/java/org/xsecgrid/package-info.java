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
/**
 * Descriptor-driven lookup tables for tabulated cross sections.
 *
 * <p>A dataset is a raw table paired with a descriptor document. Loading runs
 * once, leaf-first:
 * <ol>
 *   <li>{@link org.xsecgrid.descriptor.DescriptorParser} validates the
 *       descriptor</li>
 *   <li>{@link org.xsecgrid.reader.TableLoader} reads the raw rows</li>
 *   <li>{@link org.xsecgrid.grid.GridBuilder} indexes rows by rounded
 *       parameter values</li>
 *   <li>{@link org.xsecgrid.resolve.ValueResolver} combines uncertainties
 *       for each value specification</li>
 *   <li>{@link org.xsecgrid.query.QueryEngine} answers lookups</li>
 * </ol>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DatasetHandle handle = CrossSectionTables.load(
 *     Paths.get("13TeV.n2x1+-.wino.info"), Paths.get("13TeV.n2x1+-.wino.csv"));
 * ResolvedRecord record =
 *     handle.query(0, new double[] {500}, InterpolationMethod.LINEAR);
 * }</pre>
 */
package org.xsecgrid;
