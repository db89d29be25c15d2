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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One source of uncertainty (scale, PDF, statistics, ...) of a value.
 */
public final class UncertaintyComponent {
  private final ImmutableList<String> columns;
  private final UncertaintyType type;

  public UncertaintyComponent(List<String> columns, UncertaintyType type) {
    this.columns = ImmutableList.copyOf(columns);
    this.type = type;
  }

  public static UncertaintyComponent of(String column, UncertaintyType type) {
    return new UncertaintyComponent(ImmutableList.of(column), type);
  }

  /**
   * Returns the referenced columns: one, or two for
   * {@link UncertaintyType#ABSOLUTE_SIGNED}.
   */
  public List<String> getColumns() {
    return columns;
  }

  public UncertaintyType getType() {
    return type;
  }

  @Override public String toString() {
    String cols = columns.size() == 1 ? columns.get(0) : columns.toString();
    return cols + " (" + type + ")";
  }
}
