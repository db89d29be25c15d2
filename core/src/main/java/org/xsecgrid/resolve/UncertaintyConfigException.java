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

import org.xsecgrid.LoadException;

/**
 * Indicates that the uncertainty components of a value specification cannot
 * be applied to the table: wrong number of columns for a signed pair, a
 * column missing from the row, or a field that is not a number.
 *
 * <p>Only the affected value specification becomes unavailable; the other
 * values of the dataset still load.
 */
public class UncertaintyConfigException extends LoadException {
  private final String valueColumn;

  public UncertaintyConfigException(String valueColumn, String message) {
    super("Value '" + valueColumn + "': " + message);
    this.valueColumn = valueColumn;
  }

  /**
   * Returns the central-value column of the affected value specification.
   */
  public String getValueColumn() {
    return valueColumn;
  }
}
