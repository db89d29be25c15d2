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
package org.xsecgrid.grid;

import org.xsecgrid.LoadException;

/**
 * Indicates that two rows of a table round to the same grid key while the
 * {@link DuplicateKeyPolicy#ERROR} policy is in effect.
 */
public class DuplicateGridKeyException extends LoadException {
  private final GridKey key;

  public DuplicateGridKeyException(GridKey key, int firstLine, int secondLine) {
    super("Rows at lines " + firstLine + " and " + secondLine
        + " share grid key " + key);
    this.key = key;
  }

  public GridKey getKey() {
    return key;
  }
}
