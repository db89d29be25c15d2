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

import org.xsecgrid.LoadException;

/**
 * Indicates that a descriptor document is malformed or incomplete.
 *
 * <p>The exception carries the dotted path of the offending field, e.g.
 * {@code values[1].unc+[0].type}, so that the descriptor author can find it.
 */
public class SchemaException extends LoadException {
  private final String field;

  public SchemaException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  public SchemaException(String field, String message, Throwable cause) {
    super(field + ": " + message, cause);
    this.field = field;
  }

  /**
   * Returns the path of the field that failed validation.
   */
  public String getField() {
    return field;
  }
}
