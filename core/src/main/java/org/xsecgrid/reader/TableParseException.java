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

import org.xsecgrid.LoadException;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Indicates that a raw table row could not be parsed.
 */
public class TableParseException extends LoadException {
  private final String source;
  private final int lineNumber;
  private final String rawLine;

  public TableParseException(String source, int lineNumber, String rawLine, String message) {
    super(source + ":" + lineNumber + ": " + message + ": '" + rawLine + "'");
    this.source = source;
    this.lineNumber = lineNumber;
    this.rawLine = rawLine;
  }

  public TableParseException(String source, int lineNumber, String rawLine, String message,
      @Nullable Throwable cause) {
    super(source + ":" + lineNumber + ": " + message + ": '" + rawLine + "'", cause);
    this.source = source;
    this.lineNumber = lineNumber;
    this.rawLine = rawLine;
  }

  public String getSource() {
    return source;
  }

  /**
   * Returns the 1-based physical line number of the offending row.
   */
  public int getLineNumber() {
    return lineNumber;
  }

  /**
   * Returns the raw content of the offending row.
   */
  public String getRawLine() {
    return rawLine;
  }
}
