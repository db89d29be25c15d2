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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * A single field of a raw row: a number or a label.
 *
 * <p>Numeric fields keep their raw text next to the parsed value so that
 * labels that merely look numeric can still be shown verbatim.
 */
public final class CellValue {

  /**
   * Kind of a field, decided once per column when a table is loaded.
   */
  public enum Kind {
    NUMBER,
    STRING
  }

  private final Kind kind;
  private final String text;
  private final double number;

  private CellValue(Kind kind, String text, double number) {
    this.kind = kind;
    this.text = text;
    this.number = number;
  }

  public static CellValue number(double value) {
    return new CellValue(Kind.NUMBER, Double.toString(value), value);
  }

  static CellValue number(String text, double value) {
    return new CellValue(Kind.NUMBER, text, value);
  }

  public static CellValue string(String text) {
    return new CellValue(Kind.STRING, text, Double.NaN);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isNumber() {
    return kind == Kind.NUMBER;
  }

  /**
   * Returns the numeric value.
   *
   * @throws IllegalStateException if this is a label
   */
  public double asDouble() {
    if (kind != Kind.NUMBER) {
      throw new IllegalStateException("Not a number: '" + text + "'");
    }
    return number;
  }

  /**
   * Returns the field as written in the table.
   */
  public String asString() {
    return text;
  }

  /**
   * Parses a field the way tabulated numbers are written: plain decimals,
   * exponents, and {@code nan}/{@code inf} in any case. An empty field is a
   * missing number.
   *
   * @return the value, or null if the text is not numeric
   */
  static @Nullable Double tryParse(String text) {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return Double.NaN;
    }
    switch (trimmed.toLowerCase(Locale.ROOT)) {
      case "nan":
        return Double.NaN;
      case "inf":
      case "+inf":
      case "infinity":
        return Double.POSITIVE_INFINITY;
      case "-inf":
      case "-infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        break;
    }
    char last = trimmed.charAt(trimmed.length() - 1);
    if (Character.isLetter(last)) {
      // Double.parseDouble accepts "1d" and "1f"
      return null;
    }
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CellValue)) {
      return false;
    }
    CellValue that = (CellValue) o;
    if (kind != that.kind) {
      return false;
    }
    return kind == Kind.NUMBER
        ? Double.compare(number, that.number) == 0
        : text.equals(that.text);
  }

  @Override public int hashCode() {
    return kind == Kind.NUMBER ? Objects.hash(kind, number) : Objects.hash(kind, text);
  }

  @Override public String toString() {
    return text;
  }
}
