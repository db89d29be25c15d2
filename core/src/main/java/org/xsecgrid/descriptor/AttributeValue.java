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
import java.util.Objects;

/**
 * Value of a dataset attribute: either a single string or a list of strings.
 *
 * <p>Lists are kept as declared. A dataset covering several production
 * processes lists all of them, e.g.
 * <pre>{@code
 * "processes": ["pp>n2x1+", "pp>n2x1-"]
 * }</pre>
 */
public final class AttributeValue {

  /**
   * Kind of attribute value.
   */
  public enum Kind {
    STRING,
    LIST
  }

  private final Kind kind;
  private final ImmutableList<String> values;

  private AttributeValue(Kind kind, List<String> values) {
    this.kind = kind;
    this.values = ImmutableList.copyOf(values);
  }

  public static AttributeValue of(String value) {
    return new AttributeValue(Kind.STRING, ImmutableList.of(value));
  }

  public static AttributeValue of(List<String> values) {
    return new AttributeValue(Kind.LIST, values);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isList() {
    return kind == Kind.LIST;
  }

  /**
   * Returns the string of a {@link Kind#STRING} value.
   *
   * @throws IllegalStateException if this is a list
   */
  public String asString() {
    if (kind != Kind.STRING) {
      throw new IllegalStateException("Attribute is a list: " + values);
    }
    return values.get(0);
  }

  /**
   * Returns the values; a single-element list for a {@link Kind#STRING}.
   */
  public List<String> asList() {
    return values;
  }

  /**
   * Returns whether this value is, or contains, the given string.
   */
  public boolean matches(String candidate) {
    return values.contains(candidate);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AttributeValue)) {
      return false;
    }
    AttributeValue that = (AttributeValue) o;
    return kind == that.kind && values.equals(that.values);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, values);
  }

  @Override public String toString() {
    return kind == Kind.STRING ? values.get(0) : values.toString();
  }
}
