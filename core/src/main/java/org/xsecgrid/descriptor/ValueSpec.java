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
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declares one reportable quantity of a table: a central-value column and the
 * components of its uncertainty band.
 *
 * <h3>Asymmetric band</h3>
 * <pre>{@code
 * {
 *   "column": "xsec",
 *   "unc-": [{"column": "unc-_scale", "type": "relative"},
 *            {"column": "unc-_pdf", "type": "relative"}],
 *   "unc+": [{"column": "unc+_scale", "type": "relative"},
 *            {"column": "unc+_pdf", "type": "relative"}]
 * }
 * }</pre>
 *
 * <h3>Symmetric band with attribute override</h3>
 * <pre>{@code
 * {
 *   "column": "xsec_nlo",
 *   "unc": [{"column": "unc_nlo", "type": "absolute"}],
 *   "attributes": {"order": "NLO"}
 * }
 * }</pre>
 */
public final class ValueSpec {
  private final String column;
  private final ImmutableList<UncertaintyComponent> uncMinus;
  private final ImmutableList<UncertaintyComponent> uncPlus;
  private final boolean symmetric;
  private final ImmutableMap<String, AttributeValue> attributes;

  private ValueSpec(Builder builder) {
    this.column = builder.column;
    this.symmetric = builder.symmetric != null;
    if (symmetric) {
      this.uncMinus = ImmutableList.copyOf(builder.symmetric);
      this.uncPlus = this.uncMinus;
    } else {
      this.uncMinus = ImmutableList.copyOf(builder.uncMinus);
      this.uncPlus = ImmutableList.copyOf(builder.uncPlus);
    }
    this.attributes = ImmutableMap.copyOf(builder.attributes);
  }

  /**
   * Returns the column holding the central value.
   */
  public String getColumn() {
    return column;
  }

  /**
   * Returns the components of the lower band; for a symmetric band the same
   * list as {@link #getUncPlus()}.
   */
  public List<UncertaintyComponent> getUncMinus() {
    return uncMinus;
  }

  /**
   * Returns the components of the upper band.
   */
  public List<UncertaintyComponent> getUncPlus() {
    return uncPlus;
  }

  /**
   * Returns whether the band was declared with a single {@code unc} block.
   */
  public boolean isSymmetric() {
    return symmetric;
  }

  public boolean hasUncertainties() {
    return !uncMinus.isEmpty() || !uncPlus.isEmpty();
  }

  /**
   * Returns the attribute override of this value, empty if none.
   */
  public Map<String, AttributeValue> getAttributes() {
    return attributes;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("ValueSpec{column='").append(column).append("'");
    if (symmetric) {
      sb.append(", unc=").append(uncPlus);
    } else {
      sb.append(", unc-=").append(uncMinus);
      sb.append(", unc+=").append(uncPlus);
    }
    if (!attributes.isEmpty()) {
      sb.append(", attributes=").append(attributes);
    }
    sb.append("}");
    return sb.toString();
  }

  /**
   * Builder for ValueSpec.
   */
  public static class Builder {
    private String column;
    private final List<UncertaintyComponent> uncMinus = new ArrayList<UncertaintyComponent>();
    private final List<UncertaintyComponent> uncPlus = new ArrayList<UncertaintyComponent>();
    private List<UncertaintyComponent> symmetric;
    private final Map<String, AttributeValue> attributes =
        new LinkedHashMap<String, AttributeValue>();

    public Builder column(String column) {
      this.column = column;
      return this;
    }

    public Builder uncMinus(UncertaintyComponent component) {
      this.uncMinus.add(component);
      return this;
    }

    public Builder uncPlus(UncertaintyComponent component) {
      this.uncPlus.add(component);
      return this;
    }

    /**
     * Adds a component applied to both sides of the band.
     */
    public Builder unc(UncertaintyComponent component) {
      if (symmetric == null) {
        symmetric = new ArrayList<UncertaintyComponent>();
      }
      this.symmetric.add(component);
      return this;
    }

    public Builder attribute(String key, AttributeValue value) {
      this.attributes.put(key, value);
      return this;
    }

    public Builder attributes(Map<String, AttributeValue> attributes) {
      this.attributes.putAll(attributes);
      return this;
    }

    public ValueSpec build() {
      if (column == null || column.isEmpty()) {
        throw new IllegalArgumentException("Value column is required");
      }
      if (symmetric != null && (!uncMinus.isEmpty() || !uncPlus.isEmpty())) {
        throw new IllegalArgumentException(
            "Value " + column + " declares both unc and unc+/unc-");
      }
      return new ValueSpec(this);
    }
  }
}
