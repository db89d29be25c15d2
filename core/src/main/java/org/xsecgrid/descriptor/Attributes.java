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

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attribute maps of a dataset.
 */
public final class Attributes {

  private Attributes() {
    // Utility class - no instances
  }

  /**
   * Merges a value specification's attribute override on top of the base
   * attributes of its descriptor.
   *
   * <p>Keys of both maps are kept; on a collision the override wins. Base key
   * order is preserved and new keys follow in override order.
   *
   * @param base Descriptor-wide attributes
   * @param override Attributes of one value specification, may be empty
   * @return Merged attributes
   */
  public static ImmutableMap<String, AttributeValue> merge(
      Map<String, AttributeValue> base, Map<String, AttributeValue> override) {
    if (override.isEmpty()) {
      return ImmutableMap.copyOf(base);
    }
    Map<String, AttributeValue> merged = new LinkedHashMap<String, AttributeValue>(base);
    merged.putAll(override);
    return ImmutableMap.copyOf(merged);
  }
}
