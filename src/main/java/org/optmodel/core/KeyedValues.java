// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.optmodel.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.optmodel.ModelingException;

/**
 * Per-member values of a group attribute such as a lower bound: a single scalar applied to every
 * member, a map from member key to value, or a list aligned with the member order.
 *
 * <p>A key absent from a map falls back to the type default. Keys of the wrong arity and
 * positions outside a list are errors.
 */
public final class KeyedValues {
  private static final KeyedValues NONE = new KeyedValues(null, null, null, -1);

  /** No values, every member uses the default. */
  public static KeyedValues none() {
    return NONE;
  }

  public static KeyedValues of(double value) {
    return new KeyedValues(value, null, null, -1);
  }

  /** Values by member key; map keys may be {@link Key}s, lists or single components. */
  public static KeyedValues ofMap(Map<?, ? extends Number> values) {
    ImmutableMap.Builder<Key, Double> builder = ImmutableMap.builder();
    int arity = -1;
    for (Map.Entry<?, ? extends Number> entry : values.entrySet()) {
      Key key = Key.from(entry.getKey());
      if (arity >= 0 && key.size() != arity) {
        throw new ModelingException(
            "KeyedValues.ofMap", "keys have different arities: " + arity + " and " + key.size());
      }
      arity = key.size();
      builder.put(key, entry.getValue().doubleValue());
    }
    return new KeyedValues(null, builder.buildOrThrow(), null, arity);
  }

  /** Values aligned with the member order of the group. */
  public static KeyedValues ofList(List<? extends Number> values) {
    ImmutableList.Builder<Double> builder = ImmutableList.builder();
    for (Number value : values) {
      builder.add(value.doubleValue());
    }
    return new KeyedValues(null, null, builder.build(), -1);
  }

  private KeyedValues(Double scalar, ImmutableMap<Key, Double> map, ImmutableList<Double> list,
      int arity) {
    this.scalar = scalar;
    this.map = map;
    this.list = list;
    this.arity = arity;
  }

  /** Returns the scalar value, or null if the values are per member. */
  public Double getScalar() {
    return scalar;
  }

  public boolean isPerMember() {
    return map != null || list != null;
  }

  /**
   * Returns the value of the member {@code key} at {@code position}, or {@code fallback} if no
   * value is given for it.
   */
  public Double resolve(String methodName, Key key, int position, Double fallback) {
    if (scalar != null) {
      return scalar;
    }
    if (map != null) {
      if (!map.isEmpty() && key.size() != arity) {
        throw new ModelingException(
            methodName,
            "key " + key + " has arity " + key.size() + " but the values are keyed by " + arity
                + " components");
      }
      Double value = map.get(key);
      return value != null ? value : fallback;
    }
    if (list != null) {
      try {
        return list.get(position);
      } catch (IndexOutOfBoundsException e) {
        throw new ModelingException(
            methodName, "no value at position " + position + " for key " + key, e);
      }
    }
    return fallback;
  }

  private final Double scalar;
  private final ImmutableMap<Key, Double> map;
  private final ImmutableList<Double> list;
  private final int arity;
}
