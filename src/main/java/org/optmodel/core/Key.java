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
import java.util.ArrayList;
import java.util.List;
import org.optmodel.NumberFormatter;

/**
 * An immutable index tuple of a group member, e.g. {@code (0, 'a')}.
 *
 * <p>Integral numbers are normalized to {@code Long}, so that {@code 1}, {@code 1L} and {@code 1.0}
 * designate the same member. A component may also be a {@link Term} or an {@link
 * ExpressionArgument}, e.g. a set iterator, for symbolic references such as {@code x[i]}.
 * Expression components are copied and compared by structure: {@code x[i + 1]} built twice
 * designates the same member.
 */
public final class Key {
  private static final Key EMPTY = new Key(ImmutableList.of());

  public static Key of(Object... parts) {
    List<Object> normalized = new ArrayList<>(parts.length);
    for (Object part : parts) {
      normalized.add(normalize(part));
    }
    return new Key(ImmutableList.copyOf(normalized));
  }

  public static Key empty() {
    return EMPTY;
  }

  /** Converts a key, a list of components or a single component into a key. */
  public static Key from(Object value) {
    if (value instanceof Key) {
      return (Key) value;
    }
    if (value instanceof List) {
      return of(((List<?>) value).toArray());
    }
    if (value instanceof Object[]) {
      return of((Object[]) value);
    }
    return of(value);
  }

  static Object normalize(Object part) {
    if (part == null) {
      throw new NullPointerException("Key components must not be null");
    }
    if (part instanceof Key) {
      throw new IllegalArgumentException("Key components must not be keys: " + part);
    }
    if (part instanceof Integer || part instanceof Long || part instanceof Short
        || part instanceof Byte) {
      return ((Number) part).longValue();
    }
    if (part instanceof Number) {
      double d = ((Number) part).doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < Long.MAX_VALUE) {
        return (long) d;
      }
      return d;
    }
    if (part instanceof Character) {
      return part.toString();
    }
    if (part instanceof ExpressionArgument && !(part instanceof Term)) {
      return Expression.copyOf((ExpressionArgument) part);
    }
    return part;
  }

  private Key(ImmutableList<Object> parts) {
    this.parts = parts;
  }

  public ImmutableList<Object> getParts() {
    return parts;
  }

  public Object get(int index) {
    return parts.get(index);
  }

  public int size() {
    return parts.size();
  }

  /** Returns the concatenation of this key and {@code other}. */
  public Key concat(Key other) {
    return new Key(ImmutableList.builder().addAll(parts).addAll(other.parts).build());
  }

  /** Returns true if a component is a symbolic term, e.g. a set iterator. */
  public boolean isSymbolic() {
    for (Object part : parts) {
      if (part instanceof Term && ((Term) part).isSymbolic()) {
        return true;
      }
      if (part instanceof ExpressionArgument
          && !(part instanceof Term)
          && ((ExpressionArgument) part).toExpression().isSymbolic()) {
        return true;
      }
    }
    return false;
  }

  /** Renders the components for generated code, strings quoted: {@code 0,'a'}. */
  public String render(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder();
    for (Object part : parts) {
      if (sb.length() > 0) {
        sb.append(',');
      }
      sb.append(renderPart(part, formatter));
    }
    return sb.toString();
  }

  /** Renders the components as the engine names members: {@code 0,a}. */
  public String toName() {
    StringBuilder sb = new StringBuilder();
    for (Object part : parts) {
      if (sb.length() > 0) {
        sb.append(',');
      }
      sb.append(part instanceof Double ? new NumberFormatter(12).format((Double) part) : part);
    }
    return sb.toString();
  }

  /** Renders the components as an identifier suffix: {@code 0_a}. */
  public String toIdentifierSuffix() {
    StringBuilder sb = new StringBuilder();
    for (Object part : parts) {
      if (sb.length() > 0) {
        sb.append('_');
      }
      String text =
          part instanceof Double ? new NumberFormatter(12).format((Double) part) : part.toString();
      sb.append(text.replaceAll("[^A-Za-z0-9_]", "_"));
    }
    return sb.toString();
  }

  static String renderPart(Object part, NumberFormatter formatter) {
    if (part instanceof String) {
      return quote((String) part);
    }
    if (part instanceof Double) {
      return formatter.format((Double) part);
    }
    if (part instanceof Term) {
      return ((Term) part).render(formatter);
    }
    if (part instanceof ExpressionArgument) {
      return ((ExpressionArgument) part).toExpression().render(formatter);
    }
    return part.toString();
  }

  /** Quotes a string literal for generated code. */
  public static String quote(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Key)) {
      return false;
    }
    Key other = (Key) o;
    if (parts.size() != other.parts.size()) {
      return false;
    }
    for (int i = 0; i < parts.size(); ++i) {
      Object part = parts.get(i);
      Object otherPart = other.parts.get(i);
      if (part instanceof Expression && otherPart instanceof Expression) {
        if (!((Expression) part).sameStructure((Expression) otherPart)) {
          return false;
        }
      } else if (!part.equals(otherPart)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = 1;
    for (Object part : parts) {
      hash = 31 * hash
          + (part instanceof Expression ? ((Expression) part).structuralHash() : part.hashCode());
    }
    return hash;
  }

  @Override
  public String toString() {
    return "(" + toName() + ")";
  }

  private final ImmutableList<Object> parts;
}
