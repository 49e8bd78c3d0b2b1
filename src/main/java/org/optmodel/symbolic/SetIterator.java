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

package org.optmodel.symbolic;

import java.util.ArrayList;
import java.util.List;
import org.optmodel.NumberFormatter;
import org.optmodel.UnsupportedModelException;
import org.optmodel.core.Expression;
import org.optmodel.core.ExpressionArgument;
import org.optmodel.core.Term;

/**
 * A placeholder for a generic element of a set, bound by an {@link Iteration}. Expressions built
 * over an iterator are symbolic: they can be rendered but not evaluated on the client.
 */
public final class SetIterator implements Term, ExpressionArgument {
  /** Returns an iterator over a one-dimensional domain, e.g. {@code i in 1..10}. */
  public static SetIterator over(String name, SetDomain domain) {
    if (domain.getDimension() != 1) {
      throw new IllegalArgumentException(
          "SetIterator.over: domain has " + domain.getDimension() + " dimensions");
    }
    return new SetIterator(name, domain, 0);
  }

  /** Returns one iterator per dimension of {@code domain}, bound together as a tuple. */
  public static List<SetIterator> tuple(SetDomain domain, String... names) {
    if (names.length != domain.getDimension()) {
      throw new IllegalArgumentException(
          "SetIterator.tuple: domain has " + domain.getDimension() + " dimensions, got "
              + names.length + " names");
    }
    List<SetIterator> iterators = new ArrayList<>();
    for (int i = 0; i < names.length; ++i) {
      iterators.add(new SetIterator(names[i], domain, i));
    }
    return iterators;
  }

  private SetIterator(String name, SetDomain domain, int position) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("SetIterator: name must not be empty");
    }
    this.name = name;
    this.domain = domain;
    this.position = position;
  }

  public String getName() {
    return name;
  }

  public SetDomain getDomain() {
    return domain;
  }

  /** Position of this iterator within a tuple of a multi-dimensional set. */
  public int getPosition() {
    return position;
  }

  /** Returns the condition {@code this in set}. */
  public Condition in(SetDomain set) {
    return Condition.in(this, set);
  }

  @Override
  public String render(NumberFormatter formatter) {
    return name;
  }

  @Override
  public double evaluate() {
    throw new UnsupportedModelException(
        "SetIterator.evaluate", "iterator " + name + " has no value on the client");
  }

  @Override
  public boolean isSymbolic() {
    return true;
  }

  @Override
  public Expression toExpression() {
    return Expression.of(this);
  }

  /**
   * Iterators with the same name, domain and tuple position are interchangeable: they render the
   * same binding.
   */
  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SetIterator)) {
      return false;
    }
    SetIterator other = (SetIterator) o;
    return name.equals(other.name) && domain.equals(other.domain) && position == other.position;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * name.hashCode() + domain.hashCode()) + position;
  }

  @Override
  public String toString() {
    return name;
  }

  private final String name;
  private final SetDomain domain;
  private final int position;
}
