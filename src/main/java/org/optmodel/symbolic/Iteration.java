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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.optmodel.NumberFormatter;

/**
 * A set of iterator bindings with an optional filter, rendered as {@code {i in I, <j, k> in K:
 * i <= j}}.
 *
 * <p>Consecutive iterators over the same multi-dimensional set are bound together as a tuple.
 */
public final class Iteration {
  public static Iteration over(SetIterator... iterators) {
    return over(ImmutableList.copyOf(iterators));
  }

  public static Iteration over(List<SetIterator> iterators) {
    if (iterators.isEmpty()) {
      throw new IllegalArgumentException("Iteration.over: at least one iterator is required");
    }
    return new Iteration(ImmutableList.copyOf(iterators), null);
  }

  private Iteration(ImmutableList<SetIterator> iterators, Condition condition) {
    this.iterators = iterators;
    this.condition = condition;
  }

  /** Returns this iteration filtered by {@code filter}, combined with any existing filter. */
  public Iteration where(Condition filter) {
    return new Iteration(iterators, condition == null ? filter : condition.and(filter));
  }

  public ImmutableList<SetIterator> getIterators() {
    return iterators;
  }

  /** Returns the filter, or null. */
  public Condition getCondition() {
    return condition;
  }

  /** Renders the bindings and the filter inside braces. */
  public String render(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder("{").append(renderBindings(formatter));
    if (condition != null) {
      sb.append(": ").append(condition.render(formatter));
    }
    return sb.append('}').toString();
  }

  /** Renders the bindings alone: {@code i in I, <j, k> in K}. */
  public String renderBindings(NumberFormatter formatter) {
    List<String> bindings = new ArrayList<>();
    int i = 0;
    while (i < iterators.size()) {
      SetIterator iterator = iterators.get(i);
      SetDomain domain = iterator.getDomain();
      int dimension = domain.getDimension();
      if (dimension > 1) {
        List<String> names = new ArrayList<>();
        int j = i;
        while (j < iterators.size() && iterators.get(j).getDomain() == domain
            && names.size() < dimension) {
          names.add(iterators.get(j).getName());
          j++;
        }
        bindings.add("<" + String.join(", ", names) + "> in " + domain.renderDomain(formatter));
        i = j;
      } else {
        bindings.add(iterator.getName() + " in " + domain.renderDomain(formatter));
        i++;
      }
    }
    return String.join(", ", bindings);
  }

  /** Two iterations are equal if they bind equal iterators under equal filters. */
  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Iteration)) {
      return false;
    }
    Iteration other = (Iteration) o;
    return iterators.equals(other.iterators) && Objects.equals(condition, other.condition);
  }

  @Override
  public int hashCode() {
    return 31 * iterators.hashCode() + Objects.hashCode(condition);
  }

  @Override
  public String toString() {
    return render(new NumberFormatter(12));
  }

  private final ImmutableList<SetIterator> iterators;
  private final Condition condition;
}
