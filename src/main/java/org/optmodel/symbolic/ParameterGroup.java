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
import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;
import org.optmodel.core.Declaration;
import org.optmodel.core.Expression;
import org.optmodel.core.ExpressionArgument;
import org.optmodel.core.IndexedReference;
import org.optmodel.core.Key;

/**
 * An indexed table of parameters resolved on the engine, e.g. {@code num cap {I} init 10;}, filled
 * by a {@code read data} statement or defined by an expression over iterators.
 */
public final class ParameterGroup implements Declaration {
  /** Builder for {@link ParameterGroup}. */
  public static final class Builder {
    private final String name;
    private final List<IndexSet> sets = new ArrayList<>();
    private Iteration iteration;
    private ValueType type = ValueType.NUM;
    private Double init;
    private String initText;
    private Expression value;

    private Builder(String name) {
      this.name = name;
    }

    /** Indexes the group by {@code set}, rendered {@code {I, J}}. */
    public Builder addIndex(IndexSet set) {
      sets.add(set);
      return this;
    }

    /** Indexes the group by an iteration, rendered {@code {i in I}}. */
    public Builder over(Iteration iteration) {
      this.iteration = iteration;
      return this;
    }

    public Builder setType(ValueType type) {
      this.type = type;
      return this;
    }

    public Builder setInit(double init) {
      this.init = init;
      return this;
    }

    public Builder setInit(String init) {
      this.initText = init;
      return this;
    }

    /** Defining expression, usually over the iterators of {@link #over(Iteration)}. */
    public Builder setValue(ExpressionArgument value) {
      this.value = Expression.copyOf(value);
      return this;
    }

    public ParameterGroup build(NameRegistry registry) {
      if (sets.isEmpty() == (iteration == null)) {
        throw new ModelingException(
            "ParameterGroup.build", "exactly one of index sets or iteration is required for "
                + name);
      }
      ParameterGroup group = new ParameterGroup(this);
      group.name = registry.registerOrGenerate(name, "p", group);
      return group;
    }
  }

  public static Builder newBuilder(String name) {
    return new Builder(name);
  }

  private ParameterGroup(Builder builder) {
    this.sets = ImmutableList.copyOf(builder.sets);
    this.iteration = builder.iteration;
    this.type = builder.type;
    this.init = builder.init;
    this.initText = builder.initText;
    this.value = builder.value;
    int dimension = 0;
    if (iteration != null) {
      dimension = iteration.getIterators().size();
    } else {
      for (IndexSet set : sets) {
        dimension += set.getDimension();
      }
    }
    this.arity = dimension;
  }

  @Override
  public String getName() {
    return name;
  }

  public ValueType getType() {
    return type;
  }

  public int getArity() {
    return arity;
  }

  /** Returns the entry {@code p[key]}. */
  public IndexedReference get(Object... key) {
    Key k = Key.of(key);
    if (k.size() != arity) {
      throw new ModelingException(
          "ParameterGroup.get", name + " expects " + arity + " key components, got " + k.size());
    }
    return new IndexedReference(this, k);
  }

  @Override
  public String toDeclaration(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder(type.getKeyword()).append(' ').append(name).append(' ');
    if (iteration != null) {
      sb.append(iteration.render(formatter));
    } else {
      List<String> names = new ArrayList<>();
      for (IndexSet set : sets) {
        names.add(set.getName());
      }
      sb.append('{').append(String.join(", ", names)).append('}');
    }
    if (value != null) {
      sb.append(" = ").append(value.render(formatter));
    } else if (init != null) {
      sb.append(" init ").append(formatter.format(init));
    } else if (initText != null) {
      sb.append(" init ").append(Key.quote(initText));
    }
    return sb.append(';').toString();
  }

  @Override
  public String toString() {
    return name;
  }

  private String name;
  private final ImmutableList<IndexSet> sets;
  private final Iteration iteration;
  private final ValueType type;
  private final Double init;
  private final String initText;
  private final Expression value;
  private final int arity;
}
