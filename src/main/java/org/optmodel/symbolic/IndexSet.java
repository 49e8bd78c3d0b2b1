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
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;
import org.optmodel.core.Declaration;
import org.optmodel.core.Key;

/**
 * A named set whose membership is resolved on the engine, e.g. {@code set <num, str> ARCS;}.
 *
 * <p>The set may carry literal initial members or a range, or be filled by a {@code read data}
 * statement.
 */
public final class IndexSet implements Declaration, SetDomain {
  /** Builder for {@link IndexSet}. */
  public static final class Builder {
    private final String name;
    private ImmutableList<ValueType> types = ImmutableList.of(ValueType.NUM);
    private String initOperator;
    private List<Key> members;
    private SetRange range;

    private Builder(String name) {
      this.name = name;
    }

    /** Component types; one type per dimension. */
    public Builder setTypes(ValueType... types) {
      if (types.length == 0) {
        throw new IllegalArgumentException("IndexSet.setTypes: at least one type is required");
      }
      this.types = ImmutableList.copyOf(types);
      return this;
    }

    /** Initial members, overwritable by the engine: {@code init {1,2,3}}. */
    public Builder setInit(Iterable<?> members) {
      return setMembers("init", members);
    }

    /** Initial range: {@code init 1..N}. */
    public Builder setInit(SetRange range) {
      this.initOperator = "init";
      this.range = range;
      this.members = null;
      return this;
    }

    /** Fixed members: {@code = {'a','b'}}. */
    public Builder setValue(Iterable<?> members) {
      return setMembers("=", members);
    }

    /** Fixed range: {@code = 1..N}. */
    public Builder setValue(SetRange range) {
      this.initOperator = "=";
      this.range = range;
      this.members = null;
      return this;
    }

    private Builder setMembers(String operator, Iterable<?> values) {
      List<Key> keys = new ArrayList<>();
      for (Object value : values) {
        keys.add(Key.from(value));
      }
      this.initOperator = operator;
      this.members = keys;
      this.range = null;
      return this;
    }

    public IndexSet build(NameRegistry registry) {
      IndexSet set = new IndexSet(this);
      set.name = registry.registerOrGenerate(name, "S", set);
      return set;
    }
  }

  public static Builder newBuilder(String name) {
    return new Builder(name);
  }

  private IndexSet(Builder builder) {
    this.types = builder.types;
    this.initOperator = builder.initOperator;
    this.members = builder.members == null ? null : ImmutableList.copyOf(builder.members);
    this.range = builder.range;
  }

  @Override
  public String getName() {
    return name;
  }

  public ImmutableList<ValueType> getTypes() {
    return types;
  }

  @Override
  public int getDimension() {
    return types.size();
  }

  /** Returns the literal members, or null if the set has none. */
  public ImmutableList<Key> getMembers() {
    return members;
  }

  /** Returns an iterator over a one-dimensional set. */
  public SetIterator iterator(String iteratorName) {
    if (getDimension() != 1) {
      throw new IllegalArgumentException(
          "IndexSet.iterator: set " + name + " has " + getDimension()
              + " dimensions, use iterators()");
    }
    return SetIterator.over(iteratorName, this);
  }

  /** Returns one iterator per dimension, to be bound together as a tuple. */
  public List<SetIterator> iterators(String... iteratorNames) {
    return SetIterator.tuple(this, iteratorNames);
  }

  @Override
  public String renderDomain(NumberFormatter formatter) {
    return name;
  }

  @Override
  public String toDeclaration(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder("set ");
    if (types.size() > 1 || types.get(0) != ValueType.NUM) {
      List<String> keywords = new ArrayList<>();
      for (ValueType type : types) {
        keywords.add(type.getKeyword());
      }
      sb.append('<').append(String.join(", ", keywords)).append("> ");
    }
    sb.append(name);
    if (range != null) {
      sb.append(' ').append(initOperator).append(' ').append(range.renderDomain(formatter));
    } else if (members != null) {
      sb.append(' ').append(initOperator).append(' ')
          .append(LiteralSet.of(members).renderDomain(formatter));
    }
    return sb.append(';').toString();
  }

  @Override
  public String toString() {
    return name;
  }

  private String name;
  private final ImmutableList<ValueType> types;
  private final String initOperator;
  private final ImmutableList<Key> members;
  private final SetRange range;
}
