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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;
import org.optmodel.ShapeMismatchException;
import org.optmodel.symbolic.IndexSet;
import org.optmodel.symbolic.Iteration;
import org.optmodel.symbolic.LiteralSet;
import org.optmodel.symbolic.SetDomain;
import org.optmodel.symbolic.SetIterator;
import org.optmodel.symbolic.SymbolicSum;

/**
 * An indexed family of variables sharing a name, a type and default attributes.
 *
 * <p>Members are created for every combination of the index sources, in insertion order, and
 * named {@code x[0,a]}. A group indexed by an {@link IndexSet} is abstract: its members exist only
 * on the engine and are referenced symbolically, e.g. {@code x[i]}.
 */
public final class VariableGroup implements Declaration, Iterable<Variable> {
  /** Wildcard matching any value of a key component in {@link #sum(Object...)}. */
  public static final String ANY = "*";

  /** One index source of the group: literal values, key tuples or an abstract set. */
  private static final class IndexSource {
    final List<Key> keys;
    final String literal;
    final IndexSet set;
    final int dimension;

    IndexSource(List<Key> keys, String literal, IndexSet set, int dimension) {
      this.keys = keys;
      this.literal = literal;
      this.set = set;
      this.dimension = dimension;
    }

    SetDomain domain() {
      return set != null ? set : LiteralSet.of(keys);
    }

    String render(NumberFormatter formatter) {
      if (set != null) {
        return set.getName();
      }
      return literal != null ? literal : LiteralSet.of(keys).renderDomain(formatter);
    }
  }

  /** Builder for {@link VariableGroup}. */
  public static final class Builder {
    private final String name;
    private final List<IndexSource> sources = new ArrayList<>();
    private VarType type = VarType.CONTINUOUS;
    private KeyedValues lowerBounds = KeyedValues.none();
    private KeyedValues upperBounds = KeyedValues.none();
    private KeyedValues inits = KeyedValues.none();

    private Builder(String name) {
      this.name = name;
    }

    /** Adds an index over the given values, e.g. {@code List.of("a", "b")}. */
    public Builder addIndex(Iterable<?> values) {
      List<Key> keys = new ArrayList<>();
      for (Object value : values) {
        keys.add(Key.of(value));
      }
      sources.add(new IndexSource(distinct(keys), null, null, 1));
      return this;
    }

    /** Adds an index over {@code 0 .. size - 1}. */
    public Builder addRange(int size) {
      return addRange(0, size);
    }

    /** Adds an index over {@code start .. end - 1}. */
    public Builder addRange(int start, int end) {
      List<Key> keys = new ArrayList<>();
      for (int i = start; i < end; ++i) {
        keys.add(Key.of(i));
      }
      String literal = keys.isEmpty() ? "{}" : start + ".." + (end - 1);
      sources.add(new IndexSource(keys, literal, null, 1));
      return this;
    }

    /** Adds an index over previously built key tuples, all of the same arity. */
    public Builder addKeys(Iterable<?> keys) {
      List<Key> converted = new ArrayList<>();
      int arity = -1;
      for (Object key : keys) {
        Key k = Key.from(key);
        if (arity >= 0 && k.size() != arity) {
          throw new ModelingException(
              "VariableGroup.addKeys", "keys have different arities: " + arity + " and "
                  + k.size());
        }
        arity = k.size();
        converted.add(k);
      }
      sources.add(new IndexSource(distinct(converted), null, null, Math.max(arity, 1)));
      return this;
    }

    /** Adds an abstract index; the group becomes abstract. */
    public Builder addIndex(IndexSet set) {
      sources.add(new IndexSource(null, null, set, set.getDimension()));
      return this;
    }

    public Builder setType(VarType type) {
      this.type = type;
      return this;
    }

    public Builder setLowerBound(double lowerBound) {
      return setLowerBound(KeyedValues.of(lowerBound));
    }

    public Builder setLowerBound(KeyedValues lowerBounds) {
      this.lowerBounds = lowerBounds;
      return this;
    }

    public Builder setUpperBound(double upperBound) {
      return setUpperBound(KeyedValues.of(upperBound));
    }

    public Builder setUpperBound(KeyedValues upperBounds) {
      this.upperBounds = upperBounds;
      return this;
    }

    public Builder setInit(double init) {
      return setInit(KeyedValues.of(init));
    }

    public Builder setInit(KeyedValues inits) {
      this.inits = inits;
      return this;
    }

    /** Creates the group and its members, registering their names in {@code registry}. */
    public VariableGroup build(NameRegistry registry) {
      if (sources.isEmpty()) {
        throw new ModelingException("VariableGroup.build", "at least one index is required");
      }
      return new VariableGroup(this, registry);
    }

    private static List<Key> distinct(List<Key> keys) {
      return new ArrayList<>(new LinkedHashSet<>(keys));
    }
  }

  public static Builder newBuilder(String name) {
    return new Builder(name);
  }

  private VariableGroup(Builder builder, NameRegistry registry) {
    this.sources = ImmutableList.copyOf(builder.sources);
    this.type = builder.type;
    int dimension = 0;
    boolean isAbstract = false;
    for (IndexSource source : sources) {
      dimension += source.dimension;
      isAbstract |= source.set != null;
    }
    this.arity = dimension;
    this.isAbstract = isAbstract;
    Double lb = builder.lowerBounds.getScalar();
    Double ub = builder.upperBounds.getScalar();
    this.lowerBound = lb != null ? lb : type.defaultLowerBound();
    this.upperBound = ub != null ? ub : type.defaultUpperBound();
    this.init = builder.inits.getScalar();
    this.name = registry.registerOrGenerate(builder.name, "x", this);
    this.members = new LinkedHashMap<>();
    if (!isAbstract) {
      int position = 0;
      for (Key key : cartesianProduct()) {
        double memberLb = builder.lowerBounds.resolve(
            "VariableGroup.build", key, position, type.defaultLowerBound());
        double memberUb = builder.upperBounds.resolve(
            "VariableGroup.build", key, position, type.defaultUpperBound());
        Double memberInit = builder.inits.resolve("VariableGroup.build", key, position, null);
        Variable member = new Variable(this, key, type, memberLb, memberUb, memberInit);
        member.setMemberName(name + "[" + key.toName() + "]");
        registry.register(member.getName(), member);
        members.put(key, member);
        position++;
      }
    }
  }

  private List<Key> cartesianProduct() {
    List<Key> result = new ArrayList<>();
    result.add(Key.empty());
    for (IndexSource source : sources) {
      List<Key> next = new ArrayList<>();
      for (Key prefix : result) {
        for (Key key : source.keys) {
          next.add(prefix.concat(key));
        }
      }
      result = next;
    }
    return result;
  }

  @Override
  public String getName() {
    return name;
  }

  public VarType getType() {
    return type;
  }

  /** Number of key components. */
  public int getArity() {
    return arity;
  }

  public boolean isAbstract() {
    return isAbstract;
  }

  /** Group-wide lower bound. */
  public double getLowerBound() {
    return lowerBound;
  }

  public double getUpperBound() {
    return upperBound;
  }

  /** Group-wide initial value, or null. */
  public Double getInit() {
    return init;
  }

  public int size() {
    return members.size();
  }

  public ImmutableList<Key> getKeys() {
    return ImmutableList.copyOf(members.keySet());
  }

  public ImmutableMap<Key, Variable> getMembers() {
    return ImmutableMap.copyOf(members);
  }

  @Override
  public Iterator<Variable> iterator() {
    return Collections.unmodifiableCollection(members.values()).iterator();
  }

  /**
   * Returns the member with the given key.
   *
   * @throws ModelingException if the group is abstract or has no such member
   */
  public Variable get(Object... key) {
    if (isAbstract) {
      throw new ModelingException(
          "VariableGroup.get", "group " + name + " is abstract, use at() for symbolic access");
    }
    Key k = key.length == 1 ? Key.from(key[0]) : Key.of(key);
    Variable member = members.get(k);
    if (member == null) {
      throw new ModelingException("VariableGroup.get", "group " + name + " has no member " + k);
    }
    return member;
  }

  /** Returns the symbolic member {@code x[i, ...]} for the given iterators. */
  public IndexedReference get(SetIterator... iterators) {
    return at((Object[]) iterators);
  }

  /** Returns a symbolic reference to the member with the given key, e.g. {@code x[i, 'a']}. */
  public IndexedReference at(Object... key) {
    Key k = Key.of(key);
    if (k.size() != arity) {
      throw new ModelingException(
          "VariableGroup.at", "group " + name + " expects " + arity + " key components, got "
              + k.size());
    }
    return new IndexedReference(this, k);
  }

  /**
   * Returns the sum of the members matching {@code filter}. Each filter component is a value,
   * {@link #ANY}, or a collection of accepted values. Without filter, all members are summed.
   *
   * <p>For an abstract group, wildcard components become iterators of a symbolic sum.
   */
  public Expression sum(Object... filter) {
    if (filter.length != 0 && filter.length != arity) {
      throw new ModelingException(
          "VariableGroup.sum", "filter has " + filter.length + " components but group " + name
              + " has " + arity);
    }
    if (isAbstract) {
      return abstractSum(filter);
    }
    List<Variable> selected = new ArrayList<>();
    for (Map.Entry<Key, Variable> entry : members.entrySet()) {
      if (matches(entry.getKey(), filter)) {
        selected.add(entry.getValue());
      }
    }
    return Expression.sum(selected);
  }

  private static boolean matches(Key key, Object[] filter) {
    for (int i = 0; i < filter.length; ++i) {
      Object accepted = filter[i];
      if (ANY.equals(accepted)) {
        continue;
      }
      Object part = key.get(i);
      if (accepted instanceof Collection) {
        boolean found = false;
        for (Object candidate : (Collection<?>) accepted) {
          if (Key.normalize(candidate).equals(part)) {
            found = true;
            break;
          }
        }
        if (!found) {
          return false;
        }
      } else if (!Key.normalize(accepted).equals(part)) {
        return false;
      }
    }
    return true;
  }

  private Expression abstractSum(Object[] filter) {
    List<Object> parts = new ArrayList<>();
    List<SetIterator> iterators = new ArrayList<>();
    int position = 0;
    for (IndexSource source : sources) {
      int wildcards = 0;
      for (int i = 0; i < source.dimension; ++i) {
        if (filter.length == 0 || ANY.equals(filter[position + i])) {
          wildcards++;
        }
      }
      if (wildcards == source.dimension) {
        String[] names = new String[source.dimension];
        for (int i = 0; i < names.length; ++i) {
          names[i] = "o" + (iterators.size() + i + 1);
        }
        List<SetIterator> tuple = SetIterator.tuple(source.domain(), names);
        iterators.addAll(tuple);
        parts.addAll(tuple);
      } else if (wildcards == 0) {
        for (int i = 0; i < source.dimension; ++i) {
          if (filter[position + i] instanceof Collection) {
            throw new ModelingException(
                "VariableGroup.sum", "value lists are not supported for abstract group " + name);
          }
          parts.add(filter[position + i]);
        }
      } else {
        throw new ModelingException(
            "VariableGroup.sum",
            "partial wildcards over a multi-dimensional set are not supported for group " + name);
      }
      position += source.dimension;
    }
    IndexedReference member = at(parts.toArray());
    if (iterators.isEmpty()) {
      return member.toExpression();
    }
    return SymbolicSum.over(Iteration.over(iterators), member);
  }

  /**
   * Returns {@code sum(coefficients[i] * member[i])}, pairing the members in iteration order.
   *
   * @throws ShapeMismatchException if the sizes differ
   */
  public Expression mult(List<? extends Number> coefficients) {
    checkConcrete("VariableGroup.mult");
    if (coefficients.size() != members.size()) {
      throw new ShapeMismatchException(
          "VariableGroup.mult", name, members.size(), "coefficients", coefficients.size());
    }
    Expression result = new Expression();
    int i = 0;
    for (Variable member : members.values()) {
      result.addInPlace("VariableGroup.mult", member.toExpression(),
          coefficients.get(i++).doubleValue());
    }
    return result;
  }

  /** Same as {@link #mult(List)} for an array of coefficients. */
  public Expression mult(double[] coefficients) {
    List<Double> list = new ArrayList<>(coefficients.length);
    for (double c : coefficients) {
      list.add(c);
    }
    return mult(list);
  }

  /**
   * Returns {@code sum(coefficients[key] * member[key])} for coefficients keyed like the members.
   *
   * @throws ShapeMismatchException if the sizes differ
   */
  public Expression mult(Map<?, ? extends Number> coefficients) {
    checkConcrete("VariableGroup.mult");
    if (coefficients.size() != members.size()) {
      throw new ShapeMismatchException(
          "VariableGroup.mult", name, members.size(), "coefficients", coefficients.size());
    }
    Expression result = new Expression();
    for (Map.Entry<?, ? extends Number> entry : coefficients.entrySet()) {
      Key key = Key.from(entry.getKey());
      Variable member = members.get(key);
      if (member == null) {
        throw new ModelingException(
            "VariableGroup.mult", "group " + name + " has no member " + key);
      }
      result.addInPlace("VariableGroup.mult", member.toExpression(),
          entry.getValue().doubleValue());
    }
    return result;
  }

  /** Sets the bounds of the group and of every member. */
  public void setBounds(double lowerBound, double upperBound) {
    if (type == VarType.BINARY) {
      this.lowerBound = Math.max(lowerBound, 0.0);
      this.upperBound = Math.min(upperBound, 1.0);
    } else {
      this.lowerBound = lowerBound;
      this.upperBound = upperBound;
    }
    for (Variable member : members.values()) {
      member.setBounds(lowerBound, upperBound);
    }
  }

  /** Sets the initial value of the group and of every member. */
  public void setInit(Double init) {
    this.init = init;
    for (Variable member : members.values()) {
      member.setInit(init);
    }
  }

  public void clearSolution() {
    for (Variable member : members.values()) {
      member.clearSolution();
    }
  }

  private void checkConcrete(String methodName) {
    if (isAbstract) {
      throw new ModelingException(methodName, "group " + name + " is abstract");
    }
  }

  @Override
  public String toDeclaration(NumberFormatter formatter) {
    List<String> indices = new ArrayList<>();
    for (IndexSource source : sources) {
      indices.add(source.render(formatter));
    }
    StringBuilder sb = new StringBuilder("var ").append(name).append(" {")
        .append(String.join(", ", indices)).append('}');
    Variable.appendAttributes(sb, type, lowerBound, upperBound, init, formatter);
    sb.append(';');
    for (Variable member : members.values()) {
      String reference = member.render(formatter);
      if (member.getLowerBound() != lowerBound) {
        sb.append('\n').append(reference).append(".lb = ")
            .append(formatter.format(member.getLowerBound())).append(';');
      }
      if (member.getUpperBound() != upperBound) {
        sb.append('\n').append(reference).append(".ub = ")
            .append(formatter.format(member.getUpperBound())).append(';');
      }
      Double memberInit = member.getInit();
      if (memberInit != null && !memberInit.equals(init)) {
        sb.append('\n').append(reference).append(" = ").append(formatter.format(memberInit))
            .append(';');
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return name;
  }

  private final ImmutableList<IndexSource> sources;
  private final VarType type;
  private final int arity;
  private final boolean isAbstract;
  private final String name;
  private final Map<Key, Variable> members;
  private double lowerBound;
  private double upperBound;
  private Double init;
}
