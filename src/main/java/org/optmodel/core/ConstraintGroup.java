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
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;
import org.optmodel.symbolic.Iteration;

/**
 * An indexed family of constraints.
 *
 * <p>A concrete group holds one constraint per key, named {@code c_0_a} for the key {@code (0,
 * 'a')}. An abstract group holds one template over an {@link Iteration} and is declared on a
 * single line, {@code con c {i in I} : x[i] <= cap[i];}.
 */
public final class ConstraintGroup implements Declaration, Iterable<Constraint> {
  /**
   * Creates a concrete group with one constraint per key.
   *
   * @param keys the member keys: {@link Key}s, lists of components or single components
   * @param generator returns the constraint of a key
   */
  public static ConstraintGroup of(NameRegistry registry, String name, Iterable<?> keys,
      Function<Key, Constraint> generator) {
    ConstraintGroup group = new ConstraintGroup(null, null);
    group.name = registry.registerOrGenerate(name, "con", group);
    for (Object k : keys) {
      Key key = Key.from(k);
      if (group.members.containsKey(key)) {
        throw new ModelingException(
            "ConstraintGroup.of", "duplicate key " + key + " in group " + group.name);
      }
      Constraint member = generator.apply(key);
      if (member == null) {
        throw new ModelingException(
            "ConstraintGroup.of", "no constraint generated for key " + key);
      }
      if (member.getName() != null) {
        member = member.copy();
      }
      member.register(registry, group.name + "_" + key.toIdentifierSuffix());
      member.setGroup(group, key);
      group.members.put(key, member);
    }
    return group;
  }

  /** Creates an abstract group instantiating {@code template} for each iteration element. */
  public static ConstraintGroup over(NameRegistry registry, String name, Iteration iteration,
      Constraint template) {
    ConstraintGroup group = new ConstraintGroup(iteration, template.copy());
    group.name = registry.registerOrGenerate(name, "con", group);
    return group;
  }

  private ConstraintGroup(Iteration iteration, Constraint template) {
    this.iteration = iteration;
    this.template = template;
    this.members = new LinkedHashMap<>();
  }

  @Override
  public String getName() {
    return name;
  }

  public boolean isAbstract() {
    return iteration != null;
  }

  /** Returns the iteration of an abstract group, or null. */
  public Iteration getIteration() {
    return iteration;
  }

  /** Returns the template of an abstract group, or null. */
  public Constraint getTemplate() {
    return template;
  }

  public int size() {
    return members.size();
  }

  public ImmutableList<Key> getKeys() {
    return ImmutableList.copyOf(members.keySet());
  }

  public ImmutableMap<Key, Constraint> getMembers() {
    return ImmutableMap.copyOf(members);
  }

  @Override
  public Iterator<Constraint> iterator() {
    return Collections.unmodifiableCollection(members.values()).iterator();
  }

  /** Returns the member with the given key. */
  public Constraint get(Object... key) {
    Key k = key.length == 1 ? Key.from(key[0]) : Key.of(key);
    Constraint member = members.get(k);
    if (member == null) {
      throw new ModelingException(
          "ConstraintGroup.get", "group " + name + " has no member " + k);
    }
    return member;
  }

  public void clearSolution() {
    for (Constraint member : members.values()) {
      member.clearSolution();
    }
  }

  @Override
  public String toDeclaration(NumberFormatter formatter) {
    if (isAbstract()) {
      return "con " + name + " " + iteration.render(formatter) + " : "
          + template.renderRelation(formatter) + ";";
    }
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Key, Constraint> entry : members.entrySet()) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(entry.getValue().toDeclaration(formatter));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return name;
  }

  private final Iteration iteration;
  private final Constraint template;
  private final Map<Key, Constraint> members;
  private String name;
}
