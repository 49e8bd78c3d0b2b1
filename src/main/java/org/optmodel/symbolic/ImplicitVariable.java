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

import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;
import org.optmodel.UnsupportedModelException;
import org.optmodel.core.Declaration;
import org.optmodel.core.Expression;
import org.optmodel.core.ExpressionArgument;
import org.optmodel.core.IndexedReference;
import org.optmodel.core.Key;
import org.optmodel.core.Term;

/**
 * A derived quantity defined by a formula, e.g. {@code impvar fit {i in POINTS} = a * t[i] + b;}.
 * Its definition, not a stored value, is emitted into generated code.
 */
public final class ImplicitVariable implements Term, ExpressionArgument, Declaration {
  /** Builder for {@link ImplicitVariable}. */
  public static final class Builder {
    private final String name;
    private Iteration iteration;
    private Expression definition;

    private Builder(String name) {
      this.name = name;
    }

    /** Makes the implicit variable indexed by {@code iteration}. */
    public Builder over(Iteration iteration) {
      this.iteration = iteration;
      return this;
    }

    public Builder setDefinition(ExpressionArgument definition) {
      this.definition = Expression.copyOf(definition);
      return this;
    }

    public ImplicitVariable build(NameRegistry registry) {
      if (definition == null) {
        throw new ModelingException("ImplicitVariable.build", "no definition for " + name);
      }
      ImplicitVariable variable = new ImplicitVariable(iteration, definition);
      variable.name = registry.registerOrGenerate(name, "impvar", variable);
      return variable;
    }
  }

  public static Builder newBuilder(String name) {
    return new Builder(name);
  }

  private ImplicitVariable(Iteration iteration, Expression definition) {
    this.iteration = iteration;
    this.definition = definition;
  }

  @Override
  public String getName() {
    return name;
  }

  public boolean isIndexed() {
    return iteration != null;
  }

  public Expression getDefinition() {
    return definition;
  }

  /** Returns the entry {@code z[key]} of an indexed implicit variable. */
  public IndexedReference get(Object... key) {
    if (iteration == null) {
      throw new ModelingException("ImplicitVariable.get", name + " is not indexed");
    }
    Key k = Key.of(key);
    if (k.size() != iteration.getIterators().size()) {
      throw new ModelingException(
          "ImplicitVariable.get", name + " expects " + iteration.getIterators().size()
              + " key components, got " + k.size());
    }
    return new IndexedReference(this, k);
  }

  @Override
  public String render(NumberFormatter formatter) {
    return name;
  }

  /** Evaluates the definition of a scalar implicit variable. */
  @Override
  public double evaluate() {
    if (iteration != null) {
      throw new UnsupportedModelException(
          "ImplicitVariable.evaluate", name + " is indexed, evaluate an entry instead");
    }
    return definition.getValue();
  }

  @Override
  public boolean isSymbolic() {
    return iteration != null || definition.isSymbolic();
  }

  @Override
  public Expression toExpression() {
    if (iteration != null) {
      throw new ModelingException(
          "ImplicitVariable.toExpression", name + " is indexed, use get() to reference an entry");
    }
    return Expression.of(this);
  }

  @Override
  public String toDeclaration(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder("impvar ").append(name);
    if (iteration != null) {
      sb.append(' ').append(iteration.render(formatter));
    }
    return sb.append(" = ").append(definition.render(formatter)).append(';').toString();
  }

  @Override
  public String toString() {
    return name;
  }

  private String name;
  private final Iteration iteration;
  private final Expression definition;
}
