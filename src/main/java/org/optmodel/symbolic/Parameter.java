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
import org.optmodel.core.Key;
import org.optmodel.core.Term;

/** A scalar parameter resolved on the engine: {@code num p init 5;}. */
public final class Parameter implements Term, ExpressionArgument, Declaration {
  /** Builder for {@link Parameter}. */
  public static final class Builder {
    private final String name;
    private ValueType type = ValueType.NUM;
    private String initText;
    private Double initValue;
    private Expression value;

    private Builder(String name) {
      this.name = name;
    }

    public Builder setType(ValueType type) {
      this.type = type;
      return this;
    }

    /** Default numeric value, overwritable on the engine. */
    public Builder setInit(double init) {
      this.initValue = init;
      this.initText = null;
      return this;
    }

    /** Default string value, overwritable on the engine. */
    public Builder setInit(String init) {
      this.initText = init;
      this.initValue = null;
      return this;
    }

    /** Defining expression: {@code num p = expr;}. */
    public Builder setValue(ExpressionArgument value) {
      this.value = Expression.copyOf(value);
      return this;
    }

    public Parameter build(NameRegistry registry) {
      if (initText != null && type != ValueType.STR) {
        throw new ModelingException(
            "Parameter.build", "string init for numeric parameter " + name);
      }
      Parameter parameter = new Parameter(this);
      parameter.name = registry.registerOrGenerate(name, "p", parameter);
      return parameter;
    }
  }

  public static Builder newBuilder(String name) {
    return new Builder(name);
  }

  private Parameter(Builder builder) {
    this.type = builder.type;
    this.initText = builder.initText;
    this.initValue = builder.initValue;
    this.value = builder.value;
  }

  @Override
  public String getName() {
    return name;
  }

  public ValueType getType() {
    return type;
  }

  /** Returns the default numeric value, or null. */
  public Double getInit() {
    return initValue;
  }

  @Override
  public String render(NumberFormatter formatter) {
    return name;
  }

  @Override
  public double evaluate() {
    throw new UnsupportedModelException(
        "Parameter.evaluate", "parameter " + name + " is only known on the engine");
  }

  @Override
  public boolean isSymbolic() {
    return true;
  }

  @Override
  public Expression toExpression() {
    return Expression.of(this);
  }

  @Override
  public String toDeclaration(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder(type.getKeyword()).append(' ').append(name);
    if (value != null) {
      sb.append(" = ").append(value.render(formatter));
    } else if (initValue != null) {
      sb.append(" init ").append(formatter.format(initValue));
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
  private final ValueType type;
  private final String initText;
  private final Double initValue;
  private final Expression value;
}
