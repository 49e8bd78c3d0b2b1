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

package org.optmodel.statement;

import java.util.ArrayList;
import java.util.List;
import org.optmodel.ModelingException;
import org.optmodel.ProgramWriter;
import org.optmodel.core.Expression;
import org.optmodel.core.ExpressionArgument;

/**
 * Fixes variables to values for the following solves: {@code fix x=3 y[i]=0;}. A target without
 * a value is fixed at its current value.
 */
public final class FixStatement implements Statement {
  /** Builder for {@link FixStatement}. */
  public static final class Builder {
    private final List<Object> targets = new ArrayList<>();
    private final List<Expression> values = new ArrayList<>();

    private Builder() {}

    /** Fixes {@code target}, a variable, a variable group or a member reference. */
    public Builder add(Object target, ExpressionArgument value) {
      targets.add(target);
      values.add(value == null ? null : Expression.copyOf(value));
      return this;
    }

    public Builder add(Object target, double value) {
      return add(target, Expression.constant(value));
    }

    public Builder add(Object target) {
      return add(target, null);
    }

    public FixStatement build() {
      if (targets.isEmpty()) {
        throw new ModelingException("FixStatement.build", "nothing to fix");
      }
      return new FixStatement(new ArrayList<>(targets), new ArrayList<>(values));
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static FixStatement of(Object target, double value) {
    return newBuilder().add(target, value).build();
  }

  private FixStatement(List<Object> targets, List<Expression> values) {
    this.targets = targets;
    this.values = values;
  }

  @Override
  public void writeTo(ProgramWriter out) {
    StringBuilder sb = new StringBuilder("fix");
    for (int i = 0; i < targets.size(); i++) {
      sb.append(' ').append(Operands.target(targets.get(i), out.getFormatter()));
      if (values.get(i) != null) {
        sb.append('=').append(Operands.expression(values.get(i), out.getFormatter()));
      }
    }
    out.line(sb.append(';').toString());
  }

  private final List<Object> targets;
  private final List<Expression> values;
}
