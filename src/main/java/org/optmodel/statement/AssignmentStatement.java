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

import org.optmodel.ProgramWriter;
import org.optmodel.core.Expression;
import org.optmodel.core.ExpressionArgument;

/**
 * Assigns a value on the engine: {@code p = 5;}, {@code x[i].lb = 2;} or {@code x = 0.5;} for the
 * current value of a variable.
 */
public final class AssignmentStatement implements Statement {
  public static AssignmentStatement assign(Object target, ExpressionArgument value) {
    return new AssignmentStatement(target, "", Expression.copyOf(value));
  }

  public static AssignmentStatement assign(Object target, double value) {
    return assign(target, Expression.constant(value));
  }

  public static AssignmentStatement setLowerBound(Object target, ExpressionArgument value) {
    return new AssignmentStatement(target, ".lb", Expression.copyOf(value));
  }

  public static AssignmentStatement setLowerBound(Object target, double value) {
    return setLowerBound(target, Expression.constant(value));
  }

  public static AssignmentStatement setUpperBound(Object target, ExpressionArgument value) {
    return new AssignmentStatement(target, ".ub", Expression.copyOf(value));
  }

  public static AssignmentStatement setUpperBound(Object target, double value) {
    return setUpperBound(target, Expression.constant(value));
  }

  private AssignmentStatement(Object target, String suffix, Expression value) {
    this.target = target;
    this.suffix = suffix;
    this.value = value;
  }

  @Override
  public void writeTo(ProgramWriter out) {
    out.line(Operands.target(target, out.getFormatter()) + suffix + " = "
        + value.render(out.getFormatter()) + ";");
  }

  private final Object target;
  private final String suffix;
  private final Expression value;
}
