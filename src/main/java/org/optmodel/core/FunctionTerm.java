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
import java.util.ArrayList;
import java.util.List;
import org.optmodel.ModelingException;
import org.optmodel.NumberFormatter;

/**
 * A call to a built-in function, treated as an atomic factor: {@code 2 * sin(x) + sin(x)}
 * collapses to {@code 3 * sin(x)}.
 */
public final class FunctionTerm implements Term {
  /**
   * Returns the expression {@code function(arguments)}. Constant arguments are evaluated at
   * once.
   */
  public static Expression call(MathFunction function, ExpressionArgument... arguments) {
    if (arguments.length < function.getMinArgs() || arguments.length > function.getMaxArgs()) {
      throw new ModelingException(
          "FunctionTerm.call",
          function.getKeyword() + " takes between " + function.getMinArgs() + " and "
              + function.getMaxArgs() + " arguments, got " + arguments.length);
    }
    List<Expression> frozen = new ArrayList<>();
    boolean constant = true;
    for (ExpressionArgument argument : arguments) {
      Expression e = Expression.copyOf(argument);
      constant &= e.isConstant();
      frozen.add(e);
    }
    if (constant) {
      double[] values = new double[frozen.size()];
      for (int i = 0; i < values.length; ++i) {
        values[i] = frozen.get(i).getConstant();
      }
      double result = function.apply(values);
      if (Double.isNaN(result) || Double.isInfinite(result)) {
        throw new ModelingException(
            "FunctionTerm.call", function.getKeyword() + " is undefined for these arguments");
      }
      return Expression.constant(result);
    }
    return Expression.of(new FunctionTerm(function, ImmutableList.copyOf(frozen)));
  }

  private FunctionTerm(MathFunction function, ImmutableList<Expression> arguments) {
    this.function = function;
    this.arguments = arguments;
  }

  public MathFunction getFunction() {
    return function;
  }

  public ImmutableList<Expression> getArguments() {
    return arguments;
  }

  @Override
  public String render(NumberFormatter formatter) {
    List<String> rendered = new ArrayList<>();
    for (Expression argument : arguments) {
      rendered.add(argument.render(formatter));
    }
    return function.getKeyword() + "(" + String.join(", ", rendered) + ")";
  }

  @Override
  public double evaluate() {
    double[] values = new double[arguments.size()];
    for (int i = 0; i < values.length; ++i) {
      values[i] = arguments.get(i).getValue();
    }
    return function.apply(values);
  }

  @Override
  public boolean isSymbolic() {
    for (Expression argument : arguments) {
      if (argument.isSymbolic()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof FunctionTerm)) {
      return false;
    }
    FunctionTerm other = (FunctionTerm) o;
    if (function != other.function || arguments.size() != other.arguments.size()) {
      return false;
    }
    for (int i = 0; i < arguments.size(); ++i) {
      if (!arguments.get(i).sameStructure(other.arguments.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = function.hashCode();
    for (Expression argument : arguments) {
      hash = 31 * hash + argument.structuralHash();
    }
    return hash;
  }

  @Override
  public String toString() {
    return render(new NumberFormatter(12));
  }

  private final MathFunction function;
  private final ImmutableList<Expression> arguments;
}
