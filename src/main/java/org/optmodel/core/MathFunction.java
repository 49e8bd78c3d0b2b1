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

import java.util.function.ToDoubleFunction;

/** Built-in functions of the target language, also evaluated on the client. */
public enum MathFunction {
  ABS("abs", 1, 1, args -> Math.abs(args[0])),
  LOG("log", 1, 1, args -> Math.log(args[0])),
  LOG2("log2", 1, 1, args -> Math.log(args[0]) / Math.log(2.0)),
  LOG10("log10", 1, 1, args -> Math.log10(args[0])),
  EXP("exp", 1, 1, args -> Math.exp(args[0])),
  SQRT("sqrt", 1, 1, args -> Math.sqrt(args[0])),
  MOD("mod", 2, 2, args -> args[0] % args[1]),
  INT("int", 1, 1, args -> args[0] < 0 ? Math.ceil(args[0]) : Math.floor(args[0])),
  SIGN("sign", 1, 1, args -> Math.signum(args[0])),
  MAX("max", 1, Integer.MAX_VALUE, args -> {
    double result = Double.NEGATIVE_INFINITY;
    for (double arg : args) {
      result = Math.max(result, arg);
    }
    return result;
  }),
  MIN("min", 1, Integer.MAX_VALUE, args -> {
    double result = Double.POSITIVE_INFINITY;
    for (double arg : args) {
      result = Math.min(result, arg);
    }
    return result;
  }),
  SIN("sin", 1, 1, args -> Math.sin(args[0])),
  COS("cos", 1, 1, args -> Math.cos(args[0])),
  TAN("tan", 1, 1, args -> Math.tan(args[0])),
  SINH("sinh", 1, 1, args -> Math.sinh(args[0])),
  COSH("cosh", 1, 1, args -> Math.cosh(args[0])),
  TANH("tanh", 1, 1, args -> Math.tanh(args[0]));

  MathFunction(String keyword, int minArgs, int maxArgs, ToDoubleFunction<double[]> evaluator) {
    this.keyword = keyword;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.evaluator = evaluator;
  }

  public String getKeyword() {
    return keyword;
  }

  public int getMinArgs() {
    return minArgs;
  }

  public int getMaxArgs() {
    return maxArgs;
  }

  public double apply(double... args) {
    return evaluator.applyAsDouble(args);
  }

  private final String keyword;
  private final int minArgs;
  private final int maxArgs;
  private final ToDoubleFunction<double[]> evaluator;
}
