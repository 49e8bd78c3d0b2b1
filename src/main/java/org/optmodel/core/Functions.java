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

/** Static helpers calling the built-in functions, e.g. {@code Functions.sin(x.plus(1))}. */
public final class Functions {
  public static Expression abs(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.ABS, arg);
  }

  public static Expression log(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.LOG, arg);
  }

  public static Expression log2(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.LOG2, arg);
  }

  public static Expression log10(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.LOG10, arg);
  }

  public static Expression exp(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.EXP, arg);
  }

  public static Expression sqrt(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.SQRT, arg);
  }

  public static Expression mod(ExpressionArgument dividend, ExpressionArgument divisor) {
    return FunctionTerm.call(MathFunction.MOD, dividend, divisor);
  }

  /** Integer part, truncated toward zero. */
  public static Expression toInt(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.INT, arg);
  }

  public static Expression sign(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.SIGN, arg);
  }

  public static Expression max(ExpressionArgument... args) {
    return FunctionTerm.call(MathFunction.MAX, args);
  }

  public static Expression min(ExpressionArgument... args) {
    return FunctionTerm.call(MathFunction.MIN, args);
  }

  public static Expression sin(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.SIN, arg);
  }

  public static Expression cos(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.COS, arg);
  }

  public static Expression tan(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.TAN, arg);
  }

  public static Expression sinh(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.SINH, arg);
  }

  public static Expression cosh(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.COSH, arg);
  }

  public static Expression tanh(ExpressionArgument arg) {
    return FunctionTerm.call(MathFunction.TANH, arg);
  }

  private Functions() {}
}
