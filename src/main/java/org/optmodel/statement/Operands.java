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

import org.optmodel.ModelingException;
import org.optmodel.NumberFormatter;
import org.optmodel.core.Declaration;
import org.optmodel.core.Expression;
import org.optmodel.core.ExpressionArgument;
import org.optmodel.core.Key;
import org.optmodel.core.Term;

/** Rendering of statement operands. */
final class Operands {
  /** Renders an expression, parenthesized if it holds more than one term. */
  static String expression(ExpressionArgument argument, NumberFormatter formatter) {
    Expression expression = argument.toExpression();
    String text = expression.render(formatter);
    return expression.isCompound() ? "(" + text + ")" : text;
  }

  /** Renders a term by reference, a declaration by name and a string as a quoted literal. */
  static String item(Object item, NumberFormatter formatter) {
    if (item instanceof Term) {
      return ((Term) item).render(formatter);
    }
    if (item instanceof Declaration) {
      return ((Declaration) item).getName();
    }
    if (item instanceof ExpressionArgument) {
      return expression((ExpressionArgument) item, formatter);
    }
    if (item instanceof Number) {
      return formatter.format(((Number) item).doubleValue());
    }
    if (item instanceof String) {
      return Key.quote((String) item);
    }
    throw new ModelingException(
        "Operands.item", "cannot render " + item.getClass().getSimpleName() + " in a statement");
  }

  /** Renders an assignable target: a term by reference or a declaration by name. */
  static String target(Object target, NumberFormatter formatter) {
    if (target instanceof Term) {
      return ((Term) target).render(formatter);
    }
    if (target instanceof Declaration) {
      return ((Declaration) target).getName();
    }
    throw new ModelingException(
        "Operands.target", target + " cannot be the target of an assignment");
  }

  private Operands() {}
}
