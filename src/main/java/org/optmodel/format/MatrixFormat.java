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

package org.optmodel.format;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.optmodel.UnsupportedModelException;
import org.optmodel.core.Constraint;
import org.optmodel.core.ConstraintGroup;
import org.optmodel.core.Declaration;
import org.optmodel.core.Direction;
import org.optmodel.core.Expression;
import org.optmodel.core.Model;
import org.optmodel.core.Monomial;
import org.optmodel.core.Objective;
import org.optmodel.core.ProgramElement;
import org.optmodel.core.Sense;
import org.optmodel.core.VarType;
import org.optmodel.core.Variable;
import org.optmodel.core.VariableGroup;

/**
 * Converts a concrete linear or mixed-integer model into a {@link MatrixModel}.
 *
 * <p>Columns follow the variable insertion order and rows the constraint insertion order, dropped
 * constraints excluded. Abstract components, statements and nonlinear expressions cannot be
 * represented and raise {@link UnsupportedModelException}.
 */
public final class MatrixFormat {
  private static final Logger logger = Logger.getLogger(MatrixFormat.class.getName());

  /** Name of the fixed column carrying a nonzero objective constant. */
  public static final String OBJECTIVE_CONSTANT_COLUMN = "obj_constant";

  /** Name of the objective row when the model has no objective. */
  public static final String DEFAULT_OBJECTIVE_ROW = "obj";

  public static MatrixModel toMatrix(Model model) {
    checkConcrete(model);
    MatrixModel.Builder builder = new MatrixModel.Builder(model.getName());
    Objective objective = model.getObjective();
    Expression objectiveExpression =
        objective == null ? Expression.constant(0.0) : objective.getExpression();
    checkLinear(objectiveExpression, objective == null ? "objective" : objective.getName());

    Set<Variable> known = new HashSet<>();
    for (Variable variable : model.getVariables()) {
      known.add(variable);
      builder.addColumn(variable.getName(), variable.getType(), variable.getLowerBound(),
          variable.getUpperBound(), objectiveExpression.getCoefficient(variable));
    }
    checkVariables(objectiveExpression, known,
        objective == null ? "objective" : objective.getName());

    double constant = objectiveExpression.getConstant();
    if (objective != null) {
      builder.setObjective(objective.getName(), objective.getSense(), constant);
    }
    if (constant != 0.0) {
      String column = OBJECTIVE_CONSTANT_COLUMN;
      for (int i = 2; builder.hasColumn(column); i++) {
        column = OBJECTIVE_CONSTANT_COLUMN + "_" + i;
      }
      logger.warning("Objective constant " + constant + " is carried by the fixed column "
          + column);
      builder.addColumn(column, VarType.CONTINUOUS, constant, constant, 1.0);
    }

    Set<Constraint> dropped = new HashSet<>(model.getDroppedConstraints());
    for (Constraint constraint : model.getConstraints()) {
      if (dropped.contains(constraint)) {
        continue;
      }
      Expression body = constraint.getBody();
      checkLinear(body, constraint.getName());
      checkVariables(body, known, constraint.getName());
      int row;
      if (constraint.getDirection() == Direction.RANGE) {
        double lower = constraint.getLower() - body.getConstant();
        double upper = constraint.getUpper() - body.getConstant();
        if (lower == Double.NEGATIVE_INFINITY && upper == Double.POSITIVE_INFINITY) {
          throw new UnsupportedModelException(
              "MatrixFormat.toMatrix", "range constraint " + constraint.getName()
                  + " has no finite bound");
        }
        // A one-sided range is exported as an inequality row.
        if (lower == Double.NEGATIVE_INFINITY) {
          row = builder.addRow(constraint.getName(), Direction.LE, upper, 0.0);
        } else if (upper == Double.POSITIVE_INFINITY) {
          row = builder.addRow(constraint.getName(), Direction.GE, lower, 0.0);
        } else {
          row = builder.addRow(constraint.getName(), Direction.RANGE, lower, upper - lower);
        }
      } else {
        row = builder.addRow(
            constraint.getName(), constraint.getDirection(), constraint.getRhs(), 0.0);
      }
      for (Map.Entry<Monomial, Double> term : body.getTerms().entrySet()) {
        Variable variable = (Variable) term.getKey().asSingleTerm();
        builder.addEntry(row, builder.columnIndex(variable.getName()), term.getValue());
      }
    }
    if (objective == null) {
      String rowName = DEFAULT_OBJECTIVE_ROW;
      for (int i = 2; builder.hasRow(rowName); i++) {
        rowName = DEFAULT_OBJECTIVE_ROW + "_" + i;
      }
      builder.setObjective(rowName, Sense.MINIMIZE, 0.0);
    }
    return builder.build();
  }

  private static void checkConcrete(Model model) {
    for (ProgramElement element : model.getElements()) {
      if (element instanceof VariableGroup && ((VariableGroup) element).isAbstract()
          || element instanceof ConstraintGroup && ((ConstraintGroup) element).isAbstract()) {
        throw new UnsupportedModelException("MatrixFormat.toMatrix",
            "abstract group " + ((Declaration) element).getName() + " has no matrix form");
      }
      if (!(element instanceof Variable || element instanceof VariableGroup
          || element instanceof Constraint || element instanceof ConstraintGroup
          || element instanceof Objective)) {
        String what = element instanceof Declaration
            ? ((Declaration) element).getName() : element.getClass().getSimpleName();
        throw new UnsupportedModelException("MatrixFormat.toMatrix",
            what + " has no matrix form, submit the model as program text");
      }
    }
    if (!model.getPostSolveStatements().isEmpty()) {
      throw new UnsupportedModelException("MatrixFormat.toMatrix",
          "post-solve statements have no matrix form");
    }
    if (model.getObjectives().size() > 1) {
      logger.warning("Model " + model.getName() + " has " + model.getObjectives().size()
          + " objectives, only " + model.getObjective().getName() + " is exported");
    }
  }

  private static void checkLinear(Expression expression, String owner) {
    if (expression.isSymbolic()) {
      throw new UnsupportedModelException(
          "MatrixFormat.toMatrix", owner + " references abstract components");
    }
    if (!expression.isLinear()) {
      throw new UnsupportedModelException(
          "MatrixFormat.toMatrix", owner + " is not linear");
    }
  }

  private static void checkVariables(Expression expression, Set<Variable> known, String owner) {
    for (Variable variable : expression.getVariables()) {
      if (!known.contains(variable)) {
        throw new UnsupportedModelException("MatrixFormat.toMatrix",
            owner + " references " + variable.getName() + ", which is not part of the model");
      }
    }
  }

  private MatrixFormat() {}
}
