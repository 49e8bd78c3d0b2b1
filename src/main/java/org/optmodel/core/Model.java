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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.optmodel.Config;
import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.SubmissionException;
import org.optmodel.format.FormatOptions;
import org.optmodel.format.MatrixFormat;
import org.optmodel.format.MatrixModel;
import org.optmodel.format.OptmodelFormat;
import org.optmodel.session.EngineResponse;
import org.optmodel.session.ResultBlock;
import org.optmodel.session.Session;
import org.optmodel.session.SolutionReader;
import org.optmodel.session.Submission;
import org.optmodel.statement.SolveOptions;
import org.optmodel.statement.Statement;
import org.optmodel.symbolic.ImplicitVariable;
import org.optmodel.symbolic.IndexSet;
import org.optmodel.symbolic.Iteration;
import org.optmodel.symbolic.Parameter;
import org.optmodel.symbolic.ParameterGroup;

/**
 * Main modeling class.
 *
 * <p>A model holds, in insertion order, the variables, constraints, objectives, sets, parameters
 * and statements of one optimization problem. The order is significant: it is the order of the
 * generated declarations and of the matrix rows and columns. Components are held by reference,
 * so a variable included in two models is a single object.
 *
 * <p>Each model owns a {@link NameRegistry}; components must be created with {@link
 * #getRegistry()} or through the factory methods of the model.
 */
public final class Model {
  private static final Logger logger = Logger.getLogger(Model.class.getName());

  public Model(String name) {
    this(name, Config.getDefault());
  }

  public Model(String name, Config config) {
    this(name, config, new NameRegistry());
  }

  public Model(String name, Config config, NameRegistry registry) {
    this.name = name;
    this.config = config;
    this.registry = registry;
    logger.info("Initialized model " + name);
  }

  public String getName() {
    return name;
  }

  public Config getConfig() {
    return config;
  }

  public NameRegistry getRegistry() {
    return registry;
  }

  // Variables.

  /** Creates a continuous variable with domain [lb, ub]. */
  public Variable newNumVar(double lb, double ub, String name) {
    return addVariable(Variable.newBuilder(name).setBounds(lb, ub));
  }

  /** Creates an integer variable with domain [lb, ub]. */
  public Variable newIntVar(double lb, double ub, String name) {
    return addVariable(Variable.newBuilder(name).setType(VarType.INTEGER).setBounds(lb, ub));
  }

  /** Creates a binary variable with the given name. */
  public Variable newBoolVar(String name) {
    return addVariable(Variable.newBuilder(name).setType(VarType.BINARY));
  }

  /** Creates a continuous variable with the default bounds [0, inf). */
  public Variable addVariable(String name) {
    return addVariable(Variable.newBuilder(name));
  }

  public Variable addVariable(Variable.Builder builder) {
    return append(builder.build(registry));
  }

  public VariableGroup addVariables(VariableGroup.Builder builder) {
    return append(builder.build(registry));
  }

  // Constraints.

  /** Adds {@code constraint}, under {@code name} or a generated name if empty. */
  public Constraint addConstraint(Constraint constraint, String name) {
    checkNotIncluded("Model.addConstraint", constraint);
    if (constraint.getGroup() != null) {
      throw new ModelingException("Model.addConstraint",
          constraint.getName() + " belongs to group " + constraint.getGroup().getName());
    }
    return append(constraint.register(registry, name));
  }

  public Constraint addConstraint(Constraint constraint) {
    return addConstraint(constraint, "");
  }

  /** Adds a group with one constraint per key, generated by {@code generator}. */
  public ConstraintGroup addConstraints(Iterable<?> keys, Function<Key, Constraint> generator,
      String name) {
    return append(ConstraintGroup.of(registry, name, keys, generator));
  }

  /** Adds an abstract group instantiating {@code template} over the iteration. */
  public ConstraintGroup addConstraints(Iteration iteration, Constraint template, String name) {
    return append(ConstraintGroup.over(registry, name, iteration, template));
  }

  /** Adds {@code lb <= expr <= ub}. */
  public Constraint addLinearConstraint(ExpressionArgument expr, double lb, double ub) {
    if (lb == Double.NEGATIVE_INFINITY) {
      return addLessOrEqual(expr, ub);
    }
    if (ub == Double.POSITIVE_INFINITY) {
      return addGreaterOrEqual(expr, lb);
    }
    if (lb == ub) {
      return addEquality(expr, lb);
    }
    return addConstraint(expr.eq(lb, ub));
  }

  /** Adds {@code expr == value}. */
  public Constraint addEquality(ExpressionArgument expr, double value) {
    return addConstraint(expr.eq(value));
  }

  /** Adds {@code left == right}. */
  public Constraint addEquality(ExpressionArgument left, ExpressionArgument right) {
    return addConstraint(left.eq(right));
  }

  /** Adds {@code expr <= value}. */
  public Constraint addLessOrEqual(ExpressionArgument expr, double value) {
    return addConstraint(expr.le(value));
  }

  /** Adds {@code left <= right}. */
  public Constraint addLessOrEqual(ExpressionArgument left, ExpressionArgument right) {
    return addConstraint(left.le(right));
  }

  /** Adds {@code expr >= value}. */
  public Constraint addGreaterOrEqual(ExpressionArgument expr, double value) {
    return addConstraint(expr.ge(value));
  }

  /** Adds {@code left >= right}. */
  public Constraint addGreaterOrEqual(ExpressionArgument left, ExpressionArgument right) {
    return addConstraint(left.ge(right));
  }

  // Objectives.

  /** Replaces every objective of the model by {@code expression}. */
  public Objective setObjective(ExpressionArgument expression, Sense sense, String name) {
    for (Objective previous : objectives) {
      elements.remove(previous);
      registry.release(previous.getName(), previous);
    }
    objectives.clear();
    return appendObjective(expression, sense, name);
  }

  /** Adds an objective, which becomes the one optimized by a single-objective solve. */
  public Objective appendObjective(ExpressionArgument expression, Sense sense, String name) {
    Objective objective = Objective.create(registry, expression, sense, name);
    objectives.add(objective);
    return append(objective);
  }

  /** Minimize expression. */
  public Objective minimize(ExpressionArgument expression) {
    return setObjective(expression, Sense.MINIMIZE, "");
  }

  /** Maximize expression. */
  public Objective maximize(ExpressionArgument expression) {
    return setObjective(expression, Sense.MAXIMIZE, "");
  }

  /** Sets the objective with the configured default sense. */
  public Objective setObjective(ExpressionArgument expression, String name) {
    return setObjective(expression, config.getDefaultSense(), name);
  }

  /** Returns the objective optimized by a single-objective solve, or null. */
  public Objective getObjective() {
    return objectives.isEmpty() ? null : objectives.get(objectives.size() - 1);
  }

  /** Returns all objectives, in registration order. */
  public ImmutableList<Objective> getObjectives() {
    return ImmutableList.copyOf(objectives);
  }

  // Abstract components.

  public IndexSet addSet(IndexSet.Builder builder) {
    return append(builder.build(registry));
  }

  public Parameter addParameter(Parameter.Builder builder) {
    return append(builder.build(registry));
  }

  public ParameterGroup addParameterGroup(ParameterGroup.Builder builder) {
    return append(builder.build(registry));
  }

  public ImplicitVariable addImplicitVariable(ImplicitVariable.Builder builder) {
    return append(builder.build(registry));
  }

  // Statements.

  /** Adds a statement executed before the solve, in insertion order with the declarations. */
  public <T extends Statement> T addStatement(T statement) {
    elements.add(statement);
    return statement;
  }

  /** Adds a statement executed after the solve. */
  public <T extends Statement> T addPostSolveStatement(T statement) {
    postSolveStatements.add(statement);
    return statement;
  }

  public List<Statement> getPostSolveStatements() {
    return Collections.unmodifiableList(postSolveStatements);
  }

  // Shared components.

  /**
   * Includes existing components: variables, groups, constraints, objectives, abstract components,
   * statements or every component of another model. Their names are registered in this model.
   *
   * @throws ModelingException if a name collides with a different component of this model
   */
  public void include(Object... components) {
    for (Object component : components) {
      if (component instanceof Model) {
        Model other = (Model) component;
        include(other.elements.toArray());
        droppedConstraints.addAll(other.droppedConstraints);
        postSolveStatements.addAll(other.postSolveStatements);
      } else if (component instanceof Statement) {
        addStatement((Statement) component);
      } else if (component instanceof Declaration) {
        includeDeclaration((Declaration) component);
      } else {
        throw new ModelingException("Model.include",
            "cannot include " + component.getClass().getSimpleName());
      }
    }
  }

  private void includeDeclaration(Declaration declaration) {
    if (elements.contains(declaration)) {
      return;
    }
    if (declaration instanceof Constraint && ((Constraint) declaration).getGroup() != null) {
      throw new ModelingException("Model.include",
          "include group " + ((Constraint) declaration).getGroup().getName() + " instead of "
              + declaration.getName());
    }
    registry.register(declaration.getName(), declaration);
    if (declaration instanceof VariableGroup) {
      for (Variable member : (VariableGroup) declaration) {
        registry.register(member.getName(), member);
      }
    } else if (declaration instanceof ConstraintGroup) {
      for (Constraint member : (ConstraintGroup) declaration) {
        registry.register(member.getName(), member);
      }
    } else if (declaration instanceof Objective) {
      objectives.add((Objective) declaration);
    }
    elements.add(declaration);
  }

  // Dropping components.

  /**
   * Drops a constraint. A standalone constraint leaves the model; a group member stays declared
   * and is removed by a {@code drop} statement.
   */
  public void dropConstraint(Constraint constraint) {
    if (constraint.getGroup() != null) {
      if (!elements.contains(constraint.getGroup())) {
        throw new ModelingException("Model.dropConstraint",
            constraint.getName() + " is not part of model " + name);
      }
      droppedConstraints.add(constraint);
      return;
    }
    removeElement("Model.dropConstraint", constraint);
  }

  /** Drops a whole constraint group. */
  public void dropConstraints(ConstraintGroup group) {
    removeElement("Model.dropConstraints", group);
    for (Constraint member : group) {
      droppedConstraints.remove(member);
    }
  }

  /** Undoes {@link #dropConstraint}. */
  public void restoreConstraint(Constraint constraint) {
    if (droppedConstraints.remove(constraint)) {
      return;
    }
    include(constraint);
  }

  /** Returns the group members currently dropped, in drop order. */
  public ImmutableList<Constraint> getDroppedConstraints() {
    return ImmutableList.copyOf(droppedConstraints);
  }

  /** Removes a variable or a variable group from the model. */
  public void dropVariable(Declaration variable) {
    if (!(variable instanceof Variable) && !(variable instanceof VariableGroup)) {
      throw new ModelingException("Model.dropVariable", variable.getName() + " is not a variable");
    }
    removeElement("Model.dropVariable", variable);
  }

  private void removeElement(String methodName, Declaration declaration) {
    if (!elements.remove(declaration)) {
      throw new ModelingException(methodName,
          declaration.getName() + " is not part of model " + name);
    }
    registry.release(declaration.getName(), declaration);
    if (declaration instanceof VariableGroup) {
      for (Variable member : (VariableGroup) declaration) {
        registry.release(member.getName(), member);
      }
    } else if (declaration instanceof ConstraintGroup) {
      for (Constraint member : (ConstraintGroup) declaration) {
        registry.release(member.getName(), member);
      }
    }
  }

  // Lookups.

  /** Returns the declarations and pre-solve statements, in insertion order. */
  public List<ProgramElement> getElements() {
    return Collections.unmodifiableList(elements);
  }

  /** Returns every concrete variable, group members included, in insertion order. */
  public ImmutableList<Variable> getVariables() {
    return ImmutableList.copyOf(SolutionReader.indexVariables(elements).values());
  }

  /** Returns every concrete constraint, group members included, in insertion order. */
  public ImmutableList<Constraint> getConstraints() {
    return ImmutableList.copyOf(SolutionReader.indexConstraints(elements).values());
  }

  /** Returns the variable named {@code name}, e.g. {@code x} or {@code y[0,a]}. */
  public Variable getVariable(String name) {
    Variable variable = SolutionReader.indexVariables(elements).get(name);
    if (variable == null) {
      throw new ModelingException("Model.getVariable", "model " + this.name
          + " has no variable " + name);
    }
    return variable;
  }

  /** Returns the constraint named {@code name}, e.g. {@code c} or {@code cap_0}. */
  public Constraint getConstraint(String name) {
    Constraint constraint = SolutionReader.indexConstraints(elements).get(name);
    if (constraint == null) {
      throw new ModelingException("Model.getConstraint", "model " + this.name
          + " has no constraint " + name);
    }
    return constraint;
  }

  /** Returns the number of concrete variables. */
  public int numVariables() {
    return getVariables().size();
  }

  /** Returns the number of concrete constraints. */
  public int numConstraints() {
    return getConstraints().size();
  }

  // Export.

  /** Returns the program text with a {@code solve} statement. */
  public String toText() {
    return toText(FormatOptions.getDefault());
  }

  public String toText(FormatOptions options) {
    String text = OptmodelFormat.toText(this, options);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Generated " + text.length() + " characters for model " + name);
    }
    return text;
  }

  /** Returns the matrix form of a concrete linear or mixed-integer model. */
  public MatrixModel toMatrix() {
    return MatrixFormat.toMatrix(this);
  }

  /** Exports the model in free MPS format. */
  public String exportToMpsString() {
    return toMatrix().toMpsString(config.getFormatter());
  }

  // Solve.

  public ResultBlock solve(Session session) {
    return solve(session, SolveOptions.getDefault());
  }

  /**
   * Submits the model, waits for the response and copies the returned values into the variables,
   * constraints and objective.
   *
   * @throws SubmissionException if the transport fails or the engine reports a failure; values
   *     from earlier solves are left untouched
   */
  public ResultBlock solve(Session session, SolveOptions options) {
    Submission submission;
    if (options.isMatrixFormat()) {
      submission = Submission.ofMatrix(name, toMatrix(), options.getSolver(),
          options.getOptions());
    } else {
      submission = Submission.ofProgram(name, toText(FormatOptions.newBuilder()
          .setSolveOptions(options)
          .setParseResults(true)
          .build()));
    }
    logger.info("Submitting model " + name + " as " + submission.getKind());
    EngineResponse response;
    try {
      response = session.submit(submission);
    } catch (RuntimeException e) {
      throw new SubmissionException("Model.solve", String.valueOf(e.getMessage()), e);
    }
    if (!response.isSuccessful()) {
      throw new SubmissionException("Model.solve", response.getDiagnostic());
    }
    if (response.getBlocks().isEmpty()) {
      throw new SubmissionException("Model.solve", "engine returned no result");
    }
    ResultBlock block = response.getBlocks().get(0);
    new SolutionReader(config).apply(block, SolutionReader.indexVariables(elements),
        SolutionReader.indexConstraints(elements));
    Objective objective = solvedObjective(options);
    if (objective != null) {
      objective.setValue(block.getObjectiveValue());
    }
    lastResult = block;
    logger.info("Model " + name + " solved with status " + block.getSolutionStatus());
    return block;
  }

  private Objective solvedObjective(SolveOptions options) {
    if (options.isNoObjective() || options.getObjectives().size() > 1) {
      return null;
    }
    return options.getObjectives().isEmpty() ? getObjective() : options.getObjectives().get(0);
  }

  /** Returns the status of the last solve, or null. */
  public String getSolutionStatus() {
    return lastResult == null ? null : lastResult.getSolutionStatus();
  }

  /** Returns the solution summary of the last solve, empty before a solve. */
  public ImmutableMap<String, String> getSolutionSummary() {
    return lastResult == null ? ImmutableMap.of() : lastResult.getSolutionSummary();
  }

  /** Returns the problem summary of the last solve, empty before a solve. */
  public ImmutableMap<String, String> getProblemSummary() {
    return lastResult == null ? ImmutableMap.of() : lastResult.getProblemSummary();
  }

  /** Returns the objective value of the last solve, NaN before a solve. */
  public double getObjectiveValue() {
    return lastResult == null ? Double.NaN : lastResult.getObjectiveValue();
  }

  /** Resets the values and duals of every component, and forgets the last result. */
  public void clearSolution() {
    for (ProgramElement element : elements) {
      if (element instanceof Variable) {
        ((Variable) element).clearSolution();
      } else if (element instanceof VariableGroup) {
        ((VariableGroup) element).clearSolution();
      } else if (element instanceof Constraint) {
        ((Constraint) element).clearSolution();
      } else if (element instanceof ConstraintGroup) {
        ((ConstraintGroup) element).clearSolution();
      } else if (element instanceof Objective) {
        ((Objective) element).clearSolution();
      }
    }
    lastResult = null;
  }

  private <T extends Declaration> T append(T declaration) {
    elements.add(declaration);
    return declaration;
  }

  private void checkNotIncluded(String methodName, Declaration declaration) {
    if (elements.contains(declaration)) {
      throw new ModelingException(methodName,
          declaration.getName() + " is already part of model " + name);
    }
  }

  @Override
  public String toString() {
    return "Model(" + name + ", " + numVariables() + " variables, " + numConstraints()
        + " constraints)";
  }

  private final String name;
  private final Config config;
  private final NameRegistry registry;
  private final List<ProgramElement> elements = new ArrayList<>();
  private final List<Objective> objectives = new ArrayList<>();
  private final Set<Constraint> droppedConstraints = new LinkedHashSet<>();
  private final List<Statement> postSolveStatements = new ArrayList<>();
  private ResultBlock lastResult;
}
