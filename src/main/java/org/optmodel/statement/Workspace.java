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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.optmodel.Config;
import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.SubmissionException;
import org.optmodel.core.Constraint;
import org.optmodel.core.ConstraintGroup;
import org.optmodel.core.Declaration;
import org.optmodel.core.ExpressionArgument;
import org.optmodel.core.Objective;
import org.optmodel.core.ProgramElement;
import org.optmodel.core.Sense;
import org.optmodel.core.Variable;
import org.optmodel.core.VariableGroup;
import org.optmodel.format.OptmodelFormat;
import org.optmodel.session.EngineResponse;
import org.optmodel.session.ResultBlock;
import org.optmodel.session.Session;
import org.optmodel.session.SolutionReader;
import org.optmodel.session.Submission;
import org.optmodel.symbolic.ImplicitVariable;
import org.optmodel.symbolic.IndexSet;
import org.optmodel.symbolic.Iteration;
import org.optmodel.symbolic.Parameter;
import org.optmodel.symbolic.ParameterGroup;

/**
 * An ordered program of declarations and statements executed as one unit on the engine.
 *
 * <p>A workspace moves through {@link State#BUILDING}, {@link State#SERIALIZED} (once its text is
 * generated, after which nothing can be added), {@link State#SUBMITTED} and finally
 * {@link State#COMPLETED} or {@link State#FAILED}. On completion, the result blocks of the
 * response are handed to the top-level {@code solve} and {@code print} statements in program
 * order.
 */
public final class Workspace implements StatementContainer {
  private static final Logger logger = Logger.getLogger(Workspace.class.getName());

  /** Lifecycle of a workspace. */
  public enum State {
    BUILDING,
    SERIALIZED,
    SUBMITTED,
    COMPLETED,
    FAILED
  }

  public Workspace(String name) {
    this(name, Config.getDefault());
  }

  public Workspace(String name, Config config) {
    this(name, config, new NameRegistry());
  }

  public Workspace(String name, Config config, NameRegistry registry) {
    this.name = name;
    this.config = config;
    this.registry = registry;
    logger.info("Initialized workspace " + name);
  }

  public String getName() {
    return name;
  }

  public Config getConfig() {
    return config;
  }

  /** Returns the registry that components of this workspace must be built with. */
  public NameRegistry getRegistry() {
    return registry;
  }

  public State getState() {
    return state;
  }

  /** Appends a declaration built with {@link #getRegistry()}. */
  public <T extends Declaration> T declare(T declaration) {
    checkBuilding("Workspace.declare");
    Object owner = registry.lookup(declaration.getName()).orElse(null);
    if (owner != declaration) {
      throw new ModelingException("Workspace.declare",
          declaration.getName() + " is not registered in workspace " + name);
    }
    elements.add(declaration);
    return declaration;
  }

  @Override
  public <T extends Statement> T add(T statement) {
    checkBuilding("Workspace.add");
    elements.add(statement);
    return statement;
  }

  public IndexSet addSet(IndexSet.Builder builder) {
    return declare(builder.build(registry));
  }

  public Parameter addParameter(Parameter.Builder builder) {
    return declare(builder.build(registry));
  }

  public ParameterGroup addParameterGroup(ParameterGroup.Builder builder) {
    return declare(builder.build(registry));
  }

  public ImplicitVariable addImplicitVariable(ImplicitVariable.Builder builder) {
    return declare(builder.build(registry));
  }

  public Variable addVariable(Variable.Builder builder) {
    return declare(builder.build(registry));
  }

  public VariableGroup addVariables(VariableGroup.Builder builder) {
    return declare(builder.build(registry));
  }

  public Constraint addConstraint(Constraint constraint, String constraintName) {
    return declare(constraint.register(registry, constraintName));
  }

  /** Declares an abstract constraint group instantiating {@code template} over the iteration. */
  public ConstraintGroup addConstraints(Iteration iteration, Constraint template,
      String groupName) {
    return declare(ConstraintGroup.over(registry, groupName, iteration, template));
  }

  public Objective addObjective(ExpressionArgument expression, Sense sense,
      String objectiveName) {
    return declare(Objective.create(registry, expression, sense, objectiveName));
  }

  /** Appends {@code solve} with the given options. */
  public SolveStatement solve(SolveOptions options) {
    return add(new SolveStatement(options));
  }

  /** Appends {@code print} of the given items. */
  public PrintStatement print(Object... items) {
    return add(PrintStatement.of(items));
  }

  /** Returns the declarations and statements, in program order. */
  public List<ProgramElement> getElements() {
    return Collections.unmodifiableList(elements);
  }

  @Override
  public List<Statement> getStatements() {
    List<Statement> statements = new ArrayList<>();
    for (ProgramElement element : elements) {
      if (element instanceof Statement) {
        statements.add((Statement) element);
      }
    }
    return Collections.unmodifiableList(statements);
  }

  /**
   * Generates the program text. The first call freezes the workspace: later additions raise
   * {@link IllegalStateException}.
   */
  public String toText() {
    String text = OptmodelFormat.toText(this);
    if (state == State.BUILDING) {
      state = State.SERIALIZED;
      for (ProgramElement element : elements) {
        if (element instanceof Statement) {
          ((Statement) element).seal();
        }
      }
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Generated " + text.length() + " characters for workspace " + name);
    }
    return text;
  }

  /**
   * Submits the whole program and distributes the result blocks.
   *
   * @throws SubmissionException if the transport fails or the engine reports a failure; values
   *     already held by variables and constraints are left untouched
   */
  public EngineResponse submit(Session session) {
    if (state != State.BUILDING && state != State.SERIALIZED) {
      throw new IllegalStateException(
          "Workspace.submit: workspace " + name + " is already " + state);
    }
    String text = toText();
    state = State.SUBMITTED;
    logger.info("Submitting workspace " + name);
    EngineResponse response;
    try {
      response = session.submit(Submission.ofProgram(name, text));
    } catch (RuntimeException e) {
      state = State.FAILED;
      diagnostic = String.valueOf(e.getMessage());
      throw new SubmissionException("Workspace.submit", diagnostic, e);
    }
    if (!response.isSuccessful()) {
      state = State.FAILED;
      diagnostic = response.getDiagnostic();
      throw new SubmissionException("Workspace.submit", diagnostic);
    }
    this.response = response;
    distribute(response.getBlocks());
    state = State.COMPLETED;
    logger.info("Workspace " + name + " completed with " + response.getBlocks().size()
        + " result blocks");
    return response;
  }

  private void distribute(ImmutableList<ResultBlock> blocks) {
    List<Statement> targets = new ArrayList<>();
    for (ProgramElement element : elements) {
      if (element instanceof SolveStatement || element instanceof PrintStatement) {
        targets.add((Statement) element);
      }
    }
    if (targets.size() != blocks.size()) {
      logger.warning("Workspace " + name + " has " + targets.size()
          + " solve and print statements but received " + blocks.size() + " result blocks");
    }
    SolutionReader reader = new SolutionReader(config);
    int count = Math.min(targets.size(), blocks.size());
    for (int i = 0; i < count; i++) {
      ResultBlock block = blocks.get(i);
      Statement target = targets.get(i);
      if (target instanceof PrintStatement) {
        ((PrintStatement) target).setResult(block);
        continue;
      }
      SolveStatement solve = (SolveStatement) target;
      solve.setResult(block);
      reader.apply(block, SolutionReader.indexVariables(elements),
          SolutionReader.indexConstraints(elements));
      Objective objective = solvedObjective(solve.getOptions());
      if (objective != null) {
        objective.setValue(block.getObjectiveValue());
      }
    }
  }

  /** The objective a solve optimizes: the selected one, or the last declared one. */
  private Objective solvedObjective(SolveOptions options) {
    if (options.isNoObjective() || options.getObjectives().size() > 1) {
      return null;
    }
    if (options.getObjectives().size() == 1) {
      return options.getObjectives().get(0);
    }
    Objective last = null;
    for (ProgramElement element : elements) {
      if (element instanceof Objective) {
        last = (Objective) element;
      }
    }
    return last;
  }

  /** Returns the response of a completed submission, or null. */
  public EngineResponse getResponse() {
    return response;
  }

  /** Returns the diagnostic of a failed submission, or null. */
  public String getDiagnostic() {
    return diagnostic;
  }

  private void checkBuilding(String methodName) {
    if (state != State.BUILDING) {
      throw new IllegalStateException(
          methodName + ": workspace " + name + " is " + state + ", no element can be added");
    }
  }

  private final String name;
  private final Config config;
  private final NameRegistry registry;
  private final List<ProgramElement> elements = new ArrayList<>();
  private State state = State.BUILDING;
  private EngineResponse response;
  private String diagnostic;
}
