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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.optmodel.ModelingException;
import org.optmodel.NumberFormatter;
import org.optmodel.core.Objective;

/**
 * Options of a {@code solve} statement.
 *
 * <p>Rendered as {@code solve [with S] [obj f | obj (f1 f2) | noobj] [relaxint] [/ k=v ...
 * primalin];}. Option values are numbers, strings, booleans (a true flag renders as its key alone)
 * or maps rendered as {@code key=(a=1,b=2)}.
 */
public final class SolveOptions {
  private static final SolveOptions DEFAULT = newBuilder().build();

  /** Builder for {@link SolveOptions}. */
  public static final class Builder {
    private String solver;
    private final Map<String, Object> options = new LinkedHashMap<>();
    private boolean relaxInt = false;
    private boolean primalIn = false;
    private boolean noObjective = false;
    private boolean matrixFormat = false;
    private final List<Objective> objectives = new ArrayList<>();

    private Builder() {}

    /** Selects the solver, e.g. {@code lp}, {@code milp}, {@code nlp} or {@code blackbox}. */
    public Builder setSolver(String solver) {
      this.solver = solver;
      return this;
    }

    public Builder setOption(String key, Object value) {
      if (key == null || key.isEmpty()) {
        throw new ModelingException("SolveOptions.setOption", "option key must not be empty");
      }
      if (value == null) {
        throw new ModelingException("SolveOptions.setOption", "option " + key + " has no value");
      }
      options.put(key, value);
      return this;
    }

    /** Solves the continuous relaxation of the problem. */
    public Builder setRelaxInt(boolean relaxInt) {
      this.relaxInt = relaxInt;
      return this;
    }

    /** Uses the current variable values as the starting point. */
    public Builder setPrimalIn(boolean primalIn) {
      this.primalIn = primalIn;
      return this;
    }

    /** Solves a feasibility problem, ignoring every objective. */
    public Builder setNoObjective(boolean noObjective) {
      this.noObjective = noObjective;
      return this;
    }

    /** Selects the objective to optimize when the model declares several. */
    public Builder setObjective(Objective objective) {
      objectives.clear();
      objectives.add(objective);
      return this;
    }

    /** Adds an objective of a multi-objective solve, rendered {@code obj (f1 f2)}. */
    public Builder addObjective(Objective objective) {
      objectives.add(objective);
      return this;
    }

    /** Submits the model as a matrix instead of program text. */
    public Builder setMatrixFormat(boolean matrixFormat) {
      this.matrixFormat = matrixFormat;
      return this;
    }

    public SolveOptions build() {
      SolveOptions result = new SolveOptions(this);
      if (result.noObjective && !result.objectives.isEmpty()) {
        throw new ModelingException(
            "SolveOptions.build", "noobj conflicts with the selected objectives");
      }
      return result;
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns options with no solver, no objective selection and no flags. */
  public static SolveOptions getDefault() {
    return DEFAULT;
  }

  private SolveOptions(Builder builder) {
    this.solver = builder.solver;
    this.options = ImmutableMap.copyOf(builder.options);
    this.relaxInt = builder.relaxInt;
    this.primalIn = builder.primalIn;
    this.noObjective = builder.noObjective;
    this.matrixFormat = builder.matrixFormat;
    this.objectives = ImmutableList.copyOf(builder.objectives);
  }

  /** Returns the solver, or null to let the engine choose. */
  public String getSolver() {
    return solver;
  }

  public ImmutableMap<String, Object> getOptions() {
    return options;
  }

  public boolean isRelaxInt() {
    return relaxInt;
  }

  public boolean isPrimalIn() {
    return primalIn;
  }

  public boolean isNoObjective() {
    return noObjective;
  }

  public boolean isMatrixFormat() {
    return matrixFormat;
  }

  public ImmutableList<Objective> getObjectives() {
    return objectives;
  }

  /** Returns whether these options already decide which objective is optimized. */
  public boolean selectsObjective() {
    return noObjective || !objectives.isEmpty();
  }

  /** Returns a copy selecting {@code objective}. */
  public SolveOptions withObjective(Objective objective) {
    Builder builder = toBuilder();
    builder.objectives.add(objective);
    return builder.build();
  }

  public Builder toBuilder() {
    Builder builder = newBuilder()
        .setSolver(solver)
        .setRelaxInt(relaxInt)
        .setPrimalIn(primalIn)
        .setNoObjective(noObjective)
        .setMatrixFormat(matrixFormat);
    builder.options.putAll(options);
    builder.objectives.addAll(objectives);
    return builder;
  }

  /** Renders the {@code solve} statement. */
  public String toSolveText(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder("solve");
    if (solver != null && !solver.isEmpty()) {
      sb.append(" with ").append(solver);
    }
    if (noObjective) {
      sb.append(" noobj");
    } else if (objectives.size() == 1) {
      sb.append(" obj ").append(objectives.get(0).getName());
    } else if (objectives.size() > 1) {
      sb.append(" obj (")
          .append(objectives.stream().map(Objective::getName).collect(Collectors.joining(" ")))
          .append(')');
    }
    if (relaxInt) {
      sb.append(" relaxint");
    }
    StringBuilder trailing = new StringBuilder();
    for (Map.Entry<String, Object> option : options.entrySet()) {
      String rendered = renderOption(option.getKey(), option.getValue(), formatter);
      if (!rendered.isEmpty()) {
        trailing.append(' ').append(rendered);
      }
    }
    if (primalIn) {
      trailing.append(" primalin");
    }
    if (trailing.length() > 0) {
      sb.append(" /").append(trailing);
    }
    return sb.append(';').toString();
  }

  private static String renderOption(String key, Object value, NumberFormatter formatter) {
    if (value instanceof Boolean) {
      return (Boolean) value ? key : "";
    }
    return key + "=" + renderValue(value, formatter);
  }

  private static String renderValue(Object value, NumberFormatter formatter) {
    if (value instanceof Number) {
      return formatter.format(((Number) value).doubleValue());
    }
    if (value instanceof Map) {
      return ((Map<?, ?>) value).entrySet().stream()
          .map(e -> e.getKey() + "=" + renderValue(e.getValue(), formatter))
          .collect(Collectors.joining(",", "(", ")"));
    }
    return value.toString();
  }

  @Override
  public String toString() {
    return toSolveText(new NumberFormatter(12));
  }

  private final String solver;
  private final ImmutableMap<String, Object> options;
  private final boolean relaxInt;
  private final boolean primalIn;
  private final boolean noObjective;
  private final boolean matrixFormat;
  private final ImmutableList<Objective> objectives;
}
