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

package org.optmodel.session;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.optmodel.Config;
import org.optmodel.core.Constraint;
import org.optmodel.core.ConstraintGroup;
import org.optmodel.core.Variable;
import org.optmodel.core.VariableGroup;

/**
 * Copies the values of a result block back into variables and constraints, matching rows by
 * exact name.
 *
 * <p>All rows are matched before any value is written, so a block is either applied completely or
 * not at all. Rows naming unknown components are skipped with a warning.
 */
public final class SolutionReader {
  private static final Logger logger = Logger.getLogger(SolutionReader.class.getName());

  public SolutionReader(Config config) {
    this.validOutcomes = config.getValidOutcomes();
  }

  /**
   * Returns whether the status of {@code block} is one of the configured valid outcomes. Logs a
   * warning otherwise.
   */
  public boolean checkStatus(ResultBlock block) {
    String status = block.getSolutionStatus();
    if (status == null) {
      logger.warning("Result block carries no solution status");
      return false;
    }
    if (!validOutcomes.contains(status)) {
      logger.warning("Solution status " + status + " is not one of " + validOutcomes);
      return false;
    }
    logger.info("Solution status: " + status);
    return true;
  }

  /**
   * Applies the primal rows to {@code variables} and the dual rows to {@code constraints}.
   *
   * @return the number of rows applied
   */
  public int apply(ResultBlock block, Map<String, Variable> variables,
      Map<String, Constraint> constraints) {
    checkStatus(block);
    List<Runnable> updates = new ArrayList<>();
    for (SolutionRow row : block.getPrimalRows()) {
      Variable variable = variables.get(row.getName());
      if (variable == null) {
        logger.warning("Ignoring value of unknown variable " + row.getName());
        continue;
      }
      updates.add(() -> {
        variable.setValue(row.getValue());
        variable.setDual(row.getDual());
      });
    }
    for (SolutionRow row : block.getDualRows()) {
      Constraint constraint = constraints.get(row.getName());
      if (constraint == null) {
        logger.warning("Ignoring value of unknown constraint " + row.getName());
        continue;
      }
      updates.add(() -> {
        constraint.setValue(row.getValue());
        constraint.setDual(row.getDual());
      });
    }
    for (Runnable update : updates) {
      update.run();
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Applied " + updates.size() + " solution rows");
    }
    return updates.size();
  }

  /** Indexes the variables among {@code components}, group members included, by name. */
  public static Map<String, Variable> indexVariables(Iterable<?> components) {
    Map<String, Variable> index = new LinkedHashMap<>();
    for (Object component : components) {
      if (component instanceof Variable) {
        Variable variable = (Variable) component;
        index.put(variable.getName(), variable);
      } else if (component instanceof VariableGroup) {
        for (Variable member : (VariableGroup) component) {
          index.put(member.getName(), member);
        }
      }
    }
    return index;
  }

  /** Indexes the constraints among {@code components}, group members included, by name. */
  public static Map<String, Constraint> indexConstraints(Iterable<?> components) {
    Map<String, Constraint> index = new LinkedHashMap<>();
    for (Object component : components) {
      if (component instanceof Constraint) {
        Constraint constraint = (Constraint) component;
        index.put(constraint.getName(), constraint);
      } else if (component instanceof ConstraintGroup) {
        for (Constraint member : (ConstraintGroup) component) {
          index.put(member.getName(), member);
        }
      }
    }
    return index;
  }

  private final ImmutableSet<String> validOutcomes;
}
