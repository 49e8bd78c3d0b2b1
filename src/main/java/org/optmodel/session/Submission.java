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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.optmodel.format.MatrixModel;

/** A unit of work sent to the engine: either a program text or a matrix with solver options. */
public final class Submission {
  /** Form of the submitted problem. */
  public enum Kind {
    PROGRAM,
    MATRIX
  }

  /** Returns a submission holding generated program text. */
  public static Submission ofProgram(String name, String program) {
    return new Submission(Kind.PROGRAM, name, program, null, null, ImmutableMap.of());
  }

  /** Returns a submission holding a matrix, to be solved with {@code solver}. */
  public static Submission ofMatrix(String name, MatrixModel matrix, String solver,
      Map<String, Object> options) {
    return new Submission(
        Kind.MATRIX, name, null, matrix, solver, ImmutableMap.copyOf(options));
  }

  private Submission(Kind kind, String name, String program, MatrixModel matrix, String solver,
      ImmutableMap<String, Object> options) {
    this.kind = kind;
    this.name = name;
    this.program = program;
    this.matrix = matrix;
    this.solver = solver;
    this.options = options;
  }

  public Kind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  /** Returns the program text, or null for a matrix submission. */
  public String getProgram() {
    return program;
  }

  /** Returns the matrix, or null for a program submission. */
  public MatrixModel getMatrix() {
    return matrix;
  }

  /** Returns the solver of a matrix submission, or null to let the engine choose. */
  public String getSolver() {
    return solver;
  }

  public ImmutableMap<String, Object> getOptions() {
    return options;
  }

  @Override
  public String toString() {
    return "Submission(" + kind + ", " + name + ")";
  }

  private final Kind kind;
  private final String name;
  private final String program;
  private final MatrixModel matrix;
  private final String solver;
  private final ImmutableMap<String, Object> options;
}
