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

/** One row of a returned solution table: a variable or a constraint, by name. */
public final class SolutionRow {
  public static SolutionRow of(String name, double value, double dual) {
    return new SolutionRow(name, value, dual, Double.NaN, Double.NaN);
  }

  public static SolutionRow of(String name, double value, double dual, double lowerBound,
      double upperBound) {
    return new SolutionRow(name, value, dual, lowerBound, upperBound);
  }

  private SolutionRow(String name, double value, double dual, double lowerBound,
      double upperBound) {
    this.name = name;
    this.value = value;
    this.dual = dual;
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
  }

  public String getName() {
    return name;
  }

  /** Primal value of a variable, or body value of a constraint. */
  public double getValue() {
    return value;
  }

  /** Reduced cost of a variable, or dual value of a constraint. NaN if not reported. */
  public double getDual() {
    return dual;
  }

  public double getLowerBound() {
    return lowerBound;
  }

  public double getUpperBound() {
    return upperBound;
  }

  @Override
  public String toString() {
    return String.format("%s(value=%f, dual=%f)", name, value, dual);
  }

  private final String name;
  private final double value;
  private final double dual;
  private final double lowerBound;
  private final double upperBound;
}
