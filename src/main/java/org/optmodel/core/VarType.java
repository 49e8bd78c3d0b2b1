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

/** Domain of a decision variable. */
public enum VarType {
  CONTINUOUS(""),
  INTEGER("integer"),
  BINARY("binary");

  VarType(String keyword) {
    this.keyword = keyword;
  }

  /** Keyword used in a declaration, empty for continuous variables. */
  public String getKeyword() {
    return keyword;
  }

  public boolean isIntegral() {
    return this != CONTINUOUS;
  }

  /** Default lower bound: 0 for every type. */
  public double defaultLowerBound() {
    return 0.0;
  }

  /** Default upper bound: 1 for binary variables, +inf otherwise. */
  public double defaultUpperBound() {
    return this == BINARY ? 1.0 : Double.POSITIVE_INFINITY;
  }

  private final String keyword;
}
