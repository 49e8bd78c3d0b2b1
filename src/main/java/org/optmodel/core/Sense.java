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

import java.util.Locale;

/** Objective sense. */
public enum Sense {
  MINIMIZE("min"),
  MAXIMIZE("max");

  Sense(String keyword) {
    this.keyword = keyword;
  }

  public String getKeyword() {
    return keyword;
  }

  /** Parses {@code min}, {@code minimize}, {@code max} or {@code maximize}, in any case. */
  public static Sense parse(String text) {
    switch (text.toLowerCase(Locale.ROOT)) {
      case "min":
      case "minimize":
        return MINIMIZE;
      case "max":
      case "maximize":
        return MAXIMIZE;
      default:
        throw new IllegalArgumentException("Sense.parse: unknown objective sense '" + text + "'");
    }
  }

  private final String keyword;
}
