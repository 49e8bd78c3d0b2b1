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

package org.optmodel;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prints numbers in generated code.
 *
 * <p>Rounding only affects the printed text, stored values are never modified.
 */
public final class NumberFormatter {
  public NumberFormatter(int maxDigits) {
    this.maxDigits = maxDigits;
  }

  public int getMaxDigits() {
    return maxDigits;
  }

  /** Formats {@code value}, e.g. 2.0 as "2", 1/3 as "0.333333333333". */
  public String format(double value) {
    if (Double.isNaN(value)) {
      return ".";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "constant('BIG')" : "-constant('BIG')";
    }
    BigDecimal rounded = BigDecimal.valueOf(value).setScale(maxDigits, RoundingMode.HALF_UP);
    if (rounded.signum() == 0) {
      return "0";
    }
    return rounded.stripTrailingZeros().toPlainString();
  }

  /** Formats a number with its sign, for terms after the first one: "+ 2", "- 3". */
  public String formatSigned(double value) {
    return (value < 0 ? "- " : "+ ") + format(Math.abs(value));
  }

  private final int maxDigits;
}
