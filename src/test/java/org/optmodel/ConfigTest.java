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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.optmodel.core.Sense;

public final class ConfigTest {
  @Test
  public void builder_defaults() {
    Config config = Config.newBuilder().build();
    assertThat(config.getMaxDigits()).isEqualTo(12);
    assertThat(config.getDefaultSense()).isEqualTo(Sense.MINIMIZE);
    assertThat(config.getValidOutcomes())
        .containsExactly("OPTIMAL", "ABSFCONV", "BEST_FEASIBLE")
        .inOrder();
    assertThat(config.getIndent()).isEqualTo(3);
  }

  @Test
  public void load_readsClasspathResource() {
    Config config = Config.load();
    assertThat(config.getMaxDigits()).isEqualTo(12);
    assertThat(config.getValidOutcomes()).contains("OPTIMAL");
  }

  @Test
  public void merge_appliesPrefixedKeys() {
    Properties properties = new Properties();
    properties.setProperty("optmodel.max_digits", "4");
    properties.setProperty("optmodel.default_sense", "maximize");
    properties.setProperty("optmodel.valid_outcomes", "optimal, conditional_optimal");
    properties.setProperty("indent", "8");
    Config config = Config.newBuilder().merge(properties, Config.SYSTEM_PREFIX).build();
    assertThat(config.getMaxDigits()).isEqualTo(4);
    assertThat(config.getDefaultSense()).isEqualTo(Sense.MAXIMIZE);
    assertThat(config.getValidOutcomes()).containsExactly("OPTIMAL", "CONDITIONAL_OPTIMAL");
    assertThat(config.getIndent()).isEqualTo(3);
    assertThat(config.getFormatter().format(1.0 / 3.0)).isEqualTo("0.3333");
  }

  @Test
  public void merge_invalidInteger_throws() {
    Properties properties = new Properties();
    properties.setProperty("max_digits", "many");
    assertThrows(
        IllegalArgumentException.class, () -> Config.newBuilder().merge(properties, ""));
  }

  @Test
  public void toBuilder_copiesEverySetting() {
    Config config = Config.newBuilder().setIndent(2).setDefaultSense(Sense.MAXIMIZE).build();
    Config copy = config.toBuilder().setMaxDigits(3).build();
    assertThat(copy.getIndent()).isEqualTo(2);
    assertThat(copy.getDefaultSense()).isEqualTo(Sense.MAXIMIZE);
    assertThat(copy.getMaxDigits()).isEqualTo(3);
    assertThat(config.getMaxDigits()).isEqualTo(12);
  }
}
