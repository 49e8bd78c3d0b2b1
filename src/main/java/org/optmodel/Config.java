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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;
import org.optmodel.core.Sense;

/**
 * Immutable settings shared by a model or a workspace.
 *
 * <p>The default configuration is read from the classpath resource {@code optmodel.properties};
 * every key can be overridden by the system property {@code optmodel.<key>}.
 */
public final class Config {
  private static final Logger logger = Logger.getLogger(Config.class.getName());

  public static final String RESOURCE = "/optmodel.properties";
  public static final String SYSTEM_PREFIX = "optmodel.";

  public static final String MAX_DIGITS = "max_digits";
  public static final String DEFAULT_SENSE = "default_sense";
  public static final String VALID_OUTCOMES = "valid_outcomes";
  public static final String INDENT = "indent";

  /** Builder for {@link Config}. */
  public static final class Builder {
    private int maxDigits = 12;
    private Sense defaultSense = Sense.MINIMIZE;
    private ImmutableSet<String> validOutcomes =
        ImmutableSet.of("OPTIMAL", "ABSFCONV", "BEST_FEASIBLE");
    private int indent = 3;

    private Builder() {}

    /** Number of decimal digits kept when numbers are printed in generated code. */
    public Builder setMaxDigits(int maxDigits) {
      if (maxDigits < 0) {
        throw new IllegalArgumentException("max_digits must be non-negative: " + maxDigits);
      }
      this.maxDigits = maxDigits;
      return this;
    }

    public Builder setDefaultSense(Sense defaultSense) {
      this.defaultSense = defaultSense;
      return this;
    }

    /** Solution statuses accepted without a warning. */
    public Builder setValidOutcomes(Iterable<String> validOutcomes) {
      this.validOutcomes = ImmutableSet.copyOf(validOutcomes);
      return this;
    }

    public Builder setIndent(int indent) {
      if (indent < 0) {
        throw new IllegalArgumentException("indent must be non-negative: " + indent);
      }
      this.indent = indent;
      return this;
    }

    /** Applies the known keys found in {@code properties}, ignoring the others. */
    public Builder merge(Properties properties, String prefix) {
      String value = properties.getProperty(prefix + MAX_DIGITS);
      if (value != null) {
        setMaxDigits(parseInt(MAX_DIGITS, value));
      }
      value = properties.getProperty(prefix + DEFAULT_SENSE);
      if (value != null) {
        setDefaultSense(Sense.parse(value.trim()));
      }
      value = properties.getProperty(prefix + VALID_OUTCOMES);
      if (value != null) {
        setValidOutcomes(Splitter.on(',').trimResults().omitEmptyStrings()
            .split(value.toUpperCase(Locale.ROOT)));
      }
      value = properties.getProperty(prefix + INDENT);
      if (value != null) {
        setIndent(parseInt(INDENT, value));
      }
      return this;
    }

    public Config build() {
      return new Config(this);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns the configuration loaded from the classpath and the system properties. */
  public static Config getDefault() {
    return DefaultHolder.INSTANCE;
  }

  /** Loads a configuration from the classpath resource and the system properties. */
  public static Config load() {
    Builder builder = newBuilder();
    Properties resource = new Properties();
    try (InputStream in = Config.class.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        resource.load(in);
      } else {
        logger.fine("No " + RESOURCE + " on the classpath, using built-in defaults");
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read " + RESOURCE, e);
    }
    builder.merge(resource, "");
    builder.merge(System.getProperties(), SYSTEM_PREFIX);
    return builder.build();
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer: " + value, e);
    }
  }

  private static final class DefaultHolder {
    static final Config INSTANCE = load();
  }

  private Config(Builder builder) {
    this.maxDigits = builder.maxDigits;
    this.defaultSense = builder.defaultSense;
    this.validOutcomes = builder.validOutcomes;
    this.indent = builder.indent;
  }

  public int getMaxDigits() {
    return maxDigits;
  }

  public Sense getDefaultSense() {
    return defaultSense;
  }

  public ImmutableSet<String> getValidOutcomes() {
    return validOutcomes;
  }

  public int getIndent() {
    return indent;
  }

  /** Returns the number formatter matching this configuration. */
  public NumberFormatter getFormatter() {
    return new NumberFormatter(maxDigits);
  }

  /** Returns a builder initialized from this configuration. */
  public Builder toBuilder() {
    return newBuilder()
        .setMaxDigits(maxDigits)
        .setDefaultSense(defaultSense)
        .setValidOutcomes(validOutcomes)
        .setIndent(indent);
  }

  @Override
  public String toString() {
    return String.format(
        "Config(max_digits=%d, default_sense=%s, valid_outcomes=%s, indent=%d)",
        maxDigits, defaultSense, validOutcomes, indent);
  }

  private final int maxDigits;
  private final Sense defaultSense;
  private final ImmutableSet<String> validOutcomes;
  private final int indent;
}
