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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tracks the names given to variables, constraints, objectives, sets and parameters of one model
 * or workspace, so that generated code never contains two declarations with the same identifier.
 *
 * <p>A registry is owned by a {@code Model} or a {@code Workspace}, or passed in explicitly when
 * several of them must share identifiers. All methods are synchronized on the registry.
 */
public final class NameRegistry {
  private static final Logger logger = Logger.getLogger(NameRegistry.class.getName());
  private static final Pattern GENERATED_NAME = Pattern.compile("(.+)_([1-9][0-9]{0,8})");

  /**
   * Registers {@code name} for {@code owner}.
   *
   * <p>Registering the same owner twice is a no-op.
   *
   * @throws ModelingException if the name is already taken by another object
   */
  public synchronized void register(String name, Object owner) {
    if (name == null || name.isEmpty()) {
      throw new ModelingException("NameRegistry.register", "name must not be empty");
    }
    Object previous = entries.get(name);
    if (previous != null && previous != owner) {
      throw new ModelingException(
          "NameRegistry.register", "name '" + name + "' is already in use");
    }
    entries.put(name, owner);
  }

  /** Returns a free name of the form {@code prefix_N}, with the lowest positive N available. */
  public synchronized String generate(String prefix) {
    int counter = counters.getOrDefault(prefix, 0);
    String candidate;
    do {
      counter++;
      candidate = prefix + "_" + counter;
    } while (entries.containsKey(candidate));
    counters.put(prefix, counter);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Generated name " + candidate);
    }
    return candidate;
  }

  /**
   * Registers {@code owner} under {@code name}, or under a generated name if {@code name} is
   * empty.
   */
  public synchronized String registerOrGenerate(String name, String prefix, Object owner) {
    String effective = (name == null || name.isEmpty()) ? generate(prefix) : name;
    register(effective, owner);
    return effective;
  }

  /** Frees {@code name} if it is held by {@code owner}. */
  public synchronized void release(String name, Object owner) {
    if (entries.get(name) != owner) {
      return;
    }
    entries.remove(name);
    // counters[prefix] = k means prefix_1 to prefix_k are all taken.
    Matcher matcher = GENERATED_NAME.matcher(name);
    if (matcher.matches()) {
      String prefix = matcher.group(1);
      int index = Integer.parseInt(matcher.group(2));
      Integer counter = counters.get(prefix);
      if (counter != null && counter >= index) {
        counters.put(prefix, index - 1);
      }
    }
  }

  public synchronized boolean contains(String name) {
    return entries.containsKey(name);
  }

  /** Returns the object registered under {@code name}. */
  public synchronized Optional<Object> lookup(String name) {
    return Optional.ofNullable(entries.get(name));
  }

  /** Returns a strictly increasing creation order, used to sort declarations. */
  public synchronized int nextOrder() {
    return ++order;
  }

  public synchronized int size() {
    return entries.size();
  }

  private final Map<String, Object> entries = new LinkedHashMap<>();
  private final Map<String, Integer> counters = new LinkedHashMap<>();
  private int order = 0;
}
