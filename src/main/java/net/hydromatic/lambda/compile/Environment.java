/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.lambda.compile;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import net.hydromatic.lambda.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment for type resolution; maps variable names to types.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. The new
 * environment may obscure bindings in the old environment, but neither the new
 * nor the old will ever change.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 */
public abstract class Environment {
  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name are
   * visited, but after the more obscuring bindings.
   */
  abstract void visit(BiConsumer<String, Type> consumer);

  /**
   * Converts this environment to a string, one "{@code name : type}" line per
   * visible variable, sorted by name.
   *
   * <p>This method does not override the {@link #toString()} method; if we did,
   * debuggers would invoke it automatically.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    getTypeMap()
        .forEach((k, v) -> b.append(k).append(" : ").append(v).append("\n"));
    return b.toString();
  }

  /** Returns the type of variable {@code name} if bound, null if not. */
  public abstract @Nullable Type getOpt(String name);

  /** Returns whether variable {@code name} is bound. */
  public boolean has(String name) {
    return getOpt(name) != null;
  }

  /**
   * Creates an environment that is the same as this environment, plus one more
   * variable. If {@code name} is already bound, the new binding obscures it.
   */
  public Environment bind(String name, Type type) {
    return new Environments.SubEnvironment(this, name, type);
  }

  /**
   * Creates an environment that is the same as this, plus the given bindings.
   */
  public final Environment bindAll(Map<String, ? extends Type> bindings) {
    return Environments.bind(this, bindings);
  }

  /**
   * Calls a consumer for each variable and its type. Does not visit obscured
   * bindings.
   */
  public void forEachType(BiConsumer<String, Type> consumer) {
    final Set<String> names = new HashSet<>();
    visit(
        (name, type) -> {
          if (names.add(name)) {
            consumer.accept(name, type);
          }
        });
  }

  /** Returns the names of the visible variables, sorted. */
  public final SortedSet<String> names() {
    return ImmutableSortedSet.copyOf(getTypeMap().keySet());
  }

  /** Returns a map of the visible variables and their types. */
  public final SortedMap<String, Type> getTypeMap() {
    final SortedMap<String, Type> typeMap = new TreeMap<>();
    forEachType(typeMap::put);
    return ImmutableSortedMap.copyOfSorted(typeMap);
  }
}

// End Environment.java
