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

import static java.util.Objects.requireNonNull;

import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.lambda.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Returns an empty environment. */
  public static Environment empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /** Creates an environment containing the given bindings. */
  public static Environment of(Map<String, ? extends Type> bindings) {
    return bind(empty(), bindings);
  }

  /** Creates an environment that is a given environment plus bindings. */
  static Environment bind(
      Environment env, Map<String, ? extends Type> bindings) {
    for (Map.Entry<String, ? extends Type> entry : bindings.entrySet()) {
      env = env.bind(entry.getKey(), entry.getValue());
    }
    return env;
  }

  /** Environment that inherits from a parent environment and adds one
   * binding. */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final String name;
    private final Type type;

    SubEnvironment(Environment parent, String name, Type type) {
      this.parent = requireNonNull(parent);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }

    @Override
    public String toString() {
      return name + " : " + type + ", ...";
    }

    @Override
    public @Nullable Type getOpt(String name) {
      for (Environment e = this; ; e = ((SubEnvironment) e).parent) {
        if (!(e instanceof SubEnvironment)) {
          return e.getOpt(name);
        }
        if (((SubEnvironment) e).name.equals(name)) {
          return ((SubEnvironment) e).type;
        }
      }
    }

    @Override
    void visit(BiConsumer<String, Type> consumer) {
      consumer.accept(name, type);
      parent.visit(consumer);
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override
    void visit(BiConsumer<String, Type> consumer) {}

    @Override
    public @Nullable Type getOpt(String name) {
      return null;
    }
  }
}

// End Environments.java
