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
package net.hydromatic.lambda.type;

import static java.util.Objects.requireNonNull;

import net.hydromatic.lambda.ast.Op;

/**
 * Type.
 *
 * <p>Types are immutable. Two types are equal if their {@link #key() keys}
 * are equal, that is, if they have the same structure.
 */
public interface Type {
  /**
   * Structural identifier of the type, e.g. "{@code Int}", "{@code (Int ->
   * Bool)}", "{@code Linear[Int]}".
   */
  Key key();

  /** Description of the type, e.g. "{@code Effect[IO, Int]}". */
  default String moniker() {
    return key().toString();
  }

  /** Type operator. */
  Op op();

  /**
   * Whether this type is a function that can be applied to an argument of a
   * given type.
   *
   * <p>For example:
   *
   * <ul>
   *   <li>{@code Int} is not a function and therefore returns {@code false}
   *       for all argument types;
   *   <li>{@code (Int -> Bool)} can be applied to {@code Int} but not to
   *       {@code Bool} or {@code Linear[Int]}.
   * </ul>
   */
  default boolean canCallArgOf(Type type) {
    return false;
  }

  /** Structural identifier of a type. */
  abstract class Key {
    public final Op op;

    /** Creates a key. */
    protected Key(Op op) {
      this.op = requireNonNull(op);
    }

    /**
     * Returns a description of this key.
     *
     * <p>The default implementation calls {@link #describe(StringBuilder)},
     * but subclasses may override to provide a more efficient implementation.
     */
    @Override
    public String toString() {
      return describe(new StringBuilder()).toString();
    }

    /** Writes a description of this key to a string builder. */
    abstract StringBuilder describe(StringBuilder buf);
  }
}

// End Type.java
