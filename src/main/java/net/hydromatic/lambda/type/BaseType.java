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
 * Type whose identity is its structure.
 *
 * <p>The key is computed once, when the type is created, from the keys of its
 * component types. Two such types are equal if and only if their keys are
 * equal, regardless of which instances they were built from.
 */
abstract class BaseType implements Type {
  private final Key key;

  protected BaseType(Key key) {
    this.key = requireNonNull(key);
  }

  @Override
  public final Key key() {
    return key;
  }

  @Override
  public Op op() {
    return key.op;
  }

  @Override
  public String toString() {
    return key.toString();
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || o instanceof BaseType && key.equals(((BaseType) o).key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }
}

// End BaseType.java
