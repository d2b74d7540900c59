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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.Iterables.getLast;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import java.util.List;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A collection of types.
 *
 * <p>Creates types; knows the primitive types by name. A type system is
 * immutable and may be shared between threads.
 */
public class TypeSystem {
  private final ImmutableSortedMap<String, Type> typeByName;

  /** Creates a type system. */
  public TypeSystem() {
    final ImmutableSortedMap.Builder<String, Type> b =
        ImmutableSortedMap.naturalOrder();
    for (PrimitiveType primitiveType : PrimitiveType.values()) {
      b.put(primitiveType.moniker, primitiveType);
    }
    typeByName = b.build();
  }

  /** Looks up a type by name; throws if not found. */
  public Type lookup(String name) {
    final Type type = lookupOpt(name);
    if (type == null) {
      throw new IllegalArgumentException("no type named '" + name + "'");
    }
    return type;
  }

  /** Looks up a type by name, returning null if not found. */
  public @Nullable Type lookupOpt(String name) {
    return typeByName.get(name);
  }

  /** Creates a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    return new FnType(paramType, resultType);
  }

  /**
   * Creates a curried function type.
   *
   * <p>For example, {@code fnType(INT, BOOL, INT)} returns "{@code (Int ->
   * (Bool -> Int))}".
   */
  public FnType fnType(Type paramType, Type type1, Type... types) {
    final List<Type> list = Lists.asList(paramType, type1, types);
    Type resultType = getLast(list);
    for (int i = list.size() - 2; i > 0; i--) {
      resultType = fnType(list.get(i), resultType);
    }
    return fnType(paramType, resultType);
  }

  /**
   * Creates a dependent function type.
   *
   * <p>{@code returnTypeOf} is called with the parameter name, and must
   * return the same type each time.
   */
  public DependentFnType dependentFnType(
      String paramName, Type paramType, Function<String, Type> returnTypeOf) {
    checkArgument(!paramName.isEmpty(), "empty parameter name");
    return new DependentFnType(paramName, paramType, returnTypeOf);
  }

  /** Creates a linear type. */
  public LinearType linearType(Type baseType) {
    return new LinearType(baseType);
  }

  /** Creates an effect type. */
  public EffectType effectType(String effect, Type baseType) {
    return new EffectType(effect, baseType);
  }

  /** Creates a type family applied to a value name, e.g. "Vector(n)". */
  public IndexedType indexedType(String name, String index) {
    return new IndexedType(name, index);
  }
}

// End TypeSystem.java
