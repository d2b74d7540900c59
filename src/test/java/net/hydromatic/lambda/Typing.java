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
package net.hydromatic.lambda;

import static net.hydromatic.lambda.Matchers.hasMoniker;
import static net.hydromatic.lambda.Matchers.throwsTypeException;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.lambda.ast.Ast;
import net.hydromatic.lambda.compile.Environment;
import net.hydromatic.lambda.compile.Environments;
import net.hydromatic.lambda.compile.Prop;
import net.hydromatic.lambda.compile.Tracer;
import net.hydromatic.lambda.compile.Tracers;
import net.hydromatic.lambda.compile.TypeResolver;
import net.hydromatic.lambda.type.Type;
import net.hydromatic.lambda.type.TypeSystem;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Typing {
  final TypeSystem typeSystem;
  private final Ast.Exp exp;
  private final Map<String, Type> bindings;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;

  Typing(
      TypeSystem typeSystem,
      Ast.Exp exp,
      Map<String, Type> bindings,
      Map<Prop, Object> propMap,
      Tracer tracer) {
    this.typeSystem = typeSystem;
    this.exp = exp;
    this.bindings = ImmutableMap.copyOf(bindings);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = tracer;
  }

  /** Creates a {@code Typing}. */
  static Typing typing(TypeSystem typeSystem, Ast.Exp exp) {
    return new Typing(
        typeSystem, exp, ImmutableMap.of(), ImmutableMap.of(), Tracers.empty());
  }

  /** Returns a copy with an extra variable in the environment. */
  Typing withBinding(String name, Type type) {
    final Map<String, Type> bindings = new LinkedHashMap<>(this.bindings);
    bindings.put(name, type);
    return new Typing(typeSystem, exp, bindings, propMap, tracer);
  }

  Typing withProp(Prop prop, Object value) {
    final Map<Prop, Object> propMap = new LinkedHashMap<>(this.propMap);
    prop.set(propMap, value);
    return new Typing(typeSystem, exp, bindings, propMap, tracer);
  }

  Typing withTracer(Tracer tracer) {
    return new Typing(typeSystem, exp, bindings, propMap, tracer);
  }

  Environment env() {
    return Environments.of(bindings);
  }

  /** Deduces the type of the expression. */
  Type type() {
    return TypeResolver.create(typeSystem, propMap, tracer).infer(exp, env());
  }

  @CanIgnoreReturnValue
  Typing assertType(Matcher<Type> matcher) {
    assertThat(type(), matcher);
    return this;
  }

  @CanIgnoreReturnValue
  Typing assertType(String expected) {
    return assertType(hasMoniker(expected));
  }

  @CanIgnoreReturnValue
  Typing assertTypeThrows(Matcher<Throwable> matcher) {
    try {
      final Type type = type();
      fail("expected error, got " + type);
    } catch (TypeResolver.TypeException e) {
      assertThat(e, matcher);
    }
    return this;
  }

  @CanIgnoreReturnValue
  Typing assertTypeThrows(TypeResolver.Kind kind, String message) {
    return assertTypeThrows(throwsTypeException(kind, message));
  }
}

// End Typing.java
