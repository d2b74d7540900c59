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

import java.util.function.Function;
import net.hydromatic.lambda.ast.Op;

/**
 * Dependent function type, "{@code (Π n: Int. Vector(n))}".
 *
 * <p>The return type is computed from the <em>name</em> of the parameter, not
 * from a value. There is no structural equality: a dependent function type is
 * equal only to itself.
 */
public class DependentFnType implements Type {
  public final String paramName;
  public final Type paramType;
  private final Function<String, Type> returnTypeOf;

  DependentFnType(
      String paramName, Type paramType, Function<String, Type> returnTypeOf) {
    this.paramName = requireNonNull(paramName);
    this.paramType = requireNonNull(paramType);
    this.returnTypeOf = requireNonNull(returnTypeOf);
  }

  /** Returns the return type, applying the function to the parameter name. */
  public Type returnType() {
    return requireNonNull(returnTypeOf.apply(paramName), "returnType");
  }

  @Override
  public Key key() {
    return Keys.dependentFn(this);
  }

  @Override
  public Op op() {
    return Op.DEPENDENT_FUNCTION_TYPE;
  }

  @Override
  public String toString() {
    return moniker();
  }
}

// End DependentFnType.java
