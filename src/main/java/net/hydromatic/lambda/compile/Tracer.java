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

import net.hydromatic.lambda.ast.Ast;
import net.hydromatic.lambda.type.Type;

/** Called on various events during type resolution. */
public interface Tracer {
  /** Called when the type of an expression has been deduced. */
  void onType(Ast.Exp exp, Type type);

  /**
   * Called with the exception thrown while resolving the type of a top-level
   * expression. Returns whether a handler was found.
   *
   * <p>The resolver rethrows the exception regardless.
   */
  boolean onTypeException(TypeResolver.TypeException e);
}

// End Tracer.java
