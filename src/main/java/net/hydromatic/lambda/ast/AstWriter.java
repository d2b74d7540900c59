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
package net.hydromatic.lambda.ast;

import net.hydromatic.lambda.type.Type;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier to the output. */
  public AstWriter id(String s) {
    b.append(s);
    return this;
  }

  /** Appends the description of a type to the output. */
  public AstWriter append(Type type) {
    b.append(type.moniker());
    return this;
  }

  /** Appends a call to an infix operator, always in parentheses. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    append("(");
    a0.unparse(this, left, 0);
    append(op.padded);
    a1.unparse(this, 0, right);
    return append(")");
  }

  @Override
  public String toString() {
    return b.toString();
  }

  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }
}

// End AstWriter.java
