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

/**
 * Sub-types of {@link AstNode} and of {@link net.hydromatic.lambda.type.Type}.
 */
public enum Op {
  // identifiers
  ID,

  // expressions
  FN(". "),
  APPLY(" "),
  EFFECT,

  // types
  FUNCTION_TYPE(" -> "),
  DEPENDENT_FUNCTION_TYPE(". "),
  LINEAR_TYPE,
  EFFECT_TYPE,
  INDEXED_TYPE;

  /**
   * Text between the operands, e.g. " -> " for {@link #FUNCTION_TYPE}; empty
   * if the operator is not written infix.
   */
  public final String padded;

  Op() {
    this("");
  }

  Op(String padded) {
    this.padded = padded;
  }
}

// End Op.java
