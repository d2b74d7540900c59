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

/**
 * Linear type.
 *
 * <p>A variable bound at a linear type must be used exactly once in its
 * scope. The type resolver enforces only a weak, textual form of that rule.
 */
public class LinearType extends BaseType {
  public final Type baseType;

  LinearType(Type baseType) {
    super(Keys.linear(baseType.key()));
    this.baseType = baseType;
  }
}

// End LinearType.java
