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
package net.hydromatic.formc.compile;

import net.hydromatic.formc.ast.Pos;
import net.hydromatic.formc.ast.Shape;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Error building an expression whose operands have incompatible shapes.
 *
 * <p>Carries the shapes of the operands and the text of the expression that
 * could not be built.
 */
public class ShapeException extends CompileException {
  public final Shape left;
  public final @Nullable Shape right;
  public final String expression;
  private final String reason;

  public ShapeException(String reason, String expression, Shape left,
      @Nullable Shape right, Pos pos) {
    super(reason + " in " + expression + ": "
        + (right == null ? "shape " + left : "shapes " + left + " and "
        + right), pos);
    this.reason = reason;
    this.expression = expression;
    this.left = left;
    this.right = right;
  }

  /** Returns a copy of this exception with a position. */
  public ShapeException withPos(Pos pos) {
    final ShapeException e =
        new ShapeException(reason, expression, left, right, pos);
    e.setStackTrace(getStackTrace());
    return e;
  }
}

// End ShapeException.java
