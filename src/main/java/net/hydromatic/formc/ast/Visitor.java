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
package net.hydromatic.formc.ast;

/** Visits expressions. */
public class Visitor {

  /** For use as a method reference. */
  protected void accept(Expr e) {
    e.accept(this);
  }

  // terminals

  protected void visit(Expr.Argument argument) {}

  protected void visit(Expr.Coefficient coefficient) {}

  protected void visit(Expr.Constant constant) {}

  protected void visit(Expr.Zero zero) {}

  protected void visit(Expr.Geometric geometric) {}

  // calls

  protected void visit(Expr.Call1 call) {
    call.a.accept(this);
  }

  protected void visit(Expr.Call2 call) {
    call.a0.accept(this);
    call.a1.accept(this);
  }

  protected void visit(Expr.Power power) {
    power.a.accept(this);
  }

  protected void visit(Expr.Indexed indexed) {
    indexed.a.accept(this);
  }

  protected void visit(Expr.Restricted restricted) {
    restricted.a.accept(this);
  }
}

// End Visitor.java
