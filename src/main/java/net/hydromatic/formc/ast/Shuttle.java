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

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms expressions. */
public class Shuttle {
  protected List<Expr> visitList(List<Expr> nodes) {
    final List<Expr> list = new ArrayList<>();
    for (Expr node : nodes) {
      list.add(node.accept(this));
    }
    return list;
  }

  // terminals

  protected Expr visit(Expr.Argument argument) {
    return argument; // leaf
  }

  protected Expr visit(Expr.Coefficient coefficient) {
    return coefficient; // leaf
  }

  protected Expr visit(Expr.Constant constant) {
    return constant; // leaf
  }

  protected Expr visit(Expr.Zero zero) {
    return zero; // leaf
  }

  protected Expr visit(Expr.Geometric geometric) {
    return geometric; // leaf
  }

  // calls

  protected Expr visit(Expr.Call1 call) {
    return call.copy(visitList(call.operands()));
  }

  protected Expr visit(Expr.Call2 call) {
    return call.copy(visitList(call.operands()));
  }

  protected Expr visit(Expr.Power power) {
    return power.copy(visitList(power.operands()));
  }

  protected Expr visit(Expr.Indexed indexed) {
    return indexed.copy(visitList(indexed.operands()));
  }

  protected Expr visit(Expr.Restricted restricted) {
    return restricted.copy(visitList(restricted.operands()));
  }
}

// End Shuttle.java
