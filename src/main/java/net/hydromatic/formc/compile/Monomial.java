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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/** Product of a real coefficient and a sorted list of atoms. */
public final class Monomial {
  /** Orders lists of atoms lexicographically. */
  static final Ordering<Iterable<Atom>> ATOMS_ORDERING =
      Ordering.<Atom>natural().lexicographical();

  public final double coefficient;
  public final ImmutableList<Atom> atoms;

  Monomial(double coefficient, ImmutableList<Atom> atoms) {
    this.coefficient = coefficient;
    this.atoms = requireNonNull(atoms);
  }

  /** Returns the atoms of a given kind. */
  @SuppressWarnings("unchecked")
  public <A extends Atom> List<A> atoms(Class<A> atomClass) {
    final List<A> list = new ArrayList<>();
    for (Atom atom : atoms) {
      if (atomClass.isInstance(atom)) {
        list.add((A) atom);
      }
    }
    return list;
  }

  /** Returns whether any atom, including the atoms inside the argument of a
   * nonlinear atom, satisfies a predicate. */
  public boolean anyAtom(Predicate<Atom> predicate) {
    for (Atom atom : atoms) {
      if (predicate.test(atom)) {
        return true;
      }
      if (atom instanceof Atom.Nonlinear
          && ((Atom.Nonlinear) atom).argument.anyAtom(predicate)) {
        return true;
      }
    }
    return false;
  }

  /** Calls a consumer for each atom, including the atoms inside the argument
   * of a nonlinear atom. */
  public void forEachAtom(Consumer<Atom> consumer) {
    for (Atom atom : atoms) {
      consumer.accept(atom);
      if (atom instanceof Atom.Nonlinear) {
        ((Atom.Nonlinear) atom).argument.forEachAtom(consumer);
      }
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(coefficient, atoms);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Monomial
            && coefficient == ((Monomial) o).coefficient
            && atoms.equals(((Monomial) o).atoms);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    b.append(coefficient);
    for (Atom atom : atoms) {
      b.append(" * ").append(atom);
    }
    return b.toString();
  }
}

// End Monomial.java
