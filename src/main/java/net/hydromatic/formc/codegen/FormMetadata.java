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
package net.hydromatic.formc.codegen;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.ast.Shape;
import net.hydromatic.formc.compile.CompiledForm;
import net.hydromatic.formc.element.Cell;

/**
 * Description of a compiled form for an assembly engine.
 *
 * <p>This is the whole of the interface between generated code and the
 * engine that calls it; the engine needs no other knowledge of the
 * compiler. The interface is versioned by {@link #CONTRACT_VERSION}.
 */
public final class FormMetadata {
  /** Version of the interface between generated procedures and the
   * assembly engine. Incremented whenever the signature of a procedure, the
   * layout of the buffer or of the coordinate dofs, or the contents of the
   * metadata change incompatibly. */
  public static final int CONTRACT_VERSION = 1;

  public final String name;
  public final int rank;
  public final ImmutableList<Shape> argumentValueShapes;
  /** Local dimension of each argument, over one cell. */
  public final ImmutableList<Integer> argumentDimensions;
  public final ImmutableList<String> coefficientNames;
  public final ImmutableList<Integer> coefficientDimensions;
  public final int geometricDimension;
  public final int topologicalDimension;
  public final Cell cell;
  /** Subdomain ids of each integral type that is present. */
  public final ImmutableSortedMap<IntegralType, ImmutableList<Integer>>
      subdomainIds;

  private FormMetadata(String name, int rank,
      List<Shape> argumentValueShapes, List<Integer> argumentDimensions,
      List<String> coefficientNames, List<Integer> coefficientDimensions,
      int geometricDimension, int topologicalDimension, Cell cell,
      Map<IntegralType, ImmutableList<Integer>> subdomainIds) {
    this.name = requireNonNull(name);
    this.rank = rank;
    this.argumentValueShapes = ImmutableList.copyOf(argumentValueShapes);
    this.argumentDimensions = ImmutableList.copyOf(argumentDimensions);
    this.coefficientNames = ImmutableList.copyOf(coefficientNames);
    this.coefficientDimensions = ImmutableList.copyOf(coefficientDimensions);
    this.geometricDimension = geometricDimension;
    this.topologicalDimension = topologicalDimension;
    this.cell = requireNonNull(cell);
    this.subdomainIds = ImmutableSortedMap.copyOf(subdomainIds);
  }

  /** Creates the metadata of a compiled form. */
  public static FormMetadata of(CompiledForm compiledForm) {
    final ImmutableList.Builder<Shape> shapes = ImmutableList.builder();
    final ImmutableList.Builder<Integer> dimensions = ImmutableList.builder();
    for (Expr.Argument argument : compiledForm.form.arguments) {
      shapes.add(argument.element.valueShape);
      dimensions.add(argument.element.spaceDimension());
    }
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    final ImmutableList.Builder<Integer> coefficientDimensions =
        ImmutableList.builder();
    for (Expr.Coefficient coefficient : compiledForm.form.coefficients) {
      names.add(coefficient.name);
      coefficientDimensions.add(coefficient.element.spaceDimension());
    }
    final ImmutableSortedMap.Builder<IntegralType, ImmutableList<Integer>>
        ids = ImmutableSortedMap.naturalOrder();
    for (IntegralType type : compiledForm.integralTypes()) {
      ids.put(type, compiledForm.form.subdomainIds(type).asList());
    }
    final Cell cell = compiledForm.form.domain.cell;
    return new FormMetadata(compiledForm.name, compiledForm.rank(),
        shapes.build(), dimensions.build(), names.build(),
        coefficientDimensions.build(), cell.dimension(), cell.dimension(),
        cell, ids.build());
  }

  /** Returns the length of the buffer of the procedure for an integral
   * type. */
  public int bufferLength(IntegralType type) {
    int n = 1;
    for (int dimension : argumentDimensions) {
      n *= type == IntegralType.INTERIOR_FACET ? 2 * dimension : dimension;
    }
    return n;
  }

  @Override
  public String toString() {
    return "FormMetadata(" + name + ", rank=" + rank + ", dimensions="
        + argumentDimensions + ", cell=" + cell.lowerName() + ")";
  }
}

// End FormMetadata.java
