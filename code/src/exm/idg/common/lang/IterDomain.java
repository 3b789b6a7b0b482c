/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.idg.common.lang;

import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.ir.tree.Exprs.Expr;

/**
 * One axis of a tensor's iteration space.
 *
 * Iteration domains are owned by the compiler IR and compared by identity:
 * two distinct objects are never equal even if all their attributes agree.
 * The only attribute that may change after construction is the parallel
 * type.
 */
public class IterDomain {

  /** Allocate unique ids in creation order, used for naming and ordering */
  private static int nextId = 0;

  private final int id;
  private final String name;
  private final Extent extent;
  private final IterType iterType;

  /**
   * True if this was produced by a view transformation into the rfactor
   * domain of a tensor
   */
  private final boolean rfactorProduct;

  private ParallelType parallelType;

  /** Transformation that produced this, null if none */
  private Expr definition;

  public IterDomain(String name, Extent extent, IterType iterType,
                    boolean rfactorProduct) {
    assert(extent != null);
    assert(iterType != null);
    this.id = nextId++;
    this.name = name;
    this.extent = extent;
    this.iterType = iterType;
    this.rfactorProduct = rfactorProduct;
    this.parallelType = ParallelType.SERIAL;
    this.definition = null;
  }

  public static IterDomain create(String name, Extent extent) {
    return new IterDomain(name, extent, IterType.ITERATION, false);
  }

  public static IterDomain create(String name, long extent) {
    return create(name, Extent.constant(extent));
  }

  /**
   * Create a dimension with a symbolic extent of the same name
   */
  public static IterDomain createSymbolic(String name) {
    return create(name, Extent.symbolic(name));
  }

  public static IterDomain createBroadcast(String name) {
    return new IterDomain(name, Extent.ONE, IterType.BROADCAST, false);
  }

  public static IterDomain createReduction(String name, Extent extent) {
    return new IterDomain(name, extent, IterType.REDUCTION, false);
  }

  public int id() {
    return id;
  }

  public String name() {
    return name;
  }

  public Extent extent() {
    return extent;
  }

  public IterType iterType() {
    return iterType;
  }

  public boolean isBroadcast() {
    return iterType == IterType.BROADCAST;
  }

  public boolean isReduction() {
    return iterType == IterType.REDUCTION;
  }

  public boolean isRFactorProduct() {
    return rfactorProduct;
  }

  public ParallelType getParallelType() {
    return parallelType;
  }

  public void parallelize(ParallelType ptype) {
    assert(ptype != null);
    this.parallelType = ptype;
  }

  public Expr definition() {
    return definition;
  }

  /**
   * Called once by the transformation that produces this
   * @param def
   */
  public void setDefinition(Expr def) {
    if (this.definition != null && this.definition != def) {
      throw new IDGRuntimeError(this + " already defined by " +
                                this.definition);
    }
    this.definition = def;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (name != null) {
      sb.append(name);
    } else {
      switch (iterType) {
        case BROADCAST:
          sb.append('b');
          break;
        case REDUCTION:
          sb.append('r');
          break;
        default:
          sb.append('i');
          break;
      }
      sb.append(id);
    }
    sb.append('{').append(extent).append('}');
    if (parallelType != ParallelType.SERIAL) {
      sb.append('_').append(parallelType);
    }
    return sb.toString();
  }
}
