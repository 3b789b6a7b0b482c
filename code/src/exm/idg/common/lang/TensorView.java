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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.common.util.StackLite;
import exm.idg.ir.tree.Exprs.Expr;
import exm.idg.ir.tree.Exprs.Merge;
import exm.idg.ir.tree.Exprs.Resize;
import exm.idg.ir.tree.Exprs.Split;
import exm.idg.ir.tree.Exprs.Swizzle2D;
import exm.idg.ir.tree.Exprs.SwizzleMode;
import exm.idg.ir.tree.Exprs.SwizzleType;

/**
 * A tensor and the domains describing how it is iterated over.
 *
 * - The root domain is the domain the tensor is declared with.
 * - The optional rfactor domain results from view transformations of the
 *   root domain and is what consumers see.
 * - The leaf domain results from scheduling transformations and gives the
 *   loop nest the tensor is computed in.
 *
 * Leaf positions left of the computeAt position share loops with the
 * consumers of the tensor.
 */
public class TensorView {

  private static final Comparator<IterDomain> BY_ID =
      new Comparator<IterDomain>() {
        @Override
        public int compare(IterDomain a, IterDomain b) {
          return Integer.compare(a.id(), b.id());
        }
      };

  private final String name;
  private final List<IterDomain> rootDomain;
  private List<IterDomain> rfactorDomain;
  private final ArrayList<IterDomain> leafDomain;
  private int computeAtPosition;
  private int computeWithPosition;

  public TensorView(String name, List<IterDomain> rootDomain) {
    this.name = name;
    this.rootDomain = ImmutableList.copyOf(rootDomain);
    this.rfactorDomain = null;
    this.leafDomain = new ArrayList<IterDomain>(rootDomain);
    this.computeAtPosition = 0;
    this.computeWithPosition = 0;
  }

  public static TensorView create(String name, IterDomain ...rootDomain) {
    return new TensorView(name, Arrays.asList(rootDomain));
  }

  public String name() {
    return name;
  }

  public List<IterDomain> getRootDomain() {
    return rootDomain;
  }

  public boolean hasRFactor() {
    return rfactorDomain != null;
  }

  /**
   * @return rfactor domain, or null if none
   */
  public List<IterDomain> getRFactorDomain() {
    return rfactorDomain;
  }

  /**
   * @return domain visible to consumers: rfactor if present, else root
   */
  public List<IterDomain> getMaybeRFactorDomain() {
    return rfactorDomain != null ? rfactorDomain : rootDomain;
  }

  public List<IterDomain> getLeafDomain() {
    return Collections.unmodifiableList(leafDomain);
  }

  public int nDims() {
    return leafDomain.size();
  }

  public IterDomain axis(int i) {
    return leafDomain.get(i);
  }

  public int getComputeAtPosition() {
    return computeAtPosition;
  }

  /**
   * Mark the outermost pos leaf dimensions as shared with consumer loops
   * @param pos
   */
  public TensorView setComputeAt(int pos) {
    Preconditions.checkArgument(pos >= 0 && pos <= nDims(),
        "computeAt position %s out of range for %s", pos, name);
    this.computeAtPosition = pos;
    this.computeWithPosition = Math.max(computeWithPosition, pos);
    return this;
  }

  public int getComputeWithPosition() {
    return computeWithPosition;
  }

  /**
   * @return true if more leaf dimensions share loops with a consumer than
   *          the computeAt position says
   */
  public boolean hasComputeWith() {
    return computeWithPosition > computeAtPosition;
  }

  /**
   * Let the outermost pos leaf dimensions share loops with the consumer
   * this is computed with.  Cannot be left of the computeAt position.
   * @param pos
   */
  public TensorView setComputeWith(int pos) {
    Preconditions.checkArgument(pos >= computeAtPosition && pos <= nDims(),
        "computeWith position %s out of range for %s", pos, name);
    this.computeWithPosition = pos;
    return this;
  }

  public TensorView split(int axis, long factor) {
    return split(axis, Extent.constant(factor), true);
  }

  public TensorView split(int axis, Extent factor, boolean innerSplit) {
    Split split = Split.create(leafDomain.get(axis), factor, innerSplit,
                               false);
    replaceLeaf(axis, 1, split.outputs());
    return this;
  }

  /**
   * Merge axis with axis + 1
   */
  public TensorView merge(int axis) {
    Merge merge = Merge.create(leafDomain.get(axis),
                               leafDomain.get(axis + 1));
    replaceLeaf(axis, 2, merge.outputs());
    return this;
  }

  public TensorView swizzle(SwizzleType type, int x, int y,
                            SwizzleMode mode) {
    Swizzle2D swizzle = Swizzle2D.create(leafDomain.get(x),
                                         leafDomain.get(y), type, mode);
    leafDomain.set(x, swizzle.outX());
    leafDomain.set(y, swizzle.outY());
    return this;
  }

  public TensorView resize(int axis, Extent left, Extent right) {
    Resize resize = Resize.create(leafDomain.get(axis), left, right, false);
    replaceLeaf(axis, 1, resize.outputs());
    return this;
  }

  public TensorView reorder(int from, int to) {
    IterDomain id = leafDomain.remove(from);
    leafDomain.add(to, id);
    return this;
  }

  /**
   * Split a dimension of the domain seen by consumers, e.g. for a reshape.
   * Must be called before any scheduling of the leaf domain.
   */
  public TensorView reshapeSplit(int axis, Extent factor) {
    List<IterDomain> logical = startReshape();
    Split split = Split.create(logical.get(axis), factor, true, true);
    replace(logical, axis, 1, split.outputs());
    finishReshape(logical);
    return this;
  }

  /**
   * Merge axis and axis + 1 of the domain seen by consumers.
   * Must be called before any scheduling of the leaf domain.
   */
  public TensorView reshapeMerge(int axis) {
    List<IterDomain> logical = startReshape();
    Merge merge = Merge.create(logical.get(axis), logical.get(axis + 1),
                               true);
    replace(logical, axis, 2, merge.outputs());
    finishReshape(logical);
    return this;
  }

  /**
   * Pad a dimension of the domain seen by consumers.
   */
  public TensorView reshapeResize(int axis, Extent left, Extent right) {
    List<IterDomain> logical = startReshape();
    Resize resize = Resize.create(logical.get(axis), left, right, true);
    replace(logical, axis, 1, resize.outputs());
    finishReshape(logical);
    return this;
  }

  private List<IterDomain> startReshape() {
    if (!leafDomain.equals(getMaybeRFactorDomain())) {
      throw new IDGRuntimeError("Cannot reshape " + name +
                                " after scheduling its leaf domain");
    }
    return new ArrayList<IterDomain>(getMaybeRFactorDomain());
  }

  private void finishReshape(List<IterDomain> logical) {
    this.rfactorDomain = ImmutableList.copyOf(logical);
    this.leafDomain.clear();
    this.leafDomain.addAll(logical);
  }

  private void replaceLeaf(int axis, int count, List<IterDomain> with) {
    replace(leafDomain, axis, count, with);
    if (computeAtPosition > nDims()) {
      computeAtPosition = nDims();
    }
    if (computeWithPosition > nDims()) {
      computeWithPosition = nDims();
    }
  }

  private static void replace(List<IterDomain> domain, int axis, int count,
                              List<IterDomain> with) {
    for (int i = 0; i < count; i++) {
      domain.remove(axis);
    }
    domain.addAll(axis, with);
  }

  /**
   * @return all dimensions between the root and leaf domains, including
   *          both, in creation order
   */
  public List<IterDomain> allIds() {
    Set<IterDomain> root = new HashSet<IterDomain>(rootDomain);
    Set<IterDomain> visited = new HashSet<IterDomain>();
    StackLite<IterDomain> stack = new StackLite<IterDomain>();
    stack.pushAll(rootDomain);
    if (rfactorDomain != null) {
      stack.pushAll(rfactorDomain);
    }
    stack.pushAll(leafDomain);
    while (!stack.isEmpty()) {
      IterDomain id = stack.pop();
      if (!visited.add(id)) {
        continue;
      }
      Expr def = id.definition();
      if (def == null || root.contains(id)) {
        continue;
      }
      stack.pushAll(def.inputs());
      // Siblings of leaf dimensions that were transformed away further
      stack.pushAll(def.outputs());
    }

    List<IterDomain> result = new ArrayList<IterDomain>(visited);
    Collections.sort(result, BY_ID);
    return result;
  }

  /**
   * @return transformations between the root and leaf domains, in
   *          creation order
   */
  public List<Expr> allExprs() {
    Set<IterDomain> root = new HashSet<IterDomain>(rootDomain);
    List<Expr> result = new ArrayList<Expr>();
    Set<Expr> seen = new HashSet<Expr>();
    for (IterDomain id: allIds()) {
      Expr def = id.definition();
      if (def != null && !root.contains(id) && seen.add(def)) {
        result.add(def);
      }
    }
    Collections.sort(result, new Comparator<Expr>() {
      @Override
      public int compare(Expr a, Expr b) {
        return Integer.compare(a.id(), b.id());
      }
    });
    return result;
  }

  @Override
  public String toString() {
    return name + leafDomain;
  }
}
