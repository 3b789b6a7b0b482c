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
package exm.idg.ir.tree;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.common.lang.Extent;
import exm.idg.common.lang.IterDomain;
import exm.idg.common.lang.IterType;

/**
 * Transformations between iteration domains.  Constructing a
 * transformation creates its output domains and records itself as their
 * definition.  Transformations are immutable and compared by identity.
 */
public class Exprs {

  public static abstract class Expr {
    /** Allocate unique ids in creation order */
    private static int nextId = 0;

    private final int id;
    private final List<IterDomain> inputs;
    private final List<IterDomain> outputs;

    protected Expr(List<IterDomain> inputs, List<IterDomain> outputs) {
      this.id = nextId++;
      this.inputs = ImmutableList.copyOf(inputs);
      this.outputs = ImmutableList.copyOf(outputs);
      for (IterDomain out: outputs) {
        out.setDefinition(this);
      }
    }

    public abstract ExprKind kind();

    /**
     * Build an identical transformation of different inputs, creating
     * new outputs.
     * @param newInputs must have same number of elements as inputs()
     * @return
     */
    public abstract Expr replayAs(List<IterDomain> newInputs);

    public int id() {
      return id;
    }

    public List<IterDomain> inputs() {
      return inputs;
    }

    public List<IterDomain> outputs() {
      return outputs;
    }

    public IterDomain input(int i) {
      return inputs.get(i);
    }

    public IterDomain output(int i) {
      return outputs.get(i);
    }

    protected void checkReplayInputs(List<IterDomain> newInputs) {
      if (newInputs.size() != inputs.size()) {
        throw new IDGRuntimeError("Cannot replay " + this + " with " +
                newInputs.size() + " inputs, expected " + inputs.size());
      }
    }

    /**
     * @return printed form of the kind-specific parameters
     */
    protected String paramString() {
      return "";
    }

    @Override
    public String toString() {
      return kind().toString().toLowerCase() + "#" + id + "(" +
             inputs + " -> " + outputs + paramString() + ")";
    }
  }

  private static String derivedName(IterDomain in, String suffix) {
    return in.name() == null ? null : in.name() + suffix;
  }

  /**
   * Split a domain into two.  For an inner split the inner output has
   * the factor as its extent, otherwise the outer output does.
   */
  public static class Split extends Expr {
    private final Extent factor;
    private final boolean innerSplit;

    private Split(IterDomain in, IterDomain outer, IterDomain inner,
                  Extent factor, boolean innerSplit) {
      super(Arrays.asList(in), Arrays.asList(outer, inner));
      this.factor = factor;
      this.innerSplit = innerSplit;
    }

    public static Split create(IterDomain in, Extent factor,
                      boolean innerSplit, boolean rfactorProduct) {
      Extent remainder = in.extent().ceilDiv(factor);
      Extent outerExtent = innerSplit ? remainder : factor;
      Extent innerExtent = innerSplit ? factor : remainder;
      IterDomain outer = new IterDomain(derivedName(in, "o"), outerExtent,
                                        in.iterType(), rfactorProduct);
      IterDomain inner = new IterDomain(derivedName(in, "i"), innerExtent,
                                        in.iterType(), rfactorProduct);
      return new Split(in, outer, inner, factor, innerSplit);
    }

    public static Split create(IterDomain in, long factor) {
      return create(in, Extent.constant(factor), true, false);
    }

    public IterDomain in() {
      return input(0);
    }

    public IterDomain outer() {
      return output(0);
    }

    public IterDomain inner() {
      return output(1);
    }

    public Extent factor() {
      return factor;
    }

    public boolean innerSplit() {
      return innerSplit;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.SPLIT;
    }

    @Override
    public Split replayAs(List<IterDomain> newInputs) {
      checkReplayInputs(newInputs);
      return create(newInputs.get(0), factor, innerSplit, false);
    }

    @Override
    protected String paramString() {
      return " factor=" + factor + (innerSplit ? "" : " outer");
    }
  }

  /**
   * Merge two domains into one whose extent is their product
   */
  public static class Merge extends Expr {
    private Merge(IterDomain outer, IterDomain inner, IterDomain out) {
      super(Arrays.asList(outer, inner), Arrays.asList(out));
    }

    public static Merge create(IterDomain outer, IterDomain inner,
                               boolean rfactorProduct) {
      IterType iterType;
      if (outer.isBroadcast() && inner.isBroadcast()) {
        iterType = IterType.BROADCAST;
      } else if (outer.isReduction() || inner.isReduction()) {
        iterType = IterType.REDUCTION;
      } else {
        iterType = IterType.ITERATION;
      }
      String name = null;
      if (outer.name() != null && inner.name() != null) {
        name = outer.name() + "*" + inner.name();
      }
      IterDomain out = new IterDomain(name,
          outer.extent().mul(inner.extent()), iterType, rfactorProduct);
      return new Merge(outer, inner, out);
    }

    public static Merge create(IterDomain outer, IterDomain inner) {
      return create(outer, inner, false);
    }

    public IterDomain outer() {
      return input(0);
    }

    public IterDomain inner() {
      return input(1);
    }

    public IterDomain out() {
      return output(0);
    }

    @Override
    public ExprKind kind() {
      return ExprKind.MERGE;
    }

    @Override
    public Merge replayAs(List<IterDomain> newInputs) {
      checkReplayInputs(newInputs);
      return create(newInputs.get(0), newInputs.get(1), false);
    }
  }

  public static enum SwizzleType {
    NO_SWIZZLE, ZSHAPE, XOR, CYCLIC_SHIFT
  }

  public static enum SwizzleMode {
    NO_SWIZZLE,
    DATA, // Changes the data layout: affects indexing
    LOOP, // Changes iteration order only
  }

  /**
   * Two dimensional swizzle.  Outputs have the extents of the
   * corresponding inputs.
   */
  public static class Swizzle2D extends Expr {
    private final SwizzleType swizzleType;
    private final SwizzleMode swizzleMode;

    private Swizzle2D(IterDomain inX, IterDomain inY,
                      IterDomain outX, IterDomain outY,
                      SwizzleType swizzleType, SwizzleMode swizzleMode) {
      super(Arrays.asList(inX, inY), Arrays.asList(outX, outY));
      this.swizzleType = swizzleType;
      this.swizzleMode = swizzleMode;
    }

    public static Swizzle2D create(IterDomain inX, IterDomain inY,
                  SwizzleType swizzleType, SwizzleMode swizzleMode) {
      IterDomain outX = new IterDomain(derivedName(inX, "s"), inX.extent(),
                                       inX.iterType(), false);
      IterDomain outY = new IterDomain(derivedName(inY, "s"), inY.extent(),
                                       inY.iterType(), false);
      return new Swizzle2D(inX, inY, outX, outY, swizzleType, swizzleMode);
    }

    public IterDomain inX() {
      return input(0);
    }

    public IterDomain inY() {
      return input(1);
    }

    public IterDomain outX() {
      return output(0);
    }

    public IterDomain outY() {
      return output(1);
    }

    public SwizzleType swizzleType() {
      return swizzleType;
    }

    public SwizzleMode swizzleMode() {
      return swizzleMode;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.SWIZZLE2D;
    }

    @Override
    public Swizzle2D replayAs(List<IterDomain> newInputs) {
      checkReplayInputs(newInputs);
      return create(newInputs.get(0), newInputs.get(1),
                    swizzleType, swizzleMode);
    }

    @Override
    protected String paramString() {
      return " " + swizzleType + " " + swizzleMode;
    }
  }

  /**
   * Expand (or with negative amounts, shrink) a domain at either end
   */
  public static class Resize extends Expr {
    private final Extent leftExpand;
    private final Extent rightExpand;

    private Resize(IterDomain in, IterDomain out,
                   Extent leftExpand, Extent rightExpand) {
      super(Arrays.asList(in), Arrays.asList(out));
      this.leftExpand = leftExpand;
      this.rightExpand = rightExpand;
    }

    public static Resize create(IterDomain in, Extent leftExpand,
                       Extent rightExpand, boolean rfactorProduct) {
      Extent extent = in.extent().add(leftExpand).add(rightExpand);
      IterDomain out = new IterDomain(derivedName(in, "p"), extent,
                                      in.iterType(), rfactorProduct);
      return new Resize(in, out, leftExpand, rightExpand);
    }

    public IterDomain in() {
      return input(0);
    }

    public IterDomain out() {
      return output(0);
    }

    public Extent leftExpand() {
      return leftExpand;
    }

    public Extent rightExpand() {
      return rightExpand;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.RESIZE;
    }

    @Override
    public Resize replayAs(List<IterDomain> newInputs) {
      checkReplayInputs(newInputs);
      return create(newInputs.get(0), leftExpand, rightExpand, false);
    }

    @Override
    protected String paramString() {
      return " left=" + leftExpand + " right=" + rightExpand;
    }
  }
}
