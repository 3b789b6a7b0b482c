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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.common.lang.IterDomain;
import exm.idg.common.lang.IterType;
import exm.idg.common.lang.TensorView;
import exm.idg.common.util.Pair;

/**
 * Operations between tensors.  Each operation relates the domain its
 * producers expose to consumers with the root domain of its outputs.
 */
public class TensorOps {

  public static enum TensorOpKind {
    UNARY,
    BINARY,
    BROADCAST,    // Output has new broadcast dimensions
    REDUCTION,    // Output has reduction dimensions
    PERMUTE,      // Output dimensions are a permutation of the input's
    VIEW,         // Output is reshaped through its rfactor domain
    MULTI_OUTPUT, // Several outputs with identical domains
    ;
  }

  public static class TensorOp {
    public final TensorOpKind kind;
    private final List<TensorView> inputs;
    private final List<TensorView> outputs;

    /** For BROADCAST: which output root dimensions are new */
    private final boolean[] newBroadcast;

    /** For PERMUTE: output position i comes from input position new2old[i] */
    private final int[] new2old;

    private TensorOp(TensorOpKind kind, List<TensorView> inputs,
              List<TensorView> outputs, boolean[] newBroadcast,
              int[] new2old) {
      assert(!outputs.isEmpty());
      this.kind = kind;
      this.inputs = ImmutableList.copyOf(inputs);
      this.outputs = ImmutableList.copyOf(outputs);
      this.newBroadcast = newBroadcast;
      this.new2old = new2old;
    }

    public List<TensorView> inputs() {
      return inputs;
    }

    public List<TensorView> outputs() {
      return outputs;
    }

    public TensorView input(int i) {
      return inputs.get(i);
    }

    public TensorView output(int i) {
      return outputs.get(i);
    }

    /**
     * Pair each dimension of producer that consumer reads with the consumer
     * root dimension it becomes.  Reduction dimensions of the producer and
     * new broadcast dimensions of the consumer have no partner.
     * @param producer an input of this operation
     * @param consumer an output of this operation
     * @return ordered pairs of (producer id, consumer id)
     */
    public List<Pair<IterDomain, IterDomain>> pairwiseRootMap(
                            TensorView producer, TensorView consumer) {
      if (!inputs.contains(producer) || !outputs.contains(consumer)) {
        throw new IDGRuntimeError(producer.name() + " -> " +
             consumer.name() + " is not a producer/consumer pair of " + this);
      }
      List<IterDomain> producerIds = new ArrayList<IterDomain>();
      for (IterDomain id: producer.getMaybeRFactorDomain()) {
        if (!id.isReduction()) {
          producerIds.add(id);
        }
      }

      List<IterDomain> consumerRoot = consumer.getRootDomain();
      List<IterDomain> consumerIds = new ArrayList<IterDomain>();
      for (int i = 0; i < consumerRoot.size(); i++) {
        if (kind == TensorOpKind.BROADCAST && newBroadcast[i]) {
          continue;
        }
        consumerIds.add(consumerRoot.get(i));
      }

      if (producerIds.size() != consumerIds.size()) {
        throw new IDGRuntimeError("Mismatched dimensions between " +
            producer + " and " + consumer + " in " + this);
      }

      List<Pair<IterDomain, IterDomain>> result =
              new ArrayList<Pair<IterDomain, IterDomain>>();
      for (int i = 0; i < consumerIds.size(); i++) {
        int producerPos = (kind == TensorOpKind.PERMUTE) ? new2old[i] : i;
        result.add(Pair.create(producerIds.get(producerPos),
                               consumerIds.get(i)));
      }
      return result;
    }

    @Override
    public String toString() {
      List<String> ins = new ArrayList<String>();
      for (TensorView tv: inputs) {
        ins.add(tv.name());
      }
      List<String> outs = new ArrayList<String>();
      for (TensorView tv: outputs) {
        outs.add(tv.name());
      }
      return outs + " = " + kind.toString().toLowerCase() + ins;
    }
  }

  private static String cloneName(IterDomain id, String tvName) {
    return id.name() == null ? null : id.name() + "_" + tvName;
  }

  /**
   * Fresh root dimensions for a consumer of producer
   * @param resolveWith if not null, broadcast dimensions of producer are
   *          resolved against the corresponding dimension of this tensor
   */
  private static List<IterDomain> cloneLogical(TensorView producer,
                              TensorView resolveWith, String tvName) {
    List<IterDomain> result = new ArrayList<IterDomain>();
    List<IterDomain> other = null;
    if (resolveWith != null) {
      other = nonReduction(resolveWith);
    }
    int pos = 0;
    for (IterDomain id: nonReduction(producer)) {
      IterDomain source = id;
      if (other != null && id.isBroadcast() && !other.get(pos).isBroadcast()) {
        source = other.get(pos);
      }
      result.add(new IterDomain(cloneName(source, tvName), source.extent(),
                                source.iterType(), false));
      pos++;
    }
    return result;
  }

  private static List<IterDomain> nonReduction(TensorView tv) {
    List<IterDomain> result = new ArrayList<IterDomain>();
    for (IterDomain id: tv.getMaybeRFactorDomain()) {
      if (!id.isReduction()) {
        result.add(id);
      }
    }
    return result;
  }

  public static TensorOp unary(String outName, TensorView in) {
    TensorView out = new TensorView(outName, cloneLogical(in, null, outName));
    return new TensorOp(TensorOpKind.UNARY, Arrays.asList(in),
                        Arrays.asList(out), null, null);
  }

  /**
   * Pointwise operation; broadcast dimensions of the first input are
   * resolved against the second
   */
  public static TensorOp binary(String outName, TensorView in1,
                                TensorView in2) {
    if (nonReduction(in1).size() != nonReduction(in2).size()) {
      throw new IDGRuntimeError("Rank mismatch between " + in1 + " and "
                                + in2);
    }
    TensorView out = new TensorView(outName, cloneLogical(in1, in2, outName));
    return new TensorOp(TensorOpKind.BINARY, Arrays.asList(in1, in2),
                        Arrays.asList(out), null, null);
  }

  /**
   * @param newBroadcast one flag per output dimension, true where a new
   *          broadcast dimension is inserted
   */
  public static TensorOp broadcast(String outName, TensorView in,
                                   boolean ...newBroadcast) {
    List<IterDomain> inIds = nonReduction(in);
    List<IterDomain> root = new ArrayList<IterDomain>();
    int inPos = 0;
    for (int i = 0; i < newBroadcast.length; i++) {
      if (newBroadcast[i]) {
        root.add(IterDomain.createBroadcast("b" + i + "_" + outName));
      } else {
        IterDomain id = inIds.get(inPos++);
        root.add(new IterDomain(cloneName(id, outName), id.extent(),
                                id.iterType(), false));
      }
    }
    if (inPos != inIds.size()) {
      throw new IDGRuntimeError("Broadcast flags do not cover " + in);
    }
    TensorView out = new TensorView(outName, root);
    return new TensorOp(TensorOpKind.BROADCAST, Arrays.asList(in),
                        Arrays.asList(out), newBroadcast.clone(), null);
  }

  /**
   * @param axes positions of the input's non-reduction dimensions to reduce
   */
  public static TensorOp reduction(String outName, TensorView in,
                                   int ...axes) {
    List<IterDomain> inIds = nonReduction(in);
    List<IterDomain> root = new ArrayList<IterDomain>();
    for (int i = 0; i < inIds.size(); i++) {
      IterDomain id = inIds.get(i);
      boolean reduced = false;
      for (int axis: axes) {
        reduced = reduced || axis == i;
      }
      IterType type = reduced ? IterType.REDUCTION : id.iterType();
      root.add(new IterDomain(cloneName(id, outName), id.extent(), type,
                              false));
    }
    TensorView out = new TensorView(outName, root);
    return new TensorOp(TensorOpKind.REDUCTION, Arrays.asList(in),
                        Arrays.asList(out), null, null);
  }

  public static TensorOp permute(String outName, TensorView in,
                                 int ...new2old) {
    List<IterDomain> inIds = nonReduction(in);
    if (new2old.length != inIds.size()) {
      throw new IDGRuntimeError("Permutation does not match rank of " + in);
    }
    List<IterDomain> root = new ArrayList<IterDomain>();
    for (int i = 0; i < new2old.length; i++) {
      IterDomain id = inIds.get(new2old[i]);
      root.add(new IterDomain(cloneName(id, outName), id.extent(),
                              id.iterType(), false));
    }
    TensorView out = new TensorView(outName, root);
    return new TensorOp(TensorOpKind.PERMUTE, Arrays.asList(in),
                        Arrays.asList(out), null, new2old.clone());
  }

  /**
   * Reshape: the output root mirrors the input, the caller then reshapes
   * the output with {@link TensorView#reshapeSplit} and friends.
   */
  public static TensorOp view(String outName, TensorView in) {
    TensorView out = new TensorView(outName, cloneLogical(in, null, outName));
    return new TensorOp(TensorOpKind.VIEW, Arrays.asList(in),
                        Arrays.asList(out), null, null);
  }

  /**
   * Operation producing several outputs over the same domain,
   * e.g. a mean and variance computed together
   */
  public static TensorOp multiOutput(List<String> outNames, TensorView in) {
    List<TensorView> outs = new ArrayList<TensorView>();
    for (String outName: outNames) {
      outs.add(new TensorView(outName, cloneLogical(in, null, outName)));
    }
    return new TensorOp(TensorOpKind.MULTI_OUTPUT, Arrays.asList(in), outs,
                        null, null);
  }
}
