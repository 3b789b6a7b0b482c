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
import java.util.Collections;
import java.util.List;

import exm.idg.common.lang.TensorView;
import exm.idg.common.util.UniqueList;
import exm.idg.ir.tree.TensorOps.TensorOp;

/**
 * Ordered list of tensor operations, plus tensors that are not connected
 * to any operation (e.g. unused inputs)
 */
public class Fusion {
  private final List<TensorOp> ops = new ArrayList<TensorOp>();
  private final UniqueList<TensorView> extraTensors =
                                          new UniqueList<TensorView>();

  /**
   * Add operation.  Operations must be added in topological order.
   * @param op
   * @return op, for convenience
   */
  public TensorOp add(TensorOp op) {
    ops.add(op);
    return op;
  }

  public void addTensor(TensorView tv) {
    extraTensors.pushBack(tv);
  }

  public List<TensorOp> ops() {
    return Collections.unmodifiableList(ops);
  }

  public List<TensorView> extraTensors() {
    return extraTensors.toList();
  }

  /**
   * @return all tensors, in order of first appearance
   */
  public List<TensorView> allTensors() {
    UniqueList<TensorView> result = new UniqueList<TensorView>();
    for (TensorOp op: ops) {
      result.pushBack(op.inputs());
      result.pushBack(op.outputs());
    }
    result.pushBack(extraTensors);
    return result.toList();
  }
}
