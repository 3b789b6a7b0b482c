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
package exm.idg.graph;

import java.util.ArrayList;
import java.util.List;

import exm.idg.common.lang.IterDomain;
import exm.idg.common.lang.TensorView;
import exm.idg.common.util.Pair;
import exm.idg.ir.tree.Exprs.Expr;
import exm.idg.ir.tree.Exprs.Merge;
import exm.idg.ir.tree.TensorOps.TensorOp;

/**
 * As ALMOST_EXACT, but broadcast dimensions are mapped with the
 * dimensions they are resolved against, and a merge of a broadcast with
 * another dimension is mapped with that dimension.
 */
public class PermissivePolicy implements MappingPolicy {

  @Override
  public IdMappingMode mode() {
    return IdMappingMode.PERMISSIVE;
  }

  @Override
  public IdGraph initialGraph(IterDomainGraphs graphs) {
    return new IdGraph(graphs.idGraph(IdMappingMode.ALMOST_EXACT), this);
  }

  @Override
  public void buildMappings(IdGraph graph, IterDomainGraphs graphs) {
    for (TensorOp op: graphs.ops()) {
      for (TensorView producer: op.inputs()) {
        for (TensorView consumer: op.outputs()) {
          for (Pair<IterDomain, IterDomain> p:
                        op.pairwiseRootMap(producer, consumer)) {
            graph.mapIds(p.val1, p.val2);
          }
        }
      }
    }

    List<Merge> merges = new ArrayList<Merge>();
    for (ExprGroup group: graph.disjointExprSets().disjointSets()) {
      for (Expr expr: group) {
        if (expr instanceof Merge) {
          merges.add((Merge)expr);
        }
      }
    }
    for (Merge merge: merges) {
      if (merge.outer().isBroadcast() && !merge.inner().isBroadcast()) {
        graph.mapIds(merge.inner(), merge.out());
      } else if (merge.inner().isBroadcast() &&
                 !merge.outer().isBroadcast()) {
        graph.mapIds(merge.outer(), merge.out());
      }
    }

    graph.mapThroughLoopSwizzles();
  }

  @Override
  public boolean allowMap(IdGraph graph, IterDomain a, IterDomain b) {
    return true;
  }
}
