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

import java.util.List;

import exm.idg.common.lang.IterDomain;
import exm.idg.common.lang.TensorView;
import exm.idg.common.util.Pair;
import exm.idg.ir.tree.TensorOps.TensorOp;

/**
 * Ids are mapped when their index expressions are identical.  Broadcast
 * dimensions are never mapped with iteration or reduction dimensions.
 */
public class ExactPolicy implements MappingPolicy {

  @Override
  public IdMappingMode mode() {
    return IdMappingMode.EXACT;
  }

  @Override
  public IdGraph initialGraph(IterDomainGraphs graphs) {
    return graphs.initializeIdGraph(this);
  }

  @Override
  public void buildMappings(IdGraph graph, IterDomainGraphs graphs) {
    for (TensorOp op: graphs.ops()) {
      mapSiblings(graph, op);

      for (TensorView producer: op.inputs()) {
        for (TensorView consumer: op.outputs()) {
          for (Pair<IterDomain, IterDomain> p:
                        op.pairwiseRootMap(producer, consumer)) {
            // Broadcasts are resolved in the consumer, not an exact match
            if (p.val1.isBroadcast() == p.val2.isBroadcast()) {
              graph.mapIds(p.val1, p.val2);
            }
          }
        }
      }
    }
    graph.mapThroughLoopSwizzles();
  }

  /**
   * Outputs of one operation share their iteration space
   */
  static void mapSiblings(IdGraph graph, TensorOp op) {
    List<TensorView> outputs = op.outputs();
    List<IterDomain> first = outputs.get(0).getRootDomain();
    for (int i = 1; i < outputs.size(); i++) {
      List<IterDomain> sibling = outputs.get(i).getRootDomain();
      for (int j = 0; j < Math.min(first.size(), sibling.size()); j++) {
        graph.mapIds(first.get(j), sibling.get(j));
      }
    }
  }

  @Override
  public boolean allowMap(IdGraph graph, IterDomain a, IterDomain b) {
    return a.isBroadcast() == b.isBroadcast();
  }
}
