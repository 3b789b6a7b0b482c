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
import java.util.Collections;
import java.util.List;

import exm.idg.common.lang.IterDomain;
import exm.idg.common.lang.TensorView;
import exm.idg.common.util.UniqueList;
import exm.idg.ir.tree.Exprs.Expr;
import exm.idg.ir.tree.TensorOps.TensorOp;

/**
 * Ids are mapped when they share a loop in generated code.  Only leaf
 * dimensions in the active region of each tensor take part: the
 * positions left of its computeAt position or of the computeAt position
 * of any of its producers.  A computeWith position resolved after the
 * build extends the region, see
 * {@link IterDomainGraphs#updateComputeWith(TensorView)}.
 */
public class LoopPolicy implements MappingPolicy {

  @Override
  public IdMappingMode mode() {
    return IdMappingMode.LOOP;
  }

  @Override
  public IdGraph initialGraph(IterDomainGraphs graphs) {
    UniqueList<IterDomain> active = new UniqueList<IterDomain>();
    for (TensorView tv: graphs.tensors()) {
      int n = activeLength(graphs, tv);
      for (int i = 0; i < n; i++) {
        active.pushBack(tv.axis(i));
      }
    }

    IdGraph graph = new IdGraph(this);
    for (IterDomain id: active) {
      graph.initializeId(id, onlyActive(graphs.idDefinitions(id), active),
                         onlyActive(graphs.idUses(id), active));
    }
    return graph;
  }

  private static List<Expr> onlyActive(Iterable<Expr> exprs,
                                       UniqueList<IterDomain> active) {
    List<Expr> result = new ArrayList<Expr>();
    for (Expr expr: exprs) {
      if (active.containsAll(expr.inputs()) &&
          active.containsAll(expr.outputs())) {
        result.add(expr);
      }
    }
    return result;
  }

  /**
   * @return number of outer leaf positions of tv that share loops with
   *          producers or consumers
   */
  public static int activeLength(IterDomainGraphs graphs, TensorView tv) {
    int n = tv.getComputeAtPosition();
    for (TensorView producer: graphs.producersOf(tv)) {
      n = Math.max(n, producer.getComputeAtPosition());
    }
    return Math.min(n, tv.nDims());
  }

  @Override
  public void buildMappings(IdGraph graph, IterDomainGraphs graphs) {
    IdGraph permissive = graphs.idGraph(IdMappingMode.PERMISSIVE);
    for (TensorOp op: graphs.ops()) {
      for (TensorView producer: op.inputs()) {
        for (TensorView consumer: op.outputs()) {
          mapProducerConsumer(graph, permissive, producer,
              producer.getComputeAtPosition(), consumer,
              activeLength(graphs, consumer));
        }
      }

      List<TensorView> outputs = op.outputs();
      TensorView first = outputs.get(0);
      for (int i = 1; i < outputs.size(); i++) {
        TensorView sibling = outputs.get(i);
        int n = Math.min(activeLength(graphs, first),
                         activeLength(graphs, sibling));
        for (int j = 0; j < n; j++) {
          graph.mapIds(first.axis(j), sibling.axis(j));
        }
      }
    }
  }

  /**
   * Map each of the first producerLength leaf dimensions of producer
   * with the first PERMISSIVE-mapped dimension among the first
   * consumerLength leaf dimensions of consumer.  Dimensions not yet in
   * the graph are added when they find a partner.
   */
  static void mapProducerConsumer(IdGraph graph, IdGraph permissive,
          TensorView producer, int producerLength, TensorView consumer,
          int consumerLength) {
    for (int i = 0; i < producerLength; i++) {
      IterDomain producerId = producer.axis(i);
      for (int j = 0; j < consumerLength; j++) {
        IterDomain consumerId = consumer.axis(j);
        if (permissive.disjointIdSets().strictAreMapped(producerId,
                                                        consumerId)) {
          addIfMissing(graph, producerId);
          addIfMissing(graph, consumerId);
          graph.mapIds(producerId, consumerId);
          break;
        }
      }
    }
  }

  private static void addIfMissing(IdGraph graph, IterDomain id) {
    if (!graph.hasId(id)) {
      graph.initializeId(id, Collections.<Expr>emptyList(),
                         Collections.<Expr>emptyList());
    }
  }

  @Override
  public boolean allowMap(IdGraph graph, IterDomain a, IterDomain b) {
    return graph.hasId(a) && graph.hasId(b);
  }
}
