package exm.idg.graph;

import java.util.Collections;
import java.util.List;

import exm.idg.common.lang.IterDomain;
import exm.idg.common.util.UniqueList;
import exm.idg.ir.tree.Exprs.Expr;

/**
 * Helpers to build graphs directly from transformations
 */
class GraphFixtures {

  /**
   * Graph containing all inputs and outputs of exprs, each in its own
   * group
   */
  static IdGraph graphOf(IdMappingMode mode, Expr ...exprs) {
    IdGraph graph = new IdGraph(mode);
    UniqueList<IterDomain> ids = new UniqueList<IterDomain>();
    for (Expr expr: exprs) {
      ids.pushBack(expr.inputs());
      ids.pushBack(expr.outputs());
    }
    for (IterDomain id: ids) {
      UniqueList<Expr> defs = new UniqueList<Expr>();
      UniqueList<Expr> uses = new UniqueList<Expr>();
      for (Expr expr: exprs) {
        if (expr.outputs().contains(id)) {
          defs.pushBack(expr);
        }
        if (expr.inputs().contains(id)) {
          uses.pushBack(expr);
        }
      }
      graph.initializeId(id, defs, uses);
    }
    return graph;
  }

  static IdGraph emptyGraph(IdMappingMode mode, IterDomain ...ids) {
    IdGraph graph = new IdGraph(mode);
    for (IterDomain id: ids) {
      graph.initializeId(id, Collections.<Expr>emptyList(),
                         Collections.<Expr>emptyList());
    }
    return graph;
  }

  static IdGroup group(IdGraph graph, IterDomain id) {
    return graph.disjointIdSets().find(id);
  }

  static ExprGroup group(IdGraph graph, Expr expr) {
    return graph.disjointExprSets().find(expr);
  }

  static List<IdGroup> groups(IdGraph graph, IterDomain ...ids) {
    UniqueList<IdGroup> result = new UniqueList<IdGroup>();
    for (IterDomain id: ids) {
      result.pushBack(group(graph, id));
    }
    return result.toList();
  }
}
