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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.idg.common.Logging;
import exm.idg.common.Settings;
import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.common.exceptions.ParallelTypeConflictException;
import exm.idg.common.exceptions.SelfMappingException;
import exm.idg.common.lang.IterDomain;
import exm.idg.common.lang.ParallelType;
import exm.idg.common.lang.TensorView;
import exm.idg.common.util.Pair;
import exm.idg.common.util.UniqueList;
import exm.idg.ir.tree.Exprs.Expr;
import exm.idg.ir.tree.Fusion;
import exm.idg.ir.tree.TensorOps.TensorOp;

/**
 * Builds and holds an {@link IdGraph} for every {@link IdMappingMode}.
 *
 * Graphs are built in a fixed order, each from the previous: EXACT,
 * ALMOST_EXACT, PERMISSIVE, then LOOP, whose parallel types are checked
 * and propagated.  Finally every tensor is checked for distinct
 * dimensions that ended up equivalent.
 */
public class IterDomainGraphs {

  private static final Logger logger = Logging.getIDGLogger();

  private static final List<IdMappingMode> BUILD_ORDER = Arrays.asList(
      IdMappingMode.EXACT, IdMappingMode.ALMOST_EXACT,
      IdMappingMode.PERMISSIVE, IdMappingMode.LOOP);

  /** Modes in which two dimensions of one tensor may not be mapped */
  private static final List<IdMappingMode> SELF_MAPPING_MODES =
      Arrays.asList(IdMappingMode.EXACT, IdMappingMode.PERMISSIVE);

  private final List<TensorOp> ops;

  /** All tensors, in order of first appearance */
  private final List<TensorView> tensors;

  private final ListMultimap<TensorView, TensorView> producers;

  /** Ids in order of first appearance */
  private final UniqueList<IterDomain> allIds;

  private final Map<IterDomain, UniqueList<Expr>> idDefinitions;
  private final Map<IterDomain, UniqueList<Expr>> idUses;

  /** Ids produced by view transformations */
  private final UniqueList<IterDomain> viewRfactorIds;

  private final EnumMap<IdMappingMode, IdGraph> idGraphs;

  /** First self mapping found, null if none */
  private final SelfMappingInfo selfMapping;

  /**
   * @param ops tensor operations in topological order
   * @param additionalTvs tensors not connected to any operation
   * @param allowSelfMapping if false, fail if two dimensions of one
   *          tensor are mapped
   * @throws SelfMappingException
   * @throws ParallelTypeConflictException if dimensions sharing a loop
   *          have different parallel types
   */
  public IterDomainGraphs(List<TensorOp> ops,
        List<TensorView> additionalTvs, boolean allowSelfMapping)
        throws SelfMappingException, ParallelTypeConflictException {
    this.ops = new ArrayList<TensorOp>(ops);
    this.producers = ArrayListMultimap.create();
    this.allIds = new UniqueList<IterDomain>();
    this.idDefinitions = new HashMap<IterDomain, UniqueList<Expr>>();
    this.idUses = new HashMap<IterDomain, UniqueList<Expr>>();
    this.viewRfactorIds = new UniqueList<IterDomain>();
    this.idGraphs = new EnumMap<IdMappingMode, IdGraph>(
                                          IdMappingMode.class);

    UniqueList<TensorView> tvs = new UniqueList<TensorView>();
    for (TensorOp op: ops) {
      tvs.pushBack(op.inputs());
      tvs.pushBack(op.outputs());
      for (TensorView out: op.outputs()) {
        producers.putAll(out, op.inputs());
      }
    }
    tvs.pushBack(additionalTvs);
    this.tensors = tvs.toList();

    buildIterDomainDefinitionsAndUses();

    for (IdMappingMode mode: BUILD_ORDER) {
      MappingPolicy policy = MappingPolicies.forMode(mode);
      IdGraph graph = policy.initialGraph(this);
      idGraphs.put(mode, graph);
      policy.buildMappings(graph, this);
      logger.debug("Built " + mode + " graph: " +
          graph.disjointIdSets().size() + " id groups, " +
          graph.disjointExprSets().size() + " expr groups");
      if (logger.isTraceEnabled()) {
        logger.trace(graph.toString());
      }
    }

    validateAndPropagateParallelType();

    this.selfMapping = findFirstSelfMapping();
    if (selfMapping != null) {
      if (!allowSelfMapping) {
        throw new SelfMappingException(selfMapping);
      }
      Logging.uniqueWarn("Tolerating self mapping: " + selfMapping);
    }
  }

  public IterDomainGraphs(List<TensorOp> ops, boolean allowSelfMapping)
        throws SelfMappingException, ParallelTypeConflictException {
    this(ops, Collections.<TensorView>emptyList(), allowSelfMapping);
  }

  public IterDomainGraphs(Fusion fusion, boolean allowSelfMapping)
        throws SelfMappingException, ParallelTypeConflictException {
    this(fusion.ops(), fusion.extraTensors(), allowSelfMapping);
  }

  /**
   * Self mapping is allowed according to settings
   */
  public IterDomainGraphs(Fusion fusion)
        throws SelfMappingException, ParallelTypeConflictException {
    this(fusion, Settings.getBooleanUnchecked(Settings.ALLOW_SELF_MAPPING));
  }

  /**
   * Record which transformations produce and consume each id of each
   * tensor.  Transformations are not followed past the root domain.
   */
  private void buildIterDomainDefinitionsAndUses() {
    for (TensorView tv: tensors) {
      for (IterDomain id: tv.allIds()) {
        allIds.pushBack(id);
        rawEntry(idDefinitions, id);
        rawEntry(idUses, id);
        if (tv.hasRFactor() && id.isRFactorProduct()) {
          viewRfactorIds.pushBack(id);
        }
      }
      for (Expr expr: tv.allExprs()) {
        for (IterDomain in: expr.inputs()) {
          rawEntry(idUses, in).pushBack(expr);
        }
        for (IterDomain out: expr.outputs()) {
          rawEntry(idDefinitions, out).pushBack(expr);
        }
      }
    }
  }

  private static UniqueList<Expr> rawEntry(
              Map<IterDomain, UniqueList<Expr>> map, IterDomain id) {
    UniqueList<Expr> entry = map.get(id);
    if (entry == null) {
      entry = new UniqueList<Expr>();
      map.put(id, entry);
    }
    return entry;
  }

  /**
   * Graph with every id in its own group and every transformation
   * registered
   */
  IdGraph initializeIdGraph(MappingPolicy policy) {
    IdGraph graph = new IdGraph(policy);
    for (IterDomain id: allIds) {
      graph.initializeId(id, idDefinitions(id), idUses(id));
    }
    return graph;
  }

  List<TensorOp> ops() {
    return Collections.unmodifiableList(ops);
  }

  public List<TensorView> tensors() {
    return Collections.unmodifiableList(tensors);
  }

  List<TensorView> producersOf(TensorView tv) {
    return producers.get(tv);
  }

  public List<IterDomain> allIds() {
    return allIds.toList();
  }

  /**
   * @return transformations producing id, empty if none or unknown
   */
  public List<Expr> idDefinitions(IterDomain id) {
    UniqueList<Expr> defs = idDefinitions.get(id);
    return defs == null ? Collections.<Expr>emptyList() : defs.toList();
  }

  /**
   * @return transformations consuming id, empty if none or unknown
   */
  public List<Expr> idUses(IterDomain id) {
    UniqueList<Expr> uses = idUses.get(id);
    return uses == null ? Collections.<Expr>emptyList() : uses.toList();
  }

  /**
   * @return first transformation consuming id, or null
   */
  public Expr idUse(IterDomain id) {
    UniqueList<Expr> uses = idUses.get(id);
    return uses == null || uses.isEmpty() ? null : uses.front();
  }

  /**
   * @return first transformation producing id, or null
   */
  public Expr idDef(IterDomain id) {
    UniqueList<Expr> defs = idDefinitions.get(id);
    return defs == null || defs.isEmpty() ? null : defs.front();
  }

  public List<IterDomain> viewRfactorIds() {
    return viewRfactorIds.toList();
  }

  public IdGraph idGraph(IdMappingMode mode) {
    IdGraph graph = idGraphs.get(mode);
    if (graph == null) {
      throw new IDGRuntimeError(mode + " graph has not been built");
    }
    return graph;
  }

  public Pair<IdGroup, Boolean> findGroup(IterDomain id,
                                          IdMappingMode mode) {
    return idGraph(mode).disjointIdSet(id);
  }

  public Pair<ExprGroup, Boolean> findGroup(Expr expr, IdMappingMode mode) {
    return idGraph(mode).disjointExprSet(expr);
  }

  public boolean areMapped(IterDomain a, IterDomain b, IdMappingMode mode) {
    return idGraph(mode).disjointIdSets().permissiveAreMapped(a, b);
  }

  public UniqueList<IdGroup> toIdGroups(Collection<IterDomain> ids,
                                        IdMappingMode mode) {
    return idGraph(mode).toIdGroups(ids);
  }

  public UniqueList<ExprGroup> toExprGroups(Collection<Expr> exprs,
                                            IdMappingMode mode) {
    return idGraph(mode).toExprGroups(exprs);
  }

  /**
   * Transformation groups needed to compute to from from
   */
  public List<ExprGroup> pathBetween(Collection<IterDomain> from,
            Collection<IterDomain> to, IdMappingMode mode) {
    IdGraph graph = idGraph(mode);
    return graph.getExprsBetween(graph.toIdGroups(from),
                                 graph.toIdGroups(to));
  }

  public IdGraphStmtSort topologicalOrder(IdMappingMode mode) {
    return new IdGraphStmtSort(idGraph(mode));
  }

  /**
   * Representative of the group of id: a member bound to a thread (for
   * LOOP), else a non-broadcast member, else one with constant extent,
   * else the earliest created.
   * @return null if id is not in the graph
   */
  public IterDomain getConcreteMappedId(IterDomain id, IdMappingMode mode) {
    IdGroup group = idGraph(mode).disjointIdSets().find(id);
    if (group == null) {
      return null;
    }
    IterDomain best = null;
    for (IterDomain candidate: group) {
      if (best == null ||
          concreteRank(candidate, mode) > concreteRank(best, mode) ||
          (concreteRank(candidate, mode) == concreteRank(best, mode) &&
           candidate.id() < best.id())) {
        best = candidate;
      }
    }
    return best;
  }

  private static int concreteRank(IterDomain id, IdMappingMode mode) {
    int rank = 0;
    if (mode == IdMappingMode.LOOP && id.getParallelType().isThread()) {
      rank += 4;
    }
    if (!id.isBroadcast()) {
      rank += 2;
    }
    if (id.extent().isConstant()) {
      rank += 1;
    }
    return rank;
  }

  public boolean hasSelfMapping() {
    return selfMapping != null;
  }

  /**
   * @return first self mapping found, or null
   */
  public SelfMappingInfo selfMapping() {
    return selfMapping;
  }

  /**
   * Replay expr on newInputs and add the replay to every graph where
   * newInputs are mapped to the inputs of expr.  The replay is then
   * mapped with existing transformations of the same inputs.
   * @return the replay
   */
  public Expr addReplayAs(List<IterDomain> newInputs, Expr expr) {
    if (newInputs.size() != expr.inputs().size()) {
      throw new IDGRuntimeError("Expected " + expr.inputs().size() +
                        " inputs to replay " + expr);
    }

    List<IdGraph> targets = new ArrayList<IdGraph>();
    for (IdGraph graph: idGraphs.values()) {
      boolean present = true;
      for (int i = 0; i < newInputs.size(); i++) {
        IterDomain orig = expr.input(i);
        IterDomain replacement = newInputs.get(i);
        if (!graph.hasId(orig) || !graph.hasId(replacement)) {
          present = false;
          break;
        }
        if (!graph.disjointIdSets().strictAreMapped(orig, replacement)) {
          throw new IDGRuntimeError("Cannot replay " + expr + " on " +
              replacement + ": not mapped to " + orig + " in " +
              graph.mode() + " graph");
        }
      }
      if (present) {
        targets.add(graph);
      }
    }

    Expr replay = expr.replayAs(newInputs);
    for (IterDomain in: replay.inputs()) {
      rawEntry(idUses, in).pushBack(replay);
    }
    for (IterDomain out: replay.outputs()) {
      allIds.pushBack(out);
      rawEntry(idDefinitions, out).pushBack(replay);
      rawEntry(idUses, out);
    }

    for (IdGraph graph: targets) {
      graph.registerExpr(replay);
      IdGroup inputGroup = graph.disjointIdSets().find(replay.input(0));
      List<ExprGroup> uses = graph.uniqueUses(inputGroup).toList();
      for (ExprGroup use: uses) {
        Expr existing = use.front();
        if (existing != replay) {
          graph.mapThroughExpr(existing, replay, true);
        }
      }
    }
    logger.debug("Replayed " + expr + " as " + replay + " in " +
                 targets.size() + " graphs");
    return replay;
  }

  /**
   * Add the loops tv shares with its consumers once its computeWith
   * position is resolved: each leaf dimension of tv left of that position
   * is mapped in the LOOP graph with the PERMISSIVE-mapped leaf dimension
   * of each consumer.  Parallel types are checked again afterwards.
   * @throws ParallelTypeConflictException if the new loops join
   *          dimensions with different parallel types
   */
  public void updateComputeWith(TensorView tv)
                    throws ParallelTypeConflictException {
    if (!tv.hasComputeWith()) {
      throw new IDGRuntimeError(tv.name() + " has no computeWith position "
                                + "beyond its computeAt position");
    }
    IdGraph loop = idGraph(IdMappingMode.LOOP);
    IdGraph permissive = idGraph(IdMappingMode.PERMISSIVE);
    int consumers = 0;
    for (TensorOp op: ops) {
      if (!op.inputs().contains(tv)) {
        continue;
      }
      for (TensorView consumer: op.outputs()) {
        LoopPolicy.mapProducerConsumer(loop, permissive, tv,
            tv.getComputeWithPosition(), consumer, consumer.nDims());
        consumers++;
      }
    }
    logger.debug("Updated LOOP graph for computeWith of " + tv + " at " +
                 tv.getComputeWithPosition() + " with " + consumers +
                 " consumers");
    validateAndPropagateParallelType();
  }

  /**
   * Check that each LOOP group has at most one parallel type other than
   * SERIAL and apply it to all members of the group.
   */
  private void validateAndPropagateParallelType()
                    throws ParallelTypeConflictException {
    IdGraph loop = idGraph(IdMappingMode.LOOP);
    for (IdGroup group: loop.disjointIdSets().disjointSets()) {
      ParallelType common = ParallelType.SERIAL;
      IterDomain commonId = null;
      for (IterDomain id: group) {
        ParallelType ptype = id.getParallelType();
        if (ptype == ParallelType.SERIAL) {
          continue;
        }
        if (commonId == null) {
          common = ptype;
          commonId = id;
        } else if (ptype != common) {
          throw new ParallelTypeConflictException(commonId, common,
                                                  id, ptype);
        }
      }
      if (commonId != null) {
        for (IterDomain id: group) {
          id.parallelize(common);
        }
      }
    }
  }

  /**
   * Look for two distinct dimensions of one tensor domain that are mapped
   * @return null if none
   */
  private SelfMappingInfo findFirstSelfMapping() {
    for (TensorView tv: tensors) {
      for (IdMappingMode mode: SELF_MAPPING_MODES) {
        IdGraph graph = idGraph(mode);
        SelfMappingInfo info = findSelfMapping(graph, tv,
                                      tv.getRootDomain(), "Root");
        if (info == null && tv.hasRFactor()) {
          info = findSelfMapping(graph, tv, tv.getRFactorDomain(),
                                 "RFactor");
        }
        if (info == null) {
          info = findSelfMapping(graph, tv, tv.getLeafDomain(), "Leaf");
        }
        if (info != null) {
          return info;
        }
      }
    }
    return null;
  }

  private static SelfMappingInfo findSelfMapping(IdGraph graph,
          TensorView tv, List<IterDomain> domain, String domainName) {
    for (int i = 0; i < domain.size(); i++) {
      for (int j = i + 1; j < domain.size(); j++) {
        if (graph.disjointIdSets().strictAreMapped(domain.get(i),
                                                   domain.get(j))) {
          return new SelfMappingInfo(tv, domain.get(i), domain.get(j),
                                     domainName, graph.mode());
        }
      }
    }
    return null;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (IdGraph graph: idGraphs.values()) {
      sb.append(graph.toString());
    }
    return sb.toString();
  }
}
