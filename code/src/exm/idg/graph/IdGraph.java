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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.idg.common.Logging;
import exm.idg.common.Settings;
import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.common.exceptions.MalformedGraphError;
import exm.idg.common.exceptions.PropagationLimitError;
import exm.idg.common.lang.IterDomain;
import exm.idg.common.util.Pair;
import exm.idg.common.util.UniqueList;
import exm.idg.ir.tree.Exprs.Expr;
import exm.idg.ir.tree.Exprs.Merge;
import exm.idg.ir.tree.Exprs.Resize;
import exm.idg.ir.tree.Exprs.Split;
import exm.idg.ir.tree.Exprs.Swizzle2D;
import exm.idg.ir.tree.Exprs.SwizzleMode;
import exm.idg.ir.tree.Exprs.SwizzleType;

/**
 * Equivalence classes of iteration domains and of the transformations
 * between them under one {@link IdMappingMode}.
 *
 * Groups are connected through definitions (transformation groups
 * producing an id group) and uses (transformation groups consuming it),
 * which makes the graph traversable at the level of groups.
 *
 * Mapping two ids propagates: transformations consuming both groups whose
 * inputs now match are mapped, and so are their outputs; likewise for
 * transformations producing both groups and their inputs.  Propagation
 * runs on a work queue until nothing changes.
 */
public class IdGraph {

  private static final Logger logger = Logging.getIDGLogger();

  private final MappingPolicy policy;

  private final DisjointSets<IterDomain, IdGroup> disjointIdSets;
  private final DisjointSets<Expr, ExprGroup> disjointExprSets;

  /** Transformation groups producing each id group */
  private final Map<IdGroup, UniqueList<ExprGroup>> uniqueDefinitions;

  /** Transformation groups consuming each id group */
  private final Map<IdGroup, UniqueList<ExprGroup>> uniqueUses;

  /** Definitions of individual ids known to this graph */
  private final Map<IterDomain, UniqueList<Expr>> idDefinitions;

  /** Uses of individual ids known to this graph */
  private final Map<IterDomain, UniqueList<Expr>> idUses;

  public IdGraph(MappingPolicy policy) {
    this.policy = policy;
    this.disjointIdSets = DisjointSets.create(IdGroup.FACTORY);
    this.disjointExprSets = DisjointSets.create(ExprGroup.FACTORY);
    this.uniqueDefinitions = new HashMap<IdGroup, UniqueList<ExprGroup>>();
    this.uniqueUses = new HashMap<IdGroup, UniqueList<ExprGroup>>();
    this.idDefinitions = new HashMap<IterDomain, UniqueList<Expr>>();
    this.idUses = new HashMap<IterDomain, UniqueList<Expr>>();
  }

  public IdGraph(IdMappingMode mode) {
    this(MappingPolicies.forMode(mode));
  }

  /**
   * Copy other, with a possibly different policy.  The copy has the same
   * partitions but its own group objects.
   */
  public IdGraph(IdGraph other, MappingPolicy policy) {
    this.policy = policy;
    this.disjointIdSets = new DisjointSets<IterDomain, IdGroup>(
                                                  other.disjointIdSets);
    this.disjointExprSets = new DisjointSets<Expr, ExprGroup>(
                                                  other.disjointExprSets);
    this.uniqueDefinitions = translateIndex(other.uniqueDefinitions);
    this.uniqueUses = translateIndex(other.uniqueUses);
    this.idDefinitions = copyRaw(other.idDefinitions);
    this.idUses = copyRaw(other.idUses);
  }

  public IdGraph(IdGraph other) {
    this(other, other.policy);
  }

  private Map<IdGroup, UniqueList<ExprGroup>> translateIndex(
                          Map<IdGroup, UniqueList<ExprGroup>> index) {
    Map<IdGroup, UniqueList<ExprGroup>> result =
                      new HashMap<IdGroup, UniqueList<ExprGroup>>();
    for (Entry<IdGroup, UniqueList<ExprGroup>> e: index.entrySet()) {
      IdGroup newKey = disjointIdSets.find(e.getKey().front());
      UniqueList<ExprGroup> newVal = new UniqueList<ExprGroup>();
      for (ExprGroup eg: e.getValue()) {
        newVal.pushBack(disjointExprSets.find(eg.front()));
      }
      result.put(newKey, newVal);
    }
    return result;
  }

  private static Map<IterDomain, UniqueList<Expr>> copyRaw(
                          Map<IterDomain, UniqueList<Expr>> raw) {
    Map<IterDomain, UniqueList<Expr>> result =
                      new HashMap<IterDomain, UniqueList<Expr>>();
    for (Entry<IterDomain, UniqueList<Expr>> e: raw.entrySet()) {
      result.put(e.getKey(), new UniqueList<Expr>(e.getValue()));
    }
    return result;
  }

  public IdMappingMode mode() {
    return policy.mode();
  }

  public MappingPolicy policy() {
    return policy;
  }

  public DisjointSets<IterDomain, IdGroup> disjointIdSets() {
    return disjointIdSets;
  }

  public DisjointSets<Expr, ExprGroup> disjointExprSets() {
    return disjointExprSets;
  }

  /**
   * @return (group, true) if id is in this graph, else (null, false)
   */
  public Pair<IdGroup, Boolean> disjointIdSet(IterDomain id) {
    IdGroup group = disjointIdSets.find(id);
    return group == null ? Pair.<IdGroup>notFound() : Pair.found(group);
  }

  /**
   * @return (group, true) if expr is in this graph, else (null, false)
   */
  public Pair<ExprGroup, Boolean> disjointExprSet(Expr expr) {
    ExprGroup group = disjointExprSets.find(expr);
    return group == null ? Pair.<ExprGroup>notFound() : Pair.found(group);
  }

  public boolean hasId(IterDomain id) {
    return disjointIdSets.find(id) != null;
  }

  /**
   * Groups of ids, in order, without duplicates
   * @throws IDGRuntimeError if an id is not in the graph
   */
  public UniqueList<IdGroup> toIdGroups(Collection<IterDomain> ids) {
    UniqueList<IdGroup> result = new UniqueList<IdGroup>();
    for (IterDomain id: ids) {
      IdGroup group = disjointIdSets.find(id);
      if (group == null) {
        throw new IDGRuntimeError(id + " is not in the " + mode() +
                                  " graph");
      }
      result.pushBack(group);
    }
    return result;
  }

  /**
   * Groups of exprs, in order, without duplicates
   * @throws IDGRuntimeError if an expr is not in the graph
   */
  public UniqueList<ExprGroup> toExprGroups(Collection<Expr> exprs) {
    UniqueList<ExprGroup> result = new UniqueList<ExprGroup>();
    for (Expr expr: exprs) {
      ExprGroup group = disjointExprSets.find(expr);
      if (group == null) {
        throw new IDGRuntimeError(expr + " is not in the " + mode() +
                                  " graph");
      }
      result.pushBack(group);
    }
    return result;
  }

  public List<IdGroup> inputGroups(ExprGroup group) {
    return toIdGroups(group.front().inputs()).toList();
  }

  public List<IdGroup> outputGroups(ExprGroup group) {
    return toIdGroups(group.front().outputs()).toList();
  }

  /**
   * @return true if an output group of group is also one of its input
   *          groups, e.g. a split by one mapped onto its input
   */
  public boolean isSelfLoop(ExprGroup group) {
    List<IdGroup> inputs = inputGroups(group);
    for (IdGroup output: outputGroups(group)) {
      if (inputs.contains(output)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Definitions index lookup, without falling back to raw definitions
   */
  public Pair<UniqueList<ExprGroup>, Boolean>
                    iterDomainGroupDefinitions(IdGroup group) {
    UniqueList<ExprGroup> defs = uniqueDefinitions.get(group);
    return defs == null ? Pair.<UniqueList<ExprGroup>>notFound()
                        : Pair.found(defs);
  }

  /**
   * Uses index lookup, without falling back to raw uses
   */
  public Pair<UniqueList<ExprGroup>, Boolean>
                    iterDomainGroupUses(IdGroup group) {
    UniqueList<ExprGroup> uses = uniqueUses.get(group);
    return uses == null ? Pair.<UniqueList<ExprGroup>>notFound()
                        : Pair.found(uses);
  }

  /**
   * Transformation groups producing group.  Groups not yet in the index
   * are answered from the definitions of their members.
   */
  public UniqueList<ExprGroup> uniqueDefinitions(IdGroup group) {
    UniqueList<ExprGroup> defs = uniqueDefinitions.get(group);
    if (defs != null) {
      return defs;
    }
    return fromRaw(group, idDefinitions);
  }

  /**
   * Transformation groups consuming group.  Groups not yet in the index
   * are answered from the uses of their members.
   */
  public UniqueList<ExprGroup> uniqueUses(IdGroup group) {
    UniqueList<ExprGroup> uses = uniqueUses.get(group);
    if (uses != null) {
      return uses;
    }
    return fromRaw(group, idUses);
  }

  private UniqueList<ExprGroup> fromRaw(IdGroup group,
                          Map<IterDomain, UniqueList<Expr>> raw) {
    UniqueList<ExprGroup> result = new UniqueList<ExprGroup>();
    for (IterDomain id: group) {
      UniqueList<Expr> exprs = raw.get(id);
      if (exprs == null) {
        continue;
      }
      for (Expr expr: exprs) {
        ExprGroup eg = disjointExprSets.find(expr);
        if (eg != null) {
          result.pushBack(eg);
        }
      }
    }
    return result;
  }

  /**
   * Register id in its own group along with the transformations that
   * produce and consume it.  If id is already present, the
   * transformations are added to what is known about it.
   */
  public IdGroup initializeId(IterDomain id, Collection<Expr> definitions,
                              Collection<Expr> uses) {
    IdGroup group = disjointIdSets.initializeSet(id);

    UniqueList<Expr> rawDefs = idDefinitions.get(id);
    if (rawDefs == null) {
      rawDefs = new UniqueList<Expr>();
      idDefinitions.put(id, rawDefs);
    }
    UniqueList<Expr> rawUses = idUses.get(id);
    if (rawUses == null) {
      rawUses = new UniqueList<Expr>();
      idUses.put(id, rawUses);
    }
    rawDefs.pushBack(definitions);
    rawUses.pushBack(uses);

    UniqueList<ExprGroup> defGroups = indexEntry(uniqueDefinitions, group);
    for (Expr def: definitions) {
      defGroups.pushBack(disjointExprSets.initializeSet(def));
    }
    UniqueList<ExprGroup> useGroups = indexEntry(uniqueUses, group);
    for (Expr use: uses) {
      useGroups.pushBack(disjointExprSets.initializeSet(use));
    }
    return group;
  }

  private static UniqueList<ExprGroup> indexEntry(
          Map<IdGroup, UniqueList<ExprGroup>> index, IdGroup group) {
    UniqueList<ExprGroup> entry = index.get(group);
    if (entry == null) {
      entry = new UniqueList<ExprGroup>();
      index.put(group, entry);
    }
    return entry;
  }

  /**
   * Record a new transformation whose inputs are already in this graph.
   * Outputs are registered in singleton groups.
   */
  public ExprGroup registerExpr(Expr expr) {
    ExprGroup group = disjointExprSets.initializeSet(expr);
    for (IterDomain in: expr.inputs()) {
      IdGroup inGroup = disjointIdSets.find(in);
      if (inGroup == null) {
        throw new IDGRuntimeError("Input " + in + " of " + expr +
                                  " is not in the " + mode() + " graph");
      }
      UniqueList<Expr> rawUses = idUses.get(in);
      if (rawUses == null) {
        rawUses = new UniqueList<Expr>();
        idUses.put(in, rawUses);
      }
      rawUses.pushBack(expr);
      indexEntry(uniqueUses, inGroup).pushBack(group);
    }
    for (IterDomain out: expr.outputs()) {
      initializeId(out, Collections.singletonList(expr),
                   Collections.<Expr>emptyList());
    }
    return group;
  }

  /**
   * Check whether first and second are equivalent transformations given
   * the current mapping: same kind and parameters, and all inputs
   * (forward) or outputs (backward) already mapped.
   */
  public boolean exprsMap(Expr first, Expr second, boolean forward) {
    if (first == null || second == null) {
      return false;
    }
    if (first.kind() != second.kind()) {
      return false;
    }

    List<IterDomain> ids1 = forward ? first.inputs() : first.outputs();
    List<IterDomain> ids2 = forward ? second.inputs() : second.outputs();
    if (ids1.size() != ids2.size()) {
      return false;
    }
    for (int i = 0; i < ids1.size(); i++) {
      IterDomain id1 = ids1.get(i);
      IterDomain id2 = ids2.get(i);
      if (!hasId(id1) || !hasId(id2) ||
          !disjointIdSets.permissiveAreMapped(id1, id2)) {
        return false;
      }
    }

    switch (first.kind()) {
      case SPLIT: {
        Split s1 = (Split)first;
        Split s2 = (Split)second;
        return s1.innerSplit() == s2.innerSplit() &&
               s1.factor().sameAs(s2.factor());
      }
      case MERGE: {
        if (forward) {
          return true;
        }
        // A merged output can come from different splits of the same
        // extent, so one input must be known to match.
        Merge m1 = (Merge)first;
        Merge m2 = (Merge)second;
        boolean outerMatch = disjointIdSets.permissiveAreMapped(
                                   m1.outer(), m2.outer()) ||
                    m1.outer().extent().sameAs(m2.outer().extent());
        boolean innerMatch = disjointIdSets.permissiveAreMapped(
                                   m1.inner(), m2.inner()) ||
                    m1.inner().extent().sameAs(m2.inner().extent());
        return outerMatch || innerMatch;
      }
      case SWIZZLE2D: {
        Swizzle2D s1 = (Swizzle2D)first;
        Swizzle2D s2 = (Swizzle2D)second;
        return s1.swizzleType() == s2.swizzleType() &&
               s1.swizzleMode() == s2.swizzleMode();
      }
      case RESIZE: {
        Resize r1 = (Resize)first;
        Resize r2 = (Resize)second;
        return r1.leftExpand().sameAs(r2.leftExpand()) &&
               r1.rightExpand().sameAs(r2.rightExpand());
      }
      default:
        throw new IDGRuntimeError("Unknown expr kind " + first.kind());
    }
  }

  /**
   * Pairs of ids that a transformation leaves unchanged, e.g. the
   * input and inner output of a split by one.
   * @return empty list if expr changes iteration
   */
  public static List<Pair<IterDomain, IterDomain>> isTrivialExpr(
                                                          Expr expr) {
    List<Pair<IterDomain, IterDomain>> result =
              new ArrayList<Pair<IterDomain, IterDomain>>();
    switch (expr.kind()) {
      case SPLIT: {
        Split split = (Split)expr;
        if (split.factor().isOne()) {
          if (split.innerSplit()) {
            result.add(Pair.create(split.in(), split.outer()));
          } else {
            result.add(Pair.create(split.in(), split.inner()));
          }
        }
        break;
      }
      case MERGE: {
        Merge merge = (Merge)expr;
        if (merge.inner().extent().isOne()) {
          result.add(Pair.create(merge.outer(), merge.out()));
        } else if (merge.outer().extent().isOne()) {
          result.add(Pair.create(merge.inner(), merge.out()));
        }
        break;
      }
      case SWIZZLE2D: {
        Swizzle2D swizzle = (Swizzle2D)expr;
        if (swizzle.swizzleType() == SwizzleType.NO_SWIZZLE ||
            swizzle.swizzleMode() == SwizzleMode.NO_SWIZZLE) {
          result.add(Pair.create(swizzle.inX(), swizzle.outX()));
          result.add(Pair.create(swizzle.inY(), swizzle.outY()));
        }
        break;
      }
      case RESIZE: {
        Resize resize = (Resize)expr;
        if (resize.leftExpand().isZero() && resize.rightExpand().isZero()) {
          result.add(Pair.create(resize.in(), resize.out()));
        }
        break;
      }
      default:
        throw new IDGRuntimeError("Unknown expr kind " + expr.kind());
    }
    return result;
  }

  /**
   * Map two transformations and update the definitions and uses of the
   * groups they touch.  Does not map their inputs or outputs.
   */
  public void mapExprs(Expr first, Expr second) {
    if (first == second) {
      return;
    }
    ExprGroup group1 = disjointExprSets.find(first);
    ExprGroup group2 = disjointExprSets.find(second);
    if (group1 == null || group2 == null) {
      throw new IDGRuntimeError("Cannot map " + first + " and " + second +
                      ": not both in the " + mode() + " graph");
    }
    if (group1 == group2) {
      return;
    }

    ExprGroup merged = disjointExprSets.mapEntries(first, second);
    if (logger.isTraceEnabled()) {
      logger.trace(mode() + ": mapped exprs " + merged);
    }

    // Any member of either old group may be indexed under its own ids
    for (Expr member: merged) {
      replaceInIndex(uniqueUses, member.inputs(), group1, group2, merged);
      replaceInIndex(uniqueDefinitions, member.outputs(), group1, group2,
                     merged);
    }
  }

  private void replaceInIndex(Map<IdGroup, UniqueList<ExprGroup>> index,
          List<IterDomain> ids, ExprGroup old1, ExprGroup old2,
          ExprGroup merged) {
    for (IterDomain id: ids) {
      IdGroup idGroup = disjointIdSets.find(id);
      if (idGroup == null) {
        continue;
      }
      UniqueList<ExprGroup> entry = index.get(idGroup);
      if (entry == null) {
        continue;
      }
      boolean removed = entry.remove(old1);
      removed = entry.remove(old2) || removed;
      if (removed) {
        entry.pushBack(merged);
      }
    }
  }

  /**
   * Map a and b and propagate the consequences until nothing changes.
   * @throws PropagationLimitError if propagation does not settle within
   *          the configured number of steps
   */
  public void mapIds(IterDomain a, IterDomain b) {
    Deque<Pair<IterDomain, IterDomain>> queue =
                      new ArrayDeque<Pair<IterDomain, IterDomain>>();
    queue.add(Pair.create(a, b));
    processQueue(queue);
  }

  /**
   * If first and second are equivalent, map them and their outputs
   * (forward) or inputs (backward), then propagate.
   * @return true if they were mapped
   */
  public boolean mapThroughExpr(Expr first, Expr second, boolean forward) {
    if (first == null || second == null) {
      return false;
    }
    if (!exprsMap(first, second, forward)) {
      return false;
    }
    Deque<Pair<IterDomain, IterDomain>> queue =
                      new ArrayDeque<Pair<IterDomain, IterDomain>>();
    mapExprsAndQueue(first, second, forward, queue);
    processQueue(queue);
    return true;
  }

  private void mapExprsAndQueue(Expr first, Expr second, boolean forward,
                  Deque<Pair<IterDomain, IterDomain>> queue) {
    mapExprs(first, second);
    List<IterDomain> ids1 = forward ? first.outputs() : first.inputs();
    List<IterDomain> ids2 = forward ? second.outputs() : second.inputs();
    assert(ids1.size() == ids2.size());
    for (int i = 0; i < ids1.size(); i++) {
      queue.add(Pair.create(ids1.get(i), ids2.get(i)));
    }
  }

  private void processQueue(Deque<Pair<IterDomain, IterDomain>> queue) {
    long maxSteps = Settings.getLongUnchecked(
                                        Settings.MAX_PROPAGATION_STEPS);
    long steps = 0;
    while (!queue.isEmpty()) {
      Pair<IterDomain, IterDomain> next = queue.removeFirst();
      if (mapIdsStep(next.val1, next.val2, queue)) {
        steps++;
        if (steps > maxSteps) {
          throw new PropagationLimitError(steps, "Mapping " + next.val1 +
              " and " + next.val2 + " in " + mode() + " graph did not " +
              "settle after " + maxSteps + " steps");
        }
      }
    }
  }

  /**
   * Union the groups of a and b, then queue the ids that become
   * equivalent as a consequence.
   * @return true if a union happened
   */
  private boolean mapIdsStep(IterDomain a, IterDomain b,
                  Deque<Pair<IterDomain, IterDomain>> queue) {
    if (a == b) {
      return false;
    }
    if (!policy.allowMap(this, a, b)) {
      if (logger.isTraceEnabled()) {
        logger.trace(mode() + ": refused to map " + a + " and " + b);
      }
      return false;
    }

    IdGroup group1 = disjointIdSets.find(a);
    if (group1 == null) {
      group1 = initializeId(a, Collections.<Expr>emptyList(),
                            Collections.<Expr>emptyList());
    }
    IdGroup group2 = disjointIdSets.find(b);
    if (group2 == null) {
      group2 = initializeId(b, Collections.<Expr>emptyList(),
                            Collections.<Expr>emptyList());
    }
    if (group1 == group2) {
      return false;
    }

    UniqueList<ExprGroup> defs1 = new UniqueList<ExprGroup>(
                                        uniqueDefinitions(group1));
    UniqueList<ExprGroup> defs2 = new UniqueList<ExprGroup>(
                                        uniqueDefinitions(group2));
    UniqueList<ExprGroup> uses1 = new UniqueList<ExprGroup>(
                                        uniqueUses(group1));
    UniqueList<ExprGroup> uses2 = new UniqueList<ExprGroup>(
                                        uniqueUses(group2));

    IdGroup merged = disjointIdSets.mapEntries(a, b);
    uniqueDefinitions.remove(group1);
    uniqueDefinitions.remove(group2);
    uniqueUses.remove(group1);
    uniqueUses.remove(group2);
    uniqueDefinitions.put(merged, defs1.computeUnion(defs2));
    uniqueUses.put(merged, uses1.computeUnion(uses2));

    if (logger.isTraceEnabled()) {
      logger.trace(mode() + ": mapped " + a + " and " + b + " -> " +
                   merged);
    }

    // Uses whose inputs now match have matching outputs
    for (ExprGroup use1: uses1) {
      for (ExprGroup use2: uses2) {
        if (use1 == use2) {
          continue;
        }
        Expr e1 = use1.front();
        Expr e2 = use2.front();
        if (disjointExprSets.strictAreMapped(e1, e2)) {
          continue;
        }
        if (exprsMap(e1, e2, true)) {
          mapExprsAndQueue(e1, e2, true, queue);
        }
      }
    }

    // Definitions whose outputs now match have matching inputs
    for (ExprGroup def1: defs1) {
      for (ExprGroup def2: defs2) {
        if (def1 == def2) {
          continue;
        }
        Expr e1 = def1.front();
        Expr e2 = def2.front();
        if (disjointExprSets.strictAreMapped(e1, e2)) {
          continue;
        }
        if (exprsMap(e1, e2, false)) {
          mapExprsAndQueue(e1, e2, false, queue);
        }
      }
    }
    return true;
  }

  /**
   * Map inputs to outputs of swizzles that only change loop order
   */
  public void mapThroughLoopSwizzles() {
    List<Expr> swizzles = new ArrayList<Expr>();
    for (ExprGroup group: disjointExprSets.disjointSets()) {
      for (Expr expr: group) {
        if (expr instanceof Swizzle2D &&
            ((Swizzle2D)expr).swizzleMode() == SwizzleMode.LOOP) {
          swizzles.add(expr);
        }
      }
    }
    for (Expr expr: swizzles) {
      Swizzle2D swizzle = (Swizzle2D)expr;
      mapIds(swizzle.inX(), swizzle.outX());
      mapIds(swizzle.inY(), swizzle.outY());
    }
  }

  /**
   * All transformation groups reachable forward from groups
   */
  public UniqueList<ExprGroup> allUsesOf(Collection<IdGroup> groups) {
    UniqueList<ExprGroup> visited = new UniqueList<ExprGroup>();
    UniqueList<ExprGroup> toVisit = new UniqueList<ExprGroup>();
    for (IdGroup group: groups) {
      toVisit.pushBack(uniqueUses(group));
    }
    while (!toVisit.isEmpty()) {
      ExprGroup current = toVisit.popFront();
      if (!visited.pushBack(current)) {
        continue;
      }
      for (IdGroup output: outputGroups(current)) {
        toVisit.pushBack(uniqueUses(output).subtract(visited));
      }
    }
    return visited;
  }

  /**
   * All transformation groups reachable backward from groups
   */
  public UniqueList<ExprGroup> allDefinitionsOf(Collection<IdGroup> groups) {
    UniqueList<ExprGroup> visited = new UniqueList<ExprGroup>();
    UniqueList<ExprGroup> toVisit = new UniqueList<ExprGroup>();
    for (IdGroup group: groups) {
      toVisit.pushBack(uniqueDefinitions(group));
    }
    while (!toVisit.isEmpty()) {
      ExprGroup current = toVisit.popFront();
      if (!visited.pushBack(current)) {
        continue;
      }
      for (IdGroup input: inputGroups(current)) {
        toVisit.pushBack(uniqueDefinitions(input).subtract(visited));
      }
    }
    return visited;
  }

  /**
   * Transformation groups needed to produce to from from, in an order
   * where each group comes after the groups producing its inputs.
   * Groups with no definition that are not in from are treated as
   * additional inputs, as are groups only defined by self loops.
   */
  public List<ExprGroup> getExprsBetween(Collection<IdGroup> from,
                                         Collection<IdGroup> to) {
    UniqueList<ExprGroup> usesOfFrom = allUsesOf(from);

    UniqueList<ExprGroup> required = new UniqueList<ExprGroup>();
    UniqueList<IdGroup> visited = new UniqueList<IdGroup>();
    UniqueList<IdGroup> toVisit = new UniqueList<IdGroup>(to);
    while (!toVisit.isEmpty()) {
      IdGroup current = toVisit.popFront();
      if (!visited.pushBack(current) || from.contains(current)) {
        continue;
      }
      // Self loops do not produce anything new
      UniqueList<ExprGroup> defs = new UniqueList<ExprGroup>();
      for (ExprGroup def: uniqueDefinitions(current)) {
        if (!isSelfLoop(def)) {
          defs.pushBack(def);
        }
      }
      if (defs.isEmpty()) {
        continue;
      }
      ExprGroup chosen = null;
      for (ExprGroup def: defs) {
        if (usesOfFrom.contains(def)) {
          chosen = def;
          break;
        }
      }
      if (chosen == null) {
        chosen = defs.front();
      }
      if (required.pushBack(chosen)) {
        toVisit.pushBack(inputGroups(chosen));
      }
    }
    return forwardOrder(required);
  }

  /**
   * Order transformation groups so each follows those producing its
   * inputs
   */
  private List<ExprGroup> forwardOrder(UniqueList<ExprGroup> exprs) {
    Map<IdGroup, ExprGroup> producer = new HashMap<IdGroup, ExprGroup>();
    for (ExprGroup expr: exprs) {
      for (IdGroup output: outputGroups(expr)) {
        producer.put(output, expr);
      }
    }

    List<ExprGroup> sorted = new ArrayList<ExprGroup>();
    UniqueList<ExprGroup> emitted = new UniqueList<ExprGroup>();
    UniqueList<ExprGroup> remaining = new UniqueList<ExprGroup>(exprs);
    while (!remaining.isEmpty()) {
      boolean progress = false;
      for (ExprGroup expr: remaining.toList()) {
        boolean ready = true;
        for (IdGroup input: inputGroups(expr)) {
          ExprGroup prod = producer.get(input);
          if (prod != null && prod != expr && !emitted.contains(prod)) {
            ready = false;
            break;
          }
        }
        if (ready) {
          sorted.add(expr);
          emitted.pushBack(expr);
          remaining.remove(expr);
          progress = true;
        }
      }
      if (!progress) {
        throw new MalformedGraphError("Cycle among " + remaining +
                                      " in " + mode() + " graph");
      }
    }
    return sorted;
  }

  /**
   * For each id in from, the ids in to that are in the same group
   */
  public Map<IterDomain, List<IterDomain>> buildMapBetween(
                    List<IterDomain> from, List<IterDomain> to) {
    Map<IterDomain, List<IterDomain>> result =
                    new LinkedHashMap<IterDomain, List<IterDomain>>();
    for (IterDomain fromId: from) {
      List<IterDomain> mapped = new ArrayList<IterDomain>();
      IdGroup group = disjointIdSets.find(fromId);
      if (group != null) {
        for (IterDomain toId: to) {
          if (group.has(toId)) {
            mapped.add(toId);
          }
        }
      }
      result.put(fromId, mapped);
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(mode()).append(" graph:\n");
    for (IdGroup group: disjointIdSets.disjointSets()) {
      sb.append("  {").append(StringUtils.join(group.members(), ", "))
        .append("}\n");
      UniqueList<ExprGroup> defs = uniqueDefinitions(group);
      if (!defs.isEmpty()) {
        sb.append("    defs: ").append(StringUtils.join(defs, ", "))
          .append('\n');
      }
      UniqueList<ExprGroup> uses = uniqueUses(group);
      if (!uses.isEmpty()) {
        sb.append("    uses: ").append(StringUtils.join(uses, ", "))
          .append('\n');
      }
    }
    return sb.toString();
  }
}
