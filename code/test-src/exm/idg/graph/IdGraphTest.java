package exm.idg.graph;

import static exm.idg.graph.GraphFixtures.emptyGraph;
import static exm.idg.graph.GraphFixtures.graphOf;
import static exm.idg.graph.GraphFixtures.group;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.idg.common.Logging;
import exm.idg.common.Settings;
import exm.idg.common.exceptions.PropagationLimitError;
import exm.idg.common.lang.Extent;
import exm.idg.common.lang.IterDomain;
import exm.idg.common.util.Pair;
import exm.idg.ir.tree.Exprs.Expr;
import exm.idg.ir.tree.Exprs.Merge;
import exm.idg.ir.tree.Exprs.Resize;
import exm.idg.ir.tree.Exprs.Split;
import exm.idg.ir.tree.Exprs.Swizzle2D;
import exm.idg.ir.tree.Exprs.SwizzleMode;
import exm.idg.ir.tree.Exprs.SwizzleType;

public class IdGraphTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("IdGraphTest.idg.log", true);
  }

  @After
  public void resetSettings() {
    Settings.reset(Settings.MAX_PROPAGATION_STEPS);
  }

  @Test
  public void testInitializeSingleton() {
    IterDomain i0 = IterDomain.create("i0", 8);
    Split split = Split.create(i0, 2);
    IdGraph graph = graphOf(IdMappingMode.EXACT, split);

    for (IterDomain id: Arrays.asList(i0, split.outer(), split.inner())) {
      Pair<IdGroup, Boolean> found = graph.disjointIdSet(id);
      assertTrue(found.val2);
      assertEquals(Arrays.asList(id), found.val1.members());
    }
    assertEquals(3, graph.disjointIdSets().size());
    assertEquals(1, graph.disjointExprSets().size());

    IdGroup inGroup = group(graph, i0);
    assertEquals(Arrays.asList(group(graph, split)),
                 graph.uniqueUses(inGroup).toList());
    assertTrue(graph.uniqueDefinitions(inGroup).isEmpty());
  }

  @Test
  public void testNotFound() {
    IdGraph graph = new IdGraph(IdMappingMode.EXACT);
    IterDomain i0 = IterDomain.create("i0", 8);
    Pair<IdGroup, Boolean> found = graph.disjointIdSet(i0);
    assertFalse(found.val2);
    assertNull(found.val1);
    assertFalse(graph.disjointExprSet(Split.create(i0, 2)).val2);
  }

  /**
   * Mapping the inputs of two merges maps the merges and their outputs
   */
  @Test
  public void testForwardPropagation() {
    IterDomain a0 = IterDomain.create("a0", 4);
    IterDomain a1 = IterDomain.create("a1", 8);
    IterDomain b0 = IterDomain.create("b0", 4);
    IterDomain b1 = IterDomain.create("b1", 8);
    Merge ma = Merge.create(a0, a1);
    Merge mb = Merge.create(b0, b1);
    IdGraph graph = graphOf(IdMappingMode.EXACT, ma, mb);

    graph.mapIds(a0, b0);
    assertFalse(graph.disjointIdSets().strictAreMapped(ma.out(), mb.out()));

    graph.mapIds(a1, b1);
    assertTrue(graph.disjointIdSets().strictAreMapped(ma.out(), mb.out()));
    assertSame(group(graph, ma), group(graph, mb));

    // Indices refer to the new groups only
    ExprGroup merged = group(graph, ma);
    assertEquals(Arrays.asList(merged),
                 graph.uniqueUses(group(graph, a0)).toList());
    assertEquals(Arrays.asList(merged),
                 graph.uniqueDefinitions(group(graph, mb.out())).toList());
  }

  /**
   * Mapping all outputs of two splits maps their inputs
   */
  @Test
  public void testBackwardPropagation() {
    IterDomain a = IterDomain.create("a", 16);
    IterDomain b = IterDomain.create("b", 16);
    Split sa = Split.create(a, 4);
    Split sb = Split.create(b, 4);
    IdGraph graph = graphOf(IdMappingMode.EXACT, sa, sb);

    graph.mapIds(sa.outer(), sb.outer());
    assertFalse(graph.disjointIdSets().strictAreMapped(a, b));

    graph.mapIds(sa.inner(), sb.inner());
    assertTrue(graph.disjointIdSets().strictAreMapped(a, b));
  }

  /**
   * An expr group that grows in two steps during one propagation must
   * replace the older groups under every member's ids
   */
  @Test
  public void testCascadedExprMergeKeepsIndexLive() {
    Merge ma = Merge.create(IterDomain.create("a1", 2),
                            IterDomain.create("a2", 8));
    Merge mb = Merge.create(IterDomain.create("b1", 2),
                            IterDomain.create("b2", 4));
    Merge mc = Merge.create(IterDomain.create("c1", 4),
                            IterDomain.create("c2", 4));
    IdGraph graph = graphOf(IdMappingMode.EXACT, ma, mb, mc);

    // No input of ma matches mc, so only the outputs are mapped
    graph.mapIds(ma.out(), mc.out());
    assertNotSame(group(graph, ma), group(graph, mc));

    // ma matches mb on the outer input, mc matches mb on the inner input
    graph.mapIds(ma.out(), mb.out());
    assertEquals(1, graph.disjointExprSets().size());
    ExprGroup merged = group(graph, ma);
    assertSame(merged, group(graph, mc));

    List<ExprGroup> live = graph.disjointExprSets().disjointSets();
    for (IdGroup idGroup: graph.disjointIdSets().disjointSets()) {
      for (ExprGroup use: graph.uniqueUses(idGroup)) {
        assertTrue("stale use " + use + " of " + idGroup,
                   live.contains(use));
      }
      for (ExprGroup def: graph.uniqueDefinitions(idGroup)) {
        assertTrue("stale definition " + def + " of " + idGroup,
                   live.contains(def));
      }
    }
    assertEquals(Arrays.asList(merged),
                 graph.uniqueUses(group(graph, ma.outer())).toList());

    assertEquals(Arrays.asList(merged), new IdGraphStmtSort(graph).exprs());
  }

  @Test
  public void testSplitFactorMismatch() {
    IterDomain a = IterDomain.create("a", 16);
    IterDomain b = IterDomain.create("b", 16);
    Split sa = Split.create(a, 4);
    Split sb = Split.create(b, 2);
    IdGraph graph = graphOf(IdMappingMode.EXACT, sa, sb);

    graph.mapIds(a, b);
    assertFalse(graph.exprsMap(sa, sb, true));
    assertFalse(graph.disjointIdSets().strictAreMapped(sa.inner(),
                                                       sb.inner()));
    assertNotSame(group(graph, sa), group(graph, sb));
  }

  @Test
  public void testInnerOuterSplitMismatch() {
    IterDomain a = IterDomain.create("a", 16);
    IterDomain b = IterDomain.create("b", 16);
    Split sa = Split.create(a, Extent.constant(4), true, false);
    Split sb = Split.create(b, Extent.constant(4), false, false);
    IdGraph graph = graphOf(IdMappingMode.EXACT, sa, sb);

    graph.mapIds(a, b);
    assertFalse(graph.exprsMap(sa, sb, true));
  }

  /**
   * Backward through a merge needs one of the inputs to match
   */
  @Test
  public void testMergeBackward() {
    IterDomain c0 = IterDomain.create("c0", 4);
    IterDomain c1 = IterDomain.create("c1", 8);
    IterDomain d0 = IterDomain.create("d0", 4);
    IterDomain d1 = IterDomain.create("d1", 8);
    Merge mc = Merge.create(c0, c1);
    Merge md = Merge.create(d0, d1);

    IterDomain e0 = IterDomain.create("e0", 2);
    IterDomain e1 = IterDomain.create("e1", 16);
    Merge me = Merge.create(e0, e1);
    IdGraph graph = graphOf(IdMappingMode.EXACT, mc, md, me);

    assertFalse(graph.exprsMap(mc, md, true));
    graph.mapIds(mc.out(), md.out());
    assertTrue(graph.disjointIdSets().strictAreMapped(c0, d0));
    assertTrue(graph.disjointIdSets().strictAreMapped(c1, d1));

    // Same total extent, different factors
    graph.mapIds(mc.out(), me.out());
    assertFalse(graph.disjointIdSets().strictAreMapped(c0, e0));
    assertFalse(graph.disjointIdSets().strictAreMapped(c1, e1));
  }

  /**
   * Merges are compared position by position
   */
  @Test
  public void testMergeOperandOrder() {
    IterDomain x = IterDomain.create("x", 4);
    IterDomain y = IterDomain.create("y", 8);
    IterDomain x2 = IterDomain.create("x2", 4);
    IterDomain y2 = IterDomain.create("y2", 8);
    Merge m1 = Merge.create(x, y);
    Merge m2 = Merge.create(y2, x2);
    IdGraph graph = graphOf(IdMappingMode.EXACT, m1, m2);

    graph.mapIds(x, x2);
    graph.mapIds(y, y2);
    assertFalse(graph.disjointIdSets().strictAreMapped(m1.out(), m2.out()));
  }

  @Test
  public void testCascade() {
    // a -> split -> merge chain replayed on b
    IterDomain a = IterDomain.create("a", 32);
    IterDomain b = IterDomain.create("b", 32);
    Split sa = Split.create(a, 4);
    Split sb = Split.create(b, 4);
    Merge ma = Merge.create(sa.inner(), sa.outer());
    Merge mb = Merge.create(sb.inner(), sb.outer());
    IdGraph graph = graphOf(IdMappingMode.EXACT, sa, sb, ma, mb);

    graph.mapIds(a, b);
    assertTrue(graph.disjointIdSets().strictAreMapped(ma.out(), mb.out()));
    assertEquals(4, graph.disjointIdSets().size());
    assertEquals(2, graph.disjointExprSets().size());
  }

  @Test
  public void testExactRefusesBroadcast() {
    IterDomain i0 = IterDomain.create("i0", 4);
    IterDomain b0 = IterDomain.createBroadcast("b0");
    IdGraph exact = emptyGraph(IdMappingMode.EXACT, i0, b0);
    exact.mapIds(i0, b0);
    assertFalse(exact.disjointIdSets().strictAreMapped(i0, b0));

    IdGraph permissive = emptyGraph(IdMappingMode.PERMISSIVE, i0, b0);
    permissive.mapIds(i0, b0);
    assertTrue(permissive.disjointIdSets().strictAreMapped(i0, b0));
  }

  @Test
  public void testLoopRefusesUnknownIds() {
    IterDomain i0 = IterDomain.create("i0", 4);
    IterDomain i1 = IterDomain.create("i1", 4);
    IdGraph loop = emptyGraph(IdMappingMode.LOOP, i0);
    loop.mapIds(i0, i1);
    assertFalse(loop.hasId(i1));
    assertEquals(1, loop.disjointIdSets().size());
  }

  @Test
  public void testTrivialExprs() {
    IterDomain i0 = IterDomain.createSymbolic("i0");

    Split outerByOne = Split.create(i0, Extent.ONE, false, false);
    assertEquals(Arrays.asList(Pair.create(i0, outerByOne.inner())),
                 IdGraph.isTrivialExpr(outerByOne));

    Split innerByOne = Split.create(i0, Extent.ONE, true, false);
    assertEquals(Arrays.asList(Pair.create(i0, innerByOne.outer())),
                 IdGraph.isTrivialExpr(innerByOne));

    assertTrue(IdGraph.isTrivialExpr(Split.create(i0, 2)).isEmpty());

    IterDomain b = IterDomain.createBroadcast("b");
    Merge merge = Merge.create(b, i0);
    assertEquals(Arrays.asList(Pair.create(i0, merge.out())),
                 IdGraph.isTrivialExpr(merge));

    IterDomain i1 = IterDomain.create("i1", 4);
    Swizzle2D noSwizzle = Swizzle2D.create(i0, i1, SwizzleType.NO_SWIZZLE,
                                           SwizzleMode.DATA);
    assertEquals(2, IdGraph.isTrivialExpr(noSwizzle).size());
    Swizzle2D xor = Swizzle2D.create(i0, i1, SwizzleType.XOR,
                                     SwizzleMode.DATA);
    assertTrue(IdGraph.isTrivialExpr(xor).isEmpty());

    Resize noPad = Resize.create(i1, Extent.ZERO, Extent.ZERO, false);
    assertEquals(Arrays.asList(Pair.create(i1, noPad.out())),
                 IdGraph.isTrivialExpr(noPad));
    Resize pad = Resize.create(i1, Extent.ONE, Extent.ZERO, false);
    assertTrue(IdGraph.isTrivialExpr(pad).isEmpty());
  }

  @Test
  public void testSwizzleAndResizeParams() {
    IterDomain x = IterDomain.create("x", 4);
    IterDomain y = IterDomain.create("y", 4);
    Swizzle2D s1 = Swizzle2D.create(x, y, SwizzleType.XOR,
                                    SwizzleMode.DATA);
    Swizzle2D s2 = Swizzle2D.create(x, y, SwizzleType.ZSHAPE,
                                    SwizzleMode.DATA);
    Resize r1 = Resize.create(x, Extent.ONE, Extent.ONE, false);
    Resize r2 = Resize.create(x, Extent.ONE, Extent.ONE, false);
    Resize r3 = Resize.create(x, Extent.ZERO, Extent.ONE, false);
    IdGraph graph = graphOf(IdMappingMode.EXACT, s1, s2, r1, r2, r3);

    assertFalse(graph.exprsMap(s1, s2, true));
    assertTrue(graph.exprsMap(r1, r2, true));
    assertFalse(graph.exprsMap(r1, r3, true));
    // Different kinds never match
    assertFalse(graph.exprsMap(s1, r1, true));
  }

  @Test
  public void testLoopSwizzles() {
    IterDomain x = IterDomain.create("x", 4);
    IterDomain y = IterDomain.create("y", 4);
    Swizzle2D loopSwizzle = Swizzle2D.create(x, y, SwizzleType.ZSHAPE,
                                             SwizzleMode.LOOP);
    IterDomain u = IterDomain.create("u", 4);
    IterDomain v = IterDomain.create("v", 4);
    Swizzle2D dataSwizzle = Swizzle2D.create(u, v, SwizzleType.ZSHAPE,
                                             SwizzleMode.DATA);
    IdGraph graph = graphOf(IdMappingMode.EXACT, loopSwizzle, dataSwizzle);

    graph.mapThroughLoopSwizzles();
    assertTrue(graph.disjointIdSets().strictAreMapped(x,
                                                      loopSwizzle.outX()));
    assertTrue(graph.disjointIdSets().strictAreMapped(y,
                                                      loopSwizzle.outY()));
    assertFalse(graph.disjointIdSets().strictAreMapped(u,
                                                       dataSwizzle.outX()));
  }

  @Test
  public void testCopy() {
    IterDomain a = IterDomain.create("a", 16);
    IterDomain b = IterDomain.create("b", 16);
    Split sa = Split.create(a, 4);
    Split sb = Split.create(b, 4);
    IdGraph graph = graphOf(IdMappingMode.EXACT, sa, sb);
    graph.mapIds(a, b);

    IdGraph copy = new IdGraph(graph,
                        MappingPolicies.forMode(IdMappingMode.ALMOST_EXACT));
    assertEquals(IdMappingMode.ALMOST_EXACT, copy.mode());
    assertTrue(copy.disjointIdSets().strictAreMapped(sa.inner(),
                                                     sb.inner()));
    assertNotSame(group(graph, a), group(copy, a));

    // Index entries refer to the copy's groups
    IdGroup copyA = group(copy, a);
    assertTrue(copy.iterDomainGroupUses(copyA).val2);
    assertEquals(Arrays.asList(group(copy, sa)),
                 copy.iterDomainGroupUses(copyA).val1.toList());

    IterDomain c = IterDomain.create("c", 16);
    copy.initializeId(c, Collections.<Expr>emptyList(),
                      Collections.<Expr>emptyList());
    copy.mapIds(a, c);
    assertFalse(graph.hasId(c));
    assertEquals(2, group(graph, a).size());
  }

  @Test
  public void testRawFallback() {
    IterDomain a = IterDomain.create("a", 16);
    Split sa = Split.create(a, 4);
    IdGraph graph = graphOf(IdMappingMode.EXACT, sa);
    IdGroup stale = group(graph, a);
    IterDomain b = IterDomain.create("b", 16);
    graph.mapIds(a, b);

    // The stale group is no longer indexed but can still be answered
    assertFalse(graph.iterDomainGroupUses(stale).val2);
    assertEquals(Arrays.asList(group(graph, sa)),
                 graph.uniqueUses(stale).toList());
  }

  @Test
  public void testRegisterExprAndMapThrough() {
    IterDomain a = IterDomain.create("a", 16);
    IterDomain b = IterDomain.create("b", 16);
    Split sa = Split.create(a, 4);
    IdGraph graph = graphOf(IdMappingMode.EXACT, sa);
    graph.initializeId(b, Collections.<Expr>emptyList(),
                       Collections.<Expr>emptyList());
    graph.mapIds(a, b);

    Split sb = Split.create(b, 4);
    graph.registerExpr(sb);
    assertTrue(graph.hasId(sb.outer()));
    assertTrue(graph.mapThroughExpr(sa, sb, true));
    assertTrue(graph.disjointIdSets().strictAreMapped(sa.outer(),
                                                      sb.outer()));
    assertTrue(graph.disjointIdSets().strictAreMapped(sa.inner(),
                                                      sb.inner()));
  }

  @Test
  public void testBuildMapBetween() {
    IterDomain a = IterDomain.create("a", 4);
    IterDomain b = IterDomain.create("b", 4);
    IterDomain c = IterDomain.create("c", 4);
    IterDomain d = IterDomain.create("d", 4);
    IdGraph graph = emptyGraph(IdMappingMode.EXACT, a, b, c, d);
    graph.mapIds(a, c);
    graph.mapIds(a, d);

    Map<IterDomain, List<IterDomain>> map =
        graph.buildMapBetween(Arrays.asList(a, b), Arrays.asList(c, d));
    assertEquals(Arrays.asList(c, d), map.get(a));
    assertTrue(map.get(b).isEmpty());
  }

  @Test
  public void testAllUsesAndDefinitions() {
    IterDomain a = IterDomain.create("a", 16);
    Split split = Split.create(a, 4);
    Merge merge = Merge.create(split.outer(), split.inner());
    IdGraph graph = graphOf(IdMappingMode.EXACT, split, merge);

    assertEquals(Arrays.asList(group(graph, split), group(graph, merge)),
        graph.allUsesOf(Arrays.asList(group(graph, a))).toList());
    assertEquals(Arrays.asList(group(graph, merge), group(graph, split)),
        graph.allDefinitionsOf(Arrays.asList(group(graph, merge.out())))
                                                              .toList());
  }

  @Test
  public void testPropagationLimit() {
    IterDomain a0 = IterDomain.create("a0", 4);
    IterDomain a1 = IterDomain.create("a1", 8);
    IterDomain b0 = IterDomain.create("b0", 4);
    IterDomain b1 = IterDomain.create("b1", 8);
    Merge ma = Merge.create(a0, a1);
    Merge mb = Merge.create(b0, b1);
    IdGraph graph = graphOf(IdMappingMode.EXACT, ma, mb);

    Settings.set(Settings.MAX_PROPAGATION_STEPS, "1");
    graph.mapIds(a0, b0);
    exception.expect(PropagationLimitError.class);
    graph.mapIds(a1, b1);
  }

  @Test
  public void testToString() {
    IterDomain a = IterDomain.create("a", 16);
    Split split = Split.create(a, 4);
    IdGraph graph = graphOf(IdMappingMode.EXACT, split);
    String s = graph.toString();
    assertTrue(s, s.startsWith("EXACT graph"));
    assertTrue(s, s.contains("uses: exprg[split"));
  }
}
