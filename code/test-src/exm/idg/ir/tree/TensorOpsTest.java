package exm.idg.ir.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.common.lang.IterDomain;
import exm.idg.common.lang.TensorView;
import exm.idg.common.util.Pair;
import exm.idg.ir.tree.TensorOps.TensorOp;

public class TensorOpsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static IterDomain root(TensorView tv, int i) {
    return tv.getRootDomain().get(i);
  }

  @Test
  public void testUnary() {
    TensorView tv0 = TensorView.create("tv0", IterDomain.create("i0", 4),
                                       IterDomain.create("i1", 8));
    TensorOp op = TensorOps.unary("tv1", tv0);
    TensorView tv1 = op.output(0);
    assertNotSame(root(tv0, 0), root(tv1, 0));
    assertEquals(root(tv0, 1).extent(), root(tv1, 1).extent());

    List<Pair<IterDomain, IterDomain>> map = op.pairwiseRootMap(tv0, tv1);
    assertEquals(Arrays.asList(Pair.create(root(tv0, 0), root(tv1, 0)),
                               Pair.create(root(tv0, 1), root(tv1, 1))),
                 map);
  }

  @Test
  public void testPermute() {
    TensorView tv0 = TensorView.create("tv0", IterDomain.create("i0", 4),
                                       IterDomain.create("i1", 8));
    TensorOp op = TensorOps.permute("tv1", tv0, 1, 0);
    TensorView tv1 = op.output(0);
    assertEquals(root(tv0, 1).extent(), root(tv1, 0).extent());
    assertEquals(Arrays.asList(Pair.create(root(tv0, 1), root(tv1, 0)),
                               Pair.create(root(tv0, 0), root(tv1, 1))),
                 op.pairwiseRootMap(tv0, tv1));
  }

  @Test
  public void testReductionAndBroadcast() {
    TensorView tv0 = TensorView.create("tv0", IterDomain.create("i0", 4),
                                       IterDomain.create("i1", 8));
    TensorOp sum = TensorOps.reduction("tv1", tv0, 1);
    TensorView tv1 = sum.output(0);
    assertTrue(root(tv1, 1).isReduction());
    assertEquals(2, sum.pairwiseRootMap(tv0, tv1).size());

    TensorOp bcast = TensorOps.broadcast("tv2", tv1, true, false);
    TensorView tv2 = bcast.output(0);
    assertTrue(root(tv2, 0).isBroadcast());
    // The reduction dimension is not seen by consumers
    assertEquals(Arrays.asList(Pair.create(root(tv1, 0), root(tv2, 1))),
                 bcast.pairwiseRootMap(tv1, tv2));
  }

  @Test
  public void testBinaryResolvesBroadcast() {
    TensorView tv0 = TensorView.create("tv0",
        IterDomain.createBroadcast("b0"), IterDomain.create("i1", 8));
    TensorView tv1 = TensorView.create("tv1", IterDomain.create("j0", 4),
                                       IterDomain.create("j1", 8));
    TensorOp op = TensorOps.binary("tv2", tv0, tv1);
    TensorView tv2 = op.output(0);
    assertFalse(root(tv2, 0).isBroadcast());
    assertEquals(root(tv1, 0).extent(), root(tv2, 0).extent());
    assertSame(root(tv0, 0), op.pairwiseRootMap(tv0, tv2).get(0).val1);
  }

  @Test
  public void testRankMismatch() {
    TensorView tv0 = TensorView.create("tv0", IterDomain.create("i0", 4));
    TensorView tv1 = TensorView.create("tv1", IterDomain.create("j0", 4),
                                       IterDomain.create("j1", 8));
    exception.expect(IDGRuntimeError.class);
    TensorOps.binary("tv2", tv0, tv1);
  }

  @Test
  public void testNotProducer() {
    TensorView tv0 = TensorView.create("tv0", IterDomain.create("i0", 4));
    TensorOp op = TensorOps.unary("tv1", tv0);
    exception.expect(IDGRuntimeError.class);
    op.pairwiseRootMap(op.output(0), tv0);
  }

  @Test
  public void testFusion() {
    TensorView tv0 = TensorView.create("tv0", IterDomain.create("i0", 4));
    TensorView unused = TensorView.create("unused",
                                          IterDomain.create("u", 2));
    Fusion fusion = new Fusion();
    TensorOp op1 = fusion.add(TensorOps.unary("tv1", tv0));
    TensorOp op2 = fusion.add(TensorOps.unary("tv2", op1.output(0)));
    fusion.addTensor(unused);

    assertEquals(Arrays.asList(op1, op2), fusion.ops());
    assertEquals(Arrays.asList(tv0, op1.output(0), op2.output(0), unused),
                 fusion.allTensors());
    assertEquals(Arrays.asList(unused), fusion.extraTensors());
  }
}
