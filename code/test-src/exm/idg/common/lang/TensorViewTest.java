package exm.idg.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.idg.common.exceptions.IDGRuntimeError;
import exm.idg.ir.tree.Exprs.Expr;
import exm.idg.ir.tree.Exprs.SwizzleMode;
import exm.idg.ir.tree.Exprs.SwizzleType;

public class TensorViewTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testScheduling() {
    IterDomain i0 = IterDomain.create("i0", 16);
    IterDomain i1 = IterDomain.create("i1", 8);
    TensorView tv = TensorView.create("tv", i0, i1);

    tv.split(0, 4);
    assertEquals(3, tv.nDims());
    assertEquals(Extent.constant(4), tv.axis(0).extent());
    assertEquals(Extent.constant(4), tv.axis(1).extent());
    assertSame(i1, tv.axis(2));

    tv.merge(1);
    assertEquals(2, tv.nDims());
    assertEquals(Extent.constant(32), tv.axis(1).extent());

    tv.reorder(1, 0);
    assertEquals(Extent.constant(32), tv.axis(0).extent());

    // Root is unchanged
    assertEquals(Arrays.asList(i0, i1), tv.getRootDomain());
    assertFalse(tv.hasRFactor());
  }

  @Test
  public void testAllIds() {
    IterDomain i0 = IterDomain.create("i0", 16);
    IterDomain i1 = IterDomain.create("i1", 8);
    TensorView tv = TensorView.create("tv", i0, i1);
    tv.split(0, 4);
    IterDomain outer = tv.axis(0);
    IterDomain inner = tv.axis(1);
    tv.merge(1);
    tv.swizzle(SwizzleType.XOR, 0, 1, SwizzleMode.LOOP);

    List<IterDomain> ids = tv.allIds();
    // i0, i1, outer, inner, merged, two swizzled
    assertEquals(7, ids.size());
    assertTrue(ids.containsAll(Arrays.asList(i0, i1, outer, inner)));
    assertTrue(ids.containsAll(tv.getLeafDomain()));
    assertSame(i0, ids.get(0));

    List<Expr> exprs = tv.allExprs();
    assertEquals(3, exprs.size());
    assertSame(outer.definition(), exprs.get(0));
  }

  @Test
  public void testReshape() {
    IterDomain i0 = IterDomain.create("i0", 4);
    IterDomain i1 = IterDomain.create("i1", 6);
    TensorView tv = TensorView.create("tv", i0, i1);
    tv.reshapeMerge(0);
    assertTrue(tv.hasRFactor());
    IterDomain merged = tv.getRFactorDomain().get(0);
    assertTrue(merged.isRFactorProduct());
    assertEquals(tv.getRFactorDomain(), tv.getLeafDomain());
    assertEquals(tv.getRFactorDomain(), tv.getMaybeRFactorDomain());

    tv.reshapeSplit(0, Extent.constant(3));
    assertEquals(2, tv.getRFactorDomain().size());
    assertEquals(Extent.constant(8), tv.getRFactorDomain().get(0).extent());
  }

  @Test
  public void testReshapeAfterSchedule() {
    TensorView tv = TensorView.create("tv", IterDomain.create("i0", 4));
    tv.split(0, 2);
    exception.expect(IDGRuntimeError.class);
    tv.reshapeMerge(0);
  }

  @Test
  public void testComputeAt() {
    TensorView tv = TensorView.create("tv", IterDomain.create("i0", 4),
                                      IterDomain.create("i1", 4));
    tv.setComputeAt(2);
    tv.merge(0);
    // Clamped to the new number of dimensions
    assertEquals(1, tv.getComputeAtPosition());

    exception.expect(IllegalArgumentException.class);
    tv.setComputeAt(3);
  }

  @Test
  public void testComputeWith() {
    TensorView tv = TensorView.create("tv", IterDomain.create("i0", 4),
                                      IterDomain.create("i1", 4));
    tv.setComputeAt(1);
    assertFalse(tv.hasComputeWith());
    assertEquals(1, tv.getComputeWithPosition());
    tv.setComputeWith(2);
    assertTrue(tv.hasComputeWith());

    exception.expect(IllegalArgumentException.class);
    tv.setComputeWith(0);
  }

  @Test
  public void testRedefinition() {
    IterDomain i0 = IterDomain.create("i0", 4);
    TensorView tv = TensorView.create("tv", i0);
    tv.split(0, 2);
    exception.expect(IDGRuntimeError.class);
    tv.axis(0).setDefinition(TensorView.create("other",
          IterDomain.create("x", 8)).split(0, 2).axis(0).definition());
  }
}
