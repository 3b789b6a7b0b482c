package exm.idg.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ExtentTest {

  @Test
  public void testConstantArithmetic() {
    Extent e = Extent.constant(10);
    assertEquals(Extent.constant(3), e.ceilDiv(Extent.constant(4)));
    assertEquals(Extent.constant(40), e.mul(Extent.constant(4)));
    assertEquals(Extent.constant(12), e.add(Extent.constant(2)));
    assertTrue(Extent.constant(1).isOne());
    assertTrue(Extent.ZERO.isZero());
  }

  @Test
  public void testSymbolic() {
    Extent n = Extent.symbolic("N");
    assertFalse(n.isConstant());
    assertTrue(n.sameAs(Extent.symbolic("N")));
    assertFalse(n.sameAs(Extent.symbolic("M")));
    assertSame(n, n.ceilDiv(Extent.ONE));
    assertSame(n, n.mul(Extent.ONE));
    assertSame(n, Extent.ZERO.add(n));
    assertEquals("ceilDiv(N, 4)", n.ceilDiv(Extent.constant(4)).toString());
  }
}
