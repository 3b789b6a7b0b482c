package exm.idg.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class UniqueListTest {

  @Test
  public void testInsertionOrder() {
    UniqueList<String> l = UniqueList.create();
    assertTrue(l.pushBack("c"));
    assertTrue(l.pushBack("a"));
    assertFalse(l.pushBack("c"));
    l.pushBack(Arrays.asList("b", "a", "d"));
    assertEquals(Arrays.asList("c", "a", "b", "d"), l.toList());
    assertEquals("c", l.front());
  }

  @Test
  public void testWorkList() {
    UniqueList<Integer> l = UniqueList.of(3, 1, 2);
    assertEquals(3, (int)l.popFront());
    // Popped values can be pushed again
    l.pushBack(3);
    assertEquals(Arrays.asList(1, 2, 3), l.toList());
  }

  @Test
  public void testSetOperations() {
    UniqueList<Integer> l = UniqueList.of(1, 2, 3, 4);
    assertEquals(Arrays.asList(2, 4), l.intersect(Arrays.asList(4, 2, 9))
                                                               .toList());
    assertEquals(Arrays.asList(1, 3), l.subtract(Arrays.asList(4, 2))
                                                               .toList());
    assertEquals(Arrays.asList(1, 2, 3, 4, 7),
                 l.computeUnion(Arrays.asList(7, 1)).toList());
    // Unchanged
    assertEquals(4, l.size());
  }

  @Test
  public void testSetEquality() {
    assertEquals(UniqueList.of(1, 2), UniqueList.of(2, 1));
  }
}
