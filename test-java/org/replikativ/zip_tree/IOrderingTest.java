package org.replikativ.zip_tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Comparator;
import org.junit.Test;

public class IOrderingTest {
  private final IOrdering<Integer> ints = (a, b) -> a < b;

  @Test
  public void derivesRelationsFromLessThan() {
    assertTrue(ints.lessThan(1, 2));
    assertFalse(ints.lessThan(2, 2));

    assertTrue(ints.greaterThan(3, 2));
    assertFalse(ints.greaterThan(2, 3));

    assertTrue(ints.lessThanOrEqual(2, 2));
    assertTrue(ints.lessThanOrEqual(1, 2));
    assertFalse(ints.lessThanOrEqual(3, 2));

    assertTrue(ints.greaterThanOrEqual(2, 2));
    assertTrue(ints.greaterThanOrEqual(3, 2));
    assertFalse(ints.greaterThanOrEqual(1, 2));

    assertTrue(ints.equal(7, 7));
    assertFalse(ints.equal(7, 8));
  }

  @Test
  public void compareFollowsComparatorConvention() {
    assertEquals(-1, ints.compare(1, 2));
    assertEquals(0, ints.compare(2, 2));
    assertEquals(1, ints.compare(3, 2));

    Comparator<Integer> cmp = ints.asComparator();
    assertTrue(cmp.compare(1, 2) < 0);
    assertTrue(cmp.compare(5, 2) > 0);
  }

  @Test
  public void wrapsComparator() {
    IOrdering<String> byLength = IOrdering.of(Comparator.<String>comparingInt(String::length));
    assertTrue(byLength.lessThan("a", "bb"));
    // equal under the ordering even though the strings differ
    assertTrue(byLength.equal("ab", "cd"));

    IOrdering<Integer> reversed = IOrdering.of(Comparator.<Integer>reverseOrder());
    assertTrue(reversed.lessThan(5, 1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsNullComparator() {
    IOrdering.of(null);
  }

  @Test
  public void naturalOrderingUsesClojureDefaultComparator() {
    IOrdering<Object> natural = IOrdering.natural();
    assertTrue(natural.lessThan(1, 2L));
    assertTrue(natural.equal(2, 2L));
    assertTrue(natural.lessThan("apple", "banana"));
  }
}
