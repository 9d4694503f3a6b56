package org.replikativ.zip_tree;

import java.util.Random;

/**
 * Zip-zip rank: a pair (r1, r2) packed into one int as {@code r1 << 16 | (1 + r2)}.
 *
 * r1 is geometric with p = 1/2 and decides the shape of the tree. r2 is
 * uniform in [0, log2(n + 1)^3) and only breaks ties between equal r1.
 * Packed values compare the same way the pairs compare lexicographically.
 */
public final class Rank {
  public static final int SECONDARY_BITS = 16;
  public static final int SECONDARY_MASK = (1 << SECONDARY_BITS) - 1;
  // keeps the packed value non-negative
  public static final int MAX_PRIMARY = Short.MAX_VALUE;

  private Rank() {
  }

  /**
   * Draws the rank for a node inserted into a tree currently holding {@code size} nodes.
   */
  public static int draw(Random random, int size) {
    int r1 = 0;
    while (random.nextInt(2) != 0) {
      if (r1 < MAX_PRIMARY) {
        r1++;
      }
    }
    int r2 = 0;
    int bound = secondaryBound(size);
    if (bound > 0) {
      r2 = random.nextInt(bound);
    }
    return pack(r1, r2);
  }

  /**
   * floor(log2(size + 1))^3, 0 for an empty tree.
   */
  public static int secondaryBound(int size) {
    if (size <= 0) {
      return 0;
    }
    int log = 31 - Integer.numberOfLeadingZeros(size + 1);
    return log * log * log;
  }

  public static int pack(int r1, int r2) {
    assert 0 <= r1 && r1 <= MAX_PRIMARY : "r1 out of range: " + r1;
    assert 0 <= r2 && r2 < SECONDARY_MASK : "r2 out of range: " + r2;
    return (r1 << SECONDARY_BITS) | (1 + r2);
  }

  public static int primary(int rank) {
    return rank >>> SECONDARY_BITS;
  }

  // stored form, i.e. 1 + r2
  public static int secondary(int rank) {
    return rank & SECONDARY_MASK;
  }

  public static String toString(int rank) {
    return "(" + primary(rank) + ", " + secondary(rank) + ")";
  }
}
