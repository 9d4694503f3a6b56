package org.replikativ.zip_tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

/**
 * Random source that hands out the ranks a test asks for.
 */
class ScriptedRandom extends Random {
  private final Deque<Integer> _draws = new ArrayDeque<Integer>();

  /**
   * Scripts the rank of the next node inserted into a tree of {@code size} nodes.
   */
  ScriptedRandom rank(int size, int r1, int r2) {
    for (int i = 0; i < r1; ++i) {
      _draws.add(1);
    }
    _draws.add(0);
    if (Rank.secondaryBound(size) > 0) {
      _draws.add(r2);
    }
    return this;
  }

  boolean exhausted() {
    return _draws.isEmpty();
  }

  @Override
  public int nextInt(int bound) {
    Integer next = _draws.poll();
    if (next == null) {
      throw new IllegalStateException("Random script exhausted");
    }
    if (next >= bound) {
      throw new IllegalStateException("Scripted draw " + next + " out of bound " + bound);
    }
    return next;
  }
}
