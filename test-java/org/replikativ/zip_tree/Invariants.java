package org.replikativ.zip_tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Walks the whole arena and checks every structural invariant of a zip tree.
 */
final class Invariants {
  private Invariants() {
  }

  static <Key> void check(ZipTree<Key> tree) {
    assertEquals("size vs root count", tree.size(), tree.count());
    if (tree.size() == 0) {
      assertEquals(ZipTree.NONE, tree.root());
      return;
    }
    int root = tree.root();
    assertTrue("root out of arena: " + root, 0 <= root && root < tree.size());
    assertEquals("root has a parent", ZipTree.NONE, tree.parent(root));
    int reached = checkSubtree(tree, root, null, false, null, false);
    assertEquals("nodes reachable from root", tree.size(), reached);
  }

  // returns the number of nodes in the subtree
  private static <Key> int checkSubtree(ZipTree<Key> tree, int idx, Key lo, boolean hasLo, Key hi, boolean hasHi) {
    if (idx == ZipTree.NONE) {
      return 0;
    }
    assertTrue("slot out of arena: " + idx, 0 <= idx && idx < tree.size());
    Key key = tree.key(idx);
    IOrdering<Key> ord = tree._ordering;
    if (hasLo) {
      assertTrue("BST order broken at " + key, ord.lessThan(lo, key));
    }
    if (hasHi) {
      assertTrue("BST order broken at " + key, ord.lessThan(key, hi));
    }

    int left = tree.left(idx);
    int right = tree.right(idx);
    if (left != ZipTree.NONE) {
      assertEquals("parent link of left child of " + key, idx, tree.parent(left));
      // an equal-rank left child would have the smaller key below the larger one
      assertTrue("heap order broken left of " + key, tree.rank(idx) > tree.rank(left));
    }
    if (right != ZipTree.NONE) {
      assertEquals("parent link of right child of " + key, idx, tree.parent(right));
      assertTrue("heap order broken right of " + key, tree.rank(idx) >= tree.rank(right));
    }

    int count = 1
      + checkSubtree(tree, left, lo, hasLo, key, true)
      + checkSubtree(tree, right, key, true, hi, hasHi);
    assertEquals("subtree count of " + key, count, tree.subtreeCount(idx));
    return count;
  }
}
