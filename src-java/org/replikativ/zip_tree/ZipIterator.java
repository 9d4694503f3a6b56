package org.replikativ.zip_tree;

/**
 * Cursor over a zip tree. Steps in key order by following parent links,
 * so it needs no stack.
 *
 * A cursor is a view into the tree's arena. Any structural change to the
 * tree, including deleting through this very cursor, makes it stale; a
 * stale cursor behaves as an empty one.
 */
public class ZipIterator<Key> {
  final ZipTree<Key> _tree;
  final int _version;
  int _current;

  ZipIterator(ZipTree<Key> tree, int current) {
    _tree    = tree;
    _version = tree._version;
    _current = current;
  }

  public boolean isStale() {
    return _version != _tree._version;
  }

  public boolean isEmpty() {
    return _current == ZipTree.NONE || isStale();
  }

  /**
   * Arena slot under the cursor, {@link ZipTree#NONE} when empty.
   */
  public int index() {
    return isEmpty() ? ZipTree.NONE : _current;
  }

  public void next() {
    if (isEmpty()) {
      return;
    }
    _current = _tree.successor(_current);
  }

  public void prev() {
    if (isEmpty()) {
      return;
    }
    _current = _tree.predecessor(_current);
  }

  /**
   * @return key under the cursor, null when empty
   */
  public Key key() {
    return isEmpty() ? null : _tree.key(_current);
  }

  // diagnostics only
  public int parent() {
    return isEmpty() ? ZipTree.NONE : _tree.parent(_current);
  }

  @Override
  public String toString() {
    if (isEmpty()) {
      return isStale() ? "#<ZipIterator stale>" : "#<ZipIterator empty>";
    }
    return "#<ZipIterator " + _current + " " + key() + ">";
  }
}
