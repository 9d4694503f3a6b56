package org.replikativ.zip_tree;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * {@link Iterator} over keys in ascending order. Supports {@link #remove()};
 * any other structural change to the tree makes it fail fast.
 */
public class JavaIter<Key> implements Iterator<Key> {
  final ZipTree<Key> _tree;
  ZipIterator<Key> _cursor;
  Key _last;
  boolean _canRemove;

  JavaIter(ZipTree<Key> tree, ZipIterator<Key> cursor) {
    _tree   = tree;
    _cursor = cursor;
  }

  private void checkVersion() {
    if (_cursor.isStale()) {
      throw new ConcurrentModificationException("Zip tree was structurally modified during iteration");
    }
  }

  public boolean hasNext() {
    checkVersion();
    return !_cursor.isEmpty();
  }

  public Key next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    _last = _cursor.key();
    _canRemove = true;
    _cursor.next();
    return _last;
  }

  public void remove() {
    if (!_canRemove) {
      throw new IllegalStateException("next() has not been called, or remove() was already called");
    }
    checkVersion();
    boolean more = !_cursor.isEmpty();
    Key nextKey = more ? _cursor.key() : null;
    _tree.delete(_last);
    // compaction may have moved the successor, look it up again
    _cursor = more ? _tree.find(nextKey) : _tree.cursor(ZipTree.NONE);
    _last = null;
    _canRemove = false;
  }
}
