package org.replikativ.zip_tree;

import java.util.Arrays;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Random;
import clojure.lang.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable ordered set on a zip-zip tree with order statistics.
 *
 * Nodes live in a flat arena of parallel columns addressed by int slots.
 * The arena is always dense: a deleted node's slot is refilled with the node
 * from the last slot, so a slot handle is only valid until the next
 * structural change. Cursors detect that through {@link #_version}.
 *
 * Tree invariants, for every live slot:
 *
 *   keys in left subtree  &lt; key &lt; keys in right subtree
 *   rank &gt;= rank of both children, on equal ranks the smaller key is the ancestor
 *   count == 1 + count(left) + count(right)
 *
 * Not thread-safe.
 */
@SuppressWarnings("unchecked")
public class ZipTree<Key> implements Counted, Seqable, Reversible, Sorted, IReduceInit, Iterable<Key> {
  private static final Logger logger = LoggerFactory.getLogger(ZipTree.class);

  public static final int NONE = -1;
  public static final int NOT_FOUND = -1;

  public final IOrdering<Key> _ordering;
  public final Settings _settings;
  final Random _random;

  // Only valid [0 ... _len-1]
  Object[] _keys;
  int[] _left;
  int[] _right;
  int[] _parent;
  int[] _rank;
  int[] _count;

  int _len;
  int _root;
  int _version;

  public ZipTree() {
    this(IOrdering.natural());
  }

  public ZipTree(IOrdering<Key> ordering) {
    this(ordering, null);
  }

  public ZipTree(IOrdering<Key> ordering, Random random) {
    this(ordering, random, new Settings());
  }

  /**
   * @param random owned by this tree from now on, null for a fresh unseeded one
   */
  public ZipTree(IOrdering<Key> ordering, Random random, Settings settings) {
    if (ordering == null) {
      throw new IllegalArgumentException("Ordering must not be null");
    }
    _ordering = ordering;
    _random   = random != null ? random : new Random();
    _settings = settings != null ? settings : new Settings();

    int capacity = _settings.initialCapacity();
    _keys   = new Object[capacity];
    _left   = new int[capacity];
    _right  = new int[capacity];
    _parent = new int[capacity];
    _rank   = new int[capacity];
    _count  = new int[capacity];
    _len    = 0;
    _root   = NONE;
    logger.debug("New {} with {} random source, {}", getClass().getSimpleName(), random != null ? "supplied" : "fresh", _settings);
  }

  public static <Key> ZipTree<Key> fromComparator(Comparator<? super Key> cmp) {
    return new ZipTree<Key>(IOrdering.of(cmp));
  }

  // arena accessors

  Key key(int idx) {
    return (Key) _keys[idx];
  }

  int left(int idx) {
    return _left[idx];
  }

  int right(int idx) {
    return _right[idx];
  }

  int parent(int idx) {
    return _parent[idx];
  }

  int rank(int idx) {
    return _rank[idx];
  }

  int subtreeCount(int idx) {
    return idx == NONE ? 0 : _count[idx];
  }

  int root() {
    return _root;
  }

  private void ensureCapacity(int required) {
    int capacity = _keys.length;
    if (required <= capacity) {
      return;
    }
    int newCapacity = _settings.grow(capacity, required);
    logger.trace("Growing arena from {} to {} slots", capacity, newCapacity);
    resize(newCapacity);
  }

  /**
   * Reallocates every arena column to {@code capacity} slots.
   * Subclasses carrying extra columns must resize them here too.
   */
  protected void resize(int capacity) {
    _keys   = Arrays.copyOf(_keys, capacity);
    _left   = Arrays.copyOf(_left, capacity);
    _right  = Arrays.copyOf(_right, capacity);
    _parent = Arrays.copyOf(_parent, capacity);
    _rank   = Arrays.copyOf(_rank, capacity);
    _count  = Arrays.copyOf(_count, capacity);
  }

  /**
   * Copies the whole slot {@code from} over slot {@code to}. The only way
   * a slot ever moves, so subclasses carrying extra columns must move them here.
   * Links pointing at {@code from} are fixed by the caller.
   */
  protected void relocate(int from, int to) {
    _keys[to]   = _keys[from];
    _left[to]   = _left[from];
    _right[to]  = _right[from];
    _parent[to] = _parent[from];
    _rank[to]   = _rank[from];
    _count[to]  = _count[from];
  }

  /**
   * Drops references held by a slot that is no longer live.
   */
  protected void release(int idx) {
    _keys[idx] = null;
  }

  // lookups, all return a slot or NONE

  int slotOf(Key key) {
    int curr = _root;
    while (curr != NONE) {
      Key k = key(curr);
      if (_ordering.lessThan(key, k)) {
        curr = _left[curr];
      } else if (_ordering.greaterThan(key, k)) {
        curr = _right[curr];
      } else {
        break;
      }
    }
    return curr;
  }

  int minimumSlot() {
    int curr = _root;
    if (curr == NONE) return NONE;
    while (_left[curr] != NONE) {
      curr = _left[curr];
    }
    return curr;
  }

  int maximumSlot() {
    int curr = _root;
    if (curr == NONE) return NONE;
    while (_right[curr] != NONE) {
      curr = _right[curr];
    }
    return curr;
  }

  int floorSlot(Key key) {
    int res = NONE;
    int curr = _root;
    while (curr != NONE) {
      if (_ordering.lessThan(key, key(curr))) {
        curr = _left[curr];
      } else {
        res = curr;
        curr = _right[curr];
      }
    }
    return res;
  }

  int ceilingSlot(Key key) {
    int res = NONE;
    int curr = _root;
    while (curr != NONE) {
      if (_ordering.greaterThan(key, key(curr))) {
        curr = _right[curr];
      } else {
        res = curr;
        curr = _left[curr];
      }
    }
    return res;
  }

  int upperBoundSlot(Key key) {
    int res = NONE;
    int curr = _root;
    while (curr != NONE) {
      if (_ordering.greaterThanOrEqual(key, key(curr))) {
        curr = _right[curr];
      } else {
        res = curr;
        curr = _left[curr];
      }
    }
    return res;
  }

  int slotAt(int index) {
    if (index < 0) return NONE;
    int curr = _root;
    while (curr != NONE) {
      int leftCount = subtreeCount(_left[curr]);
      if (index < leftCount) {
        curr = _left[curr];
      } else if (index > leftCount) {
        index -= leftCount + 1;
        curr = _right[curr];
      } else {
        break;
      }
    }
    return curr;
  }

  int successor(int idx) {
    if (_right[idx] != NONE) {
      idx = _right[idx];
      while (_left[idx] != NONE) {
        idx = _left[idx];
      }
      return idx;
    }
    int parent = _parent[idx];
    while (parent != NONE && _right[parent] == idx) {
      idx = parent;
      parent = _parent[parent];
    }
    return parent;
  }

  int predecessor(int idx) {
    if (_left[idx] != NONE) {
      idx = _left[idx];
      while (_right[idx] != NONE) {
        idx = _right[idx];
      }
      return idx;
    }
    int parent = _parent[idx];
    while (parent != NONE && _left[parent] == idx) {
      idx = parent;
      parent = _parent[parent];
    }
    return parent;
  }

  // structural changes

  /**
   * Appends a node for {@code key}, which must not be present, and links it in.
   * Returns the new node's slot.
   */
  int insertNode(Key key) {
    ensureCapacity(_len + 1);
    int idx = _len;
    int rank = Rank.draw(_random, _len);
    _keys[idx]   = key;
    _left[idx]   = NONE;
    _right[idx]  = NONE;
    _parent[idx] = NONE;
    _rank[idx]   = rank;
    _count[idx]  = 1;
    _len += 1;

    // find where the new node goes: below everything with a higher rank,
    // and below equal ranks with smaller keys
    int root = _root;
    int curr = root;
    int prev = NONE;
    while (curr != NONE && (rank < _rank[curr] || (rank == _rank[curr] && _ordering.lessThan(key(curr), key)))) {
      prev = curr;
      curr = _ordering.lessThan(key, key(curr)) ? _left[curr] : _right[curr];
    }

    if (curr == root) {
      _root = idx;
    } else {
      if (_ordering.lessThan(key, key(prev))) {
        _left[prev] = idx;
      } else {
        _right[prev] = idx;
      }
      _parent[idx] = prev;
    }

    if (curr != NONE) {
      unzip(idx, curr);
    }
    fixupCount(idx, NONE);

    _version += 1;
    return idx;
  }

  /**
   * Splits the subtree at {@code curr}, just displaced by the new node {@code idx},
   * into the keys below and above the new key. Each side becomes a chain of
   * alternating runs hanging off {@code idx}.
   */
  private void unzip(int idx, int curr) {
    Key key = key(idx);
    if (_ordering.lessThan(key, key(curr))) {
      _right[idx] = curr;
    } else {
      _left[idx] = curr;
    }
    _parent[curr] = idx;

    int prev = idx;
    while (curr != NONE) {
      int fix = prev;
      if (_ordering.greaterThan(key, key(curr))) {
        while (curr != NONE && _ordering.greaterThanOrEqual(key, key(curr))) {
          prev = curr;
          curr = _right[curr];
        }
      } else {
        while (curr != NONE && _ordering.lessThanOrEqual(key, key(curr))) {
          prev = curr;
          curr = _left[curr];
        }
      }

      // fix is idx itself on the first pass, otherwise the tail of the opposite run
      if (_ordering.lessThan(key, key(fix)) || (fix == idx && _ordering.lessThan(key, key(prev)))) {
        _left[fix] = curr;
      } else {
        _right[fix] = curr;
      }
      if (curr != NONE) {
        _parent[curr] = fix;
      }
      fixupCount(fix, idx);
    }
  }

  /**
   * Detaches the node at {@code idx} and zips its subtrees together in its place.
   * The slot itself stays allocated.
   */
  private void unlink(int idx) {
    int prev = _parent[idx];
    int left = _left[idx];
    int right = _right[idx];

    int curr;
    if (left == NONE) {
      curr = right;
    } else if (right == NONE) {
      curr = left;
    } else if (_rank[left] >= _rank[right]) {
      curr = left;
    } else {
      curr = right;
    }

    if (_root == idx) {
      _root = curr;
    } else if (_left[prev] == idx) {
      _left[prev] = curr;
    } else {
      _right[prev] = curr;
    }
    if (curr != NONE) {
      _parent[curr] = prev;
    }

    // zip: walk down the right spine of the left side and the left spine of
    // the right side, handing over whenever the other side outranks
    while (left != NONE && right != NONE) {
      if (_rank[left] >= _rank[right]) {
        int rightRank = _rank[right];
        while (left != NONE && _rank[left] >= rightRank) {
          prev = left;
          left = _right[left];
        }
        _right[prev] = right;
        _parent[right] = prev;
      } else {
        int leftRank = _rank[left];
        while (right != NONE && leftRank < _rank[right]) {
          prev = right;
          right = _left[right];
        }
        _left[prev] = left;
        _parent[left] = prev;
      }
    }
    fixupCount(prev, NONE);
  }

  /**
   * Refills the unlinked slot {@code idx} with the last slot and shrinks the arena.
   */
  private void compact(int idx) {
    int last = _len - 1;
    if (idx != last) {
      relocate(last, idx);
      int left = _left[idx], right = _right[idx], parent = _parent[idx];
      if (left != NONE) {
        _parent[left] = idx;
      }
      if (right != NONE) {
        _parent[right] = idx;
      }
      if (parent != NONE) {
        if (_left[parent] == last) {
          _left[parent] = idx;
        } else {
          _right[parent] = idx;
        }
      }
      if (_root == last) {
        _root = idx;
      }
      logger.trace("Relocated slot {} to {}", last, idx);
    }
    release(last);
    _len = last;
  }

  boolean deleteSlot(int idx) {
    if (idx == NONE) {
      return false;
    }
    unlink(idx);
    compact(idx);
    _version += 1;
    return true;
  }

  // recomputes counts from idx up to, not including, limit
  void fixupCount(int idx, int limit) {
    while (idx != limit) {
      _count[idx] = 1 + subtreeCount(_left[idx]) + subtreeCount(_right[idx]);
      idx = _parent[idx];
    }
  }

  // public API

  /**
   * @return true if the key was added, false if it was already present
   */
  public boolean insert(Key key) {
    if (slotOf(key) != NONE) {
      return false;
    }
    insertNode(key);
    return true;
  }

  /**
   * @return true if the key was removed, false if it was not present
   */
  public boolean delete(Key key) {
    return deleteSlot(slotOf(key));
  }

  /**
   * Deletes the entry under the cursor. The cursor, like every other
   * cursor on this tree, is stale afterwards.
   *
   * @return false if the cursor is empty or stale
   */
  public boolean deleteIter(ZipIterator<Key> iter) {
    if (iter == null || iter.isEmpty()) {
      return false;
    }
    if (iter._tree != this) {
      throw new IllegalArgumentException("Iterator belongs to a different tree");
    }
    return deleteSlot(iter._current);
  }

  public boolean contains(Key key) {
    return slotOf(key) != NONE;
  }

  public void clear() {
    for (int i = 0; i < _len; ++i) {
      release(i);
    }
    _len = 0;
    _root = NONE;
    _version += 1;
  }

  protected ZipIterator<Key> cursor(int idx) {
    return new ZipIterator<Key>(this, idx);
  }

  public ZipIterator<Key> find(Key key) {
    return cursor(slotOf(key));
  }

  /**
   * Greatest key less than or equal to {@code key}.
   */
  public ZipIterator<Key> floor(Key key) {
    return cursor(floorSlot(key));
  }

  /**
   * Least key greater than or equal to {@code key}.
   */
  public ZipIterator<Key> ceiling(Key key) {
    return cursor(ceilingSlot(key));
  }

  /**
   * First key not ordered before {@code key}. Same as {@link #ceiling}.
   */
  public ZipIterator<Key> lowerBound(Key key) {
    return cursor(ceilingSlot(key));
  }

  /**
   * First key ordered after {@code key}.
   */
  public ZipIterator<Key> upperBound(Key key) {
    return cursor(upperBoundSlot(key));
  }

  public ZipIterator<Key> minimum() {
    return cursor(minimumSlot());
  }

  public ZipIterator<Key> maximum() {
    return cursor(maximumSlot());
  }

  /**
   * Cursor at the {@code index}-th smallest key, 0-based. Empty if out of range.
   */
  public ZipIterator<Key> atIndex(int index) {
    return cursor(slotAt(index));
  }

  /**
   * Number of keys ordered before {@code key}, or {@link #NOT_FOUND} if it is not present.
   */
  public int indexOf(Key key) {
    int curr = _root;
    int res = 0;
    while (curr != NONE) {
      Key k = key(curr);
      if (_ordering.lessThan(key, k)) {
        curr = _left[curr];
      } else {
        res += subtreeCount(_left[curr]);
        if (_ordering.greaterThan(key, k)) {
          res += 1;
          curr = _right[curr];
        } else {
          return res;
        }
      }
    }
    return NOT_FOUND;
  }

  public ZipIterator<Key> newIterator() {
    return cursor(minimumSlot());
  }

  public ZipIterator<Key> newReverseIterator() {
    return cursor(maximumSlot());
  }

  /**
   * Number of live arena slots.
   */
  public int size() {
    return _len;
  }

  public boolean isEmpty() {
    return _len == 0;
  }

  // Counted

  /**
   * Subtree count of the root. Always equal to {@link #size()}.
   */
  public int count() {
    return _root == NONE ? 0 : _count[_root];
  }

  // Seqable, Reversible, Sorted

  /**
   * What seqs and reductions yield for the slot: the key itself for sets.
   */
  Object entryAt(int idx) {
    return _keys[idx];
  }

  public ISeq seq() {
    return seq(true);
  }

  public ISeq rseq() {
    return seq(false);
  }

  public ISeq seq(boolean ascending) {
    int start = ascending ? minimumSlot() : maximumSlot();
    return start == NONE ? null : new Seq(null, this, start, ascending, _version);
  }

  public ISeq seqFrom(Object key, boolean ascending) {
    int start = ascending ? ceilingSlot((Key) key) : floorSlot((Key) key);
    return start == NONE ? null : new Seq(null, this, start, ascending, _version);
  }

  public Comparator comparator() {
    return _ordering.asComparator();
  }

  public Object entryKey(Object entry) {
    return entry;
  }

  // IReduceInit
  public Object reduce(IFn f, Object start) {
    int version = _version;
    Object acc = start;
    for (int idx = minimumSlot(); idx != NONE; idx = successor(idx)) {
      acc = f.invoke(acc, entryAt(idx));
      if (RT.isReduced(acc)) {
        return ((IDeref) acc).deref();
      }
      if (version != _version) {
        throw new ConcurrentModificationException("Tree modified during reduce");
      }
    }
    return acc;
  }

  // Iterable
  public Iterator<Key> iterator() {
    return new JavaIter<Key>(this, newIterator());
  }

  // diagnostics

  String nodeString(int idx) {
    return "Key: " + _keys[idx] + ", Rank: " + Rank.toString(_rank[idx]) + ", Count: " + _count[idx];
  }

  /**
   * Pre-order dump of the tree, one node per line.
   */
  public String str() {
    StringBuilder sb = new StringBuilder();
    str(sb, _root, "", false, false);
    return sb.toString();
  }

  private void str(StringBuilder sb, int idx, String prefix, boolean isLeft, boolean hasBoth) {
    if (idx == NONE) {
      return;
    }
    boolean branch = isLeft && hasBoth;
    sb.append(prefix)
      .append(branch ? "├── " : "└── ")
      .append("Idx: ").append(idx).append(", ")
      .append(nodeString(idx))
      .append(", Parent: ").append(Integer.toUnsignedString(_parent[idx]))
      .append('\n');
    String childPrefix = prefix + (branch ? "│   " : "    ");
    boolean both = _left[idx] != NONE && _right[idx] != NONE;
    str(sb, _left[idx], childPrefix, true, both);
    str(sb, _right[idx], childPrefix, false, both);
  }

  /**
   * Nodes in ascending key order, one per line.
   */
  public String strInOrder() {
    StringBuilder sb = new StringBuilder();
    for (int idx = minimumSlot(); idx != NONE; idx = successor(idx)) {
      sb.append(nodeString(idx)).append('\n');
    }
    return sb.toString();
  }

  public String toString() {
    StringBuilder sb = new StringBuilder("#{");
    for (int idx = minimumSlot(); idx != NONE; idx = successor(idx)) {
      sb.append(_keys[idx]).append(" ");
    }
    if (sb.charAt(sb.length() - 1) == ' ') {
      sb.delete(sb.length() - 1, sb.length());
    }
    sb.append("}");
    return sb.toString();
  }
}
