package org.replikativ.zip_tree;

import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.Map;
import java.util.Random;
import clojure.lang.*;

/**
 * Mutable ordered map: a {@link ZipTree} of keys plus a value column.
 *
 * {@code _vals[i]} always belongs to the key in arena slot {@code i}. The
 * column is resized, relocated and released by the same hooks that move
 * the key columns, so the two never drift apart.
 *
 * Every key needs a value: {@link #insert(Object)} is not supported, use {@link #put}.
 */
@SuppressWarnings("unchecked")
public class ZipTreeMap<Key, Val> extends ZipTree<Key> implements IKVReduce {
  // Only valid [0 ... _len-1]
  Object[] _vals;

  public ZipTreeMap() {
    this(IOrdering.natural());
  }

  public ZipTreeMap(IOrdering<Key> ordering) {
    this(ordering, null);
  }

  public ZipTreeMap(IOrdering<Key> ordering, Random random) {
    this(ordering, random, new Settings());
  }

  public ZipTreeMap(IOrdering<Key> ordering, Random random, Settings settings) {
    super(ordering, random, settings);
    _vals = new Object[_keys.length];
  }

  Val value(int idx) {
    return (Val) _vals[idx];
  }

  @Override
  protected void resize(int capacity) {
    super.resize(capacity);
    _vals = Arrays.copyOf(_vals, capacity);
  }

  @Override
  protected void relocate(int from, int to) {
    super.relocate(from, to);
    _vals[to] = _vals[from];
  }

  @Override
  protected void release(int idx) {
    super.release(idx);
    _vals[idx] = null;
  }

  @Override
  protected ZipMapIterator<Key, Val> cursor(int idx) {
    return new ZipMapIterator<Key, Val>(this, idx);
  }

  /**
   * Always throws: a key without a value would break the value column.
   */
  @Override
  public boolean insert(Key key) {
    throw new UnsupportedOperationException("insert(key) is not supported by ZipTreeMap, use put(key, value)");
  }

  /**
   * @return true if a new entry was created, false if an existing value was replaced
   */
  public boolean put(Key key, Val value) {
    int idx = slotOf(key);
    if (idx == NONE) {
      idx = insertNode(key);
      _vals[idx] = value;
      return true;
    }
    _vals[idx] = value;
    return false;
  }

  public Val get(Key key) {
    return get(key, null);
  }

  public Val get(Key key, Val notFound) {
    int idx = slotOf(key);
    return idx == NONE ? notFound : value(idx);
  }

  public boolean containsKey(Key key) {
    return slotOf(key) != NONE;
  }

  @Override
  public ZipMapIterator<Key, Val> find(Key key) {
    return (ZipMapIterator<Key, Val>) super.find(key);
  }

  @Override
  public ZipMapIterator<Key, Val> floor(Key key) {
    return (ZipMapIterator<Key, Val>) super.floor(key);
  }

  @Override
  public ZipMapIterator<Key, Val> ceiling(Key key) {
    return (ZipMapIterator<Key, Val>) super.ceiling(key);
  }

  @Override
  public ZipMapIterator<Key, Val> lowerBound(Key key) {
    return (ZipMapIterator<Key, Val>) super.lowerBound(key);
  }

  @Override
  public ZipMapIterator<Key, Val> upperBound(Key key) {
    return (ZipMapIterator<Key, Val>) super.upperBound(key);
  }

  @Override
  public ZipMapIterator<Key, Val> minimum() {
    return (ZipMapIterator<Key, Val>) super.minimum();
  }

  @Override
  public ZipMapIterator<Key, Val> maximum() {
    return (ZipMapIterator<Key, Val>) super.maximum();
  }

  @Override
  public ZipMapIterator<Key, Val> atIndex(int index) {
    return (ZipMapIterator<Key, Val>) super.atIndex(index);
  }

  @Override
  public ZipMapIterator<Key, Val> newIterator() {
    return (ZipMapIterator<Key, Val>) super.newIterator();
  }

  @Override
  public ZipMapIterator<Key, Val> newReverseIterator() {
    return (ZipMapIterator<Key, Val>) super.newReverseIterator();
  }

  // Seqable, Sorted

  @Override
  Object entryAt(int idx) {
    return MapEntry.create(_keys[idx], _vals[idx]);
  }

  @Override
  public Object entryKey(Object entry) {
    return ((Map.Entry) entry).getKey();
  }

  // IKVReduce
  public Object kvreduce(IFn f, Object init) {
    int version = _version;
    Object acc = init;
    for (int idx = minimumSlot(); idx != NONE; idx = successor(idx)) {
      acc = f.invoke(acc, _keys[idx], _vals[idx]);
      if (RT.isReduced(acc)) {
        return ((IDeref) acc).deref();
      }
      if (version != _version) {
        throw new ConcurrentModificationException("Tree modified during kvreduce");
      }
    }
    return acc;
  }

  // diagnostics

  @Override
  String nodeString(int idx) {
    return "Key: " + _keys[idx] + ", Value: " + _vals[idx] + ", Rank: " + Rank.toString(_rank[idx]) + ", Count: " + _count[idx];
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (int idx = minimumSlot(); idx != NONE; idx = successor(idx)) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(_keys[idx]).append(" ").append(_vals[idx]);
    }
    sb.append("}");
    return sb.toString();
  }
}
