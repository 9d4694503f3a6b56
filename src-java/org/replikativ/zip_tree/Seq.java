package org.replikativ.zip_tree;

import clojure.lang.*;

/**
 * Lazy seq over a zip tree in ascending or descending order.
 * Realised elements stay valid; walking further after the tree has been
 * structurally changed throws.
 */
@SuppressWarnings("rawtypes")
public class Seq extends ASeq {
  final ZipTree _tree;
  final int     _idx;
  final boolean _asc;
  final int     _version;
  final Object  _first;
  ISeq          _next;
  boolean       _nextRealized;

  Seq(IPersistentMap meta, ZipTree tree, int idx, boolean asc, int version) {
    super(meta);
    _tree    = tree;
    _idx     = idx;
    _asc     = asc;
    _version = version;
    _first   = tree.entryAt(idx);
  }

  private Seq(IPersistentMap meta, Seq seq) {
    super(meta);
    _tree         = seq._tree;
    _idx          = seq._idx;
    _asc          = seq._asc;
    _version      = seq._version;
    _first        = seq._first;
    _next         = seq._next;
    _nextRealized = seq._nextRealized;
  }

  void checkVersion() {
    if (_version != _tree._version) {
      throw new IllegalStateException("Zip tree was structurally modified while a seq over it was being walked");
    }
  }

  public Object first() {
    return _first;
  }

  public ISeq next() {
    if (!_nextRealized) {
      checkVersion();
      int idx = _asc ? _tree.successor(_idx) : _tree.predecessor(_idx);
      _next = idx == ZipTree.NONE ? null : new Seq(null, _tree, idx, _asc, _version);
      _nextRealized = true;
    }
    return _next;
  }

  public Seq withMeta(IPersistentMap meta) {
    if (meta() == meta) {
      return this;
    }
    return new Seq(meta, this);
  }
}
