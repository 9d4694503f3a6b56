package org.replikativ.zip_tree;

public class ZipMapIterator<Key, Val> extends ZipIterator<Key> {
  final ZipTreeMap<Key, Val> _map;

  ZipMapIterator(ZipTreeMap<Key, Val> map, int current) {
    super(map, current);
    _map = map;
  }

  /**
   * @return value under the cursor, null when empty
   */
  public Val value() {
    return isEmpty() ? null : _map.value(_current);
  }
}
