package org.replikativ.zip_tree;

public class Settings {
  public static final int DEFAULT_INITIAL_CAPACITY = 16;
  public static final int MIN_EXPAND_LEN = 8;
  // NONE (-1) must never be a valid slot, and JVMs refuse arrays close to Integer.MAX_VALUE
  public static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

  public final int _initialCapacity;
  public final int _expandLen;

  public Settings() {
    this(0, 0);
  }

  public Settings(int initialCapacity) {
    this(initialCapacity, 0);
  }

  // expandLen <= 0 grows by half the current capacity
  public Settings(int initialCapacity, int expandLen) {
    if (initialCapacity <= 0) {
      initialCapacity = DEFAULT_INITIAL_CAPACITY;
    }
    if (expandLen < 0) {
      expandLen = 0;
    }
    _initialCapacity = Math.min(initialCapacity, MAX_CAPACITY);
    _expandLen = expandLen;
  }

  public int initialCapacity() {
    return _initialCapacity;
  }

  public int expandLen() {
    return _expandLen;
  }

  /**
   * Capacity to grow an arena of {@code capacity} slots to so that it can hold
   * at least {@code required} slots.
   */
  public int grow(int capacity, int required) {
    if (required > MAX_CAPACITY) {
      throw new IllegalStateException("Zip tree capacity exhausted: " + required + " > " + MAX_CAPACITY);
    }
    long step = _expandLen > 0 ? _expandLen : Math.max(MIN_EXPAND_LEN, capacity >>> 1);
    long next = Math.max((long) capacity + step, required);
    return (int) Math.min(next, MAX_CAPACITY);
  }

  @Override
  public String toString() {
    return "Settings{initialCapacity=" + _initialCapacity + ", expandLen=" + _expandLen + "}";
  }
}
