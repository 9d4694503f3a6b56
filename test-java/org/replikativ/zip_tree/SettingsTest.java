package org.replikativ.zip_tree;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class SettingsTest {

  @Test
  public void fallsBackToDefaults() {
    Settings settings = new Settings(-3, -1);
    assertEquals(Settings.DEFAULT_INITIAL_CAPACITY, settings.initialCapacity());
    assertEquals(0, settings.expandLen());
  }

  @Test
  public void growsByHalfWithMinimumStep() {
    Settings settings = new Settings();
    assertEquals(9, settings.grow(1, 2));
    assertEquals(24, settings.grow(16, 17));
    assertEquals(150, settings.grow(100, 150));
  }

  @Test
  public void growsByFixedStep() {
    Settings settings = new Settings(4, 4);
    assertEquals(8, settings.grow(4, 5));
    assertEquals(20, settings.grow(8, 20));
  }

  @Test(expected = IllegalStateException.class)
  public void refusesToGrowPastMaximum() {
    new Settings().grow(Settings.MAX_CAPACITY, Settings.MAX_CAPACITY + 1);
  }

  @Test
  public void smallArenaGrowsTransparently() {
    ZipTree<Integer> tree = new ZipTree<Integer>((a, b) -> a < b, new java.util.Random(1), new Settings(1, 1));
    for (int i = 0; i < 100; ++i) {
      tree.insert(i);
    }
    assertEquals(100, tree.size());
    Invariants.check(tree);
  }
}
