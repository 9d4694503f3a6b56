package org.replikativ.zip_tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import clojure.lang.*;
import org.junit.Test;

public class SeqTest {

  static List<Object> toList(ISeq seq) {
    List<Object> res = new ArrayList<Object>();
    for (ISeq s = seq; s != null; s = s.next()) {
      res.add(s.first());
    }
    return res;
  }

  static final IFn PLUS = new AFn() {
    public Object invoke(Object acc, Object x) {
      return ((Integer) acc) + ((Integer) x);
    }
  };

  @Test
  public void seqsInBothDirections() {
    ZipTree<Integer> tree = ZipTreeTest.tree(1, 4, 2, 8, 6);
    assertEquals(Arrays.asList(2, 4, 6, 8), toList(tree.seq()));
    assertEquals(Arrays.asList(8, 6, 4, 2), toList(tree.rseq()));
    assertEquals(4, RT.count(tree));
    assertNull(ZipTreeTest.tree(1).seq());
    assertNull(ZipTreeTest.tree(1).rseq());
  }

  @Test
  public void seqFromKey() {
    ZipTree<Integer> tree = ZipTreeTest.tree(2, 4, 2, 8, 6);
    assertEquals(Arrays.asList(6, 8), toList(tree.seqFrom(5, true)));
    assertEquals(Arrays.asList(6, 8), toList(tree.seqFrom(6, true)));
    assertEquals(Arrays.asList(4, 2), toList(tree.seqFrom(5, false)));
    assertNull(tree.seqFrom(9, true));
    assertNull(tree.seqFrom(1, false));
  }

  @Test
  public void seqIsASequentialList() {
    ZipTree<Integer> tree = ZipTreeTest.tree(3, 3, 1, 2);
    ISeq seq = tree.seq();
    assertEquals(RT.seq(Arrays.asList(1, 2, 3)), seq);
    assertEquals(3, seq.count());
  }

  @Test
  public void realisedSeqSurvivesMutation() {
    ZipTree<Integer> tree = ZipTreeTest.tree(4, 1, 2, 3);
    ISeq seq = tree.seq();
    List<Object> before = toList(seq);
    tree.insert(10);
    assertEquals(before, toList(seq));
  }

  @Test(expected = IllegalStateException.class)
  public void unrealisedSeqFailsAfterMutation() {
    ZipTree<Integer> tree = ZipTreeTest.tree(4, 1, 2, 3);
    ISeq seq = tree.seq();
    tree.delete(3);
    seq.next();
  }

  @Test
  public void withMetaKeepsElements() {
    ZipTree<Integer> tree = ZipTreeTest.tree(5, 1, 2);
    IPersistentMap meta = PersistentArrayMap.EMPTY.assoc(Keyword.intern("tag"), "x");
    Seq seq = (Seq) tree.seq();
    Seq tagged = seq.withMeta(meta);
    assertSame(meta, tagged.meta());
    assertEquals(toList(seq), toList(tagged));
    assertSame(seq, seq.withMeta(null));
  }

  @Test
  public void reducesWithEarlyExit() {
    ZipTree<Integer> tree = ZipTreeTest.tree(6, 1, 2, 3, 4, 5);
    assertEquals(15, tree.reduce(PLUS, 0));

    IFn upToThree = new AFn() {
      public Object invoke(Object acc, Object x) {
        int sum = (Integer) acc + (Integer) x;
        return (Integer) x >= 3 ? new Reduced(sum) : sum;
      }
    };
    assertEquals(6, tree.reduce(upToThree, 0));
  }

  @Test
  public void sortedInterface() {
    ZipTree<Integer> tree = ZipTreeTest.tree(7, 1, 2);
    assertEquals(-1, Integer.signum(tree.comparator().compare(1, 2)));
    assertEquals(5, tree.entryKey(5));
  }

  @Test
  public void mapSeqsOverEntries() {
    ZipTreeMap<Integer, String> map = ZipTreeMapTest.map(8);
    map.put(2, "b");
    map.put(1, "a");
    map.put(3, "c");

    List<Object> entries = toList(map.seq());
    assertEquals(3, entries.size());
    Map.Entry first = (Map.Entry) entries.get(0);
    assertEquals(1, first.getKey());
    assertEquals("a", first.getValue());
    assertEquals(1, map.entryKey(first));

    Map.Entry last = (Map.Entry) map.rseq().first();
    assertEquals(3, last.getKey());
    assertEquals("c", last.getValue());
  }

  @Test
  public void mapKvReduce() {
    ZipTreeMap<Integer, String> map = ZipTreeMapTest.map(9);
    map.put(2, "b");
    map.put(1, "a");
    map.put(3, "c");
    IFn concat = new AFn() {
      public Object invoke(Object acc, Object k, Object v) {
        return acc + "" + k + v;
      }
    };
    assertEquals("1a2b3c", map.kvreduce(concat, ""));

    IFn firstOnly = new AFn() {
      public Object invoke(Object acc, Object k, Object v) {
        return new Reduced(v);
      }
    };
    assertEquals("a", map.kvreduce(firstOnly, null));
  }
}
