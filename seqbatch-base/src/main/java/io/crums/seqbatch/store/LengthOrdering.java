/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.store;


import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Sorts {@linkplain LengthRow}s per a {@linkplain ReadOrder} using an explicit
 * random source, so that a given seed reproduces the same order.
 * 
 * <h2>Jitter</h2>
 * <p>
 * For the length policies each row is assigned the key
 * {@code length + random.nextInt(lenRand)} and rows are (stably) sorted on
 * that key. Only the statistical shape matters here: near-length-sorted
 * output with a controlled amount of mixing between adjacent lengths.
 * </p><p>
 * The target-length policies fall back to the source length for rows that
 * have no target.
 * </p>
 */
public class LengthOrdering {
  
  private LengthOrdering() {  }
  
  
  /**
   * Returns a new list containing the given rows in the given order.
   * 
   * @param rows    the rows (not modified)
   * @param order   the policy
   * @param lenRand jitter window (&ge; 1)
   * @param random  the random source (consumed)
   */
  public static List<LengthRow> sort(
      List<LengthRow> rows, ReadOrder order, int lenRand, Random random) {
    
    Objects.requireNonNull(order, "null order");
    Objects.requireNonNull(random, "null random");
    if (lenRand < 1)
      throw new IllegalArgumentException("lenRand " + lenRand);
    
    if (order == ReadOrder.RANDOM) {
      var copy = new ArrayList<>(rows);
      Collections.shuffle(copy, random);
      return copy;
    }
    
    final int count = rows.size();
    long[] keys = new long[count];
    Integer[] index = new Integer[count];
    for (int i = 0; i < count; ++i) {
      LengthRow row = rows.get(i);
      int len = order.byTarget() ? targetLen(row) : row.xLen();
      keys[i] = lenRand == 1 ? len : len + random.nextInt(lenRand);
      index[i] = i;
    }
    
    Comparator<Integer> byKey = (a, b) -> Long.compare(keys[a], keys[b]);
    if (order.descending())
      byKey = byKey.reversed();
    
    // stable
    Arrays.sort(index, byKey);
    
    var sorted = new ArrayList<LengthRow>(count);
    for (int i : index)
      sorted.add(rows.get(i));
    return sorted;
  }
  
  
  private static int targetLen(LengthRow row) {
    return row.yLen() >= 0 ? row.yLen() : row.xLen();
  }

}
