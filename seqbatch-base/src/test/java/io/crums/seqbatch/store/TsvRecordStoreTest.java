/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.store;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.seqbatch.SeqBatchException;
import io.crums.seqbatch.SeqPair;
import io.crums.seqbatch.SeqRecord;

/**
 * 
 */
public class TsvRecordStoreTest {
  
  @TempDir
  File dir;
  
  
  private File write(String name, String text) throws IOException {
    File file = new File(dir, name);
    Files.writeString(file.toPath(), text, StandardCharsets.UTF_8);
    return file;
  }
  
  
  private static List<SeqRecord> pass(RecordStore store) {
    var records = new ArrayList<SeqRecord>();
    try (var iter = store.iterator()) {
      while (iter.hasNext())
        records.add(iter.next());
    }
    return records;
  }
  
  
  private static List<Integer> yLens(List<SeqRecord> records) {
    var lens = new ArrayList<Integer>();
    for (var record : records)
      lens.add(record.yLen());
    return lens;
  }
  
  
  @Test
  public void testStreaming() throws IOException {
    File file = write("train.tsv",
        """
        5 6\t7
        1\t2 3 4
        8 9 10\t11 12
        """);
    var store = new TsvRecordStore(file);
    assertEquals(3, store.size());
    
    var records = pass(store);
    assertEquals(3, records.size());
    assertEquals(new SeqRecord(0, new int[] { 5, 6 }, new int[] { 7 }), records.get(0));
    assertEquals(new SeqRecord(1, new int[] { 1 }, new int[] { 2, 3, 4 }), records.get(1));
    assertEquals(2, records.get(2).id());
    
    assertEquals(records, pass(store));
    assertEquals(2, store.passes());
  }
  
  
  @Test
  public void testMono() throws IOException {
    File file = write("mono.tsv", "1 2 3\n4\n");
    var records = pass(new TsvRecordStore(file));
    assertEquals(2, records.size());
    assertFalse(records.get(0).hasY());
    assertArrayEquals(new int[] { 4 }, records.get(1).x());
  }
  
  
  @Test
  public void testLongestFirstEveryPass() throws IOException {
    File file = write("lf.tsv",
        """
        1\t1 1
        2\t2 2 2 2 2
        3\t3 3 3
        """);
    var options = TsvRecordStore.Options.DEFAULT.longestFirst(true);
    var store = new TsvRecordStore(file, options, new Random(1));
    for (int p = 0; p < 3; ++p)
      assertEquals(List.of(5, 3, 2), yLens(pass(store)));
  }
  
  
  @Test
  public void testShuffleIsPermutation() throws IOException {
    var text = new StringBuilder();
    for (int index = 0; index < 50; ++index)
      text.append(index + 1).append('\t').append(index + 1).append('\n');
    File file = write("shuffled.tsv", text.toString());
    var store = new TsvRecordStore(
        file, TsvRecordStore.Options.DEFAULT.shuffle(true), new Random(11));
    
    var first = pass(store);
    var second = pass(store);
    assertEquals(50, first.size());
    assertEquals(50, second.size());
    assertNotEquals(first, second);
    var ids = new ArrayList<Long>();
    for (var record : second)
      ids.add(record.id());
    ids.sort(null);
    for (int index = 0; index < 50; ++index)
      assertEquals(index, ids.get(index));
  }
  
  
  @Test
  public void testSkipOverLength() throws IOException {
    File file = write("long.tsv", "1 2 3 4\t5\n1\t2\n");
    var options = TsvRecordStore.Options.DEFAULT.maxLengths(3, 3);
    var records = pass(new TsvRecordStore(file, options, new Random()));
    assertEquals(1, records.size());
    assertEquals(1, records.get(0).id());
  }
  
  
  @Test
  public void testTruncateOverLength() throws IOException {
    File file = write("long.tsv", "1 2 3 4\t5\n1\t2\n");
    var options = TsvRecordStore.Options.DEFAULT.maxLengths(3, 3).truncate(true);
    var records = pass(new TsvRecordStore(file, options, new Random()));
    assertEquals(2, records.size());
    assertArrayEquals(new int[] { 1, 2, 3 }, records.get(0).x());
  }
  
  
  @Test
  public void testEmptyLinesSkipped() throws IOException {
    File file = write("gaps.tsv", "1\t2\n\n3\t\n4\t5\n");
    var records = pass(new TsvRecordStore(file));
    assertEquals(2, records.size());
    assertEquals(0, records.get(0).id());
    assertEquals(3, records.get(1).id());
  }
  
  
  @Test
  public void testIrregularWhitespace() throws IOException {
    File file = write("ws.tsv", "  5   6 \t 7\t8\n");
    var records = pass(new TsvRecordStore(file));
    assertEquals(1, records.size());
    assertArrayEquals(new int[] { 5, 6 }, records.get(0).x());
    // only the first tab separates the sides
    assertArrayEquals(new int[] { 7, 8 }, records.get(0).y());
  }
  
  
  @Test
  public void testMalformed() throws IOException {
    File file = write("bad.tsv", "1 2\t3\n1 x\t3\n");
    var store = new TsvRecordStore(file);
    var iter = store.iterator();
    assertTrue(iter.hasNext());
    iter.next();
    var sbx = assertThrows(SeqBatchException.class, iter::hasNext);
    assertTrue(sbx.getMessage().contains(":2"));
  }
  
  
  @Test
  public void testWriteParallel() throws IOException {
    File file = new File(dir, "out.tsv");
    long count = TsvRecordStore.writeParallel(
        List.of(
            new SeqPair(new int[] { 1, 2 }, new int[] { 3 }),
            new SeqPair(new int[] { 4 })),
        file);
    assertEquals(2, count);
    assertEquals("1 2\t3\n4\n", Files.readString(file.toPath()));
    
    var records = pass(new TsvRecordStore(file));
    assertTrue(records.get(0).hasY());
    assertFalse(records.get(1).hasY());
  }

}
