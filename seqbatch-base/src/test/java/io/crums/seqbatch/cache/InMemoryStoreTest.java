/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.cache;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.seqbatch.ByteFormatException;
import io.crums.seqbatch.DuplicateIdException;
import io.crums.seqbatch.MissingRecordException;
import io.crums.seqbatch.SeqPair;
import io.crums.seqbatch.SeqRecord;
import io.crums.seqbatch.store.LengthRow;
import io.crums.seqbatch.store.ReadOrder;
import io.crums.seqbatch.store.TsvRecordStore;

/**
 * 
 */
public class InMemoryStoreTest {
  
  @TempDir
  File dir;
  
  
  private static List<SeqRecord> sample() {
    return List.of(
        new SeqRecord(10, new int[] { 1, 2 }, new int[] { 3 }),
        new SeqRecord(11, new int[] { 4 }, new int[] { 5, 6, 7 }),
        new SeqRecord(12, new int[] { 8, 9, 10, 11 }, new int[] { 12, 13 }));
  }
  
  
  private static List<SeqRecord> pass(InMemoryStore store) {
    var records = new ArrayList<SeqRecord>();
    store.forEach(records::add);
    return records;
  }
  
  
  @Test
  public void testLoadOrderAndIds() {
    var store = new InMemoryStore(sample(), null, new Random());
    assertEquals(3, store.size());
    assertEquals(sample(), pass(store));
    
    var got = store.getByIds(new long[] { 12, 10 });
    assertEquals(12, got.get(0).id());
    assertEquals(10, got.get(1).id());
  }
  
  
  @Test
  public void testMonoLengthIndex() {
    int[] xLens = { 1, 5, 2, 4, 3, 1, 5 };
    var records = new ArrayList<SeqRecord>();
    for (int index = 0; index < xLens.length; ++index)
      records.add(new SeqRecord(index, new int[xLens[index]], null));
    var store = new InMemoryStore(records, null, new Random());
    
    var rows = store.lengthIndex(ReadOrder.EQ_LEN_RAND_BATCH);
    assertEquals(
        List.of(5, 5, 4, 3, 2, 1, 1),
        rows.stream().map(LengthRow::xLen).toList());
  }
  
  
  @Test
  public void testMissingId() {
    var store = new InMemoryStore(sample(), null, new Random());
    assertThrows(MissingRecordException.class, () -> store.getByIds(new long[] { 10, 13 }));
  }
  
  
  @Test
  public void testDuplicateId() {
    var records = new ArrayList<>(sample());
    records.add(new SeqRecord(11, new int[] { 1 }, new int[] { 1 }));
    assertThrows(DuplicateIdException.class, () -> new InMemoryStore(records, null, new Random()));
  }
  
  
  @Test
  public void testLengthIndex() {
    var store = new InMemoryStore(sample(), null, new Random());
    var rows = store.lengthIndex(ReadOrder.Y_LEN_DESC);
    assertEquals(List.of(11L, 12L, 10L), rows.stream().map(LengthRow::id).toList());
    rows = store.lengthIndex(ReadOrder.X_LEN_ASC);
    assertEquals(List.of(11L, 10L, 12L), rows.stream().map(LengthRow::id).toList());
  }
  
  
  @Test
  public void testObserver() {
    var calls = new AtomicInteger();
    LoadObserver observer = new LoadObserver() {
      @Override
      public void loaded(long count, long usedMemory) {
        calls.incrementAndGet();
      }
      @Override
      public int interval() {
        return 2;
      }
    };
    new InMemoryStore(sample(), observer, new Random());
    // once at record 2, once at the end
    assertEquals(2, calls.get());
  }
  
  
  @Test
  public void testSnapshotRoundTrip() throws IOException {
    var records = new ArrayList<>(sample());
    records.add(new SeqRecord(20, new int[] { -5, 70_000 }));
    var store = new InMemoryStore(records, null, new Random());
    File snapshot = new File(dir, "snap" + ".memdb");
    store.save(snapshot);
    
    var loaded = InMemoryStore.load(snapshot, new Random());
    assertEquals(records, pass(loaded));
    assertNull(loaded.sourceKey());
  }
  
  
  @Test
  public void testNotASnapshot() throws IOException {
    File file = new File(dir, "junk.memdb");
    Files.write(file.toPath(), new byte[] { 1, 2, 3, 4, 5, 6, 7 });
    assertThrows(ByteFormatException.class, () -> InMemoryStore.load(file, new Random()));
  }
  
  
  @Test
  public void testLoadOrBuild() throws IOException {
    File source = new File(dir, "train.tsv");
    TsvRecordStore.writeParallel(
        List.of(
            new SeqPair(new int[] { 1 }, new int[] { 2 }),
            new SeqPair(new int[] { 3, 4 }, new int[] { 5 })),
        source);
    
    var builds = new AtomicInteger();
    var first = InMemoryStore.loadOrBuild(
        source,
        () -> {
          builds.incrementAndGet();
          try {
            return new TsvRecordStore(source);
          } catch (IOException iox) {
            throw new AssertionError(iox);
          }
        },
        LoadObserver.NOOP,
        new Random());
    
    assertEquals(1, builds.get());
    assertTrue(InMemoryStore.snapshotFile(source).isFile());
    
    var second = InMemoryStore.loadOrBuild(
        source,
        () -> {
          builds.incrementAndGet();
          throw new AssertionError("should have loaded the snapshot");
        },
        LoadObserver.NOOP,
        new Random());
    
    assertEquals(1, builds.get());
    assertEquals(pass(first), pass(second));
    assertEquals(first.sourceKey(), second.sourceKey());
  }

}
