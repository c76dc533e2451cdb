/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.sql;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.seqbatch.CorpusMismatchException;
import io.crums.seqbatch.UnsupportedStrategyException;
import io.crums.seqbatch.batch.Batch;
import io.crums.seqbatch.cache.InMemoryStore;
import io.crums.seqbatch.config.DatasetConfig;
import io.crums.seqbatch.iter.BatchIterable;
import io.crums.seqbatch.iter.Bucketing;
import io.crums.seqbatch.iter.LoopingIterable;
import io.crums.seqbatch.prep.LengthPolicy;
import io.crums.seqbatch.prep.ParallelPreprocessor;
import io.crums.seqbatch.prep.Tokenizer;
import io.crums.seqbatch.store.TsvRecordStore;

/**
 * 
 */
public class DatasetLoaderTest {
  
  @TempDir
  File dir;
  
  
  private Properties props(String dataPath, int tokens) {
    var props = new Properties();
    props.setProperty(DatasetConfig.BASE_DIR, dir.getPath());
    props.setProperty(DatasetConfig.DATA_PATH, dataPath);
    props.setProperty(DatasetConfig.BATCH_TOKENS, String.valueOf(tokens));
    props.setProperty(DatasetConfig.SEED, "7");
    // raw batches: no BOS/EOS
    props.setProperty(DatasetConfig.ADD_EOS_X, "false");
    props.setProperty(DatasetConfig.ADD_EOS_Y, "false");
    return props;
  }
  
  
  private File writeDb(String name, int count) throws IOException {
    File path = new File(dir, name + SqlRecordStore.H2_EXT);
    var pairs = SqlRecordStoreTest.randomPairs(count, 12, new Random(count));
    SqlRecordStore.write(path, pairs.iterator());
    return path;
  }
  
  
  private static List<Batch> pass(BatchIterable batches) {
    var out = new ArrayList<Batch>();
    try (var iter = batches.iterator()) {
      while (iter.hasNext())
        out.add(iter.next());
    }
    return out;
  }
  
  
  private static int countRecords(List<Batch> batches) {
    var ids = new HashSet<Long>();
    for (var batch : batches)
      for (long id : batch.ids())
        assertTrue(ids.add(id));
    return ids.size();
  }
  
  
  @Test
  public void testDbEqLenRandom() throws IOException {
    writeDb("train", 250);
    var props = props("train" + SqlRecordStore.H2_EXT, 60);
    props.setProperty(DatasetConfig.BUCKETING, "eq_len_random");
    
    try (var batches = DatasetLoader.open(new DatasetConfig(props))) {
      assertTrue(batches.store() instanceof SqlRecordStore);
      assertEquals(Bucketing.EQ_LEN_RANDOM, batches.bucketing());
      var first = pass(batches);
      assertEquals(250, countRecords(first));
      for (var batch : first)
        assertTrue(batch.size() * Math.max(batch.maxXLen(), batch.maxYLen()) <= 60);
    }
  }
  
  
  @Test
  public void testDbReadOrder() throws IOException {
    writeDb("ordered", 80);
    var props = props("ordered" + SqlRecordStore.H2_EXT, 1000);
    props.setProperty(DatasetConfig.READ_ORDER, "x_len_desc");
    props.setProperty(DatasetConfig.LEN_RAND, "1");
    
    try (var batches = DatasetLoader.open(new DatasetConfig(props))) {
      int prev = Integer.MAX_VALUE;
      for (var batch : pass(batches)) {
        for (int len : batch.xLens()) {
          assertTrue(len <= prev);
          prev = len;
        }
      }
    }
  }
  
  
  @Test
  public void testKeepInMem() throws IOException {
    File path = writeDb("cached", 40);
    var props = props("cached" + SqlRecordStore.H2_EXT, 100);
    props.setProperty(DatasetConfig.KEEP_IN_MEM, "true");
    props.setProperty(DatasetConfig.BUCKETING, "eq_len_random");
    
    try (var batches = DatasetLoader.open(new DatasetConfig(props))) {
      assertTrue(batches.store() instanceof InMemoryStore);
      assertEquals(40, countRecords(pass(batches)));
    }
    assertTrue(InMemoryStore.snapshotFile(path).isFile());
    
    // 2nd time from the snapshot
    try (var batches = DatasetLoader.open(new DatasetConfig(props))) {
      assertEquals(40, countRecords(pass(batches)));
    }
  }
  
  
  @Test
  public void testFlatFile() throws IOException {
    File tsv = new File(dir, "train.tsv");
    Files.writeString(tsv.toPath(), "5 6\t7\n1\t8 9 4\n", StandardCharsets.UTF_8);
    var props = props("train.tsv", 6);
    
    try (var batches = DatasetLoader.open(new DatasetConfig(props))) {
      assertTrue(batches.store() instanceof TsvRecordStore);
      var list = pass(batches);
      assertEquals(1, list.size());
      assertEquals(2, list.get(0).maxXLen());
      assertEquals(3, list.get(0).maxYLen());
    }
  }
  
  
  @Test
  public void testFlatFileUnsupported() throws IOException {
    Files.writeString(new File(dir, "train.tsv").toPath(), "5 6\t7\n");
    
    var props = props("train.tsv", 6);
    props.setProperty(DatasetConfig.READ_ORDER, "y_len_desc");
    assertThrows(
        UnsupportedStrategyException.class,
        () -> DatasetLoader.open(new DatasetConfig(props)));
    
    var props2 = props("train.tsv", 6);
    props2.setProperty(DatasetConfig.BUCKETING, "eq_len_random");
    assertThrows(
        UnsupportedStrategyException.class,
        () -> DatasetLoader.open(new DatasetConfig(props2)));
  }
  
  
  @Test
  public void testFlatFileEqLenRandomKeptInMem() throws IOException {
    File tsv = new File(dir, "train.tsv");
    Files.writeString(tsv.toPath(), "5 6\t7\n");
    
    var props = props("train.tsv", 6);
    props.setProperty(DatasetConfig.BUCKETING, "eq_len_random");
    props.setProperty(DatasetConfig.KEEP_IN_MEM, "true");
    assertThrows(
        UnsupportedStrategyException.class,
        () -> DatasetLoader.open(new DatasetConfig(props)));
    // rejected before anything is loaded
    assertFalse(InMemoryStore.snapshotFile(tsv).exists());
  }
  
  
  @Test
  public void testMissingData() {
    var props = props("absent.tsv", 6);
    assertThrows(
        IllegalArgumentException.class,
        () -> DatasetLoader.open(new DatasetConfig(props)));
  }
  
  
  @Test
  public void testBuildStoreAndLoop() throws IOException {
    File src = new File(dir, "raw.src");
    File tgt = new File(dir, "raw.tgt");
    var s = new StringBuilder();
    var t = new StringBuilder();
    for (int index = 0; index < 30; ++index) {
      s.append(10 + index).append(' ').append(11 + index).append('\n');
      t.append(20 + index).append('\n');
    }
    Files.writeString(src.toPath(), s.toString());
    Files.writeString(tgt.toPath(), t.toString());
    
    var prep = new ParallelPreprocessor(
        Tokenizer.INTEGERS, Tokenizer.INTEGERS, LengthPolicy.DEFAULT, 2);
    File out = new File(dir, "built" + SqlRecordStore.H2_EXT);
    assertEquals(30, DatasetLoader.buildStore(prep, src, tgt, out));
    
    try (var batches = DatasetLoader.open(new DatasetConfig(props(out.getName(), 8)))) {
      // 4 records of length 2 per batch
      var loop = new LoopingIterable<Batch>(batches, 20);
      int count = 0;
      for (Batch batch : loop) {
        assertTrue(batch.size() <= 4);
        ++count;
      }
      assertEquals(20, count);
      assertEquals(3, loop.passes());
    }
  }
  
  
  @Test
  public void testBuildStoreMismatch() throws IOException {
    File src = new File(dir, "raw.src");
    File tgt = new File(dir, "raw.tgt");
    Files.writeString(src.toPath(), "1\n2\n");
    Files.writeString(tgt.toPath(), "1\n");
    var prep = new ParallelPreprocessor(
        Tokenizer.INTEGERS, Tokenizer.INTEGERS, LengthPolicy.DEFAULT, 1);
    File out = new File(dir, "bad" + SqlRecordStore.H2_EXT);
    assertThrows(
        CorpusMismatchException.class,
        () -> DatasetLoader.buildStore(prep, src, tgt, out));
    assertFalse(out.exists());
  }
  
  
  @Test
  public void testBuildMonoStore() throws IOException {
    File file = new File(dir, "mono.txt");
    Files.writeString(file.toPath(), "4 5 6\n7\n");
    var prep = new ParallelPreprocessor(
        Tokenizer.INTEGERS, Tokenizer.INTEGERS, LengthPolicy.DEFAULT, 1);
    File out = new File(dir, "mono" + SqlRecordStore.H2_EXT);
    assertEquals(2, DatasetLoader.buildMonoStore(prep, file, out));
    try (var store = new SqlRecordStore(out)) {
      assertFalse(store.getByIds(new long[] { 1 }).get(0).hasY());
    }
  }

}
