/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.sql;


import static io.crums.seqbatch.SeqBatchConstants.*;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.Random;

import io.crums.seqbatch.CorpusMismatchException;
import io.crums.seqbatch.SeqPair;
import io.crums.seqbatch.UnsupportedStrategyException;
import io.crums.seqbatch.cache.InMemoryStore;
import io.crums.seqbatch.cache.LoadObserver;
import io.crums.seqbatch.config.DatasetConfig;
import io.crums.seqbatch.iter.BatchIterable;
import io.crums.seqbatch.iter.Bucketing;
import io.crums.seqbatch.prep.ParallelPreprocessor;
import io.crums.seqbatch.store.ReadOrder;
import io.crums.seqbatch.store.RecordStore;
import io.crums.seqbatch.store.TsvRecordStore;

/**
 * Opens (and builds) training data per a {@linkplain DatasetConfig}.
 *
 * <h2>Backend Selection</h2>
 * <p>
 * A data path whose name ends with {@code .db} is opened as a
 * {@linkplain SqlRecordStore}; anything else, as a {@linkplain TsvRecordStore}.
 * Flat-files support neither a configured read order nor
 * {@linkplain Bucketing#EQ_LEN_RANDOM eq_len_random} bucketing, whether or not
 * they're kept in memory.
 * </p>
 */
public class DatasetLoader {

  private final static int LOAD_LOG_INTERVAL = 100_000;


  private DatasetLoader() {  }


  /**
   * Returns the random source for the given configuration: seeded, if a seed is
   * configured.
   */
  public static Random random(DatasetConfig config) {
    return config.seed().map(Random::new).orElseGet(Random::new);
  }


  /**
   * Opens the configured training data as batches.
   *
   * @throws UnsupportedStrategyException if the configuration asks for a
   *         strategy the backend doesn't support
   */
  public static BatchIterable open(DatasetConfig config) throws IOException {
    Random random = random(config);
    RecordStore store = openStore(config, random);
    try {
      return new BatchIterable(
          store, config.batchTokens(), config.batchBuilder(), config.bucketing(), random);
    } catch (RuntimeException rx) {
      store.close();
      throw rx;
    }
  }


  /**
   * Opens the configured record store.
   *
   * @param random  random source for ordering and shuffling
   */
  public static RecordStore openStore(DatasetConfig config, Random random) throws IOException {
    Objects.requireNonNull(random, "null random");
    File path = config.dataPath();
    if (!path.exists())
      throw new IllegalArgumentException("training data doesn't exist: " + path);

    if (!config.isDbStore()) {
      if (config.readOrder().isPresent())
        throw new UnsupportedStrategyException(
            "read order " + config.readOrder().get().symbol() +
            " is not supported for flat-file " + path);
      if (config.bucketing() == Bucketing.EQ_LEN_RANDOM)
        throw new UnsupportedStrategyException(
            config.bucketing().symbol() + " bucketing is not supported for flat-file " + path);
    }

    if (!config.keepInMem())
      return newStore(config, random);

    try {
      return InMemoryStore.loadOrBuild(
          path,
          () -> {
            try {
              return newStore(config, random);
            } catch (IOException iox) {
              throw new UncheckedIOException(iox);
            }
          },
          LoadObserver.logging(LOAD_LOG_INTERVAL),
          random);
    } catch (UncheckedIOException uiox) {
      throw uiox.getCause();
    }
  }


  private static RecordStore newStore(DatasetConfig config, Random random) throws IOException {
    if (config.isDbStore()) {
      var options = new SqlRecordStore.ReadOptions(
          config.readOrder().orElse(ReadOrder.RANDOM),
          config.lenRand(),
          config.maxSrcLen(),
          config.maxTgtLen(),
          config.truncate());
      return new SqlRecordStore(config.dataPath(), options, random);
    }
    return new TsvRecordStore(config.dataPath(), config.tsvOptions(), random);
  }



  /**
   * Preprocesses a raw parallel corpus and writes the surviving pairs to a new
   * database store.
   *
   * @param preprocessor  tokenizes and filters the corpus
   * @param srcFile       source side
   * @param tgtFile       target side (line-aligned)
   * @param out           the store file (name ends with {@linkplain SqlRecordStore#H2_EXT})
   *
   * @return the number of records written
   *
   * @throws CorpusMismatchException if the two files have unequal line counts
   */
  public static long buildStore(
      ParallelPreprocessor preprocessor, File srcFile, File tgtFile, File out)
          throws IOException, CorpusMismatchException {

    List<SeqPair> pairs = preprocessor.processParallel(srcFile, tgtFile);
    logInfo("writing " + pairs.size() + " records to " + out);
    return SqlRecordStore.write(out, pairs.iterator());
  }


  /**
   * Preprocesses a raw monolingual corpus and writes it to a new database store.
   * The records have no target side.
   *
   * @return the number of records written
   */
  public static long buildMonoStore(ParallelPreprocessor preprocessor, File file, File out)
      throws IOException {

    List<int[]> seqs = preprocessor.processMono(file);
    logInfo("writing " + seqs.size() + " mono records to " + out);
    return SqlRecordStore.write(out, seqs.stream().map(SeqPair::new).iterator());
  }

}
