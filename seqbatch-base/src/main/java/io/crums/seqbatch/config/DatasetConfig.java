/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch.config;


import static io.crums.seqbatch.SeqBatchConstants.*;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

import io.crums.seqbatch.batch.Alignment;
import io.crums.seqbatch.batch.BatchBuilder;
import io.crums.seqbatch.iter.Bucketing;
import io.crums.seqbatch.store.ReadOrder;
import io.crums.seqbatch.store.TsvRecordStore;

/**
 * Dataset and batching configuration.
 *
 * <h2>Quirks and Features</h2>
 * <p>
 * A simple properties file is used to store configuration. Every key is prefixed
 * with {@linkplain #ROOT}. Only {@linkplain #DATA_PATH} and {@linkplain #BATCH_TOKENS}
 * are required; everything else has a default.
 * </p>
 * <h3>Relative Paths</h3>
 * <p>
 * The data path may be specified in either absolute or relative form. Relative
 * paths are resolved relative to the location of the configuration file (or the
 * {@linkplain #BASE_DIR} property, when constructed from {@linkplain Properties}).
 * </p>
 */
public class DatasetConfig {

  /**
   * Every property known to this configuration is prefixed with this value.
   */
  public final static String ROOT = "seqbatch.";

  /**
   * The name of the base directory path. <em>This value should not be set in the properties file.</em>
   * It is set dynamically to the parent directory of the configuration file.
   */
  public final static String BASE_DIR = ROOT + "base.dir";
  /**
   * Path to the training data: a database store if the name ends with {@code .db};
   * otherwise, a flat-file. Required.
   */
  public final static String DATA_PATH = ROOT + "data.path";
  /**
   * Token budget per batch. Required.
   */
  public final static String BATCH_TOKENS = ROOT + "batch.tokens";
  /**
   * Bucketing strategy: {@code sequential} (default) or {@code eq_len_random}.
   * The latter is not supported for flat-files.
   */
  public final static String BUCKETING = ROOT + "bucketing";
  /**
   * Read order for database stores (e.g. {@code y_len_desc}). Defaults to {@code random}.
   * Not supported for flat-files.
   */
  public final static String READ_ORDER = ROOT + "read.order";
  /** Jitter window for length-sorted reads. Defaults to 2. */
  public final static String LEN_RAND = ROOT + "len.rand";
  /** If {@code true}, the store is cached in memory (and snapshot to disk). */
  public final static String KEEP_IN_MEM = ROOT + "keep.in.mem";
  /** Flat-file only: shuffle records between passes. */
  public final static String SHUFFLE = ROOT + "shuffle";
  public final static String MAX_SRC_LEN = ROOT + "max.src.len";
  public final static String MAX_TGT_LEN = ROOT + "max.tgt.len";
  /** Truncate (instead of skip) over-length records. */
  public final static String TRUNCATE = ROOT + "truncate";
  /** Random seed. If not set, runs are not reproducible. */
  public final static String SEED = ROOT + "seed";
  /** Sort the records in each batch by source length, descending. */
  public final static String SORT_DESC = ROOT + "sort.desc";

  public final static String BATCH_FIRST = ROOT + "batch.first";
  public final static String ADD_BOS_X = ROOT + "add.bos.x";
  public final static String ADD_EOS_X = ROOT + "add.eos.x";
  public final static String ADD_BOS_Y = ROOT + "add.bos.y";
  public final static String ADD_EOS_Y = ROOT + "add.eos.y";
  public final static String PAD_VALUE = ROOT + "pad.value";
  public final static String BOS_VALUE = ROOT + "bos.value";
  public final static String EOS_VALUE = ROOT + "eos.value";


  public final static int DEF_PAD_VALUE = 0;
  public final static int DEF_BOS_VALUE = 2;
  public final static int DEF_EOS_VALUE = 3;


  /**
   * List of property names.
   */
  public final static List<String> PROP_NAMES = List.of(
      BASE_DIR,
      DATA_PATH,
      BATCH_TOKENS,
      BUCKETING,
      READ_ORDER,
      LEN_RAND,
      KEEP_IN_MEM,
      SHUFFLE,
      MAX_SRC_LEN,
      MAX_TGT_LEN,
      TRUNCATE,
      SEED,
      SORT_DESC,
      BATCH_FIRST,
      ADD_BOS_X,
      ADD_EOS_X,
      ADD_BOS_Y,
      ADD_EOS_Y,
      PAD_VALUE,
      BOS_VALUE,
      EOS_VALUE);


  private static Properties loadProperties(File propertiesFile) {
    Properties props = new Properties();
    try (var in = new FileInputStream(propertiesFile)) {
      props.load(in);
    } catch (FileNotFoundException fnfx) {
      throw new IllegalArgumentException("properties file does not exist: " + propertiesFile);
    } catch (IOException iox) {
      throw new IllegalArgumentException("failed to read properties file: " + propertiesFile, iox);
    }
    File baseDir = propertiesFile.getAbsoluteFile().getParentFile();
    props.put(BASE_DIR, baseDir.getPath());
    return props;
  }




  private final File dataPath;
  private final int batchTokens;
  private final Bucketing bucketing;
  private final Optional<ReadOrder> readOrder;
  private final int lenRand;
  private final boolean keepInMem;
  private final boolean shuffle;
  private final int maxSrcLen;
  private final int maxTgtLen;
  private final boolean truncate;
  private final Optional<Long> seed;
  private final boolean sortDesc;
  private final Alignment alignment;



  public DatasetConfig(File propertiesFile) {
    this(loadProperties(propertiesFile));
  }


  /**
   * @throws IllegalArgumentException if a required property is missing, or a
   *         value doesn't parse
   */
  public DatasetConfig(Properties props) {
    String path = props.getProperty(DATA_PATH);
    enforceRequired(DATA_PATH, path);
    this.dataPath = resolve(props, path.trim());

    this.batchTokens = getInt(props, BATCH_TOKENS, -1);
    if (batchTokens < 1)
      throw new IllegalArgumentException(
          "missing or non-positive required property " + BATCH_TOKENS);

    String b = props.getProperty(BUCKETING);
    this.bucketing = b == null || b.isBlank() ? Bucketing.SEQUENTIAL : Bucketing.forSymbol(b);

    String order = props.getProperty(READ_ORDER);
    this.readOrder =
        order == null || order.isBlank() ?
            Optional.empty() : Optional.of(ReadOrder.forSymbol(order));

    this.lenRand = getInt(props, LEN_RAND, DEF_LEN_RAND);
    if (lenRand < 1)
      throw new IllegalArgumentException(LEN_RAND + " " + lenRand);

    this.keepInMem = getBoolean(props, KEEP_IN_MEM, false);
    this.shuffle = getBoolean(props, SHUFFLE, false);
    this.maxSrcLen = getInt(props, MAX_SRC_LEN, DEF_MAX_SRC_LEN);
    this.maxTgtLen = getInt(props, MAX_TGT_LEN, DEF_MAX_TGT_LEN);
    this.truncate = getBoolean(props, TRUNCATE, false);

    String s = props.getProperty(SEED);
    try {
      this.seed = s == null || s.isBlank() ? Optional.empty() : Optional.of(Long.parseLong(s.trim()));
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException(SEED + " not a number: '" + s + "'");
    }

    this.sortDesc = getBoolean(props, SORT_DESC, false);

    this.alignment = new Alignment(
        getBoolean(props, ADD_BOS_X, false),
        getBoolean(props, ADD_EOS_X, true),
        getBoolean(props, ADD_BOS_Y, false),
        getBoolean(props, ADD_EOS_Y, true),
        getBoolean(props, BATCH_FIRST, true),
        getInt(props, PAD_VALUE, DEF_PAD_VALUE),
        getInt(props, BOS_VALUE, DEF_BOS_VALUE),
        getInt(props, EOS_VALUE, DEF_EOS_VALUE));
  }


  private static File resolve(Properties props, String path) {
    File file = new File(path);
    if (file.isAbsolute())
      return file;
    String baseDir = props.getProperty(BASE_DIR);
    return baseDir == null ? file : new File(baseDir, path);
  }


  private static void enforceRequired(String name, String value) {
    if (value == null || value.isBlank())
      throw new IllegalArgumentException("missing required property " + name);
  }


  private static int getInt(Properties props, String name, int defaultValue) {
    String value = props.getProperty(name);
    if (value == null || value.isBlank())
      return defaultValue;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException(name + " not an integer: '" + value + "'");
    }
  }


  private static boolean getBoolean(Properties props, String name, boolean defaultValue) {
    String value = props.getProperty(name);
    if (value == null || value.isBlank())
      return defaultValue;
    switch (value.trim().toLowerCase(Locale.ROOT)) {
    case "true":
    case "yes":
      return true;
    case "false":
    case "no":
      return false;
    default:
      throw new IllegalArgumentException(name + " not a boolean: '" + value + "'");
    }
  }



  public File dataPath() {
    return dataPath;
  }

  /** Returns {@code true} if the data path names a database store. */
  public boolean isDbStore() {
    return dataPath.getName().endsWith(DB_EXT);
  }

  public int batchTokens() {
    return batchTokens;
  }

  public Bucketing bucketing() {
    return bucketing;
  }

  /** Returns the configured read order, if any. */
  public Optional<ReadOrder> readOrder() {
    return readOrder;
  }

  public int lenRand() {
    return lenRand;
  }

  public boolean keepInMem() {
    return keepInMem;
  }

  public boolean shuffle() {
    return shuffle;
  }

  public int maxSrcLen() {
    return maxSrcLen;
  }

  public int maxTgtLen() {
    return maxTgtLen;
  }

  public boolean truncate() {
    return truncate;
  }

  public Optional<Long> seed() {
    return seed;
  }

  public boolean sortDesc() {
    return sortDesc;
  }

  public Alignment alignment() {
    return alignment;
  }


  /**
   * Returns a batch builder per this configuration.
   */
  public BatchBuilder batchBuilder() {
    return new BatchBuilder(alignment, sortDesc);
  }


  /**
   * Returns the flat-file store options per this configuration.
   * (Longest-first is off: batches are formed in file order.)
   */
  public TsvRecordStore.Options tsvOptions() {
    return new TsvRecordStore.Options(
        false, shuffle, false, maxSrcLen, maxTgtLen, truncate);
  }

}
