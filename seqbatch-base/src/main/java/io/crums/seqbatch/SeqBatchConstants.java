/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.seqbatch;


import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * Library constants.
 */
public class SeqBatchConstants {
  
  /**
   * The module's logger name.
   * 
   * @see #getLogger()
   */
  public final static String LOG_NAME = "io.crums.seqbatch";
  
  /**
   * Default maximum source (x) sequence length (512).
   */
  public final static int DEF_MAX_SRC_LEN = 512;
  
  /**
   * Default maximum target (y) sequence length (512).
   */
  public final static int DEF_MAX_TGT_LEN = 512;
  
  /**
   * Default jitter window for length-sorted reads (2).
   */
  public final static int DEF_LEN_RAND = 2;
  
  /**
   * Value of the {@code y_len} column when a record has no target sequence.
   */
  public final static int NO_Y_LEN = -1;
  
  /**
   * File extension (includes the dot) appended to a store's path to name
   * its in-memory snapshot.
   */
  public final static String MEMDB_EXT = ".memdb";
  
  /**
   * Files whose names end with this extension are opened as indexed
   * (database) stores; all others are read as flat-files.
   */
  public final static String DB_EXT = ".db";
  
  
  /**
   * Returns the module logger.
   * 
   * @see #LOG_NAME
   */
  public static Logger getLogger() {
    return System.getLogger(LOG_NAME);
  }
  
  
  public static void logInfo(String message) {
    getLogger().log(Level.INFO, message);
  }
  
  public static void logWarning(String message) {
    getLogger().log(Level.WARNING, message);
  }
  
  public static void logDebug(String message) {
    getLogger().log(Level.DEBUG, message);
  }
  
  

  private SeqBatchConstants() {  }

}
