/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl;


import java.lang.System.Logger;
import java.time.Duration;

/**
 * Library constants.
 */
public class GvlConstants {
  
  
  /**
   * Hashing algorithm used throughout. Currently SHA-256.
   */
  public final static String HASH_ALGO = "SHA-256";
  
  /**
   * Hash width in bytes (32).
   */
  public final static int HASH_WIDTH = 32;
  
  /**
   * Width of the seed in bytes. The seed is the first 64 bits of a hash.
   */
  public final static int SEED_WIDTH = 8;
  
  
  /**
   * Default number of entries in a sealed Merkle batch.
   */
  public final static int DEF_BATCH_SIZE = 1024;
  
  /**
   * Default time a record may wait in {@code AWAITING_APPROVAL} before it
   * is rejected (fail-closed).
   */
  public final static Duration DEF_APPROVAL_TIMEOUT = Duration.ofHours(72);
  
  /**
   * Default interval between polls of the approval channel.
   */
  public final static Duration DEF_POLL_INTERVAL = Duration.ofSeconds(30);
  
  /**
   * Default minimum retention, in years. Informational: retention is
   * enforced by the archival collaborator, not here.
   */
  public final static int DEF_RETENTION_YEARS = 7;
  
  
  /**
   * Version byte used in file headers.
   */
  public final static byte VERSION_BYTE = 1;
  
  
  /**
   * Entry data file name (in a ledger directory).
   */
  public final static String ENTRIES_FILE = "entries.gvl";
  
  /**
   * Entry offset index file name (in a ledger directory).
   */
  public final static String OFFSETS_FILE = "entries.idx";
  
  /**
   * Sealed batch root file name (in a ledger directory).
   */
  public final static String BATCHES_FILE = "batches.mrk";
  
  /**
   * Rejection log file name (JSON lines).
   */
  public final static String REJECTIONS_FILE = "rejections.jsonl";
  
  /**
   * Pending approvals subdirectory name.
   */
  public final static String PENDING_DIR = "pending";
  
  
  
  /**
   * The module's logger name.
   * 
   * @see #getLogger()
   */
  public final static String LOGGER_NAME = "gvl";
  
  
  /**
   * Returns the module logger.
   * 
   * @see #LOGGER_NAME
   */
  public static Logger getLogger() {
    return System.getLogger(LOGGER_NAME);
  }
  
  
  

  private GvlConstants() {  }

}
