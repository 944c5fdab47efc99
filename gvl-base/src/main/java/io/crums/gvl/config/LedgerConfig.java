/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.config;


import static io.crums.gvl.GvlConstants.*;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import io.crums.gvl.Criticality;
import io.crums.gvl.gate.OversightPolicy;
import io.crums.gvl.gate.PendingApprovals;
import io.crums.gvl.gate.PendingApprovalsDir;
import io.crums.gvl.gate.PhaseRegistry;
import io.crums.gvl.gate.RejectionLog;
import io.crums.gvl.gate.RejectionLogFile;
import io.crums.gvl.sig.KeyRing;
import io.crums.gvl.store.EntryLogDir;
import io.crums.gvl.store.LedgerStore;
import io.crums.gvl.store.RetryPolicy;

/**
 * Ledger configuration.
 *
 * <h2>Quirks and Features</h2>
 * <p>
 * A simple properties file is used to store configuration. Every setting has
 * a default, so an empty file is a valid configuration.
 * </p>
 * <h3>Relative Paths</h3>
 * <p>
 * Filepaths may be specified in either absolute or relative form. For relative
 * paths, <em>paths are resolved relative to the location of the configuration
 * file</em> (or the working directory, if there's no file).
 * </p>
 * <h3>Durations</h3>
 * <p>
 * Durations are in ISO-8601 form (e.g. {@code PT72H}, {@code PT0.1S}).
 * </p>
 */
public class LedgerConfig {

  /**
   * Every property known to this configuration is prefixed with this value.
   */
  public final static String ROOT = "gvl.";

  /**
   * The name of the base directory path. <em>This value should not be set in the properties file.</em>
   * It is set dynamically to the parent directory of the configuration file.
   */
  public final static String BASE_DIR = ROOT + "base.dir";
  /** Ledger directory (entry log, offsets, batch roots). Default {@code ledger}. */
  public final static String LEDGER_DIR = ROOT + "ledger.dir";
  /** Partition name. Default {@code default}. */
  public final static String PARTITION = ROOT + "partition";
  /** Merkle batch size. Default {@value io.crums.gvl.GvlConstants#DEF_BATCH_SIZE}. */
  public final static String BATCH_SIZE = ROOT + "batch.size";
  /** Directory of {@code <signerId>.pub} files. Default {@code keys}. */
  public final static String KEYS_DIR = ROOT + "keys.dir";
  /** Comma-separated list of open lifecycle phases. Default none. */
  public final static String PHASES_OPEN = ROOT + "phases.open";
  /** Oversight threshold (criticality name or level). Default {@code MAJOR}. */
  public final static String APPROVAL_THRESHOLD = ROOT + "approval.threshold";
  /** Approval timeout. Default {@code PT72H}. */
  public final static String APPROVAL_TIMEOUT = ROOT + "approval.timeout";
  /** Approval poll interval. Default {@code PT30S}. */
  public final static String APPROVAL_POLL = ROOT + "approval.poll.interval";
  /** Rejection log file. Default {@code rejections.jsonl} in the ledger directory. */
  public final static String REJECTIONS_PATH = ROOT + "rejections.file";
  /** Pending approvals directory. Default {@code pending} in the ledger directory. */
  public final static String PENDING_PATH = ROOT + "pending.dir";
  /** Maximum append retries. Default 3. */
  public final static String RETRY_MAX = ROOT + "retry.max";
  /** First retry backoff. Default {@code PT0.1S}. */
  public final static String RETRY_BACKOFF = ROOT + "retry.backoff";
  /** Backoff cap. Default {@code PT2S}. */
  public final static String RETRY_BACKOFF_MAX = ROOT + "retry.backoff.max";
  /** Retention period, handed to the archival collaborator. Default 7. */
  public final static String RETENTION_YEARS = ROOT + "retention.years";


  /** All the property names. */
  public final static List<String> PROP_NAMES = List.of(
      BASE_DIR,
      LEDGER_DIR,
      PARTITION,
      BATCH_SIZE,
      KEYS_DIR,
      PHASES_OPEN,
      APPROVAL_THRESHOLD,
      APPROVAL_TIMEOUT,
      APPROVAL_POLL,
      REJECTIONS_PATH,
      PENDING_PATH,
      RETRY_MAX,
      RETRY_BACKOFF,
      RETRY_BACKOFF_MAX,
      RETENTION_YEARS);


  /**
   * Loads the given properties file, setting {@linkplain #BASE_DIR} to its parent directory.
   *
   * @throws IllegalArgumentException if the file does not exist or cannot be read
   */
  public static Properties loadProperties(File propertiesFile) {
    Properties props = new Properties();
    try (var in = new FileInputStream(propertiesFile)) {
      props.load(in);
    } catch (FileNotFoundException fnfx) {
      throw new IllegalArgumentException("properties file does not exist: " + propertiesFile);
    } catch (IOException iox) {
      throw new IllegalArgumentException("failed to read properties file: " + propertiesFile, iox);
    }
    File baseDir = propertiesFile.getAbsoluteFile().getParentFile();
    props.put(BASE_DIR, baseDir.getAbsolutePath());
    return props;
  }



  private final File baseDir;
  private final File ledgerDir;
  private final String partition;
  private final int batchSize;
  private final File keysDir;
  private final List<String> openPhases;
  private final Criticality threshold;
  private final Duration approvalTimeout;
  private final Duration pollInterval;
  private final File rejectionsFile;
  private final File pendingDir;
  private final RetryPolicy retryPolicy;
  private final int retentionYears;


  /**
   * Creates an instance with every setting defaulted, relative to the
   * working directory.
   */
  public LedgerConfig() {
    this(new Properties());
  }


  public LedgerConfig(File propertiesFile) {
    this(loadProperties(propertiesFile));
  }


  /**
   * @throws IllegalArgumentException if a property value is malformed
   */
  public LedgerConfig(Properties props) {
    String base = props.getProperty(BASE_DIR);
    this.baseDir = new File(base == null ? "." : base).getAbsoluteFile();

    this.ledgerDir = resolve(props.getProperty(LEDGER_DIR, "ledger"));
    this.partition = props.getProperty(PARTITION, "default").trim();
    if (partition.isEmpty())
      throw new IllegalArgumentException("empty " + PARTITION);
    this.batchSize = getInt(props, BATCH_SIZE, DEF_BATCH_SIZE, 1);
    this.keysDir = resolve(props.getProperty(KEYS_DIR, "keys"));

    var phases = new ArrayList<String>();
    for (var phase : props.getProperty(PHASES_OPEN, "").split(",")) {
      if (!phase.isBlank())
        phases.add(phase.trim());
    }
    this.openPhases = List.copyOf(phases);

    try {
      this.threshold = Criticality.parse(props.getProperty(APPROVAL_THRESHOLD, "MAJOR"));
    } catch (IllegalArgumentException iax) {
      throw new IllegalArgumentException(
          "illegal " + APPROVAL_THRESHOLD + ": " + props.getProperty(APPROVAL_THRESHOLD), iax);
    }
    this.approvalTimeout = getDuration(props, APPROVAL_TIMEOUT, DEF_APPROVAL_TIMEOUT);
    this.pollInterval = getDuration(props, APPROVAL_POLL, DEF_POLL_INTERVAL);

    String rejPath = props.getProperty(REJECTIONS_PATH);
    this.rejectionsFile =
        rejPath == null ? new File(ledgerDir, REJECTIONS_FILE) : resolve(rejPath);
    String pendingPath = props.getProperty(PENDING_PATH);
    this.pendingDir =
        pendingPath == null ? new File(ledgerDir, PENDING_DIR) : resolve(pendingPath);

    var defRetry = RetryPolicy.DEFAULT;
    this.retryPolicy = new RetryPolicy(
        getInt(props, RETRY_MAX, defRetry.maxRetries(), 0),
        getDuration(props, RETRY_BACKOFF, defRetry.initialBackoff()),
        getDuration(props, RETRY_BACKOFF_MAX, defRetry.maxBackoff()));

    this.retentionYears = getInt(props, RETENTION_YEARS, DEF_RETENTION_YEARS, 1);
  }


  private File resolve(String path) {
    File file = new File(path.trim());
    return file.isAbsolute() ? file : new File(baseDir, path.trim());
  }


  private static int getInt(Properties props, String name, int defaultValue, int min) {
    String value = props.getProperty(name);
    if (value == null)
      return defaultValue;
    final int n;
    try {
      n = Integer.parseInt(value.trim());
    } catch (NumberFormatException nfx) {
      throw new IllegalArgumentException("illegal " + name + ": " + value, nfx);
    }
    if (n < min)
      throw new IllegalArgumentException(name + " " + n + " < " + min);
    return n;
  }


  private static Duration getDuration(Properties props, String name, Duration defaultValue) {
    String value = props.getProperty(name);
    if (value == null)
      return defaultValue;
    try {
      return Duration.parse(value.trim());
    } catch (DateTimeParseException dtpx) {
      throw new IllegalArgumentException("illegal " + name + ": " + value, dtpx);
    }
  }



  public File getBaseDir() {
    return baseDir;
  }

  public File getLedgerDir() {
    return ledgerDir;
  }

  public String getPartition() {
    return partition;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public File getKeysDir() {
    return keysDir;
  }

  public List<String> getOpenPhases() {
    return openPhases;
  }

  public Criticality getThreshold() {
    return threshold;
  }

  public Duration getApprovalTimeout() {
    return approvalTimeout;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public File getRejectionsFile() {
    return rejectionsFile;
  }

  public File getPendingDir() {
    return pendingDir;
  }

  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  public int getRetentionYears() {
    return retentionYears;
  }



  /**
   * Opens the ledger's entry log.
   *
   * @param readOnly if {@code true}, the ledger directory must exist
   */
  public EntryLogDir openLog(boolean readOnly) {
    return new EntryLogDir(ledgerDir, readOnly);
  }


  /**
   * Opens (or creates) the ledger store.
   */
  public LedgerStore openStore() {
    return new LedgerStore(partition, openLog(false), batchSize, retryPolicy);
  }


  /**
   * Loads the key ring. A missing keys directory yields an empty ring.
   */
  public KeyRing loadKeyRing() {
    return keysDir.isDirectory() ? KeyRing.load(keysDir) : new KeyRing();
  }


  public PhaseRegistry newPhaseRegistry() {
    return new PhaseRegistry(openPhases);
  }


  public OversightPolicy oversightPolicy() {
    return new OversightPolicy(threshold);
  }


  public RejectionLog rejectionLog() {
    return new RejectionLogFile(rejectionsFile);
  }


  public PendingApprovals pendingApprovals() {
    return new PendingApprovalsDir(pendingDir);
  }

}
