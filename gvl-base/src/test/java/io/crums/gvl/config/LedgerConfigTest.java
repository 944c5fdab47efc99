/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.config;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.FileOutputStream;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import io.crums.gvl.Criticality;
import io.crums.gvl.GvlConstants;
import io.crums.gvl.GvlTestCase;
import io.crums.gvl.sig.KeyRing;

/**
 * 
 */
public class LedgerConfigTest extends GvlTestCase {

  public final static String RESOURCE = "/gvl-test.properties";


  private Properties testProperties() throws Exception {
    var props = new Properties();
    try (var in = getClass().getResourceAsStream(RESOURCE)) {
      props.load(in);
    }
    return props;
  }


  @Test
  public void testDefaults() {
    var config = new LedgerConfig();
    assertEquals("default", config.getPartition());
    assertEquals(GvlConstants.DEF_BATCH_SIZE, config.getBatchSize());
    assertEquals(Criticality.MAJOR, config.getThreshold());
    assertEquals(Duration.ofHours(72), config.getApprovalTimeout());
    assertEquals(new File(config.getLedgerDir(), GvlConstants.REJECTIONS_FILE), config.getRejectionsFile());
    assertEquals(new File(config.getLedgerDir(), GvlConstants.PENDING_DIR), config.getPendingDir());
    assertTrue(config.getOpenPhases().isEmpty());
    assertEquals(7, config.getRetentionYears());
  }


  @Test
  public void testLoad() throws Exception {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    File file = new File(dir, "gvl.properties");
    try (var out = new FileOutputStream(file)) {
      testProperties().store(out, null);
    }

    var config = new LedgerConfig(file);
    assertEquals(dir.getAbsoluteFile(), config.getBaseDir());
    assertEquals(new File(dir.getAbsoluteFile(), "data/ledger"), config.getLedgerDir());
    assertEquals(new File("/etc/gvl/keys"), config.getKeysDir());
    assertEquals("airframe", config.getPartition());
    assertEquals(16, config.getBatchSize());
    assertEquals(List.of("design", "verification"), config.getOpenPhases());
    assertEquals(Criticality.HAZARDOUS, config.getThreshold());
    assertEquals(Duration.ofHours(48), config.getApprovalTimeout());
    assertEquals(Duration.ofSeconds(5), config.getPollInterval());
    assertEquals(5, config.getRetryPolicy().maxRetries());
    assertEquals(Duration.ofMillis(50), config.getRetryPolicy().initialBackoff());
    assertEquals(10, config.getRetentionYears());

    var phases = config.newPhaseRegistry();
    assertTrue(phases.isOpen("verification"));
    assertFalse(phases.isKnown("operations"));
    assertTrue(config.oversightPolicy().requiresApproval(Criticality.CATASTROPHIC));
    assertFalse(config.oversightPolicy().requiresApproval(Criticality.MAJOR));
  }


  @Test
  public void testOpenStore() throws Exception {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    var props = new Properties();
    props.setProperty(LedgerConfig.BASE_DIR, dir.getPath());
    props.setProperty(LedgerConfig.BATCH_SIZE, "2");
    var config = new LedgerConfig(props);

    assertTrue(config.loadKeyRing().isEmpty());
    KeyRing.save(mkdir(config.getKeysDir()), SIGNER_ID, signer().publicKey());
    assertTrue(config.loadKeyRing().contains(SIGNER_ID));

    try (var store = config.openStore()) {
      store.append(record(0));
      store.append(record(1));
      assertEquals(1, store.sealedBatchCount());
    }
    try (var log = config.openLog(true)) {
      assertEquals(2, log.size());
    }
    assertTrue(config.rejectionLog().list().isEmpty());
    assertTrue(config.pendingApprovals().list().isEmpty());
    assertTrue(config.getPendingDir().isDirectory());
  }


  private File mkdir(File dir) {
    dir.mkdirs();
    return dir;
  }


  @Test
  public void testMalformed() {
    var props = new Properties();
    props.setProperty(LedgerConfig.BATCH_SIZE, "0");
    assertThrows(IllegalArgumentException.class, () -> new LedgerConfig(props));
    props.remove(LedgerConfig.BATCH_SIZE);
    props.setProperty(LedgerConfig.APPROVAL_TIMEOUT, "72 hours");
    assertThrows(IllegalArgumentException.class, () -> new LedgerConfig(props));
    props.remove(LedgerConfig.APPROVAL_TIMEOUT);
    props.setProperty(LedgerConfig.APPROVAL_THRESHOLD, "severe");
    assertThrows(IllegalArgumentException.class, () -> new LedgerConfig(props));
  }


  @Test
  public void testMissingFile() {
    final Object label = new Object() {  };
    File file = getMethodOutputFilepath(label);
    assertThrows(IllegalArgumentException.class, () -> new LedgerConfig(file));
  }

}
