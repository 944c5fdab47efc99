/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import io.crums.gvl.Criticality;
import io.crums.gvl.GovernanceTuple;
import io.crums.gvl.GvlTestCase;
import io.crums.gvl.PersistenceException;
import io.crums.gvl.store.FailingEntryLog;
import io.crums.gvl.store.LedgerStore;
import io.crums.gvl.store.RetryPolicy;
import io.crums.gvl.store.VolatileEntryLog;

/**
 * 
 */
public class AdmissionGateTest extends GvlTestCase {

  private final static long HOUR_NANOS = TimeUnit.HOURS.toNanos(1);

  private final AtomicLong nanos = new AtomicLong(1_000_000L);
  private final MockApprovalChannel channel = new MockApprovalChannel();
  private final VolatileRejectionLog rejections = new VolatileRejectionLog();


  private AdmissionGate.Builder gateBuilder(LedgerStore store) {
    return AdmissionGate.builder(store)
        .verifier(verifier())
        .approvalChannel(channel)
        .phases(new PhaseRegistry("design", "verification"))
        .rejectionLog(rejections)
        .ticker(nanos::get);
  }

  private void advanceHours(long hours) {
    nanos.addAndGet(hours * HOUR_NANOS);
  }

  private GovernanceTuple hazardous(int n) {
    return record("design", Criticality.HAZARDOUS, "structures", n);
  }


  @Test
  public void testConcurrentLowCriticality() throws Exception {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).build()) {
      var admissions = new ArrayList<Admission>();
      for (int n = 0; n < 3; ++n)
        admissions.add(gate.submit(record(n)));

      CompletableFuture.allOf(
          admissions.stream().map(Admission::future).toArray(CompletableFuture[]::new))
          .get(10, TimeUnit.SECONDS);

      var seqNos = new TreeSet<Long>();
      for (var a : admissions) {
        assertEquals(AdmissionState.APPENDED, a.state());
        assertTrue(a.decision().isEmpty());
        seqNos.add(a.entry().get().seqNo());
      }
      assertEquals(3, store.size());
      assertEquals(new TreeSet<>(List.of(0L, 1L, 2L)), seqNos);
      assertEquals(0, channel.requestCount());
      assertTrue(rejections.list().isEmpty());
    }
  }


  @Test
  public void testApprovalTimeout() {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).build()) {
      var admission = gate.admit(hazardous(1));
      assertEquals(AdmissionState.AWAITING_APPROVAL, admission.state());
      assertEquals("TCK-1", admission.ticketId().get());
      assertEquals(1, gate.pendingCount());

      advanceHours(71);
      assertEquals(0, gate.pollPending());
      assertEquals(AdmissionState.AWAITING_APPROVAL, admission.state());

      advanceHours(1);
      assertEquals(1, gate.pollPending());
      assertEquals(AdmissionState.REJECTED, admission.state());
      assertEquals(RejectionReason.APPROVAL_TIMEOUT, admission.rejectionReason().get());
      assertTrue(admission.future().isDone());
      assertEquals(0, gate.pendingCount());
      assertEquals(0, store.size());

      var logged = rejections.list();
      assertEquals(1, logged.size());
      assertEquals(admission.tuple().id(), logged.get(0).recordId());
      assertEquals(AdmissionState.AWAITING_APPROVAL, logged.get(0).stoppedAt());
      assertEquals(RejectionReason.APPROVAL_TIMEOUT, logged.get(0).reason());
    }
  }


  @Test
  public void testLateApprovalNotHonored() {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).build()) {
      var admission = gate.admit(hazardous(1));
      advanceHours(73);
      channel.approve(admission.ticketId().get(), "j.doe");
      gate.pollPending();
      assertEquals(RejectionReason.APPROVAL_TIMEOUT, admission.rejectionReason().get());
      assertEquals(0, store.size());
    }
  }


  @Test
  public void testThresholdInclusive() {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).policy(new OversightPolicy(Criticality.MAJOR)).build()) {
      var major = gate.admit(record("design", Criticality.MAJOR, "structures", 1));
      var minor = gate.admit(record("design", Criticality.MINOR, "structures", 2));
      assertEquals(AdmissionState.AWAITING_APPROVAL, major.state());
      assertEquals(AdmissionState.APPENDED, minor.state());
      assertEquals(0, minor.entry().get().seqNo());
      assertEquals(1, channel.requestCount());
      assertTrue(channel.summaries().get(0).contains(major.tuple().id()));
    }
  }


  @Test
  public void testApproved() throws Exception {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).build()) {
      var admission = gate.admit(hazardous(1));
      assertEquals(0, gate.pollPending());

      channel.approve(admission.ticketId().get(), "j.doe");
      advanceHours(2);
      assertEquals(1, gate.pollPending());

      assertEquals(AdmissionState.APPENDED, admission.state());
      var entry = admission.future().get(1, TimeUnit.SECONDS).entry().get();
      assertEquals(0, entry.seqNo());
      var decision = entry.decision().get();
      assertEquals("TCK-1", decision.ticketId());
      assertEquals("j.doe", decision.approver());
      assertEquals(decision, store.read(0).decision().get());
    }
  }


  @Test
  public void testRejectedByApprover() {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).build()) {
      var admission = gate.admit(hazardous(1));
      channel.reject(admission.ticketId().get(), "j.doe", "load case missing");
      assertEquals(1, gate.pollPending());
      assertEquals(RejectionReason.APPROVAL_REJECTED, admission.rejectionReason().get());
      assertTrue(admission.rejectionDetail().contains("load case missing"));
      assertEquals(0, store.size());
    }
  }


  @Test
  public void testPollFailureRetried() {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).build()) {
      var admission = gate.admit(hazardous(1));
      channel.failPolls(true);
      assertEquals(0, gate.pollPending());
      assertEquals(AdmissionState.AWAITING_APPROVAL, admission.state());
      channel.failPolls(false);
      channel.approve(admission.ticketId().get(), "j.doe");
      assertEquals(1, gate.pollPending());
      assertEquals(AdmissionState.APPENDED, admission.state());
    }
  }


  @Test
  public void testApprovalRequestFails() {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).build()) {
      channel.failRequests(true);
      var admission = gate.admit(hazardous(1));
      assertEquals(AdmissionState.REJECTED, admission.state());
      assertEquals(RejectionReason.APPROVAL_REJECTED, admission.rejectionReason().get());
      assertEquals(0, gate.pendingCount());
    }
  }


  @Test
  public void testInvalidSignature() {
    var store = LedgerStore.inMemory();
    var t = record(1);
    var forged = new GovernanceTuple(
        t.id(), t.seed() + 1, t.inputHash(), t.solverIdentity(), t.rankedResults(),
        t.resultHash(), t.lifecyclePhase(), t.criticality(), t.timestamp(), t.signerId(),
        t.category(), t.recordType(), t.upstreamRef(), t.signature());
    try (var gate = gateBuilder(store).build()) {
      var admission = gate.admit(forged);
      assertEquals(RejectionReason.INVALID_SIGNATURE, admission.rejectionReason().get());
      assertEquals(AdmissionState.RECEIVED, rejections.list().get(0).stoppedAt());
      assertEquals(0, store.size());
    }
  }


  @Test
  public void testLifecycleClosed() {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).build()) {
      gate.phases().close("verification");
      var closed = gate.admit(record("verification", Criticality.MINOR, "structures", 1));
      var unknown = gate.admit(record("disposal", Criticality.MINOR, "structures", 2));
      assertEquals(RejectionReason.LIFECYCLE_CLOSED, closed.rejectionReason().get());
      assertEquals(RejectionReason.LIFECYCLE_CLOSED, unknown.rejectionReason().get());
      assertEquals(AdmissionState.SIGNATURE_VERIFIED, rejections.list().get(0).stoppedAt());

      gate.phases().open("verification");
      var reopened = gate.admit(record("verification", Criticality.MINOR, "structures", 3));
      assertEquals(AdmissionState.APPENDED, reopened.state());
    }
  }


  @Test
  public void testWithdrawBeforeChecks() {
    var store = LedgerStore.inMemory();
    var workers = new ManualExecutor();
    try (var gate = gateBuilder(store).workers(workers).build()) {
      var admission = gate.submit(record(1));
      assertEquals(AdmissionState.RECEIVED, admission.state());
      assertTrue(admission.withdraw());
      assertFalse(admission.withdraw());
      assertEquals(1, workers.runAll());

      assertEquals(AdmissionState.REJECTED, admission.state());
      assertEquals(RejectionReason.WITHDRAWN, admission.rejectionReason().get());
      assertTrue(admission.future().isDone());
      assertEquals(0, store.size());
      assertEquals(AdmissionState.RECEIVED, rejections.list().get(0).stoppedAt());
    }
  }


  @Test
  public void testWithdrawAfterEscalation() {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).build()) {
      var escalated = gate.admit(hazardous(1));
      assertFalse(escalated.withdraw());
      assertEquals(AdmissionState.AWAITING_APPROVAL, escalated.state());

      var appended = gate.admit(record(2));
      assertFalse(appended.withdraw());
      assertEquals(AdmissionState.APPENDED, appended.state());
      assertTrue(rejections.list().isEmpty());
    }
  }


  @Test
  public void testResumeAfterRestart() {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    var store = LedgerStore.inMemory();

    Admission first;
    try (var gate = gateBuilder(store)
        .pendingApprovals(new PendingApprovalsDir(dir)).build()) {
      first = gate.admit(hazardous(1));
      gate.admit(hazardous(2));
      advanceHours(10);
      assertEquals(0, gate.pollPending());
    }
    assertEquals(AdmissionState.AWAITING_APPROVAL, first.state());

    // restart: new gate, new monotonic origin
    nanos.set(5);
    try (var gate = gateBuilder(store)
        .pendingApprovals(new PendingApprovalsDir(dir)).build()) {
      var resumed = gate.resumePending();
      assertEquals(2, resumed.size());
      assertEquals(2, gate.pendingCount());

      channel.approve("TCK-2", "j.doe");
      assertEquals(1, gate.pollPending());
      assertEquals(1, store.size());

      advanceHours(61);
      assertEquals(0, gate.pollPending());
      advanceHours(1);
      assertEquals(1, gate.pollPending());
      assertEquals(0, gate.pendingCount());
      assertEquals(1, store.size());
      assertTrue(new PendingApprovalsDir(dir).list().isEmpty());
    }
  }


  @Test
  public void testResumeSkipsCommitted() {
    var pending = new VolatilePendingApprovals();
    var store = LedgerStore.inMemory();
    var tuple = hazardous(1);
    store.append(tuple);
    pending.save(new PendingApproval("TCK-9", store.partition(), tuple, TEST_UTC, 0));
    pending.save(new PendingApproval("TCK-10", "other", hazardous(2), TEST_UTC, 0));
    try (var gate = gateBuilder(store).pendingApprovals(pending).build()) {
      assertTrue(gate.resumePending().isEmpty());
      assertEquals(1, pending.list().size());
    }
  }


  @Test
  public void testPersistenceFailure() throws Exception {
    var log = new FailingEntryLog(new VolatileEntryLog());
    var store = new LedgerStore("default", log, 8, RetryPolicy.NONE);
    try (var gate = gateBuilder(store).build()) {
      log.failNext(1);
      assertThrows(PersistenceException.class, () -> gate.admit(record(1)));

      var admission = gate.submit(record(2));
      var x = assertThrows(
          ExecutionException.class, () -> admission.future().get(10, TimeUnit.SECONDS));
      assertTrue(x.getCause() instanceof PersistenceException);
      assertEquals(AdmissionState.APPROVED, admission.state());
      assertTrue(admission.failure().isPresent());
      assertEquals(0, store.size());
    }
  }


  @Test
  public void testApprovalCompletionOrder() {
    var store = LedgerStore.inMemory();
    try (var gate = gateBuilder(store).build()) {
      var a1 = gate.admit(hazardous(1));
      var a2 = gate.admit(hazardous(2));
      assertEquals("TCK-1", a1.ticketId().get());
      assertEquals("TCK-2", a2.ticketId().get());

      channel.approve("TCK-2", "j.doe");
      assertEquals(1, gate.pollPending());
      channel.approve("TCK-1", "j.doe");
      assertEquals(1, gate.pollPending());

      assertEquals(0, a2.entry().get().seqNo());
      assertEquals(1, a1.entry().get().seqNo());
      assertEquals(a2.tuple(), store.read(0).tuple());
      assertEquals(a1.tuple(), store.read(1).tuple());
    }
  }


  @Test
  public void testApprovedButNotCommittedResumes() {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    var base = new VolatileEntryLog();
    var log = new FailingEntryLog(base);
    var store = new LedgerStore("default", log, 8, RetryPolicy.NONE);

    try (var gate = gateBuilder(store)
        .pendingApprovals(new PendingApprovalsDir(dir)).build()) {
      var admission = gate.admit(hazardous(1));
      channel.approve("TCK-1", "j.doe");
      log.failNext(1);
      assertEquals(1, gate.pollPending());

      assertEquals(AdmissionState.APPROVED, admission.state());
      assertTrue(admission.failure().isPresent());
      assertEquals(0, store.size());
      assertEquals(1, new PendingApprovalsDir(dir).list().size());
    }

    // restart over the healthy log
    var reopened = new LedgerStore("default", base, 8, RetryPolicy.NONE);
    try (var gate = gateBuilder(reopened)
        .pendingApprovals(new PendingApprovalsDir(dir)).build()) {
      var resumed = gate.resumePending();
      assertEquals(1, resumed.size());
      assertEquals(1, gate.pollPending());

      assertEquals(AdmissionState.APPENDED, resumed.get(0).state());
      assertEquals(1, reopened.size());
      assertEquals("j.doe", reopened.read(0).decision().get().approver());
      assertTrue(new PendingApprovalsDir(dir).list().isEmpty());
      assertTrue(rejections.list().isEmpty());
    }
  }


  @Test
  public void testPendingSaveFailureStillTimesOut() throws Exception {
    var store = LedgerStore.inMemory();
    var unsavable = new VolatilePendingApprovals() {
      @Override
      public void save(PendingApproval p) {
        throw new UncheckedIOException(new IOException("pending dir on fire"));
      }
    };
    try (var gate = gateBuilder(store).pendingApprovals(unsavable).build()) {
      var admission = gate.admit(hazardous(1));
      assertEquals(AdmissionState.AWAITING_APPROVAL, admission.state());
      assertFalse(admission.future().isDone());
      assertEquals(1, gate.pendingCount());

      advanceHours(100);
      assertEquals(1, gate.pollPending());
      assertEquals(AdmissionState.REJECTED, admission.state());
      assertEquals(RejectionReason.APPROVAL_TIMEOUT, admission.rejectionReason().get());
      assertTrue(admission.future().get(1, TimeUnit.SECONDS).rejectionReason().isPresent());
      assertEquals(1, rejections.list().size());
    }
  }


  @Test
  public void testOverlappingPollPasses() throws Exception {
    final Object label = new Object() {  };
    File dir = makeTestDir(label);
    var store = LedgerStore.inMemory();

    var entered = new CountDownLatch(1);
    var release = new CountDownLatch(1);
    var polls = new AtomicInteger();
    // first poll stalls, then reports the (stale) pending status
    var stalling = new ApprovalChannel() {
      @Override
      public String requestApproval(String summary, Criticality criticality) {
        return channel.requestApproval(summary, criticality);
      }
      @Override
      public ApprovalStatus pollDecision(String ticketId) {
        if (polls.incrementAndGet() == 1) {
          entered.countDown();
          try {
            release.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException ix) {
            Thread.currentThread().interrupt();
          }
          return ApprovalStatus.PENDING;
        }
        return channel.pollDecision(ticketId);
      }
    };

    try (var gate = gateBuilder(store)
        .approvalChannel(stalling)
        .pendingApprovals(new PendingApprovalsDir(dir)).build()) {
      var admission = gate.admit(hazardous(1));

      var slowPass = new Thread(gate::pollPending);
      slowPass.start();
      assertTrue(entered.await(10, TimeUnit.SECONDS));

      channel.approve("TCK-1", "j.doe");
      var fastPass = new Thread(gate::pollPending);
      fastPass.start();
      long deadline = System.currentTimeMillis() + 10_000;
      while (fastPass.getState() != Thread.State.BLOCKED &&
          fastPass.getState() != Thread.State.TERMINATED &&
          System.currentTimeMillis() < deadline)
        Thread.sleep(1);

      release.countDown();
      slowPass.join(10_000);
      fastPass.join(10_000);

      assertEquals(AdmissionState.APPENDED, admission.state());
      assertEquals(1, store.size());
      assertEquals(0, gate.pendingCount());
      assertTrue(new PendingApprovalsDir(dir).list().isEmpty());
    }
  }


  @Test
  public void testBuilderChecks() {
    var store = LedgerStore.inMemory();
    assertThrows(
        NullPointerException.class,
        () -> AdmissionGate.builder(store).approvalChannel(channel).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> gateBuilder(store).approvalTimeout(Duration.ZERO).build());
  }

}
