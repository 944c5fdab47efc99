/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import static io.crums.gvl.GvlConstants.DEF_APPROVAL_TIMEOUT;
import static io.crums.gvl.GvlConstants.DEF_POLL_INTERVAL;
import static io.crums.gvl.GvlConstants.getLogger;

import java.lang.System.Logger.Level;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import io.crums.gvl.ApprovalDecision;
import io.crums.gvl.GovernanceTuple;
import io.crums.gvl.PersistenceException;
import io.crums.gvl.sig.TupleVerifier;
import io.crums.gvl.sig.VerificationException;
import io.crums.gvl.store.LedgerStore;

/**
 * Validates signed records and commits the approved ones to a
 * {@linkplain LedgerStore}.
 *
 * <h2>Flow</h2>
 * <ol>
 * <li>Signature check against the key ring ({@linkplain RejectionReason#INVALID_SIGNATURE}).</li>
 * <li>Lifecycle check against the {@linkplain PhaseRegistry} ({@linkplain RejectionReason#LIFECYCLE_CLOSED}).</li>
 * <li>Oversight: at or above the {@linkplain OversightPolicy threshold} the
 *     record is escalated through the {@linkplain ApprovalChannel} and waits;
 *     otherwise it's approved.</li>
 * <li>Approved records enter a FIFO commit queue drained under one lock, so
 *     sequence order is approval-completion order.</li>
 * </ol>
 * <p>
 * Rejections are recorded in the {@linkplain RejectionLog} only. Escalated
 * records are persisted as {@linkplain PendingApproval}s with the time already
 * waited, so {@linkplain #resumePending()} picks them up after a restart with
 * what is left of their timeout. An approved record's pending approval is
 * removed only once the record is committed. Timeouts are measured on a
 * {@linkplain Ticker monotonic clock}. A timed-out approval is rejected even
 * if a late decision is available (fail-closed).
 * </p>
 */
public class AdmissionGate implements AutoCloseable {


  /**
   * Returns a new builder over the given store.
   */
  public static Builder builder(LedgerStore store) {
    return new Builder(store);
  }


  /**
   * {@linkplain AdmissionGate} builder. The store, verifier, and approval
   * channel are required; everything else has a default.
   */
  public static class Builder {

    private final LedgerStore store;
    private TupleVerifier verifier;
    private ApprovalChannel channel;
    private PhaseRegistry phases = new PhaseRegistry();
    private OversightPolicy policy = OversightPolicy.DEFAULT;
    private RejectionLog rejections;
    private PendingApprovals pendingApprovals;
    private Duration approvalTimeout = DEF_APPROVAL_TIMEOUT;
    private Duration pollInterval = DEF_POLL_INTERVAL;
    private Ticker ticker = Ticker.SYSTEM;
    private Clock clock = Clock.systemUTC();
    private ExecutorService workers;

    private Builder(LedgerStore store) {
      this.store = Objects.requireNonNull(store, "null store");
    }

    public Builder verifier(TupleVerifier verifier) {
      this.verifier = verifier;
      return this;
    }

    public Builder approvalChannel(ApprovalChannel channel) {
      this.channel = channel;
      return this;
    }

    public Builder phases(PhaseRegistry phases) {
      this.phases = phases;
      return this;
    }

    public Builder policy(OversightPolicy policy) {
      this.policy = policy;
      return this;
    }

    public Builder rejectionLog(RejectionLog rejections) {
      this.rejections = rejections;
      return this;
    }

    public Builder pendingApprovals(PendingApprovals pendingApprovals) {
      this.pendingApprovals = pendingApprovals;
      return this;
    }

    public Builder approvalTimeout(Duration timeout) {
      this.approvalTimeout = timeout;
      return this;
    }

    public Builder pollInterval(Duration interval) {
      this.pollInterval = interval;
      return this;
    }

    public Builder ticker(Ticker ticker) {
      this.ticker = ticker;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the executor {@linkplain AdmissionGate#submit(GovernanceTuple)}
     * runs checks on. The gate does not shut down an executor it is given.
     */
    public Builder workers(ExecutorService workers) {
      this.workers = workers;
      return this;
    }

    public AdmissionGate build() {
      return new AdmissionGate(this);
    }
  }


  /** An escalated admission, and when it started waiting. */
  private record Waiting(
      Admission admission, PendingApproval pending, long startNanos, long priorNanos) {

    long waitedNanos(long now) {
      return priorNanos + (now - startNanos);
    }
  }



  private final LedgerStore store;
  private final TupleVerifier verifier;
  private final ApprovalChannel channel;
  private final PhaseRegistry phases;
  private final OversightPolicy policy;
  private final RejectionLog rejections;
  private final PendingApprovals pendingApprovals;
  private final Duration approvalTimeout;
  private final Duration pollInterval;
  private final Ticker ticker;
  private final Clock clock;
  private final ExecutorService workers;
  private final boolean ownsWorkers;

  private final Map<String, Waiting> awaiting = new ConcurrentHashMap<>();
  private final ConcurrentLinkedQueue<Admission> commitQueue = new ConcurrentLinkedQueue<>();
  private final ReentrantLock commitLock = new ReentrantLock();

  private ScheduledExecutorService poller;


  private AdmissionGate(Builder builder) {
    this.store = builder.store;
    this.verifier = Objects.requireNonNull(builder.verifier, "null verifier");
    this.channel = Objects.requireNonNull(builder.channel, "null approval channel");
    this.phases = Objects.requireNonNull(builder.phases, "null phases");
    this.policy = Objects.requireNonNull(builder.policy, "null policy");
    this.rejections =
        builder.rejections == null ? new VolatileRejectionLog() : builder.rejections;
    this.pendingApprovals =
        builder.pendingApprovals == null ?
            new VolatilePendingApprovals() : builder.pendingApprovals;
    this.approvalTimeout = checkPositive(builder.approvalTimeout, "approvalTimeout");
    this.pollInterval = checkPositive(builder.pollInterval, "pollInterval");
    this.ticker = Objects.requireNonNull(builder.ticker, "null ticker");
    this.clock = Objects.requireNonNull(builder.clock, "null clock");
    this.ownsWorkers = builder.workers == null;
    this.workers =
        ownsWorkers ?
            Executors.newFixedThreadPool(
                Runtime.getRuntime().availableProcessors(), daemonThreads("gvl-admit-")) :
            builder.workers;
  }


  private static Duration checkPositive(Duration d, String name) {
    Objects.requireNonNull(d, "null " + name);
    if (d.isNegative() || d.isZero())
      throw new IllegalArgumentException(name + " " + d);
    return d;
  }


  private static ThreadFactory daemonThreads(String prefix) {
    var count = new AtomicInteger();
    return r -> {
      var thread = new Thread(r, prefix + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }



  public LedgerStore store() {
    return store;
  }

  public PhaseRegistry phases() {
    return phases;
  }

  public OversightPolicy policy() {
    return policy;
  }

  public RejectionLog rejectionLog() {
    return rejections;
  }

  public Duration approvalTimeout() {
    return approvalTimeout;
  }

  /** Returns the number of admissions waiting on a human decision. */
  public int pendingCount() {
    return awaiting.size();
  }



  /**
   * Submits the given record for asynchronous admission. Signature and
   * lifecycle checks run on the worker executor.
   *
   * @return the admission handle (initially {@linkplain AdmissionState#RECEIVED})
   */
  public Admission submit(GovernanceTuple tuple) {
    var admission = new Admission(this, tuple, AdmissionState.RECEIVED);
    workers.execute(() -> process(admission));
    return admission;
  }


  /**
   * Admits the given record synchronously in the calling thread. Returns once
   * the record is appended, rejected, or waiting on approval.
   *
   * @throws PersistenceException if the record was approved but could not be
   *         persisted
   */
  public Admission admit(GovernanceTuple tuple) throws PersistenceException {
    var admission = new Admission(this, tuple, AdmissionState.RECEIVED);
    process(admission);
    var failure = admission.failure();
    if (failure.isPresent())
      throw failure.get();
    return admission;
  }


  private void process(Admission admission) {
    try {
      processImpl(admission);
    } catch (RuntimeException x) {
      // the future carries it
      if (!admission.future().isDone())
        admission.future().completeExceptionally(x);
      getLogger().log(Level.ERROR,
          "admission of record " + admission.tuple().id() + " failed: " + x.getMessage(), x);
    }
  }


  private void processImpl(Admission admission) {
    final var tuple = admission.tuple();

    try {
      verifier.verify(tuple);
    } catch (VerificationException vx) {
      reject(admission, RejectionReason.INVALID_SIGNATURE, vx.getMessage());
      return;
    }
    if (!admission.advance(AdmissionState.SIGNATURE_VERIFIED))
      return;

    try {
      phases.check(tuple.lifecyclePhase());
    } catch (LifecycleException lx) {
      reject(admission, RejectionReason.LIFECYCLE_CLOSED, lx.getMessage());
      return;
    }
    if (!admission.advance(AdmissionState.LIFECYCLE_CHECKED))
      return;

    if (policy.requiresApproval(tuple.criticality()))
      escalate(admission);
    else
      approve(admission, Optional.empty());
  }


  private void escalate(Admission admission) {
    if (!admission.escalate())
      return;

    final var tuple = admission.tuple();
    final String ticketId;
    try {
      ticketId = channel.requestApproval(tuple.summary(), tuple.criticality());
      if (ticketId == null || ticketId.isEmpty())
        throw new IllegalStateException("approval channel returned no ticket");
    } catch (RuntimeException x) {
      getLogger().log(Level.WARNING,
          "approval request for record " + tuple.id() + " failed: " + x.getMessage(), x);
      reject(admission, RejectionReason.APPROVAL_REJECTED,
          "approval request failed: " + x.getMessage());
      return;
    }
    admission.setTicket(ticketId);

    // an unsaved approval is still tracked (and timed out) in memory
    var pending = new PendingApproval(ticketId, store.partition(), tuple, clock.millis(), 0);
    savePending(pending);
    awaiting.put(ticketId, new Waiting(admission, pending, ticker.nanos(), 0));

    getLogger().log(Level.INFO,
        "record " + tuple.id() + " (" + tuple.criticality() + ") awaiting approval; ticket " +
        ticketId);
  }


  private void approve(Admission admission, Optional<ApprovalDecision> decision) {
    if (!admission.approve(decision))
      return;
    commitQueue.add(admission);
    drainCommits();
  }


  /**
   * Commits queued admissions in FIFO order. Every enqueuer drains, so nothing
   * is stranded in the queue.
   */
  private void drainCommits() {
    commitLock.lock();
    try {
      Admission next;
      while ((next = commitQueue.poll()) != null)
        commit(next);
    } finally {
      commitLock.unlock();
    }
  }


  private void commit(Admission admission) {
    final var tuple = admission.tuple();
    try {
      var entry = store.append(tuple, admission.decision());
      admission.ticketId().ifPresent(this::removePending);
      admission.appended(entry);
      admission.complete();
    } catch (PersistenceException px) {
      // the pending approval stays persisted, so a restart picks it up again
      getLogger().log(Level.ERROR,
          "approved record " + tuple.id() + " could not be appended: " + px.getMessage(), px);
      admission.fail(px);
    }
  }


  private void reject(Admission admission, RejectionReason reason, String detail) {
    var stoppedAt = admission.reject(reason, detail);
    if (stoppedAt == null)
      return;
    logRejection(admission, stoppedAt, reason, detail);
    admission.complete();
  }


  private void logRejection(
      Admission admission, AdmissionState stoppedAt, RejectionReason reason, String detail) {
    var rejection = new Rejection(
        admission.tuple(), store.partition(), stoppedAt, reason, detail, clock.millis());
    getLogger().log(Level.INFO,
        "record " + rejection.recordId() + " rejected at " + stoppedAt + ": " + reason +
        (detail == null || detail.isEmpty() ? "" : " (" + detail + ")"));
    try {
      rejections.record(rejection);
    } catch (RuntimeException x) {
      getLogger().log(Level.ERROR,
          "failed to record rejection of " + rejection.recordId() + " (" + reason + ")", x);
    }
  }


  /**
   * Invoked by {@linkplain Admission#withdraw()}.
   */
  boolean withdraw(Admission admission) {
    var stoppedAt = admission.tryWithdraw();
    if (stoppedAt == null)
      return false;
    logRejection(admission, stoppedAt, RejectionReason.WITHDRAWN, "withdrawn by submitter");
    admission.complete();
    return true;
  }



  /**
   * Runs one polling pass over the admissions awaiting approval: resolves
   * those decided or timed out, and saves the waited time of the rest.
   *
   * @return the number of admissions resolved in this pass
   */
  public int pollPending() {
    int resolved = 0;
    for (var waiting : new ArrayList<>(awaiting.values())) {
      if (pollOne(waiting))
        ++resolved;
    }
    return resolved;
  }


  private boolean pollOne(Waiting waiting) {
    // one pass at a time per ticket
    synchronized (waiting) {
      if (awaiting.get(waiting.pending().ticketId()) != waiting)
        return false;
      return pollOneImpl(waiting);
    }
  }


  private boolean pollOneImpl(Waiting waiting) {
    final var admission = waiting.admission();
    final var pending = waiting.pending();
    final String ticketId = pending.ticketId();

    final long waitedNanos = waiting.waitedNanos(ticker.nanos());

    if (waitedNanos >= approvalTimeout.toNanos()) {
      resolved(ticketId);
      reject(admission, RejectionReason.APPROVAL_TIMEOUT,
          "no decision on ticket " + ticketId + " within " + approvalTimeout);
      return true;
    }

    final ApprovalStatus status;
    try {
      status = channel.pollDecision(ticketId);
    } catch (RuntimeException x) {
      getLogger().log(Level.WARNING,
          "poll of ticket " + ticketId + " failed; will retry: " + x.getMessage());
      savePending(pending.waited(TimeUnit.NANOSECONDS.toMillis(waitedNanos)));
      return false;
    }

    switch (status.decision()) {
    case APPROVED:
      // the persisted pending approval is removed on commit
      awaiting.remove(ticketId);
      var decision = new ApprovalDecision(
          ticketId, status.approver(), clock.millis(), status.note());
      approve(admission, Optional.of(decision));
      return true;
    case REJECTED:
      resolved(ticketId);
      reject(admission, RejectionReason.APPROVAL_REJECTED,
          "ticket " + ticketId + " rejected by " + status.approver() + ": " + status.note());
      return true;
    default:
      savePending(pending.waited(TimeUnit.NANOSECONDS.toMillis(waitedNanos)));
      return false;
    }
  }


  private void resolved(String ticketId) {
    awaiting.remove(ticketId);
    removePending(ticketId);
  }


  private void removePending(String ticketId) {
    try {
      pendingApprovals.remove(ticketId);
    } catch (RuntimeException x) {
      getLogger().log(Level.WARNING,
          "failed to remove resolved pending approval " + ticketId + ": " + x.getMessage());
    }
  }


  private void savePending(PendingApproval pending) {
    try {
      pendingApprovals.save(pending);
    } catch (RuntimeException x) {
      getLogger().log(Level.WARNING,
          "failed to save pending approval " + pending.ticketId() + ": " + x.getMessage());
    }
  }


  /**
   * Restores the persisted pending approvals (e.g. after a restart). Each
   * resumes with the time it had already waited.
   *
   * @return the restored admissions, each in {@linkplain AdmissionState#AWAITING_APPROVAL}
   */
  public List<Admission> resumePending() {
    var resumed = new ArrayList<Admission>();
    final long now = ticker.nanos();
    for (var pending : pendingApprovals.list()) {
      if (!pending.partition().equals(store.partition()) ||
          awaiting.containsKey(pending.ticketId()))
        continue;
      if (store.findById(pending.tuple().id()).isPresent()) {
        getLogger().log(Level.WARNING,
            "pending approval " + pending.ticketId() + " already committed; discarding");
        pendingApprovals.remove(pending.ticketId());
        continue;
      }
      var admission = new Admission(this, pending.tuple(), AdmissionState.AWAITING_APPROVAL);
      admission.setTicket(pending.ticketId());
      awaiting.put(
          pending.ticketId(),
          new Waiting(
              admission, pending, now,
              TimeUnit.MILLISECONDS.toNanos(pending.waitedMillis())));
      resumed.add(admission);
    }
    if (!resumed.isEmpty())
      getLogger().log(Level.INFO,
          "resumed " + resumed.size() + " pending approval(s) in partition " + store.partition());
    return resumed;
  }


  /**
   * Starts the periodic poller. Idempotent.
   */
  public synchronized void start() {
    if (poller != null)
      return;
    poller = Executors.newSingleThreadScheduledExecutor(daemonThreads("gvl-poll-"));
    long millis = pollInterval.toMillis();
    poller.scheduleWithFixedDelay(this::pollQuietly, millis, millis, TimeUnit.MILLISECONDS);
  }


  private void pollQuietly() {
    try {
      pollPending();
    } catch (RuntimeException x) {
      // an escaping exception would cancel the schedule
      getLogger().log(Level.ERROR, "approval poll pass failed", x);
    }
  }


  /**
   * Stops the poller and, if owned, the worker executor. Pending approvals
   * stay persisted. Does not close the store.
   */
  @Override
  public synchronized void close() {
    if (poller != null) {
      poller.shutdownNow();
      poller = null;
    }
    if (ownsWorkers)
      workers.shutdown();
  }

}
