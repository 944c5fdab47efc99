/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.gate;


import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import io.crums.gvl.ApprovalDecision;
import io.crums.gvl.GovernanceTuple;
import io.crums.gvl.LedgerEntry;
import io.crums.gvl.PersistenceException;

/**
 * Handle on a record's passage through an {@linkplain AdmissionGate}. State
 * transitions are checked against {@linkplain AdmissionState#canTransitionTo(AdmissionState)}.
 * <p>
 * The {@linkplain #future() future} completes (with this instance) once the
 * admission reaches a terminal state. It completes exceptionally only if an
 * approved record could not be persisted; in that case the state stays
 * {@linkplain AdmissionState#APPROVED}.
 * </p>
 */
public class Admission {

  private final AdmissionGate gate;
  private final GovernanceTuple tuple;
  private final CompletableFuture<Admission> future = new CompletableFuture<>();

  // guarded by this
  private AdmissionState state;
  private RejectionReason reason;
  private String detail;
  private String ticketId;
  private ApprovalDecision decision;
  private LedgerEntry entry;
  private PersistenceException failure;


  Admission(AdmissionGate gate, GovernanceTuple tuple, AdmissionState initial) {
    this.gate = gate;
    this.tuple = Objects.requireNonNull(tuple, "null tuple");
    this.state = initial;
  }


  public GovernanceTuple tuple() {
    return tuple;
  }

  public synchronized AdmissionState state() {
    return state;
  }

  /** Present once rejected. */
  public synchronized Optional<RejectionReason> rejectionReason() {
    return Optional.ofNullable(reason);
  }

  /** Rejection detail; empty if not rejected. */
  public synchronized String rejectionDetail() {
    return detail == null ? "" : detail;
  }

  /** Present once escalated for approval. */
  public synchronized Optional<String> ticketId() {
    return Optional.ofNullable(ticketId);
  }

  /** Present once approved through the approval channel. */
  public synchronized Optional<ApprovalDecision> decision() {
    return Optional.ofNullable(decision);
  }

  /** Present once appended. */
  public synchronized Optional<LedgerEntry> entry() {
    return Optional.ofNullable(entry);
  }


  /** Present if the record was approved but could not be persisted. */
  public synchronized Optional<PersistenceException> failure() {
    return Optional.ofNullable(failure);
  }


  /**
   * Completes when the admission reaches a terminal state.
   */
  public CompletableFuture<Admission> future() {
    return future;
  }


  /**
   * Withdraws the record. Allowed only before the record is escalated for
   * approval (or approved).
   *
   * @return {@code true} if withdrawn; {@code false} if already past the point
   *         of withdrawal (or already withdrawn)
   */
  public boolean withdraw() {
    return gate.withdraw(this);
  }



  /**
   * Transitions to the given state.
   *
   * @return {@code false} if the current state is terminal (e.g. withdrawn
   *         concurrently)
   * @throws IllegalStateException if the transition is illegal from a
   *         non-terminal state
   */
  synchronized boolean advance(AdmissionState next) {
    if (state.isTerminal())
      return false;
    if (!state.canTransitionTo(next))
      throw new IllegalStateException(
          "illegal transition " + state + " -> " + next + " on record " + tuple.id());
    state = next;
    return true;
  }


  /** Moves to {@linkplain AdmissionState#AWAITING_APPROVAL}. */
  synchronized boolean escalate() {
    return advance(AdmissionState.AWAITING_APPROVAL);
  }


  synchronized void setTicket(String ticketId) {
    this.ticketId = ticketId;
  }


  synchronized boolean approve(Optional<ApprovalDecision> decision) {
    if (!advance(AdmissionState.APPROVED))
      return false;
    this.decision = decision.orElse(null);
    return true;
  }


  /**
   * Rejects, returning the state admission stopped at, or {@code null} if
   * already terminal.
   */
  synchronized AdmissionState reject(RejectionReason reason, String detail) {
    final AdmissionState stoppedAt = state;
    if (!advance(AdmissionState.REJECTED))
      return null;
    this.reason = reason;
    this.detail = detail;
    return stoppedAt;
  }


  /**
   * Withdraws, returning the state admission stopped at, or {@code null} if
   * not withdrawable.
   */
  synchronized AdmissionState tryWithdraw() {
    if (!state.isWithdrawable())
      return null;
    return reject(RejectionReason.WITHDRAWN, "withdrawn by submitter");
  }


  synchronized void appended(LedgerEntry entry) {
    advance(AdmissionState.APPENDED);
    this.entry = entry;
  }


  void complete() {
    future.complete(this);
  }


  void fail(PersistenceException px) {
    synchronized (this) {
      failure = px;
    }
    future.completeExceptionally(px);
  }


  @Override
  public synchronized String toString() {
    return "Admission[" + tuple.id() + ", " + state +
        (reason == null ? "" : "(" + reason + ")") + "]";
  }

}
