/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeUnit;

import io.crums.gvl.GovernanceTuple;
import io.crums.gvl.LedgerEntry;

/**
 * Secondary indices over the ledger: filter dimension value to ascending
 * sequence indices. Derived state, never authoritative: it can always be
 * rebuilt from the entry log.
 * <p>
 * Lookups take a {@code bound} (the snapshot size) so that entries indexed
 * after a query's snapshot was fixed are invisible to it.
 * </p>
 */
public class LedgerIndex {
  
  /**
   * Exact-match filter dimensions.
   */
  public enum Dimension {
    CATEGORY,
    PHASE,
    CRITICALITY,
    RECORD_TYPE;
    
    String valueOf(GovernanceTuple tuple) {
      switch (this) {
      case CATEGORY:    return tuple.category();
      case PHASE:       return tuple.lifecyclePhase();
      case CRITICALITY: return tuple.criticality().name();
      case RECORD_TYPE: return tuple.recordType();
      default:
        throw new AssertionError(this);
      }
    }
  }
  
  
  private final static long DAY_MILLIS = TimeUnit.DAYS.toMillis(1);
  
  
  /** Returns the UTC day number of the given UTC millis. */
  public static long dayOf(long utcMillis) {
    return Math.floorDiv(utcMillis, DAY_MILLIS);
  }
  
  
  private final Map<Dimension, Map<String, SeqList>> maps = new EnumMap<>(Dimension.class);
  private final ConcurrentSkipListMap<Long, SeqList> days = new ConcurrentSkipListMap<>();
  private final Map<String, Long> ids = new ConcurrentHashMap<>();
  
  
  public LedgerIndex() {
    for (var dim : Dimension.values())
      maps.put(dim, new ConcurrentHashMap<>());
  }
  
  
  /**
   * Indexes the given entry. Entries must be added in ascending sequence order.
   */
  void add(LedgerEntry entry) {
    final long seqNo = entry.seqNo();
    final var tuple = entry.tuple();
    for (var dim : Dimension.values())
      maps.get(dim).computeIfAbsent(dim.valueOf(tuple), v -> new SeqList()).add(seqNo);
    days.computeIfAbsent(dayOf(tuple.timestamp()), d -> new SeqList()).add(seqNo);
    ids.putIfAbsent(tuple.id(), seqNo);
  }
  
  
  
  
  /**
   * Returns the sequence indices of entries with the given value, less than
   * {@code bound}, in ascending order.
   */
  public long[] lookup(Dimension dim, String value, long bound) {
    Objects.requireNonNull(value, "null value");
    var list = maps.get(dim).get(value);
    return list == null ? new long[0] : list.head(bound);
  }
  
  
  /**
   * Returns the sequence indices of entries with the timestamps in the UTC days
   * {@code fromDay} thru {@code toDay} (inclusive), less than {@code bound},
   * in ascending order. The caller filters by exact timestamp.
   */
  public long[] lookupDays(long fromDay, long toDay, long bound) {
    if (fromDay > toDay)
      return new long[0];
    var lists = new ArrayList<long[]>();
    int total = 0;
    for (var list : days.subMap(fromDay, true, toDay, true).values()) {
      long[] head = list.head(bound);
      lists.add(head);
      total += head.length;
    }
    long[] out = new long[total];
    int pos = 0;
    for (var head : lists) {
      System.arraycopy(head, 0, out, pos, head.length);
      pos += head.length;
    }
    Arrays.sort(out);
    return out;
  }
  
  
  /**
   * Returns the sequence index of the entry with the given record ID, if any,
   * and if less than {@code bound}.
   */
  public OptionalLong seqNoOf(String id, long bound) {
    Long seqNo = ids.get(id);
    return seqNo == null || seqNo >= bound ? OptionalLong.empty() : OptionalLong.of(seqNo);
  }
  
  
  /**
   * Returns the distinct values indexed under the given dimension.
   */
  public SortedSet<String> values(Dimension dim) {
    return new TreeSet<>(maps.get(dim).keySet());
  }

}
