/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.query;


import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.crums.gvl.Criticality;
import io.crums.gvl.GovernanceTuple;
import io.crums.gvl.Hashing;
import io.crums.gvl.Serials;

/**
 * Conjunctive filter over ledger entries, plus paging. Unset filters match
 * everything. Immutable; create instances with {@linkplain #builder()}.
 */
public class LedgerQuery {

  /** Default page size. */
  public final static int DEF_PAGE_SIZE = 100;
  /** Maximum page size. */
  public final static int MAX_PAGE_SIZE = 1000;


  public static Builder builder() {
    return new Builder();
  }


  /**
   * {@linkplain LedgerQuery} builder.
   */
  public static class Builder {

    private String category;
    private String phase;
    private String recordType;
    private EnumSet<Criticality> criticalities;
    private Criticality minCriticality;
    private Long fromTime;
    private Long toTime;
    private int pageSize = DEF_PAGE_SIZE;
    private PageToken token;

    private Builder() {  }

    public Builder category(String category) {
      this.category = category;
      return this;
    }

    public Builder phase(String phase) {
      this.phase = phase;
      return this;
    }

    public Builder recordType(String recordType) {
      this.recordType = recordType;
      return this;
    }

    /** Matches any of the given criticalities. */
    public Builder criticality(Criticality first, Criticality... more) {
      this.criticalities = EnumSet.of(first, more);
      return this;
    }

    /** Matches any of the given criticalities. */
    public Builder criticalities(Collection<Criticality> set) {
      if (set == null)
        this.criticalities = null;
      else {
        this.criticalities = EnumSet.noneOf(Criticality.class);
        this.criticalities.addAll(set);
      }
      return this;
    }

    /** Matches this criticality and above. */
    public Builder minCriticality(Criticality min) {
      this.minCriticality = min;
      return this;
    }

    /**
     * Inclusive UTC millis range. Either end may be {@code null} (open).
     */
    public Builder timeRange(Long from, Long to) {
      this.fromTime = from;
      this.toTime = to;
      return this;
    }

    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    public Builder token(PageToken token) {
      this.token = token;
      return this;
    }

    /**
     * @throws InvalidQueryException if the page size is out of range, the time
     *         range is inverted, or the criticality set is empty
     */
    public LedgerQuery build() throws InvalidQueryException {
      return new LedgerQuery(this);
    }
  }



  private final String category;
  private final String phase;
  private final String recordType;
  private final Set<Criticality> criticalities;
  private final Criticality minCriticality;
  private final Long fromTime;
  private final Long toTime;
  private final int pageSize;
  private final PageToken token;


  private LedgerQuery(Builder b) throws InvalidQueryException {
    if (b.pageSize < 1 || b.pageSize > MAX_PAGE_SIZE)
      throw new InvalidQueryException(
          "page size " + b.pageSize + " not in [1, " + MAX_PAGE_SIZE + "]");
    if (b.fromTime != null && b.toTime != null && b.fromTime > b.toTime)
      throw new InvalidQueryException(
          "inverted time range [" + b.fromTime + ", " + b.toTime + "]");
    if (b.criticalities != null && b.criticalities.isEmpty())
      throw new InvalidQueryException("empty criticality set");
    this.category = b.category;
    this.phase = b.phase;
    this.recordType = b.recordType;
    this.criticalities =
        b.criticalities == null ? null : Collections.unmodifiableSet(EnumSet.copyOf(b.criticalities));
    this.minCriticality = b.minCriticality;
    this.fromTime = b.fromTime;
    this.toTime = b.toTime;
    this.pageSize = b.pageSize;
    this.token = b.token;
  }


  private LedgerQuery(LedgerQuery copy, PageToken token) {
    this.category = copy.category;
    this.phase = copy.phase;
    this.recordType = copy.recordType;
    this.criticalities = copy.criticalities;
    this.minCriticality = copy.minCriticality;
    this.fromTime = copy.fromTime;
    this.toTime = copy.toTime;
    this.pageSize = copy.pageSize;
    this.token = token;
  }


  /**
   * Returns a copy of this query with the given page token.
   */
  public LedgerQuery withToken(PageToken token) {
    return new LedgerQuery(this, Objects.requireNonNull(token, "null token"));
  }


  public Optional<String> category() {
    return Optional.ofNullable(category);
  }

  public Optional<String> phase() {
    return Optional.ofNullable(phase);
  }

  public Optional<String> recordType() {
    return Optional.ofNullable(recordType);
  }

  public Optional<Set<Criticality>> criticalities() {
    return Optional.ofNullable(criticalities);
  }

  public Optional<Criticality> minCriticality() {
    return Optional.ofNullable(minCriticality);
  }

  public Optional<Long> fromTime() {
    return Optional.ofNullable(fromTime);
  }

  public Optional<Long> toTime() {
    return Optional.ofNullable(toTime);
  }

  public int pageSize() {
    return pageSize;
  }

  public Optional<PageToken> token() {
    return Optional.ofNullable(token);
  }


  /**
   * Tests whether the given record passes every filter.
   */
  public boolean matches(GovernanceTuple tuple) {
    return
        (category == null || category.equals(tuple.category())) &&
        (phase == null || phase.equals(tuple.lifecyclePhase())) &&
        (recordType == null || recordType.equals(tuple.recordType())) &&
        (criticalities == null || criticalities.contains(tuple.criticality())) &&
        (minCriticality == null || tuple.criticality().atLeast(minCriticality)) &&
        (fromTime == null || tuple.timestamp() >= fromTime) &&
        (toTime == null || tuple.timestamp() <= toTime);
  }


  /**
   * Returns a fingerprint of the filters and page size (not the token). Page
   * tokens carry it, so a token is only good for the query that issued it.
   */
  public long fingerprint() {
    StringBuilder s = new StringBuilder();
    s.append(category).append('|').append(phase).append('|').append(recordType).append('|');
    s.append(criticalities).append('|').append(minCriticality).append('|');
    s.append(fromTime).append('|').append(toTime).append('|').append(pageSize);
    return ByteBuffer.wrap(Hashing.hash(Serials.utf8(s.toString()))).getLong();
  }


  @Override
  public String toString() {
    StringBuilder s = new StringBuilder("LedgerQuery[");
    category().ifPresent(c -> s.append("category=").append(c).append(", "));
    phase().ifPresent(p -> s.append("phase=").append(p).append(", "));
    recordType().ifPresent(r -> s.append("recordType=").append(r).append(", "));
    criticalities().ifPresent(c -> s.append("criticality=").append(c).append(", "));
    minCriticality().ifPresent(c -> s.append("minCriticality=").append(c).append(", "));
    fromTime().ifPresent(t -> s.append("from=").append(t).append(", "));
    toTime().ifPresent(t -> s.append("to=").append(t).append(", "));
    return s.append("pageSize=").append(pageSize).append(']').toString();
  }

}
