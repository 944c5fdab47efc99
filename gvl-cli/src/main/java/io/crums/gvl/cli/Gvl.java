/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.cli;


import java.io.Closeable;
import java.io.File;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.gvl.ByteFormatException;
import io.crums.gvl.Criticality;
import io.crums.gvl.Hashing;
import io.crums.gvl.IntegrityException;
import io.crums.gvl.LedgerEntry;
import io.crums.gvl.NotFoundException;
import io.crums.gvl.config.LedgerConfig;
import io.crums.gvl.json.EntryParser;
import io.crums.gvl.json.JsonParsingException;
import io.crums.gvl.json.RejectionParser;
import io.crums.gvl.query.LedgerQuery;
import io.crums.gvl.query.PageToken;
import io.crums.gvl.query.ProvenEntry;
import io.crums.gvl.query.QueryEngine;
import io.crums.gvl.query.QueryException;
import io.crums.gvl.sig.TupleVerifier;
import io.crums.gvl.store.LedgerStore;
import io.crums.gvl.store.MerkleProof;
import io.crums.gvl.verify.ChainAnchor;
import io.crums.gvl.verify.IntegrityVerifier;
import io.crums.gvl.verify.VerificationReport;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Offline inspection and verification of a governance ledger. Opens the
 * ledger read-only.
 */
@Command(
    name = "gvl",
    mixinStandardHelpOptions = true,
    version = "gvl 0.1",
    synopsisHeading = "",
    customSynopsis = {
        "",
        "Governance evidence ledger inspection and verification tool.",
        "",
        "Usage: @|bold gvl|@ @|fg(yellow) FILE|@ COMMAND",
        "       @|bold gvl help|@ COMMAND",
        "       @|bold gvl|@ [@|fg(yellow) -hV|@]",
        "",
    },
    subcommands = {
        HelpCommand.class,
        Info.class,
        Verify.class,
        ListCmd.class,
        EntryCmd.class,
        Rejections.class,
    })
public class Gvl implements Closeable {


  public static void main(String[] args) {
    int exitCode;
    try (var gvl = new Gvl()) {
      exitCode = newCommandLine(gvl).execute(args);
    }
    System.exit(exitCode);
  }


  /**
   * Returns a command line for the given instance, with exceptions mapped to
   * exit codes.
   */
  public static CommandLine newCommandLine(Gvl gvl) {
    var cl = new CommandLine(gvl);
    cl.setExecutionExceptionHandler((x, cmd, parseResult) -> {
      int code = exitCode(x);
      cmd.getErr().println(cmd.getColorScheme().errorText("error: " + x.getMessage()));
      if (code == ERR_SOFT)
        x.printStackTrace(cmd.getErr());
      return code;
    });
    return cl;
  }


  private static int exitCode(Exception x) {
    if (x instanceof UncheckedIOException)
      return ERR_IO;
    if (x instanceof NotFoundException ||
        x instanceof QueryException ||
        x instanceof IllegalArgumentException)
      return ERR_USER;
    if (x instanceof IntegrityException ||
        x instanceof ByteFormatException ||
        x instanceof JsonParsingException)
      return ERR_INTEGRITY;
    return ERR_SOFT;
  }


  final static int ERR_SOFT = 1;
  final static int ERR_USER = 2;
  final static int ERR_IO = 4;
  /** Ledger failed verification. */
  final static int ERR_INTEGRITY = 6;



  @Spec
  private CommandSpec spec;


  private File configFile;

  @Parameters(
      arity = "0..1",
      paramLabel = "FILE",
      description = {
          "Ledger configuration file (properties)",
          "@|bold Required|@ with any command except @|bold help|@"
      })
  public void setConfig(File configFile) {
    this.configFile = configFile;
    if (!configFile.isFile())
      throw new ParameterException(spec.commandLine(), "not a file: " + configFile);
    else if (!configFile.canRead())
      throw new ParameterException(spec.commandLine(), "need read permission: " + configFile);
  }


  private LedgerConfig config;

  public LedgerConfig getConfig() {
    if (config == null) {
      if (configFile == null)
        throw new ParameterException(spec.commandLine(), "missing configuration FILE");
      config = new LedgerConfig(configFile);
    }
    return config;
  }


  private LedgerStore store;

  /**
   * Returns the ledger store, opened read-only.
   */
  public LedgerStore getStore() {
    if (store == null) {
      var cfg = getConfig();
      store = new LedgerStore(
          cfg.getPartition(), cfg.openLog(true), cfg.getBatchSize(), cfg.getRetryPolicy());
    }
    return store;
  }


  PrintWriter out() {
    return spec.commandLine().getOut();
  }


  @Override
  public void close() {
    if (store != null) {
      store.close();
      store = null;
    }
    config = null;
  }


  static String utc(long millis) {
    return Instant.ofEpochMilli(millis).toString();
  }

}


@Command(
    name = Info.NAME,
    description = "Display ledger size, sealed batches and head anchor")
class Info implements Callable<Integer> {

  final static String NAME = "info";

  @ParentCommand
  private Gvl gvl;

  @Override
  public Integer call() {
    var out = gvl.out();
    var cfg = gvl.getConfig();
    var store = gvl.getStore();
    long size = store.size();
    out.printf("%npartition:       %s%n", store.partition());
    out.printf("ledger dir:      %s%n", cfg.getLedgerDir());
    out.printf("entries:         %d%n", size);
    out.printf("batch size:      %d%n", store.batchSize());
    out.printf("sealed batches:  %d%n", store.sealedBatchCount());
    out.printf("retention:       %d years%n", cfg.getRetentionYears());
    if (size > 0) {
      var last = store.read(size - 1);
      out.printf("last entry:      [%d] %s%n", last.seqNo(), Gvl.utc(last.tuple().timestamp()));
    }
    out.printf("%nhead anchor:%n%s%n", ChainAnchor.of(store));
    out.flush();
    return 0;
  }
}


@Command(
    name = Verify.NAME,
    description = {
        "Recompute the hash chain and sealed batch roots",
        "Reports; never corrects. Exits with " + Gvl.ERR_INTEGRITY + " if issues are found."
    })
class Verify implements Callable<Integer> {

  final static String NAME = "verify";

  @ParentCommand
  private Gvl gvl;

  @Option(
      names = "--sigs",
      description = "Also verify record signatures against the configured key ring")
  private boolean signatures;

  @Option(
      names = "--anchor",
      paramLabel = "SIZE:HASH",
      description = "Trusted head anchor (as printed by @|bold info|@)")
  private String anchor;


  @Override
  public Integer call() {
    var cfg = gvl.getConfig();
    var out = gvl.out();

    VerificationReport report;
    try (var log = cfg.openLog(true)) {
      var verifier = new IntegrityVerifier(log, cfg.getBatchSize());
      if (signatures)
        verifier = verifier.withSignatures(new TupleVerifier(cfg.loadKeyRing()));
      if (anchor != null)
        verifier = verifier.withAnchor(ChainAnchor.parse(anchor));
      report = verifier.verify();
    }

    out.printf("%n%d entries, %d sealed batches checked%n",
        report.entriesChecked(), report.batchesChecked());
    if (report.isValid()) {
      out.printf("OK%n");
      out.flush();
      return 0;
    }
    for (var issue : report.issues())
      out.printf("  %-20s [%d] %s%n", issue.kind(), issue.index(), issue.message());
    report.firstChainMismatch().ifPresent(
        index -> out.printf("%nfirst chain mismatch at [%d]; entries past it are unverified%n", index));
    out.flush();
    return Gvl.ERR_INTEGRITY;
  }
}


@Command(
    name = ListCmd.NAME,
    description = {
        "List entries matching filters, in ascending sequence order",
        "Every entry listed is checked against its proof."
    })
class ListCmd implements Callable<Integer> {

  final static String NAME = "list";

  @ParentCommand
  private Gvl gvl;

  @Spec
  private CommandSpec spec;

  @Option(names = "--category", paramLabel = "CAT")
  private String category;

  @Option(names = "--phase", paramLabel = "PHASE")
  private String phase;

  @Option(names = "--type", paramLabel = "TYPE", description = "Record type")
  private String recordType;

  @Option(
      names = "--criticality", paramLabel = "C", split = ",",
      description = "Comma-separated criticalities (names or levels)")
  private List<String> criticalities;

  @Option(
      names = "--min-criticality", paramLabel = "C",
      description = "Minimum criticality (inclusive)")
  private String minCriticality;

  @Option(names = "--from", paramLabel = "TIME", description = "ISO-8601 instant (inclusive)")
  private String from;

  @Option(names = "--to", paramLabel = "TIME", description = "ISO-8601 instant (inclusive)")
  private String to;

  @Option(
      names = "--page-size", paramLabel = "N",
      description = "1 to " + LedgerQuery.MAX_PAGE_SIZE + ". Default: " + LedgerQuery.DEF_PAGE_SIZE)
  private int pageSize = LedgerQuery.DEF_PAGE_SIZE;

  @Option(names = "--token", paramLabel = "TOKEN", description = "Page token from a previous listing")
  private String token;

  @Option(names = "--json", description = "Print entries as JSON")
  private boolean json;


  @Override
  public Integer call() {
    var builder = LedgerQuery.builder()
        .category(category)
        .phase(phase)
        .recordType(recordType)
        .timeRange(instant(from, "--from"), instant(to, "--to"))
        .pageSize(pageSize);
    if (criticalities != null)
      builder.criticalities(criticalities.stream().map(Criticality::parse).toList());
    if (minCriticality != null)
      builder.minCriticality(Criticality.parse(minCriticality));
    if (token != null)
      builder.token(PageToken.decode(token));

    var page = new QueryEngine(gvl.getStore()).query(builder.build());
    var out = gvl.out();

    if (json) {
      printJson(out, page.entries(), page.next());
      return 0;
    }

    for (var proven : page.entries())
      printRow(out, proven);
    out.printf("%n%d entr%s listed (snapshot size %d)%n",
        page.entries().size(), page.entries().size() == 1 ? "y" : "ies", page.snapshotSize());
    page.next().ifPresent(t -> out.printf("next page: --token %s%n", t.encode()));
    out.flush();
    return 0;
  }


  private Long instant(String time, String option) {
    if (time == null)
      return null;
    try {
      return Instant.parse(time).toEpochMilli();
    } catch (DateTimeParseException dtpx) {
      throw new ParameterException(spec.commandLine(), "illegal " + option + ": " + time);
    }
  }


  static void printRow(PrintWriter out, ProvenEntry proven) {
    LedgerEntry entry = proven.entry();
    var tuple = entry.tuple();
    out.printf("[%d] %s %-12s %-10s %-14s %s%s%n",
        entry.seqNo(),
        Gvl.utc(tuple.timestamp()),
        tuple.lifecyclePhase(),
        tuple.category(),
        tuple.criticality(),
        proven.proof() instanceof MerkleProof ? "merkle" : "chain",
        proven.verify() ? "" : "  PROOF FAILED");
  }


  @SuppressWarnings("unchecked")
  static void printJson(PrintWriter out, List<ProvenEntry> entries, Optional<PageToken> next) {
    var jArray = new JSONArray();
    for (var proven : entries) {
      var jObj = EntryParser.INSTANCE.toJsonObject(proven.entry());
      jObj.put("proofType", proven.proof() instanceof MerkleProof ? "merkle" : "chain");
      jObj.put("proofVerified", proven.verify());
      jArray.add(jObj);
    }
    var page = new JSONObject();
    page.put("entries", jArray);
    next.ifPresent(t -> page.put("next", t.encode()));
    out.println(page.toJSONString());
    out.flush();
  }
}


@Command(
    name = EntryCmd.NAME,
    description = "Display an entry (by sequence index or record ID) with its proof")
class EntryCmd implements Callable<Integer> {

  final static String NAME = "entry";

  @ParentCommand
  private Gvl gvl;

  @Parameters(
      arity = "1",
      paramLabel = "SEQ_NO|ID",
      description = "Sequence index, or record ID (UUID)")
  private String key;

  @Option(names = "--json", description = "Print as JSON")
  private boolean json;


  @Override
  public Integer call() {
    var engine = new QueryEngine(gvl.getStore());
    ProvenEntry proven;
    if (key.chars().allMatch(Character::isDigit))
      proven = engine.entry(Long.parseLong(key));
    else
      proven = engine.findById(key);

    var out = gvl.out();
    if (json) {
      ListCmd.printJson(out, List.of(proven), Optional.empty());
      return 0;
    }
    var entry = proven.entry();
    var tuple = entry.tuple();
    out.printf("%nseq no:       %d%n", entry.seqNo());
    out.printf("record ID:    %s%n", tuple.id());
    out.printf("time:         %s%n", Gvl.utc(tuple.timestamp()));
    out.printf("solver:       %s%n", tuple.solverIdentity());
    out.printf("phase:        %s%n", tuple.lifecyclePhase());
    out.printf("criticality:  %s%n", tuple.criticality());
    out.printf("category:     %s%n", tuple.category());
    out.printf("record type:  %s%n", tuple.recordType());
    out.printf("upstream:     %s%n", tuple.upstreamRef());
    out.printf("signer:       %s%n", tuple.signerId());
    out.printf("seed:         %d%n", tuple.seed());
    out.printf("input hash:   %s%n", Hashing.toHex(tuple.inputHash()));
    out.printf("result hash:  %s%n", Hashing.toHex(tuple.resultHash()));
    out.printf("results:      %s%n", tuple.rankedResults());
    entry.decision().ifPresent(d ->
        out.printf("approved by:  %s (ticket %s, %s)%n", d.approver(), d.ticketId(), Gvl.utc(d.decidedAt())));
    out.printf("chain hash:   %s%n", Hashing.toHex(entry.chainHash()));
    out.printf("proof:        %s, %s%n",
        proven.proof() instanceof MerkleProof ? "merkle" : "chain segment",
        proven.verify() ? "verified" : "FAILED");
    out.flush();
    return proven.verify() ? 0 : Gvl.ERR_INTEGRITY;
  }
}


@Command(
    name = Rejections.NAME,
    description = "List the rejection log (rejected admissions never enter the ledger)")
class Rejections implements Callable<Integer> {

  final static String NAME = "rejections";

  @ParentCommand
  private Gvl gvl;

  @Option(names = "--json", description = "Print as JSON lines")
  private boolean json;


  @Override
  public Integer call() {
    var rejections = gvl.getConfig().rejectionLog().list();
    var out = gvl.out();
    for (var r : rejections) {
      if (json)
        out.println(RejectionParser.INSTANCE.toJsonObject(r).toJSONString());
      else
        out.printf("%s  %s  %-18s at %-18s %s%n",
            Gvl.utc(r.rejectedAt()), r.recordId(), r.reason(), r.stoppedAt(), r.detail());
    }
    if (!json)
      out.printf("%n%d rejection%s%n", rejections.size(), rejections.size() == 1 ? "" : "s");
    out.flush();
    return 0;
  }
}
