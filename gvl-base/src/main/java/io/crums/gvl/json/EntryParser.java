/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.json;


import static io.crums.gvl.json.JsonUtils.*;

import java.nio.ByteBuffer;
import java.util.Optional;

import org.json.simple.JSONObject;

import io.crums.gvl.ApprovalDecision;
import io.crums.gvl.Hashing;
import io.crums.gvl.LedgerEntry;

/**
 * {@linkplain LedgerEntry} JSON parser.
 */
public class EntryParser implements JsonEntityParser<LedgerEntry> {

  public final static String SEQ_NO = "seqNo";
  public final static String RECORD = "record";
  public final static String APPROVAL = "approval";
  public final static String CHAIN_HASH = "chainHash";

  public final static EntryParser INSTANCE = new EntryParser();


  private final TupleParser tupleParser = TupleParser.INSTANCE;
  private final ApprovalDecisionParser decisionParser = ApprovalDecisionParser.INSTANCE;


  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(LedgerEntry entry, JSONObject jObj) {
    jObj.put(SEQ_NO, entry.seqNo());
    jObj.put(RECORD, tupleParser.toJsonObject(entry.tuple()));
    entry.decision().ifPresent(d -> jObj.put(APPROVAL, decisionParser.toJsonObject(d)));
    jObj.put(CHAIN_HASH, Hashing.toHex(entry.chainHash()));
    return jObj;
  }


  @Override
  public LedgerEntry toEntity(JSONObject jObj) throws JsonParsingException {
    long seqNo = getLong(jObj, SEQ_NO);
    var tuple = tupleParser.toEntity(getJsonObject(jObj, RECORD, true));
    var jDecision = getJsonObject(jObj, APPROVAL, false);
    Optional<ApprovalDecision> decision =
        jDecision == null ? Optional.empty() : Optional.of(decisionParser.toEntity(jDecision));
    var chainHash = ByteBuffer.wrap(getHex(jObj, CHAIN_HASH, true));
    try {
      return new LedgerEntry(seqNo, tuple, decision, chainHash);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException(iax.getMessage(), iax);
    }
  }

}
