/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.json;


import static io.crums.gvl.json.JsonUtils.*;

import java.nio.ByteBuffer;

import org.json.simple.JSONObject;

import io.crums.gvl.Criticality;
import io.crums.gvl.GovernanceTuple;
import io.crums.gvl.Hashing;

/**
 * {@linkplain GovernanceTuple} JSON parser. Hashes and the signature are
 * hex-encoded; the ranked results are kept as their canonical JSON string, so
 * the result hash still checks after a round trip.
 */
public class TupleParser implements JsonEntityParser<GovernanceTuple> {

  public final static String ID = "id";
  public final static String SEED = "seed";
  public final static String INPUT_HASH = "inputHash";
  public final static String SOLVER = "solver";
  public final static String RESULTS = "rankedResults";
  public final static String RESULT_HASH = "resultHash";
  public final static String PHASE = "phase";
  public final static String CRITICALITY = "criticality";
  public final static String TIMESTAMP = "timestamp";
  public final static String SIGNER = "signer";
  public final static String CATEGORY = "category";
  public final static String RECORD_TYPE = "recordType";
  public final static String UPSTREAM = "upstreamRef";
  public final static String SIGNATURE = "signature";


  /**
   * Stateless instance.
   */
  public final static TupleParser INSTANCE = new TupleParser();


  protected TupleParser() {  }


  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(GovernanceTuple tuple, JSONObject jObj) {
    jObj.put(ID, tuple.id());
    jObj.put(SEED, tuple.seed());
    jObj.put(INPUT_HASH, Hashing.toHex(tuple.inputHash()));
    jObj.put(SOLVER, tuple.solverIdentity());
    jObj.put(RESULTS, tuple.rankedResults());
    jObj.put(RESULT_HASH, Hashing.toHex(tuple.resultHash()));
    jObj.put(PHASE, tuple.lifecyclePhase());
    jObj.put(CRITICALITY, tuple.criticality().name());
    jObj.put(TIMESTAMP, tuple.timestamp());
    jObj.put(SIGNER, tuple.signerId());
    jObj.put(CATEGORY, tuple.category());
    jObj.put(RECORD_TYPE, tuple.recordType());
    jObj.put(UPSTREAM, tuple.upstreamRef());
    jObj.put(SIGNATURE, Hashing.toHex(tuple.signature()));
    return jObj;
  }


  @Override
  public GovernanceTuple toEntity(JSONObject jObj) throws JsonParsingException {
    try {
      return new GovernanceTuple(
          getString(jObj, ID, true),
          getLong(jObj, SEED),
          ByteBuffer.wrap(getHex(jObj, INPUT_HASH, true)),
          getString(jObj, SOLVER, true),
          getString(jObj, RESULTS, true),
          ByteBuffer.wrap(getHex(jObj, RESULT_HASH, true)),
          getString(jObj, PHASE, true),
          Criticality.parse(getString(jObj, CRITICALITY, true)),
          getLong(jObj, TIMESTAMP),
          getString(jObj, SIGNER, true),
          getString(jObj, CATEGORY, true),
          getString(jObj, RECORD_TYPE, true),
          getString(jObj, UPSTREAM, true),
          ByteBuffer.wrap(getHex(jObj, SIGNATURE, true)));
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("illegal record: " + iax.getMessage(), iax);
    }
  }

}
