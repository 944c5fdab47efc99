/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.json;


import static io.crums.gvl.json.JsonUtils.*;

import org.json.simple.JSONObject;

import io.crums.gvl.Criticality;
import io.crums.gvl.gate.AdmissionState;
import io.crums.gvl.gate.Rejection;
import io.crums.gvl.gate.RejectionReason;

/**
 * {@linkplain Rejection} JSON parser. One object per line in the rejection
 * log file.
 */
public class RejectionParser implements JsonEntityParser<Rejection> {

  public final static String RECORD_ID = "recordId";
  public final static String PARTITION = "partition";
  public final static String STOPPED_AT = "stoppedAt";
  public final static String REASON = "reason";
  public final static String DETAIL = "detail";
  public final static String REJECTED_AT = "rejectedAt";
  public final static String SIGNER = "signer";
  public final static String PHASE = "phase";
  public final static String CRITICALITY = "criticality";

  public final static RejectionParser INSTANCE = new RejectionParser();


  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(Rejection rejection, JSONObject jObj) {
    jObj.put(RECORD_ID, rejection.recordId());
    jObj.put(PARTITION, rejection.partition());
    jObj.put(STOPPED_AT, rejection.stoppedAt().name());
    jObj.put(REASON, rejection.reason().name());
    jObj.put(DETAIL, rejection.detail());
    jObj.put(REJECTED_AT, rejection.rejectedAt());
    addIfPresent(jObj, SIGNER, rejection.signerId());
    addIfPresent(jObj, PHASE, rejection.lifecyclePhase());
    jObj.put(CRITICALITY, rejection.criticality().name());
    return jObj;
  }


  @Override
  public Rejection toEntity(JSONObject jObj) throws JsonParsingException {
    try {
      return new Rejection(
          getString(jObj, RECORD_ID, true),
          getString(jObj, PARTITION, true),
          AdmissionState.valueOf(getString(jObj, STOPPED_AT, true)),
          RejectionReason.valueOf(getString(jObj, REASON, true)),
          getString(jObj, DETAIL, false),
          getLong(jObj, REJECTED_AT),
          getString(jObj, SIGNER, false),
          getString(jObj, PHASE, false),
          Criticality.parse(getString(jObj, CRITICALITY, true)));
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException(iax.getMessage(), iax);
    }
  }

}
