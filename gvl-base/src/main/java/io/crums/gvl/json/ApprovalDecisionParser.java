/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.json;


import static io.crums.gvl.json.JsonUtils.*;

import org.json.simple.JSONObject;

import io.crums.gvl.ApprovalDecision;

/**
 * {@linkplain ApprovalDecision} JSON parser.
 */
public class ApprovalDecisionParser implements JsonEntityParser<ApprovalDecision> {

  public final static String TICKET = "ticket";
  public final static String APPROVER = "approver";
  public final static String DECIDED_AT = "decidedAt";
  public final static String NOTE = "note";

  public final static ApprovalDecisionParser INSTANCE = new ApprovalDecisionParser();


  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(ApprovalDecision decision, JSONObject jObj) {
    jObj.put(TICKET, decision.ticketId());
    jObj.put(APPROVER, decision.approver());
    jObj.put(DECIDED_AT, decision.decidedAt());
    if (!decision.note().isEmpty())
      jObj.put(NOTE, decision.note());
    return jObj;
  }


  @Override
  public ApprovalDecision toEntity(JSONObject jObj) throws JsonParsingException {
    try {
      return new ApprovalDecision(
          getString(jObj, TICKET, true),
          getString(jObj, APPROVER, true),
          getLong(jObj, DECIDED_AT),
          getString(jObj, NOTE, false));
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException(iax.getMessage(), iax);
    }
  }

}
