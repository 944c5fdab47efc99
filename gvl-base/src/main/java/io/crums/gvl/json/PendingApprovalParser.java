/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.json;


import static io.crums.gvl.json.JsonUtils.*;

import org.json.simple.JSONObject;

import io.crums.gvl.gate.PendingApproval;

/**
 * {@linkplain PendingApproval} JSON parser.
 */
public class PendingApprovalParser implements JsonEntityParser<PendingApproval> {

  public final static String TICKET = "ticket";
  public final static String PARTITION = "partition";
  public final static String RECORD = "record";
  public final static String REQUESTED_AT = "requestedAt";
  public final static String WAITED = "waitedMillis";

  public final static PendingApprovalParser INSTANCE = new PendingApprovalParser();


  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(PendingApproval pending, JSONObject jObj) {
    jObj.put(TICKET, pending.ticketId());
    jObj.put(PARTITION, pending.partition());
    jObj.put(RECORD, TupleParser.INSTANCE.toJsonObject(pending.tuple()));
    jObj.put(REQUESTED_AT, pending.requestedAt());
    jObj.put(WAITED, pending.waitedMillis());
    return jObj;
  }


  @Override
  public PendingApproval toEntity(JSONObject jObj) throws JsonParsingException {
    var tuple = TupleParser.INSTANCE.toEntity(getJsonObject(jObj, RECORD, true));
    try {
      return new PendingApproval(
          getString(jObj, TICKET, true),
          getString(jObj, PARTITION, true),
          tuple,
          getLong(jObj, REQUESTED_AT),
          getLong(jObj, WAITED));
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException(iax.getMessage(), iax);
    }
  }

}
