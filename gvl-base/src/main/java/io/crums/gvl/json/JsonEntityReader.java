/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.json;


import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JSON read-interface for an entity.
 *
 * @param <T> the entity type
 */
public interface JsonEntityReader<T> {


  /**
   * Returns the given JSON as the typed instance.
   *
   * @throws JsonParsingException if the given object is malformed, or breaks the entity's grammar
   */
  T toEntity(JSONObject jObj) throws JsonParsingException;


  /**
   * Returns the given JSON input as a typed entity.
   *
   * @throws JsonParsingException if the given object is malformed, or if the given
   * JSON is not a single object
   */
  default T toEntity(String json) throws JsonParsingException {
    try {
      return toEntity((JSONObject) new JSONParser().parse(json));
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + json, px);
    } catch (ClassCastException ccx) {
      throw new JsonParsingException(
          "not a JSON object: " + json.substring(0, Math.min(20, json.length())) + "...", ccx);
    }
  }


  /**
   * Returns the given JSON input as a typed entity.
   *
   * @throws UncheckedIOException {@code IOException}s are unchecked
   */
  default T toEntity(Reader reader) throws JsonParsingException, UncheckedIOException {
    try {
      return toEntity((JSONObject) new JSONParser().parse(reader));
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json", px);
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("not a JSON object", ccx);
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
  }


  default T toEntity(File file) throws JsonParsingException, UncheckedIOException {
    try (var reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return toEntity(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException("on toEntity(file=" + file + "): " + iox , iox);
    }
  }


  /**
   * Returns the given JSON array as a typed list.
   *
   * @param jArray null counts as empty
   *
   * @return read-only, possibly empty list
   */
  default List<T> toEntityList(JSONArray jArray) throws JsonParsingException {
    int size = jArray == null ? 0 : jArray.size();
    if (size == 0)
      return Collections.emptyList();

    ArrayList<T> list = new ArrayList<>(size);
    for (int index = 0; index < size; ++index) {
      Object element = jArray.get(index);
      if (!(element instanceof JSONObject))
        throw new JsonParsingException("element [" + index + "] is not an object: " + element);
      list.add( toEntity((JSONObject) element) );
    }
    return Collections.unmodifiableList(list);
  }

}
