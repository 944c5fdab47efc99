/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.json;


/**
 * Emergent pattern for implementing parsing and generating JSON,
 * abstracted into an interface.
 *
 * @param <T> the entity type
 */
public interface JsonEntityParser<T> extends JsonEntityWriter<T>, JsonEntityReader<T> {


}
