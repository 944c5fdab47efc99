/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.gvl.store;


/**
 * Notified when a Merkle batch is sealed. This is how the archival
 * collaborator learns of new batches; it is never invoked with the
 * writer lock held, and its failures do not affect the write path.
 */
@FunctionalInterface
public interface BatchSealedListener {
  
  void batchSealed(MerkleBatch batch);

}
