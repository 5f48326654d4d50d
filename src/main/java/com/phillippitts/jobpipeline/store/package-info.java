/**
 * Coordination store abstraction and its Redis implementation.
 *
 * <p>{@link com.phillippitts.jobpipeline.store.CoordinationStore} offers the few primitives the
 * pipeline needs (hashes with compare-and-set, sets, a scheduled queue and counters).
 * {@link com.phillippitts.jobpipeline.store.StoreKeys} owns the key layout.
 *
 * @since 1.0
 */
package com.phillippitts.jobpipeline.store;
