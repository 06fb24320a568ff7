/**
 * Graph store over an ordered key-value substrate, plus the stores, logs and evaluators it is
 * assembled from.
 *
 * <p>Start from {@link io.polygraph.store.core.GraphStores}.
 */
package io.polygraph.store.core;
