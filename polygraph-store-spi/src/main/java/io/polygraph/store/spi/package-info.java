/**
 * Storage contracts: the ordered key-value substrate, replicated logs, graph stores and the
 * codec SPI that turns entities into bytes.
 */
package io.polygraph.store.spi;
