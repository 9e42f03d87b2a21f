/**
 * Per-transaction locking.
 *
 * @see io.snapshotd.registry.TransactionRegistry
 */
package io.snapshotd.registry;
