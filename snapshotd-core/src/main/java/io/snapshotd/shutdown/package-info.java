/**
 * Graceful termination that waits for locked transactions to drain.
 */
package io.snapshotd.shutdown;
