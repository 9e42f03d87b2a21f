package io.snapshotd.dispatch;

import io.snapshotd.PrimitiveException;
import io.snapshotd.spi.ExecutionResult;
import io.snapshotd.spi.SnapshotTransaction;

import java.util.List;

/**
 * How a Call/CallExt command is run against its transaction.
 */
public enum ExecutionMode {
    /** {@code Call}: root changed into the snapshot. */
    CHROOTED {
        @Override
        ExecutionResult run(SnapshotTransaction transaction, List<String> argv) throws PrimitiveException {
            return transaction.execute(argv);
        }
    },
    /** {@code CallExt}: caller's root, transaction as context. */
    EXTERNAL {
        @Override
        ExecutionResult run(SnapshotTransaction transaction, List<String> argv) throws PrimitiveException {
            return transaction.callExternal(argv);
        }
    };

    abstract ExecutionResult run(SnapshotTransaction transaction, List<String> argv) throws PrimitiveException;
}
