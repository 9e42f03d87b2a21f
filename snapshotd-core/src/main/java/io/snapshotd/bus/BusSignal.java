package io.snapshotd.bus;

import java.util.List;
import java.util.Objects;

/**
 * Fire-and-forget notifications emitted by the daemon.
 *
 * <p>Every signal references a transaction (or snapshot) id as its first argument, which
 * is what the legacy broadcast-driven unlock keys on.
 */
public sealed interface BusSignal
        permits BusSignal.TransactionOpened, BusSignal.CommandExecuted, BusSignal.ExecutionError {

    /**
     * Returns the signal's member name on the bus.
     *
     * @return the member name, e.g. {@code "CommandExecuted"}
     */
    String member();

    /**
     * Returns the transaction or snapshot id the signal refers to.
     *
     * @return the referenced id
     */
    String transactionId();

    /**
     * Returns the signal arguments in wire order.
     *
     * @return immutable argument list
     */
    List<Object> arguments();

    /** A new transaction was opened from a base snapshot. Signature {@code s}. */
    record TransactionOpened(String snapshot) implements BusSignal {
        public TransactionOpened {
            Objects.requireNonNull(snapshot, "snapshot");
        }

        @Override
        public String member() {
            return "TransactionOpened";
        }

        @Override
        public String transactionId() {
            return snapshot;
        }

        @Override
        public List<Object> arguments() {
            return List.of(snapshot);
        }
    }

    /** A Call/CallExt command ran to completion. Signature {@code sis}. */
    record CommandExecuted(String snapshot, int returnCode, String output) implements BusSignal {
        public CommandExecuted {
            Objects.requireNonNull(snapshot, "snapshot");
            output = output == null ? "" : output;
        }

        @Override
        public String member() {
            return "CommandExecuted";
        }

        @Override
        public String transactionId() {
            return snapshot;
        }

        @Override
        public List<Object> arguments() {
            return List.of(snapshot, returnCode, output);
        }
    }

    /** An asynchronous operation failed after its method call was answered. Signature {@code ssi}. */
    record ExecutionError(String transaction, String message, int code) implements BusSignal {
        public ExecutionError {
            Objects.requireNonNull(transaction, "transaction");
            message = message == null ? "" : message;
        }

        @Override
        public String member() {
            return "Error";
        }

        @Override
        public String transactionId() {
            return transaction;
        }

        @Override
        public List<Object> arguments() {
            return List.of(transaction, message, code);
        }
    }
}
