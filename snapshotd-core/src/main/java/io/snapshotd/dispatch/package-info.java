/**
 * Asynchronous command execution for {@code Call} and {@code CallExt}.
 *
 * <p>{@link io.snapshotd.dispatch.ExecutionDispatcher} starts one worker per request. Workers
 * expand the command with {@link io.snapshotd.dispatch.CommandLine}, run it, and report through
 * {@link io.snapshotd.dispatch.CompletionNotifier}, which routes registry changes back to the
 * owner loop.
 *
 * @see io.snapshotd.dispatch.ExecutionDispatcher
 * @see io.snapshotd.dispatch.CompletionNotifier
 */
package io.snapshotd.dispatch;
