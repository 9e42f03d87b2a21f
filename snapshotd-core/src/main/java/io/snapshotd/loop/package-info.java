/**
 * The single owner thread that serializes request handling and registry changes.
 */
package io.snapshotd.loop;
