/**
 * Request handlers for {@code Open}, {@code Call}, {@code CallExt}, {@code Close} and {@code Abort}.
 */
package io.snapshotd.service;
