/**
 * Session runtime.
 *
 * <p>{@link io.uabridge.runtime.SessionController} owns the connection lifecycle and the
 * state scoped to one session: the address-space cache, the watch map and the broadcast
 * channel the live-data hub reads from.
 */
package io.uabridge.runtime;
