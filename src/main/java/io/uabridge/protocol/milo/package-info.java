/**
 * Eclipse Milo binding of the protocol seam.
 */
package io.uabridge.protocol.milo;
