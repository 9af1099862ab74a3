/**
 * UaBridge: an OPC UA client runtime with a cached address space, shared value watches, a live
 * update hub and a type-reconciling write path. {@link io.uabridge.Main} is the CLI entry point.
 */
package io.uabridge;
