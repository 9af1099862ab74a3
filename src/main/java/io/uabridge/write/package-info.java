/**
 * Typed writes: literal parsing into exact wire types and the type-mismatch fallback ladder.
 */
package io.uabridge.write;
