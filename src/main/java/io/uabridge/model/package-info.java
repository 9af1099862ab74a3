/**
 * Immutable records shared between the runtime, the hub and the HTTP surface.
 * JSON field names follow the snake_case wire format.
 */
package io.uabridge.model;
