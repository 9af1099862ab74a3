/**
 * Live-data broadcast hub: per-client filtered fan-out of watch updates over bounded queues.
 */
package io.uabridge.hub;
