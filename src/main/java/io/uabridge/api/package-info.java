/**
 * Network surfaces over the session runtime: the REST API on the JDK HTTP server and the hub's
 * WebSocket endpoint on Netty. {@link io.uabridge.api.ApiHost} starts and stops both together.
 */
package io.uabridge.api;
