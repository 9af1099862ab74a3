/**
 * Secure-channel provisioning: security policy and mode resolution, client key material
 * loading, and local certificate issuance.
 */
package io.uabridge.security;
