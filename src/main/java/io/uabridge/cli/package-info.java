/**
 * picocli command tree. Results go to stdout as JSON; logs go to stderr.
 */
package io.uabridge.cli;
