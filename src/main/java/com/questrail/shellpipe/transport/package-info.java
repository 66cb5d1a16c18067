/**
 * Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, a test double) and
 * the session relay.
 *
 * <h2>Why these ports exist</h2>
 * Production uses Netty for its channel lifecycle handling <strong>without</strong>
 * allowing Netty types to leak into the relay or the supervisor. Everything
 * above the adapter sees only:
 * <ul>
 *   <li>blocking {@code InputStream}/{@code OutputStream} pairs</li>
 *   <li>a sampled {@code isConnected()} flag</li>
 *   <li>{@code close()}</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no sealing, no framing)</li>
 *   <li>Preserve byte order within each direction</li>
 *   <li>Unblock pending reads with end-of-stream when the channel closes</li>
 * </ul>
 */
package com.questrail.shellpipe.transport;
