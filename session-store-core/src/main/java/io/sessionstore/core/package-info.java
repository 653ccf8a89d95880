/**
 * Storage-neutral building blocks for sessions.
 *
 * <p>This module carries no backend code. It contains only:
 * <ul>
 *   <li>The session identifier and its generator</li>
 *   <li>The value codec contract and its ServiceLoader provider hook</li>
 *   <li>The exception hierarchy shared by every store</li>
 * </ul>
 *
 * <p>Store contracts live in {@code session-store-server-spi}; backends in their own modules.
 */
package io.sessionstore.core;
