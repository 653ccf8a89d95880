/**
 * Session façade and the backends that need no external service.
 *
 * <p>Contents:
 * <ul>
 *   <li>{@link io.sessionstore.server.core.Session} and {@link io.sessionstore.server.core.SessionFactory}</li>
 *   <li>{@link io.sessionstore.server.core.MemorySessionStore}, usable on its own or as a hot layer</li>
 *   <li>{@link io.sessionstore.server.core.LayeredSessionStore}, composing any hot and cold store</li>
 *   <li>{@link io.sessionstore.server.core.ServiceLoaderCodecRegistry} for codec discovery</li>
 * </ul>
 */
package io.sessionstore.server.core;
