/**
 * Contracts between the session façade and the storage backends.
 *
 * <p>{@link io.sessionstore.server.spi.SessionStore} is the capability every backend provides.
 * {@link io.sessionstore.server.spi.LayeredHotStore} and {@link io.sessionstore.server.spi.LayeredColdStore}
 * are the extra capabilities a backend needs to sit on either side of a layered store.
 */
package io.sessionstore.server.spi;
