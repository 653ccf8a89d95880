/**
 * Redis backend built on Lettuce's asynchronous API.
 */
package io.sessionstore.redis;
