/**
 * PostgreSQL backend over plain JDBC.
 *
 * <p>Each store operation is one SQL statement; multi-step operations such as rename-and-write are chains of
 * data-modifying common table expressions.
 */
package io.sessionstore.postgres;
