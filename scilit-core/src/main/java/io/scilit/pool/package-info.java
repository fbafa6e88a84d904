/**
 * Fixed-size connection pooling.
 *
 * @see io.scilit.pool.ConnectionPool
 */
package io.scilit.pool;
