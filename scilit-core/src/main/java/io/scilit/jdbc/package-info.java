/**
 * JDBC helpers for SQLite: connection factory, statement binding, rows and script splitting.
 */
package io.scilit.jdbc;
