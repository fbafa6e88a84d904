/**
 * Storage access layer for the scientific literature database.
 *
 * <p>{@link io.scilit.DatabaseManager} is the single entry point: it owns the
 * connection pool, bootstraps the schema and exposes scoped connections and
 * transactions. Configuration is an immutable {@link io.scilit.DatabaseConfig}.
 * All failures surface as subclasses of {@link io.scilit.StoreException}.
 */
package io.scilit;
