/**
 * Spring Boot auto-configuration for the scientific literature store.
 *
 * <p>{@link io.scilit.spring.boot.ScilitAutoConfiguration} wires an initialized
 * {@link io.scilit.DatabaseManager} from {@code scilit.database.*} application
 * properties, together with a schema validator and a query performance monitor.
 *
 * @see io.scilit.spring.boot.ScilitAutoConfiguration
 * @see io.scilit.spring.boot.ScilitMicrometerAutoConfiguration
 * @see io.scilit.spring.boot.ScilitProperties
 */
package io.scilit.spring.boot;
