/**
 * Service provider interfaces for plugging the store into its environment.
 *
 * <ul>
 *   <li>{@link io.scilit.spi.ConnectionFactory}: opens physical connections for the pool</li>
 *   <li>{@link io.scilit.spi.MetricsExporter}: exports query, pool and transaction metrics</li>
 * </ul>
 */
package io.scilit.spi;
