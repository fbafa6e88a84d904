/**
 * Query timing and plan inspection.
 *
 * <p>{@link io.scilit.monitor.QueryPerformanceMonitor} groups executions by
 * {@linkplain io.scilit.monitor.QueryFingerprint fingerprint} and keeps
 * statistics in memory only; they are lost on restart.
 */
package io.scilit.monitor;
