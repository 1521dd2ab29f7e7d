/**
 * Data objects shared between the analytics engine and the alert engine.
 *
 * <ul>
 * <li>{@link com.dnssentinel.core.model.QueryRecord} - one DNS query as
 * collected</li>
 * <li>{@link com.dnssentinel.core.model.MetricsSnapshot} - aggregate activity
 * handed to rule evaluation</li>
 * <li>{@link com.dnssentinel.core.model.Anomaly} - deviation reported by a
 * detector</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.dnssentinel.core.model;
