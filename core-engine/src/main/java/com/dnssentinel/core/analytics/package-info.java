/**
 * Statistical analytics over DNS query batches.
 *
 * <p>
 * {@link com.dnssentinel.core.analytics.AnalyticsEngine} combines a baseline
 * {@link com.dnssentinel.core.analytics.AnomalyDetector} with a stateless
 * {@link com.dnssentinel.core.analytics.TrendAnalyzer}; its
 * {@link com.dnssentinel.core.analytics.AnalyticsResult} feeds the alert
 * engine.
 * </p>
 *
 * @since 1.0.0
 */
package com.dnssentinel.core.analytics;
