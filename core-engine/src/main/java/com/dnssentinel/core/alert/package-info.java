/**
 * Rule-based and anomaly-driven alerting.
 *
 * <p>
 * {@link com.dnssentinel.core.alert.AlertManager} is the entry point. Rule
 * conditions carry typed {@link com.dnssentinel.core.alert.ConditionValue}s
 * and are evaluated by {@link com.dnssentinel.core.alert.ConditionEvaluator}
 * against a flattened metrics snapshot.
 * </p>
 */
package com.dnssentinel.core.alert;
