/**
 * YAML configuration for the analytics engine and the alert manager.
 *
 * <p>
 * {@link com.dnssentinel.core.config.SentinelConfigLoader} parses
 * {@code sentinel.yml} into JavaBean sections and validates them.
 * </p>
 */
package com.dnssentinel.core.config;
