/**
 * Runnable DNS Sentinel process: reads query logs, runs analytics on a
 * schedule, drives the alert manager and serves health endpoints.
 */
package com.dnssentinel.service;
