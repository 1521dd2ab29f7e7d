/**
 * Notification channels for fired alerts: the log, a Slack-compatible
 * webhook and SMTP email.
 */
package com.dnssentinel.core.alert.notify;
