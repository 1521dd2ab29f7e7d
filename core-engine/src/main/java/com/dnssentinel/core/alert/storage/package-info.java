/**
 * Alert history backends: bounded in-memory and JSON file.
 */
package com.dnssentinel.core.alert.storage;
