/**
 * HTTP service around the detection core: environment configuration, the
 * SQLite usage store, Micrometer metrics and the JSON API.
 *
 * @since 1.0.0
 */
package com.usagesentinel.service;
