/**
 * Access to stored usage series.
 *
 * @since 1.0.0
 */
package com.usagesentinel.core.loader;
