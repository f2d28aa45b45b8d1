/**
 * Exception hierarchy for the usage spike detection engine.
 *
 * <p>
 * All exceptions extend
 * {@link com.usagesentinel.core.exception.SentinelException} and carry an
 * {@link com.usagesentinel.core.exception.ErrorCode} plus a retryable flag so
 * that transport layers can map them to status codes without inspecting
 * messages.
 * </p>
 *
 * @since 1.0.0
 */
package com.usagesentinel.core.exception;
