/**
 * Configuration loading and validation for the condition-hint catalog.
 *
 * <p>
 * Hints are defined in YAML and loaded by
 * {@link com.usagesentinel.core.config.ConditionHintLoader} into a
 * {@link com.usagesentinel.core.config.ConditionHintCatalog}. Validation runs
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.usagesentinel.core.config;
