/**
 * Engine configuration: YAML-bound POJOs and the loader that resolves,
 * parses and validates them.
 *
 * @since 1.0.0
 */
package com.premiumlens.core.config;
