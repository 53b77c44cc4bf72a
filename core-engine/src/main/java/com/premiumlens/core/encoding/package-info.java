/**
 * Charset detection for CSV extracts of unknown encoding.
 *
 * @since 1.0.0
 */
package com.premiumlens.core.encoding;
