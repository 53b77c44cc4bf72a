/**
 * Record filtering by a {@link com.premiumlens.core.model.FilterState} and the
 * cascading option lists derived from it.
 *
 * @since 1.0.0
 */
package com.premiumlens.core.filter;
