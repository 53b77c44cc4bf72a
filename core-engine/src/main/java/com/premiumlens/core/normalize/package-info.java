/**
 * Text canonicalization for free-text record dimensions.
 */
package com.premiumlens.core.normalize;
