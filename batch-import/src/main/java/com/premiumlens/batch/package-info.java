/**
 * Command-line batch import runner: resolves its configuration from the
 * environment, imports CSV files through the core engine, records Micrometer
 * metrics and writes a JSON report.
 */
package com.premiumlens.batch;
