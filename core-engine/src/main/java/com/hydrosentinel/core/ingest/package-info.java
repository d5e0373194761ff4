/**
 * Transport-facing entry point: turns payload bytes into raw readings.
 *
 * @since 1.0.0
 */
package com.hydrosentinel.core.ingest;
