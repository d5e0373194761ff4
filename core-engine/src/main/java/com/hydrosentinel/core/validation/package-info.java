/**
 * Structural and semantic validation of raw readings, including
 * interpolation of missing values.
 *
 * @since 1.0.0
 */
package com.hydrosentinel.core.validation;
