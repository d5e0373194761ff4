/**
 * Trailing-window performance monitoring and threshold alerts.
 *
 * @since 1.0.0
 */
package com.hydrosentinel.core.monitor;
