/**
 * Bounded intake queue between the transport and the pipeline workers.
 *
 * @since 1.0.0
 */
package com.hydrosentinel.core.buffer;
