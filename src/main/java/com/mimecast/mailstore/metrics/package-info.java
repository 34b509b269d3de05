/**
 * Micrometer registry holder.
 *
 * <p>The embedding application registers a Prometheus registry here; update pipe counters bind to it lazily.
 */
package com.mimecast.mailstore.metrics;
