/**
 * Metrics registry holder.
 *
 * <p>Embedding applications register their Micrometer registry with
 * {@link com.mimecast.catcher.metrics.MetricsRegistry#register}.
 */
package com.mimecast.catcher.metrics;
