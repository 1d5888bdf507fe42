/**
 * In-memory Source adapter implementation package.
 *
 * <p>This package provides the reference implementation of the
 * {@link com.ryuqq.delegation.core.spi.Source} SPI for tests and simple
 * property bags.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.delegation.adapter.inmemory.source.MapSource}:
 *       insertion-ordered map-backed source</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Not thread-safe</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @see com.ryuqq.delegation.core.spi.Source
 * @author Delegation Team
 * @since 1.0.0
 */
package com.ryuqq.delegation.adapter.inmemory.source;
