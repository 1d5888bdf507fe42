/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the contract a backing object must satisfy to take part in
 * a Composite hierarchy.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.delegation.core.spi.Source} - existence check, read, own-key enumeration, deletion</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., delegation-adapter-inmemory) provide concrete implementations.
 * {@link com.ryuqq.delegation.core.composite.Composite} also implements this SPI, which is what
 * makes recursive composition possible.</p>
 *
 * <h2>Verification</h2>
 * <p>Implementations should extend {@code AbstractSourceContractTest} from delegation-testkit.</p>
 *
 * @since 1.0.0
 * @author Delegation Team
 */
package com.ryuqq.delegation.core.spi;
