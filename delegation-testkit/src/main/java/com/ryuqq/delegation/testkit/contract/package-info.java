/**
 * Contract test kit for Source implementations.
 *
 * <p>This package ships reusable JUnit 5 infrastructure so that every Source
 * implementation, including Composite itself, is verified against the same contract.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.delegation.testkit.contract.AbstractSourceContractTest} - Source SPI contract</li>
 *   <li>{@link com.ryuqq.delegation.testkit.contract.RecordingSource} - Source that records every call</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Delegation Team
 */
package com.ryuqq.delegation.testkit.contract;
