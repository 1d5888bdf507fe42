/**
 * Composite construction package.
 *
 * <p>Entry point for callers: builds Composite handles from optional sources and
 * optional policy flags, applying factory-wide defaults and preset extension operations.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.delegation.application.factory.CompositeFactory} - Construction contract</li>
 *   <li>{@link com.ryuqq.delegation.application.factory.DefaultCompositeFactory} - Defaults + presets implementation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Delegation Team
 */
package com.ryuqq.delegation.application.factory;
