/**
 * Operation naming model package.
 *
 * <p>This package defines the closed vocabulary of extension operation names
 * accepted by the Composite operation registry.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.delegation.core.model.OperationName} - Closed set of thirteen operation names (enum)</li>
 *   <li>{@link com.ryuqq.delegation.core.model.OperationCategory} - ELIGIBLE / PROTECTED classification</li>
 * </ul>
 *
 * <h2>Name Sets</h2>
 * <pre>
 * ELIGIBLE  (add / remove / override): apply, construct, defineProperty, deleteProperty,
 *                                     getOwnPropertyDescriptor, getPrototypeOf, isExtensible,
 *                                     preventExtensions, setPrototypeOf
 * PROTECTED (never touched):          get, set, has, ownKeys
 * </pre>
 *
 * @since 1.0.0
 * @author Delegation Team
 */
package com.ryuqq.delegation.core.model;
