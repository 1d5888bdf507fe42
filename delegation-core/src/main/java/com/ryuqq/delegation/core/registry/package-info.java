/**
 * Extension operation registry package.
 *
 * <p>Each Composite owns one {@link com.ryuqq.delegation.core.registry.OperationRegistry}
 * holding {@link com.ryuqq.delegation.core.registry.OperationCallback}s keyed by the closed
 * {@link com.ryuqq.delegation.core.model.OperationName} enum. Registration is validated
 * against the fixed ELIGIBLE and PROTECTED sets.</p>
 *
 * <h2>Relation to the mandatory operations</h2>
 * <p>has, get, set, keys and delete are always implemented by the Composite itself. Installing
 * a callback never changes how those five behave; extension callbacks run only through
 * {@code Composite.invokeOperation}.</p>
 *
 * @since 1.0.0
 * @author Delegation Team
 */
package com.ryuqq.delegation.core.registry;
