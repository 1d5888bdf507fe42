/**
 * Delegation error taxonomy package.
 *
 * <p>All errors are unchecked, raised synchronously at the point of violation and
 * surfaced to the immediate caller. None are retried or suppressed internally; the
 * only conversion to a boolean result happens through the documented {@code silent}
 * parameters.</p>
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.delegation.core.exception.DelegationException} - Base type carrying an error code</li>
 *   <li>{@link com.ryuqq.delegation.core.exception.DuplicatePropertyException} - Read matched 2+ sources while duplication is disallowed</li>
 *   <li>{@link com.ryuqq.delegation.core.exception.MissingPropertyException} - Read/write found nothing while errorIfMissing is enabled</li>
 *   <li>{@link com.ryuqq.delegation.core.exception.OverrideDisallowedException} - New own key while allowOverride is false</li>
 *   <li>{@link com.ryuqq.delegation.core.exception.DeletionDisallowedException} - Source-side delete while allowDeletion is false</li>
 *   <li>{@link com.ryuqq.delegation.core.exception.UnknownSourceException} - Non-silent removal of an absent source</li>
 *   <li>{@link com.ryuqq.delegation.core.exception.UnknownOwnPropertyException} - Non-silent removal of an absent own key</li>
 *   <li>{@link com.ryuqq.delegation.core.exception.OperationNotAllowedException} - Registration outside the eligible set</li>
 *   <li>{@link com.ryuqq.delegation.core.exception.ProtectedOperationException} - Removal of a protected operation</li>
 * </ul>
 *
 * <p>Argument validation failures (null keys, null sources, null callbacks) throw
 * {@link java.lang.IllegalArgumentException} instead.</p>
 *
 * @since 1.0.0
 * @author Delegation Team
 */
package com.ryuqq.delegation.core.exception;
