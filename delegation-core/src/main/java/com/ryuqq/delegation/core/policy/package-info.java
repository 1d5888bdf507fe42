/**
 * Policy flag package.
 *
 * <p>Four independent booleans govern how a Composite resolves conflicts and
 * mutations. {@link com.ryuqq.delegation.core.policy.CompositeConfig} carries the
 * construction-time values; {@link com.ryuqq.delegation.core.policy.PolicyFlags}
 * holds the live, mutable values of one Composite.</p>
 *
 * <h2>Flags and Defaults</h2>
 * <pre>
 * duplicationAllowed = true   get() tolerates a key found in 2+ sources (last match wins)
 * errorIfMissing     = false  get()/set() fail when the key is nowhere in the hierarchy
 * allowOverride      = true   set()/addOwnProperty() may create a new own key
 * allowDeletion      = false  delete() may remove keys from sources (all of them)
 * </pre>
 *
 * @since 1.0.0
 * @author Delegation Team
 */
package com.ryuqq.delegation.core.policy;
