/**
 * Composite resolution engine package.
 *
 * <p>This package implements the delegation unit and everything that operates on
 * its internal state.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.delegation.core.composite.Composite} - Own storage + ordered sources + policy flags + operation registry;
 *       implements the five mandatory operations and is itself a {@link com.ryuqq.delegation.core.spi.Source}</li>
 *   <li>{@code SourceList} - Identity-unique ordered source list (package-private)</li>
 *   <li>{@link com.ryuqq.delegation.core.composite.HierarchyInspector} - Occurrence counts, duplicate and unique names</li>
 * </ul>
 *
 * <h2>Resolution Order</h2>
 * <pre>
 * 1. own storage            (always wins when the key is present)
 * 2. sources, left → right  (get: last match wins; has: first match ends the scan)
 * 3. policy flags           (decide failure when nothing or too much was found)
 * </pre>
 *
 * <h2>Known Hazards</h2>
 * <ul>
 *   <li><strong>Cycles:</strong> a source graph that loops back to an ancestor composite recurses
 *       until {@link java.lang.StackOverflowError}; there is no cycle detection</li>
 *   <li><strong>Aliasing:</strong> a source shared by several composites can be mutated through any
 *       of them without locking</li>
 *   <li><strong>Live list:</strong> {@code Composite.sources()} returns the backing list; mutating it
 *       directly bypasses the identity-uniqueness guarantee</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Delegation Team
 */
package com.ryuqq.delegation.core.composite;
