package com.ryuqq.delegation.core.registry;

import com.ryuqq.delegation.core.exception.OperationNotAllowedException;
import com.ryuqq.delegation.core.exception.ProtectedOperationException;
import com.ryuqq.delegation.core.model.OperationCategory;
import com.ryuqq.delegation.core.model.OperationName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extension operation registry of one Composite.
 *
 * <p>The registry only ever holds names from the ELIGIBLE set. The five mandatory
 * operations are implemented by the Composite directly and never appear here.</p>
 *
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li>add: eligible names only; anything else returns false (silent) or throws
 *       {@link OperationNotAllowedException}</li>
 *   <li>remove: protected names return false (silent) or throw
 *       {@link ProtectedOperationException}; eligible names are removed and return true
 *       whether or not they were installed; unknown names return false</li>
 *   <li>add on an installed name overwrites its callback</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * OperationRegistry registry = new OperationRegistry();
 * registry.add(OperationName.APPLY, (target, args) -&gt; target.get("fn"), false);
 * registry.add("get", callback, true);       // false: protected name
 * registry.remove(OperationName.HAS, false); // throws ProtectedOperationException
 * </pre>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public final class OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private static final Set<OperationName> ELIGIBLE =
        Collections.unmodifiableSet(OperationName.of(OperationCategory.ELIGIBLE));
    private static final Set<OperationName> PROTECTED =
        Collections.unmodifiableSet(OperationName.of(OperationCategory.PROTECTED));

    private final Map<OperationName, OperationCallback> operations = new EnumMap<>(OperationName.class);

    /**
     * Installs or overwrites an extension operation.
     *
     * @param name operation name
     * @param callback operation callback
     * @param silent when true, a non-eligible name yields false instead of an exception
     * @return true if installed, false if the name is not eligible (silent mode)
     * @throws IllegalArgumentException if name or callback is null
     * @throws OperationNotAllowedException if the name is not eligible and silent is false
     */
    public boolean add(OperationName name, OperationCallback callback, boolean silent) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (!ELIGIBLE.contains(name)) {
            return rejectAdd(name.getValue(), silent);
        }
        OperationCallback previous = operations.put(name, callback);
        log.debug("Operation '{}' {}", name, previous == null ? "installed" : "overwritten");
        return true;
    }

    /**
     * Installs or overwrites an extension operation by its string name.
     *
     * <p>A string outside the closed {@link OperationName} set is treated as not eligible.</p>
     *
     * @param name operation name (e.g. "defineProperty")
     * @param callback operation callback
     * @param silent when true, a non-eligible name yields false instead of an exception
     * @return true if installed, false if the name is not eligible (silent mode)
     * @throws IllegalArgumentException if name or callback is null
     * @throws OperationNotAllowedException if the name is not eligible and silent is false
     */
    public boolean add(String name, OperationCallback callback, boolean silent) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        Optional<OperationName> resolved = OperationName.fromValue(name);
        if (resolved.isEmpty()) {
            if (callback == null) {
                throw new IllegalArgumentException("callback cannot be null");
            }
            return rejectAdd(name, silent);
        }
        return add(resolved.get(), callback, silent);
    }

    /**
     * Removes an extension operation.
     *
     * @param name operation name
     * @param silent when true, a protected name yields false instead of an exception
     * @return true if the name is eligible (and is now absent), false otherwise
     * @throws IllegalArgumentException if name is null
     * @throws ProtectedOperationException if the name is protected and silent is false
     */
    public boolean remove(OperationName name, boolean silent) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (PROTECTED.contains(name)) {
            if (!silent) {
                throw new ProtectedOperationException(name.getValue());
            }
            return false;
        }
        if (ELIGIBLE.contains(name)) {
            if (operations.remove(name) != null) {
                log.debug("Operation '{}' removed", name);
            }
            return true;
        }
        return false;
    }

    /**
     * Removes an extension operation by its string name.
     *
     * @param name operation name (e.g. "apply")
     * @param silent when true, a protected name yields false instead of an exception
     * @return true if the name is eligible (and is now absent), false otherwise
     * @throws IllegalArgumentException if name is null
     * @throws ProtectedOperationException if the name is protected and silent is false
     */
    public boolean remove(String name, boolean silent) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return OperationName.fromValue(name)
            .map(resolved -> remove(resolved, silent))
            .orElse(false);
    }

    /**
     * Looks up an installed callback.
     *
     * @param name operation name
     * @return the callback, or empty if not installed
     */
    public Optional<OperationCallback> find(OperationName name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(operations.get(name));
    }

    /**
     * Names currently installed, in declaration order of {@link OperationName}.
     *
     * @return new set (safe to modify)
     */
    public Set<OperationName> installed() {
        return operations.isEmpty()
            ? EnumSet.noneOf(OperationName.class)
            : EnumSet.copyOf(operations.keySet());
    }

    /**
     * The nine names that may be added, removed or overridden.
     *
     * @return new set (safe to modify)
     */
    public static Set<OperationName> eligibleOperationNames() {
        return EnumSet.copyOf(ELIGIBLE);
    }

    /**
     * The four names that can never be added, removed or overridden.
     *
     * @return new set (safe to modify)
     */
    public static Set<OperationName> protectedOperationNames() {
        return EnumSet.copyOf(PROTECTED);
    }

    private static boolean rejectAdd(String name, boolean silent) {
        if (!silent) {
            throw new OperationNotAllowedException(name);
        }
        return false;
    }
}
