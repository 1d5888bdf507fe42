package com.ryuqq.delegation.core.registry;

import com.ryuqq.delegation.core.composite.Composite;

import java.util.List;

/**
 * Extension operation callback registered under an eligible {@link com.ryuqq.delegation.core.model.OperationName}.
 *
 * <p>Callbacks run only when explicitly invoked through
 * {@link Composite#invokeOperation(com.ryuqq.delegation.core.model.OperationName, Object...)};
 * they never participate in the five mandatory resolution operations.</p>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OperationCallback {

    /**
     * Runs the operation.
     *
     * @param target the composite the operation was invoked on
     * @param arguments caller-supplied arguments (never null, may be empty)
     * @return operation result (may be null)
     */
    Object invoke(Composite target, List<Object> arguments);
}
