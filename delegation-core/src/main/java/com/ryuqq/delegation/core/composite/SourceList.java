package com.ryuqq.delegation.core.composite;

import com.ryuqq.delegation.core.exception.UnknownSourceException;
import com.ryuqq.delegation.core.spi.Source;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, identity-unique list of the sources behind one Composite.
 *
 * <p>Order is the only precedence signal used by resolution: later entries win
 * during a left-to-right scan. Membership is decided by reference identity, never
 * by {@code equals}.</p>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
final class SourceList {

    private final List<Source> sources = new ArrayList<>();

    /**
     * Creates a list from initial sources, dropping repeated references.
     *
     * @param initial initial sources in order (null means empty)
     * @throws IllegalArgumentException if any element is null
     */
    SourceList(List<? extends Source> initial) {
        if (initial == null) {
            return;
        }
        for (Source source : initial) {
            if (source == null) {
                throw new IllegalArgumentException("source cannot be null");
            }
            add(source, false);
        }
    }

    boolean add(Source source, boolean putUpfront) {
        if (indexOf(source) >= 0) {
            return false;
        }
        if (putUpfront) {
            sources.add(0, source);
        } else {
            sources.add(source);
        }
        return true;
    }

    boolean remove(Source source, boolean silent) {
        int index = indexOf(source);
        if (index < 0) {
            if (!silent) {
                throw new UnknownSourceException(source);
            }
            return false;
        }
        sources.remove(index);
        return true;
    }

    boolean contains(Source source) {
        return indexOf(source) >= 0;
    }

    int size() {
        return sources.size();
    }

    /**
     * The backing list itself, not a copy.
     */
    List<Source> live() {
        return sources;
    }

    private int indexOf(Source source) {
        for (int i = 0; i < sources.size(); i++) {
            if (sources.get(i) == source) {
                return i;
            }
        }
        return -1;
    }
}
