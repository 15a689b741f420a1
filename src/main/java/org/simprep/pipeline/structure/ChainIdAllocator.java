package org.simprep.pipeline.structure;

import org.simprep.pipeline.StateInconsistencyException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Hands out chain identifiers not yet used in a structure.
 * <p>
 * An allocator belongs to one task run: it is seeded with the identifiers present in the
 * task's input and passed to every step of that task that creates chains.
 */
public class ChainIdAllocator {

    private static final String CANDIDATES = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final Set<String> used = new LinkedHashSet<>();

    public ChainIdAllocator(Collection<String> inUse) {
        used.addAll(inUse);
    }

    /**
     * @return the first candidate identifier not in use, now marked as used
     * @throws StateInconsistencyException if every single-character identifier is taken
     */
    public String next() {
        for (int i = 0; i < CANDIDATES.length(); i++) {
            String candidate = String.valueOf(CANDIDATES.charAt(i));
            if (used.add(candidate)) {
                return candidate;
            }
        }
        throw new StateInconsistencyException("No unused chain identifier left (" + used.size() + " in use)");
    }

    public void reserve(String chainId) {
        used.add(chainId);
    }

    public boolean isUsed(String chainId) {
        return used.contains(chainId);
    }
}
