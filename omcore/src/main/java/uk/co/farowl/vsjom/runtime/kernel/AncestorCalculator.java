// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime.kernel;

import java.util.List;

import uk.co.farowl.vsjom.runtime.ModelClass;

/**
 * Calculation of the ancestor sequence of a class: the class itself,
 * followed by the ancestor sequence of its base. With single
 * inheritance there is nothing to merge, so the result is the chain of
 * bases, ending at the universal base class.
 */
public final class AncestorCalculator {

    private AncestorCalculator() {} // no instances

    /**
     * Calculate the ancestor sequence of a class under construction,
     * whose base (if any) is complete.
     *
     * @param cls under construction
     * @param base of {@code cls} or {@code null} for the root
     * @return the ancestors as an array, starting with {@code cls}
     */
    public static ModelClass[] getAncestors(ModelClass cls,
            ModelClass base) {
        if (base == null) {
            // cls is the universal base class
            return new ModelClass[] {cls};
        }
        List<ModelClass> baseAncestors = base.getAncestors();
        int n = baseAncestors.size();
        ModelClass[] mro = new ModelClass[1 + n];
        mro[0] = cls;
        for (int i = 0; i < n; i++) { mro[i + 1] = baseAncestors.get(i); }
        return mro;
    }
}
