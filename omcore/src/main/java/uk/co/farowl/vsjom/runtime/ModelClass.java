// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import uk.co.farowl.vsjom.runtime.kernel.AncestorCalculator;
import uk.co.farowl.vsjom.support.InterpreterError;

/**
 * A class of the modelled language. A class has a name, at most one
 * base (only the universal base class has none), a table of the
 * attributes and methods it defines directly, and a metaclass, which is
 * the class of which this class is an instance.
 * <p>
 * Unlike a {@link ModelInstance}, a class keeps its attributes in a
 * table rather than in storage described by a shared
 * {@link uk.co.farowl.vsjom.runtime.kernel.Layout Layout}. Classes are
 * few, and are mutated less uniformly than instances.
 * <p>
 * Classes are created only by a {@link ClassSystem}.
 */
public final class ModelClass extends ModelObject {

    /** The class system that created this class. */
    final ClassSystem system;

    /** Name of the class. */
    private final String name;

    /** The base of this class or {@code null} in the root. */
    private final ModelClass base;

    /**
     * The class of which this class is an instance. This is fixed at
     * construction, except that the two root classes are patched once
     * during bootstrap of their class system.
     */
    private ModelClass metaclass;

    /**
     * Attributes defined directly on the class. Values may be
     * {@code null}, which is distinct from absence.
     */
    private final Map<String, Object> fields;

    /** Read-only view of {@link #fields}. */
    private final Map<String, Object> dict;

    /**
     * This class, then the ancestors of its base. Since the base never
     * changes, we compute this once.
     */
    private final ModelClass[] ancestors;

    /**
     * Construct a class. The caller has validated the arguments.
     *
     * @param system creating this class
     * @param name of the class
     * @param base of the class ({@code null} only for the root)
     * @param fields initial attributes defined on the class
     * @param metaclass of the class (or {@code null} during bootstrap)
     */
    ModelClass(ClassSystem system, String name, ModelClass base,
            Map<String, ?> fields, ModelClass metaclass) {
        this.system = system;
        this.name = name;
        this.base = base;
        this.metaclass = metaclass;
        this.fields = new HashMap<>(fields);
        this.dict = Collections.unmodifiableMap(this.fields);
        this.ancestors = AncestorCalculator.getAncestors(this, base);
    }

    /**
     * Complete the bootstrap of a root class by giving it a metaclass.
     * This may only happen once, to a class constructed without one.
     *
     * @param metaclass to give the class
     * @throws InterpreterError if the class already has a metaclass
     */
    void patchType(ModelClass metaclass) throws InterpreterError {
        if (this.metaclass != null) {
            throw new InterpreterError("metaclass of '%s' already set",
                    name);
        }
        this.metaclass = metaclass;
    }

    @Override
    public ModelClass getType() { return metaclass; }

    /** @return the name of this class */
    public String getName() { return name; }

    /** @return the base of this class or {@code null} in the root */
    public ModelClass getBase() { return base; }

    /**
     * Return the ancestor sequence of this class: this class, then its
     * base, and so on to the universal base class.
     *
     * @return the ancestors, starting with this class
     */
    public List<ModelClass> getAncestors() { return List.of(ancestors); }

    /**
     * Test whether this class is {@code b} or has {@code b} among its
     * ancestors.
     *
     * @param b the putative ancestor
     * @return whether {@code b} is an ancestor
     */
    public boolean isSubclassOf(ModelClass b) {
        for (ModelClass c : ancestors) {
            if (c == b) { return true; }
        }
        return false;
    }

    /**
     * Look for the definition of {@code name} along the ancestors of
     * this class. The first class that defines it directly provides the
     * result, so that a definition in a subclass hides one in its base.
     *
     * @param name to look up
     * @return the definition or {@link ModelObject#ABSENT}
     */
    public Object lookup(String name) {
        for (ModelClass c : ancestors) {
            Map<String, Object> f = c.fields;
            Object v = f.get(name);
            if (v != null || f.containsKey(name)) { return v; }
        }
        return ABSENT;
    }

    /**
     * Test whether this class or an ancestor defines the given special
     * method.
     *
     * @param sm special method sought
     * @return whether lookup would find a definition
     */
    boolean defines(SpecialMethod sm) {
        return lookup(sm.methodName) != ABSENT;
    }

    /**
     * The attributes defined directly on this class in a read-only
     * view.
     *
     * @return the attributes of the class
     */
    public Map<String, Object> getDict() { return dict; }

    @Override
    public Object rawRead(String name) {
        Object v = fields.get(name);
        if (v == null && !fields.containsKey(name)) { return ABSENT; }
        return v;
    }

    @Override
    public void rawWrite(String name, Object value) {
        if (value == ABSENT) {
            throw new InterpreterError(ABSENT_VALUE, name, this.name);
        }
        fields.put(name, value);
    }

    static final String ABSENT_VALUE =
            "cannot store the absent marker as '%s' in '%s'";

    @Override
    public String toString() { return "<class '" + name + "'>"; }
}
