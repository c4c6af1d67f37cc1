// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsjom.runtime.kernel.Layout;
import uk.co.farowl.vsjom.runtime.kernel.LayoutCache;
import uk.co.farowl.vsjom.support.InterpreterError;

/**
 * {@code ClassSystem} is the nexus of class and instance creation in the
 * object model. It owns the two root classes, the universal base class
 * {@code object} and the default metaclass {@code type}, and the cache
 * of instance {@link Layout}s. Every operation of the object model
 * takes place within some class system.
 * <p>
 * There is no global class system. Each one is independent of every
 * other: classes, instances and layouts made by one are never seen by
 * another. A front end will usually create one, and a test may create
 * one per test.
 * <p>
 * A class system is not thread safe. A host that uses one from several
 * threads must serialise the creation of classes, writes to new
 * attribute names of instances and redefinition of class attributes.
 */
public class ClassSystem {

    /** Logger for (the public face of) the class system. */
    static final Logger logger = LoggerFactory.getLogger(ClassSystem.class);

    /** Name of the system property that enables layout tracing. */
    public static final String TRACE_LAYOUTS_PROPERTY =
            "uk.co.farowl.vsjom.traceLayouts";

    /**
     * Options affecting the behaviour of a class system.
     *
     * @param traceLayouts if {@code true}, log each new layout at debug
     *     level
     */
    public static record Options(boolean traceLayouts) {

        /** Options with every feature at its default. */
        public static final Options DEFAULT = new Options(false);

        /**
         * Options taken from the system properties, where defined, and
         * otherwise defaulted.
         *
         * @return options from the system properties
         */
        public static Options fromSystemProperties() {
            String trace = System.getProperty(TRACE_LAYOUTS_PROPERTY,
                    "false");
            return new Options(Boolean.parseBoolean(trace.trim()));
        }
    }

    /** Options in force. */
    private final Options options;

    /** Layouts of instances created by this class system. */
    private final LayoutCache layouts;

    /** The universal base class {@code object}. */
    private final ModelClass objectClass;

    /** The default metaclass {@code type}. */
    private final ModelClass typeClass;

    /**
     * Create a class system with options from the system properties.
     */
    public ClassSystem() { this(Options.fromSystemProperties()); }

    /**
     * Create a class system with the given options. This makes the root
     * classes {@code object} and {@code type}.
     *
     * @param options in force
     */
    public ClassSystem(Options options) {
        logger.info("Class system is waking up.");
        long start = System.nanoTime();

        this.options = options;
        this.layouts = new LayoutCache(options.traceLayouts());

        /*
         * object and type define each other: type is an instance of
         * itself, and object is an instance of type, while type is a
         * subclass of object. Make both with no metaclass, then patch
         * in the metaclass once type exists.
         */
        ModelClass object =
                new ModelClass(this, "object", null, Map.of(), null);
        ModelClass type =
                new ModelClass(this, "type", object, Map.of(), null);
        object.patchType(type);
        type.patchType(type);

        // Every write needs a hook: object provides the default.
        object.rawWrite(SpecialMethod.op_setattr.methodName,
                JavaFunction.of("object.__setattr__",
                        ClassSystem::object__setattr__));

        this.objectClass = object;
        this.typeClass = type;

        double millis = (System.nanoTime() - start) * 1e-6;
        logger.atInfo().setMessage("Class system ready ({} ms).")
                .addArgument(() -> String.format("%.3f", millis)).log();
    }

    /**
     * The default write hook {@code object.__setattr__}.
     *
     * @param obj object to operate on
     * @param name of attribute
     * @param value to set
     * @return {@code null}
     * @throws ArgumentError if {@code obj} or {@code name} is the wrong
     *     type
     */
    private static Object object__setattr__(Object obj, Object name,
            Object value) throws ArgumentError {
        if (!(obj instanceof ModelObject o)) {
            throw new ArgumentError(SETATTR_ARG, "object", obj);
        }
        if (!(name instanceof String n)) {
            throw new ArgumentError(SETATTR_ARG, "attribute name", name);
        }
        Abstract.genericSetAttr(o, n, value);
        return null;
    }

    private static final String SETATTR_ARG =
            "object.__setattr__(): %s expected, not %s";

    /** @return the options in force */
    public Options getOptions() { return options; }

    /** @return the universal base class {@code object} */
    public ModelClass baseClass() { return objectClass; }

    /** @return the default metaclass {@code type} */
    public ModelClass defaultMetaclass() { return typeClass; }

    /**
     * Create a class.
     *
     * @param name of the class
     * @param base of the class or {@code null} to mean {@code object}
     * @param fields initial attributes defined on the class (or
     *     {@code null} for none)
     * @param metaclass of the class or {@code null} to mean
     *     {@code type}
     * @return the new class
     * @throws ClassDefinitionError if the arguments are inconsistent
     */
    public ModelClass makeClass(String name, ModelClass base,
            Map<String, ?> fields, ModelClass metaclass)
            throws ClassDefinitionError {
        if (name == null) {
            throw new ClassDefinitionError("a class must have a name");
        }
        if (base == null) {
            base = objectClass;
        } else if (base.system != this) {
            throw new ClassDefinitionError(FOREIGN_CLASS, name, "base",
                    base.getName());
        }
        if (metaclass == null) {
            metaclass = typeClass;
        } else if (metaclass.system != this) {
            throw new ClassDefinitionError(FOREIGN_CLASS, name,
                    "metaclass", metaclass.getName());
        } else if (!metaclass.isSubclassOf(typeClass)) {
            throw new ClassDefinitionError(NOT_METACLASS, name,
                    metaclass.getName());
        }
        if (fields == null) {
            fields = Map.of();
        }
        for (Map.Entry<String, ?> e : fields.entrySet()) {
            if (e.getValue() == ModelObject.ABSENT) {
                throw new ClassDefinitionError(ABSENT_FIELD, name,
                        e.getKey());
            }
        }

        ModelClass cls =
                new ModelClass(this, name, base, fields, metaclass);
        logger.atDebug().setMessage("Created class {} (base {}, type {})")
                .addArgument(name).addArgument(base::getName)
                .addArgument(metaclass::getName).log();
        return cls;
    }

    private static final String FOREIGN_CLASS =
            "class '%s': %s '%s' belongs to another class system";
    private static final String NOT_METACLASS =
            "class '%s': metaclass '%s' is not a subclass of 'type'";
    private static final String ABSENT_FIELD =
            "class '%s': field '%s' holds the absent marker";

    /**
     * Create a class with the default metaclass {@code type}.
     *
     * @param name of the class
     * @param base of the class or {@code null} to mean {@code object}
     * @param fields initial attributes defined on the class
     * @return the new class
     * @throws ClassDefinitionError if the arguments are inconsistent
     */
    public ModelClass makeClass(String name, ModelClass base,
            Map<String, ?> fields) throws ClassDefinitionError {
        return makeClass(name, base, fields, null);
    }

    /**
     * Create an instance of a class, with no attributes and the empty
     * layout.
     *
     * @param cls of which an instance is required
     * @return the new instance
     * @throws InterpreterError if {@code cls} is not a class of this
     *     class system
     */
    public ModelInstance newInstance(ModelObject cls)
            throws InterpreterError {
        if (!(cls instanceof ModelClass c)) {
            throw new InterpreterError(NOT_A_CLASS, cls);
        } else if (c.system != this) {
            throw new InterpreterError(FOREIGN_INSTANCE, c.getName());
        }
        return new ModelInstance(c, layouts.empty());
    }

    private static final String NOT_A_CLASS =
            "cannot make an instance of %s: not a class";
    private static final String FOREIGN_INSTANCE =
            "cannot make an instance of '%s': another class system";

    /**
     * Attribute read {@code obj.name}, as
     * {@link Abstract#getAttr(ModelObject, String)}.
     *
     * @param obj object to operate on
     * @param name of attribute
     * @return {@code obj.name}
     * @throws AttributeNotFound if nothing supplies the attribute
     * @throws Throwable from a hook or descriptor
     */
    public Object read(ModelObject obj, String name)
            throws AttributeNotFound, Throwable {
        return Abstract.getAttr(obj, name);
    }

    /**
     * Attribute write {@code obj.name = value}, as
     * {@link Abstract#setAttr(ModelObject, String, Object)}.
     *
     * @param obj object to operate on
     * @param name of attribute
     * @param value to set
     * @throws Throwable from the write hook
     */
    public void write(ModelObject obj, String name, Object value)
            throws Throwable {
        Abstract.setAttr(obj, name, value);
    }

    /**
     * Method call {@code obj.name(args...)}, as
     * {@link Abstract#callMethod(ModelObject, String, Object...)}.
     *
     * @param obj target of the call
     * @param name of the method
     * @param args other arguments
     * @return the result of the call
     * @throws Throwable from the method or a hook
     */
    public Object callMethod(ModelObject obj, String name, Object... args)
            throws Throwable {
        return Abstract.callMethod(obj, name, args);
    }

    /**
     * Test whether {@code obj} is an instance of {@code cls} or of a
     * subclass of it.
     *
     * @param obj to test
     * @param cls to test against
     * @return whether {@code cls} is an ancestor of the class of
     *     {@code obj}
     */
    public boolean isInstance(ModelObject obj, ModelClass cls) {
        return obj.getType().isSubclassOf(cls);
    }

    /**
     * Test whether {@code a} is {@code b} or a subclass of it.
     *
     * @param a the putative subclass
     * @param b the putative ancestor
     * @return whether {@code b} is an ancestor of {@code a}
     */
    public boolean isSubclass(ModelClass a, ModelClass b) {
        return a.isSubclassOf(b);
    }

    /**
     * The ancestor sequence of a class: the class, its base, and so on
     * to {@code object}.
     *
     * @param cls of which the ancestors are required
     * @return the ancestors, starting with {@code cls}
     */
    public List<ModelClass> ancestors(ModelClass cls) {
        return cls.getAncestors();
    }

    /** @return the empty layout with which every instance starts */
    public Layout emptyLayout() { return layouts.empty(); }

    /** @return the number of distinct instance layouts created */
    public int layoutCount() { return layouts.size(); }
}
