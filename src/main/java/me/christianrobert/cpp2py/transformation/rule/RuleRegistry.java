package me.christianrobert.cpp2py.transformation.rule;

import me.christianrobert.cpp2py.transformation.rule.builtin.CastToConstructorRule;
import me.christianrobert.cpp2py.transformation.rule.builtin.ClassMethodRule;
import me.christianrobert.cpp2py.transformation.rule.builtin.ContainerMethodRule;
import me.christianrobert.cpp2py.transformation.rule.builtin.ForLoopToRangeRule;
import me.christianrobert.cpp2py.transformation.rule.builtin.IncrementToAugmentedAssignmentRule;
import me.christianrobert.cpp2py.transformation.rule.builtin.IntegerDivisionRule;
import me.christianrobert.cpp2py.transformation.rule.builtin.MainGuardRule;
import me.christianrobert.cpp2py.transformation.rule.builtin.PrintfToPrintRule;
import me.christianrobert.cpp2py.transformation.rule.builtin.StdCinToInputRule;
import me.christianrobert.cpp2py.transformation.rule.builtin.StdCoutToPrintRule;
import me.christianrobert.cpp2py.transformation.rule.builtin.StdFunctionCallRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Ordered catalogue of rule factories keyed by rule name.
 *
 * <p>Registration order is application order: when two rules match the same node the
 * one registered first wins. Registries are immutable; build custom ones with
 * {@link #builder()}.</p>
 */
public final class RuleRegistry {

    private static final RuleRegistry DEFAULT = builder()
            .register(ForLoopToRangeRule::new)
            .register(StdCoutToPrintRule::new)
            .register(PrintfToPrintRule::new)
            .register(StdCinToInputRule::new)
            .register(IncrementToAugmentedAssignmentRule::new)
            .register(CastToConstructorRule::new)
            .register(IntegerDivisionRule::new)
            .register(StdFunctionCallRule::new)
            .register(ContainerMethodRule::new)
            .register(ClassMethodRule::new)
            .register(MainGuardRule::new)
            .build();

    private final Map<String, Supplier<? extends Rule>> factories;

    private RuleRegistry(Map<String, Supplier<? extends Rule>> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    /**
     * Registry with every built-in rule, in their canonical order.
     */
    public static RuleRegistry defaultRegistry() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rule names in registration order.
     */
    public List<String> names() {
        return new ArrayList<>(factories.keySet());
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    /**
     * Creates a fresh instance of the named rule.
     *
     * @throws NoSuchElementException if no rule with that name is registered
     */
    public Rule create(String name) {
        Supplier<? extends Rule> factory = factories.get(name);
        if (factory == null) {
            throw new NoSuchElementException("No rule registered under '" + name + "'");
        }
        return factory.get();
    }

    public int size() {
        return factories.size();
    }

    public static final class Builder {

        private final Map<String, Supplier<? extends Rule>> factories = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a factory under the name reported by the rule it creates.
         *
         * @throws IllegalArgumentException if the name is already taken
         */
        public Builder register(Supplier<? extends Rule> factory) {
            String name = factory.get().getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Rule name cannot be blank");
            }
            if (factories.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate rule name: " + name);
            }
            factories.put(name, factory);
            return this;
        }

        public RuleRegistry build() {
            return new RuleRegistry(factories);
        }
    }
}
