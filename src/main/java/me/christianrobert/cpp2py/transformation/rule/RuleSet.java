package me.christianrobert.cpp2py.transformation.rule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The active, ordered rules of one translation.
 *
 * <p>Selection keeps registry order regardless of the order names were given in, so a
 * subset always behaves like the full set restricted to those rules.</p>
 */
public final class RuleSet {

    private final List<Rule> rules;

    private RuleSet(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(rules);
    }

    /**
     * Every rule of the registry.
     */
    public static RuleSet all(RuleRegistry registry) {
        List<Rule> rules = new ArrayList<>();
        for (String name : registry.names()) {
            rules.add(registry.create(name));
        }
        return new RuleSet(rules);
    }

    /**
     * The named subset of the registry, in registry order. An empty selection yields a
     * rule set that rewrites nothing.
     *
     * @throws IllegalArgumentException if a name is not registered; the message lists
     *         the available rules
     */
    public static RuleSet select(RuleRegistry registry, Collection<String> names) {
        Set<String> requested = new LinkedHashSet<>(names);
        List<String> unknown = requested.stream()
                .filter(name -> !registry.contains(name))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown rule(s): " + String.join(", ", unknown)
                    + ". Available rules: " + String.join(", ", registry.names()));
        }
        List<Rule> rules = new ArrayList<>();
        for (String name : registry.names()) {
            if (requested.contains(name)) {
                rules.add(registry.create(name));
            }
        }
        return new RuleSet(rules);
    }

    /**
     * A rule set that leaves every tree unchanged.
     */
    public static RuleSet none() {
        return new RuleSet(List.of());
    }

    /**
     * Rules in application order, for callers that assemble rules outside a registry.
     */
    public static RuleSet of(Rule... rules) {
        return new RuleSet(List.of(rules));
    }

    public List<Rule> getRules() {
        return rules;
    }

    public List<String> getNames() {
        return rules.stream().map(Rule::getName).collect(Collectors.toList());
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return "RuleSet" + getNames();
    }
}
