package com.finops.costengine.engine.classification;

import java.util.List;

/**
 * Ordered list of rules evaluated top-down; the first matching rule wins and the fallback
 * label applies when none match.
 */
public final class ClassificationTable<I, L> {

    private final List<ClassificationRule<I, L>> rules;
    private final L fallback;

    public ClassificationTable(List<ClassificationRule<I, L>> rules, L fallback) {
        this.rules = List.copyOf(rules);
        this.fallback = fallback;
    }

    public L classify(I input) {
        for (ClassificationRule<I, L> rule : rules) {
            if (rule.matches(input)) {
                return rule.label();
            }
        }
        return fallback;
    }

    public List<ClassificationRule<I, L>> getRules() {
        return rules;
    }

    public L getFallback() {
        return fallback;
    }
}
