package com.finops.costengine.engine.classification;

import java.util.function.Predicate;

/**
 * One row of a classification table: the label applies when the predicate holds.
 */
public record ClassificationRule<I, L>(Predicate<I> predicate, L label) {

    public boolean matches(I input) {
        return predicate.test(input);
    }
}
