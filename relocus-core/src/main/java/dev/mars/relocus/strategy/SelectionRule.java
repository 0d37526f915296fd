/*
 * Copyright 2026 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.relocus.strategy;

import dev.mars.relocus.core.RelocationStrategy;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the ordered selection table: when the condition holds, the rule yields
 * its strategy.
 */
public final class SelectionRule {

    private final String name;
    private final Predicate<SelectionContext> condition;
    private final Function<SelectionContext, RelocationStrategy> strategy;

    public SelectionRule(String name, Predicate<SelectionContext> condition,
                         Function<SelectionContext, RelocationStrategy> strategy) {
        this.name = Objects.requireNonNull(name, "Rule name cannot be null");
        this.condition = Objects.requireNonNull(condition, "Condition cannot be null");
        this.strategy = Objects.requireNonNull(strategy, "Strategy cannot be null");
    }

    public String getName() {
        return name;
    }

    public boolean matches(SelectionContext context) {
        return condition.test(context);
    }

    public Optional<RelocationStrategy> evaluate(SelectionContext context) {
        return matches(context) ? Optional.of(strategy.apply(context)) : Optional.empty();
    }

    @Override
    public String toString() {
        return "SelectionRule{" + name + "}";
    }
}
