package com.guardrail.core.chain;

import java.util.List;

/**
 * A multi-step scenario whose steps look harmless one at a time.
 */
public class AttackChain {

    private final String name;
    private final String description;
    private final List<String> steps;
    private final String attackType;

    public AttackChain(String name, String description, List<String> steps, String attackType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Attack chain name must not be blank");
        }
        if (steps == null || steps.size() < 2) {
            throw new IllegalArgumentException("Attack chain '" + name + "' needs at least two steps");
        }
        this.name = name;
        this.description = description;
        this.steps = List.copyOf(steps);
        this.attackType = attackType;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getSteps() {
        return steps;
    }

    public String getAttackType() {
        return attackType;
    }

    @Override
    public String toString() {
        return "AttackChain{name='" + name + "', steps=" + steps.size() + ", type='" + attackType + "'}";
    }
}
