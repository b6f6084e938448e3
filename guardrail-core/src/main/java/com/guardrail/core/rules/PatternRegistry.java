package com.guardrail.core.rules;

import com.guardrail.core.model.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable, ordered catalog of compiled detection rules.
 * Packs are ordered by their {@link RulePack#getOrder()} priority; rules keep the
 * order their pack declares them in.
 */
public class PatternRegistry {

    private static final Logger log = LoggerFactory.getLogger(PatternRegistry.class);

    private final List<Rule> rules;
    private final Map<String, Rule> ruleMap;

    private PatternRegistry(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(rules);
        Map<String, Rule> byId = new LinkedHashMap<>();
        for (Rule rule : rules) {
            byId.put(rule.getId(), rule);
        }
        this.ruleMap = Collections.unmodifiableMap(byId);
    }

    /**
     * Compiles every rule of every pack.
     *
     * @throws RuleConfigurationException on the first invalid pattern or duplicate id
     */
    public static PatternRegistry load(List<? extends RulePack> packs) {
        List<RulePack> sorted = new ArrayList<>(packs);
        sorted.sort(Comparator.comparingInt(RulePack::getOrder));

        List<Rule> compiled = new ArrayList<>();
        Map<String, String> owners = new LinkedHashMap<>();
        for (RulePack pack : sorted) {
            for (RuleDefinition definition : pack.getRules()) {
                String previousOwner = owners.putIfAbsent(definition.id(), pack.getId());
                if (previousOwner != null) {
                    throw new RuleConfigurationException("Duplicate rule id '" + definition.id()
                            + "' in pack '" + pack.getId() + "' (already declared by '" + previousOwner + "')");
                }
                compiled.add(Rule.compile(definition));
            }
        }

        log.info("[Guardrail] Loaded {} detection rules from {} packs: {}",
                compiled.size(), sorted.size(),
                sorted.stream().map(p -> p.getId() + "(order=" + p.getOrder() + ")")
                        .collect(Collectors.joining(", ")));
        return new PatternRegistry(compiled);
    }

    public List<Rule> getRules() {
        return rules;
    }

    public Optional<Rule> getRule(String id) {
        return Optional.ofNullable(ruleMap.get(id));
    }

    public List<Rule> getRulesByCategory(Category category) {
        return rules.stream()
                .filter(r -> r.getCategory() == category)
                .collect(Collectors.toList());
    }

    /**
     * Number of rules per category, in {@link Category} declaration order.
     */
    public Map<Category, Integer> getCategoryCounts() {
        Map<Category, Integer> counts = new EnumMap<>(Category.class);
        for (Rule rule : rules) {
            counts.merge(rule.getCategory(), 1, Integer::sum);
        }
        return counts;
    }

    public int size() {
        return rules.size();
    }
}
