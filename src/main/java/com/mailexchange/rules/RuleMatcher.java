package com.mailexchange.rules;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Subject to rule matcher.
 *
 * <p>Rules are scanned in configured order and the first rule whose tag is a
 * case-insensitive substring of the subject wins.
 * <br>Overlapping tags are therefore resolved by configuration order, not by specificity.
 */
public class RuleMatcher {

    private final List<ForwardRule> rules;

    /**
     * Constructs a new RuleMatcher instance.
     *
     * @param rules Rules in configured order.
     */
    public RuleMatcher(List<ForwardRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Finds the rule for a subject.
     *
     * @param subject Message subject, null is treated as empty.
     * @return Optional of ForwardRule.
     */
    public Optional<ForwardRule> match(String subject) {
        String lowerSubject = subject != null ? subject.toLowerCase(Locale.ROOT) : "";
        for (ForwardRule rule : rules) {
            if (lowerSubject.contains(rule.getTag().toLowerCase(Locale.ROOT))) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public List<ForwardRule> getRules() {
        return rules;
    }
}
