package net.spookly.multiupstream.routing;

import java.util.List;

/**
 * Evaluates routing rules against a flow.
 */
public final class RuleMatcher {
    private RuleMatcher() {
    }

    /**
     * Returns true when the rule matches the flow. Missing attributes never match.
     */
    public static boolean matches(FlowView flow, Rule rule) {
        if (flow == null || rule == null) {
            return false;
        }
        return rule.test(flow);
    }

    /**
     * Returns true when any of the rules matches. An empty rule list never matches.
     */
    public static boolean matchesAny(FlowView flow, List<Rule> rules) {
        if (rules == null) {
            return false;
        }
        for (Rule rule : rules) {
            if (matches(flow, rule)) {
                return true;
            }
        }
        return false;
    }
}
