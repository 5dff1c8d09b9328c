package com.agentflow.core.model;

import com.agentflow.core.exception.WorkflowValidationException;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exit condition of a validation loop, evaluated over the merged diagnostics of one phase iteration.
 * The phase is re-entered while the condition is unsatisfied and the iteration cap is not reached.
 */
@FunctionalInterface
public interface LoopCondition {

    boolean isSatisfied(Diagnostics diagnostics);

    /**
     * Human-readable form used in logs and run reports.
     */
    @JsonValue
    default String describe() {
        return "custom condition";
    }

    default LoopCondition and(LoopCondition other) {
        LoopCondition self = this;
        return new Expression(d -> self.isSatisfied(d) && other.isSatisfied(d),
            self.describe() + " && " + other.describe());
    }

    static LoopCondition countEquals(String key, long expected) {
        return new Expression(d -> d.count(key) == expected, key + " == " + expected);
    }

    static LoopCondition countAtMost(String key, long max) {
        return new Expression(d -> d.count(key) <= max, key + " <= " + max);
    }

    /**
     * Satisfied when no finding at or above the given severity remains.
     */
    static LoopCondition noneAtOrAbove(Severity severity) {
        return new Expression(d -> d.countAtOrAbove(severity) == 0,
            "no findings at or above " + severity);
    }

    /**
     * Parse the textual form used in workflow catalogs, e.g.
     * {@code diagnostics.criticalCount == 0 && highCount <= 2}.
     *
     * @throws WorkflowValidationException if the expression cannot be parsed
     */
    static LoopCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new WorkflowValidationException("loopUntil", "expression is empty");
        }
        List<LoopCondition> clauses = new ArrayList<>();
        for (String clause : expression.split("&&")) {
            clauses.add(Expression.parseClause(clause.trim(), expression));
        }
        LoopCondition result = clauses.get(0);
        for (int i = 1; i < clauses.size(); i++) {
            result = result.and(clauses.get(i));
        }
        return result;
    }

    /**
     * Predicate paired with its textual description.
     */
    record Expression(Predicate<Diagnostics> predicate, String text) implements LoopCondition {

        private static final Pattern CLAUSE = Pattern.compile(
            "^(?:diagnostics\\.)?([A-Za-z][\\w.-]*)\\s*(==|!=|<=|>=|<|>)\\s*(-?\\d+)$");

        @Override
        public boolean isSatisfied(Diagnostics diagnostics) {
            return predicate.test(diagnostics);
        }

        @Override
        public String describe() {
            return text;
        }

        static LoopCondition parseClause(String clause, String expression) {
            Matcher matcher = CLAUSE.matcher(clause);
            if (!matcher.matches()) {
                throw new WorkflowValidationException("loopUntil",
                    "cannot parse clause '" + clause + "' in '" + expression + "'");
            }
            String key = matcher.group(1);
            String op = matcher.group(2);
            long value = Long.parseLong(matcher.group(3));
            Predicate<Diagnostics> predicate = switch (op) {
                case "==" -> d -> d.count(key) == value;
                case "!=" -> d -> d.count(key) != value;
                case "<=" -> d -> d.count(key) <= value;
                case ">=" -> d -> d.count(key) >= value;
                case "<" -> d -> d.count(key) < value;
                case ">" -> d -> d.count(key) > value;
                default -> throw new WorkflowValidationException("loopUntil", "unknown operator " + op);
            };
            return new Expression(predicate, key + " " + op + " " + value);
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
