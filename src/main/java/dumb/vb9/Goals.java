package dumb.vb9;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Ground backward chaining over facts and rules, memoizing every resolved goal.
 * No variables and no unification: a goal is proven by matching a fact exactly or by one of
 * the conjunctions its predicate's rules expand it into.
 */
public class Goals {

    private final Set<Goal> facts = new HashSet<>();
    private final Map<String, List<Rule>> rules = new LinkedHashMap<>();
    private final Map<Goal, Boolean> memo = new HashMap<>();
    private final Set<Goal> inProgress = new HashSet<>();
    /** Times a branch failed by re-entering a goal still in progress. */
    private long cuts;

    /**
     * Fact {@code (bootstrap gcc)} plus a {@code build} rule chaining
     * emacs, gtk, glib and libc down to the bootstrap compiler.
     */
    public static Goals example() {
        var kb = new Goals();
        kb.addFact("bootstrap", "gcc");
        kb.addRule("build", goal -> {
            if (goal.size() != 2) return Stream.empty();
            var pkg = goal.get(1);
            if ("emacs".equals(pkg)) return Stream.of(List.of(Goal.of("build", "gtk"), Goal.of("build", "elisp")));
            if ("gtk".equals(pkg)) return Stream.of(List.of(Goal.of("build", "glib"), Goal.of("build", "cairo")));
            if ("glib".equals(pkg)) return Stream.of(List.of(Goal.of("build", "libc")));
            if ("libc".equals(pkg)) return Stream.of(List.of(Goal.of("bootstrap", "gcc")));
            return Stream.empty();
        });
        return kb;
    }

    public synchronized void addFact(Object... terms) {
        addFact(Goal.of(terms));
    }

    public synchronized void addFact(Goal fact) {
        facts.add(requireNonNull(fact));
        memo.clear();
    }

    public synchronized void addRule(String predicate, Rule rule) {
        rules.computeIfAbsent(requireNonNull(predicate), k -> new ArrayList<>()).add(requireNonNull(rule));
        memo.clear();
    }

    public synchronized boolean prove(Object... terms) {
        return prove(Goal.of(terms));
    }

    /**
     * Rules are tried in registration order, each rule's conjunctions in the order it yields
     * them; the first conjunction whose subgoals all hold proves the goal. A goal reached again
     * while it is still being resolved fails on that branch.
     * <p>
     * Successes are always memoized. A failure is memoized only when no branch under it was cut
     * by an enclosing goal, since such a failure may turn into a success once that goal resolves.
     * The outermost goal of a query is always memoized.
     */
    public synchronized boolean prove(Goal goal) {
        var known = memo.get(goal);
        if (known != null) return known;

        if (facts.contains(goal)) {
            memo.put(goal, true);
            return true;
        }

        if (!inProgress.add(goal)) {
            cuts++;
            return false;
        }
        var cutsBefore = cuts;
        boolean proven;
        try {
            proven = rules.getOrDefault(goal.predicate(), List.of()).stream()
                    .anyMatch(rule -> rule.expand(goal)
                            .anyMatch(conjunction -> conjunction.stream().allMatch(this::prove)));
        } finally {
            inProgress.remove(goal);
        }
        if (proven || cuts == cutsBefore || inProgress.isEmpty())
            memo.put(goal, proven);
        return proven;
    }

    public synchronized boolean isMemoized(Goal goal) {
        return memo.containsKey(goal);
    }

    @FunctionalInterface
    public interface Rule {
        /**
         * Alternative conjunctions of subgoals for {@code goal}, tried lazily in stream order.
         */
        Stream<List<Goal>> expand(Goal goal);
    }

    /** A predicate name followed by ground arguments. */
    public record Goal(List<Object> terms) {
        public Goal {
            terms = List.copyOf(terms);
            if (terms.isEmpty()) throw new IllegalArgumentException("Goal needs a predicate");
        }

        public static Goal of(Object... terms) {
            return new Goal(List.of(terms));
        }

        public String predicate() {
            return String.valueOf(terms.get(0));
        }

        public Object get(int index) {
            return terms.get(index);
        }

        public int size() {
            return terms.size();
        }

        @Override
        public String toString() {
            return terms.toString();
        }
    }
}
