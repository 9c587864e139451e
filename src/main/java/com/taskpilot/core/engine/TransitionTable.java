package com.taskpilot.core.engine;

import com.taskpilot.core.model.TddPhase;
import com.taskpilot.core.model.WorkflowPhase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable {@code (phase, tddPhase, trigger) -> (phase, tddPhase)} table. Anything not listed
 * is illegal.
 */
public final class TransitionTable {

    private static final TransitionTable STANDARD = new TransitionTable.Builder()
            .add(StatePoint.of(WorkflowPhase.PREFLIGHT), Trigger.PREFLIGHT_COMPLETE,
                    StatePoint.of(WorkflowPhase.BRANCH_SETUP))
            .add(StatePoint.of(WorkflowPhase.BRANCH_SETUP), Trigger.BRANCH_CREATED,
                    StatePoint.loop(TddPhase.RED))
            .add(StatePoint.loop(TddPhase.RED), Trigger.RED_COMPLETE,
                    StatePoint.loop(TddPhase.GREEN))
            .add(StatePoint.loop(TddPhase.RED), Trigger.RED_ALREADY_SATISFIED,
                    StatePoint.loop(TddPhase.COMMIT))
            .add(StatePoint.loop(TddPhase.GREEN), Trigger.GREEN_COMPLETE,
                    StatePoint.loop(TddPhase.COMMIT))
            .add(StatePoint.loop(TddPhase.COMMIT), Trigger.COMMIT_COMPLETE,
                    StatePoint.loop(TddPhase.RED))
            .add(StatePoint.loop(TddPhase.COMMIT), Trigger.LAST_COMMIT_COMPLETE,
                    StatePoint.of(WorkflowPhase.FINALIZE))
            .add(StatePoint.of(WorkflowPhase.FINALIZE), Trigger.FINALIZE_COMPLETE,
                    StatePoint.of(WorkflowPhase.COMPLETE))
            .build();

    private final Map<StatePoint, Map<Trigger, StatePoint>> transitions;

    private TransitionTable(Map<StatePoint, Map<Trigger, StatePoint>> transitions) {
        this.transitions = transitions;
    }

    public static TransitionTable standard() {
        return STANDARD;
    }

    public Optional<StatePoint> next(StatePoint from, Trigger trigger) {
        return Optional.ofNullable(transitions.getOrDefault(from, Map.of()).get(trigger));
    }

    /**
     * @throws InvalidTransitionException when {@code trigger} is not legal from {@code from}
     */
    public StatePoint require(StatePoint from, Trigger trigger) {
        return next(from, trigger).orElseThrow(() -> new InvalidTransitionException(
                "Cannot apply " + trigger + " in " + from,
                "Legal operations here: " + legalOperations(from)));
    }

    public Set<Trigger> triggersFrom(StatePoint from) {
        Map<Trigger, StatePoint> row = transitions.get(from);
        return row == null ? Set.of() : Collections.unmodifiableSet(row.keySet());
    }

    /**
     * Operations that can advance the workflow from {@code from}. A finished workflow has none;
     * only a new start replaces it.
     */
    public Set<Operation> legalOperations(StatePoint from) {
        Set<Operation> ops = EnumSet.noneOf(Operation.class);
        for (Trigger trigger : triggersFrom(from)) {
            ops.add(trigger.operation());
        }
        return Collections.unmodifiableSet(ops);
    }

    public boolean isLegal(StatePoint from, Operation operation) {
        return legalOperations(from).contains(operation);
    }

    static final class Builder {
        private final Map<StatePoint, Map<Trigger, StatePoint>> transitions = new LinkedHashMap<>();

        Builder add(StatePoint from, Trigger trigger, StatePoint to) {
            StatePoint previous = transitions.computeIfAbsent(from, k -> new EnumMap<>(Trigger.class))
                    .put(trigger, to);
            if (previous != null) {
                throw new IllegalStateException("Duplicate transition " + from + " + " + trigger);
            }
            return this;
        }

        TransitionTable build() {
            var frozen = new LinkedHashMap<StatePoint, Map<Trigger, StatePoint>>();
            transitions.forEach((from, row) -> frozen.put(from, Collections.unmodifiableMap(new EnumMap<>(row))));
            return new TransitionTable(Collections.unmodifiableMap(frozen));
        }
    }
}
