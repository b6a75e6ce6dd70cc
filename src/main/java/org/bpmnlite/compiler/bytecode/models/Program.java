package org.bpmnlite.compiler.bytecode.models;

import lombok.Builder;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The compiled artifact handed to the workflow runtime.
 *
 * @param instructions    the linear instruction stream
 * @param taskManifest    distinct task types and human task kinds, in first-emission order
 * @param bytecodeVersion SHA-256 of the program content as 64 lowercase hex characters
 * @param boundaryMap     boundary event id to the id of the activity it is attached to
 * @param racePlan        activity id to the race run while that activity is in flight
 * @param joinPlan        join id to its converging gateway
 * @param waitPlan        wait id to the message or human wait it parks on
 * @param errorRoutes     activity id to its error routes, specific codes first and the catch-all last
 * @param debugMap        instruction address to the BPMN element whose code starts there
 */
@Builder
public record Program(
        List<Instr> instructions,
        List<String> taskManifest,
        String bytecodeVersion,
        SortedMap<String, String> boundaryMap,
        SortedMap<String, RaceEntry> racePlan,
        SortedMap<Integer, JoinPlanEntry> joinPlan,
        SortedMap<Integer, WaitPlanEntry> waitPlan,
        SortedMap<String, List<ErrorRoute>> errorRoutes,
        SortedMap<Integer, String> debugMap
) {
    public Program {
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        taskManifest = taskManifest == null ? List.of() : List.copyOf(taskManifest);
        boundaryMap = frozen(boundaryMap);
        racePlan = frozen(racePlan);
        joinPlan = frozen(joinPlan);
        waitPlan = frozen(waitPlan);
        errorRoutes = frozen(errorRoutes);
        debugMap = frozen(debugMap);
    }

    private static <K, V> SortedMap<K, V> frozen(Map<K, V> map) {
        return Collections.unmodifiableSortedMap(map == null ? new TreeMap<>() : new TreeMap<>(map));
    }

    public Instr instruction(int address) {
        return instructions.get(address);
    }

    public long count(Class<? extends Instr> type) {
        return instructions.stream().filter(type::isInstance).count();
    }
}
