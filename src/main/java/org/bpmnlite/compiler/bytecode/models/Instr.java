package org.bpmnlite.compiler.bytecode.models;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.bpmnlite.compiler.bpmn.models.ConditionExpr;

import java.util.List;

/**
 * One bytecode instruction. Instructions are addressed by their index in {@link Program#instructions()};
 * every {@code target}, {@code next} and {@code resumeAt} field holds such an address.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Instr.ExecNative.class, name = "ExecNative"),
        @JsonSubTypes.Type(value = Instr.WaitMsg.class, name = "WaitMsg"),
        @JsonSubTypes.Type(value = Instr.WaitFor.class, name = "WaitFor"),
        @JsonSubTypes.Type(value = Instr.WaitUntil.class, name = "WaitUntil"),
        @JsonSubTypes.Type(value = Instr.Jump.class, name = "Jump"),
        @JsonSubTypes.Type(value = Instr.BranchIf.class, name = "BranchIf"),
        @JsonSubTypes.Type(value = Instr.Fork.class, name = "Fork"),
        @JsonSubTypes.Type(value = Instr.Join.class, name = "Join"),
        @JsonSubTypes.Type(value = Instr.ForkInclusive.class, name = "ForkInclusive"),
        @JsonSubTypes.Type(value = Instr.JoinDynamic.class, name = "JoinDynamic"),
        @JsonSubTypes.Type(value = Instr.End.class, name = "End"),
        @JsonSubTypes.Type(value = Instr.EndTerminate.class, name = "EndTerminate"),
        @JsonSubTypes.Type(value = Instr.Fail.class, name = "Fail")
})
public interface Instr {

    /**
     * Runs the executor registered for {@code taskType}.
     */
    record ExecNative(String taskType) implements Instr {
    }

    /**
     * Parks the instance until a message correlated by {@code corrKeySource} arrives.
     *
     * @param taskKind the human task kind, or null for a plain message wait
     */
    record WaitMsg(int waitId, String name, String corrKeySource, String taskKind) implements Instr {
    }

    record WaitFor(long ms) implements Instr {
    }

    record WaitUntil(long deadlineMs) implements Instr {
    }

    record Jump(int target) implements Instr {
    }

    /**
     * Transfers to {@code target} when the condition holds against the instance flags, else continues.
     */
    record BranchIf(ConditionExpr condition, int target) implements Instr {
    }

    record Fork(List<Integer> targets) implements Instr {
        public Fork {
            targets = List.copyOf(targets);
        }
    }

    /**
     * Waits for {@code expected} arrivals, then continues at {@code next}.
     */
    record Join(int joinId, int expected, int next) implements Instr {
    }

    /**
     * Starts every branch whose condition holds, or {@code defaultTarget} when none does.
     * The number of started branches is what the paired {@link JoinDynamic} waits for.
     *
     * @param joinId        the paired join, or null when no converging inclusive gateway follows
     * @param defaultTarget the default flow target, or null
     */
    record ForkInclusive(List<InclusiveBranch> branches, Integer joinId, Integer defaultTarget) implements Instr {
        public ForkInclusive {
            branches = List.copyOf(branches);
        }
    }

    record JoinDynamic(int joinId, int next) implements Instr {
    }

    record End() implements Instr {
    }

    /**
     * Ends the whole instance, cancelling every other live token.
     */
    record EndTerminate() implements Instr {
    }

    record Fail(String elementId, String reason) implements Instr {
    }
}
