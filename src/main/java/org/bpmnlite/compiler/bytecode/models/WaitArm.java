package org.bpmnlite.compiler.bytecode.models;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One contender in an activity's race. The first arm to fire wins and the instance resumes at its
 * {@code resumeAt} address.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WaitArm.Internal.class, name = "Internal"),
        @JsonSubTypes.Type(value = WaitArm.Timer.class, name = "Timer"),
        @JsonSubTypes.Type(value = WaitArm.Deadline.class, name = "Deadline"),
        @JsonSubTypes.Type(value = WaitArm.Error.class, name = "Error")
})
public interface WaitArm {

    int resumeAt();

    /**
     * Normal completion of the activity itself.
     */
    record Internal(int resumeAt) implements WaitArm {
    }

    /**
     * @param cycle set only for repeating timers; {@code durationMs} is then the first interval
     */
    record Timer(long durationMs, int resumeAt, boolean interrupting, CycleSpec cycle) implements WaitArm {
    }

    record Deadline(long deadlineMs, int resumeAt, boolean interrupting) implements WaitArm {
    }

    /**
     * @param errorCode the caught code, or null to catch any error
     */
    record Error(String errorCode, int resumeAt) implements WaitArm {
    }
}
