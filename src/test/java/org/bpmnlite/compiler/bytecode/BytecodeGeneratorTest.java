package org.bpmnlite.compiler.bytecode;

import org.bpmnlite.compiler.bpmn.BpmnParser;
import org.bpmnlite.compiler.bpmn.models.ConditionExpr;
import org.bpmnlite.compiler.bpmn.models.ConditionLiteral;
import org.bpmnlite.compiler.bpmn.models.ConditionOp;
import org.bpmnlite.compiler.bpmn.models.IREdge;
import org.bpmnlite.compiler.bpmn.models.IRGraph;
import org.bpmnlite.compiler.bpmn.models.IRNode;
import org.bpmnlite.compiler.bpmn.models.TimerSpec;
import org.bpmnlite.compiler.bytecode.models.CycleSpec;
import org.bpmnlite.compiler.bytecode.models.ErrorRoute;
import org.bpmnlite.compiler.bytecode.models.InclusiveBranch;
import org.bpmnlite.compiler.bytecode.models.Instr;
import org.bpmnlite.compiler.bytecode.models.JoinPlanEntry;
import org.bpmnlite.compiler.bytecode.models.Program;
import org.bpmnlite.compiler.bytecode.models.RaceEntry;
import org.bpmnlite.compiler.bytecode.models.WaitArm;
import org.bpmnlite.compiler.bytecode.models.WaitPlanEntry;
import org.bpmnlite.compiler.bytecode.models.WaitType;
import org.bpmnlite.compiler.verifier.BpmnVerifier;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BytecodeGeneratorTest {
    private static final String MODELS = "src/test/resources/models/";

    private static final ConditionExpr RETRY =
            new ConditionExpr("retry", ConditionOp.EQ, new ConditionLiteral.Bool(true));
    private static final ConditionExpr HIGH_RISK =
            new ConditionExpr("risk", ConditionOp.GT, new ConditionLiteral.I64(80));

    private static Program lowerFixture(String fileName) throws IOException {
        IRGraph graph = new BpmnParser().parse(Files.readString(Path.of(MODELS + fileName)));
        BpmnVerifier.verify(graph);
        return BytecodeGenerator.lower(graph);
    }

    private static IRGraph linearGraph(boolean reversedInsertion) {
        var b = IRGraph.builder();
        int start;
        int task;
        int end;
        if (reversedInsertion) {
            end = b.addNode(new IRNode.End("end", false));
            task = b.addNode(new IRNode.ServiceTask("task1", "Create Case", "create_case"));
            start = b.addNode(new IRNode.Start("start"));
        } else {
            start = b.addNode(new IRNode.Start("start"));
            task = b.addNode(new IRNode.ServiceTask("task1", "Create Case", "create_case"));
            end = b.addNode(new IRNode.End("end", false));
        }
        b.addEdge(start, task, new IREdge("f1")).addEdge(task, end, new IREdge("f2"));
        return b.build();
    }

    private static IRGraph timedReview(TimerSpec spec, boolean interrupting) {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int review = b.addNode(new IRNode.HumanWait("review", "Review", "manual_review", "case_id"));
        int end = b.addNode(new IRNode.End("end", false));
        int timer = b.addNode(new IRNode.BoundaryTimer("timer", "review", spec, interrupting));
        int escalate = b.addNode(new IRNode.ServiceTask("escalate", "Escalate", "escalate"));
        b.addEdge(start, review, new IREdge("f1"))
                .addEdge(review, end, new IREdge("f2"))
                .addEdge(timer, escalate, new IREdge("f3"))
                .addEdge(escalate, end, new IREdge("f4"));
        return b.build();
    }

    @Test
    void shouldLowerLinearGraph() {
        Program program = BytecodeGenerator.lower(linearGraph(false));

        assertEquals(List.of(new Instr.ExecNative("create_case"), new Instr.End()), program.instructions());
        assertEquals(List.of("create_case"), program.taskManifest());
        assertEquals(Map.of(0, "task1", 1, "end"), program.debugMap());
    }

    @Test
    void shouldBeIndependentOfNodeInsertionOrder() {
        Program first = BytecodeGenerator.lower(linearGraph(false));
        Program second = BytecodeGenerator.lower(linearGraph(true));

        assertEquals(first.instructions(), second.instructions());
        assertEquals(first.bytecodeVersion(), second.bytecodeVersion());
    }

    @Test
    void shouldProduceHexContentHash() {
        Program program = BytecodeGenerator.lower(linearGraph(false));

        assertTrue(program.bytecodeVersion().matches("[0-9a-f]{64}"));
        assertNotEquals("0".repeat(64), program.bytecodeVersion());
        assertEquals(program.bytecodeVersion(), BytecodeGenerator.lower(linearGraph(false)).bytecodeVersion());
    }

    @Test
    void shouldChangeHashWhenTimerChanges() {
        String threeDays = BytecodeGenerator.lower(timedReview(new TimerSpec.Duration(259_200_000L), true))
                .bytecodeVersion();
        String twoDays = BytecodeGenerator.lower(timedReview(new TimerSpec.Duration(172_800_000L), true))
                .bytecodeVersion();
        String nonInterrupting = BytecodeGenerator.lower(timedReview(new TimerSpec.Duration(259_200_000L), false))
                .bytecodeVersion();

        assertNotEquals(threeDays, twoDays);
        assertNotEquals(threeDays, nonInterrupting);
    }

    @Test
    void shouldLowerKycProcess() throws IOException {
        Program program = lowerFixture("kyc_onboarding.bpmn");

        assertEquals(3, program.count(Instr.ExecNative.class));
        assertEquals(2, program.count(Instr.WaitMsg.class));
        assertEquals(List.of("create_case_record", "verify_identity", "kyc_review", "sanctions_screening"),
                program.taskManifest());
        assertEquals(List.of(
                new Instr.ExecNative("create_case_record"),
                new Instr.WaitMsg(0, "Documents Received", "case_id", null),
                new Instr.ExecNative("verify_identity"),
                new Instr.WaitMsg(1, "Analyst Review", "case_id", "kyc_review"),
                new Instr.ExecNative("sanctions_screening"),
                new Instr.End()), program.instructions());
        assertNotEquals("0".repeat(64), program.bytecodeVersion());
    }

    @Test
    void shouldRecordWaitPlan() throws IOException {
        Program program = lowerFixture("kyc_onboarding.bpmn");

        assertEquals(new WaitPlanEntry(WaitType.MESSAGE, "Documents Received", "case_id", "wait_documents"),
                program.waitPlan().get(0));
        assertEquals(new WaitPlanEntry(WaitType.HUMAN, "Analyst Review", "case_id", "task_review"),
                program.waitPlan().get(1));
    }

    @Test
    void shouldBuildRacePlanForBoundaryTimer() throws IOException {
        Program program = lowerFixture("boundary_timer.bpmn");

        assertEquals(List.of(
                new Instr.ExecNative("review_application"),
                new Instr.End(),
                new Instr.ExecNative("escalate_case"),
                new Instr.End()), program.instructions());
        assertEquals(1, program.racePlan().size());

        RaceEntry race = program.racePlan().get("task_review");
        assertEquals(0, race.activityAddr());
        assertEquals(2, race.arms().size());
        assertEquals(new WaitArm.Internal(1), race.arms().get(0));

        WaitArm.Timer timer = assertInstanceOf(WaitArm.Timer.class, race.arms().get(1));
        assertEquals(259_200_000L, timer.durationMs());
        assertTrue(timer.interrupting());
        assertNull(timer.cycle());
        assertNotEquals(race.activityAddr(), timer.resumeAt());
        assertEquals(new Instr.ExecNative("escalate_case"), program.instruction(timer.resumeAt()));
        assertEquals(Map.of("boundary_timeout", "task_review"), program.boundaryMap());
    }

    @Test
    void shouldResumeTimerArmAtEscalationBranch() {
        Program program = BytecodeGenerator.lower(timedReview(new TimerSpec.Duration(1000), true));

        WaitArm.Timer timer = (WaitArm.Timer) program.racePlan().get("review").arms().get(1);
        Instr target = program.instruction(timer.resumeAt());

        assertTrue(target instanceof Instr.ExecNative || target instanceof Instr.Jump);
        assertEquals(new Instr.ExecNative("escalate"), target);
        assertEquals(List.of("manual_review", "escalate"), program.taskManifest());
    }

    @Test
    void shouldCarryCycleOnRepeatingBoundary() {
        Program program = BytecodeGenerator.lower(timedReview(new TimerSpec.Cycle(3_600_000L, 3), false));

        WaitArm.Timer timer = (WaitArm.Timer) program.racePlan().get("review").arms().get(1);

        assertEquals(3_600_000L, timer.durationMs());
        assertFalse(timer.interrupting());
        assertEquals(new CycleSpec(3_600_000L, 3), timer.cycle());
    }

    @Test
    void shouldEmitDeadlineArmForDateBoundary() {
        Program program = BytecodeGenerator.lower(timedReview(new TimerSpec.Date(1_700_000_000_000L), true));

        WaitArm arm = program.racePlan().get("review").arms().get(1);

        WaitArm.Deadline deadline = assertInstanceOf(WaitArm.Deadline.class, arm);
        assertEquals(1_700_000_000_000L, deadline.deadlineMs());
        assertTrue(deadline.interrupting());
    }

    @Test
    void shouldLowerExclusiveGatewayToBranchAndJump() throws IOException {
        Program program = lowerFixture("exclusive_decision.bpmn");

        ConditionExpr approved = new ConditionExpr("approved", ConditionOp.EQ, new ConditionLiteral.Bool(true));
        assertEquals(List.of(
                new Instr.BranchIf(approved, 2),
                new Instr.Jump(4),
                new Instr.ExecNative("approve_application"),
                new Instr.End(),
                new Instr.ExecNative("reject_application"),
                new Instr.End()), program.instructions());
        assertEquals("gw_decision", program.debugMap().get(0));
    }

    @Test
    void shouldFailWhenExclusiveGatewayHasNoDefault() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int gw = b.addNode(new IRNode.GatewayXor("gw", "Risk"));
        int endA = b.addNode(new IRNode.End("end_a", false));
        int endB = b.addNode(new IRNode.End("end_b", false));
        b.addEdge(start, gw, new IREdge("f1"))
                .addEdge(gw, endA, new IREdge("f2", RETRY))
                .addEdge(gw, endB, new IREdge("f3", HIGH_RISK));

        Program program = BytecodeGenerator.lower(b.build());

        assertEquals(List.of(
                new Instr.BranchIf(RETRY, 3),
                new Instr.BranchIf(HIGH_RISK, 4),
                new Instr.Fail("gw", BytecodeGenerator.NO_MATCHING_FLOW),
                new Instr.End(),
                new Instr.End()), program.instructions());
    }

    @Test
    void shouldTakeLastUnconditionedFlowAsExclusiveDefault() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int gw = b.addNode(new IRNode.GatewayXor("gw", "Route"));
        int endA = b.addNode(new IRNode.End("end_a", false));
        int endB = b.addNode(new IRNode.End("end_b", false));
        b.addEdge(start, gw, new IREdge("f1"))
                .addEdge(gw, endB, new IREdge("f2"))
                .addEdge(gw, endA, new IREdge("f3"));

        Program program = BytecodeGenerator.lower(b.build());

        assertEquals(List.of(
                new Instr.Jump(1),
                new Instr.End(),
                new Instr.End()), program.instructions());
        assertEquals("end_a", program.debugMap().get(1));
    }

    @Test
    void shouldLowerParallelGateways() throws IOException {
        Program program = lowerFixture("parallel_checks.bpmn");

        assertEquals(List.of(
                new Instr.Fork(List.of(1, 3)),
                new Instr.ExecNative("task_a"),
                new Instr.Jump(4),
                new Instr.ExecNative("task_b"),
                new Instr.Join(0, 2, 5),
                new Instr.End()), program.instructions());
        assertEquals(Map.of(0, new JoinPlanEntry("join", 2, 5, false)), program.joinPlan());
    }

    @Test
    void shouldLowerInclusiveGateways() throws IOException {
        Program program = lowerFixture("inclusive_checks.bpmn");

        ConditionExpr needsCredit = new ConditionExpr("needs_credit", ConditionOp.EQ, new ConditionLiteral.Bool(true));
        ConditionExpr bigAmount = new ConditionExpr("amount", ConditionOp.GT, new ConditionLiteral.I64(1000));
        assertEquals(new Instr.ForkInclusive(List.of(
                        new InclusiveBranch(needsCredit, 5),
                        new InclusiveBranch(bigAmount, 1)), 0, 3),
                program.instruction(0));
        assertEquals(new Instr.JoinDynamic(0, 7), program.instruction(6));
        assertEquals(new JoinPlanEntry("merge", 3, 7, true), program.joinPlan().get(0));
        assertEquals(List.of("aml_check", "basic_check", "credit_check"), program.taskManifest());
    }

    @Test
    void shouldRouteErrorsWithCatchAllLast() throws IOException {
        Program program = lowerFixture("error_boundaries.bpmn");

        assertEquals(List.of(
                new Instr.ExecNative("charge_card"),
                new Instr.Jump(3),
                new Instr.EndTerminate(),
                new Instr.End(),
                new Instr.ExecNative("notify_customer"),
                new Instr.End()), program.instructions());

        assertEquals(List.of(
                new ErrorRoute("CARD_DECLINED", 4, "boundary_declined"),
                new ErrorRoute(null, 2, "boundary_any")), program.errorRoutes().get("task_charge"));

        RaceEntry race = program.racePlan().get("task_charge");
        assertEquals(List.of(
                new WaitArm.Internal(1),
                new WaitArm.Error(null, 2),
                new WaitArm.Error("CARD_DECLINED", 4)), race.arms());
        assertEquals(Map.of("boundary_any", "task_charge", "boundary_declined", "task_charge"),
                program.boundaryMap());
    }

    @Test
    void shouldLowerTimerWaits() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int cooldown = b.addNode(new IRNode.TimerWait("cooldown", new TimerSpec.Duration(1_800_000L)));
        int deadline = b.addNode(new IRNode.TimerWait("deadline", new TimerSpec.Date(1_700_000_000_000L)));
        int end = b.addNode(new IRNode.End("end", false));
        b.addEdge(start, cooldown, new IREdge("f1"))
                .addEdge(cooldown, deadline, new IREdge("f2"))
                .addEdge(deadline, end, new IREdge("f3"));

        Program program = BytecodeGenerator.lower(b.build());

        assertEquals(List.of(
                new Instr.WaitFor(1_800_000L),
                new Instr.WaitUntil(1_700_000_000_000L),
                new Instr.End()), program.instructions());
        assertTrue(program.taskManifest().isEmpty());
    }

    @Test
    void shouldAddImplicitEndToDeadEnd() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int task = b.addNode(new IRNode.ServiceTask("task", "Archive", "archive"));
        b.addEdge(start, task, new IREdge("f1"));

        Program program = BytecodeGenerator.lower(b.build());

        assertEquals(List.of(new Instr.ExecNative("archive"), new Instr.End()), program.instructions());
    }

    @Test
    void shouldLinearizeLoops() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int task = b.addNode(new IRNode.ServiceTask("task_a", "Attempt", "attempt"));
        int gw = b.addNode(new IRNode.GatewayXor("gw", "Retry?"));
        int end = b.addNode(new IRNode.End("end", false));
        b.addEdge(start, task, new IREdge("f1"))
                .addEdge(task, gw, new IREdge("f2"))
                .addEdge(gw, task, new IREdge("f3", RETRY))
                .addEdge(gw, end, new IREdge("f4"));

        Program program = BytecodeGenerator.lower(b.build());

        assertEquals(List.of(
                new Instr.ExecNative("attempt"),
                new Instr.BranchIf(RETRY, 0),
                new Instr.Jump(3),
                new Instr.End()), program.instructions());
    }

    @Test
    void shouldExposeImmutableProgram() {
        Program program = BytecodeGenerator.lower(linearGraph(false));

        assertThrows(UnsupportedOperationException.class, () -> program.instructions().add(new Instr.End()));
        assertThrows(UnsupportedOperationException.class, () -> program.racePlan().clear());
    }
}
