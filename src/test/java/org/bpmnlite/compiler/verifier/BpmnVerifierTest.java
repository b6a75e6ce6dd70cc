package org.bpmnlite.compiler.verifier;

import org.bpmnlite.compiler.bpmn.models.ConditionExpr;
import org.bpmnlite.compiler.bpmn.models.ConditionLiteral;
import org.bpmnlite.compiler.bpmn.models.ConditionOp;
import org.bpmnlite.compiler.bpmn.models.GatewayDirection;
import org.bpmnlite.compiler.bpmn.models.IREdge;
import org.bpmnlite.compiler.bpmn.models.IRGraph;
import org.bpmnlite.compiler.bpmn.models.IRNode;
import org.bpmnlite.compiler.bpmn.models.TimerSpec;
import org.bpmnlite.compiler.errors.BpmnCompileException;
import org.bpmnlite.compiler.errors.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BpmnVerifierTest {

    private static final ConditionExpr APPROVED =
            new ConditionExpr("approved", ConditionOp.EQ, new ConditionLiteral.Bool(true));

    private static void assertRejected(IRGraph graph, String messagePart) {
        var ex = assertThrows(BpmnCompileException.class, () -> BpmnVerifier.verify(graph));
        assertEquals(ErrorKind.VERIFICATION_ERROR, ex.getKind());
        assertTrue(ex.getMessage().contains(messagePart), ex.getMessage());
    }

    @Test
    void shouldAcceptLinearGraph() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int task = b.addNode(new IRNode.ServiceTask("task", "Task", "task"));
        int end = b.addNode(new IRNode.End("end", false));
        b.addEdge(start, task, new IREdge("f1")).addEdge(task, end, new IREdge("f2"));

        assertDoesNotThrow(() -> BpmnVerifier.verify(b.build()));
    }

    @Test
    void shouldRequireExactlyOneStart() {
        var none = IRGraph.builder();
        none.addNode(new IRNode.End("end", false));
        assertRejected(none.build(), "found 0");

        var two = IRGraph.builder();
        int s1 = two.addNode(new IRNode.Start("s1"));
        int s2 = two.addNode(new IRNode.Start("s2"));
        int end = two.addNode(new IRNode.End("end", false));
        two.addEdge(s1, end, new IREdge("f1")).addEdge(s2, end, new IREdge("f2"));
        assertRejected(two.build(), "found 2");
    }

    @Test
    void shouldRejectUnreachableNodes() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int end = b.addNode(new IRNode.End("end", false));
        b.addNode(new IRNode.ServiceTask("orphan", "Orphan", "orphan"));
        b.addEdge(start, end, new IREdge("f1"));

        assertRejected(b.build(), "orphan");
    }

    @Test
    void shouldReachBoundaryThroughItsActivity() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int task = b.addNode(new IRNode.ServiceTask("task", "Task", "task"));
        int end = b.addNode(new IRNode.End("end", false));
        int timer = b.addNode(new IRNode.BoundaryTimer("timer", "task", new TimerSpec.Duration(1000), true));
        int escalated = b.addNode(new IRNode.End("escalated", false));
        b.addEdge(start, task, new IREdge("f1"))
                .addEdge(task, end, new IREdge("f2"))
                .addEdge(timer, escalated, new IREdge("f3"));

        assertDoesNotThrow(() -> BpmnVerifier.verify(b.build()));
    }

    @Test
    void shouldRejectBoundaryOnNonActivity() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int gw = b.addNode(new IRNode.GatewayXor("gw", ""));
        int end = b.addNode(new IRNode.End("end", false));
        int timer = b.addNode(new IRNode.BoundaryTimer("timer", "gw", new TimerSpec.Duration(1000), true));
        b.addEdge(start, gw, new IREdge("f1"))
                .addEdge(gw, end, new IREdge("f2"))
                .addEdge(timer, end, new IREdge("f3"));

        assertRejected(b.build(), "not a task");
    }

    @Test
    void shouldRejectBoundaryOnUnknownActivity() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int end = b.addNode(new IRNode.End("end", false));
        b.addNode(new IRNode.BoundaryError("err", "ghost", null));
        b.addEdge(start, end, new IREdge("f1"));

        // an unattached boundary is never reached either
        assertRejected(b.build(), "err");
    }

    @Test
    void shouldRejectBoundaryWithoutOutgoingFlow() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int task = b.addNode(new IRNode.ServiceTask("task", "Task", "task"));
        int end = b.addNode(new IRNode.End("end", false));
        b.addNode(new IRNode.BoundaryError("err", "task", "E1"));
        b.addEdge(start, task, new IREdge("f1")).addEdge(task, end, new IREdge("f2"));

        assertRejected(b.build(), "no outgoing flow");
    }

    @Test
    void shouldRejectTwoTimerBoundariesOnOneActivity() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int task = b.addNode(new IRNode.ServiceTask("task", "Task", "task"));
        int end = b.addNode(new IRNode.End("end", false));
        int t1 = b.addNode(new IRNode.BoundaryTimer("t1", "task", new TimerSpec.Duration(1000), true));
        int t2 = b.addNode(new IRNode.BoundaryTimer("t2", "task", new TimerSpec.Duration(2000), false));
        b.addEdge(start, task, new IREdge("f1"))
                .addEdge(task, end, new IREdge("f2"))
                .addEdge(t1, end, new IREdge("f3"))
                .addEdge(t2, end, new IREdge("f4"));

        assertRejected(b.build(), "more than one timer boundary");
    }

    @Test
    void shouldRejectAmbiguousUnconditionedBranching() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int task = b.addNode(new IRNode.ServiceTask("task", "Task", "task"));
        int a = b.addNode(new IRNode.End("a", false));
        int c = b.addNode(new IRNode.End("c", false));
        b.addEdge(start, task, new IREdge("f1"))
                .addEdge(task, a, new IREdge("f2"))
                .addEdge(task, c, new IREdge("f3"));

        assertRejected(b.build(), "unconditioned");
    }

    @Test
    void shouldAcceptConditionedBranchingWithOneDefault() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int task = b.addNode(new IRNode.ServiceTask("task", "Task", "task"));
        int a = b.addNode(new IRNode.End("a", false));
        int c = b.addNode(new IRNode.End("c", false));
        b.addEdge(start, task, new IREdge("f1"))
                .addEdge(task, a, new IREdge("f2", APPROVED))
                .addEdge(task, c, new IREdge("f3"));

        assertDoesNotThrow(() -> BpmnVerifier.verify(b.build()));
    }

    @Test
    void shouldRejectDivergingGatewayWithSingleOutgoing() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int fork = b.addNode(new IRNode.GatewayAnd("fork", "", GatewayDirection.DIVERGING));
        int end = b.addNode(new IRNode.End("end", false));
        b.addEdge(start, fork, new IREdge("f1")).addEdge(fork, end, new IREdge("f2"));

        assertRejected(b.build(), "diverging gateway 'fork'");
    }

    @Test
    void shouldRejectConvergingGatewayWithSingleIncoming() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int merge = b.addNode(new IRNode.GatewayInclusive("merge", "", GatewayDirection.CONVERGING));
        int end = b.addNode(new IRNode.End("end", false));
        b.addEdge(start, merge, new IREdge("f1")).addEdge(merge, end, new IREdge("f2"));

        assertRejected(b.build(), "converging gateway 'merge'");
    }

    @Test
    void shouldRejectConvergingGatewayWithSeveralOutgoing() {
        var b = IRGraph.builder();
        int start = b.addNode(new IRNode.Start("start"));
        int fork = b.addNode(new IRNode.GatewayAnd("fork", "", GatewayDirection.DIVERGING));
        int a = b.addNode(new IRNode.ServiceTask("a", "A", "a"));
        int c = b.addNode(new IRNode.ServiceTask("c", "C", "c"));
        int join = b.addNode(new IRNode.GatewayAnd("join", "", GatewayDirection.CONVERGING));
        int d = b.addNode(new IRNode.ServiceTask("d", "D", "d"));
        int e = b.addNode(new IRNode.ServiceTask("e", "E", "e"));
        int end = b.addNode(new IRNode.End("end", false));
        b.addEdge(start, fork, new IREdge("f1"))
                .addEdge(fork, a, new IREdge("f2"))
                .addEdge(fork, c, new IREdge("f3"))
                .addEdge(a, join, new IREdge("f4"))
                .addEdge(c, join, new IREdge("f5"))
                .addEdge(join, d, new IREdge("f6"))
                .addEdge(join, e, new IREdge("f7"))
                .addEdge(d, end, new IREdge("f8"))
                .addEdge(e, end, new IREdge("f9"));

        assertRejected(b.build(), "converging gateway 'join' allows at most one outgoing flow");
    }
}
