package org.bpmnlite.compiler.util;

import org.bpmnlite.compiler.bpmn.models.ConditionExpr;
import org.bpmnlite.compiler.bpmn.models.ConditionLiteral;
import org.bpmnlite.compiler.bpmn.models.ConditionOp;

import java.util.List;
import java.util.Optional;

public class ConditionParser {

    // Matching order matters: ">=" is never seen as one operator, it splits on ">".
    private static final List<ConditionOp> OPERATOR_ORDER = List.of(
            ConditionOp.EQ, ConditionOp.NEQ, ConditionOp.GT, ConditionOp.LT);

    /**
     * Parses a flag comparison like {@code = approved == true} or {@code count > 5}
     * into a ConditionExpr.
     * <p>
     * An expression that does not fit the grammar yields an empty result rather than an error:
     * the owning sequence flow is then treated as the default (unconditioned) flow.
     *
     * @param expression the raw text of a {@code conditionExpression} element
     * @return the parsed condition, or empty if the text is not a supported comparison
     */
    public static Optional<ConditionExpr> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }

        String text = expression.trim();
        if (text.startsWith("=")) {
            text = text.substring(1).trim();
        }

        for (ConditionOp op : OPERATOR_ORDER) {
            int pos = text.indexOf(op.symbol());
            if (pos < 0) {
                continue;
            }
            String flag = text.substring(0, pos).trim();
            String rhs = text.substring(pos + op.symbol().length()).trim();
            return parseLiteral(rhs).map(literal -> new ConditionExpr(flag, op, literal));
        }

        return Optional.empty();
    }

    private static Optional<ConditionLiteral> parseLiteral(String text) {
        switch (text) {
            case "true" -> {
                return Optional.of(new ConditionLiteral.Bool(true));
            }
            case "false" -> {
                return Optional.of(new ConditionLiteral.Bool(false));
            }
            default -> {
                try {
                    return Optional.of(new ConditionLiteral.I64(Long.parseLong(text)));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }
        }
    }
}
