package com.integration.migrator.transform;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.expression.ConditionInverter;
import com.integration.migrator.expression.ExpressionTranslator;
import com.integration.migrator.workflow.ActionKind;
import com.integration.migrator.workflow.WorkflowAction;

/**
 * Turns "repeat while" guards into "repeat until" conditions. The target loop only knows the
 * exit condition, so each pending guard is inverted before translation.
 */
public class LoopConditionPass {

    private static final Logger log = LoggerFactory.getLogger(LoopConditionPass.class);

    /** Iteration cap for loops whose guard carries no numeric bound. */
    public static final int DEFAULT_LOOP_LIMIT = 60;

    private static final Pattern UPPER_BOUND = Pattern.compile("<\\s*=?\\s*(\\d+)");

    private final ConditionInverter inverter;
    private final ExpressionTranslator translator;

    public LoopConditionPass(ConditionInverter inverter, ExpressionTranslator translator) {
        this.inverter = inverter;
        this.translator = translator;
    }

    public void apply(List<WorkflowAction> actions, TransformationContext context) {
        for (WorkflowAction root : actions) {
            for (WorkflowAction action : root.flatten()) {
                if (action.getKind() == ActionKind.UNTIL && action.getLoopGuard() != null) {
                    String guard = action.getLoopGuard();
                    String inverted = inverter.invert(guard);
                    action.setDetails(translator.translate(inverted, context.getVariableNames()));
                    action.setSourceExpression(guard);
                    if (action.getLoopThreshold() == null) {
                        action.setLoopThreshold(thresholdOrDefault(guard));
                    }
                    log.debug("Loop {} runs until {}", action.getName(), inverted);
                }
            }
        }
    }

    public static int thresholdOrDefault(String expression) {
        Integer bound = extractThreshold(expression);
        return bound != null ? bound : DEFAULT_LOOP_LIMIT;
    }

    /**
     * Upper bound of a {@code < N} or {@code <= N} comparison, looking inside {@code while (...)}
     * when present; null when there is none.
     */
    public static Integer extractThreshold(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        String text = expression.trim();
        if (text.toLowerCase(Locale.ROOT).startsWith("while")) {
            int open = text.indexOf('(');
            int close = text.lastIndexOf(')');
            if (open >= 0 && close > open) {
                text = text.substring(open + 1, close);
            }
        }
        Matcher matcher = UPPER_BOUND.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.valueOf(matcher.group(1));
        } catch (NumberFormatException e) {
            log.debug("Loop bound out of range in '{}'", expression);
            return null;
        }
    }
}
