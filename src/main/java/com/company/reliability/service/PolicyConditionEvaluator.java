package com.company.reliability.service;

import com.company.reliability.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.expression.MapAccessor;
import org.springframework.core.convert.TypeDescriptor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.MethodExecutor;
import org.springframework.expression.MethodResolver;
import org.springframework.expression.TypedValue;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates gate policy conditions such as
 * {@code budget_remaining < 20 AND env == 'prod'} or
 * {@code NOT business_hours() OR freeze_period('2024-12-20', '2025-01-02')}.
 * <p>
 * Conditions are SpEL expressions evaluated against the variables of a
 * {@link PolicyContext}. Only variable reads and the functions
 * business_hours(), weekday(), peak_traffic() and freeze_period(start, end)
 * are available; type references, constructors and bean lookups are not.
 */
@Component
@Slf4j
public class PolicyConditionEvaluator {

    private static final int MAX_CACHED_EXPRESSIONS = 1000;
    static final String CONTEXT_VARIABLE = "policyContext";

    private final ExpressionParser parser = new SpelExpressionParser();
    private final MethodResolver functions = new ConditionFunctions();
    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();

    /**
     * @return the truth value of {@code condition}; an empty condition is true
     * @throws ValidationException when the condition cannot be parsed, references
     *                             an unknown variable or function, or does not
     *                             yield a boolean
     */
    public boolean evaluate(String condition, PolicyContext context) {
        if (condition == null || condition.isBlank()) {
            return true;
        }

        String normalized = condition.trim();
        try {
            Expression expression = parse(normalized);
            Boolean result = expression.getValue(createEvaluationContext(context), Boolean.class);
            return Boolean.TRUE.equals(result);
        } catch (ExpressionException | UnsupportedOperationException e) {
            throw new ValidationException("Invalid condition '" + normalized + "': " + e.getMessage(), e);
        }
    }

    private Expression parse(String condition) {
        if (expressionCache.size() >= MAX_CACHED_EXPRESSIONS) {
            log.debug("Condition cache full, clearing {} entries", expressionCache.size());
            expressionCache.clear();
        }
        return expressionCache.computeIfAbsent(condition, parser::parseExpression);
    }

    private EvaluationContext createEvaluationContext(PolicyContext context) {
        // read-only root: an assignment such as "env = 'prod'" fails instead of rebinding
        SimpleEvaluationContext evaluationContext = SimpleEvaluationContext.forPropertyAccessors(new MapAccessor())
                .withMethodResolvers(functions)
                .withRootObject(Collections.unmodifiableMap(context.toVariables()))
                .build();
        evaluationContext.setVariable(CONTEXT_VARIABLE, context);
        return evaluationContext;
    }

    /**
     * Resolves the built-in condition functions by name, case-insensitively.
     * Any other method call fails to resolve. Parsed expressions keep the
     * resolved executor, so executors read the context of the current
     * evaluation rather than capturing one.
     */
    static class ConditionFunctions implements MethodResolver {

        @Override
        public MethodExecutor resolve(EvaluationContext evaluationContext, Object target, String name,
                                      List<TypeDescriptor> argumentTypes) {
            switch (name.toLowerCase(Locale.ROOT)) {
                case "business_hours":
                    return (ctx, root, args) -> new TypedValue(policyContext(ctx).isBusinessHours());
                case "weekday":
                    return (ctx, root, args) -> new TypedValue(policyContext(ctx).isWeekday());
                case "peak_traffic":
                    return (ctx, root, args) -> new TypedValue(policyContext(ctx).isPeakTraffic());
                case "freeze_period":
                    if (argumentTypes.size() != 2) {
                        throw new ValidationException("freeze_period takes a start and an end date");
                    }
                    return (ctx, root, args) ->
                            new TypedValue(policyContext(ctx).isWithin(parseDate(args[0]), parseDate(args[1])));
                default:
                    return null;
            }
        }

        private static PolicyContext policyContext(EvaluationContext evaluationContext) {
            return (PolicyContext) evaluationContext.lookupVariable(CONTEXT_VARIABLE);
        }

        private static LocalDate parseDate(Object value) {
            try {
                return LocalDate.parse(String.valueOf(value));
            } catch (DateTimeParseException e) {
                throw new ValidationException("Invalid date '" + value + "' in freeze_period", e);
            }
        }
    }
}
