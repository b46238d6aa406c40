package org.neuralchilli.plexor.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlContext;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.JexlExpression;
import org.apache.commons.jexl3.MapContext;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders {@code ${...}} JEXL expressions in task arguments and environment.
 * Values without an expression are returned unchanged; text around
 * expressions is kept ({@code out/${run.id}.csv}).
 */
@ApplicationScoped
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final JexlEngine jexl;
    private final DateFunctions dateFunctions;

    public ExpressionEvaluator() {
        this(new DateFunctions());
    }

    public ExpressionEvaluator(DateFunctions dateFunctions) {
        this.dateFunctions = dateFunctions;
        this.jexl = new JexlBuilder()
                .cache(512)
                .strict(false)
                .silent(false)
                .permissions(JexlPermissions.UNRESTRICTED)
                .create();
    }

    /**
     * Render a value to a string.
     *
     * @throws ExpressionException if an expression is malformed or fails
     */
    public String evaluate(String value, ExpressionContext context) {
        if (value == null || !isExpression(value)) {
            return value;
        }

        try {
            Object result = isSingleExpression(value)
                    ? evaluateExpression(extractExpression(value), context)
                    : interpolate(value, context);
            return result != null ? result.toString() : "";
        } catch (ExpressionException e) {
            throw e;
        } catch (JexlException | IllegalArgumentException e) {
            String msg = String.format("Failed to evaluate expression: %s - %s", value, e.getMessage());
            log.warn(msg);
            throw new ExpressionException(msg, e);
        }
    }

    /**
     * Render every argument
     */
    public List<String> evaluateList(List<String> values, ExpressionContext context) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<String> rendered = new ArrayList<>(values.size());
        for (String value : values) {
            rendered.add(evaluate(value, context));
        }
        return rendered;
    }

    /**
     * Render every value of a map, typically environment variables
     */
    public Map<String, String> evaluateMap(Map<String, String> map, ExpressionContext context) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : map.entrySet()) {
            result.put(entry.getKey(), evaluate(entry.getValue(), context));
        }
        return result;
    }

    public boolean isExpression(String value) {
        return value != null && value.contains("${") && value.contains("}");
    }

    /**
     * Compile-only check of every expression in the value
     *
     * @return the error message, or null if the value is valid
     */
    public String getValidationError(String value) {
        if (!isExpression(value)) {
            return null;
        }

        int pos = 0;
        while (true) {
            int start = value.indexOf("${", pos);
            if (start == -1) {
                return null;
            }
            int end = findClosingBrace(value, start + 2);
            if (end == -1) {
                return "Unclosed expression in: " + value;
            }
            try {
                jexl.createExpression(value.substring(start + 2, end));
            } catch (JexlException e) {
                return e.getMessage();
            }
            pos = end + 1;
        }
    }

    public boolean isValid(String value) {
        return getValidationError(value) == null;
    }

    private Object evaluateExpression(String expression, ExpressionContext context) {
        JexlExpression compiled = jexl.createExpression(expression);
        return compiled.evaluate(createJexlContext(context));
    }

    private boolean isSingleExpression(String value) {
        return value.startsWith("${")
                && findClosingBrace(value, 2) == value.length() - 1;
    }

    private String extractExpression(String value) {
        return value.substring(2, value.length() - 1);
    }

    private String interpolate(String template, ExpressionContext context) {
        StringBuilder result = new StringBuilder();
        int pos = 0;

        while (pos < template.length()) {
            int start = template.indexOf("${", pos);
            if (start == -1) {
                result.append(template.substring(pos));
                break;
            }

            result.append(template, pos, start);

            int end = findClosingBrace(template, start + 2);
            if (end == -1) {
                throw new ExpressionException("Unclosed expression in: " + template);
            }

            Object evaluated = evaluateExpression(template.substring(start + 2, end), context);
            result.append(evaluated != null ? evaluated.toString() : "");
            pos = end + 1;
        }

        return result.toString();
    }

    private int findClosingBrace(String str, int start) {
        int depth = 1;
        for (int i = start; i < str.length(); i++) {
            if (str.charAt(i) == '{') {
                depth++;
            } else if (str.charAt(i) == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private JexlContext createJexlContext(ExpressionContext context) {
        MapContext jexlContext = new MapContext();
        jexlContext.set("params", context.params());
        jexlContext.set("env", context.env());
        jexlContext.set("run", context.run());
        jexlContext.set("date", dateFunctions);
        return jexlContext;
    }
}
