package io.polygraph.store.core.function;

import io.polygraph.core.GraphException;
import io.polygraph.core.Ids;
import net.objecthunter.exp4j.Expression;
import net.objecthunter.exp4j.ExpressionBuilder;
import net.objecthunter.exp4j.ValidationResult;
import net.objecthunter.exp4j.function.Function;
import net.objecthunter.exp4j.function.Functions;

import java.math.BigDecimal;
import java.util.EmptyStackException;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates arithmetic over a node's attribute values with exp4j.
 *
 * <p>Supported: numeric literals, {@code + - * / % ^}, unary minus, parentheses, the constants
 * {@code pi} and {@code e}, exp4j's built-in functions ({@code abs sqrt floor ceil log ...}) and
 * {@code round min max}. Identifiers are attribute names with whitespace replaced by {@code _};
 * a name containing spaces may also be written in double quotes, as in {@code "molar mass" / 2}.
 *
 * <p>Attribute values are read like {@code parseFloat}: the leading number counts and trailing
 * text such as a unit is ignored, so {@code "18.015 g/mol"} binds 18.015.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class FunctionEvaluator {

    private static final Pattern QUOTED_NAME = Pattern.compile("\"([^\"]*)\"");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private static final Function ROUND = new Function("round", 1) {
        @Override
        public double apply(double... args) {
            return Math.round(args[0]);
        }
    };
    private static final Function MIN = new Function("min", 2) {
        @Override
        public double apply(double... args) {
            return Math.min(args[0], args[1]);
        }
    };
    private static final Function MAX = new Function("max", 2) {
        @Override
        public double apply(double... args) {
            return Math.max(args[0], args[1]);
        }
    };
    private static final Set<String> CUSTOM_FUNCTIONS = Set.of("round", "min", "max");

    /**
     * Binds attribute names to their raw values. Non-numeric values may be bound; using one in
     * the expression is an error.
     */
    public double evaluate(String expression, Map<String, String> attributes) {
        Objects.requireNonNull(attributes, "attributes");
        if (expression == null || expression.isBlank()) {
            throw new GraphException.InvalidExpression("expression must not be empty");
        }

        Map<String, String> raw = new HashMap<>();
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            String name = Ids.underscored(attribute.getKey().trim());
            if (bindable(name)) {
                raw.put(name, attribute.getValue());
            }
        }

        String source = unquoteNames(expression);
        double result;
        try {
            Expression compiled = new ExpressionBuilder(source)
                    .functions(ROUND, MIN, MAX)
                    .variables(new LinkedHashSet<>(raw.keySet()))
                    .build();
            for (String used : compiled.getVariableNames()) {
                String value = raw.get(used);
                if (value == null) {
                    continue;
                }
                OptionalDouble number = parseLeadingNumber(value);
                if (number.isEmpty()) {
                    throw new GraphException.InvalidExpression(
                            "Attribute '" + used + "' is not numeric: '" + value + "'");
                }
                compiled.setVariable(used, number.getAsDouble());
            }
            ValidationResult validation = compiled.validate(true);
            if (!validation.isValid()) {
                throw new GraphException.InvalidExpression(
                        "Invalid expression '" + expression + "': " + String.join("; ", validation.getErrors()));
            }
            result = compiled.evaluate();
        } catch (IllegalArgumentException | ArithmeticException | EmptyStackException e) {
            throw new GraphException.InvalidExpression(
                    "Invalid expression '" + expression + "': " + e.getMessage(), e);
        }
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new GraphException.InvalidExpression("'" + expression + "' does not evaluate to a finite number");
        }
        return result;
    }

    /**
     * Reads the leading decimal number of {@code value}, ignoring leading whitespace and any
     * trailing text. Empty when the value does not start with a number.
     */
    public static OptionalDouble parseLeadingNumber(String value) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        Matcher matcher = LEADING_NUMBER.matcher(value.strip());
        if (!matcher.find()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(matcher.group()));
    }

    /**
     * Renders a result the way attribute values are stored: integral results without a
     * fraction, others in plain decimal notation.
     */
    public static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString().toLowerCase(Locale.ROOT);
    }

    // names shadowing a function cannot be bound as exp4j variables
    private static boolean bindable(String name) {
        return IDENTIFIER.matcher(name).matches()
                && Functions.getBuiltinFunction(name) == null
                && !CUSTOM_FUNCTIONS.contains(name);
    }

    private static String unquoteNames(String expression) {
        Matcher matcher = QUOTED_NAME.matcher(expression);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = Ids.underscored(matcher.group(1).trim());
            if (name.isEmpty()) {
                throw new GraphException.InvalidExpression("empty quoted name in '" + expression + "'");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(name));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
