package com.formulagrid.app.services;

import com.formulagrid.app.exceptions.EmptyExpressionException;
import com.formulagrid.app.exceptions.EmptyFormulaException;
import com.formulagrid.app.exceptions.FormulaException;
import com.formulagrid.app.exceptions.InvalidCharactersException;
import com.formulagrid.app.exceptions.InvalidReferenceException;
import com.formulagrid.app.exceptions.InvalidResultException;
import com.formulagrid.app.models.CellId;
import com.formulagrid.app.models.EvaluationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the text of a cell into what the cell displays.
 * Text without a leading "=" is shown as is. Otherwise every cell reference
 * is replaced by that cell's current value and the remaining arithmetic is
 * handed to the {@link ExpressionEvaluator}.
 * Failures never escape: they come back as "#ERROR" plus a reason.
 */
public class FormulaCompiler {

    private static final Pattern REFERENCE = Pattern.compile(CellId.REFERENCE_REGEX);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern VALID_EXPRESSION = Pattern.compile("^[0-9+\\-*/().]*$");

    private final ExpressionEvaluator evaluator;

    public FormulaCompiler() {
        this(new ExpressionEvaluator());
    }

    public FormulaCompiler(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public EvaluationResult compile(String formula, CellValueResolver resolver) {
        if (!isFormula(formula)) {
            return EvaluationResult.value(formula == null ? "" : formula, Collections.emptyList());
        }
        List<CellId> references = extractReferences(formula);
        try {
            double result = evaluateFormula(formula.substring(1).trim(), references, resolver);
            return EvaluationResult.value(Numbers.format(result), references);
        } catch (FormulaException e) {
            return EvaluationResult.error(e.getMessage(), references);
        }
    }

    public static boolean isFormula(String text) {
        return text != null && text.startsWith("=");
    }

    /**
     * Distinct cell references of a formula, in order of first appearance.
     * Literals have none.
     */
    public List<CellId> extractReferences(String formula) {
        if (!isFormula(formula)) {
            return Collections.emptyList();
        }
        Set<CellId> references = new LinkedHashSet<>();
        Matcher matcher = REFERENCE.matcher(formula);
        while (matcher.find()) {
            references.add(CellId.parse(matcher.group()));
        }
        return new ArrayList<>(references);
    }

    private double evaluateFormula(String expression, List<CellId> references, CellValueResolver resolver) {
        if (expression.isEmpty()) {
            throw new EmptyFormulaException();
        }

        Map<CellId, String> values = new LinkedHashMap<>();
        for (CellId reference : references) {
            OptionalDouble value = resolver.resolve(reference);
            if (value.isEmpty()) {
                throw new InvalidReferenceException(reference.toString());
            }
            values.put(reference, Numbers.format(value.getAsDouble()));
        }

        String substituted = WHITESPACE.matcher(substitute(expression, values)).replaceAll("");
        if (!VALID_EXPRESSION.matcher(substituted).matches()) {
            throw new InvalidCharactersException();
        }
        if (substituted.isEmpty()) {
            throw new EmptyExpressionException();
        }

        double result = evaluator.evaluate(substituted);
        if (!Double.isFinite(result)) {
            throw new InvalidResultException();
        }
        return result;
    }

    // Token-wise replacement, so "A10" is never touched by the value of "A1"
    private static String substitute(String expression, Map<CellId, String> values) {
        Matcher matcher = REFERENCE.matcher(expression);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(CellId.parse(matcher.group()));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
