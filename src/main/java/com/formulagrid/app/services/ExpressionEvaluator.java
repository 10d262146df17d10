package com.formulagrid.app.services;

import com.formulagrid.app.exceptions.InvalidResultException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Evaluates arithmetic over numbers, + - * /, parentheses and unary minus,
 * e.g. "(2+3)*-4". Input is expected without whitespace.
 * Infix tokens go through the shunting-yard algorithm into postfix order,
 * which is then reduced on a single operand stack.
 */
public class ExpressionEvaluator {

    // Unary minus gets its own token so it cannot be confused with subtraction
    static final String NEGATE = "neg";

    private static final Map<String, Integer> PRECEDENCE = Map.of(
            "+", 1,
            "-", 1,
            "*", 2,
            "/", 2,
            NEGATE, 3);

    /**
     * Returns the value of the expression. Division by zero is not an error here:
     * the result is simply infinite or NaN.
     *
     * @throws InvalidResultException if the expression is malformed
     */
    public double evaluate(String expression) {
        List<String> postfix = toPostfix(tokenize(expression));
        return evaluatePostfix(postfix);
    }

    /**
     * Splits into number, operator and parenthesis tokens. A "-" where an
     * operand is expected becomes {@link #NEGATE}; a "+" there is dropped.
     */
    List<String> tokenize(String expression) {
        List<String> tokens = new ArrayList<>();
        StringBuilder number = new StringBuilder();
        boolean expectOperand = true;

        for (int i = 0; i < expression.length(); i++) {
            char ch = expression.charAt(i);
            if (Character.isDigit(ch) || ch == '.') {
                number.append(ch);
                continue;
            }
            if (number.length() > 0) {
                tokens.add(number.toString());
                number.setLength(0);
                expectOperand = false;
            }
            switch (ch) {
                case '(':
                    tokens.add("(");
                    expectOperand = true;
                    break;
                case ')':
                    tokens.add(")");
                    expectOperand = false;
                    break;
                case '+':
                case '-':
                    if (expectOperand) {
                        if (ch == '-') {
                            tokens.add(NEGATE);
                        }
                        break;
                    }
                    tokens.add(String.valueOf(ch));
                    expectOperand = true;
                    break;
                case '*':
                case '/':
                    tokens.add(String.valueOf(ch));
                    expectOperand = true;
                    break;
                default:
                    throw new InvalidResultException();
            }
        }
        if (number.length() > 0) {
            tokens.add(number.toString());
        }
        return tokens;
    }

    List<String> toPostfix(List<String> tokens) {
        List<String> output = new ArrayList<>();
        Deque<String> operators = new ArrayDeque<>();

        for (String token : tokens) {
            if (token.equals("(")) {
                operators.push(token);
            } else if (token.equals(")")) {
                while (!operators.isEmpty() && !operators.peek().equals("(")) {
                    output.add(operators.pop());
                }
                if (operators.isEmpty()) {
                    throw new InvalidResultException();
                }
                operators.pop();
            } else if (PRECEDENCE.containsKey(token)) {
                while (!operators.isEmpty() && shouldPopBefore(operators.peek(), token)) {
                    output.add(operators.pop());
                }
                operators.push(token);
            } else {
                output.add(token);
            }
        }
        while (!operators.isEmpty()) {
            String op = operators.pop();
            if (op.equals("(")) {
                throw new InvalidResultException();
            }
            output.add(op);
        }
        return output;
    }

    // Binary operators are left-associative, negation is right-associative
    private static boolean shouldPopBefore(String top, String incoming) {
        Integer topPrecedence = PRECEDENCE.get(top);
        if (topPrecedence == null) {
            return false;
        }
        int incomingPrecedence = PRECEDENCE.get(incoming);
        if (incoming.equals(NEGATE)) {
            return topPrecedence > incomingPrecedence;
        }
        return topPrecedence >= incomingPrecedence;
    }

    double evaluatePostfix(List<String> postfix) {
        Deque<Double> stack = new ArrayDeque<>();
        for (String token : postfix) {
            if (!PRECEDENCE.containsKey(token)) {
                stack.push(parseOperand(token));
                continue;
            }
            if (token.equals(NEGATE)) {
                requireOperands(stack, 1);
                stack.push(-stack.pop());
                continue;
            }
            requireOperands(stack, 2);
            double b = stack.pop();
            double a = stack.pop();
            switch (token) {
                case "+":
                    stack.push(a + b);
                    break;
                case "-":
                    stack.push(a - b);
                    break;
                case "*":
                    stack.push(a * b);
                    break;
                case "/":
                    stack.push(a / b);
                    break;
                default:
                    throw new InvalidResultException();
            }
        }
        if (stack.size() != 1) {
            throw new InvalidResultException();
        }
        return stack.pop();
    }

    private static double parseOperand(String token) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            // "1.2.3" or a lone "."
            throw new InvalidResultException(e);
        }
    }

    private static void requireOperands(Deque<Double> stack, int count) {
        if (stack.size() < count) {
            throw new InvalidResultException();
        }
    }
}
