package org.asma.assembler.expr;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;

import java.util.Optional;

/**
 * An operand expression together with its resolution progress.
 * <p>
 * Integers, absolute addresses and DSECT displacements never change once known and are
 * cached. Addresses relative to a CSECT become absolute at bind, so they are returned
 * but evaluated again on the next attempt.
 */
public final class Resolvable {

    private final Expression expression;
    private ExprValue value;
    private int attempts;
    private String lastDeferral;

    public Resolvable(Expression expression) {
        this.expression = expression;
    }

    public Expression expression() {
        return expression;
    }

    /**
     * Evaluates the expression unless a final value is already known.
     *
     * @param context The evaluation context.
     * @return The value, or empty if evaluation is deferred.
     * @throws StatementException if the expression is invalid.
     */
    public Optional<ExprValue> tryResolve(EvaluationContext context) throws StatementException {
        if (value != null) {
            return Optional.of(value);
        }
        attempts++;
        Evaluation evaluation = expression.tryEvaluate(context);
        if (evaluation instanceof Evaluation.Deferred deferred) {
            lastDeferral = deferred.reason();
            return Optional.empty();
        }
        ExprValue result = ((Evaluation.Resolved) evaluation).value();
        lastDeferral = null;
        if (isFinal(result)) {
            value = result;
        }
        return Optional.of(result);
    }

    /**
     * Evaluates the expression; a deferral at this point is an error.
     *
     * @param context The evaluation context.
     * @return The value.
     * @throws StatementException if the expression is invalid or still cannot be evaluated.
     */
    public ExprValue require(EvaluationContext context) throws StatementException {
        Optional<ExprValue> result = tryResolve(context);
        if (result.isEmpty()) {
            throw new StatementException(AssemblerErrorCode.UNRESOLVED_EXPRESSION,
                    "cannot resolve '" + expression + "': " + lastDeferral);
        }
        return result.get();
    }

    /**
     * Evaluates an expression that must produce an absolute integer.
     *
     * @param context The evaluation context.
     * @param what    Description of the operand for error messages.
     * @return The integer.
     * @throws StatementException if the expression is not an integer.
     */
    public long requireInteger(EvaluationContext context, String what) throws StatementException {
        ExprValue result = require(context);
        if (!(result instanceof ExprValue.IntValue intValue)) {
            throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC,
                    what + " must be an absolute value, not address " + result);
        }
        return intValue.value();
    }

    /**
     * @return {@code true} once a final value is cached.
     */
    public boolean isResolved() {
        return value != null;
    }

    /**
     * @return The number of evaluations performed so far.
     */
    public int attempts() {
        return attempts;
    }

    public Optional<String> lastDeferral() {
        return Optional.ofNullable(lastDeferral);
    }

    private static boolean isFinal(ExprValue result) {
        if (result instanceof ExprValue.AddrValue addr) {
            return addr.address().isAbsolute() || addr.address().isDummy();
        }
        return true;
    }

    @Override
    public String toString() {
        return expression.toString();
    }
}
