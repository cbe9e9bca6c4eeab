package org.asma.assembler.expr;

/**
 * The outcome of one evaluation attempt. A deferred evaluation is not an error: the
 * expression depends on something that a later phase will provide.
 */
public sealed interface Evaluation permits Evaluation.Resolved, Evaluation.Deferred {

    static Evaluation resolved(ExprValue value) {
        return new Resolved(value);
    }

    static Evaluation deferred(String reason) {
        return new Deferred(reason);
    }

    record Resolved(ExprValue value) implements Evaluation {}

    record Deferred(String reason) implements Evaluation {}
}
