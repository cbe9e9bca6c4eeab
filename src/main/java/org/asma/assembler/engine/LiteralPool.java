package org.asma.assembler.engine;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.content.Binary;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.EvaluationContext;
import org.asma.assembler.expr.LiteralReference;
import org.asma.assembler.frontend.DataOperandParser;
import org.asma.assembler.statement.DataOperand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects literal operands and hands them out as pools.
 * <p>
 * Literals referenced between two pool statements (LTORG or END) form one pool; equal
 * literal texts in a pool share one copy. A pool is laid out largest literals first,
 * in groups of 16, 8, 4 and 2 bytes followed by all other lengths, so that each group
 * keeps its natural alignment.
 */
final class LiteralPool {

    private static final int[] GROUPS = {16, 8, 4, 2};

    /**
     * One literal in a pool.
     */
    static final class Literal {
        private final String text;
        private final DataOperand operand;
        private final long length;
        private Binary binary;

        Literal(String text, DataOperand operand, long length) {
            this.text = text;
            this.operand = operand;
            this.length = length;
        }

        String text() {
            return text;
        }

        DataOperand operand() {
            return operand;
        }

        long length() {
            return length;
        }

        int alignment() {
            for (int group : GROUPS) {
                if (length == group) {
                    return Math.min(group, 8);
                }
            }
            return 1;
        }

        /**
         * @return The Binary holding the literal, empty until its pool is placed.
         */
        Optional<Binary> binary() {
            return Optional.ofNullable(binary);
        }

        void place(Binary binary) {
            this.binary = binary;
        }
    }

    private final Map<String, Literal> pending = new LinkedHashMap<>();
    private final Map<LiteralReference, Literal> references = new IdentityHashMap<>();
    private final Map<Integer, List<Literal>> pools = new HashMap<>();

    /**
     * Adds a literal occurrence to the pending pool.
     *
     * @param reference The occurrence.
     * @param context   Used to compute the literal's length.
     * @throws StatementException if the literal is not a valid constant or its length is not fixed.
     */
    void register(LiteralReference reference, EvaluationContext context) throws StatementException {
        Literal literal = pending.get(reference.text());
        if (literal == null) {
            DataOperand operand = DataOperandParser.parse(reference.constant(), false);
            if (!DataLayout.isConstantLength(operand)) {
                throw new StatementException(AssemblerErrorCode.INVALID_CONSTANT,
                        "literal " + reference + " needs a constant duplication factor and length");
            }
            long length = DataLayout.totalLength(operand, context).orElseThrow();
            if (length == 0) {
                throw new StatementException(AssemblerErrorCode.INVALID_CONSTANT, "literal " + reference + " has no length");
            }
            literal = new Literal(reference.text(), operand, length);
            pending.put(reference.text(), literal);
        }
        references.put(reference, literal);
    }

    boolean hasPending() {
        return !pending.isEmpty();
    }

    /**
     * Closes the pending pool.
     *
     * @param statementNumber The LTORG or END statement placing the pool.
     * @return The literals in layout order.
     */
    List<Literal> flush(int statementNumber) {
        List<Literal> ordered = new ArrayList<>();
        for (int group : GROUPS) {
            for (Literal literal : pending.values()) {
                if (literal.length() == group) {
                    ordered.add(literal);
                }
            }
        }
        for (Literal literal : pending.values()) {
            if (!ordered.contains(literal)) {
                ordered.add(literal);
            }
        }
        pending.clear();
        pools.put(statementNumber, List.copyOf(ordered));
        return ordered;
    }

    /**
     * @param statementNumber A LTORG or END statement.
     * @return The literals that statement placed.
     */
    List<Literal> placedBy(int statementNumber) {
        return pools.getOrDefault(statementNumber, Collections.emptyList());
    }

    /**
     * @param reference A literal occurrence.
     * @return The literal it refers to, empty if it was never registered.
     */
    Optional<Literal> find(LiteralReference reference) {
        return Optional.ofNullable(references.get(reference));
    }
}
