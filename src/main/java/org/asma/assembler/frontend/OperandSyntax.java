package org.asma.assembler.frontend;

import org.asma.assembler.expr.Expression;

/**
 * A parsed operand of the form {@code expr}, {@code expr(a)}, {@code expr(a,b)} or {@code expr(,b)}.
 *
 * @param primary       The expression before the parentheses.
 * @param parenthesized {@code true} if a parenthesised part follows.
 * @param first         The first parenthesised expression, may be {@code null}.
 * @param second        The second parenthesised expression, may be {@code null}.
 */
public record OperandSyntax(Expression primary, boolean parenthesized, Expression first, Expression second) {
}
