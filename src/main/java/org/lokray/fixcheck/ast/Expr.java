package org.lokray.fixcheck.ast;

/**
 * An immutable expression tree node. Every node kind has a matching method on {@link ExprVisitor},
 * so a visitor that compiles handles every alternative of the grammar.
 */
public interface Expr
{
	<R> R accept(ExprVisitor<R> visitor);
}
