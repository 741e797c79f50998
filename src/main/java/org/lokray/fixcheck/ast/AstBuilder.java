// File: src/main/java/org/lokray/fixcheck/ast/AstBuilder.java
package org.lokray.fixcheck.ast;

import org.lokray.fixcheck.parser.FixedPointExpressionBaseVisitor;
import org.lokray.fixcheck.parser.FixedPointExpressionParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the ANTLR parse tree into the immutable {@link Expr} tree.
 * Operator chains are folded left-associatively, one precedence level at a time.
 */
public class AstBuilder extends FixedPointExpressionBaseVisitor<Expr>
{
	@Override
	public Expr visitExpression(FixedPointExpressionParser.ExpressionContext ctx)
	{
		return visit(ctx.additive());
	}

	@Override
	public Expr visitAdditive(FixedPointExpressionParser.AdditiveContext ctx)
	{
		Expr result = visit(ctx.multiplicative(0));
		for (int i = 0; i < ctx.addOp().size(); i++)
		{
			BinaryOperator op = BinaryOperator.fromSymbol(ctx.addOp(i).getText());
			result = new BinaryAdditive(result, op, visit(ctx.multiplicative(i + 1)));
		}
		return result;
	}

	@Override
	public Expr visitMultiplicative(FixedPointExpressionParser.MultiplicativeContext ctx)
	{
		Expr result = visit(ctx.shift(0));
		for (int i = 0; i < ctx.mulOp().size(); i++)
		{
			BinaryOperator op = BinaryOperator.fromSymbol(ctx.mulOp(i).getText());
			result = new BinaryMultiplicative(result, op, visit(ctx.shift(i + 1)));
		}
		return result;
	}

	@Override
	public Expr visitShift(FixedPointExpressionParser.ShiftContext ctx)
	{
		Expr result = visit(ctx.atom(0));
		for (int i = 0; i < ctx.shiftOp().size(); i++)
		{
			BinaryOperator op = BinaryOperator.fromSymbol(ctx.shiftOp(i).getText());
			result = new BinaryShift(result, op, visit(ctx.atom(i + 1)));
		}
		return result;
	}

	// --- Atoms ---

	@Override
	public Expr visitTypeAnnotatedAtom(FixedPointExpressionParser.TypeAnnotatedAtomContext ctx)
	{
		return new TypeAnnotation(ctx.TYPE().getText(), visit(ctx.typedOperand()));
	}

	@Override
	public Expr visitTypedOperand(FixedPointExpressionParser.TypedOperandContext ctx)
	{
		if (ctx.arrayAccess() != null)
		{
			return visit(ctx.arrayAccess());
		}
		if (ctx.number() != null)
		{
			return visit(ctx.number());
		}
		return new Identifier(ctx.IDENT().getText());
	}

	@Override
	public Expr visitNumberAtom(FixedPointExpressionParser.NumberAtomContext ctx)
	{
		return visit(ctx.number());
	}

	@Override
	public Expr visitNumber(FixedPointExpressionParser.NumberContext ctx)
	{
		return LiteralParser.parse(ctx.getText());
	}

	@Override
	public Expr visitArrayAccessAtom(FixedPointExpressionParser.ArrayAccessAtomContext ctx)
	{
		return visit(ctx.arrayAccess());
	}

	@Override
	public Expr visitIdentifierAtom(FixedPointExpressionParser.IdentifierAtomContext ctx)
	{
		return new Identifier(ctx.IDENT().getText());
	}

	@Override
	public Expr visitParenthesizedAtom(FixedPointExpressionParser.ParenthesizedAtomContext ctx)
	{
		return new Parenthesized(visit(ctx.additive()));
	}

	@Override
	public Expr visitReplicationAtom(FixedPointExpressionParser.ReplicationAtomContext ctx)
	{
		return new Replication(visit(ctx.additive(0)), visit(ctx.additive(1)));
	}

	@Override
	public Expr visitConcatenationAtom(FixedPointExpressionParser.ConcatenationAtomContext ctx)
	{
		List<Expr> elements = new ArrayList<>();
		for (FixedPointExpressionParser.AdditiveContext element : ctx.additive())
		{
			elements.add(visit(element));
		}
		return new Concatenation(elements);
	}

	@Override
	public Expr visitAbsAtom(FixedPointExpressionParser.AbsAtomContext ctx)
	{
		return new AbsoluteValue(visit(ctx.additive()));
	}

	@Override
	public Expr visitSignedAtom(FixedPointExpressionParser.SignedAtomContext ctx)
	{
		return new SignedCast(visit(ctx.additive()), ctx.DOLLAR_SIGNED() != null);
	}

	@Override
	public Expr visitBitNegateAtom(FixedPointExpressionParser.BitNegateAtomContext ctx)
	{
		return new BitwiseNegate(visit(ctx.additive()));
	}

	@Override
	public Expr visitIndexAccess(FixedPointExpressionParser.IndexAccessContext ctx)
	{
		return new ArrayAccess(ctx.IDENT().getText(), visit(ctx.additive()));
	}

	@Override
	public Expr visitSliceAccess(FixedPointExpressionParser.SliceAccessContext ctx)
	{
		return new BitSlice(ctx.IDENT().getText(), visit(ctx.additive(0)), visit(ctx.additive(1)));
	}
}
