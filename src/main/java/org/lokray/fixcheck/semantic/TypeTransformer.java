package org.lokray.fixcheck.semantic;

import org.lokray.fixcheck.ast.*;
import org.lokray.fixcheck.error.ExpressionParseException;
import org.lokray.fixcheck.semantic.type.FixedPointType;
import org.lokray.fixcheck.semantic.type.NumberType;
import org.lokray.fixcheck.semantic.type.TypeParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces an expression tree bottom-up to a {@link ReducedExpr}. Operator rules come from {@link FixedPointOps};
 * this class only walks the tree, resolves names and builds the canonical text.
 * <p>
 * Advisories go to the list handed to the constructor. Use one transformer per expression.
 */
public class TypeTransformer implements ExprVisitor<ReducedExpr>
{
	private final IdentifierTable table;
	private final FixedPointOps ops;
	private final List<String> issues;

	public TypeTransformer(IdentifierTable table, FixedPointOps ops, List<String> issues)
	{
		this.table = table;
		this.ops = ops;
		this.issues = issues;
	}

	public ReducedExpr reduce(Expr expr)
	{
		return expr.accept(this);
	}

	@Override
	public ReducedExpr visitNumber(NumberLiteral node)
	{
		if (node.isDecimal())
		{
			throw new ExpressionParseException("Decimal literal " + node.getText() + " has no fixed-point width; annotate it with a type");
		}
		return new ReducedExpr(new NumberType(node.getValue(), node.isSigned(), node.getWidth()), node.getText());
	}

	@Override
	public ReducedExpr visitIdentifier(Identifier node)
	{
		return new ReducedExpr(table.lookup(node.getName()), node.getName());
	}

	@Override
	public ReducedExpr visitTypeAnnotation(TypeAnnotation node)
	{
		FixedPointType declared = TypeParser.parseType(node.getTypeToken());

		// A literal has no type of its own worth checking; the annotation defines it.
		if (node.getOperand() instanceof NumberLiteral literal)
		{
			return new ReducedExpr(declared, node.getTypeToken() + " " + literal.getText());
		}

		ReducedExpr operand = reduce(node.getOperand());
		if (!declared.equals(operand.getType()))
		{
			issues.add(String.format("Type annotation mismatch for '%s': declared %s, computed %s",
					operand.getText(), declared, operand.getType()));
		}
		return new ReducedExpr(operand.getType(), node.getTypeToken() + " " + operand.getText());
	}

	@Override
	public ReducedExpr visitParenthesized(Parenthesized node)
	{
		ReducedExpr inner = reduce(node.getInner());
		return new ReducedExpr(inner.getType(), "(" + inner.getText() + ")");
	}

	@Override
	public ReducedExpr visitConcatenation(Concatenation node)
	{
		List<FixedPointType> types = new ArrayList<>();
		List<String> texts = new ArrayList<>();
		for (Expr element : node.getElements())
		{
			ReducedExpr reduced = reduce(element);
			types.add(reduced.getType());
			texts.add(reduced.getText());
		}
		return new ReducedExpr(ops.concatenate(types), "{" + String.join(", ", texts) + "}");
	}

	@Override
	public ReducedExpr visitReplication(Replication node)
	{
		ReducedExpr count = reduce(node.getCount());
		ReducedExpr value = reduce(node.getValue());
		return new ReducedExpr(ops.replicate(count.getType(), value.getType()),
				"{" + count.getText() + "{" + value.getText() + "}}");
	}

	@Override
	public ReducedExpr visitAbsoluteValue(AbsoluteValue node)
	{
		ReducedExpr operand = reduce(node.getOperand());
		return new ReducedExpr(ops.absolute(operand.getType(), issues), "abs(" + operand.getText() + ")");
	}

	@Override
	public ReducedExpr visitSignedCast(SignedCast node)
	{
		ReducedExpr operand = reduce(node.getOperand());
		return new ReducedExpr(ops.toSigned(operand.getType(), node.hasSigil(), issues), "$signed(" + operand.getText() + ")");
	}

	@Override
	public ReducedExpr visitArrayAccess(ArrayAccess node)
	{
		FixedPointType element = table.lookup(node.getName());
		// The index only has to be well-formed; its type does not affect the element type.
		ReducedExpr index = reduce(node.getIndex());
		return new ReducedExpr(element, node.getName() + "[" + index.getText() + "]");
	}

	@Override
	public ReducedExpr visitBitSlice(BitSlice node)
	{
		FixedPointType base = table.lookup(node.getName());
		ReducedExpr high = reduce(node.getHigh());
		ReducedExpr low = reduce(node.getLow());
		String bounds = high.getText() + ":" + low.getText();
		FixedPointType sliced = ops.slice(node.getName(), base, high.getType(), low.getType(), bounds, issues);
		return new ReducedExpr(sliced, node.getName() + "[" + bounds + "]");
	}

	@Override
	public ReducedExpr visitBitwiseNegate(BitwiseNegate node)
	{
		ReducedExpr operand = reduce(node.getOperand());
		return new ReducedExpr(ops.bitwiseNegate(operand.getType()), "~" + operand.getText());
	}

	@Override
	public ReducedExpr visitBinaryAdditive(BinaryAdditive node)
	{
		return binary(node);
	}

	@Override
	public ReducedExpr visitBinaryMultiplicative(BinaryMultiplicative node)
	{
		return binary(node);
	}

	@Override
	public ReducedExpr visitBinaryShift(BinaryShift node)
	{
		return binary(node);
	}

	private ReducedExpr binary(BinaryExpr node)
	{
		ReducedExpr left = reduce(node.getLeft());
		ReducedExpr right = reduce(node.getRight());
		FixedPointType result = ops.binary(node.getOperator(), left.getType(), right.getType(), issues);
		return new ReducedExpr(result, "(" + left.getText() + " " + node.getOperator() + " " + right.getText() + ")");
	}
}
