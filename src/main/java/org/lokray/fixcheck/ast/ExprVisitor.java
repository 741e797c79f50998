package org.lokray.fixcheck.ast;

public interface ExprVisitor<R>
{
	R visitNumber(NumberLiteral node);

	R visitIdentifier(Identifier node);

	R visitTypeAnnotation(TypeAnnotation node);

	R visitParenthesized(Parenthesized node);

	R visitConcatenation(Concatenation node);

	R visitReplication(Replication node);

	R visitAbsoluteValue(AbsoluteValue node);

	R visitSignedCast(SignedCast node);

	R visitArrayAccess(ArrayAccess node);

	R visitBitSlice(BitSlice node);

	R visitBitwiseNegate(BitwiseNegate node);

	R visitBinaryAdditive(BinaryAdditive node);

	R visitBinaryMultiplicative(BinaryMultiplicative node);

	R visitBinaryShift(BinaryShift node);
}
