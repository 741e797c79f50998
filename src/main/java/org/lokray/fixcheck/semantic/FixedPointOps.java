// File: src/main/java/org/lokray/fixcheck/semantic/FixedPointOps.java
package org.lokray.fixcheck.semantic;

import org.lokray.fixcheck.ast.BinaryOperator;
import org.lokray.fixcheck.error.ExpressionParseException;
import org.lokray.fixcheck.error.InvalidBitSliceException;
import org.lokray.fixcheck.semantic.type.FixedPointType;
import org.lokray.fixcheck.semantic.type.NumberType;

import java.util.List;

/**
 * Per-operator type propagation rules.
 * <p>
 * One immutable instance exists per {@link EvaluationMode}. Advisories are appended to the list the caller
 * passes in; the instance itself holds no state besides its mode.
 */
public final class FixedPointOps
{
	public static final FixedPointOps STRICT = new FixedPointOps(EvaluationMode.STRICT);
	public static final FixedPointOps TRUNCATING = new FixedPointOps(EvaluationMode.TRUNCATING);

	/**
	 * Width assumed for a replication whose count is not a literal.
	 */
	public static final int FALLBACK_WIDTH = 32;

	// Add/sub operands may differ by one fractional bit before it is reported.
	private static final int FRAC_TOLERANCE = 1;

	private final EvaluationMode mode;

	private FixedPointOps(EvaluationMode mode)
	{
		this.mode = mode;
	}

	public static FixedPointOps forMode(EvaluationMode mode)
	{
		return mode == EvaluationMode.TRUNCATING ? TRUNCATING : STRICT;
	}

	public EvaluationMode getMode()
	{
		return mode;
	}

	public FixedPointType binary(BinaryOperator op, FixedPointType left, FixedPointType right, List<String> issues)
	{
		return switch (op)
		{
			case ADD, SUBTRACT -> add(left, right, op, issues);
			case MULTIPLY -> multiply(left, right);
			case DIVIDE -> divide(left, right);
			case SHIFT_LEFT -> shiftLeft(left, right, issues);
			case SHIFT_RIGHT -> shiftRight(left, right, issues);
			case SHIFT_RIGHT_SIGNED -> shiftRightSigned(left, right, issues);
		};
	}

	// --- Arithmetic ---

	public FixedPointType add(FixedPointType left, FixedPointType right, BinaryOperator op, List<String> issues)
	{
		if (left.isFractional() && right.isFractional()
				&& Math.abs(left.getFracBits() - right.getFracBits()) > FRAC_TOLERANCE)
		{
			issues.add(String.format("Fractional bits do not match for %s: %d vs %d", op, left.getFracBits(), right.getFracBits()));
		}

		int bits;
		boolean signed;
		if (mode == EvaluationMode.TRUNCATING)
		{
			bits = Math.max(left.getTotalBits(), right.getTotalBits());
			signed = left.isSigned() && right.isSigned();
		}
		else
		{
			bits = bothFractional(left, right)
					? Math.max(left.getTotalBits(), right.getTotalBits())
					: fractionalOperand(left, right).getTotalBits();
			signed = left.isSigned() || right.isSigned();
		}
		return new FixedPointType(signed, bits, left.getFracBits());
	}

	public FixedPointType multiply(FixedPointType left, FixedPointType right)
	{
		int bits;
		boolean signed;
		if (mode == EvaluationMode.TRUNCATING)
		{
			bits = Math.max(left.getTotalBits(), right.getTotalBits());
			signed = left.isSigned() && right.isSigned();
		}
		else
		{
			bits = bothFractional(left, right)
					? checkedWidth((long) left.getTotalBits() + right.getTotalBits(), "Product")
					: fractionalOperand(left, right).getTotalBits();
			signed = left.isSigned() || right.isSigned();
		}

		int frac = bothFractional(left, right)
				? checkedWidth((long) left.getFracBits() + right.getFracBits(), "Product")
				: fractionalOperand(left, right).getFracBits();
		return new FixedPointType(signed, bits, frac);
	}

	public FixedPointType divide(FixedPointType left, FixedPointType right)
	{
		int bits = bothFractional(left, right)
				? Math.max(left.getTotalBits(), right.getTotalBits())
				: fractionalOperand(left, right).getTotalBits();
		boolean signed = mode == EvaluationMode.TRUNCATING
				? left.isSigned() && right.isSigned()
				: left.isSigned() || right.isSigned();

		int frac = bothFractional(left, right)
				? left.getFracBits() - right.getFracBits()
				: fractionalOperand(left, right).getFracBits();
		if (frac < 0)
		{
			throw new ExpressionParseException(String.format("Division %s / %s leaves %d fractional bits", left, right, frac));
		}
		return new FixedPointType(signed, bits, frac);
	}

	// --- Shifts ---

	public FixedPointType shiftLeft(FixedPointType left, FixedPointType amount, List<String> issues)
	{
		int n = shiftAmount(amount, BinaryOperator.SHIFT_LEFT, issues);
		int bits = checkedWidth((long) left.getTotalBits() + n, "Left shift");
		int frac = left.isFractional() ? checkedWidth((long) left.getFracBits() + n, "Left shift") : 0;
		return new FixedPointType(left.isSigned(), bits, frac);
	}

	public FixedPointType shiftRight(FixedPointType left, FixedPointType amount, List<String> issues)
	{
		if (left.isSigned())
		{
			issues.add("Unsigned right shift on signed type");
		}
		return narrow(left, shiftAmount(amount, BinaryOperator.SHIFT_RIGHT, issues), BinaryOperator.SHIFT_RIGHT);
	}

	public FixedPointType shiftRightSigned(FixedPointType left, FixedPointType amount, List<String> issues)
	{
		if (!left.isSigned())
		{
			issues.add("Signed right shift on unsigned type");
		}
		return narrow(left, shiftAmount(amount, BinaryOperator.SHIFT_RIGHT_SIGNED, issues), BinaryOperator.SHIFT_RIGHT_SIGNED);
	}

	private FixedPointType narrow(FixedPointType left, int n, BinaryOperator op)
	{
		int bits = left.getTotalBits() - n;
		if (bits < 1)
		{
			throw new ExpressionParseException(String.format("Shift %s %d leaves no bits of %s", op, n, left));
		}
		int frac = left.isFractional() ? left.getFracBits() - n : 0;
		if (frac < 0)
		{
			throw new ExpressionParseException(String.format("Shift %s %d drops below the binary point of %s", op, n, left));
		}
		return new FixedPointType(left.isSigned(), bits, frac);
	}

	private static int shiftAmount(FixedPointType amount, BinaryOperator op, List<String> issues)
	{
		if (!(amount instanceof NumberType literal))
		{
			throw new ExpressionParseException("Shift amount for " + op + " must be a constant literal");
		}
		int n = intValue(literal, "Shift amount");
		if (n < 0)
		{
			throw new ExpressionParseException("Shift amount for " + op + " must not be negative: " + n);
		}
		if (n == 0)
		{
			issues.add("Shift by 0 is redundant");
		}
		return n;
	}

	// --- Bit-level constructs ---

	public FixedPointType concatenate(List<FixedPointType> elements)
	{
		long bits = 0;
		FixedPointType last = null;
		for (FixedPointType element : elements)
		{
			// Literals are NumberTypes whose width is the size prefix, or 32 when unsized.
			bits += element.getTotalBits();
			last = element;
		}
		if (last == null)
		{
			throw new ExpressionParseException("Empty concatenation");
		}
		return new FixedPointType(last.isSigned(), checkedWidth(bits, "Concatenation"), last.getFracBits());
	}

	public FixedPointType replicate(FixedPointType count, FixedPointType value)
	{
		if (!(count instanceof NumberType literal))
		{
			return new FixedPointType(false, FALLBACK_WIDTH, 0);
		}
		int n = intValue(literal, "Replication count");
		if (n < 1)
		{
			throw new ExpressionParseException("Replication count must be positive: " + n);
		}
		int bits = checkedWidth((long) n * value.getTotalBits(), "Replication");
		return new FixedPointType(value.isSigned(), bits, value.getFracBits());
	}

	public FixedPointType absolute(FixedPointType operand, List<String> issues)
	{
		if (mode == EvaluationMode.TRUNCATING)
		{
			issues.add("'abs' is not standard Verilog.");
		}
		return operand.asPlainType().withSigned(false);
	}

	public FixedPointType toSigned(FixedPointType operand, boolean sigil, List<String> issues)
	{
		if (!sigil)
		{
			issues.add("Use of 'signed' without $ is not standard Verilog.");
		}
		return operand.asPlainType().withSigned(true);
	}

	public FixedPointType bitwiseNegate(FixedPointType operand)
	{
		return operand.asPlainType();
	}

	/**
	 * {@code name[hi:lo]}. Constant bounds give {@code hi - lo + 1} bits; anything else falls back to the full width.
	 *
	 * @param boundsText the bounds as written, used in the advisory for non-constant bounds
	 */
	public FixedPointType slice(String name, FixedPointType base, FixedPointType high, FixedPointType low, String boundsText, List<String> issues)
	{
		int width;
		if (high instanceof NumberType hi && low instanceof NumberType lo)
		{
			int h = intValue(hi, "Slice bound");
			int l = intValue(lo, "Slice bound");
			long span = (long) h - l + 1;
			if (span <= 0)
			{
				throw new InvalidBitSliceException(name, h, l);
			}
			width = checkedWidth(span, "Bit slice");
		}
		else
		{
			issues.add("Bit slice with non-constant indices: " + name + "[" + boundsText + "]");
			width = base.getTotalBits();
		}
		return new FixedPointType(base.isSigned(), width, base.getFracBits());
	}

	private static boolean bothFractional(FixedPointType left, FixedPointType right)
	{
		return left.isFractional() && right.isFractional();
	}

	/**
	 * The left operand when it is fractional, otherwise the right one.
	 */
	private static FixedPointType fractionalOperand(FixedPointType left, FixedPointType right)
	{
		return left.isFractional() ? left : right;
	}

	private static int checkedWidth(long bits, String what)
	{
		if (bits > Integer.MAX_VALUE)
		{
			throw new ExpressionParseException(what + " width exceeds " + Integer.MAX_VALUE + " bits: " + bits);
		}
		return (int) bits;
	}

	private static int intValue(NumberType literal, String what)
	{
		try
		{
			return literal.getValue().intValueExact();
		}
		catch (ArithmeticException e)
		{
			throw new ExpressionParseException(what + " out of range: " + literal.getValue(), e);
		}
	}
}
