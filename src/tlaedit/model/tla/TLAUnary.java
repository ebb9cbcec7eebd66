package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 *
 * AST node: a prefix operator such as {@code ~}, {@code UNCHANGED} or {@code []}, or a postfix
 * operator such as the prime
 *
 * <op> operand
 * operand <op>
 *
 */
public class TLAUnary extends TLAExpression {

	private final TLASymbol operation;
	private final TLAExpression operand;
	private final boolean postfix;

	public TLAUnary(SourceLocation location, TLASymbol operation, TLAExpression operand, boolean postfix) {
		super(location);
		this.operation = operation;
		this.operand = operand;
		this.postfix = postfix;
	}

	public TLASymbol getOperation() {
		return operation;
	}

	public TLAExpression getOperand() {
		return operand;
	}

	public boolean isPostfix() {
		return postfix;
	}

	public boolean isPrime() {
		return postfix && operation.getValue().equals("'");
	}

	public boolean isUnchanged() {
		return !postfix && operation.getValue().equals("UNCHANGED");
	}

	@Override
	public List<TLANode> getChildren() {
		return Collections.singletonList(operand);
	}

	@Override
	protected TLAUnary rebuild(List<TLANode> children) {
		return new TLAUnary(SourceLocation.unknown(), operation, (TLAExpression) children.get(0), postfix);
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((operation == null) ? 0 : operation.hashCode());
		result = prime * result + ((operand == null) ? 0 : operand.hashCode());
		result = prime * result + (postfix ? 1231 : 1237);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TLAUnary other = (TLAUnary) obj;
		if (operation == null) {
			if (other.operation != null)
				return false;
		} else if (!operation.equals(other.operation))
			return false;
		if (operand == null) {
			if (other.operand != null)
				return false;
		} else if (!operand.equals(other.operand))
			return false;
		if (postfix != other.postfix)
			return false;
		return true;
	}

}
