package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 *
 * AST node:
 *
 * lhs <op> rhs
 *
 */
public class TLABinOp extends TLAExpression {

	private final TLAExpression lhs;
	private final TLAExpression rhs;
	private final TLASymbol op;

	public TLABinOp(SourceLocation location, TLASymbol op, TLAExpression lhs, TLAExpression rhs) {
		super(location);
		this.lhs = lhs;
		this.rhs = rhs;
		this.op = op;
	}

	public TLASymbol getOperation() {
		return op;
	}

	public TLAExpression getLHS() {
		return lhs;
	}

	public TLAExpression getRHS() {
		return rhs;
	}

	@Override
	public List<TLANode> getChildren() {
		return Arrays.asList(lhs, rhs);
	}

	@Override
	protected TLABinOp rebuild(List<TLANode> children) {
		return new TLABinOp(SourceLocation.unknown(), op, (TLAExpression) children.get(0),
				(TLAExpression) children.get(1));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((lhs == null) ? 0 : lhs.hashCode());
		result = prime * result + ((op == null) ? 0 : op.hashCode());
		result = prime * result + ((rhs == null) ? 0 : rhs.hashCode());
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
		TLABinOp other = (TLABinOp) obj;
		if (lhs == null) {
			if (other.lhs != null)
				return false;
		} else if (!lhs.equals(other.lhs))
			return false;
		if (op == null) {
			if (other.op != null)
				return false;
		} else if (!op.equals(other.op))
			return false;
		if (rhs == null) {
			if (other.rhs != null)
				return false;
		} else if (!rhs.equals(other.rhs))
			return false;
		return true;
	}

}
