package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 *
 * AST node:
 *
 * [from -> to]
 *
 */
public class TLAFunctionSet extends TLAExpression {

	private final TLAExpression from;
	private final TLAExpression to;

	public TLAFunctionSet(SourceLocation location, TLAExpression from, TLAExpression to) {
		super(location);
		this.from = from;
		this.to = to;
	}

	public TLAExpression getFrom() {
		return from;
	}

	public TLAExpression getTo() {
		return to;
	}

	@Override
	public List<TLANode> getChildren() {
		return Arrays.asList(from, to);
	}

	@Override
	protected TLAFunctionSet rebuild(List<TLANode> children) {
		return new TLAFunctionSet(SourceLocation.unknown(), (TLAExpression) children.get(0),
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
		result = prime * result + ((from == null) ? 0 : from.hashCode());
		result = prime * result + ((to == null) ? 0 : to.hashCode());
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
		TLAFunctionSet other = (TLAFunctionSet) obj;
		if (from == null) {
			if (other.from != null)
				return false;
		} else if (!from.equals(other.from))
			return false;
		if (to == null) {
			if (other.to != null)
				return false;
		} else if (!to.equals(other.to))
			return false;
		return true;
	}

}
