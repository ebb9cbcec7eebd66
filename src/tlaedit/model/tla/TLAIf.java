package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 *
 * AST node:
 *
 * IF cond THEN tval ELSE fval
 *
 */
public class TLAIf extends TLAExpression {

	private final TLAExpression cond;
	private final TLAExpression tval;
	private final TLAExpression fval;

	public TLAIf(SourceLocation location, TLAExpression cond, TLAExpression tval, TLAExpression fval) {
		super(location);
		this.cond = cond;
		this.tval = tval;
		this.fval = fval;
	}

	public TLAExpression getCond() {
		return cond;
	}

	public TLAExpression getTval() {
		return tval;
	}

	public TLAExpression getFval() {
		return fval;
	}

	@Override
	public List<TLANode> getChildren() {
		return Arrays.asList(cond, tval, fval);
	}

	@Override
	protected TLAIf rebuild(List<TLANode> children) {
		return new TLAIf(SourceLocation.unknown(), (TLAExpression) children.get(0),
				(TLAExpression) children.get(1), (TLAExpression) children.get(2));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((cond == null) ? 0 : cond.hashCode());
		result = prime * result + ((tval == null) ? 0 : tval.hashCode());
		result = prime * result + ((fval == null) ? 0 : fval.hashCode());
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
		TLAIf other = (TLAIf) obj;
		if (cond == null) {
			if (other.cond != null)
				return false;
		} else if (!cond.equals(other.cond))
			return false;
		if (tval == null) {
			if (other.tval != null)
				return false;
		} else if (!tval.equals(other.tval))
			return false;
		if (fval == null) {
			if (other.fval != null)
				return false;
		} else if (!fval.equals(other.fval))
			return false;
		return true;
	}

}
