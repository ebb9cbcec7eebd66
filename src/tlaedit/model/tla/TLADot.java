package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 *
 * AST node:
 *
 * expression.field
 *
 */
public class TLADot extends TLAExpression {

	private final TLAExpression expression;
	private final TLAIdentifier field;

	public TLADot(SourceLocation location, TLAExpression expression, TLAIdentifier field) {
		super(location);
		this.expression = expression;
		this.field = field;
	}

	public TLAExpression getExpression() {
		return expression;
	}

	public TLAIdentifier getField() {
		return field;
	}

	@Override
	public List<TLANode> getChildren() {
		return Arrays.asList(expression, field);
	}

	@Override
	protected TLADot rebuild(List<TLANode> children) {
		return new TLADot(SourceLocation.unknown(), (TLAExpression) children.get(0),
				(TLAIdentifier) children.get(1));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((expression == null) ? 0 : expression.hashCode());
		result = prime * result + ((field == null) ? 0 : field.hashCode());
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
		TLADot other = (TLADot) obj;
		if (expression == null) {
			if (other.expression != null)
				return false;
		} else if (!expression.equals(other.expression))
			return false;
		if (field == null) {
			if (other.field != null)
				return false;
		} else if (!field.equals(other.field))
			return false;
		return true;
	}

}
