package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 *
 * AST node:
 *
 * WF_vars(action)
 * SF_vars(action)
 *
 */
public class TLAFairness extends TLAExpression {

	public enum Type {
		WEAK("WF_"),
		STRONG("SF_");

		private final String keyword;

		Type(String keyword) {
			this.keyword = keyword;
		}

		public String getKeyword() {
			return keyword;
		}
	}

	private final Type type;
	private final TLAExpression vars;
	private final TLAExpression expression;

	public TLAFairness(SourceLocation location, Type type, TLAExpression vars, TLAExpression expression) {
		super(location);
		this.type = type;
		this.vars = vars;
		this.expression = expression;
	}

	public Type getType() {
		return type;
	}

	public TLAExpression getVars() {
		return vars;
	}

	public TLAExpression getExpression() {
		return expression;
	}

	@Override
	public List<TLANode> getChildren() {
		return Arrays.asList(vars, expression);
	}

	@Override
	protected TLAFairness rebuild(List<TLANode> children) {
		return new TLAFairness(SourceLocation.unknown(), type, (TLAExpression) children.get(0),
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
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((vars == null) ? 0 : vars.hashCode());
		result = prime * result + ((expression == null) ? 0 : expression.hashCode());
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
		TLAFairness other = (TLAFairness) obj;
		if (type != other.type)
			return false;
		if (vars == null) {
			if (other.vars != null)
				return false;
		} else if (!vars.equals(other.vars))
			return false;
		if (expression == null) {
			if (other.expression != null)
				return false;
		} else if (!expression.equals(other.expression))
			return false;
		return true;
	}

}
