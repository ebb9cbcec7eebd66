package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 *
 * AST node:
 *
 * <<body>>_vars
 *
 */
public class TLARequiredAction extends TLAExpression {

	private final TLAExpression body;
	private final TLAExpression vars;

	public TLARequiredAction(SourceLocation location, TLAExpression body, TLAExpression vars) {
		super(location);
		this.body = body;
		this.vars = vars;
	}

	public TLAExpression getBody() {
		return body;
	}

	public TLAExpression getVars() {
		return vars;
	}

	@Override
	public List<TLANode> getChildren() {
		return Arrays.asList(body, vars);
	}

	@Override
	protected TLARequiredAction rebuild(List<TLANode> children) {
		return new TLARequiredAction(SourceLocation.unknown(), (TLAExpression) children.get(0),
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
		result = prime * result + ((body == null) ? 0 : body.hashCode());
		result = prime * result + ((vars == null) ? 0 : vars.hashCode());
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
		TLARequiredAction other = (TLARequiredAction) obj;
		if (body == null) {
			if (other.body != null)
				return false;
		} else if (!body.equals(other.body))
			return false;
		if (vars == null) {
			if (other.vars != null)
				return false;
		} else if (!vars.equals(other.vars))
			return false;
		return true;
	}

}
