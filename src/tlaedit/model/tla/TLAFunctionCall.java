package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * function[p1, p2, ...]
 *
 */
public class TLAFunctionCall extends TLAExpression {

	private final TLAExpression function;
	private final List<TLAExpression> params;

	public TLAFunctionCall(SourceLocation location, TLAExpression function, List<TLAExpression> params) {
		super(location);
		this.function = function;
		this.params = params;
	}

	public TLAExpression getFunction() {
		return function;
	}

	public List<TLAExpression> getParams() {
		return params;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>();
		children.add(function);
		children.addAll(params);
		return children;
	}

	@Override
	protected TLAFunctionCall rebuild(List<TLANode> children) {
		return new TLAFunctionCall(SourceLocation.unknown(), (TLAExpression) children.get(0),
				slice(children, 1, children.size(), TLAExpression.class));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((function == null) ? 0 : function.hashCode());
		result = prime * result + ((params == null) ? 0 : params.hashCode());
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
		TLAFunctionCall other = (TLAFunctionCall) obj;
		if (function == null) {
			if (other.function != null)
				return false;
		} else if (!function.equals(other.function))
			return false;
		if (params == null) {
			if (other.params != null)
				return false;
		} else if (!params.equals(other.params))
			return false;
		return true;
	}

}
