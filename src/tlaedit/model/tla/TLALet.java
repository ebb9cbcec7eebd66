package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * LET op(a, b) == ...
 *     f[x \in S] == ...
 * IN body
 *
 */
public class TLALet extends TLAExpression {

	private final List<TLAUnit> definitions;
	private final TLAExpression body;

	public TLALet(SourceLocation location, List<TLAUnit> definitions, TLAExpression body) {
		super(location);
		this.definitions = definitions;
		this.body = body;
	}

	public List<TLAUnit> getDefinitions() {
		return definitions;
	}

	public TLAExpression getBody() {
		return body;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>(definitions);
		children.add(body);
		return children;
	}

	@Override
	protected TLALet rebuild(List<TLANode> children) {
		return new TLALet(SourceLocation.unknown(), slice(children, 0, children.size() - 1, TLAUnit.class),
				(TLAExpression) children.get(children.size() - 1));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((definitions == null) ? 0 : definitions.hashCode());
		result = prime * result + ((body == null) ? 0 : body.hashCode());
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
		TLALet other = (TLALet) obj;
		if (definitions == null) {
			if (other.definitions != null)
				return false;
		} else if (!definitions.equals(other.definitions))
			return false;
		if (body == null) {
			if (other.body != null)
				return false;
		} else if (!body.equals(other.body))
			return false;
		return true;
	}

}
