package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * { body : a \in S, b \in T }
 *
 */
public class TLASetComprehension extends TLAExpression {

	private final TLAExpression body;
	private final List<TLAQuantifierBound> bounds;

	public TLASetComprehension(SourceLocation location, TLAExpression body, List<TLAQuantifierBound> bounds) {
		super(location);
		this.body = body;
		this.bounds = bounds;
	}

	public TLAExpression getBody() {
		return body;
	}

	public List<TLAQuantifierBound> getBounds() {
		return bounds;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>();
		children.add(body);
		children.addAll(bounds);
		return children;
	}

	@Override
	protected TLASetComprehension rebuild(List<TLANode> children) {
		return new TLASetComprehension(SourceLocation.unknown(), (TLAExpression) children.get(0),
				slice(children, 1, children.size(), TLAQuantifierBound.class));
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
		result = prime * result + ((bounds == null) ? 0 : bounds.hashCode());
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
		TLASetComprehension other = (TLASetComprehension) obj;
		if (body == null) {
			if (other.body != null)
				return false;
		} else if (!body.equals(other.body))
			return false;
		if (bounds == null) {
			if (other.bounds != null)
				return false;
		} else if (!bounds.equals(other.bounds))
			return false;
		return true;
	}

}
