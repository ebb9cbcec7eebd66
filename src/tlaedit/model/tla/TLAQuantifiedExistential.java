package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * \E a, b \in S, c \in T : body
 *
 */
public class TLAQuantifiedExistential extends TLAExpression {

	private final List<TLAQuantifierBound> bounds;
	private final TLAExpression body;

	public TLAQuantifiedExistential(SourceLocation location, List<TLAQuantifierBound> bounds, TLAExpression body) {
		super(location);
		this.bounds = bounds;
		this.body = body;
	}

	public List<TLAQuantifierBound> getBounds() {
		return bounds;
	}

	public TLAExpression getBody() {
		return body;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>(bounds);
		children.add(body);
		return children;
	}

	@Override
	protected TLAQuantifiedExistential rebuild(List<TLANode> children) {
		return new TLAQuantifiedExistential(SourceLocation.unknown(),
				slice(children, 0, children.size() - 1, TLAQuantifierBound.class),
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
		result = prime * result + ((bounds == null) ? 0 : bounds.hashCode());
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
		TLAQuantifiedExistential other = (TLAQuantifiedExistential) obj;
		if (bounds == null) {
			if (other.bounds != null)
				return false;
		} else if (!bounds.equals(other.bounds))
			return false;
		if (body == null) {
			if (other.body != null)
				return false;
		} else if (!body.equals(other.body))
			return false;
		return true;
	}

}
