package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * One binder of a quantifier, function constructor or set comprehension:
 *
 * a, b \in S
 *
 */
public class TLAQuantifierBound extends TLANode {

	private final List<TLAIdentifier> ids;
	private final TLAExpression set;

	public TLAQuantifierBound(SourceLocation location, List<TLAIdentifier> ids, TLAExpression set) {
		super(location);
		this.ids = ids;
		this.set = set;
	}

	public List<TLAIdentifier> getIds() {
		return ids;
	}

	public TLAExpression getSet() {
		return set;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>(ids);
		children.add(set);
		return children;
	}

	@Override
	protected TLAQuantifierBound rebuild(List<TLANode> children) {
		return new TLAQuantifierBound(SourceLocation.unknown(),
				slice(children, 0, children.size() - 1, TLAIdentifier.class),
				(TLAExpression) children.get(children.size() - 1));
	}

	@Override
	public <T, E extends Throwable> T accept(TLANodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((ids == null) ? 0 : ids.hashCode());
		result = prime * result + ((set == null) ? 0 : set.hashCode());
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
		TLAQuantifierBound other = (TLAQuantifierBound) obj;
		if (ids == null) {
			if (other.ids != null)
				return false;
		} else if (!ids.equals(other.ids))
			return false;
		if (set == null) {
			if (other.set != null)
				return false;
		} else if (!set.equals(other.set))
			return false;
		return true;
	}

}
