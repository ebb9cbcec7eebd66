package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * CASE p1 -> e1 [] p2 -> e2 [] OTHER -> e3
 *
 */
public class TLACase extends TLAExpression {

	private final List<TLACaseArm> arms;
	private final TLAExpression other;

	public TLACase(SourceLocation location, List<TLACaseArm> arms, TLAExpression other) {
		super(location);
		this.arms = arms;
		this.other = other;
	}

	public List<TLACaseArm> getArms() {
		return arms;
	}

	/**
	 * @return the OTHER arm, or null
	 */
	public TLAExpression getOther() {
		return other;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>(arms);
		if (other != null) {
			children.add(other);
		}
		return children;
	}

	@Override
	protected TLACase rebuild(List<TLANode> children) {
		int armCount = other != null ? children.size() - 1 : children.size();
		return new TLACase(SourceLocation.unknown(), slice(children, 0, armCount, TLACaseArm.class),
				other != null ? (TLAExpression) children.get(armCount) : null);
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((arms == null) ? 0 : arms.hashCode());
		result = prime * result + ((this.other == null) ? 0 : this.other.hashCode());
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
		TLACase other = (TLACase) obj;
		if (arms == null) {
			if (other.arms != null)
				return false;
		} else if (!arms.equals(other.arms))
			return false;
		if (this.other == null) {
			if (other.other != null)
				return false;
		} else if (!this.other.equals(other.other))
			return false;
		return true;
	}

}
