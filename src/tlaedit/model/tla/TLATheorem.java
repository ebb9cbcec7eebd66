package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 *
 * THEOREM theorem
 *
 */
public class TLATheorem extends TLAUnit {

	private final TLAExpression theorem;

	public TLATheorem(SourceLocation location, TLAExpression theorem) {
		super(location);
		this.theorem = theorem;
	}

	public TLAExpression getTheorem() {
		return theorem;
	}

	@Override
	public List<TLANode> getChildren() {
		return Collections.singletonList(theorem);
	}

	@Override
	protected TLATheorem rebuild(List<TLANode> children) {
		return new TLATheorem(SourceLocation.unknown(), (TLAExpression) children.get(0));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAUnitVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((theorem == null) ? 0 : theorem.hashCode());
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
		TLATheorem other = (TLATheorem) obj;
		if (theorem == null) {
			if (other.theorem != null)
				return false;
		} else if (!theorem.equals(other.theorem))
			return false;
		return true;
	}

}
