package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 *
 * ASSUME assumption
 *
 */
public class TLAAssumption extends TLAUnit {

	private final TLAExpression assumption;

	public TLAAssumption(SourceLocation location, TLAExpression assumption) {
		super(location);
		this.assumption = assumption;
	}

	public TLAExpression getAssumption() {
		return assumption;
	}

	@Override
	public List<TLANode> getChildren() {
		return Collections.singletonList(assumption);
	}

	@Override
	protected TLAAssumption rebuild(List<TLANode> children) {
		return new TLAAssumption(SourceLocation.unknown(), (TLAExpression) children.get(0));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAUnitVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((assumption == null) ? 0 : assumption.hashCode());
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
		TLAAssumption other = (TLAAssumption) obj;
		if (assumption == null) {
			if (other.assumption != null)
				return false;
		} else if (!assumption.equals(other.assumption))
			return false;
		return true;
	}

}
