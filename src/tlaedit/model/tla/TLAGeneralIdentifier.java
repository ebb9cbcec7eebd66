package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 *
 * A reference to a variable, constant, bound name or argument-less definition
 *
 */
public class TLAGeneralIdentifier extends TLAExpression {

	private final TLAIdentifier name;

	public TLAGeneralIdentifier(SourceLocation location, TLAIdentifier name) {
		super(location);
		this.name = name;
	}

	public TLAIdentifier getName() {
		return name;
	}

	@Override
	public List<TLANode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	protected TLAGeneralIdentifier rebuild(List<TLANode> children) {
		return new TLAGeneralIdentifier(SourceLocation.unknown(), name);
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((name == null) ? 0 : name.hashCode());
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
		TLAGeneralIdentifier other = (TLAGeneralIdentifier) obj;
		if (name == null) {
			if (other.name != null)
				return false;
		} else if (!name.equals(other.name))
			return false;
		return true;
	}

}
