package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * CONSTANTS N, Procs
 *
 */
public class TLAConstantDeclaration extends TLAUnit {

	private final List<TLAIdentifier> constants;

	public TLAConstantDeclaration(SourceLocation location, List<TLAIdentifier> constants) {
		super(location);
		this.constants = constants;
	}

	public List<TLAIdentifier> getConstants() {
		return constants;
	}

	@Override
	public List<TLANode> getChildren() {
		return new ArrayList<>(constants);
	}

	@Override
	protected TLAConstantDeclaration rebuild(List<TLANode> children) {
		return new TLAConstantDeclaration(SourceLocation.unknown(),
				slice(children, 0, children.size(), TLAIdentifier.class));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAUnitVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((constants == null) ? 0 : constants.hashCode());
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
		TLAConstantDeclaration other = (TLAConstantDeclaration) obj;
		if (constants == null) {
			if (other.constants != null)
				return false;
		} else if (!constants.equals(other.constants))
			return false;
		return true;
	}

}
