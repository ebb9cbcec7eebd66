package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * VARIABLES a, b, c
 *
 */
public class TLAVariableDeclaration extends TLAUnit {

	private final List<TLAIdentifier> variables;

	public TLAVariableDeclaration(SourceLocation location, List<TLAIdentifier> variables) {
		super(location);
		this.variables = variables;
	}

	public List<TLAIdentifier> getVariables() {
		return variables;
	}

	@Override
	public List<TLANode> getChildren() {
		return new ArrayList<>(variables);
	}

	@Override
	protected TLAVariableDeclaration rebuild(List<TLANode> children) {
		return new TLAVariableDeclaration(SourceLocation.unknown(),
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
		result = prime * result + ((variables == null) ? 0 : variables.hashCode());
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
		TLAVariableDeclaration other = (TLAVariableDeclaration) obj;
		if (variables == null) {
			if (other.variables != null)
				return false;
		} else if (!variables.equals(other.variables))
			return false;
		return true;
	}

}
