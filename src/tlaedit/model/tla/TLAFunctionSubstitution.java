package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * [source EXCEPT ![k1] = v1, !.f = v2]
 *
 */
public class TLAFunctionSubstitution extends TLAExpression {

	private final TLAExpression source;
	private final List<TLAFunctionSubstitutionPair> substitutions;

	public TLAFunctionSubstitution(SourceLocation location, TLAExpression source,
	                               List<TLAFunctionSubstitutionPair> substitutions) {
		super(location);
		this.source = source;
		this.substitutions = substitutions;
	}

	public TLAExpression getSource() {
		return source;
	}

	public List<TLAFunctionSubstitutionPair> getSubstitutions() {
		return substitutions;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>();
		children.add(source);
		children.addAll(substitutions);
		return children;
	}

	@Override
	protected TLAFunctionSubstitution rebuild(List<TLANode> children) {
		return new TLAFunctionSubstitution(SourceLocation.unknown(), (TLAExpression) children.get(0),
				slice(children, 1, children.size(), TLAFunctionSubstitutionPair.class));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((source == null) ? 0 : source.hashCode());
		result = prime * result + ((substitutions == null) ? 0 : substitutions.hashCode());
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
		TLAFunctionSubstitution other = (TLAFunctionSubstitution) obj;
		if (source == null) {
			if (other.source != null)
				return false;
		} else if (!source.equals(other.source))
			return false;
		if (substitutions == null) {
			if (other.substitutions != null)
				return false;
		} else if (!substitutions.equals(other.substitutions))
			return false;
		return true;
	}

}
