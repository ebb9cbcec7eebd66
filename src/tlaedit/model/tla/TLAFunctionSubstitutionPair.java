package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * One {@code ![a][b].c = value} entry of an EXCEPT
 *
 */
public class TLAFunctionSubstitutionPair extends TLANode {

	private final List<TLASubstitutionKey> keys;
	private final TLAExpression value;

	public TLAFunctionSubstitutionPair(SourceLocation location, List<TLASubstitutionKey> keys, TLAExpression value) {
		super(location);
		this.keys = keys;
		this.value = value;
	}

	public List<TLASubstitutionKey> getKeys() {
		return keys;
	}

	public TLAExpression getValue() {
		return value;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>(keys);
		children.add(value);
		return children;
	}

	@Override
	protected TLAFunctionSubstitutionPair rebuild(List<TLANode> children) {
		return new TLAFunctionSubstitutionPair(SourceLocation.unknown(),
				slice(children, 0, children.size() - 1, TLASubstitutionKey.class),
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
		result = prime * result + ((keys == null) ? 0 : keys.hashCode());
		result = prime * result + ((value == null) ? 0 : value.hashCode());
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
		TLAFunctionSubstitutionPair other = (TLAFunctionSubstitutionPair) obj;
		if (keys == null) {
			if (other.keys != null)
				return false;
		} else if (!keys.equals(other.keys))
			return false;
		if (value == null) {
			if (other.value != null)
				return false;
		} else if (!value.equals(other.value))
			return false;
		return true;
	}

}
