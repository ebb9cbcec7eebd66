package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * One step of an EXCEPT path: either an index {@code [a, b]} or a field {@code .name}
 *
 */
public class TLASubstitutionKey extends TLANode {

	private final List<TLAExpression> indices;
	private final TLAIdentifier field;

	public TLASubstitutionKey(SourceLocation location, List<TLAExpression> indices) {
		super(location);
		this.indices = indices;
		this.field = null;
	}

	public TLASubstitutionKey(SourceLocation location, TLAIdentifier field) {
		super(location);
		this.indices = Collections.emptyList();
		this.field = field;
	}

	public List<TLAExpression> getIndices() {
		return indices;
	}

	/**
	 * @return the field name for a {@code .name} step, or null for an index step
	 */
	public TLAIdentifier getField() {
		return field;
	}

	@Override
	public List<TLANode> getChildren() {
		if (field != null) {
			return Collections.singletonList(field);
		}
		return new ArrayList<>(indices);
	}

	@Override
	protected TLASubstitutionKey rebuild(List<TLANode> children) {
		if (field != null) {
			return new TLASubstitutionKey(SourceLocation.unknown(), (TLAIdentifier) children.get(0));
		}
		return new TLASubstitutionKey(SourceLocation.unknown(),
				slice(children, 0, children.size(), TLAExpression.class));
	}

	@Override
	public <T, E extends Throwable> T accept(TLANodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((indices == null) ? 0 : indices.hashCode());
		result = prime * result + ((field == null) ? 0 : field.hashCode());
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
		TLASubstitutionKey other = (TLASubstitutionKey) obj;
		if (indices == null) {
			if (other.indices != null)
				return false;
		} else if (!indices.equals(other.indices))
			return false;
		if (field == null) {
			if (other.field != null)
				return false;
		} else if (!field.equals(other.field))
			return false;
		return true;
	}

}
