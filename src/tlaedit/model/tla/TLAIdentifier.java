package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 *
 * AST node representing a single identifier, as it appears in declarations and binders.
 *
 */
public class TLAIdentifier extends TLANode {

	private final String id;

	public TLAIdentifier(SourceLocation location, String id) {
		super(location);
		this.id = id;
	}

	public String getId() {
		return id;
	}

	@Override
	public List<TLANode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	protected TLAIdentifier rebuild(List<TLANode> children) {
		return new TLAIdentifier(SourceLocation.unknown(), id);
	}

	@Override
	public <T, E extends Throwable> T accept(TLANodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((id == null) ? 0 : id.hashCode());
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
		TLAIdentifier other = (TLAIdentifier) obj;
		if (id == null) {
			if (other.id != null)
				return false;
		} else if (!id.equals(other.id))
			return false;
		return true;
	}

}
