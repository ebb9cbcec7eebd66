package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * { e1, e2, ... }
 *
 */
public class TLASetConstructor extends TLAExpression {

	private final List<TLAExpression> contents;

	public TLASetConstructor(SourceLocation location, List<TLAExpression> contents) {
		super(location);
		this.contents = contents;
	}

	public List<TLAExpression> getContents() {
		return contents;
	}

	@Override
	public List<TLANode> getChildren() {
		return new ArrayList<>(contents);
	}

	@Override
	protected TLASetConstructor rebuild(List<TLANode> children) {
		return new TLASetConstructor(SourceLocation.unknown(), slice(children, 0, children.size(), TLAExpression.class));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((contents == null) ? 0 : contents.hashCode());
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
		TLASetConstructor other = (TLASetConstructor) obj;
		if (contents == null) {
			if (other.contents != null)
				return false;
		} else if (!contents.equals(other.contents))
			return false;
		return true;
	}

}
