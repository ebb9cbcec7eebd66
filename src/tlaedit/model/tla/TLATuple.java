package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * << e1, e2, ... >>
 *
 */
public class TLATuple extends TLAExpression {

	private final List<TLAExpression> elements;

	public TLATuple(SourceLocation location, List<TLAExpression> elements) {
		super(location);
		this.elements = elements;
	}

	public List<TLAExpression> getElements() {
		return elements;
	}

	@Override
	public List<TLANode> getChildren() {
		return new ArrayList<>(elements);
	}

	@Override
	protected TLATuple rebuild(List<TLANode> children) {
		return new TLATuple(SourceLocation.unknown(), slice(children, 0, children.size(), TLAExpression.class));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((elements == null) ? 0 : elements.hashCode());
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
		TLATuple other = (TLATuple) obj;
		if (elements == null) {
			if (other.elements != null)
				return false;
		} else if (!elements.equals(other.elements))
			return false;
		return true;
	}

}
