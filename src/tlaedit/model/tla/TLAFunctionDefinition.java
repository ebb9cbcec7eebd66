package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * TLA AST Node
 *
 * f[x \in S] == body
 *
 */
public class TLAFunctionDefinition extends TLAUnit {

	private final TLAIdentifier name;
	private final List<TLAQuantifierBound> bounds;
	private final TLAExpression body;

	public TLAFunctionDefinition(SourceLocation location, TLAIdentifier name, List<TLAQuantifierBound> bounds,
	                             TLAExpression body) {
		super(location);
		this.name = name;
		this.bounds = bounds;
		this.body = body;
	}

	public TLAIdentifier getName() {
		return name;
	}

	public List<TLAQuantifierBound> getBounds() {
		return bounds;
	}

	public TLAExpression getBody() {
		return body;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>();
		children.add(name);
		children.addAll(bounds);
		children.add(body);
		return children;
	}

	@Override
	protected TLAFunctionDefinition rebuild(List<TLANode> children) {
		return new TLAFunctionDefinition(SourceLocation.unknown(), (TLAIdentifier) children.get(0),
				slice(children, 1, children.size() - 1, TLAQuantifierBound.class),
				(TLAExpression) children.get(children.size() - 1));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAUnitVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((name == null) ? 0 : name.hashCode());
		result = prime * result + ((bounds == null) ? 0 : bounds.hashCode());
		result = prime * result + ((body == null) ? 0 : body.hashCode());
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
		TLAFunctionDefinition other = (TLAFunctionDefinition) obj;
		if (name == null) {
			if (other.name != null)
				return false;
		} else if (!name.equals(other.name))
			return false;
		if (bounds == null) {
			if (other.bounds != null)
				return false;
		} else if (!bounds.equals(other.bounds))
			return false;
		if (body == null) {
			if (other.body != null)
				return false;
		} else if (!body.equals(other.body))
			return false;
		return true;
	}

}
