package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * CHOOSE ident \in set : body
 * CHOOSE ident : body
 *
 */
public class TLAChoose extends TLAExpression {

	private final TLAIdentifier ident;
	private final TLAExpression set;
	private final TLAExpression body;

	public TLAChoose(SourceLocation location, TLAIdentifier ident, TLAExpression set, TLAExpression body) {
		super(location);
		this.ident = ident;
		this.set = set;
		this.body = body;
	}

	public TLAIdentifier getIdent() {
		return ident;
	}

	/**
	 * @return the set chosen from, or null for an unbounded CHOOSE
	 */
	public TLAExpression getSet() {
		return set;
	}

	public TLAExpression getBody() {
		return body;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>();
		children.add(ident);
		if (set != null) {
			children.add(set);
		}
		children.add(body);
		return children;
	}

	@Override
	protected TLAChoose rebuild(List<TLANode> children) {
		return new TLAChoose(SourceLocation.unknown(), (TLAIdentifier) children.get(0),
				set != null ? (TLAExpression) children.get(1) : null,
				(TLAExpression) children.get(children.size() - 1));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((ident == null) ? 0 : ident.hashCode());
		result = prime * result + ((set == null) ? 0 : set.hashCode());
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
		TLAChoose other = (TLAChoose) obj;
		if (ident == null) {
			if (other.ident != null)
				return false;
		} else if (!ident.equals(other.ident))
			return false;
		if (set == null) {
			if (other.set != null)
				return false;
		} else if (!set.equals(other.set))
			return false;
		if (body == null) {
			if (other.body != null)
				return false;
		} else if (!body.equals(other.body))
			return false;
		return true;
	}

}
