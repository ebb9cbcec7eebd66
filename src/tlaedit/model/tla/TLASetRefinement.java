package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 *
 * AST node:
 *
 * { ident \in from : when }
 *
 */
public class TLASetRefinement extends TLAExpression {

	private final TLAIdentifier ident;
	private final TLAExpression from;
	private final TLAExpression when;

	public TLASetRefinement(SourceLocation location, TLAIdentifier ident, TLAExpression from, TLAExpression when) {
		super(location);
		this.ident = ident;
		this.from = from;
		this.when = when;
	}

	public TLAIdentifier getIdent() {
		return ident;
	}

	public TLAExpression getFrom() {
		return from;
	}

	public TLAExpression getWhen() {
		return when;
	}

	@Override
	public List<TLANode> getChildren() {
		return Arrays.asList(ident, from, when);
	}

	@Override
	protected TLASetRefinement rebuild(List<TLANode> children) {
		return new TLASetRefinement(SourceLocation.unknown(), (TLAIdentifier) children.get(0),
				(TLAExpression) children.get(1), (TLAExpression) children.get(2));
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
		result = prime * result + ((from == null) ? 0 : from.hashCode());
		result = prime * result + ((when == null) ? 0 : when.hashCode());
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
		TLASetRefinement other = (TLASetRefinement) obj;
		if (ident == null) {
			if (other.ident != null)
				return false;
		} else if (!ident.equals(other.ident))
			return false;
		if (from == null) {
			if (other.from != null)
				return false;
		} else if (!from.equals(other.from))
			return false;
		if (when == null) {
			if (other.when != null)
				return false;
		} else if (!when.equals(other.when))
			return false;
		return true;
	}

}
