package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * An n-ary conjunction or disjunction, either written as an aligned bullet list:
 *
 * <pre>
 * /\ a
 * /\ b
 * </pre>
 *
 * or as an infix chain {@code a /\ b /\ c}. Infix chains of the same operator are flattened into
 * one node.
 *
 */
public class TLAJunction extends TLAExpression {

	public enum Kind {
		CONJUNCTION("/\\"),
		DISJUNCTION("\\/");

		private final String symbol;

		Kind(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final Kind kind;
	private final boolean bulleted;
	private final List<TLAExpression> items;

	public TLAJunction(SourceLocation location, Kind kind, boolean bulleted, List<TLAExpression> items) {
		super(location);
		this.kind = kind;
		this.bulleted = bulleted;
		this.items = items;
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isBulleted() {
		return bulleted;
	}

	public List<TLAExpression> getItems() {
		return items;
	}

	@Override
	public List<TLANode> getChildren() {
		return new ArrayList<>(items);
	}

	@Override
	protected TLAJunction rebuild(List<TLANode> children) {
		return new TLAJunction(SourceLocation.unknown(), kind, bulleted,
				slice(children, 0, children.size(), TLAExpression.class));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((kind == null) ? 0 : kind.hashCode());
		result = prime * result + ((items == null) ? 0 : items.hashCode());
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
		TLAJunction other = (TLAJunction) obj;
		if (kind != other.kind)
			return false;
		if (items == null) {
			if (other.items != null)
				return false;
		} else if (!items.equals(other.items))
			return false;
		return true;
	}

}
