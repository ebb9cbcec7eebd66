package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.List;

/**
 * Base TLA expression representation
 *
 */
public abstract class TLAExpression extends TLANode {

	public TLAExpression(SourceLocation location) {
		super(location);
	}

	@Override
	public TLAExpression withChildren(List<TLANode> children) {
		return (TLAExpression) super.withChildren(children);
	}

	@Override
	public <T, E extends Throwable> T accept(TLANodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E;

}
