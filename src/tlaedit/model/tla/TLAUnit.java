package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.List;

public abstract class TLAUnit extends TLANode {

	public TLAUnit(SourceLocation location) {
		super(location);
	}

	@Override
	public TLAUnit withChildren(List<TLANode> children) {
		return (TLAUnit) super.withChildren(children);
	}

	@Override
	public <T, E extends Throwable> T accept(TLANodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(TLAUnitVisitor<T, E> v) throws E;

}
