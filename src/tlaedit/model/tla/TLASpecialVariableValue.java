package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 *
 * The {@code @} inside an EXCEPT clause, standing for the old value at the substituted path
 *
 */
public class TLASpecialVariableValue extends TLAExpression {

	public TLASpecialVariableValue(SourceLocation location) {
		super(location);
	}

	@Override
	public List<TLANode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	protected TLASpecialVariableValue rebuild(List<TLANode> children) {
		return new TLASpecialVariableValue(SourceLocation.unknown());
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 31;
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}

}
