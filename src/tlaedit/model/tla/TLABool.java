package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public class TLABool extends TLAExpression {

	private final boolean value;

	public TLABool(SourceLocation location, boolean value) {
		super(location);
		this.value = value;
	}

	public boolean getValue() {
		return value;
	}

	@Override
	public List<TLANode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	protected TLABool rebuild(List<TLANode> children) {
		return new TLABool(SourceLocation.unknown(), value);
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + (value ? 1231 : 1237);
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
		TLABool other = (TLABool) obj;
		if (value != other.value)
			return false;
		return true;
	}

}
