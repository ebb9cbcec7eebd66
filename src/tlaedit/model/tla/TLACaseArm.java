package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

public class TLACaseArm extends TLANode {

	private final TLAExpression condition;
	private final TLAExpression result;

	public TLACaseArm(SourceLocation location, TLAExpression condition, TLAExpression result) {
		super(location);
		this.condition = condition;
		this.result = result;
	}

	public TLAExpression getCondition() {
		return condition;
	}

	public TLAExpression getResult() {
		return result;
	}

	@Override
	public List<TLANode> getChildren() {
		return Arrays.asList(condition, result);
	}

	@Override
	protected TLACaseArm rebuild(List<TLANode> children) {
		return new TLACaseArm(SourceLocation.unknown(), (TLAExpression) children.get(0),
				(TLAExpression) children.get(1));
	}

	@Override
	public <T, E extends Throwable> T accept(TLANodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((condition == null) ? 0 : condition.hashCode());
		result = prime * result + ((this.result == null) ? 0 : this.result.hashCode());
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
		TLACaseArm other = (TLACaseArm) obj;
		if (condition == null) {
			if (other.condition != null)
				return false;
		} else if (!condition.equals(other.condition))
			return false;
		if (result == null) {
			if (other.result != null)
				return false;
		} else if (!result.equals(other.result))
			return false;
		return true;
	}

}
