package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 *
 * A number literal, kept exactly as written
 *
 */
public class TLANumber extends TLAExpression {

	private final String val;

	public TLANumber(SourceLocation location, String val) {
		super(location);
		this.val = val;
	}

	public String getVal() {
		return val;
	}

	@Override
	public List<TLANode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	protected TLANumber rebuild(List<TLANode> children) {
		return new TLANumber(SourceLocation.unknown(), val);
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((val == null) ? 0 : val.hashCode());
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
		TLANumber other = (TLANumber) obj;
		if (val == null) {
			if (other.val != null)
				return false;
		} else if (!val.equals(other.val))
			return false;
		return true;
	}

}
