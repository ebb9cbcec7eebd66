package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 *
 * One field of a record constructor ({@code name |-> value}) or of a record set ({@code name : set})
 *
 */
public class TLARecordField extends TLANode {

	private final TLAIdentifier name;
	private final TLAExpression value;

	public TLARecordField(SourceLocation location, TLAIdentifier name, TLAExpression value) {
		super(location);
		this.name = name;
		this.value = value;
	}

	public TLAIdentifier getName() {
		return name;
	}

	public TLAExpression getValue() {
		return value;
	}

	@Override
	public List<TLANode> getChildren() {
		return Arrays.asList(name, value);
	}

	@Override
	protected TLARecordField rebuild(List<TLANode> children) {
		return new TLARecordField(SourceLocation.unknown(), (TLAIdentifier) children.get(0),
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
		result = prime * result + ((name == null) ? 0 : name.hashCode());
		result = prime * result + ((value == null) ? 0 : value.hashCode());
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
		TLARecordField other = (TLARecordField) obj;
		if (name == null) {
			if (other.name != null)
				return false;
		} else if (!name.equals(other.name))
			return false;
		if (value == null) {
			if (other.value != null)
				return false;
		} else if (!value.equals(other.value))
			return false;
		return true;
	}

}
