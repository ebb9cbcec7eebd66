package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * [a : S, b : T]
 *
 */
public class TLARecordSet extends TLAExpression {

	private final List<TLARecordField> fields;

	public TLARecordSet(SourceLocation location, List<TLARecordField> fields) {
		super(location);
		this.fields = fields;
	}

	public List<TLARecordField> getFields() {
		return fields;
	}

	@Override
	public List<TLANode> getChildren() {
		return new ArrayList<>(fields);
	}

	@Override
	protected TLARecordSet rebuild(List<TLANode> children) {
		return new TLARecordSet(SourceLocation.unknown(),
				slice(children, 0, children.size(), TLARecordField.class));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((fields == null) ? 0 : fields.hashCode());
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
		TLARecordSet other = (TLARecordSet) obj;
		if (fields == null) {
			if (other.fields != null)
				return false;
		} else if (!fields.equals(other.fields))
			return false;
		return true;
	}

}
