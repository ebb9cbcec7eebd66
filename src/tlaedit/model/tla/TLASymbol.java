package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 *
 * An operator symbol, e.g. {@code /\}, {@code \in} or {@code UNCHANGED}
 *
 */
public class TLASymbol extends TLANode {

	private final String value;

	public TLASymbol(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public List<TLANode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	protected TLASymbol rebuild(List<TLANode> children) {
		return new TLASymbol(SourceLocation.unknown(), value);
	}

	@Override
	public <T, E extends Throwable> T accept(TLANodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
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
		TLASymbol other = (TLASymbol) obj;
		if (value == null) {
			if (other.value != null)
				return false;
		} else if (!value.equals(other.value))
			return false;
		return true;
	}

}
