package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * A whole TLA+ module. Its location spans the entire input, so the text before the header, the
 * header itself with its EXTENDS line, and everything from the closing ==== onwards live in the
 * layout around the units.
 *
 */
public class TLAModule extends TLANode {

	private final TLAIdentifier name;
	private final List<TLAIdentifier> exts;
	private final List<TLAUnit> units;

	public TLAModule(SourceLocation location, TLAIdentifier name, List<TLAIdentifier> exts, List<TLAUnit> units) {
		super(location);
		this.name = name;
		this.exts = exts;
		this.units = units;
	}

	public TLAIdentifier getName() {
		return name;
	}

	public List<TLAIdentifier> getExtends() {
		return exts;
	}

	public List<TLAUnit> getUnits() {
		return units;
	}

	@Override
	public List<TLANode> getChildren() {
		return new ArrayList<>(units);
	}

	@Override
	protected TLAModule rebuild(List<TLANode> children) {
		return new TLAModule(SourceLocation.unknown(), name, exts, slice(children, 0, children.size(), TLAUnit.class));
	}

	@Override
	public TLAModule withChildren(List<TLANode> children) {
		return (TLAModule) super.withChildren(children);
	}

	public TLAModule withUnits(List<TLAUnit> newUnits) {
		return withChildren(new ArrayList<>(newUnits));
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
		result = prime * result + ((exts == null) ? 0 : exts.hashCode());
		result = prime * result + ((units == null) ? 0 : units.hashCode());
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
		TLAModule other = (TLAModule) obj;
		if (name == null) {
			if (other.name != null)
				return false;
		} else if (!name.equals(other.name))
			return false;
		if (exts == null) {
			if (other.exts != null)
				return false;
		} else if (!exts.equals(other.exts))
			return false;
		if (units == null) {
			if (other.units != null)
				return false;
		} else if (!units.equals(other.units))
			return false;
		return true;
	}

}
