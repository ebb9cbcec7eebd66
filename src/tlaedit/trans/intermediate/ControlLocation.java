package tlaedit.trans.intermediate;

import tlaedit.model.tla.TLAExpression;
import tlaedit.model.tla.TLAGeneralIdentifier;
import tlaedit.model.tla.TLAString;
import tlaedit.model.tla.TLAUtils;

import java.util.Collection;
import java.util.Optional;

/**
 * A value of the control-location variable: either a string literal such as "L1" or the name of a
 * declared constant.
 */
public class ControlLocation {

	private final String name;
	private final boolean constant;

	public ControlLocation(String name, boolean constant) {
		this.name = name;
		this.constant = constant;
	}

	public static Optional<ControlLocation> of(TLAExpression expression, Collection<String> constants) {
		if (expression instanceof TLAString) {
			return Optional.of(new ControlLocation(((TLAString) expression).getValue(), false));
		}
		if (expression instanceof TLAGeneralIdentifier) {
			String id = ((TLAGeneralIdentifier) expression).getName().getId();
			if (constants.contains(id)) {
				return Optional.of(new ControlLocation(id, true));
			}
		}
		return Optional.empty();
	}

	public String getName() {
		return name;
	}

	public boolean isConstant() {
		return constant;
	}

	/**
	 * @return a location of the same kind as this one, with a different name
	 */
	public ControlLocation renamed(String newName) {
		return new ControlLocation(newName, constant);
	}

	public TLAExpression toExpression() {
		return constant ? TLAUtils.idexp(name) : TLAUtils.str(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		ControlLocation other = (ControlLocation) obj;
		return constant == other.constant && name.equals(other.name);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((name == null) ? 0 : name.hashCode());
		result = prime * result + (constant ? 1231 : 1237);
		return result;
	}

	@Override
	public String toString() {
		return constant ? name : "\"" + name + "\"";
	}
}
