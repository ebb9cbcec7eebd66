package tlaedit.trans;

import java.util.Objects;

/**
 * Add a state variable with the given initial value and, optionally, the set of values it may take.
 */
public class AddVariableRequest extends EditRequest {

	private final String name;
	private final String initExpr;
	private final String typeExpr;

	public AddVariableRequest(String name, String initExpr, String typeExpr) {
		this.name = name;
		this.initExpr = initExpr;
		this.typeExpr = typeExpr;
	}

	public AddVariableRequest(String name, String initExpr) {
		this(name, initExpr, null);
	}

	public String getName() {
		return name;
	}

	public String getInitExpr() {
		return initExpr;
	}

	/**
	 * @return the type expression, or null if none was given
	 */
	public String getTypeExpr() {
		return typeExpr;
	}

	@Override
	public <T, E extends Throwable> T accept(EditRequestVisitor<T, E> v) throws E {
		return v.visit(this);
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
		AddVariableRequest other = (AddVariableRequest) obj;
		return name.equals(other.name) && Objects.equals(initExpr, other.initExpr) &&
				Objects.equals(typeExpr, other.typeExpr);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((name == null) ? 0 : name.hashCode());
		result = prime * result + ((initExpr == null) ? 0 : initExpr.hashCode());
		result = prime * result + ((typeExpr == null) ? 0 : typeExpr.hashCode());
		return result;
	}

	@Override
	public String toString() {
		return "add variable " + name + " = " + initExpr + (typeExpr == null ? "" : " \\in " + typeExpr);
	}
}
