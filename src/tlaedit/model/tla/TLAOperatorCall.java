package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * AST node:
 *
 * name(arg1, arg2, ...)
 *
 */
public class TLAOperatorCall extends TLAExpression {

	private final TLAIdentifier name;
	private final List<TLAExpression> args;

	public TLAOperatorCall(SourceLocation location, TLAIdentifier name, List<TLAExpression> args) {
		super(location);
		this.name = name;
		this.args = args;
	}

	public TLAIdentifier getName() {
		return name;
	}

	public List<TLAExpression> getArgs() {
		return args;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>();
		children.add(name);
		children.addAll(args);
		return children;
	}

	@Override
	protected TLAOperatorCall rebuild(List<TLANode> children) {
		return new TLAOperatorCall(SourceLocation.unknown(), (TLAIdentifier) children.get(0),
				slice(children, 1, children.size(), TLAExpression.class));
	}

	@Override
	public <T, E extends Throwable> T accept(TLAExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((name == null) ? 0 : name.hashCode());
		result = prime * result + ((args == null) ? 0 : args.hashCode());
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
		TLAOperatorCall other = (TLAOperatorCall) obj;
		if (name == null) {
			if (other.name != null)
				return false;
		} else if (!name.equals(other.name))
			return false;
		if (args == null) {
			if (other.args != null)
				return false;
		} else if (!args.equals(other.args))
			return false;
		return true;
	}

}
