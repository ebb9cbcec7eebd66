package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * TLA AST Node
 *
 * Op(a, b) == body
 *
 */
public class TLAOperatorDefinition extends TLAUnit {

	private final TLAIdentifier name;
	private final List<TLAIdentifier> args;
	private final TLAExpression body;
	private final boolean isLocal;

	public TLAOperatorDefinition(SourceLocation location, TLAIdentifier name, List<TLAIdentifier> args,
	                             TLAExpression body, boolean isLocal) {
		super(location);
		this.name = name;
		this.args = args;
		this.body = body;
		this.isLocal = isLocal;
	}

	public TLAIdentifier getName() {
		return name;
	}

	public List<TLAIdentifier> getArgs() {
		return args;
	}

	public TLAExpression getBody() {
		return body;
	}

	public boolean isLocal() {
		return isLocal;
	}

	@Override
	public List<TLANode> getChildren() {
		List<TLANode> children = new ArrayList<>();
		children.add(name);
		children.addAll(args);
		children.add(body);
		return children;
	}

	@Override
	protected TLAOperatorDefinition rebuild(List<TLANode> children) {
		return new TLAOperatorDefinition(SourceLocation.unknown(), (TLAIdentifier) children.get(0),
				slice(children, 1, children.size() - 1, TLAIdentifier.class),
				(TLAExpression) children.get(children.size() - 1), isLocal);
	}

	@Override
	public TLAOperatorDefinition withChildren(List<TLANode> children) {
		return (TLAOperatorDefinition) super.withChildren(children);
	}

	public TLAOperatorDefinition withBody(TLAExpression newBody) {
		List<TLANode> children = getChildren();
		children.set(children.size() - 1, newBody);
		return withChildren(children);
	}

	@Override
	public <T, E extends Throwable> T accept(TLAUnitVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((name == null) ? 0 : name.hashCode());
		result = prime * result + ((args == null) ? 0 : args.hashCode());
		result = prime * result + ((body == null) ? 0 : body.hashCode());
		result = prime * result + (isLocal ? 1231 : 1237);
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
		TLAOperatorDefinition other = (TLAOperatorDefinition) obj;
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
		if (body == null) {
			if (other.body != null)
				return false;
		} else if (!body.equals(other.body))
			return false;
		if (isLocal != other.isLocal)
			return false;
		return true;
	}

}
