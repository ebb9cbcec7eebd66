package tlaedit.model.tla;

import tlaedit.formatters.TLASourceRenderer;
import tlaedit.util.SourceLocatable;
import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 *
 * The base class for any TLA AST node.
 *
 * Nodes come in three flavours. Parsed nodes know their source location and are rendered by copying
 * that exact text. Derived nodes are produced by {@link #withChildren(List)}: they have no location of
 * their own but remember the parsed node they were derived from, whose layout (the text between its
 * children) is reused when rendering. New nodes have neither and are rendered from scratch.
 *
 * Nodes are immutable; an edit builds new nodes that share every untouched subtree with the original.
 *
 */
public abstract class TLANode extends SourceLocatable {
	private final SourceLocation location;
	private TLANode layout;

	public TLANode(SourceLocation location) {
		this.location = location;
		this.layout = null;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return true if this node was produced by the parser and is still unmodified
	 */
	public boolean isVerbatim() {
		return !location.isUnknown();
	}

	/**
	 * @return the parsed node whose text layout this node follows, or null for brand new nodes
	 */
	public TLANode getLayoutSource() {
		return isVerbatim() ? this : layout;
	}

	/**
	 * @return this node's direct children, in the order they appear in source
	 */
	public abstract List<TLANode> getChildren();

	/**
	 * Builds a node of the same kind with children replaced, ignoring layout.
	 */
	protected abstract TLANode rebuild(List<TLANode> children);

	/**
	 * @param children replacement children, in source order, shaped like {@link #getChildren()}
	 * @return a node of the same kind that keeps this node's layout
	 */
	public TLANode withChildren(List<TLANode> children) {
		TLANode result = rebuild(children);
		result.layout = getLayoutSource();
		return result;
	}

	protected static <T extends TLANode> List<T> slice(List<TLANode> children, int from, int to, Class<T> kind) {
		List<T> result = new ArrayList<>(to - from);
		for (TLANode child : children.subList(from, to)) {
			result.add(kind.cast(child));
		}
		return result;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		return TLASourceRenderer.render(this);
	}

	public abstract <T, E extends Throwable> T accept(TLANodeVisitor<T, E> v) throws E;

}
