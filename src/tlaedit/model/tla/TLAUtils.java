package tlaedit.model.tla;

import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

public final class TLAUtils {
	private TLAUtils() {}

	/**
	 * Visits root and every node below it, parents before children, in source order.
	 */
	public static void forEachNode(TLANode root, Consumer<TLANode> action) {
		action.accept(root);
		for (TLANode child : root.getChildren()) {
			forEachNode(child, action);
		}
	}

	/**
	 * Rebuilds root bottom-up. Every node found (by identity) in edits is replaced by the result of its
	 * operator, which receives the node with its own children already rebuilt. Subtrees without any edit
	 * are returned as-is.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends TLANode> T substitute(T root, Map<TLANode, UnaryOperator<TLANode>> edits) {
		return (T) substituteNode(root, edits);
	}

	/**
	 * Registers an edit of node for {@link #substitute}, running it after any edit of node already registered.
	 */
	public static void addEdit(Map<TLANode, UnaryOperator<TLANode>> edits, TLANode node, UnaryOperator<TLANode> edit) {
		UnaryOperator<TLANode> previous = edits.get(node);
		if (previous == null) {
			edits.put(node, edit);
		} else {
			edits.put(node, n -> edit.apply(previous.apply(n)));
		}
	}

	private static TLANode substituteNode(TLANode node, Map<TLANode, UnaryOperator<TLANode>> edits) {
		List<TLANode> children = node.getChildren();
		List<TLANode> newChildren = new ArrayList<>(children.size());
		boolean changed = false;
		for (TLANode child : children) {
			TLANode newChild = substituteNode(child, edits);
			changed |= newChild != child;
			newChildren.add(newChild);
		}
		TLANode result = changed ? node.withChildren(newChildren) : node;
		UnaryOperator<TLANode> edit = edits.get(node);
		if (edit != null) {
			result = edit.apply(result);
		}
		return result;
	}

	/**
	 * @return the name of the definition expr refers to, if it is a plain {@code Name} or {@code Name(args)}
	 */
	public static Optional<String> referencedName(TLAExpression expr) {
		if (expr instanceof TLAGeneralIdentifier) {
			return Optional.of(((TLAGeneralIdentifier) expr).getName().getId());
		}
		if (expr instanceof TLAOperatorCall) {
			return Optional.of(((TLAOperatorCall) expr).getName().getId());
		}
		return Optional.empty();
	}

	public static TLAIdentifier id(String name) {
		return new TLAIdentifier(SourceLocation.unknown(), name);
	}

	public static TLAGeneralIdentifier idexp(String name) {
		return new TLAGeneralIdentifier(SourceLocation.unknown(), id(name));
	}

	public static TLAString str(String value) {
		return new TLAString(SourceLocation.unknown(), value);
	}

	public static TLABinOp binop(String op, TLAExpression lhs, TLAExpression rhs) {
		return new TLABinOp(SourceLocation.unknown(), new TLASymbol(SourceLocation.unknown(), op), lhs, rhs);
	}

	public static TLAUnary unchanged(TLAExpression operand) {
		return new TLAUnary(
				SourceLocation.unknown(), new TLASymbol(SourceLocation.unknown(), "UNCHANGED"), operand, false);
	}

	/**
	 * @return {@code UNCHANGED v} for a single variable, {@code UNCHANGED <<a, b>>} otherwise
	 */
	public static TLAUnary unchanged(List<String> variables) {
		if (variables.size() == 1) {
			return unchanged(idexp(variables.get(0)));
		}
		List<TLAExpression> elements = new ArrayList<>();
		for (String variable : variables) {
			elements.add(idexp(variable));
		}
		return unchanged(new TLATuple(SourceLocation.unknown(), elements));
	}

	public static TLAUnary prime(TLAExpression operand) {
		return new TLAUnary(SourceLocation.unknown(), new TLASymbol(SourceLocation.unknown(), "'"), operand, true);
	}

	/**
	 * Appends a conjunct to expr, extending expr itself if it already is a conjunction.
	 */
	public static TLAExpression conjoin(TLAExpression expr, TLAExpression conjunct) {
		if (expr instanceof TLAJunction && ((TLAJunction) expr).getKind() == TLAJunction.Kind.CONJUNCTION) {
			List<TLANode> items = expr.getChildren();
			items.add(conjunct);
			return expr.withChildren(items);
		}
		List<TLAExpression> items = new ArrayList<>();
		items.add(expr);
		items.add(conjunct);
		return new TLAJunction(SourceLocation.unknown(), TLAJunction.Kind.CONJUNCTION, false, items);
	}

	/**
	 * @return the expressions joined by expr if it is a conjunction, otherwise just expr
	 */
	public static List<TLAExpression> conjuncts(TLAExpression expr) {
		if (expr instanceof TLAJunction && ((TLAJunction) expr).getKind() == TLAJunction.Kind.CONJUNCTION) {
			return ((TLAJunction) expr).getItems();
		}
		return Collections.singletonList(expr);
	}
}
