package tlaedit.trans.passes.addvar;

import tlaedit.model.tla.*;
import tlaedit.trans.intermediate.DeclarationCatalog;

import java.util.*;

/**
 * Finds the identifiers of an expression that are neither bound inside it nor resolvable in a module.
 */
public class ReferenceResolution {

	private final DeclarationCatalog catalog;
	private final List<TLAIdentifier> unresolved;

	private ReferenceResolution(DeclarationCatalog catalog) {
		this.catalog = catalog;
		this.unresolved = new ArrayList<>();
	}

	public static List<TLAIdentifier> findUnresolved(DeclarationCatalog catalog, TLAExpression expression) {
		ReferenceResolution visitor = new ReferenceResolution(catalog);
		visitor.visit(expression, Collections.emptySet());
		return visitor.unresolved;
	}

	private static Set<String> with(Set<String> bound, List<TLAIdentifier> ids) {
		Set<String> result = new HashSet<>(bound);
		for (TLAIdentifier id : ids) {
			result.add(id.getId());
		}
		return result;
	}

	private void check(TLAIdentifier id, Set<String> bound) {
		if (!bound.contains(id.getId()) && !catalog.isResolvable(id.getId())) {
			unresolved.add(id);
		}
	}

	private Set<String> visitBounds(List<TLAQuantifierBound> bounds, Set<String> bound) {
		Set<String> inner = bound;
		for (TLAQuantifierBound quantifierBound : bounds) {
			visit(quantifierBound.getSet(), bound);
			inner = with(inner, quantifierBound.getIds());
		}
		return inner;
	}

	private void visit(TLANode node, Set<String> bound) {
		if (node instanceof TLAGeneralIdentifier) {
			check(((TLAGeneralIdentifier) node).getName(), bound);
		} else if (node instanceof TLAOperatorCall) {
			check(((TLAOperatorCall) node).getName(), bound);
			for (TLAExpression arg : ((TLAOperatorCall) node).getArgs()) {
				visit(arg, bound);
			}
		} else if (node instanceof TLAQuantifiedExistential) {
			TLAQuantifiedExistential exists = (TLAQuantifiedExistential) node;
			visit(exists.getBody(), visitBounds(exists.getBounds(), bound));
		} else if (node instanceof TLAQuantifiedUniversal) {
			TLAQuantifiedUniversal forall = (TLAQuantifiedUniversal) node;
			visit(forall.getBody(), visitBounds(forall.getBounds(), bound));
		} else if (node instanceof TLAFunction) {
			TLAFunction function = (TLAFunction) node;
			visit(function.getBody(), visitBounds(function.getBounds(), bound));
		} else if (node instanceof TLASetComprehension) {
			TLASetComprehension comprehension = (TLASetComprehension) node;
			visit(comprehension.getBody(), visitBounds(comprehension.getBounds(), bound));
		} else if (node instanceof TLAChoose) {
			TLAChoose choose = (TLAChoose) node;
			if (choose.getSet() != null) {
				visit(choose.getSet(), bound);
			}
			visit(choose.getBody(), with(bound, Collections.singletonList(choose.getIdent())));
		} else if (node instanceof TLASetRefinement) {
			TLASetRefinement refinement = (TLASetRefinement) node;
			visit(refinement.getFrom(), bound);
			visit(refinement.getWhen(), with(bound, Collections.singletonList(refinement.getIdent())));
		} else if (node instanceof TLALet) {
			TLALet let = (TLALet) node;
			List<TLAIdentifier> names = new ArrayList<>();
			for (TLAUnit unit : let.getDefinitions()) {
				if (unit instanceof TLAOperatorDefinition) {
					names.add(((TLAOperatorDefinition) unit).getName());
				} else if (unit instanceof TLAFunctionDefinition) {
					names.add(((TLAFunctionDefinition) unit).getName());
				}
			}
			Set<String> inner = with(bound, names);
			for (TLAUnit unit : let.getDefinitions()) {
				if (unit instanceof TLAOperatorDefinition) {
					TLAOperatorDefinition def = (TLAOperatorDefinition) unit;
					visit(def.getBody(), with(inner, def.getArgs()));
				} else if (unit instanceof TLAFunctionDefinition) {
					TLAFunctionDefinition def = (TLAFunctionDefinition) unit;
					visit(def.getBody(), visitBounds(def.getBounds(), inner));
				}
			}
			visit(let.getBody(), inner);
		} else {
			for (TLANode child : node.getChildren()) {
				visit(child, bound);
			}
		}
	}
}
