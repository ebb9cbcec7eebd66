package tlaedit.trans.passes.effects;

import tlaedit.model.tla.*;
import tlaedit.trans.intermediate.DeclarationCatalog;
import tlaedit.util.SourceLocation;

import java.util.*;

/**
 * Splits an action into its leaf branches and works out what each branch assigns and leaves unchanged.
 *
 * A conjunction branches as the product of its conjuncts, a disjunction as the union of its disjuncts,
 * IF and CASE once per arm. Existential quantifiers and LET are looked through. Only subexpressions that
 * can change the state (they contain a prime, an UNCHANGED or a reference to an action) branch at all;
 * everything else is a guard and becomes part of the path condition.
 *
 * When several conjuncts branch, each one whose branches all account for the same variables stands for
 * one branch of its own, so independent choices do not multiply. A reference to a helper definition, an
 * action fragment such as {@code Send(v) == msgs' = msgs \cup {v}}, contributes the effects of the
 * helper's body.
 */
public class BranchEffectsAnalyzer {
	private BranchEffectsAnalyzer() {}

	private static final class Branch {
		final List<String> assigned = new ArrayList<>();
		final List<String> unchanged = new ArrayList<>();
		final List<String> unknownUnchanged = new ArrayList<>();
		final List<TLAUnary> unchangedNodes = new ArrayList<>();
		final Set<String> expandedTuples = new LinkedHashSet<>();
		final List<TLAExpression> pathCondition = new ArrayList<>();
		final List<String> delegated = new ArrayList<>();
		final List<TLAExpression> choices = new ArrayList<>();

		Branch merge(Branch other) {
			Branch result = new Branch();
			for (Branch b : Arrays.asList(this, other)) {
				result.assigned.addAll(b.assigned);
				result.unchanged.addAll(b.unchanged);
				result.unknownUnchanged.addAll(b.unknownUnchanged);
				result.unchangedNodes.addAll(b.unchangedNodes);
				result.expandedTuples.addAll(b.expandedTuples);
				result.pathCondition.addAll(b.pathCondition);
				result.delegated.addAll(b.delegated);
				result.choices.addAll(b.choices);
			}
			return result;
		}
	}

	public static List<BranchEffects> branchEffects(DeclarationCatalog catalog, TLAOperatorDefinition definition) {
		TLAExpression body = definition.getBody();
		List<BranchEffects> result = new ArrayList<>();
		for (Branch branch : branches(catalog, body, new HashSet<>())) {
			TLAExpression container = branch.choices.isEmpty() ? body : branch.choices.get(branch.choices.size() - 1);
			result.add(new BranchEffects(branch.assigned, branch.unchanged, branch.unknownUnchanged,
					branch.unchangedNodes, branch.expandedTuples, branch.pathCondition, branch.delegated,
					branch.choices, container));
		}
		return result;
	}

	/**
	 * @return true if expr may change the state: it contains a prime or an UNCHANGED, or refers to a
	 * definition that does
	 */
	public static boolean isActionLike(DeclarationCatalog catalog, TLAExpression expr) {
		boolean[] found = {false};
		TLAUtils.forEachNode(expr, node -> {
			if (found[0]) {
				return;
			}
			if (node instanceof TLAUnary && (((TLAUnary) node).isPrime() || ((TLAUnary) node).isUnchanged())) {
				found[0] = true;
			} else if (node instanceof TLAExpression) {
				Optional<String> name = TLAUtils.referencedName((TLAExpression) node);
				found[0] = name.isPresent() && catalog.isActionLike(name.get());
			}
		});
		return found[0];
	}

	/**
	 * @return the variable assigned by {@code v' = e} or {@code v' \in S}
	 */
	public static Optional<String> assignedVariable(TLAExpression expr) {
		if (!(expr instanceof TLABinOp)) {
			return Optional.empty();
		}
		TLABinOp binOp = (TLABinOp) expr;
		String op = binOp.getOperation().getValue();
		if (!op.equals("=") && !op.equals("\\in")) {
			return Optional.empty();
		}
		if (!(binOp.getLHS() instanceof TLAUnary)) {
			return Optional.empty();
		}
		TLAUnary lhs = (TLAUnary) binOp.getLHS();
		if (!lhs.isPrime() || !(lhs.getOperand() instanceof TLAGeneralIdentifier)) {
			return Optional.empty();
		}
		return Optional.of(((TLAGeneralIdentifier) lhs.getOperand()).getName().getId());
	}

	/**
	 * @return every variable assigned anywhere inside expr
	 */
	public static Set<String> assignedVariables(TLAExpression expr) {
		Set<String> result = new LinkedHashSet<>();
		TLAUtils.forEachNode(expr, node -> {
			if (node instanceof TLAExpression) {
				assignedVariable((TLAExpression) node).ifPresent(result::add);
			}
		});
		return result;
	}

	private static TLAExpression negate(TLAExpression condition) {
		return new TLAUnary(SourceLocation.unknown(), new TLASymbol(SourceLocation.unknown(), "~"), condition, false);
	}

	private static List<Branch> within(TLAExpression choice, TLAExpression condition, List<Branch> branches) {
		for (Branch branch : branches) {
			branch.choices.add(0, choice);
			if (condition != null) {
				branch.pathCondition.add(0, condition);
			}
		}
		return branches;
	}

	private static List<String> coverage(Branch branch) {
		List<String> names = new ArrayList<>(branch.assigned);
		names.addAll(branch.unchanged);
		Collections.sort(names);
		return names;
	}

	/**
	 * @return a single branch standing for all of alternatives, if they account for the same variables
	 */
	private static Optional<Branch> collapse(List<Branch> alternatives) {
		Branch first = alternatives.get(0);
		List<String> unknown = new ArrayList<>(first.unknownUnchanged);
		Collections.sort(unknown);
		for (Branch branch : alternatives) {
			List<String> otherUnknown = new ArrayList<>(branch.unknownUnchanged);
			Collections.sort(otherUnknown);
			if (!branch.delegated.isEmpty() || !coverage(branch).equals(coverage(first)) ||
					!otherUnknown.equals(unknown) || !branch.expandedTuples.equals(first.expandedTuples)) {
				return Optional.empty();
			}
		}
		Branch result = new Branch();
		result.assigned.addAll(first.assigned);
		result.unchanged.addAll(first.unchanged);
		result.unknownUnchanged.addAll(first.unknownUnchanged);
		result.expandedTuples.addAll(first.expandedTuples);
		return Optional.of(result);
	}

	private static List<Branch> inline(DeclarationCatalog catalog, String helper, Set<String> inlining) {
		inlining.add(helper);
		List<Branch> result = branches(catalog, catalog.getDefinition(helper).getBody(), inlining);
		inlining.remove(helper);
		// edits belong to the caller, not to the shared helper
		for (Branch branch : result) {
			branch.unchangedNodes.clear();
			branch.choices.clear();
		}
		if (result.size() > 1) {
			Optional<Branch> collapsed = collapse(result);
			if (collapsed.isPresent()) {
				return new ArrayList<>(Collections.singletonList(collapsed.get()));
			}
		}
		return result;
	}

	private static List<Branch> branches(DeclarationCatalog catalog, TLAExpression expr, Set<String> inlining) {
		if (!isActionLike(catalog, expr)) {
			Branch guard = new Branch();
			guard.pathCondition.add(expr);
			return new ArrayList<>(Collections.singletonList(guard));
		}
		if (expr instanceof TLAJunction) {
			TLAJunction junction = (TLAJunction) expr;
			if (junction.getKind() == TLAJunction.Kind.CONJUNCTION) {
				List<List<Branch>> items = new ArrayList<>();
				int branching = 0;
				for (TLAExpression item : junction.getItems()) {
					List<Branch> itemBranches = branches(catalog, item, inlining);
					items.add(itemBranches);
					if (itemBranches.size() > 1) {
						++branching;
					}
				}
				List<Branch> result = new ArrayList<>(Collections.singletonList(new Branch()));
				for (List<Branch> itemBranches : items) {
					if (branching > 1 && itemBranches.size() > 1) {
						Optional<Branch> collapsed = collapse(itemBranches);
						if (collapsed.isPresent()) {
							itemBranches = Collections.singletonList(collapsed.get());
						}
					}
					List<Branch> product = new ArrayList<>();
					for (Branch left : result) {
						for (Branch right : itemBranches) {
							product.add(left.merge(right));
						}
					}
					result = product;
				}
				return result;
			}
			List<Branch> result = new ArrayList<>();
			for (TLAExpression item : junction.getItems()) {
				result.addAll(within(item, null, branches(catalog, item, inlining)));
			}
			return result;
		}
		if (expr instanceof TLAIf) {
			TLAIf tlaIf = (TLAIf) expr;
			List<Branch> result = new ArrayList<>();
			result.addAll(within(tlaIf.getTval(), tlaIf.getCond(), branches(catalog, tlaIf.getTval(), inlining)));
			result.addAll(within(tlaIf.getFval(), negate(tlaIf.getCond()), branches(catalog, tlaIf.getFval(), inlining)));
			return result;
		}
		if (expr instanceof TLACase) {
			TLACase tlaCase = (TLACase) expr;
			List<Branch> result = new ArrayList<>();
			for (TLACaseArm arm : tlaCase.getArms()) {
				result.addAll(within(arm.getResult(), arm.getCondition(), branches(catalog, arm.getResult(), inlining)));
			}
			if (tlaCase.getOther() != null) {
				List<Branch> other = branches(catalog, tlaCase.getOther(), inlining);
				for (TLACaseArm arm : tlaCase.getArms()) {
					for (Branch branch : other) {
						branch.pathCondition.add(negate(arm.getCondition()));
					}
				}
				result.addAll(within(tlaCase.getOther(), null, other));
			}
			return result;
		}
		if (expr instanceof TLAQuantifiedExistential) {
			return branches(catalog, ((TLAQuantifiedExistential) expr).getBody(), inlining);
		}
		if (expr instanceof TLALet) {
			return branches(catalog, ((TLALet) expr).getBody(), inlining);
		}
		Branch leaf = new Branch();
		Optional<String> assigned = assignedVariable(expr);
		Optional<String> referenced = TLAUtils.referencedName(expr);
		if (assigned.isPresent()) {
			leaf.assigned.add(assigned.get());
		} else if (expr instanceof TLAUnary && ((TLAUnary) expr).isUnchanged()) {
			leaf.unchangedNodes.add((TLAUnary) expr);
			expandUnchanged(catalog, ((TLAUnary) expr).getOperand(), leaf, new HashSet<>());
		} else if (referenced.isPresent() && catalog.isHelper(referenced.get()) && !inlining.contains(referenced.get())) {
			return inline(catalog, referenced.get(), inlining);
		} else if (referenced.isPresent() && catalog.isActionLike(referenced.get())) {
			leaf.delegated.add(referenced.get());
		} else {
			// primes outside of an assignment, as in x' > x, constrain the step without assigning
			leaf.pathCondition.add(expr);
		}
		return new ArrayList<>(Collections.singletonList(leaf));
	}

	private static void expandUnchanged(DeclarationCatalog catalog, TLAExpression expr, Branch branch,
	                                    Set<String> visiting) {
		if (expr instanceof TLATuple) {
			for (TLAExpression element : ((TLATuple) expr).getElements()) {
				expandUnchanged(catalog, element, branch, visiting);
			}
			return;
		}
		if (expr instanceof TLAGeneralIdentifier) {
			String id = ((TLAGeneralIdentifier) expr).getName().getId();
			if (catalog.isVariable(id)) {
				branch.unchanged.add(id);
				return;
			}
			Optional<TLAOperatorDefinition> tuple = catalog.findTupleDefinition(id);
			if (tuple.isPresent() && visiting.add(id)) {
				branch.expandedTuples.add(id);
				expandUnchanged(catalog, tuple.get().getBody(), branch, visiting);
				visiting.remove(id);
				return;
			}
		}
		branch.unknownUnchanged.add(expr.toString());
	}
}
