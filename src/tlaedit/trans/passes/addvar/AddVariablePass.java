package tlaedit.trans.passes.addvar;

import tlaedit.errors.Issue;
import tlaedit.model.tla.*;
import tlaedit.trans.AddVariableRequest;
import tlaedit.trans.intermediate.DeclarationCatalog;
import tlaedit.trans.intermediate.NotFoundIssue;
import tlaedit.trans.passes.effects.BranchEffects;
import tlaedit.trans.passes.effects.BranchEffectsAnalyzer;
import tlaedit.trans.passes.parse.tla.TLAParsingPass;
import tlaedit.util.SourceLocation;

import java.util.*;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Adds a state variable everywhere the module has to mention it: the variable declaration, the initial
 * predicate, one UNCHANGED clause on every branch of every action, the tuple of all variables and the
 * type invariant.
 */
public class AddVariablePass {
	private AddVariablePass() {}

	private static final Logger logger = Logger.getLogger("TLAEdit");

	public static TLAModule perform(DeclarationCatalog catalog, TLAModule module, AddVariableRequest request)
			throws Issue {
		String name = TLAParsingPass.performIdentifier("variable name", request.getName());
		if (catalog.isDeclared(name)) {
			throw new DuplicateNameIssue(name);
		}
		TLAExpression init = TLAParsingPass.performExpression("initial value", request.getInitExpr());
		requireResolved(catalog, init, false);
		TLAExpression type = null;
		if (request.getTypeExpr() != null) {
			type = TLAParsingPass.performExpression("type", request.getTypeExpr());
			requireResolved(catalog, type, true);
		}
		Optional<TLAOperatorDefinition> typeInvariant = catalog.getTypeInvariant();
		if (typeInvariant.isPresent() && type == null) {
			throw new MissingTypeIssue(name, typeInvariant.get().getName().getId());
		}
		TLAOperatorDefinition initDefinition = catalog.getInit()
				.orElseThrow(() -> new NotFoundIssue("initial predicate", null));

		Map<TLANode, UnaryOperator<TLANode>> edits = new IdentityHashMap<>();

		TLAVariableDeclaration lastDeclaration = null;
		for (TLAUnit unit : module.getUnits()) {
			if (unit instanceof TLAVariableDeclaration) {
				lastDeclaration = (TLAVariableDeclaration) unit;
			}
		}
		if (lastDeclaration != null) {
			TLAUtils.addEdit(edits, lastDeclaration, decl -> {
				List<TLANode> children = decl.getChildren();
				children.add(TLAUtils.id(name));
				return decl.withChildren(children);
			});
		}

		TLAExpression initConjunct = TLAUtils.binop("=", TLAUtils.idexp(name), init);
		TLAUtils.addEdit(edits, initDefinition.getBody(),
				body -> TLAUtils.conjoin((TLAExpression) body, initConjunct));

		Optional<TLAOperatorDefinition> aggregate = catalog.getAggregateTuple();
		for (TLAOperatorDefinition action : catalog.getActions()) {
			addToUnchanged(catalog, action, name, aggregate.map(def -> def.getName().getId()).orElse(null), edits);
		}

		if (aggregate.isPresent()) {
			TLAUtils.addEdit(edits, aggregate.get().getBody(), tuple -> {
				List<TLANode> elements = tuple.getChildren();
				elements.add(TLAUtils.idexp(name));
				return tuple.withChildren(elements);
			});
		}

		if (typeInvariant.isPresent()) {
			TLAExpression typeConjunct = TLAUtils.binop("\\in", TLAUtils.idexp(name), type);
			TLAUtils.addEdit(edits, typeInvariant.get().getBody(),
					body -> TLAUtils.conjoin((TLAExpression) body, typeConjunct));
		}

		TLAModule result = TLAUtils.substitute(module, edits);
		if (lastDeclaration == null) {
			result = result.withUnits(insertDeclaration(result.getUnits(), name));
		}
		logger.fine("added variable " + name + " to " + catalog.getActions().size() + " action(s)");
		return result;
	}

	private static void requireResolved(DeclarationCatalog catalog, TLAExpression expr, boolean inType) throws Issue {
		List<TLAIdentifier> unresolved = ReferenceResolution.findUnresolved(catalog, expr);
		if (!unresolved.isEmpty()) {
			throw new UnresolvedReferenceIssue(unresolved.get(0), inType);
		}
	}

	private static List<TLAUnit> insertDeclaration(List<TLAUnit> units, String name) {
		int position = 0;
		for (int i = 0; i < units.size(); ++i) {
			if (units.get(i) instanceof TLAConstantDeclaration) {
				position = i + 1;
			}
		}
		List<TLAUnit> result = new ArrayList<>(units);
		result.add(position, new TLAVariableDeclaration(
				SourceLocation.unknown(), new ArrayList<>(Collections.singletonList(TLAUtils.id(name)))));
		return result;
	}

	/**
	 * @return every node whose edit would account for the new variable on branch
	 */
	private static List<TLANode> editPoints(BranchEffects branch, TLAExpression body) {
		List<TLANode> points = new ArrayList<>(branch.getUnchangedNodes());
		points.addAll(branch.getChoices());
		points.add(body);
		return points;
	}

	private static boolean containsAny(List<TLANode> points, Set<TLANode> chosen) {
		for (TLANode point : points) {
			if (chosen.contains(point)) {
				return true;
			}
		}
		return false;
	}

	private static void addToUnchanged(DeclarationCatalog catalog, TLAOperatorDefinition action, String name,
	                                   String aggregateName, Map<TLANode, UnaryOperator<TLANode>> edits) {
		TLAExpression body = action.getBody();
		Set<TLANode> chosen = Collections.newSetFromMap(new IdentityHashMap<>());
		List<List<TLANode>> settled = new ArrayList<>();
		for (BranchEffects branch : BranchEffectsAnalyzer.branchEffects(catalog, action)) {
			if (branch.isDelegated() || (aggregateName != null && branch.getExpandedTuples().contains(aggregateName))) {
				continue;
			}
			List<TLANode> points = editPoints(branch, body);
			if (containsAny(points, chosen)) {
				settled.add(points);
				continue;
			}
			// the first UNCHANGED clause that no already settled branch shares, else the branch itself
			TLANode pick = branch.getContainer();
			for (TLAUnary unchanged : branch.getUnchangedNodes()) {
				boolean shared = false;
				for (List<TLANode> other : settled) {
					for (TLANode point : other) {
						shared |= point == unchanged;
					}
				}
				if (!shared) {
					pick = unchanged;
					break;
				}
			}
			chosen.add(pick);
			settled.add(points);
		}
		for (TLANode point : chosen) {
			if (point instanceof TLAUnary && ((TLAUnary) point).isUnchanged()) {
				TLAUtils.addEdit(edits, point, unchanged -> extendUnchanged((TLAUnary) unchanged, name));
			} else {
				TLAUtils.addEdit(edits, point,
						container -> TLAUtils.conjoin((TLAExpression) container, TLAUtils.unchanged(TLAUtils.idexp(name))));
			}
		}
		if (!chosen.isEmpty()) {
			logger.fine("extended " + chosen.size() + " UNCHANGED clause(s) of " + action.getName().getId());
		}
	}

	/**
	 * {@code UNCHANGED <<a, b>>} becomes {@code UNCHANGED <<a, b, name>>}, {@code UNCHANGED a} becomes
	 * {@code UNCHANGED <<a, name>>}.
	 */
	public static TLAUnary extendUnchanged(TLAUnary unchanged, String name) {
		TLAExpression operand = unchanged.getOperand();
		TLAExpression extended;
		if (operand instanceof TLATuple) {
			List<TLANode> elements = operand.getChildren();
			elements.add(TLAUtils.idexp(name));
			extended = operand.withChildren(elements);
		} else {
			extended = new TLATuple(SourceLocation.unknown(), new ArrayList<>(Arrays.asList(operand, TLAUtils.idexp(name))));
		}
		return (TLAUnary) unchanged.withChildren(Collections.singletonList(extended));
	}
}
