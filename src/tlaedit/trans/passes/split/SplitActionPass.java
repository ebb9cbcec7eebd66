package tlaedit.trans.passes.split;

import tlaedit.errors.Issue;
import tlaedit.model.tla.*;
import tlaedit.trans.SplitActionRequest;
import tlaedit.trans.intermediate.ControlLocation;
import tlaedit.trans.intermediate.DeclarationCatalog;
import tlaedit.trans.intermediate.NamingScheme;
import tlaedit.trans.passes.effects.BranchEffectsAnalyzer;
import tlaedit.trans.passes.parse.tla.TLAParsingPass;
import tlaedit.util.SourceLocation;

import java.util.*;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 *
 * Splits an action A, guarded on location L, into two actions that run one after the other:
 *
 * <ul>
 *     <li>A keeps its guards and the effects on the first-half variables, and moves to a new location M.</li>
 *     <li>A new action, defined right after A, is guarded on M and performs everything else A used to.</li>
 * </ul>
 *
 * Every disjunction that lists A (the next-state relation, a process's dispatcher) and every fairness
 * condition on A gains the new action as well, and M joins every enumeration of locations next to L.
 *
 * When the derived name of the new action or of M is already taken by a later member of the same
 * numbered family, that member and every one after it are renumbered up by one first.
 *
 */
public class SplitActionPass {
	private SplitActionPass() {}

	private static final Logger logger = Logger.getLogger("TLAEdit");

	private enum Role {
		LOCATION_GUARD,
		GUARD,
		LOCATION_ASSIGNMENT,
		UNCHANGED,
		FIRST_HALF,
		SECOND_HALF,
	}

	/**
	 * The top-level conjuncts of an action, each with the half it goes to.
	 */
	private static final class Anatomy {
		final TLAJunction body;
		final List<Role> roles = new ArrayList<>();
		TLABinOp guard;
		ControlLocation guardLocation;
		final Set<String> firstHalfAssigned = new HashSet<>();

		Anatomy(TLAJunction body) {
			this.body = body;
		}
	}

	public static TLAModule perform(DeclarationCatalog catalog, TLAModule module, SplitActionRequest request)
			throws Issue {
		String actionName = request.getActionName();
		TLAOperatorDefinition action = catalog.getDefinition(actionName);
		Anatomy anatomy = analyze(catalog, action, request.getFirstHalf());

		boolean nameDerived = request.getNewName() == null;
		String newName;
		if (nameDerived) {
			NamingScheme scheme = NamingScheme.of(actionName);
			if (!scheme.isNumeric()) {
				throw new AmbiguousNameIssue("action", actionName);
			}
			newName = scheme.successor();
		} else {
			newName = TLAParsingPass.performIdentifier("action name", request.getNewName());
		}

		ControlLocation guardLocation = anatomy.guardLocation;
		NamingScheme locationScheme = NamingScheme.of(guardLocation.getName());
		ControlLocation mid;
		boolean midDerived;
		if (request.getNewLocation() != null) {
			String location = guardLocation.isConstant() ?
					TLAParsingPass.performIdentifier("control location", request.getNewLocation()) :
					request.getNewLocation();
			mid = guardLocation.renamed(location);
			midDerived = false;
		} else if (guardLocation.getName().equals(actionName)) {
			// labels and actions share names, as in translated PlusCal
			mid = guardLocation.renamed(newName);
			midDerived = nameDerived;
		} else if (locationScheme.isNumeric()) {
			mid = guardLocation.renamed(locationScheme.successor());
			midDerived = true;
		} else if (!nameDerived) {
			mid = guardLocation.renamed(newName);
			midDerived = false;
		} else {
			throw new AmbiguousNameIssue("control location", guardLocation.toString());
		}
		if (mid.isConstant() && mid.getName().equals(newName)) {
			throw new CollisionUnresolvableIssue(newName, "the new action and the new control location cannot share a name");
		}

		Map<String, String> actionRenames = new LinkedHashMap<>();
		if (catalog.isDeclared(newName)) {
			if (!nameDerived) {
				throw new CollisionUnresolvableIssue(newName, "it is already declared");
			}
			actionRenames = renumbered(catalog.getFamily(actionName), NamingScheme.of(newName));
			if (!actionRenames.containsKey(newName)) {
				throw new CollisionUnresolvableIssue(newName, "it is declared, but not as an action numbered like " + actionName);
			}
		}

		Set<String> locationNames = new LinkedHashSet<>();
		Set<ControlLocation> locations = new LinkedHashSet<>(catalog.getUsedLocations());
		locations.addAll(catalog.getDeclaredLocations());
		for (ControlLocation location : locations) {
			if (location.isConstant() == mid.isConstant()) {
				locationNames.add(location.getName());
			}
		}
		Map<String, String> locationRenames = new LinkedHashMap<>();
		if (locationNames.contains(mid.getName()) || (mid.isConstant() && catalog.isDeclared(mid.getName()))) {
			if (!midDerived) {
				throw new CollisionUnresolvableIssue(mid.getName(), "it is already a control location");
			}
			locationRenames = renumbered(new ArrayList<>(locationNames), NamingScheme.of(mid.getName()));
			if (!locationRenames.containsKey(mid.getName())) {
				throw new CollisionUnresolvableIssue(mid.getName(), "it is declared, but not as a control location");
			}
		}

		Map<String, String> identifierRenames = new LinkedHashMap<>(actionRenames);
		Map<String, String> stringRenames = new LinkedHashMap<>();
		if (mid.isConstant()) {
			for (Map.Entry<String, String> rename : locationRenames.entrySet()) {
				String previous = identifierRenames.put(rename.getKey(), rename.getValue());
				if (previous != null && !previous.equals(rename.getValue())) {
					throw new CollisionUnresolvableIssue(rename.getKey(),
							"it would have to become both " + previous + " and " + rename.getValue());
				}
			}
		} else {
			stringRenames.putAll(locationRenames);
		}
		checkRenames(identifierRenames, catalog::isDeclared);
		checkRenames(stringRenames, locationNames::contains);

		if (!identifierRenames.isEmpty() || !stringRenames.isEmpty()) {
			logger.fine("renumbering " + identifierRenames + " " + stringRenames + " to make room for " + newName);
			module = RenamingPass.perform(module, identifierRenames, stringRenames);
			catalog = DeclarationCatalog.of(module);
			action = catalog.getDefinition(actionName);
			anatomy = analyze(catalog, action, request.getFirstHalf());
		}

		TLAModule result = split(catalog, module, action, anatomy, newName, mid);
		logger.fine("split " + actionName + " at " + mid + " into " + actionName + " and " + newName);
		return result;
	}

	/**
	 * @return the renames that move every member of start's family, from start's index on, up by one
	 */
	private static Map<String, String> renumbered(List<String> names, NamingScheme start) {
		List<NamingScheme> members = new ArrayList<>();
		for (String name : names) {
			NamingScheme member = NamingScheme.of(name);
			if (start.isSameFamily(member) && member.getIndex() >= start.getIndex()) {
				members.add(member);
			}
		}
		members.sort(Comparator.comparingInt(NamingScheme::getIndex));
		Map<String, String> renames = new LinkedHashMap<>();
		for (NamingScheme member : members) {
			renames.put(member.getName(), member.successor());
		}
		return renames;
	}

	private static void checkRenames(Map<String, String> renames, Predicate<String> taken) {
		Set<String> targets = new HashSet<>();
		for (Map.Entry<String, String> rename : renames.entrySet()) {
			String target = rename.getValue();
			if (!targets.add(target)) {
				throw new CollisionUnresolvableIssue(target, "more than one name would be renumbered to it");
			}
			if (!renames.containsKey(target) && taken.test(target)) {
				throw new CollisionUnresolvableIssue(target,
						"renumbering " + rename.getKey() + " would collide with an existing declaration");
			}
		}
	}

	private static Anatomy analyze(DeclarationCatalog catalog, TLAOperatorDefinition action, List<String> firstHalf)
			throws Issue {
		String name = action.getName().getId();
		if (!catalog.isAction(name)) {
			throw new NotSplittableIssue(name, "it is not an action");
		}
		String locationVariable = catalog.getLocationVariable()
				.orElseThrow(() -> new NotSplittableIssue(name, "the module has no control-location variable"));
		TLAExpression body = action.getBody();
		if (!(body instanceof TLAJunction) || ((TLAJunction) body).getKind() != TLAJunction.Kind.CONJUNCTION) {
			throw new NotSplittableIssue(name, "its body is not a conjunction");
		}
		Set<String> assignedAnywhere = BranchEffectsAnalyzer.assignedVariables(body);
		for (String variable : firstHalf) {
			if (variable.equals(locationVariable)) {
				throw new NotSplittableIssue(name, "the control-location variable " + variable +
						" cannot be assigned by the first half");
			}
			if (!assignedAnywhere.contains(variable)) {
				throw new NotSplittableIssue(name, variable + " is not assigned by the action");
			}
		}

		Anatomy anatomy = new Anatomy((TLAJunction) body);
		boolean movesOn = false;
		for (TLAExpression item : anatomy.body.getItems()) {
			Role role;
			Optional<ControlLocation> guarded = catalog.matchLocationGuard(item);
			if (anatomy.guard == null && guarded.isPresent()) {
				anatomy.guard = (TLABinOp) item;
				anatomy.guardLocation = guarded.get();
				role = Role.LOCATION_GUARD;
			} else if (catalog.findAssignedLocationExpression(item) != null) {
				role = Role.LOCATION_ASSIGNMENT;
				movesOn = true;
			} else if (item instanceof TLAUnary && ((TLAUnary) item).isUnchanged()) {
				role = Role.UNCHANGED;
			} else if (!BranchEffectsAnalyzer.isActionLike(catalog, item)) {
				role = Role.GUARD;
			} else {
				Set<String> assigned = BranchEffectsAnalyzer.assignedVariables(item);
				boolean moves = containsLocationAssignment(catalog, item);
				movesOn |= moves;
				Set<String> early = new LinkedHashSet<>(assigned);
				early.retainAll(firstHalf);
				if (early.isEmpty()) {
					role = Role.SECOND_HALF;
				} else if (early.size() == assigned.size() && !moves) {
					role = Role.FIRST_HALF;
					anatomy.firstHalfAssigned.addAll(assigned);
				} else {
					throw new NotSplittableIssue(name, "one conjunct assigns " + String.join(", ", early) +
							" together with effects of the second half");
				}
			}
			anatomy.roles.add(role);
		}
		if (anatomy.guard == null) {
			throw new NotSplittableIssue(name, "it is not guarded on a control location");
		}
		if (!movesOn) {
			throw new NotSplittableIssue(name, "it does not move to a control location");
		}
		for (int i = 0; i < anatomy.roles.size(); ++i) {
			Role role = anatomy.roles.get(i);
			if ((role == Role.SECOND_HALF || role == Role.LOCATION_ASSIGNMENT) &&
					reads(anatomy.body.getItems().get(i), anatomy.firstHalfAssigned)) {
				Set<String> read = new TreeSet<>(anatomy.firstHalfAssigned);
				read.retainAll(readVariables(anatomy.body.getItems().get(i)));
				throw new NotSplittableIssue(name, "a conjunct of the second half reads " + String.join(", ", read) +
						", which the first half assigns");
			}
		}
		return anatomy;
	}

	private static boolean containsLocationAssignment(DeclarationCatalog catalog, TLAExpression expr) {
		boolean[] found = {false};
		TLAUtils.forEachNode(expr, node -> {
			if (node instanceof TLAExpression && catalog.findAssignedLocationExpression((TLAExpression) node) != null) {
				found[0] = true;
			}
		});
		return found[0];
	}

	private static Set<String> readVariables(TLAExpression expr) {
		Set<String> names = new HashSet<>();
		TLAUtils.forEachNode(expr, node -> {
			if (node instanceof TLAGeneralIdentifier) {
				names.add(((TLAGeneralIdentifier) node).getName().getId());
			}
		});
		return names;
	}

	private static boolean reads(TLAExpression expr, Set<String> variables) {
		return !Collections.disjoint(readVariables(expr), variables);
	}

	private static TLAModule split(DeclarationCatalog catalog, TLAModule module, TLAOperatorDefinition action,
	                               Anatomy anatomy, String newName, ControlLocation mid) {
		String actionName = action.getName().getId();
		String locationVariable = catalog.getLocationVariable().get();
		List<String> variables = catalog.getVariables();
		List<String> firstHalfAssigned = new ArrayList<>();
		List<String> stay = new ArrayList<>();
		for (String variable : variables) {
			if (anatomy.firstHalfAssigned.contains(variable)) {
				firstHalfAssigned.add(variable);
			} else if (!variable.equals(locationVariable)) {
				stay.add(variable);
			}
		}

		List<TLAExpression> items = anatomy.body.getItems();
		List<TLANode> first = new ArrayList<>();
		List<TLANode> second = new ArrayList<>();
		boolean movePlaced = false;
		boolean unchangedSeen = false;
		int unchangedPosition = -1;
		for (int i = 0; i < items.size(); ++i) {
			TLAExpression item = items.get(i);
			switch (anatomy.roles.get(i)) {
				case LOCATION_GUARD:
					first.add(item);
					second.add(item.withChildren(Arrays.<TLANode>asList(anatomy.guard.getLHS(), mid.toExpression())));
					break;
				case GUARD:
					first.add(item);
					if (!reads(item, anatomy.firstHalfAssigned)) {
						second.add(item);
					}
					break;
				case FIRST_HALF:
					first.add(item);
					break;
				case SECOND_HALF:
					second.add(item);
					break;
				case LOCATION_ASSIGNMENT:
					if (!movePlaced) {
						first.add(moveTo(catalog, item, mid));
						movePlaced = true;
					}
					second.add(item);
					break;
				case UNCHANGED:
					if (unchangedSeen) {
						second.add(item);
						break;
					}
					unchangedSeen = true;
					TLAUnary unchanged = (TLAUnary) item;
					if (!stay.isEmpty()) {
						unchangedPosition = first.size();
						first.add(restrictUnchanged(catalog, unchanged, stay));
					}
					second.add(extendUnchanged(catalog, unchanged, firstHalfAssigned));
					break;
				default:
					throw new IllegalStateException("unknown role " + anatomy.roles.get(i));
			}
		}
		if (!movePlaced) {
			TLAExpression move = buildMove(locationVariable, anatomy.guard, mid);
			if (unchangedPosition != -1) {
				first.add(unchangedPosition, move);
			} else {
				first.add(move);
			}
		}
		if (!unchangedSeen) {
			if (!stay.isEmpty()) {
				first.add(TLAUtils.unchanged(stay));
			}
			if (!firstHalfAssigned.isEmpty()) {
				second.add(TLAUtils.unchanged(firstHalfAssigned));
			}
		}

		TLAOperatorDefinition firstHalf = action.withBody((TLAExpression) anatomy.body.withChildren(first));
		List<TLANode> secondChildren = action.getChildren();
		secondChildren.set(0, TLAUtils.id(newName));
		secondChildren.set(secondChildren.size() - 1, anatomy.body.withChildren(second));
		TLAOperatorDefinition secondHalf = action.withChildren(secondChildren);

		Map<TLANode, UnaryOperator<TLANode>> edits = new IdentityHashMap<>();
		edits.put(action, n -> firstHalf);
		addLocation(catalog, anatomy.guardLocation, mid, edits);
		addDisjuncts(catalog, actionName, newName, edits);
		addFairness(catalog, module, actionName, newName, edits);

		TLAModule result = TLAUtils.substitute(module, edits);
		List<TLAUnit> units = new ArrayList<>(result.getUnits());
		for (int i = 0; i < units.size(); ++i) {
			if (units.get(i) == firstHalf) {
				units.add(i + 1, secondHalf);
				break;
			}
		}
		return result.withUnits(units);
	}

	/**
	 * Rewrites a location assignment so that it moves to mid instead.
	 */
	private static TLAExpression moveTo(DeclarationCatalog catalog, TLAExpression assignment, ControlLocation mid) {
		Map<TLANode, UnaryOperator<TLANode>> edits = new IdentityHashMap<>();
		edits.put(catalog.findAssignedLocationExpression(assignment), n -> mid.toExpression());
		return TLAUtils.substitute(assignment, edits);
	}

	/**
	 * Builds a move to mid shaped like guard: {@code pc' = M} for {@code pc = L}, and
	 * {@code pc' = [pc EXCEPT ![self] = M]} for {@code pc[self] = L}.
	 */
	private static TLAExpression buildMove(String locationVariable, TLABinOp guard, ControlLocation mid) {
		TLAExpression value = mid.toExpression();
		if (guard.getLHS() instanceof TLAFunctionCall) {
			TLAFunctionCall read = (TLAFunctionCall) guard.getLHS();
			TLASubstitutionKey key = new TLASubstitutionKey(SourceLocation.unknown(), read.getParams());
			value = new TLAFunctionSubstitution(SourceLocation.unknown(), TLAUtils.idexp(locationVariable),
					Collections.singletonList(new TLAFunctionSubstitutionPair(
							SourceLocation.unknown(), Collections.singletonList(key), value)));
		}
		return TLAUtils.binop("=", TLAUtils.prime(TLAUtils.idexp(locationVariable)), value);
	}

	private static String variableName(DeclarationCatalog catalog, TLAExpression element) {
		if (element instanceof TLAGeneralIdentifier) {
			String name = ((TLAGeneralIdentifier) element).getName().getId();
			if (catalog.isVariable(name)) {
				return name;
			}
		}
		return null;
	}

	private static List<TLAExpression> unchangedElements(TLAUnary unchanged) {
		TLAExpression operand = unchanged.getOperand();
		if (operand instanceof TLATuple) {
			return new ArrayList<>(((TLATuple) operand).getElements());
		}
		return new ArrayList<>(Collections.singletonList(operand));
	}

	/**
	 * Inserts each of names into elements, before the first element declared after it.
	 */
	private static void mergeByDeclaration(DeclarationCatalog catalog, List<TLAExpression> elements,
	                                       List<String> names) {
		List<String> order = catalog.getVariables();
		Set<String> present = new HashSet<>();
		for (TLAExpression element : elements) {
			String name = variableName(catalog, element);
			if (name != null) {
				present.add(name);
			}
		}
		for (String name : names) {
			if (!present.add(name)) {
				continue;
			}
			int rank = order.indexOf(name);
			int position = elements.size();
			for (int i = 0; i < elements.size(); ++i) {
				String other = variableName(catalog, elements.get(i));
				if (other != null && order.indexOf(other) > rank) {
					position = i;
					break;
				}
			}
			elements.add(position, TLAUtils.idexp(name));
		}
	}

	private static TLAUnary withElements(TLAUnary unchanged, List<TLAExpression> elements) {
		TLAExpression operand = unchanged.getOperand();
		TLAExpression newOperand;
		if (operand instanceof TLATuple) {
			newOperand = (TLAExpression) operand.withChildren(new ArrayList<>(elements));
		} else if (elements.size() == 1) {
			newOperand = elements.get(0);
		} else {
			newOperand = new TLATuple(SourceLocation.unknown(), elements);
		}
		if (newOperand == operand) {
			return unchanged;
		}
		return (TLAUnary) unchanged.withChildren(Collections.singletonList(newOperand));
	}

	private static boolean allVariables(DeclarationCatalog catalog, List<TLAExpression> elements) {
		for (TLAExpression element : elements) {
			if (variableName(catalog, element) == null) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return unchanged, listing exactly the variables in stay
	 */
	private static TLAUnary restrictUnchanged(DeclarationCatalog catalog, TLAUnary unchanged, List<String> stay) {
		List<TLAExpression> elements = unchangedElements(unchanged);
		if (!allVariables(catalog, elements)) {
			// a tuple definition may cover variables of the first half, so list them one by one
			return (TLAUnary) unchanged.withChildren(Collections.singletonList(TLAUtils.unchanged(stay).getOperand()));
		}
		elements.removeIf(element -> !stay.contains(variableName(catalog, element)));
		mergeByDeclaration(catalog, elements, stay);
		return withElements(unchanged, elements);
	}

	/**
	 * @return unchanged, also listing the variables in extra
	 */
	private static TLAUnary extendUnchanged(DeclarationCatalog catalog, TLAUnary unchanged, List<String> extra) {
		if (extra.isEmpty()) {
			return unchanged;
		}
		List<TLAExpression> elements = unchangedElements(unchanged);
		if (allVariables(catalog, elements)) {
			mergeByDeclaration(catalog, elements, extra);
		} else {
			for (String name : extra) {
				elements.add(TLAUtils.idexp(name));
			}
		}
		return withElements(unchanged, elements);
	}

	private static void addLocation(DeclarationCatalog catalog, ControlLocation after, ControlLocation mid,
	                                Map<TLANode, UnaryOperator<TLANode>> edits) {
		List<String> constants = catalog.getConstants();
		for (TLASetConstructor enumeration : catalog.getLocationEnumerations()) {
			TLAUtils.addEdit(edits, enumeration, set -> {
				List<TLANode> elements = set.getChildren();
				int position = elements.size();
				for (int i = 0; i < elements.size(); ++i) {
					Optional<ControlLocation> location = ControlLocation.of((TLAExpression) elements.get(i), constants);
					if (location.isPresent() && location.get().equals(mid)) {
						return set;
					}
					if (location.isPresent() && location.get().equals(after)) {
						position = i + 1;
					}
				}
				elements.add(position, mid.toExpression());
				return set.withChildren(elements);
			});
		}
		if (!mid.isConstant()) {
			return;
		}
		for (TLAUnit unit : catalog.getModule().getUnits()) {
			if (!(unit instanceof TLAConstantDeclaration)) {
				continue;
			}
			List<TLAIdentifier> declared = ((TLAConstantDeclaration) unit).getConstants();
			for (int i = 0; i < declared.size(); ++i) {
				if (declared.get(i).getId().equals(after.getName())) {
					int position = i + 1;
					TLAUtils.addEdit(edits, unit, declaration -> {
						List<TLANode> children = declaration.getChildren();
						children.add(position, TLAUtils.id(mid.getName()));
						return declaration.withChildren(children);
					});
					return;
				}
			}
		}
	}

	private static TLAExpression renamedCopy(TLAExpression expr, String from, String to) {
		return RenamingPass.perform(expr, Collections.singletonMap(from, to), Collections.emptyMap());
	}

	/**
	 * Lists the new action right after the split one in every disjunction over actions.
	 */
	private static void addDisjuncts(DeclarationCatalog catalog, String actionName, String newName,
	                                 Map<TLANode, UnaryOperator<TLANode>> edits) {
		for (TLAJunction disjunction : catalog.getDisjunctionsReferencing(actionName)) {
			TLAUtils.addEdit(edits, disjunction, junction -> {
				List<TLANode> items = new ArrayList<>();
				for (TLANode item : junction.getChildren()) {
					items.add(item);
					if (DeclarationCatalog.referencesAction((TLAExpression) item, actionName)) {
						items.add(renamedCopy((TLAExpression) item, actionName, newName));
					}
				}
				return junction.withChildren(items);
			});
		}
		// a dispatcher, or Next itself, with a single disjunct
		Optional<TLAOperatorDefinition> next = catalog.getNext();
		for (TLAUnit unit : catalog.getModule().getUnits()) {
			if (!(unit instanceof TLAOperatorDefinition)) {
				continue;
			}
			TLAOperatorDefinition def = (TLAOperatorDefinition) unit;
			String name = def.getName().getId();
			if (next.isPresent() && next.get() == def) {
				Optional<TLAExpression> disjunct = catalog.findNextDisjunct(actionName);
				if (!disjunct.isPresent() || disjunct.get() != def.getBody()) {
					continue;
				}
			} else if (name.equals(actionName) || !catalog.isActionLike(name) ||
					!DeclarationCatalog.referencesAction(def.getBody(), actionName)) {
				continue;
			}
			TLAUtils.addEdit(edits, def.getBody(), body -> new TLAJunction(
					SourceLocation.unknown(), TLAJunction.Kind.DISJUNCTION, false,
					Arrays.asList((TLAExpression) body, renamedCopy((TLAExpression) body, actionName, newName))));
		}
	}

	private static boolean isFairnessOn(TLAExpression expr, String actionName) {
		while (true) {
			if (expr instanceof TLAQuantifiedUniversal) {
				expr = ((TLAQuantifiedUniversal) expr).getBody();
			} else if (expr instanceof TLAQuantifiedExistential) {
				expr = ((TLAQuantifiedExistential) expr).getBody();
			} else {
				break;
			}
		}
		return expr instanceof TLAFairness &&
				DeclarationCatalog.referencesAction(((TLAFairness) expr).getExpression(), actionName);
	}

	/**
	 * Every weak or strong fairness condition on the split action gets a twin on the new action.
	 */
	private static void addFairness(DeclarationCatalog catalog, TLAModule module, String actionName, String newName,
	                                Map<TLANode, UnaryOperator<TLANode>> edits) {
		boolean fair = false;
		for (TLAFairness clause : catalog.getFairnessClauses()) {
			fair |= DeclarationCatalog.referencesAction(clause.getExpression(), actionName);
		}
		if (!fair) {
			return;
		}
		for (TLAUnit unit : module.getUnits()) {
			if (unit instanceof TLAOperatorDefinition) {
				TLAOperatorDefinition def = (TLAOperatorDefinition) unit;
				if (def.getName().getId().equals(actionName)) {
					continue;
				}
				if (isFairnessOn(def.getBody(), actionName)) {
					TLAUtils.addEdit(edits, def.getBody(), body -> new TLAJunction(
							SourceLocation.unknown(), TLAJunction.Kind.CONJUNCTION, false,
							Arrays.asList((TLAExpression) body, renamedCopy((TLAExpression) body, actionName, newName))));
				}
			}
			TLAUtils.forEachNode(unit, node -> {
				if (!(node instanceof TLAJunction) || ((TLAJunction) node).getKind() != TLAJunction.Kind.CONJUNCTION) {
					return;
				}
				boolean any = false;
				for (TLAExpression item : ((TLAJunction) node).getItems()) {
					any |= isFairnessOn(item, actionName);
				}
				if (!any) {
					return;
				}
				TLAUtils.addEdit(edits, node, junction -> {
					List<TLANode> items = new ArrayList<>();
					for (TLANode item : junction.getChildren()) {
						items.add(item);
						if (isFairnessOn((TLAExpression) item, actionName)) {
							items.add(renamedCopy((TLAExpression) item, actionName, newName));
						}
					}
					return junction.withChildren(items);
				});
			});
		}
	}
}
