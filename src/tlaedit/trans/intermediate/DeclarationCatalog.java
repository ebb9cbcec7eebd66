package tlaedit.trans.intermediate;

import tlaedit.model.tla.*;

import java.util.*;
import java.util.logging.Logger;

/**
 * An index over one module snapshot: what is declared, which definitions play which role, the
 * actions and their families, and the control locations they move between.
 *
 * A catalog never changes. Every edit produces a new module, which gets a new catalog.
 */
public class DeclarationCatalog {

	private static final Logger logger = Logger.getLogger("TLAEdit");

	public static final List<String> TYPE_INVARIANT_NAMES = Collections.unmodifiableList(
			Arrays.asList("TypeOK", "TypeOk", "TypeInvariant", "TypeInv", "TypeCorrect"));

	private final TLAModule module;
	private final List<String> extendedModules;
	private final List<String> variables;
	private final List<String> constants;
	private final Map<String, TLAUnit> definitions;
	private String initName;
	private String nextName;
	private String tupleName;
	private TLAOperatorDefinition typeInvariant;
	private final Set<String> actionLike;
	private final List<TLAOperatorDefinition> actions;
	private final List<TLAOperatorDefinition> helpers;
	private String locationVariable;
	private final Set<ControlLocation> usedLocations;
	private final List<TLASetConstructor> locationEnumerations;
	private final List<TLAFairness> fairnessClauses;

	private DeclarationCatalog(TLAModule module) {
		this.module = module;
		this.extendedModules = new ArrayList<>();
		this.variables = new ArrayList<>();
		this.constants = new ArrayList<>();
		this.definitions = new LinkedHashMap<>();
		this.actionLike = new HashSet<>();
		this.actions = new ArrayList<>();
		this.helpers = new ArrayList<>();
		this.usedLocations = new LinkedHashSet<>();
		this.locationEnumerations = new ArrayList<>();
		this.fairnessClauses = new ArrayList<>();
	}

	public static DeclarationCatalog of(TLAModule module) {
		DeclarationCatalog catalog = new DeclarationCatalog(module);
		catalog.collectDeclarations();
		catalog.inferRoles();
		catalog.classifyActions();
		catalog.findLocations();
		TLAUtils.forEachNode(module, node -> {
			if (node instanceof TLAFairness) {
				catalog.fairnessClauses.add((TLAFairness) node);
			}
		});
		logger.fine("catalogued module " + module.getName().getId() + ": " + catalog.variables.size() +
				" variable(s), " + catalog.actions.size() + " action(s), location variable " +
				catalog.locationVariable);
		return catalog;
	}

	private void collectDeclarations() {
		for (TLAIdentifier ext : module.getExtends()) {
			extendedModules.add(ext.getId());
		}
		for (TLAUnit unit : module.getUnits()) {
			unit.accept(new TLAUnitVisitor<Void, RuntimeException>() {
				@Override
				public Void visit(TLAVariableDeclaration variableDeclaration) {
					for (TLAIdentifier id : variableDeclaration.getVariables()) {
						variables.add(id.getId());
					}
					return null;
				}

				@Override
				public Void visit(TLAConstantDeclaration constantDeclaration) {
					for (TLAIdentifier id : constantDeclaration.getConstants()) {
						constants.add(id.getId());
					}
					return null;
				}

				@Override
				public Void visit(TLAOperatorDefinition operatorDefinition) {
					definitions.putIfAbsent(operatorDefinition.getName().getId(), operatorDefinition);
					return null;
				}

				@Override
				public Void visit(TLAFunctionDefinition functionDefinition) {
					definitions.putIfAbsent(functionDefinition.getName().getId(), functionDefinition);
					return null;
				}

				@Override
				public Void visit(TLAAssumption assumption) {
					return null;
				}

				@Override
				public Void visit(TLATheorem theorem) {
					return null;
				}
			});
		}
	}

	private void inferRoles() {
		// Spec == Init /\ [][Next]_vars /\ ... names all three roles at once
		for (TLAUnit unit : module.getUnits()) {
			if (!(unit instanceof TLAOperatorDefinition) || initName != null) {
				continue;
			}
			TLAOperatorDefinition def = (TLAOperatorDefinition) unit;
			if (!def.getArgs().isEmpty()) {
				continue;
			}
			TLAMaybeAction boxed = null;
			String init = null;
			for (TLAExpression conjunct : TLAUtils.conjuncts(def.getBody())) {
				if (conjunct instanceof TLAUnary && ((TLAUnary) conjunct).getOperation().getValue().equals("[]") &&
						((TLAUnary) conjunct).getOperand() instanceof TLAMaybeAction) {
					boxed = (TLAMaybeAction) ((TLAUnary) conjunct).getOperand();
				} else if (init == null) {
					Optional<String> name = TLAUtils.referencedName(conjunct);
					if (name.isPresent() && definitions.containsKey(name.get())) {
						init = name.get();
					}
				}
			}
			if (boxed != null && init != null) {
				initName = init;
				nextName = TLAUtils.referencedName(boxed.getBody()).orElse(null);
				tupleName = TLAUtils.referencedName(boxed.getVars()).orElse(null);
			}
		}
		if (initName == null && definitions.containsKey("Init")) {
			initName = "Init";
		}
		if (nextName == null && definitions.containsKey("Next")) {
			nextName = "Next";
		}
		if (tupleName == null && definitions.containsKey("vars")) {
			tupleName = "vars";
		}
		for (String name : TYPE_INVARIANT_NAMES) {
			TLAUnit unit = definitions.get(name);
			if (unit instanceof TLAOperatorDefinition) {
				typeInvariant = (TLAOperatorDefinition) unit;
				break;
			}
		}
	}

	private static boolean hasDirectEffects(TLAExpression body) {
		boolean[] found = {false};
		TLAUtils.forEachNode(body, node -> {
			if (node instanceof TLAUnary && (((TLAUnary) node).isPrime() || ((TLAUnary) node).isUnchanged())) {
				found[0] = true;
			}
		});
		return found[0];
	}

	private boolean mayChangeState(TLAExpression expr) {
		if (hasDirectEffects(expr)) {
			return true;
		}
		for (String name : referencedNames(expr)) {
			if (actionLike.contains(name)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Collects the definitions referenced as one conjunct among others that change the state, such as
	 * Send(x) in {@code pc = "a" /\ Send(x) /\ pc' = "b"}.
	 */
	private void findHelperReferences(TLAExpression expr, boolean alongsideEffects, Set<String> result) {
		if (expr instanceof TLAJunction) {
			List<TLAExpression> items = ((TLAJunction) expr).getItems();
			boolean conjunction = ((TLAJunction) expr).getKind() == TLAJunction.Kind.CONJUNCTION;
			for (int i = 0; i < items.size(); ++i) {
				boolean alongside = alongsideEffects;
				for (int j = 0; conjunction && !alongside && j < items.size(); ++j) {
					alongside = j != i && mayChangeState(items.get(j));
				}
				findHelperReferences(items.get(i), alongside, result);
			}
		} else if (expr instanceof TLAIf) {
			findHelperReferences(((TLAIf) expr).getTval(), alongsideEffects, result);
			findHelperReferences(((TLAIf) expr).getFval(), alongsideEffects, result);
		} else if (expr instanceof TLACase) {
			for (TLACaseArm arm : ((TLACase) expr).getArms()) {
				findHelperReferences(arm.getResult(), alongsideEffects, result);
			}
			if (((TLACase) expr).getOther() != null) {
				findHelperReferences(((TLACase) expr).getOther(), alongsideEffects, result);
			}
		} else if (expr instanceof TLAQuantifiedExistential) {
			findHelperReferences(((TLAQuantifiedExistential) expr).getBody(), alongsideEffects, result);
		} else if (expr instanceof TLALet) {
			findHelperReferences(((TLALet) expr).getBody(), alongsideEffects, result);
		} else if (alongsideEffects) {
			TLAUtils.referencedName(expr).filter(actionLike::contains).ifPresent(result::add);
		}
	}

	private static boolean isTemporal(TLAExpression body) {
		boolean[] found = {false};
		TLAUtils.forEachNode(body, node -> {
			if (node instanceof TLAMaybeAction || node instanceof TLAFairness) {
				found[0] = true;
			} else if (node instanceof TLAUnary) {
				String op = ((TLAUnary) node).getOperation().getValue();
				if (op.equals("[]") || op.equals("<>")) {
					found[0] = true;
				}
			}
		});
		return found[0];
	}

	private static Set<String> referencedNames(TLAExpression body) {
		Set<String> names = new HashSet<>();
		TLAUtils.forEachNode(body, node -> {
			if (node instanceof TLAExpression) {
				TLAUtils.referencedName((TLAExpression) node).ifPresent(names::add);
			}
		});
		return names;
	}

	private void classifyActions() {
		Map<String, Set<String>> references = new HashMap<>();
		for (TLAUnit unit : definitions.values()) {
			if (!(unit instanceof TLAOperatorDefinition)) {
				continue;
			}
			TLAOperatorDefinition def = (TLAOperatorDefinition) unit;
			String name = def.getName().getId();
			if (isTemporal(def.getBody())) {
				continue;
			}
			if (hasDirectEffects(def.getBody())) {
				actionLike.add(name);
			}
			references.put(name, referencedNames(def.getBody()));
		}
		// a definition that only dispatches to actions, such as p(self) == a(self) \/ b(self), acts like one
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Map.Entry<String, Set<String>> entry : references.entrySet()) {
				if (actionLike.contains(entry.getKey())) {
					continue;
				}
				for (String referenced : entry.getValue()) {
					if (actionLike.contains(referenced)) {
						actionLike.add(entry.getKey());
						changed = true;
						break;
					}
				}
			}
		}
		Set<String> helperNames = new HashSet<>();
		for (TLAUnit unit : definitions.values()) {
			if (unit instanceof TLAOperatorDefinition && !isTemporal(((TLAOperatorDefinition) unit).getBody())) {
				findHelperReferences(((TLAOperatorDefinition) unit).getBody(), false, helperNames);
			}
		}
		for (TLAUnit unit : module.getUnits()) {
			if (!(unit instanceof TLAOperatorDefinition)) {
				continue;
			}
			TLAOperatorDefinition def = (TLAOperatorDefinition) unit;
			String name = def.getName().getId();
			if (definitions.get(name) != def || name.equals(initName) || name.equals(tupleName) || def == typeInvariant) {
				continue;
			}
			if (!isTemporal(def.getBody()) && hasDirectEffects(def.getBody())) {
				if (helperNames.contains(name)) {
					helpers.add(def);
				} else {
					actions.add(def);
				}
			}
		}
	}

	private void findLocations() {
		if (variables.contains("pc")) {
			locationVariable = "pc";
		} else {
			// otherwise pick the variable most often compared with or assigned location-like literals
			Map<String, Integer> counts = new HashMap<>();
			for (TLAOperatorDefinition action : actions) {
				TLAUtils.forEachNode(action.getBody(), node -> {
					if (!(node instanceof TLABinOp) || !((TLABinOp) node).getOperation().getValue().equals("=")) {
						return;
					}
					TLABinOp binOp = (TLABinOp) node;
					if (!ControlLocation.of(binOp.getRHS(), constants).isPresent()) {
						return;
					}
					TLAExpression lhs = binOp.getLHS();
					if (lhs instanceof TLAUnary && ((TLAUnary) lhs).isPrime()) {
						lhs = ((TLAUnary) lhs).getOperand();
					}
					if (lhs instanceof TLAFunctionCall) {
						lhs = ((TLAFunctionCall) lhs).getFunction();
					}
					if (lhs instanceof TLAGeneralIdentifier) {
						String id = ((TLAGeneralIdentifier) lhs).getName().getId();
						if (variables.contains(id)) {
							counts.merge(id, 1, Integer::sum);
						}
					}
				});
			}
			int best = 0;
			for (String variable : variables) {
				int count = counts.getOrDefault(variable, 0);
				if (count > best) {
					best = count;
					locationVariable = variable;
				}
			}
		}
		if (locationVariable == null) {
			return;
		}
		List<TLAOperatorDefinition> transitions = new ArrayList<>(actions);
		transitions.addAll(helpers);
		for (TLAOperatorDefinition action : transitions) {
			TLAUtils.forEachNode(action.getBody(), node -> {
				if (node instanceof TLAExpression) {
					matchLocationGuard((TLAExpression) node).ifPresent(usedLocations::add);
					matchLocationAssignment((TLAExpression) node).ifPresent(usedLocations::add);
				}
			});
		}
		for (TLAUnit unit : module.getUnits()) {
			TLAUtils.forEachNode(unit, node -> {
				if (!(node instanceof TLASetConstructor)) {
					return;
				}
				TLASetConstructor set = (TLASetConstructor) node;
				boolean allLocations = !set.getContents().isEmpty();
				boolean anyUsed = false;
				for (TLAExpression element : set.getContents()) {
					Optional<ControlLocation> location = ControlLocation.of(element, constants);
					if (!location.isPresent()) {
						allLocations = false;
						break;
					}
					anyUsed |= usedLocations.contains(location.get());
				}
				if (allLocations && anyUsed) {
					locationEnumerations.add(set);
				}
			});
		}
	}

	private boolean isLocationRead(TLAExpression expr) {
		if (expr instanceof TLAFunctionCall) {
			expr = ((TLAFunctionCall) expr).getFunction();
		}
		return expr instanceof TLAGeneralIdentifier &&
				((TLAGeneralIdentifier) expr).getName().getId().equals(locationVariable);
	}

	/**
	 * Matches {@code pc = L} and {@code pc[self] = L}.
	 */
	public Optional<ControlLocation> matchLocationGuard(TLAExpression expr) {
		if (locationVariable == null || !(expr instanceof TLABinOp)) {
			return Optional.empty();
		}
		TLABinOp binOp = (TLABinOp) expr;
		if (!binOp.getOperation().getValue().equals("=") || !isLocationRead(binOp.getLHS())) {
			return Optional.empty();
		}
		return ControlLocation.of(binOp.getRHS(), constants);
	}

	/**
	 * Matches {@code pc' = L} and {@code pc' = [pc EXCEPT ![self] = L]}.
	 */
	public Optional<ControlLocation> matchLocationAssignment(TLAExpression expr) {
		TLAExpression value = findAssignedLocationExpression(expr);
		return value == null ? Optional.empty() : ControlLocation.of(value, constants);
	}

	/**
	 * @return the node holding the location a location assignment moves to, or null if expr is not one
	 */
	public TLAExpression findAssignedLocationExpression(TLAExpression expr) {
		if (locationVariable == null || !(expr instanceof TLABinOp)) {
			return null;
		}
		TLABinOp binOp = (TLABinOp) expr;
		if (!binOp.getOperation().getValue().equals("=") || !(binOp.getLHS() instanceof TLAUnary)) {
			return null;
		}
		TLAUnary lhs = (TLAUnary) binOp.getLHS();
		if (!lhs.isPrime() || !(lhs.getOperand() instanceof TLAGeneralIdentifier) ||
				!((TLAGeneralIdentifier) lhs.getOperand()).getName().getId().equals(locationVariable)) {
			return null;
		}
		TLAExpression rhs = binOp.getRHS();
		if (rhs instanceof TLAFunctionSubstitution) {
			TLAFunctionSubstitution except = (TLAFunctionSubstitution) rhs;
			if (!isLocationRead(except.getSource()) || except.getSubstitutions().size() != 1) {
				return null;
			}
			rhs = except.getSubstitutions().get(0).getValue();
		}
		return ControlLocation.of(rhs, constants).isPresent() ? rhs : null;
	}

	public TLAModule getModule() {
		return module;
	}

	public List<String> getVariables() {
		return Collections.unmodifiableList(variables);
	}

	public List<String> getConstants() {
		return Collections.unmodifiableList(constants);
	}

	public boolean isVariable(String name) {
		return variables.contains(name);
	}

	public boolean isConstant(String name) {
		return constants.contains(name);
	}

	public boolean isDefined(String name) {
		return definitions.containsKey(name);
	}

	/**
	 * @return true if name is taken by a variable, a constant or a definition of this module
	 */
	public boolean isDeclared(String name) {
		return isVariable(name) || isConstant(name) || isDefined(name);
	}

	/**
	 * @return true if an expression of this module may refer to name
	 */
	public boolean isResolvable(String name) {
		if (isDeclared(name) || TLABuiltins.isBuiltin(extendedModules, name)) {
			return true;
		}
		// a module we know nothing about may define anything
		for (String ext : extendedModules) {
			if (!TLABuiltins.isBuiltinModule(ext)) {
				return true;
			}
		}
		return false;
	}

	public Optional<TLAOperatorDefinition> findDefinition(String name) {
		TLAUnit unit = definitions.get(name);
		if (unit instanceof TLAOperatorDefinition) {
			return Optional.of((TLAOperatorDefinition) unit);
		}
		return Optional.empty();
	}

	public TLAOperatorDefinition getDefinition(String name) {
		return findDefinition(name).orElseThrow(() -> new NotFoundIssue("definition", name));
	}

	/**
	 * @return the members of name's numeric family that are defined, ordered by index
	 */
	public List<String> getFamily(String name) {
		NamingScheme scheme = NamingScheme.of(name);
		if (!scheme.isNumeric()) {
			return isDefined(name) ? Collections.singletonList(name) : Collections.emptyList();
		}
		List<NamingScheme> members = new ArrayList<>();
		for (String defined : definitions.keySet()) {
			NamingScheme other = NamingScheme.of(defined);
			if (scheme.isSameFamily(other)) {
				members.add(other);
			}
		}
		members.sort(Comparator.comparingInt(NamingScheme::getIndex));
		List<String> result = new ArrayList<>();
		for (NamingScheme member : members) {
			result.add(member.getName());
		}
		return result;
	}

	public Optional<TLAOperatorDefinition> getInit() {
		return initName == null ? Optional.empty() : findDefinition(initName);
	}

	public Optional<TLAOperatorDefinition> getNext() {
		return nextName == null ? Optional.empty() : findDefinition(nextName);
	}

	/**
	 * @return the definition of the tuple of all variables, such as {@code vars == <<x, y>>}
	 */
	public Optional<TLAOperatorDefinition> getAggregateTuple() {
		if (tupleName == null) {
			return Optional.empty();
		}
		return findTupleDefinition(tupleName);
	}

	/**
	 * @return the definition of name if it is a parameterless definition whose body is a tuple
	 */
	public Optional<TLAOperatorDefinition> findTupleDefinition(String name) {
		Optional<TLAOperatorDefinition> def = findDefinition(name);
		if (def.isPresent() && def.get().getArgs().isEmpty() && def.get().getBody() instanceof TLATuple) {
			return def;
		}
		return Optional.empty();
	}

	public Optional<TLAOperatorDefinition> getTypeInvariant() {
		return Optional.ofNullable(typeInvariant);
	}

	public List<TLAOperatorDefinition> getActions() {
		return Collections.unmodifiableList(actions);
	}

	public boolean isAction(String name) {
		for (TLAOperatorDefinition action : actions) {
			if (action.getName().getId().equals(name)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return true if name has effects of its own and is used as a conjunct next to other effects, making it
	 * part of its caller rather than a step of its own
	 */
	public boolean isHelper(String name) {
		for (TLAOperatorDefinition helper : helpers) {
			if (helper.getName().getId().equals(name)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return true if a reference to name stands for a state transition, either because name is an action
	 * or because it dispatches to one
	 */
	public boolean isActionLike(String name) {
		return actionLike.contains(name);
	}

	public Optional<String> getLocationVariable() {
		return Optional.ofNullable(locationVariable);
	}

	/**
	 * @return every location some action is guarded on or moves to, in order of first use
	 */
	public Set<ControlLocation> getUsedLocations() {
		return Collections.unmodifiableSet(usedLocations);
	}

	/**
	 * @return the set literals enumerating control locations, wherever in the module they appear
	 */
	public List<TLASetConstructor> getLocationEnumerations() {
		return Collections.unmodifiableList(locationEnumerations);
	}

	public Set<ControlLocation> getDeclaredLocations() {
		Set<ControlLocation> declared = new LinkedHashSet<>();
		for (TLASetConstructor set : locationEnumerations) {
			for (TLAExpression element : set.getContents()) {
				ControlLocation.of(element, constants).ifPresent(declared::add);
			}
		}
		return declared;
	}

	public List<TLAFairness> getFairnessClauses() {
		return Collections.unmodifiableList(fairnessClauses);
	}

	/**
	 * @return true if expr is a reference to action, possibly under existential quantifiers
	 */
	public static boolean referencesAction(TLAExpression expr, String action) {
		while (expr instanceof TLAQuantifiedExistential) {
			expr = ((TLAQuantifiedExistential) expr).getBody();
		}
		Optional<String> name = TLAUtils.referencedName(expr);
		return name.isPresent() && name.get().equals(action);
	}

	/**
	 * @return the disjunct of the next-state relation that refers to action explicitly, if there is one. An
	 * action covered by a parameterized disjunct has none.
	 */
	public Optional<TLAExpression> findNextDisjunct(String action) {
		Optional<TLAOperatorDefinition> next = getNext();
		if (!next.isPresent()) {
			return Optional.empty();
		}
		TLAExpression body = next.get().getBody();
		List<TLAExpression> disjuncts = body instanceof TLAJunction &&
				((TLAJunction) body).getKind() == TLAJunction.Kind.DISJUNCTION ?
				((TLAJunction) body).getItems() : Collections.singletonList(body);
		for (TLAExpression disjunct : disjuncts) {
			if (referencesAction(disjunct, action)) {
				return Optional.of(disjunct);
			}
		}
		return Optional.empty();
	}

	/**
	 * @return every disjunction outside of action itself that lists action as one of its disjuncts, such
	 * as the next-state relation or a process's dispatcher
	 */
	public List<TLAJunction> getDisjunctionsReferencing(String action) {
		List<TLAJunction> result = new ArrayList<>();
		for (TLAUnit unit : module.getUnits()) {
			if (unit instanceof TLAOperatorDefinition &&
					((TLAOperatorDefinition) unit).getName().getId().equals(action)) {
				continue;
			}
			TLAUtils.forEachNode(unit, node -> {
				if (node instanceof TLAJunction && ((TLAJunction) node).getKind() == TLAJunction.Kind.DISJUNCTION) {
					for (TLAExpression item : ((TLAJunction) node).getItems()) {
						if (referencesAction(item, action)) {
							result.add((TLAJunction) node);
							break;
						}
					}
				}
			});
		}
		return result;
	}
}
