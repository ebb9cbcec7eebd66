package tlaedit.trans.passes.validation;

import tlaedit.errors.IssueContext;
import tlaedit.model.tla.TLAExpression;
import tlaedit.model.tla.TLAOperatorDefinition;
import tlaedit.model.tla.TLAUtils;
import tlaedit.trans.intermediate.ControlLocation;
import tlaedit.trans.intermediate.DeclarationCatalog;
import tlaedit.trans.intermediate.InDefinition;
import tlaedit.trans.passes.effects.BranchEffects;
import tlaedit.trans.passes.effects.BranchEffectsAnalyzer;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Checks that a module is well-formed as far as edits are concerned:
 *
 * <ul>
 *     <li>every branch of every action accounts for every variable exactly once, by assigning it or
 *     listing it as UNCHANGED;</li>
 *     <li>if the module enumerates its control locations anywhere, every location an action uses is
 *     enumerated, and every enumerated location is used by some action (the latter only warns).</li>
 * </ul>
 */
public class ConsistencyValidationPass {
	private ConsistencyValidationPass() {}

	private static final Logger logger = Logger.getLogger("TLAEdit");

	public static void perform(IssueContext ctx, DeclarationCatalog catalog) {
		int checked = 0;
		for (TLAOperatorDefinition action : catalog.getActions()) {
			String name = action.getName().getId();
			IssueContext actionCtx = ctx.withContext(new InDefinition(name));
			List<BranchEffects> branches = BranchEffectsAnalyzer.branchEffects(catalog, action);
			for (int i = 0; i < branches.size(); ++i) {
				BranchEffects branch = branches.get(i);
				if (branch.isDelegated()) {
					continue;
				}
				checkBranch(actionCtx, catalog, name, i + 1, branch);
				++checked;
			}
		}
		checkLocations(ctx, catalog);
		logger.fine("checked " + checked + " branch(es) of " + catalog.getActions().size() + " action(s)");
	}

	private static void checkBranch(IssueContext ctx, DeclarationCatalog catalog, String action, int number,
	                                BranchEffects branch) {
		for (String unknown : branch.getUnknownUnchanged()) {
			ctx.error(new UnknownCoverageIssue(action, number, unknown));
		}
		for (String primed : branch.getPrimed()) {
			if (!catalog.isVariable(primed)) {
				ctx.error(new UnknownCoverageIssue(action, number, primed));
			}
		}
		for (String variable : catalog.getVariables()) {
			int coverage = branch.coverageOf(variable);
			if (coverage == 0) {
				ctx.error(new UncoveredVariableIssue(action, number, variable));
			} else if (coverage > 1) {
				ctx.error(new OverlappingCoverageIssue(action, number, variable, coverage));
			}
		}
	}

	private static void checkLocations(IssueContext ctx, DeclarationCatalog catalog) {
		if (catalog.getLocationEnumerations().isEmpty()) {
			return;
		}
		Set<ControlLocation> declared = catalog.getDeclaredLocations();
		for (TLAOperatorDefinition action : catalog.getActions()) {
			Set<ControlLocation> used = new LinkedHashSet<>();
			TLAUtils.forEachNode(action.getBody(), node -> {
				if (node instanceof TLAExpression) {
					catalog.matchLocationGuard((TLAExpression) node).ifPresent(used::add);
					catalog.matchLocationAssignment((TLAExpression) node).ifPresent(used::add);
				}
			});
			String name = action.getName().getId();
			for (ControlLocation location : used) {
				if (!declared.contains(location)) {
					ctx.withContext(new InDefinition(name)).error(new UndeclaredLocationIssue(name, location));
				}
			}
		}
		for (ControlLocation location : declared) {
			if (!catalog.getUsedLocations().contains(location)) {
				ctx.error(new UnusedLocationIssue(location));
			}
		}
	}
}
