package tlaedit.trans.passes.effects;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static tlaedit.TLATestingUtils.loadModule;
import static tlaedit.TLATestingUtils.parseModule;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import tlaedit.model.tla.TLAUnary;
import tlaedit.parser.TLAParseException;
import tlaedit.trans.intermediate.DeclarationCatalog;

public class BranchEffectsAnalyzerTest {

	private static Set<String> set(String... names) {
		return new HashSet<>(Arrays.asList(names));
	}

	private static List<BranchEffects> effectsOf(DeclarationCatalog catalog, String name) {
		return BranchEffectsAnalyzer.branchEffects(catalog, catalog.getDefinition(name));
	}

	@Test
	public void straightLineAction() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("ActionX"));
		List<BranchEffects> effects = effectsOf(catalog, "ActionX_1");
		assertThat(effects.size(), is(1));
		BranchEffects branch = effects.get(0);
		assertThat(branch.getAssigned(), is(Arrays.asList("y", "pc")));
		assertThat(branch.getUnchanged(), is(Arrays.asList("x", "z")));
		assertThat(branch.getPathCondition().size(), is(1));
		assertThat(branch.getContainer(), is(catalog.getDefinition("ActionX_1").getBody()));
		assertFalse(branch.isDelegated());
		for (String variable : catalog.getVariables()) {
			assertThat(branch.coverageOf(variable), is(1));
		}
	}

	@Test
	public void nestedDisjunctionAndLet() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("Comments"));
		List<BranchEffects> effects = effectsOf(catalog, "Work");
		assertThat(effects.size(), is(2));

		BranchEffects dequeue = effects.get(0);
		assertThat(dequeue.getPrimed(), is(set("done", "queue", "pc")));
		assertThat(dequeue.getUnchanged().isEmpty(), is(true));
		assertThat(dequeue.getPathCondition().size(), is(2));
		assertThat(dequeue.getChoices().size(), is(1));

		BranchEffects idle = effects.get(1);
		assertThat(idle.getPrimed(), is(set("pc")));
		assertThat(idle.getUnchangedSet(), is(set("queue", "done")));
		assertThat(idle.getUnchangedNodes().size(), is(1));
	}

	@Test
	public void unchangedThroughTupleDefinition() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("Procs"));
		List<BranchEffects> effects = effectsOf(catalog, "Terminating");
		assertThat(effects.size(), is(1));
		assertThat(effects.get(0).getUnchanged(), is(Arrays.asList("pc", "counter")));
		assertThat(effects.get(0).getExpandedTuples(), is(Collections.singleton("vars")));
	}

	@Test
	public void delegation() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("Procs"));
		List<BranchEffects> proc = effectsOf(catalog, "proc");
		assertThat(proc.size(), is(1));
		assertThat(proc.get(0).getDelegated(), is(Collections.singletonList("s1")));

		List<BranchEffects> next = effectsOf(catalog, "Next");
		assertThat(next.size(), is(2));
		assertThat(next.get(0).getDelegated(), is(Collections.singletonList("proc")));
		assertThat(next.get(1).getDelegated(), is(Collections.singletonList("Terminating")));
	}

	@Test
	public void exceptAssignment() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("Procs"));
		BranchEffects s1 = effectsOf(catalog, "s1").get(0);
		assertThat(s1.getPrimed(), is(set("counter", "pc")));
	}

	@Test
	public void conditionalArms() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(parseModule("---- MODULE Toggle ----\n" +
				"VARIABLES x, y\n" +
				"Init == x = 0 /\\ y = 0\n" +
				"Toggle == IF x > 0 THEN x' = x - 1 /\\ UNCHANGED y ELSE y' = y + 1 /\\ UNCHANGED x\n" +
				"====\n"));
		List<BranchEffects> effects = effectsOf(catalog, "Toggle");
		assertThat(effects.size(), is(2));
		assertThat(effects.get(0).getAssigned(), is(Collections.singletonList("x")));
		assertThat(effects.get(0).getPathCondition().size(), is(1));
		assertThat(effects.get(1).getAssigned(), is(Collections.singletonList("y")));
		TLAUnary negated = (TLAUnary) effects.get(1).getPathCondition().get(0);
		assertThat(negated.getOperation().getValue(), is("~"));
	}

	@Test
	public void overlappingAndUnknown() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("Broken"));
		BranchEffects greedy = effectsOf(catalog, "Greedy").get(0);
		assertThat(greedy.coverageOf("x"), is(2));
		assertThat(greedy.coverageOf("y"), is(1));
		assertThat(greedy.getUnknownUnchanged(), is(Collections.singletonList("ghost")));

		BranchEffects forgetful = effectsOf(catalog, "Forgetful").get(0);
		assertThat(forgetful.coverageOf("y"), is(0));
	}

	private static String independentConditionals(int count) {
		StringBuilder vars = new StringBuilder("pc");
		StringBuilder init = new StringBuilder("pc = \"a\"");
		StringBuilder action = new StringBuilder("Flip ==\n    /\\ pc = \"a\"\n");
		for (int i = 1; i <= count; ++i) {
			vars.append(", v").append(i);
			init.append(" /\\ v").append(i).append(" = 0");
			action.append("    /\\ IF v").append(i).append(" > 0 THEN v").append(i).append("' = 0 ELSE v")
					.append(i).append("' = 1\n");
		}
		action.append("    /\\ pc' = \"b\"\n");
		return "---- MODULE Flips ----\n" +
				"EXTENDS Naturals\n" +
				"VARIABLES " + vars + "\n" +
				"Init == " + init + "\n" +
				action +
				"Next == Flip\n" +
				"====\n";
	}

	@Test(timeout = 5000)
	public void independentConditionalsDoNotMultiply() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(parseModule(independentConditionals(24)));
		List<BranchEffects> effects = effectsOf(catalog, "Flip");
		assertThat(effects.size(), is(1));
		BranchEffects branch = effects.get(0);
		for (String variable : catalog.getVariables()) {
			assertThat(variable, branch.coverageOf(variable), is(1));
		}
		assertThat(branch.getContainer(), is(catalog.getDefinition("Flip").getBody()));
	}

	@Test
	public void singleConditionalKeepsItsArms() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(parseModule(independentConditionals(1)));
		assertThat(effectsOf(catalog, "Flip").size(), is(2));
	}

	@Test
	public void conditionalsCoveringDifferentVariablesMultiply() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(parseModule("---- MODULE Uneven ----\n" +
				"VARIABLES x, y\n" +
				"Init == x = 0 /\\ y = 0\n" +
				"Step ==\n" +
				"    /\\ IF x > 0 THEN x' = 0 ELSE TRUE\n" +
				"    /\\ IF y > 0 THEN y' = 0 ELSE UNCHANGED y\n" +
				"====\n"));
		List<BranchEffects> effects = effectsOf(catalog, "Step");
		assertThat(effects.size(), is(2));
		assertThat(effects.get(0).coverageOf("x"), is(1));
		assertThat(effects.get(1).coverageOf("x"), is(0));
		assertThat(effects.get(1).coverageOf("y"), is(1));
	}

	private static final String MESSAGES = "---- MODULE Messages ----\n" +
			"VARIABLES pc, x, msgs\n" +
			"Locations == {\"L1\", \"L9\"}\n" +
			"Init == pc = \"L1\" /\\ x = 0 /\\ msgs = {}\n" +
			"Send(v) == msgs' = msgs \\cup {v}\n" +
			"Step_1 == pc = \"L1\" /\\ Send(x) /\\ pc' = \"L9\" /\\ UNCHANGED x\n" +
			"Next == Step_1\n" +
			"====\n";

	@Test
	public void helperEffectsCountForTheCaller() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(parseModule(MESSAGES));
		List<BranchEffects> effects = effectsOf(catalog, "Step_1");
		assertThat(effects.size(), is(1));
		BranchEffects branch = effects.get(0);
		assertFalse(branch.isDelegated());
		assertThat(branch.getPrimed(), is(set("pc", "msgs")));
		for (String variable : catalog.getVariables()) {
			assertThat(variable, branch.coverageOf(variable), is(1));
		}
		assertThat(branch.getUnchangedNodes().size(), is(1));
	}

}
