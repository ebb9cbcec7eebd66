package tlaedit.trans.passes.split;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static tlaedit.TLATestingUtils.loadModule;
import static tlaedit.TLATestingUtils.parseModule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.Test;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.TopLevelIssueContext;
import tlaedit.formatters.TLASourceRenderer;
import tlaedit.model.tla.TLAExpression;
import tlaedit.model.tla.TLAGeneralIdentifier;
import tlaedit.model.tla.TLAModule;
import tlaedit.model.tla.TLAUnary;
import tlaedit.model.tla.TLAUtils;
import tlaedit.parser.TLAParseException;
import tlaedit.trans.SplitActionRequest;
import tlaedit.trans.intermediate.ControlLocation;
import tlaedit.trans.intermediate.DeclarationCatalog;
import tlaedit.trans.passes.effects.BranchEffectsAnalyzer;
import tlaedit.trans.passes.validation.ConsistencyValidationPass;

public class SplitActionPassTest {

	private static TLAModule split(TLAModule module, SplitActionRequest request) {
		return SplitActionPass.perform(DeclarationCatalog.of(module), module, request);
	}

	private static String splitText(String fixture, SplitActionRequest request) throws TLAParseException {
		return splitText(loadModule(fixture), request);
	}

	private static String splitText(TLAModule module, SplitActionRequest request) {
		TLAModule result = split(module, request);
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ConsistencyValidationPass.perform(ctx, DeclarationCatalog.of(result));
		assertThat(ctx.format(), ctx.getIssues().isEmpty(), is(true));
		return TLASourceRenderer.render(result);
	}

	private static ErrorKind failureKind(String fixture, SplitActionRequest request) throws TLAParseException {
		return failureKind(loadModule(fixture), request);
	}

	private static ErrorKind failureKind(TLAModule module, SplitActionRequest request) {
		try {
			split(module, request);
		} catch (Issue issue) {
			return issue.getKind();
		}
		fail("expected " + request + " to fail");
		return null;
	}

	private static List<TLAExpression> conjuncts(DeclarationCatalog catalog, String action) {
		return TLAUtils.conjuncts(catalog.getDefinition(action).getBody());
	}

	private static List<String> rendered(List<TLAExpression> items) {
		List<String> result = new ArrayList<>();
		for (TLAExpression item : items) {
			result.add(TLASourceRenderer.render(item));
		}
		return result;
	}

	private static Set<String> assigned(DeclarationCatalog catalog, List<TLAExpression> items) {
		Set<String> result = new HashSet<>();
		for (TLAExpression item : items) {
			result.addAll(BranchEffectsAnalyzer.assignedVariables(item));
		}
		result.remove(catalog.getLocationVariable().get());
		return result;
	}

	private static Set<String> identifiers(TLAExpression expr) {
		Set<String> result = new HashSet<>();
		TLAUtils.forEachNode(expr, node -> {
			if (node instanceof TLAGeneralIdentifier) {
				result.add(((TLAGeneralIdentifier) node).getName().getId());
			}
		});
		return result;
	}

	/**
	 * Running the first half and then the second must do what the original action did in one step.
	 */
	private static void assertHalvesComposeToOriginal(TLAModule original, String action, SplitActionRequest request,
	                                                  String newName) {
		TLAModule result = split(original, request);
		DeclarationCatalog before = DeclarationCatalog.of(original);
		DeclarationCatalog after = DeclarationCatalog.of(result);
		List<TLAExpression> originalItems = conjuncts(before, action);
		List<TLAExpression> first = conjuncts(after, action);
		List<TLAExpression> second = conjuncts(after, newName);

		// the first half moves to where the second half starts
		ControlLocation mid = null;
		for (TLAExpression item : first) {
			Optional<ControlLocation> moved = after.matchLocationAssignment(item);
			if (moved.isPresent()) {
				assertThat(mid, nullValue());
				mid = moved.get();
			}
		}
		assertThat(mid, notNullValue());
		assertThat(after.matchLocationGuard(second.get(0)), is(Optional.of(mid)));
		int moves = 0;
		for (TLAExpression item : second) {
			if (after.findAssignedLocationExpression(item) != null) {
				++moves;
			}
		}
		assertThat(moves, is(1));

		Set<String> firstAssigned = assigned(after, first);
		Set<String> secondAssigned = assigned(after, second);
		assertTrue(firstAssigned + " " + secondAssigned, Collections.disjoint(firstAssigned, secondAssigned));
		Set<String> composed = new HashSet<>(firstAssigned);
		composed.addAll(secondAssigned);
		assertThat(composed, is(assigned(before, originalItems)));

		List<String> firstText = rendered(first);
		List<String> secondText = rendered(second);
		for (TLAExpression item : originalItems) {
			String text = TLASourceRenderer.render(item);
			boolean unchanged = item instanceof TLAUnary && ((TLAUnary) item).isUnchanged();
			if (unchanged || before.findAssignedLocationExpression(item) != null) {
				continue;
			}
			if (!BranchEffectsAnalyzer.isActionLike(before, item)) {
				if (!before.matchLocationGuard(item).isPresent()) {
					assertThat(text, firstText.contains(text), is(true));
				}
				continue;
			}
			int copies = Collections.frequency(firstText, text) + Collections.frequency(secondText, text);
			assertThat(text, copies, is(1));
			if (secondText.contains(text)) {
				assertTrue(text, Collections.disjoint(identifiers(item), firstAssigned));
			}
		}
	}

	@Test
	public void halvesComposeToOriginal() throws TLAParseException {
		assertHalvesComposeToOriginal(loadModule("ActionX"), "ActionX_1",
				new SplitActionRequest("ActionX_1"), "ActionX_2");
		assertHalvesComposeToOriginal(loadModule("ActionX"), "ActionX_1",
				new SplitActionRequest("ActionX_1", Collections.singletonList("y"), null, null), "ActionX_2");
		assertHalvesComposeToOriginal(loadModule("ActionX"), "Start",
				new SplitActionRequest("Start", Collections.singletonList("x"), "Begin", null), "Begin");
		assertHalvesComposeToOriginal(loadModule("Pipeline"), "Step1", new SplitActionRequest("Step1"), "Step2");
		assertHalvesComposeToOriginal(loadModule("Procs"), "s1", new SplitActionRequest("s1"), "s2");
		assertHalvesComposeToOriginal(parseModule(GUARDED), "A_1",
				new SplitActionRequest("A_1", Collections.singletonList("x"), null, null), "A_2");
	}

	private static final String GUARDED = "---- MODULE Guarded ----\n" +
			"EXTENDS Naturals\n" +
			"VARIABLES pc, x, y\n" +
			"Init == pc = \"L1\" /\\ x = 0 /\\ y = 0\n" +
			"A_1 ==\n" +
			"    /\\ pc = \"L1\"\n" +
			"    /\\ x < 10\n" +
			"    /\\ y > 0\n" +
			"    /\\ x' = x + 1\n" +
			"    /\\ y' = 0\n" +
			"    /\\ pc' = \"L_done\"\n" +
			"Next == A_1\n" +
			"====\n";

	@Test
	public void guardsReadingFirstHalfVariablesStayBehind() throws TLAParseException {
		String text = splitText(parseModule(GUARDED),
				new SplitActionRequest("A_1", Collections.singletonList("x"), null, null));
		assertThat(text, containsString("A_1 ==\n" +
				"    /\\ pc = \"L1\"\n" +
				"    /\\ x < 10\n" +
				"    /\\ y > 0\n" +
				"    /\\ x' = x + 1\n" +
				"    /\\ pc' = \"L2\"\n" +
				"    /\\ UNCHANGED y\n" +
				"\n" +
				"A_2 ==\n" +
				"    /\\ pc = \"L2\"\n" +
				"    /\\ y > 0\n" +
				"    /\\ y' = 0\n" +
				"    /\\ pc' = \"L_done\"\n" +
				"    /\\ UNCHANGED x\n"));
		assertThat(text, containsString("Next == A_1 \\/ A_2\n"));
	}

	@Test
	public void secondHalfMustNotReadFirstHalfVariables() throws TLAParseException {
		TLAModule module = parseModule("---- MODULE Reads ----\n" +
				"EXTENDS Naturals\n" +
				"VARIABLES pc, x, y\n" +
				"Init == pc = \"L1\" /\\ x = 0 /\\ y = 0\n" +
				"A_1 == pc = \"L1\" /\\ x' = x + 1 /\\ y' = x /\\ pc' = \"L_done\"\n" +
				"Next == A_1\n" +
				"====\n");
		assertThat(failureKind(module, new SplitActionRequest("A_1", Collections.singletonList("x"), null, null)),
				is(ErrorKind.NOT_SPLITTABLE));
		// reading the new value is no different
		TLAModule primed = parseModule("---- MODULE Reads ----\n" +
				"EXTENDS Naturals\n" +
				"VARIABLES pc, x, y\n" +
				"Init == pc = \"L1\" /\\ x = 0 /\\ y = 0\n" +
				"A_1 == pc = \"L1\" /\\ x' = x + 1 /\\ y' = x' /\\ pc' = \"L_done\"\n" +
				"Next == A_1\n" +
				"====\n");
		assertThat(failureKind(primed, new SplitActionRequest("A_1", Collections.singletonList("x"), null, null)),
				is(ErrorKind.NOT_SPLITTABLE));
		// without x in the first half the action splits as usual
		assertThat(splitText(module, new SplitActionRequest("A_1")),
				containsString("A_2 == pc = \"L2\" /\\ x' = x + 1 /\\ y' = x"));
	}

	@Test
	public void helpersAreNotSplittable() throws TLAParseException {
		TLAModule module = parseModule("---- MODULE Messages ----\n" +
				"VARIABLES pc, x, msgs\n" +
				"Init == pc = \"L1\" /\\ x = 0 /\\ msgs = {}\n" +
				"Send(v) == msgs' = msgs \\cup {v}\n" +
				"Step_1 == pc = \"L1\" /\\ Send(x) /\\ pc' = \"L9\" /\\ UNCHANGED x\n" +
				"Next == Step_1\n" +
				"====\n");
		assertThat(failureKind(module, new SplitActionRequest("Send", null, "Post", null)),
				is(ErrorKind.NOT_SPLITTABLE));
	}

	@Test
	public void derivedNames() throws TLAParseException {
		String text = splitText("ActionX", new SplitActionRequest("ActionX_1"));
		assertThat(text, containsString("ActionX_1 ==\n" +
				"    /\\ pc = \"L1\"\n" +
				"    /\\ pc' = \"L2\"\n" +
				"    /\\ UNCHANGED <<x, y, z>>\n" +
				"\n" +
				"ActionX_2 ==\n" +
				"    /\\ pc = \"L2\"\n" +
				"    /\\ y' = y + 2\n" +
				"    /\\ pc' = \"L_start\"\n" +
				"    /\\ UNCHANGED <<x, z>>\n"));
		assertThat(text, containsString("Locations == {\"L1\", \"L2\", \"L_start\"}"));
		assertThat(text, containsString("Next == Start \\/ ActionX_1 \\/ ActionX_2\n"));
		assertThat(text, containsString("Spec == Init /\\ [][Next]_vars /\\ WF_vars(ActionX_1) /\\ WF_vars(ActionX_2)\n"));
		// untouched parts keep their text
		assertThat(text, containsString("Start ==\n    /\\ pc = \"L_start\"\n    /\\ x' = x + 1\n"));
	}

	@Test
	public void firstHalfVariables() throws TLAParseException {
		String text = splitText("ActionX",
				new SplitActionRequest("ActionX_1", Collections.singletonList("y"), null, null));
		assertThat(text, containsString("ActionX_1 ==\n" +
				"    /\\ pc = \"L1\"\n" +
				"    /\\ y' = y + 2\n" +
				"    /\\ pc' = \"L2\"\n" +
				"    /\\ UNCHANGED <<x, z>>\n" +
				"\n" +
				"ActionX_2 ==\n" +
				"    /\\ pc = \"L2\"\n" +
				"    /\\ pc' = \"L_start\"\n" +
				"    /\\ UNCHANGED <<x, y, z>>\n"));
	}

	@Test
	public void explicitNames() throws TLAParseException {
		String text = splitText("ActionX", new SplitActionRequest("Start", null, "Begin", null));
		assertThat(text, containsString("Begin ==\n" +
				"    /\\ pc = \"Begin\"\n" +
				"    /\\ x' = x + 1\n" +
				"    /\\ pc' = \"L1\"\n" +
				"    /\\ UNCHANGED <<y, z>>\n"));
		assertThat(text, containsString("Locations == {\"L1\", \"L_start\", \"Begin\"}"));
		assertThat(text, containsString("Next == Start \\/ Begin \\/ ActionX_1\n"));
	}

	@Test
	public void explicitLocation() throws TLAParseException {
		String text = splitText("ActionX", new SplitActionRequest("ActionX_1", null, null, "L_mid"));
		assertThat(text, containsString("    /\\ pc' = \"L_mid\"\n"));
		assertThat(text, containsString("ActionX_2 ==\n    /\\ pc = \"L_mid\"\n"));
		assertThat(text, containsString("Locations == {\"L1\", \"L_mid\", \"L_start\"}"));
	}

	@Test
	public void renumbering() throws TLAParseException {
		String text = splitText("Pipeline", new SplitActionRequest("Step1"));
		assertThat(text, containsString("Step1 ==\n" +
				"    /\\ pc = \"L1\"\n" +
				"    /\\ pc' = \"L2\"\n" +
				"    /\\ UNCHANGED <<a, b>>\n" +
				"\n" +
				"Step2 ==\n" +
				"    /\\ pc = \"L2\"\n" +
				"    /\\ a' = a + 1\n" +
				"    /\\ pc' = \"L3\"\n" +
				"    /\\ UNCHANGED b\n" +
				"\n" +
				"Step3 ==\n" +
				"    /\\ pc = \"L3\"\n" +
				"    /\\ b' = b + a\n" +
				"    /\\ pc' = \"L4\"\n" +
				"    /\\ UNCHANGED a\n"));
		assertThat(text, containsString("Locations == {\"L1\", \"L2\", \"L3\", \"L4\"}"));
		assertThat(text, containsString("Next ==\n    \\/ Step1\n    \\/ Step2\n    \\/ Step3\n"));
	}

	@Test
	public void processTemplate() throws TLAParseException {
		String text = splitText("Procs", new SplitActionRequest("s1"));
		assertThat(text, containsString("s1(self) ==\n" +
				"    /\\ pc[self] = \"s1\"\n" +
				"    /\\ pc' = [pc EXCEPT ![self] = \"s2\"]\n" +
				"    /\\ UNCHANGED counter\n" +
				"\n" +
				"s2(self) ==\n" +
				"    /\\ pc[self] = \"s2\"\n" +
				"    /\\ counter' = counter + 1\n" +
				"    /\\ pc' = [pc EXCEPT ![self] = \"Done\"]\n"));
		assertThat(text, containsString("proc(self) == s1(self) \\/ s2(self)\n"));
		assertThat(text, containsString("{\"s1\", \"s2\", \"Done\"}"));
	}

	@Test
	public void explicitNameTaken() throws TLAParseException {
		assertThat(failureKind("Pipeline", new SplitActionRequest("Step1", null, "Step2", null)),
				is(ErrorKind.COLLISION_UNRESOLVABLE));
	}

	@Test
	public void explicitLocationTaken() throws TLAParseException {
		assertThat(failureKind("ActionX", new SplitActionRequest("ActionX_1", null, null, "L_start")),
				is(ErrorKind.COLLISION_UNRESOLVABLE));
	}

	@Test
	public void descriptiveNameNeedsExplicitName() throws TLAParseException {
		assertThat(failureKind("ActionX", new SplitActionRequest("Start")), is(ErrorKind.AMBIGUOUS_NAME));
	}

	@Test
	public void notSplittable() throws TLAParseException {
		assertThat(failureKind("ActionX", new SplitActionRequest("Init")), is(ErrorKind.NOT_SPLITTABLE));
		assertThat(failureKind("ActionX", new SplitActionRequest("ActionX_1", Arrays.asList("pc"), null, null)),
				is(ErrorKind.NOT_SPLITTABLE));
		assertThat(failureKind("ActionX", new SplitActionRequest("ActionX_1", Arrays.asList("x"), null, null)),
				is(ErrorKind.NOT_SPLITTABLE));
		assertThat(failureKind("Counter", new SplitActionRequest("Increment")), is(ErrorKind.NOT_SPLITTABLE));
	}

	@Test
	public void unknownAction() throws TLAParseException {
		assertThat(failureKind("ActionX", new SplitActionRequest("Nope")), is(ErrorKind.NOT_FOUND));
	}

}
