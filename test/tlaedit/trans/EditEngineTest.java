package tlaedit.trans;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static tlaedit.TLATestingUtils.loadModule;
import static tlaedit.TLATestingUtils.parseModule;
import static tlaedit.TLATestingUtils.readFixture;

import java.util.Arrays;

import org.junit.Test;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.model.tla.TLAModule;
import tlaedit.parser.TLAParseException;

public class EditEngineTest {

	@Test
	public void sequenceOfEdits() throws TLAParseException {
		TLAModule module = loadModule("ActionX");
		EditResult result = EditEngine.applyAll(module, Arrays.asList(
				new SplitActionRequest("ActionX_1"),
				new AddVariableRequest("w", "0", "Nat")));
		assertTrue(result.isSuccess());
		assertThat(result.getIssues().isEmpty(), is(true));
		assertThat(result.getOriginal(), sameInstance(module));
		String text = result.getText();
		assertThat(text, containsString("ActionX_1 ==\n" +
				"    /\\ pc = \"L1\"\n" +
				"    /\\ pc' = \"L2\"\n" +
				"    /\\ UNCHANGED <<x, y, z, w>>\n"));
		assertThat(text, containsString("    /\\ pc' = \"L_start\"\n    /\\ UNCHANGED <<x, z, w>>\n"));
		assertThat(result.getCatalog().getVariables(), is(Arrays.asList("x", "y", "z", "pc", "w")));
		assertTrue(result.getCatalog().isAction("ActionX_2"));
	}

	@Test
	public void failureDiscardsEarlierEdits() throws TLAParseException {
		TLAModule module = loadModule("ActionX");
		EditResult result = EditEngine.applyAll(module, Arrays.asList(
				new SplitActionRequest("ActionX_1"),
				new AddVariableRequest("x", "0", "Nat")));
		assertFalse(result.isSuccess());
		assertThat(result.getModule(), sameInstance(module));
		assertThat(result.getIssues().size(), is(1));
		assertThat(result.getIssues().get(0).getKind(), is(ErrorKind.DUPLICATE_NAME));
		assertThat(result.getText(), is(readFixture("ActionX")));
	}

	@Test
	public void editOfInconsistentModuleFails() throws TLAParseException {
		EditResult result = EditEngine.apply(loadModule("Broken"), new AddVariableRequest("w", "0"));
		assertFalse(result.isSuccess());
		assertThat(result.getIssues().isEmpty(), is(false));
		for (Issue issue : result.getIssues()) {
			assertThat(issue.getKind(), is(ErrorKind.VIOLATION));
		}
	}

	@Test(expected = IllegalStateException.class)
	public void failedEditHasNoCatalog() throws TLAParseException {
		EditEngine.apply(loadModule("ActionX"), new SplitActionRequest("Nope")).getCatalog();
	}

	@Test
	public void warningsAccompanySuccess() throws TLAParseException {
		TLAModule module = parseModule("---- MODULE Idle ----\n" +
				"VARIABLES pc\n" +
				"Locations == {\"a\", \"b\"}\n" +
				"Init == pc = \"a\"\n" +
				"Stay == pc = \"a\" /\\ pc' = \"a\"\n" +
				"====\n");
		EditResult result = EditEngine.apply(module, new AddVariableRequest("w", "0"));
		assertTrue(result.isSuccess());
		assertThat(result.getIssues().size(), is(1));
		assertTrue(result.getIssues().get(0).isWarning());
		assertThat(result.getText(), containsString("Stay == pc = \"a\" /\\ pc' = \"a\" /\\ UNCHANGED w\n"));
	}

	@Test
	public void check() throws TLAParseException {
		assertFalse(EditEngine.check(loadModule("ActionX")).hasErrors());
		assertTrue(EditEngine.check(loadModule("Broken")).hasErrors());
	}

	@Test
	public void helperConjunctIsPartOfItsCaller() throws TLAParseException {
		TLAModule module = parseModule("---- MODULE Messages ----\n" +
				"VARIABLES pc, x, msgs\n" +
				"Locations == {\"L1\", \"L9\"}\n" +
				"Init == pc = \"L1\" /\\ x = 0 /\\ msgs = {}\n" +
				"Send(v) == msgs' = msgs \\cup {v}\n" +
				"Step_1 == pc = \"L1\" /\\ Send(x) /\\ pc' = \"L9\" /\\ UNCHANGED x\n" +
				"Next == Step_1\n" +
				"====\n");
		assertFalse(EditEngine.check(module).hasErrors());
		EditResult result = EditEngine.apply(module, new AddVariableRequest("w", "0"));
		assertTrue(result.isSuccess());
		assertThat(result.getText(), containsString("Send(v) == msgs' = msgs \\cup {v}\n"));
		assertThat(result.getText(), containsString(
				"Step_1 == pc = \"L1\" /\\ Send(x) /\\ pc' = \"L9\" /\\ UNCHANGED <<x, w>>\n"));
	}

	@Test(timeout = 10000)
	public void manyIndependentConditionals() throws TLAParseException {
		StringBuilder text = new StringBuilder("---- MODULE Flips ----\nEXTENDS Naturals\nVARIABLES pc");
		for (int i = 1; i <= 20; ++i) {
			text.append(", v").append(i);
		}
		text.append("\nInit == pc = \"a\"");
		for (int i = 1; i <= 20; ++i) {
			text.append(" /\\ v").append(i).append(" = 0");
		}
		text.append("\nFlip ==\n    /\\ pc = \"a\"\n");
		for (int i = 1; i <= 20; ++i) {
			text.append("    /\\ IF v").append(i).append(" > 0 THEN v").append(i).append("' = 0 ELSE v")
					.append(i).append("' = 1\n");
		}
		text.append("    /\\ pc' = \"a\"\nNext == Flip\n====\n");
		EditResult result = EditEngine.apply(parseModule(text.toString()), new AddVariableRequest("w", "0"));
		assertTrue(result.isSuccess());
		assertThat(result.getText(), containsString("    /\\ pc' = \"a\"\n    /\\ UNCHANGED w\n"));
		assertThat(result.getText(), not(containsString("ELSE v1' = 1 /\\ UNCHANGED w")));
	}

}
