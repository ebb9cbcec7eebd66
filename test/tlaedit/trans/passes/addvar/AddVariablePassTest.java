package tlaedit.trans.passes.addvar;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static tlaedit.TLATestingUtils.loadModule;
import static tlaedit.TLATestingUtils.parseModule;
import static tlaedit.TLATestingUtils.readFixture;

import org.junit.Test;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.formatters.TLASourceRenderer;
import tlaedit.model.tla.TLAModule;
import tlaedit.parser.TLAParseException;
import tlaedit.trans.AddVariableRequest;
import tlaedit.trans.intermediate.DeclarationCatalog;

public class AddVariablePassTest {

	private static String addVariable(TLAModule module, AddVariableRequest request) {
		TLAModule result = AddVariablePass.perform(DeclarationCatalog.of(module), module, request);
		return TLASourceRenderer.render(result);
	}

	private static ErrorKind failureKind(TLAModule module, AddVariableRequest request) {
		try {
			AddVariablePass.perform(DeclarationCatalog.of(module), module, request);
		} catch (Issue issue) {
			return issue.getKind();
		}
		fail("expected " + request + " to fail");
		return null;
	}

	@Test
	public void counter() throws TLAParseException {
		String expected = readFixture("Counter")
				.replace("VARIABLES state, counter\n", "VARIABLES state, counter, debug_log\n")
				.replace("vars == <<state, counter>>", "vars == <<state, counter, debug_log>>")
				.replace("    /\\ counter = 0\n", "    /\\ counter = 0\n    /\\ debug_log = <<>>\n")
				.replace("UNCHANGED state", "UNCHANGED <<state, debug_log>>");
		assertThat(addVariable(loadModule("Counter"), new AddVariableRequest("debug_log", "<<>>")), is(expected));
	}

	@Test
	public void typeInvariantIsExtended() throws TLAParseException {
		String text = addVariable(loadModule("ActionX"), new AddVariableRequest("w", "0", "Nat"));
		assertThat(text, containsString("VARIABLES x, y, z, pc, w\n"));
		assertThat(text, containsString("vars == <<x, y, z, pc, w>>"));
		assertThat(text, containsString("    /\\ pc \\in Locations\n    /\\ w \\in Nat\n"));
		assertThat(text, containsString("    /\\ pc = \"L_start\"\n    /\\ w = 0\n"));
		assertThat(text, containsString("UNCHANGED <<y, z, w>>"));
		assertThat(text, containsString("UNCHANGED <<x, z, w>>"));
	}

	@Test
	public void typeRequiredWithTypeInvariant() throws TLAParseException {
		assertThat(failureKind(loadModule("ActionX"), new AddVariableRequest("w", "0")), is(ErrorKind.MISSING_TYPE));
	}

	@Test
	public void duplicateName() throws TLAParseException {
		assertThat(failureKind(loadModule("Counter"), new AddVariableRequest("counter", "0")),
				is(ErrorKind.DUPLICATE_NAME));
		assertThat(failureKind(loadModule("Counter"), new AddVariableRequest("Next", "0")),
				is(ErrorKind.DUPLICATE_NAME));
	}

	@Test
	public void unresolvedInitialValue() throws TLAParseException {
		assertThat(failureKind(loadModule("Counter"), new AddVariableRequest("log", "undefined_thing + 1")),
				is(ErrorKind.SYNTAX_ERROR));
		// the variable being added is not in scope of its own initial value
		assertThat(failureKind(loadModule("Counter"), new AddVariableRequest("log", "log")),
				is(ErrorKind.SYNTAX_ERROR));
	}

	@Test
	public void unresolvedType() throws TLAParseException {
		assertThat(failureKind(loadModule("ActionX"), new AddVariableRequest("w", "0", "Seq(Nat)")),
				is(ErrorKind.MISSING_TYPE));
	}

	@Test
	public void malformedRequest() throws TLAParseException {
		assertThat(failureKind(loadModule("Counter"), new AddVariableRequest("x + 1", "0")),
				is(ErrorKind.SYNTAX_ERROR));
		assertThat(failureKind(loadModule("Counter"), new AddVariableRequest("log", "<<")),
				is(ErrorKind.SYNTAX_ERROR));
	}

	@Test
	public void actionWithoutUnchanged() throws TLAParseException {
		TLAModule module = parseModule("---- MODULE Phase ----\n" +
				"VARIABLES phase, n\n" +
				"Init == phase = \"start\" /\\ n = 0\n" +
				"Go == phase = \"start\" /\\ phase' = \"end\" /\\ n' = n + 1\n" +
				"====\n");
		String text = addVariable(module, new AddVariableRequest("w", "0"));
		assertThat(text, containsString("Init == phase = \"start\" /\\ n = 0 /\\ w = 0\n"));
		assertThat(text, containsString("Go == phase = \"start\" /\\ phase' = \"end\" /\\ n' = n + 1 /\\ UNCHANGED w\n"));
	}

	@Test
	public void unchangedVarsNeedsNothing() throws TLAParseException {
		String text = addVariable(loadModule("Procs"), new AddVariableRequest("flag", "FALSE", "BOOLEAN"));
		assertThat(text, containsString("    /\\ pc' = [pc EXCEPT ![self] = \"Done\"]\n    /\\ UNCHANGED flag\n"));
		assertThat(text, containsString("    /\\ UNCHANGED vars\n"));
		assertThat(text, containsString("vars == <<pc, counter, flag>>"));
		assertThat(text, containsString("proc(self) == s1(self)\n"));
		assertThat(text, containsString("    /\\ flag \\in BOOLEAN\n"));
	}

	@Test
	public void everyBranchIsCovered() throws TLAParseException {
		String text = addVariable(loadModule("Comments"), new AddVariableRequest("w", "0", "Nat"));
		assertThat(text, containsString(
				"          /\\ queue' = Tail(queue)\n" +
				"          /\\ UNCHANGED w\n" +
				"       \\/ /\\ queue = << >>\n" +
				"          /\\ UNCHANGED <<queue, done, w>>\n"));
		assertThat(text, containsString("    /\\ UNCHANGED <<done, w>>\n"));
		assertThat(text, containsString("        /\\ pc = \"idle\"\n        /\\ w = 0\n"));
		assertThat(text, containsString("VARIABLES queue,    \\* pending jobs\n          done,\n          pc,\n          w\n"));
	}

	@Test
	public void declarationAddedWhenThereIsNone() throws TLAParseException {
		TLAModule module = parseModule("---- MODULE Empty ----\nCONSTANT N\nInit == TRUE\n====\n");
		String text = addVariable(module, new AddVariableRequest("w", "N"));
		assertThat(text, containsString("CONSTANT N\nVARIABLE w\nInit == TRUE /\\ w = N"));
	}

}
