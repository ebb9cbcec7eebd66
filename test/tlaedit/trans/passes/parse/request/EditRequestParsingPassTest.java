package tlaedit.trans.passes.parse.request;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.TopLevelIssueContext;
import tlaedit.trans.AddVariableRequest;
import tlaedit.trans.EditRequest;
import tlaedit.trans.SplitActionRequest;

public class EditRequestParsingPassTest {

	@Test
	public void requestFile() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<EditRequest> requests = EditRequestParsingPass.perform(ctx, "edits.json", "{\"edits\": [\n" +
				"  {\"kind\": \"add_variable\", \"name\": \"debug_log\", \"init\": \"<<>>\", \"type\": \"Seq(STRING)\"},\n" +
				"  {\"kind\": \"add_variable\", \"name\": \"n\", \"init\": \"0\"},\n" +
				"  {\"kind\": \"split_action\", \"action\": \"ActionX_1\", \"first_half\": [\"x\"], \"new_name\": \"ActionX_2\"},\n" +
				"  {\"kind\": \"split_action\", \"action\": \"Start\", \"new_location\": \"L_mid\"}\n" +
				"]}");
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		assertThat(requests, is(Arrays.<EditRequest>asList(
				new AddVariableRequest("debug_log", "<<>>", "Seq(STRING)"),
				new AddVariableRequest("n", "0"),
				new SplitActionRequest("ActionX_1", Collections.singletonList("x"), "ActionX_2", null),
				new SplitActionRequest("Start", Collections.<String>emptyList(), null, "L_mid"))));
	}

	@Test
	public void unknownKind() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<EditRequest> requests = EditRequestParsingPass.perform(ctx, "edits.json",
				"{\"edits\": [{\"kind\": \"rename\"}, {\"kind\": \"add_variable\", \"name\": \"n\", \"init\": \"0\"}]}");
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().get(0).getKind(), is(ErrorKind.OPTION_ERROR));
		assertThat(ctx.getIssues().get(0).getMessage(), containsString("rename"));
		assertThat(requests.size(), is(1));
	}

	@Test
	public void malformedJson() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		EditRequestParsingPass.perform(ctx, "edits.json", "{\"edits\": [");
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0).getMessage(), containsString("edits.json"));
	}

	@Test
	public void missingField() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		EditRequestParsingPass.perform(ctx, "edits.json", "{\"edits\": [{\"kind\": \"add_variable\", \"name\": \"n\"}]}");
		assertTrue(ctx.hasErrors());
	}

	@Test
	public void addVariableShorthand() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(EditRequestParsingPass.parseAddVariable(ctx, "debug_log=<<>>:Seq(STRING)"),
				is(new AddVariableRequest("debug_log", "<<>>", "Seq(STRING)")));
		assertThat(EditRequestParsingPass.parseAddVariable(ctx, "m=[k \\in {1} |-> 0]:[{1} -> Nat]"),
				is(new AddVariableRequest("m", "[k \\in {1} |-> 0]", "[{1} -> Nat]")));
		assertThat(EditRequestParsingPass.parseAddVariable(ctx, "r=[a |-> 1]"),
				is(new AddVariableRequest("r", "[a |-> 1]")));
		assertThat(EditRequestParsingPass.parseAddVariable(ctx, "f=1 :> 2"),
				is(new AddVariableRequest("f", "1 :> 2")));
		assertThat(EditRequestParsingPass.parseAddVariable(ctx, "s=\"a:b\""),
				is(new AddVariableRequest("s", "\"a:b\"")));
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void addVariableWithoutInit() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(EditRequestParsingPass.parseAddVariable(ctx, "noequals"), is(nullValue()));
		assertTrue(ctx.hasErrors());
	}

	@Test
	public void splitActionShorthand() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(EditRequestParsingPass.parseSplitAction(ctx, "ActionX_1:x, y"),
				is(new SplitActionRequest("ActionX_1", Arrays.asList("x", "y"), null, null)));
		assertThat(EditRequestParsingPass.parseSplitAction(ctx, "Start"), is(new SplitActionRequest("Start")));
		assertFalse(ctx.hasErrors());
		assertThat(EditRequestParsingPass.parseSplitAction(ctx, ":x"), is(nullValue()));
		assertTrue(ctx.hasErrors());
	}

}
