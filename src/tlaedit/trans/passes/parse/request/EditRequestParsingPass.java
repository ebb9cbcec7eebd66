package tlaedit.trans.passes.parse.request;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import tlaedit.errors.IssueContext;
import tlaedit.trans.AddVariableRequest;
import tlaedit.trans.EditRequest;
import tlaedit.trans.SplitActionRequest;
import tlaedit.trans.passes.parse.option.OptionParserIssue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads edit requests, either from a JSON request file:
 *
 * <pre>
 * {"edits": [
 *   {"kind": "add_variable", "name": "debug_log", "init": "&lt;&lt;&gt;&gt;", "type": "Seq(STRING)"},
 *   {"kind": "split_action", "action": "ActionX_1", "first_half": ["x"], "new_name": "ActionX_2"}
 * ]}
 * </pre>
 *
 * or from the one-line forms accepted on the command line, {@code name=init[:type]} and
 * {@code action[:var,var]}.
 */
public class EditRequestParsingPass {
	private EditRequestParsingPass() {}

	public static List<EditRequest> perform(IssueContext ctx, String requestFileName, String contents) {
		List<EditRequest> requests = new ArrayList<>();
		try {
			JSONArray edits = new JSONObject(contents).getJSONArray("edits");
			for (int i = 0; i < edits.length(); ++i) {
				JSONObject edit = edits.getJSONObject(i);
				String kind = edit.getString("kind");
				switch (kind) {
					case "add_variable":
						requests.add(new AddVariableRequest(
								edit.getString("name"), edit.getString("init"), edit.optString("type", null)));
						break;
					case "split_action":
						requests.add(new SplitActionRequest(
								edit.getString("action"), stringList(edit.optJSONArray("first_half")),
								edit.optString("new_name", null), edit.optString("new_location", null)));
						break;
					default:
						ctx.error(new OptionParserIssue(requestFileName + ": edit " + (i + 1) +
								" has unknown kind \"" + kind + "\""));
				}
			}
		} catch (JSONException e) {
			ctx.error(new OptionParserIssue(requestFileName + ": parsing error: " + e.getMessage()));
		}
		return requests;
	}

	private static List<String> stringList(JSONArray array) {
		List<String> result = new ArrayList<>();
		if (array != null) {
			for (int i = 0; i < array.length(); ++i) {
				result.add(array.getString(i));
			}
		}
		return result;
	}

	/**
	 * Parses {@code name=init} or {@code name=init:type}. The type starts after the last colon that is
	 * outside of brackets and strings and is not part of {@code :>} or {@code :=}.
	 */
	public static AddVariableRequest parseAddVariable(IssueContext ctx, String text) {
		int equals = text.indexOf('=');
		if (equals <= 0) {
			ctx.error(new OptionParserIssue("expected name=init[:type], found \"" + text + "\""));
			return null;
		}
		String name = text.substring(0, equals).trim();
		String rest = text.substring(equals + 1);
		int colon = typeSeparator(rest);
		if (colon == -1) {
			return new AddVariableRequest(name, rest.trim());
		}
		return new AddVariableRequest(name, rest.substring(0, colon).trim(), rest.substring(colon + 1).trim());
	}

	private static int typeSeparator(String text) {
		int depth = 0;
		boolean inString = false;
		int found = -1;
		for (int i = 0; i < text.length(); ++i) {
			char c = text.charAt(i);
			if (inString) {
				if (c == '\\') {
					++i;
				} else if (c == '"') {
					inString = false;
				}
				continue;
			}
			switch (c) {
				case '"':
					inString = true;
					break;
				case '(':
				case '[':
				case '{':
					++depth;
					break;
				case ')':
				case ']':
				case '}':
					--depth;
					break;
				case ':':
					boolean operator = i + 1 < text.length() && (text.charAt(i + 1) == '>' || text.charAt(i + 1) == '=');
					if (depth == 0 && !operator) {
						found = i;
					}
					break;
				default:
					break;
			}
		}
		return found;
	}

	/**
	 * Parses {@code action} or {@code action:x,y}, the latter naming the variables of the first half.
	 */
	public static SplitActionRequest parseSplitAction(IssueContext ctx, String text) {
		int colon = text.indexOf(':');
		String action = (colon == -1 ? text : text.substring(0, colon)).trim();
		if (action.isEmpty()) {
			ctx.error(new OptionParserIssue("expected action[:var,var], found \"" + text + "\""));
			return null;
		}
		List<String> firstHalf = new ArrayList<>();
		if (colon != -1) {
			for (String variable : Arrays.asList(text.substring(colon + 1).split(","))) {
				if (!variable.trim().isEmpty()) {
					firstHalf.add(variable.trim());
				}
			}
		}
		return new SplitActionRequest(action, firstHalf, null, null);
	}
}
