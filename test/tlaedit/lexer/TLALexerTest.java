package tlaedit.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import tlaedit.util.SourceFile;

@RunWith(Parameterized.class)
public class TLALexerTest {

	private static String ident(String value) {
		return "IDENT:" + value;
	}

	private static String num(String value) {
		return "NUMBER:" + value;
	}

	private static String str(String value) {
		return "STRING:" + value;
	}

	private static String builtin(String value) {
		return "BUILTIN:" + value;
	}

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			{ "TRUE", Arrays.asList(builtin("TRUE")) },
			{ "a b", Arrays.asList(ident("a"), ident("b")) },
			{ "  /\\ a\n  /\\ b", Arrays.asList(builtin("/\\"), ident("a"), builtin("/\\"), ident("b")) },
			{ "x' = x + 1", Arrays.asList(
					ident("x"), builtin("'"), builtin("="), ident("x"), builtin("+"), num("1")) },
			{ "\"L_start\"", Arrays.asList(str("L_start")) },
			{ "UNCHANGED <<y, z>>", Arrays.asList(
					builtin("UNCHANGED"), builtin("<<"), ident("y"), builtin(","), ident("z"), builtin(">>")) },
			{ "[pc EXCEPT ![self] = \"s2\"]", Arrays.asList(
					builtin("["), ident("pc"), builtin("EXCEPT"), builtin("!"), builtin("["), ident("self"),
					builtin("]"), builtin("="), str("s2"), builtin("]")) },
			{ "WF_vars(Next)", Arrays.asList(
					builtin("WF_"), ident("vars"), builtin("("), ident("Next"), builtin(")")) },
			{ "pc \\in Locations", Arrays.asList(ident("pc"), builtin("\\in"), ident("Locations")) },
			// comments are skipped, nested or not
			{ "a \\* trailing\nb", Arrays.asList(ident("a"), ident("b")) },
			{ "a (* outer (* inner *) still outer *) b", Arrays.asList(ident("a"), ident("b")) },
			{ "UNCHANGEDx", Arrays.asList(ident("UNCHANGEDx")) },
		});
	}

	private final String input;
	private final List<String> expected;

	public TLALexerTest(String input, List<String> expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() throws TLALexerException {
		TLALexer lexer = new TLALexer(new SourceFile(Paths.get("TEST"), input));
		lexer.requireModule(false);
		List<String> actual = new ArrayList<>();
		for (TLAToken token : lexer.readTokens()) {
			actual.add(token.getType() + ":" + token.getValue());
		}
		assertThat(actual, is(expected));
	}

}
