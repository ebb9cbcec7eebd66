package tlaedit.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.List;

import org.junit.Test;

import tlaedit.util.SourceFile;

public class TLALexerModuleTest {

	private static List<TLAToken> lex(String text) throws TLALexerException {
		return new TLALexer(new SourceFile(Paths.get("TEST"), text)).readTokens();
	}

	@Test
	public void headerAndEnd() throws TLALexerException {
		List<TLAToken> tokens = lex("preamble\n---- MODULE M ----\n====\nanything goes here");
		assertThat(tokens.size(), is(5));
		assertThat(tokens.get(0).getType(), is(TLATokenType.SEPARATOR));
		assertThat(tokens.get(1).getValue(), is("MODULE"));
		assertThat(tokens.get(2).getValue(), is("M"));
		assertThat(tokens.get(3).getType(), is(TLATokenType.SEPARATOR));
		assertThat(tokens.get(4).getType(), is(TLATokenType.MODULE_END));
	}

	@Test
	public void tokenLocations() throws TLALexerException {
		List<TLAToken> tokens = lex("---- MODULE M ----\nx == 1\n====");
		TLAToken x = tokens.get(4);
		assertThat(x.getValue(), is("x"));
		assertThat(x.getLocation().getStartLine(), is(1));
		assertThat(x.getLocation().getStartColumn(), is(0));
		assertThat(x.getLocation().getText(), is("x"));
	}

	@Test(expected = TLALexerException.class)
	public void missingHeader() throws TLALexerException {
		lex("x == 1\n====");
	}

	@Test(expected = TLALexerException.class)
	public void missingEnd() throws TLALexerException {
		lex("---- MODULE M ----\nx == 1\n");
	}

	@Test(expected = TLALexerException.class)
	public void unterminatedComment() throws TLALexerException {
		lex("---- MODULE M ----\n(* never closed\n====");
	}

	@Test
	public void stripLineComment() {
		assertThat(TLALexer.stripComments("   \\* only when idle\n    /\\ "), is("\n    /\\ "));
	}

	@Test
	public void stripCommentOnlyLines() {
		assertThat(TLALexer.stripComments("\n  (* note *)\n  /\\ "), is("\n  /\\ "));
	}

	@Test
	public void stripNestedComment() {
		assertThat(TLALexer.stripComments("a (* x (* y *) z *) b"), is("a b"));
	}

	@Test
	public void stripDashLines() {
		assertThat(TLALexer.stripComments("\n----\n"), is("\n"));
	}

	@Test
	public void stripKeepsPlainText() {
		assertThat(TLALexer.stripComments(", "), is(", "));
	}

}
