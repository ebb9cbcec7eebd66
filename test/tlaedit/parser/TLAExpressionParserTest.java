package tlaedit.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.List;

import org.junit.Test;

import tlaedit.model.tla.*;
import tlaedit.util.SourceFile;

public class TLAExpressionParserTest {

	private static TLAExpression expr(String text) throws TLAParseException {
		return TLAParser.readExpression(new SourceFile(Paths.get("TEST"), text));
	}

	private static TLAModule module(String text) throws TLAParseException {
		return TLAParser.readModule(new SourceFile(Paths.get("TEST"), text));
	}

	@Test
	public void infixConjunction() throws TLAParseException {
		TLAExpression e = expr("a /\\ b /\\ c");
		assertThat(e, instanceOf(TLAJunction.class));
		TLAJunction junction = (TLAJunction) e;
		assertThat(junction.getKind(), is(TLAJunction.Kind.CONJUNCTION));
		assertFalse(junction.isBulleted());
		assertThat(junction.getItems().size(), is(3));
	}

	@Test
	public void bulletedConjunction() throws TLAParseException {
		TLAJunction junction = (TLAJunction) expr("/\\ a = 1\n/\\ b = 2");
		assertTrue(junction.isBulleted());
		assertThat(junction.getItems().size(), is(2));
		assertThat(junction.getItems().get(1), instanceOf(TLABinOp.class));
	}

	@Test
	public void nestedBullets() throws TLAParseException {
		TLAJunction outer = (TLAJunction) expr("/\\ a\n/\\ \\/ b\n   \\/ c\n/\\ d");
		assertThat(outer.getItems().size(), is(3));
		TLAJunction inner = (TLAJunction) outer.getItems().get(1);
		assertThat(inner.getKind(), is(TLAJunction.Kind.DISJUNCTION));
		assertThat(inner.getItems().size(), is(2));
	}

	@Test
	public void primedAssignment() throws TLAParseException {
		TLABinOp assignment = (TLABinOp) expr("x' = x + 1");
		assertThat(assignment.getOperation().getValue(), is("="));
		assertTrue(((TLAUnary) assignment.getLHS()).isPrime());
		assertThat(((TLABinOp) assignment.getRHS()).getOperation().getValue(), is("+"));
	}

	@Test
	public void unchangedTuple() throws TLAParseException {
		TLAUnary unchanged = (TLAUnary) expr("UNCHANGED <<x, y>>");
		assertTrue(unchanged.isUnchanged());
		assertThat(((TLATuple) unchanged.getOperand()).getElements().size(), is(2));
	}

	@Test
	public void boxAction() throws TLAParseException {
		TLAUnary always = (TLAUnary) expr("[][Next]_vars");
		assertThat(always.getOperand(), instanceOf(TLAMaybeAction.class));
	}

	@Test
	public void functionCall() throws TLAParseException {
		TLABinOp guard = (TLABinOp) expr("pc[self] = \"s1\"");
		assertThat(guard.getLHS(), instanceOf(TLAFunctionCall.class));
		assertThat(((TLAString) guard.getRHS()).getValue(), is("s1"));
	}

	@Test
	public void precedence() throws TLAParseException {
		TLABinOp sum = (TLABinOp) expr("a + b * c");
		assertThat(sum.getOperation().getValue(), is("+"));
		assertThat(sum.getRHS(), instanceOf(TLABinOp.class));
	}

	@Test(expected = TLAParseException.class)
	public void danglingOperator() throws TLAParseException {
		expr("x +");
	}

	@Test(expected = TLAParseException.class)
	public void trailingTokens() throws TLAParseException {
		expr("x y");
	}

	@Test
	public void units() throws TLAParseException {
		TLAModule m = module("---- MODULE M ----\n" +
				"EXTENDS Naturals, Sequences\n" +
				"CONSTANT N\n" +
				"VARIABLES x, y\n" +
				"Init == x = 0 /\\ y = 0\n" +
				"Inc(n) == x' = x + n /\\ UNCHANGED y\n" +
				"----\n" +
				"THEOREM Init => x = 0\n" +
				"====\n");
		assertThat(m.getExtends().size(), is(2));
		List<TLAUnit> units = m.getUnits();
		assertThat(units.size(), is(5));
		assertThat(units.get(0), instanceOf(TLAConstantDeclaration.class));
		assertThat(units.get(1), instanceOf(TLAVariableDeclaration.class));
		TLAOperatorDefinition inc = (TLAOperatorDefinition) units.get(3);
		assertThat(inc.getName().getId(), is("Inc"));
		assertThat(inc.getArgs().size(), is(1));
		assertThat(units.get(4), instanceOf(TLATheorem.class));
	}

	@Test
	public void unitBoundaryEndsExpression() throws TLAParseException {
		TLAModule m = module("---- MODULE M ----\nA == 1 +\n  2\nB == 3\n====");
		assertThat(m.getUnits().size(), is(2));
		TLAOperatorDefinition a = (TLAOperatorDefinition) m.getUnits().get(0);
		assertThat(a.getBody(), instanceOf(TLABinOp.class));
	}

	@Test
	public void parseErrorLocation() {
		try {
			module("---- MODULE M ----\nA == (1 +\n====");
			fail("expected a parse error");
		} catch (TLAParseException e) {
			assertThat(e.getLocation().getStartLine(), is(2));
		}
	}

	@Test(expected = TLAParseException.class)
	public void missingModuleName() throws TLAParseException {
		module("---- MODULE ----\n====");
	}

}
