package tlaedit.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static tlaedit.model.tla.TLAUtils.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import tlaedit.model.tla.*;
import tlaedit.parser.TLAParseException;
import tlaedit.parser.TLAParser;
import tlaedit.util.SourceFile;
import tlaedit.util.SourceLocation;

public class TLASourceRendererTest {

	private static TLAModule module(String text) throws TLAParseException {
		return TLAParser.readModule(new SourceFile(Paths.get("TEST"), text));
	}

	private static TLAOperatorDefinition definition(TLAModule module, int index) {
		return (TLAOperatorDefinition) module.getUnits().get(index);
	}

	@Test
	public void newBinOp() {
		TLAExpression e = binop("=", idexp("x"), binop("+", idexp("a"), idexp("b")));
		assertThat(TLASourceRenderer.render(e), is("x = a + b"));
	}

	@Test
	public void newBinOpParenthesized() {
		TLAExpression e = binop("*", binop("+", idexp("a"), idexp("b")), idexp("c"));
		assertThat(TLASourceRenderer.render(e), is("(a + b) * c"));
	}

	@Test
	public void newUnchanged() {
		assertThat(TLASourceRenderer.render(unchanged(Arrays.asList("a", "b"))), is("UNCHANGED <<a, b>>"));
		assertThat(TLASourceRenderer.render(unchanged(Arrays.asList("a"))), is("UNCHANGED a"));
	}

	@Test
	public void newPrime() {
		assertThat(TLASourceRenderer.render(binop("=", prime(idexp("x")), str("L2"))), is("x' = \"L2\""));
	}

	@Test
	public void newBulletedJunction() {
		List<TLAExpression> items = Arrays.asList(binop("=", idexp("x"), idexp("y")), idexp("z"));
		TLAJunction junction = new TLAJunction(SourceLocation.unknown(), TLAJunction.Kind.DISJUNCTION, true, items);
		assertThat(TLASourceRenderer.render(junction), is("\\/ x = y\n\\/ z"));
	}

	@Test
	public void appendToBulletedConjunction() throws TLAParseException {
		TLAModule m = module("---- MODULE M ----\nInit ==\n    /\\ x = 0\n    /\\ y = 0\n====");
		TLAOperatorDefinition init = definition(m, 0);
		TLAOperatorDefinition extended = init.withBody(conjoin(init.getBody(), binop("=", idexp("z"), idexp("y"))));
		assertThat(TLASourceRenderer.render(extended),
				is("Init ==\n    /\\ x = 0\n    /\\ y = 0\n    /\\ z = y"));
	}

	@Test
	public void renderedAtAnotherColumn() throws TLAParseException {
		TLAModule m = module("---- MODULE M ----\nInit ==\n    /\\ x = 0\n    /\\ y = 0\n====");
		TLAExpression body = definition(m, 0).getBody();
		// written at column 0, so every following line moves left along with the first
		assertThat(TLASourceRenderer.render(body), is("/\\ x = 0\n/\\ y = 0"));
		assertThat(TLASourceRenderer.render(conjoin(body, idexp("z"))), is("/\\ x = 0\n/\\ y = 0\n/\\ z"));
	}

	@Test
	public void insertedSeparatorDropsComments() throws TLAParseException {
		TLAModule m = module("---- MODULE M ----\nA ==\n    /\\ x = 0 \\* first\n    /\\ y = 0\n====");
		TLAOperatorDefinition a = definition(m, 0);
		TLAJunction body = (TLAJunction) a.getBody();
		List<TLANode> items = body.getChildren();
		items.add(1, idexp("w"));
		TLAOperatorDefinition edited = a.withBody((TLAExpression) body.withChildren(items));
		assertThat(TLASourceRenderer.render(edited),
				is("A ==\n    /\\ x = 0\n    /\\ w \\* first\n    /\\ y = 0"));
	}

	@Test
	public void appendToInfixJunction() throws TLAParseException {
		TLAModule m = module("---- MODULE M ----\nNext == A \\/ B\n====");
		TLAOperatorDefinition next = definition(m, 0);
		TLAJunction body = (TLAJunction) next.getBody();
		List<TLANode> items = body.getChildren();
		items.add(idexp("C"));
		assertThat(TLASourceRenderer.render(next.withBody((TLAExpression) body.withChildren(items))),
				is("Next == A \\/ B \\/ C"));
	}

	@Test
	public void replacedChildKeepsSurroundings() throws TLAParseException {
		TLAModule m = module("---- MODULE M ----\nS == {  \"a\" ,\"b\"  }\n====");
		TLAOperatorDefinition s = definition(m, 0);
		TLASetConstructor set = (TLASetConstructor) s.getBody();
		List<TLANode> items = set.getChildren();
		items.set(1, str("c"));
		assertThat(TLASourceRenderer.render(s.withBody((TLAExpression) set.withChildren(items))),
				is("S == {  \"a\" ,\"c\"  }"));
	}

	@Test
	public void newChildNeedingParentheses() throws TLAParseException {
		TLAModule m = module("---- MODULE M ----\nP == a * b\n====");
		TLAOperatorDefinition p = definition(m, 0);
		TLABinOp product = (TLABinOp) p.getBody();
		List<TLANode> children = product.getChildren();
		children.set(1, binop("+", idexp("b"), idexp("c")));
		assertThat(TLASourceRenderer.render(p.withBody((TLAExpression) product.withChildren(children))),
				is("P == a * (b + c)"));
	}

}
