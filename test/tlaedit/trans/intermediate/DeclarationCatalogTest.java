package tlaedit.trans.intermediate;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static tlaedit.TLATestingUtils.loadModule;
import static tlaedit.TLATestingUtils.parseModule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import tlaedit.model.tla.TLAOperatorDefinition;
import tlaedit.parser.TLAParseException;

public class DeclarationCatalogTest {

	private static List<String> names(List<TLAOperatorDefinition> defs) {
		List<String> result = new ArrayList<>();
		for (TLAOperatorDefinition def : defs) {
			result.add(def.getName().getId());
		}
		return result;
	}

	private static String name(Optional<TLAOperatorDefinition> def) {
		assertTrue(def.isPresent());
		return def.get().getName().getId();
	}

	private static ControlLocation loc(String name) {
		return new ControlLocation(name, false);
	}

	@Test
	public void actionX() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("ActionX"));
		assertThat(catalog.getVariables(), is(Arrays.asList("x", "y", "z", "pc")));
		assertThat(catalog.getConstants(), is(Collections.<String>emptyList()));
		assertThat(name(catalog.getInit()), is("Init"));
		assertThat(name(catalog.getNext()), is("Next"));
		assertThat(name(catalog.getAggregateTuple()), is("vars"));
		assertThat(name(catalog.getTypeInvariant()), is("TypeOK"));
		assertThat(names(catalog.getActions()), is(Arrays.asList("Start", "ActionX_1")));
		assertThat(catalog.getLocationVariable(), is(Optional.of("pc")));
		assertThat(catalog.getFairnessClauses().size(), is(1));
	}

	@Test
	public void locations() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("ActionX"));
		assertThat(new ArrayList<>(catalog.getUsedLocations()), is(Arrays.asList(loc("L_start"), loc("L1"))));
		assertThat(new ArrayList<>(catalog.getDeclaredLocations()), is(Arrays.asList(loc("L1"), loc("L_start"))));
		assertThat(catalog.getLocationEnumerations().size(), is(1));
	}

	@Test
	public void declaredNames() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("ActionX"));
		assertTrue(catalog.isDeclared("x"));
		assertTrue(catalog.isDeclared("Locations"));
		assertFalse(catalog.isDeclared("w"));
		assertTrue(catalog.isResolvable("Nat"));
		assertFalse(catalog.isResolvable("Seq"));
		assertFalse(catalog.isResolvable("w"));
	}

	@Test
	public void unknownModuleMayDefineAnything() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(parseModule(
				"---- MODULE M ----\nEXTENDS Naturals, MyHelpers\nVARIABLE x\nInit == x = 0\n===="));
		assertTrue(catalog.isResolvable("Helper"));
	}

	@Test
	public void nextDisjuncts() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("ActionX"));
		assertTrue(catalog.findNextDisjunct("ActionX_1").isPresent());
		assertFalse(catalog.findNextDisjunct("Init").isPresent());
		assertThat(catalog.getDisjunctionsReferencing("ActionX_1").size(), is(1));
	}

	@Test
	public void families() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("Pipeline"));
		assertThat(catalog.getFamily("Step1"), is(Arrays.asList("Step1", "Step2")));
		assertThat(catalog.getFamily("Step7"), is(Arrays.asList("Step1", "Step2")));
		assertThat(catalog.getFamily("Init"), is(Collections.singletonList("Init")));
		assertThat(catalog.getFamily("Missing"), is(Collections.<String>emptyList()));
	}

	@Test
	public void dispatchersActLikeActions() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("Procs"));
		assertThat(catalog.getConstants(), is(Collections.singletonList("N")));
		assertThat(names(catalog.getActions()), is(Arrays.asList("s1", "Terminating")));
		assertTrue(catalog.isActionLike("proc"));
		assertFalse(catalog.isAction("proc"));
		assertTrue(catalog.isActionLike("Next"));
		assertFalse(catalog.isActionLike("ProcSet"));
		assertThat(new LinkedHashSet<>(catalog.getDeclaredLocations()),
				is(new LinkedHashSet<>(Arrays.asList(loc("s1"), loc("Done")))));
	}

	@Test
	public void noLocationVariable() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(loadModule("Counter"));
		assertFalse(catalog.getLocationVariable().isPresent());
		assertFalse(catalog.getTypeInvariant().isPresent());
		assertThat(catalog.getUsedLocations().isEmpty(), is(true));
		assertThat(names(catalog.getActions()), is(Collections.singletonList("Increment")));
	}

	@Test
	public void inferredLocationVariable() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(parseModule("---- MODULE Phase ----\n" +
				"VARIABLES n, phase\n" +
				"Init == phase = \"start\" /\\ n = 0\n" +
				"Go == phase = \"start\" /\\ phase' = \"end\" /\\ n' = n + 1\n" +
				"Next == Go\n" +
				"====\n"));
		assertThat(catalog.getLocationVariable(), is(Optional.of("phase")));
		assertThat(new ArrayList<>(catalog.getUsedLocations()), is(Arrays.asList(loc("start"), loc("end"))));
	}

	@Test
	public void constantLocations() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(parseModule("---- MODULE Consts ----\n" +
				"CONSTANTS Idle, Busy\n" +
				"VARIABLE pc\n" +
				"Init == pc = Idle\n" +
				"Work == pc = Idle /\\ pc' = Busy\n" +
				"====\n"));
		assertThat(new ArrayList<>(catalog.getUsedLocations()),
				is(Arrays.asList(new ControlLocation("Idle", true), new ControlLocation("Busy", true))));
		assertThat(new ControlLocation("Idle", true).toString(), is("Idle"));
		assertThat(loc("Idle").toString(), is("\"Idle\""));
	}

	@Test
	public void helpersAreNotActions() throws TLAParseException {
		DeclarationCatalog catalog = DeclarationCatalog.of(parseModule("---- MODULE Messages ----\n" +
				"VARIABLES pc, x, msgs\n" +
				"Init == pc = \"L1\" /\\ x = 0 /\\ msgs = {}\n" +
				"Send(v) == msgs' = msgs \\cup {v}\n" +
				"Step_1 == pc = \"L1\" /\\ Send(x) /\\ pc' = \"L9\" /\\ UNCHANGED x\n" +
				"Next == Step_1\n" +
				"====\n"));
		assertThat(names(catalog.getActions()), is(Collections.singletonList("Step_1")));
		assertTrue(catalog.isHelper("Send"));
		assertTrue(catalog.isActionLike("Send"));
		assertFalse(catalog.isAction("Send"));
		assertFalse(catalog.isHelper("Step_1"));
		assertThat(catalog.getUsedLocations(), is(new LinkedHashSet<>(Arrays.asList(loc("L1"), loc("L9")))));
	}

}
