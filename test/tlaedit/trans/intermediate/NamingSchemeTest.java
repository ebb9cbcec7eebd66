package tlaedit.trans.intermediate;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class NamingSchemeTest {

	@Test
	public void numbered() {
		NamingScheme scheme = NamingScheme.of("ActionX_1");
		assertTrue(scheme.isNumeric());
		assertThat(scheme.getPrefix(), is("ActionX_"));
		assertThat(scheme.getIndex(), is(1));
		assertThat(scheme.successor(), is("ActionX_2"));
		assertThat(scheme.getName(), is("ActionX_1"));
	}

	@Test
	public void zeroPadded() {
		NamingScheme scheme = NamingScheme.of("a07");
		assertThat(scheme.getIndex(), is(7));
		assertThat(scheme.successor(), is("a08"));
		assertThat(scheme.withIndex(12), is("a12"));
	}

	@Test
	public void growsPastPadding() {
		assertThat(NamingScheme.of("Step9").successor(), is("Step10"));
	}

	@Test
	public void descriptive() {
		assertFalse(NamingScheme.of("L_start").isNumeric());
		assertFalse(NamingScheme.of("Start").isNumeric());
		// a bare number has no prefix to share
		assertFalse(NamingScheme.of("7").isNumeric());
	}

	@Test(expected = IllegalStateException.class)
	public void descriptiveHasNoSuccessor() {
		NamingScheme.of("Start").successor();
	}

	@Test
	public void families() {
		assertTrue(NamingScheme.of("L1").isSameFamily(NamingScheme.of("L12")));
		assertFalse(NamingScheme.of("L1").isSameFamily(NamingScheme.of("Step1")));
		assertFalse(NamingScheme.of("Start").isSameFamily(NamingScheme.of("Start")));
	}

}
