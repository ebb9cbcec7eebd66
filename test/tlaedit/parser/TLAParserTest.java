package tlaedit.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import tlaedit.formatters.TLASourceRenderer;
import tlaedit.model.tla.TLAModule;
import tlaedit.model.tla.TLANode;
import tlaedit.util.SourceFile;

@RunWith(Parameterized.class)
public class TLAParserTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
				{"ActionX", },
				{"Counter", },
				{"Pipeline", },
				{"Procs", },
				{"Comments", },
				{"Broken", },
		});
	}

	public String fileName;
	public TLAParserTest(String name) {
		fileName = name;
	}

	private String contents() throws IOException {
		Path inputFilePath = Paths.get("test", "tla", fileName+".tla");
		return new String(Files.readAllBytes(inputFilePath), StandardCharsets.UTF_8);
	}

	private TLAModule parse(String text) throws TLAParseException {
		return TLAParser.readModule(new SourceFile(Paths.get("test", "tla", fileName+".tla"), text));
	}

	// every node rebuilt from its (rebuilt) children, so nothing is verbatim except leaves
	private static TLANode rebuild(TLANode node) {
		List<TLANode> children = node.getChildren();
		if (children.isEmpty()) {
			return node;
		}
		List<TLANode> rebuilt = new ArrayList<>();
		for (TLANode child : children) {
			rebuilt.add(rebuild(child));
		}
		return node.withChildren(rebuilt);
	}

	@Test
	public void moduleName() throws IOException, TLAParseException {
		assertThat(parse(contents()).getName().getId(), is(fileName));
	}

	@Test
	public void roundTrip() throws IOException, TLAParseException {
		String text = contents();
		assertThat(TLASourceRenderer.render(parse(text)), is(text));
	}

	@Test
	public void roundTripThroughRebuiltNodes() throws IOException, TLAParseException {
		String text = contents();
		TLANode rebuilt = rebuild(parse(text));
		assertFalse(rebuilt.isVerbatim());
		assertThat(TLASourceRenderer.render(rebuilt), is(text));
	}

	@Test
	public void rebuiltNodesCompareEqual() throws IOException, TLAParseException {
		TLAModule module = parse(contents());
		assertThat(rebuild(module), is((TLANode) module));
	}

}
