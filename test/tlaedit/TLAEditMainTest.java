package tlaedit;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static tlaedit.TLATestingUtils.fixturePath;
import static tlaedit.TLATestingUtils.readFixture;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import tlaedit.errors.ErrorKind;
import tlaedit.trans.EditRequest;
import tlaedit.trans.SplitActionRequest;

public class TLAEditMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File copyFixture(String name) throws IOException {
		File copy = new File(folder.getRoot(), name + ".tla");
		FileUtils.copyFile(fixturePath(name).toFile(), copy);
		return copy;
	}

	private File write(String name, String contents) throws IOException {
		File file = new File(folder.getRoot(), name);
		FileUtils.writeStringToFile(file, contents, StandardCharsets.UTF_8);
		return file;
	}

	private static String read(File file) throws IOException {
		return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
	}

	@Test
	public void processEdit() throws IOException {
		File module = copyFixture("ActionX");
		TLAEditMain.Outcome outcome = TLAEditMain.process(module.toPath(), false,
				Collections.<EditRequest>singletonList(new SplitActionRequest("ActionX_1")));
		assertTrue(outcome.success);
		assertThat(outcome.issues.isEmpty(), is(true));
		assertThat(outcome.text, containsString("Next == Start \\/ ActionX_1 \\/ ActionX_2\n"));
		// process never writes
		assertThat(read(module), is(readFixture("ActionX")));
	}

	@Test
	public void processCheck() throws IOException {
		TLAEditMain.Outcome outcome = TLAEditMain.process(copyFixture("Broken").toPath(), true,
				Collections.<EditRequest>emptyList());
		assertFalse(outcome.success);
		assertThat(outcome.issues.size(), is(5));
		assertThat(outcome.text, is(nullValue()));
	}

	@Test
	public void processMissingFile() {
		TLAEditMain.Outcome outcome = TLAEditMain.process(new File(folder.getRoot(), "Nope.tla").toPath(), true,
				Collections.<EditRequest>emptyList());
		assertFalse(outcome.success);
		assertThat(outcome.issues.get(0).getKind(), is(ErrorKind.IO_ERROR));
	}

	@Test
	public void processUnparsableFile() throws IOException {
		File module = write("Bad.tla", "---- MODULE Bad ----\nInit == x = \n====\n");
		TLAEditMain.Outcome outcome = TLAEditMain.process(module.toPath(), true,
				Collections.<EditRequest>emptyList());
		assertFalse(outcome.success);
		assertThat(outcome.issues.get(0).getKind(), is(ErrorKind.SYNTAX_ERROR));
	}

	@Test
	public void report() throws IOException {
		JSONObject report = TLAEditMain.report(Arrays.asList(
				TLAEditMain.process(copyFixture("Broken").toPath(), true, Collections.<EditRequest>emptyList()),
				TLAEditMain.process(copyFixture("Counter").toPath(), true, Collections.<EditRequest>emptyList())));
		JSONArray files = report.getJSONArray("files");
		assertThat(files.length(), is(2));

		JSONObject broken = files.getJSONObject(0);
		assertThat(broken.getString("file"), endsWith("Broken.tla"));
		assertFalse(broken.getBoolean("success"));
		JSONArray issues = broken.getJSONArray("issues");
		assertThat(issues.length(), is(5));
		assertThat(issues.getJSONObject(0).getString("kind"), is("VIOLATION"));
		assertThat(issues.getJSONObject(0).getString("message"), containsString("Forgetful"));
		assertTrue(issues.getJSONObject(4).getBoolean("warning"));

		JSONObject counter = files.getJSONObject(1);
		assertTrue(counter.getBoolean("success"));
		assertThat(counter.getJSONArray("issues").length(), is(0));
	}

	@Test
	public void runWithRequestFile() throws IOException {
		File module = copyFixture("Counter");
		File requests = write("edits.json", "{\"edits\": [" +
				"{\"kind\": \"add_variable\", \"name\": \"debug_log\", \"init\": \"<<>>\"}]}");
		File output = new File(folder.getRoot(), "Out.tla");
		assertTrue(new TLAEditMain(new String[]{
				"-q", "-c", requests.getPath(), "-o", output.getPath(), module.getPath()}).run());
		assertThat(read(output), containsString("VARIABLES state, counter, debug_log\n"));
		assertThat(read(output), containsString("UNCHANGED <<state, debug_log>>"));
		assertThat(read(module), is(readFixture("Counter")));
	}

	@Test
	public void runEditsInPlace() throws IOException {
		File module = copyFixture("Pipeline");
		File requests = write("edits.json", "{\"edits\": [{\"kind\": \"split_action\", \"action\": \"Step1\"}]}");
		assertTrue(new TLAEditMain(new String[]{"-q", "-c", requests.getPath(), module.getPath()}).run());
		assertThat(read(module), containsString("Step3 ==\n"));
	}

	@Test
	public void runFailedEditLeavesFileAlone() throws IOException {
		File module = copyFixture("Counter");
		File requests = write("edits.json", "{\"edits\": [" +
				"{\"kind\": \"add_variable\", \"name\": \"counter\", \"init\": \"0\"}]}");
		File report = new File(folder.getRoot(), "report.json");
		assertFalse(new TLAEditMain(new String[]{
				"-q", "-c", requests.getPath(), "--report=" + report.getPath(), module.getPath()}).run());
		assertThat(read(module), is(readFixture("Counter")));
		JSONObject json = new JSONObject(read(report));
		JSONObject file = json.getJSONArray("files").getJSONObject(0);
		assertThat(file.getJSONArray("issues").getJSONObject(0).getString("kind"), is("DUPLICATE_NAME"));
	}

	@Test
	public void runCheck() throws IOException {
		assertTrue(new TLAEditMain(new String[]{"-q", "--check", copyFixture("ActionX").getPath()}).run());
		assertFalse(new TLAEditMain(new String[]{"-q", "--check", "-j", "2",
				copyFixture("ActionX").getPath(), copyFixture("Broken").getPath()}).run());
	}

	@Test
	public void runBadOptions() {
		assertFalse(new TLAEditMain(new String[]{"-q"}).run());
	}

}
