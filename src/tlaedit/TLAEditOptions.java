package tlaedit;

import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class TLAEditOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Print the version and exit")
	public boolean version = false;

	@Option(value = "-h Print usage information")
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution")
	public boolean quiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution")
	public boolean verbose = false;

	@Option(value = "-c Path to a JSON file listing the edits to perform")
	public String requestFilePath;

	@Option(value = "-o Where to write the edited module (default: overwrite the input)")
	public String outputFilePath;

	@Option(value = "Only validate the input modules, do not edit them")
	public boolean check = false;

	// underscores in option fields are spelled as dashes on the command line: --dry-run
	@Option(value = "Print edited modules to standard output instead of writing them")
	public boolean dry_run = false;

	@Option(value = "-j Number of input files to process in parallel")
	public int threads = 1;

	@Option(value = "Add a state variable, given as name=init or name=init:type")
	public List<String> add_variable = new ArrayList<>();

	@Option(value = "Split an action at a new control location, given as its name")
	public List<String> split_action = new ArrayList<>();

	@Option(value = "Write a JSON report of every edit's outcome to this file")
	public String report;

	public List<String> inputFilePaths = Collections.emptyList();

	private final Options plumeOptions;
	private String[] remainingArgs;
	private String parseError;
	private boolean finished = false;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public TLAEditOptions(String[] args) {
		plumeOptions = new Options("tlaedit [options] module.tla...", this);
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			remainingArgs = new String[0];
			parseError = e.getMessage();
		}
	}

	/**
	 * @return true if usage or version information was printed and there is nothing left to do
	 */
	public boolean isFinished() {
		return finished;
	}

	public void parse() throws TLAEditOptionException {
		if (parseError != null) {
			throw new TLAEditOptionException(parseError);
		}

		if (version) {
			System.out.println("tlaedit version " + VERSION);
			finished = true;
			return;
		}

		if (help) {
			printHelp();
			finished = true;
			return;
		}

		if (remainingArgs.length == 0) {
			throw new TLAEditOptionException("at least one input module is required");
		}
		inputFilePaths = Arrays.asList(remainingArgs);

		if (threads < 1) {
			throw new TLAEditOptionException("-j needs a positive number of threads, not " + threads);
		}
		if (outputFilePath != null && inputFilePaths.size() != 1) {
			throw new TLAEditOptionException("-o can only be used with a single input module");
		}
		boolean hasEdits = requestFilePath != null || !add_variable.isEmpty() || !split_action.isEmpty();
		if (check && hasEdits) {
			throw new TLAEditOptionException("--check does not perform edits");
		}
		if (!check && !hasEdits) {
			throw new TLAEditOptionException("no edits requested; use -c, --add-variable, --split-action or --check");
		}
	}
}
