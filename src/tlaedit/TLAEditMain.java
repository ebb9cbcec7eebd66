package tlaedit;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import tlaedit.errors.Issue;
import tlaedit.errors.TopLevelIssueContext;
import tlaedit.model.tla.TLAModule;
import tlaedit.trans.AddVariableRequest;
import tlaedit.trans.EditEngine;
import tlaedit.trans.EditRequest;
import tlaedit.trans.EditResult;
import tlaedit.trans.SplitActionRequest;
import tlaedit.trans.intermediate.IOErrorIssue;
import tlaedit.trans.intermediate.WhileProcessingFile;
import tlaedit.trans.passes.parse.option.OptionParsingPass;
import tlaedit.trans.passes.parse.request.EditRequestParsingPass;
import tlaedit.trans.passes.parse.tla.TLAParsingPass;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

public class TLAEditMain {
	private final String[] cmdArgs;
	// the top Logger instance, shared with every pass
	private static final Logger logger = Logger.getLogger("TLAEdit");

	public TLAEditMain(String[] args) {
		cmdArgs = args;
	}

	// Creates a TLAEditMain instance, and initiates run() below.
	public static void main(String[] args) {
		if (new TLAEditMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	/**
	 * What happened to one input module.
	 */
	static final class Outcome {
		final Path path;
		final boolean success;
		final List<Issue> issues;
		final String text;

		Outcome(Path path, boolean success, List<Issue> issues, String text) {
			this.path = path;
			this.success = success;
			this.issues = issues;
			this.text = text;
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		TLAEditOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			opts.printHelp();
			return false;
		}
		if (opts.isFinished()) {
			return true;
		}

		List<EditRequest> requests = readRequests(ctx, opts);
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			return false;
		}

		List<Outcome> outcomes;
		try {
			outcomes = processAll(opts, requests);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.severe("interrupted while processing modules");
			return false;
		}

		boolean success = true;
		for (Outcome outcome : outcomes) {
			success &= outcome.success;
			if (!outcome.issues.isEmpty()) {
				TopLevelIssueContext fileCtx = new TopLevelIssueContext();
				for (Issue issue : outcome.issues) {
					fileCtx.error(issue.withContext(new WhileProcessingFile(outcome.path)));
				}
				System.err.println(fileCtx.format());
			}
			if (!outcome.success || opts.check) {
				continue;
			}
			if (opts.dry_run) {
				System.out.print(outcome.text);
				continue;
			}
			Path destination = opts.outputFilePath != null ? Paths.get(opts.outputFilePath) : outcome.path;
			logger.info("Writing edited module to \"" + destination + "\"");
			try {
				FileUtils.writeStringToFile(destination.toFile(), outcome.text, StandardCharsets.UTF_8);
			} catch (IOException e) {
				System.err.println(new IOErrorIssue(e).withContext(new WhileProcessingFile(destination)).getMessage());
				success = false;
			}
		}

		if (opts.report != null) {
			logger.info("Writing report to \"" + opts.report + "\"");
			try {
				FileUtils.writeStringToFile(new File(opts.report), report(outcomes).toString(2), StandardCharsets.UTF_8);
			} catch (IOException e) {
				System.err.println(new IOErrorIssue(e).getMessage());
				success = false;
			}
		}
		return success;
	}

	private static List<EditRequest> readRequests(TopLevelIssueContext ctx, TLAEditOptions opts) {
		List<EditRequest> requests = new ArrayList<>();
		if (opts.requestFilePath != null) {
			logger.info("Reading edit requests from \"" + opts.requestFilePath + "\"");
			try {
				String contents = FileUtils.readFileToString(new File(opts.requestFilePath), StandardCharsets.UTF_8);
				requests.addAll(EditRequestParsingPass.perform(ctx, opts.requestFilePath, contents));
			} catch (IOException e) {
				ctx.error(new IOErrorIssue(e));
			}
		}
		for (String text : opts.add_variable) {
			AddVariableRequest request = EditRequestParsingPass.parseAddVariable(ctx, text);
			if (request != null) {
				requests.add(request);
			}
		}
		for (String text : opts.split_action) {
			SplitActionRequest request = EditRequestParsingPass.parseSplitAction(ctx, text);
			if (request != null) {
				requests.add(request);
			}
		}
		return requests;
	}

	private static List<Outcome> processAll(TLAEditOptions opts, List<EditRequest> requests)
			throws InterruptedException {
		List<Outcome> outcomes = new ArrayList<>();
		if (opts.threads == 1 || opts.inputFilePaths.size() == 1) {
			for (String input : opts.inputFilePaths) {
				outcomes.add(process(Paths.get(input), opts.check, requests));
			}
			return outcomes;
		}
		// modules are independent of each other, so each one is a separate task
		ExecutorService pool = Executors.newFixedThreadPool(opts.threads);
		try {
			List<Future<Outcome>> futures = new ArrayList<>();
			for (String input : opts.inputFilePaths) {
				futures.add(pool.submit(() -> process(Paths.get(input), opts.check, requests)));
			}
			for (Future<Outcome> future : futures) {
				try {
					outcomes.add(future.get());
				} catch (ExecutionException e) {
					throw new InternalEngineError(e);
				}
			}
		} finally {
			pool.shutdown();
		}
		return outcomes;
	}

	static Outcome process(Path inputFilePath, boolean check, List<EditRequest> requests) {
		logger.info("Opening source file \"" + inputFilePath + "\"");
		String contents;
		try {
			contents = FileUtils.readFileToString(inputFilePath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			return new Outcome(inputFilePath, false, Collections.singletonList(new IOErrorIssue(e)), null);
		}

		logger.info("Parsing TLA+ module");
		TLAModule module;
		try {
			module = TLAParsingPass.perform(inputFilePath, contents);
		} catch (Issue issue) {
			return new Outcome(inputFilePath, false, Collections.singletonList(issue), null);
		}

		if (check) {
			logger.info("Validating module");
			TopLevelIssueContext ctx = EditEngine.check(module);
			return new Outcome(inputFilePath, !ctx.hasErrors(), ctx.getIssues(), null);
		}

		logger.info("Applying " + requests.size() + " edit(s)");
		EditResult result = EditEngine.applyAll(module, requests);
		if (!result.isSuccess()) {
			return new Outcome(inputFilePath, false, result.getIssues(), null);
		}
		return new Outcome(inputFilePath, true, result.getIssues(), result.getText());
	}

	static JSONObject report(List<Outcome> outcomes) {
		JSONArray files = new JSONArray();
		for (Outcome outcome : outcomes) {
			JSONArray issues = new JSONArray();
			for (Issue issue : outcome.issues) {
				issues.put(new JSONObject()
						.put("kind", issue.getKind().name())
						.put("warning", issue.isWarning())
						.put("message", issue.getMessage()));
			}
			files.put(new JSONObject()
					.put("file", outcome.path.toString())
					.put("success", outcome.success)
					.put("issues", issues));
		}
		return new JSONObject().put("files", files);
	}
}
