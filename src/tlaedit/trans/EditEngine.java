package tlaedit.trans;

import tlaedit.errors.Issue;
import tlaedit.errors.TopLevelIssueContext;
import tlaedit.formatters.TLASourceRenderer;
import tlaedit.model.tla.TLAModule;
import tlaedit.model.tla.TLANode;
import tlaedit.parser.TLAParseException;
import tlaedit.parser.TLAParser;
import tlaedit.trans.intermediate.DeclarationCatalog;
import tlaedit.trans.passes.addvar.AddVariablePass;
import tlaedit.trans.passes.parse.ParsingIssue;
import tlaedit.trans.passes.split.SplitActionPass;
import tlaedit.trans.passes.validation.ConsistencyValidationPass;
import tlaedit.util.SourceFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 *
 * Applies edit requests to a module, one at a time:
 *
 * <ol>
 *     <li>catalog the current module;</li>
 *     <li>run the transform the request asks for;</li>
 *     <li>render the result and make sure the text parses again;</li>
 *     <li>validate the result, failing on any violation.</li>
 * </ol>
 *
 * Edits are all-or-nothing. A failed edit leaves the module it was given untouched, and a failure
 * anywhere in a sequence of edits discards the whole sequence.
 *
 */
public class EditEngine {
	private EditEngine() {}

	private static final Logger logger = Logger.getLogger("TLAEdit");

	public static EditResult apply(TLAModule module, EditRequest request) {
		return applyAll(module, Collections.singletonList(request));
	}

	public static EditResult applyAll(TLAModule module, List<EditRequest> requests) {
		TLAModule current = module;
		DeclarationCatalog catalog = DeclarationCatalog.of(current);
		List<Issue> warnings = new ArrayList<>();
		for (EditRequest request : requests) {
			logger.fine("applying " + request);
			TLAModule edited;
			try {
				edited = transform(catalog, current, request);
			} catch (Issue issue) {
				logger.fine("edit failed: " + issue.getMessage());
				return EditResult.failure(module, Collections.singletonList(issue));
			}

			TLAModule reparsed;
			try {
				reparsed = TLAParser.readModule(new SourceFile(pathOf(module), TLASourceRenderer.render(edited)));
			} catch (TLAParseException e) {
				return EditResult.failure(module, Collections.singletonList(new ParsingIssue("edited module", e)));
			}

			TopLevelIssueContext ctx = new TopLevelIssueContext();
			ConsistencyValidationPass.perform(ctx, DeclarationCatalog.of(reparsed));
			if (ctx.hasErrors()) {
				logger.fine("edit failed validation with " + ctx.getIssues().size() + " issue(s)");
				return EditResult.failure(module, ctx.getIssues());
			}
			warnings.clear();
			warnings.addAll(ctx.getIssues());
			current = edited;
			catalog = DeclarationCatalog.of(current);
		}
		return EditResult.success(module, current, catalog, warnings);
	}

	private static TLAModule transform(DeclarationCatalog catalog, TLAModule module, EditRequest request) {
		return request.accept(new EditRequestVisitor<TLAModule, RuntimeException>() {
			@Override
			public TLAModule visit(AddVariableRequest addVariable) {
				return AddVariablePass.perform(catalog, module, addVariable);
			}

			@Override
			public TLAModule visit(SplitActionRequest splitAction) {
				return SplitActionPass.perform(catalog, module, splitAction);
			}
		});
	}

	/**
	 * Validates a module on its own, without editing it.
	 */
	public static TopLevelIssueContext check(TLAModule module) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ConsistencyValidationPass.perform(ctx, DeclarationCatalog.of(module));
		return ctx;
	}

	private static Path pathOf(TLAModule module) {
		TLANode layout = module.getLayoutSource();
		if (layout == null || layout.getLocation().getFile() == null) {
			return null;
		}
		return layout.getLocation().getFile().getPath();
	}
}
