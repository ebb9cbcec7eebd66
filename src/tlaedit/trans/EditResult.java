package tlaedit.trans;

import tlaedit.errors.Issue;
import tlaedit.formatters.TLASourceRenderer;
import tlaedit.model.tla.TLAModule;
import tlaedit.trans.intermediate.DeclarationCatalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of one or more edits: either the edited module, or the untouched original together with
 * the issues that prevented the edit. Warnings may accompany a success.
 */
public class EditResult {

	private final TLAModule original;
	private final TLAModule module;
	private final DeclarationCatalog catalog;
	private final List<Issue> issues;

	private EditResult(TLAModule original, TLAModule module, DeclarationCatalog catalog, List<Issue> issues) {
		this.original = original;
		this.module = module;
		this.catalog = catalog;
		this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
	}

	public static EditResult success(TLAModule original, TLAModule module, DeclarationCatalog catalog,
	                                 List<Issue> warnings) {
		return new EditResult(original, module, catalog, warnings);
	}

	public static EditResult failure(TLAModule original, List<Issue> issues) {
		return new EditResult(original, original, null, issues);
	}

	public boolean isSuccess() {
		return catalog != null;
	}

	/**
	 * @return the edited module, or the original one if the edit failed
	 */
	public TLAModule getModule() {
		return module;
	}

	public TLAModule getOriginal() {
		return original;
	}

	/**
	 * @return the catalog of the edited module
	 * @throws IllegalStateException if the edit failed
	 */
	public DeclarationCatalog getCatalog() {
		if (catalog == null) {
			throw new IllegalStateException("a failed edit has no catalog");
		}
		return catalog;
	}

	public List<Issue> getIssues() {
		return issues;
	}

	public String getText() {
		return TLASourceRenderer.render(module);
	}

}
