package tlaedit.trans.passes.split;

import tlaedit.model.tla.*;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Renames identifiers and string-valued control locations throughout a subtree, in one simultaneous
 * substitution: with {@code a2 -> a3, a3 -> a4}, what was a2 ends up a3 and what was a3 ends up a4.
 */
public class RenamingPass {
	private RenamingPass() {}

	public static <T extends TLANode> T perform(T root, Map<String, String> identifiers, Map<String, String> strings) {
		if (identifiers.isEmpty() && strings.isEmpty()) {
			return root;
		}
		Map<TLANode, UnaryOperator<TLANode>> edits = new IdentityHashMap<>();
		TLAUtils.forEachNode(root, node -> {
			if (node instanceof TLAIdentifier) {
				String renamed = identifiers.get(((TLAIdentifier) node).getId());
				if (renamed != null) {
					edits.put(node, n -> TLAUtils.id(renamed));
				}
			} else if (node instanceof TLAGeneralIdentifier) {
				String renamed = identifiers.get(((TLAGeneralIdentifier) node).getName().getId());
				if (renamed != null) {
					edits.put(node, n -> TLAUtils.idexp(renamed));
				}
			} else if (node instanceof TLAString) {
				String renamed = strings.get(((TLAString) node).getValue());
				if (renamed != null) {
					edits.put(node, n -> TLAUtils.str(renamed));
				}
			}
		});
		return TLAUtils.substitute(root, edits);
	}

}
