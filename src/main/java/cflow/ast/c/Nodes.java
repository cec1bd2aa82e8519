package cflow.ast.c;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Nodes {
	private Nodes() {
	}

	static Map<String, Object> attrs(Object... keysAndValues) {
		Map<String, Object> map = new LinkedHashMap<>();
		for (int k = 0; k + 1 < keysAndValues.length; k += 2) {
			map.put((String) keysAndValues[k], keysAndValues[k + 1]);
		}
		return Collections.unmodifiableMap(map);
	}

	// absent (null) children are left out
	static List<AstNode> children(AstNode... nodes) {
		List<AstNode> list = new ArrayList<>(nodes.length);
		for (AstNode n : nodes) {
			if (n != null) {
				list.add(n);
			}
		}
		return Collections.unmodifiableList(list);
	}
}
