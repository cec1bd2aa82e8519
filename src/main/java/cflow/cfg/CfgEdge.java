package cflow.cfg;

import java.util.Objects;

public record CfgEdge(String fromId, String toId) {
	public CfgEdge {
		Objects.requireNonNull(fromId, "fromId");
		Objects.requireNonNull(toId, "toId");
	}
}
