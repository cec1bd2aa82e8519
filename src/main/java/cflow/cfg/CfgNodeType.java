package cflow.cfg;

public enum CfgNodeType {
	START,
	END,
	PROCESS,
	DECISION,
	FUNCTION,
	RETURN,
	ASSIGNMENT,
	LOOP
}
