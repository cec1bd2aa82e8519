package cflow.ast.c;

public interface AstVisitor<R, A> {
	R visitProgram(Program node, A arg);

	R visitFunction(Function node, A arg);

	R visitDeclaration(Declaration node, A arg);

	R visitBlock(Block node, A arg);

	R visitIf(IfStatement node, A arg);

	R visitWhile(WhileStatement node, A arg);

	R visitFor(ForStatement node, A arg);

	R visitReturn(ReturnStatement node, A arg);

	R visitAssignment(AssignmentStatement node, A arg);

	R visitFunctionCall(FunctionCall node, A arg);

	R visitIdentifier(Identifier node, A arg);

	R visitLiteral(Literal node, A arg);

	R visitBinaryOp(BinaryOp node, A arg);

	R visitPreprocessor(PreprocessorDirective node, A arg);
}
