package org.pragmatica.shell.tree;

/**
 * Read-only traversal hook for renderers. One method per node kind, so a visitor that misses a
 * kind does not compile.
 */
public interface NodeVisitor<R> {
    R visitScript(Node.Script script);

    R visitCommand(Node.Command command);

    R visitPipeline(Node.Pipeline pipeline);

    R visitRedirect(Node.Redirect redirect);

    R visitConditional(Node.Conditional conditional);

    R visitLoop(Node.Loop loop);

    R visitAssignment(Node.Assignment assignment);

    R visitSubshell(Node.Subshell subshell);
}
