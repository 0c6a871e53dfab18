package me.christianrobert.cpp2py.transformation.codegen;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.definition.ClassDef;
import me.christianrobert.cpp2py.transformation.tree.definition.FunctionDef;
import me.christianrobert.cpp2py.transformation.tree.definition.Module;
import me.christianrobert.cpp2py.transformation.tree.definition.Parameter;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.expression.TupleLiteral;
import me.christianrobert.cpp2py.transformation.tree.expression.UnaryOp;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;
import me.christianrobert.cpp2py.transformation.tree.statement.DoWhileLoop;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;
import me.christianrobert.cpp2py.transformation.tree.statement.ForEach;
import me.christianrobert.cpp2py.transformation.tree.statement.ForLoop;
import me.christianrobert.cpp2py.transformation.tree.statement.ForRange;
import me.christianrobert.cpp2py.transformation.tree.statement.If;
import me.christianrobert.cpp2py.transformation.tree.statement.Opaque;
import me.christianrobert.cpp2py.transformation.tree.statement.Return;
import me.christianrobert.cpp2py.transformation.tree.statement.WhileLoop;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Renders a rewritten tree as Python 3 source.
 *
 * <p>Layout: four-space indentation, two blank lines around top-level functions and
 * classes, one blank line between methods. {@code import math} / {@code import sys} are
 * emitted when the tree references those modules. The output of a non-empty module ends
 * with a single newline; an empty module renders as the empty string.</p>
 *
 * <p>Constructs no rule rewrote still render as valid Python: a C-style for loop becomes
 * a while loop, a do-while becomes {@code while True} with a trailing exit test.</p>
 */
@ApplicationScoped
public class PythonCodeGenerator {

    private static final Set<String> IMPORTABLE_MODULES = Set.of("math", "sys");

    public String generate(Module module) {
        if (module.isEmpty()) {
            return "";
        }
        Writer writer = new Writer();
        List<String> imports = requiredImports(module);
        for (String name : imports) {
            writer.line("import " + name);
        }
        if (!imports.isEmpty()) {
            writer.blank(isDefinition(module.getBody().get(0)) ? 2 : 1);
        }

        Node previous = null;
        for (Node statement : module.getBody()) {
            if (previous != null && (isDefinition(previous) || isDefinition(statement))) {
                writer.blank(2);
            }
            writer.statement(statement);
            previous = statement;
        }
        return writer.toString();
    }

    private static List<String> requiredImports(Module module) {
        Set<String> modules = new TreeSet<>();
        Nodes.descendants(module)
                .filter(n -> n instanceof MemberAccess && ((MemberAccess) n).getObject() instanceof Identifier)
                .map(n -> ((Identifier) ((MemberAccess) n).getObject()).getName())
                .filter(IMPORTABLE_MODULES::contains)
                .forEach(modules::add);
        return new ArrayList<>(modules);
    }

    private static boolean isDefinition(Node node) {
        return node instanceof FunctionDef || node instanceof ClassDef;
    }

    /**
     * Line-oriented output state for one module.
     */
    private static final class Writer {

        private static final String INDENT = "    ";

        private final List<String> lines = new ArrayList<>();
        // code to run before "continue" in the innermost loop; empty for native loops
        private final Deque<List<Runnable>> continuePreludes = new ArrayDeque<>();
        private int depth;

        void line(String text) {
            lines.add(INDENT.repeat(depth) + text);
        }

        void blank(int count) {
            for (int i = 0; i < count; i++) {
                lines.add("");
            }
        }

        // ========== STATEMENTS ==========

        void statement(Node node) {
            switch (node.getKind()) {
                case FUNCTION_DEF:
                    function((FunctionDef) node);
                    break;
                case CLASS_DEF:
                    classDef((ClassDef) node);
                    break;
                case BLOCK:
                    for (Node child : ((Block) node).getStatements()) {
                        statement(child);
                    }
                    break;
                case FOR_LOOP:
                    forLoop((ForLoop) node);
                    break;
                case FOR_RANGE:
                    forRange((ForRange) node);
                    break;
                case FOR_EACH: {
                    ForEach loop = (ForEach) node;
                    line("for " + PythonNames.name(loop.getTarget()) + " in "
                            + ExpressionRenderer.render(loop.getIterable()) + ":");
                    loopBody(loop.getBody(), List.of());
                    break;
                }
                case WHILE_LOOP: {
                    WhileLoop loop = (WhileLoop) node;
                    line("while " + ExpressionRenderer.render(loop.getCondition()) + ":");
                    loopBody(loop.getBody(), List.of());
                    break;
                }
                case DO_WHILE_LOOP:
                    doWhile((DoWhileLoop) node);
                    break;
                case IF:
                    ifChain((If) node, "if");
                    break;
                case BREAK:
                    line("break");
                    break;
                case CONTINUE:
                    continueStatement();
                    break;
                case RETURN: {
                    Node value = ((Return) node).getValue();
                    line(value == null ? "return" : "return " + ExpressionRenderer.render(value));
                    break;
                }
                case EXPRESSION_STATEMENT:
                    expressionStatement((ExpressionStatement) node);
                    break;
                case ASSIGNMENT:
                    assignment((Assignment) node);
                    break;
                case OPAQUE:
                    opaque((Opaque) node);
                    break;
                default:
                    throw new IllegalArgumentException("Not a statement: " + node.getKind());
            }
        }

        private void function(FunctionDef function) {
            if (function.isStaticMethod()) {
                line("@staticmethod");
            }
            List<String> parameters = new ArrayList<>();
            for (Parameter parameter : function.getParameters()) {
                parameters.add(parameter(parameter));
            }
            String returns = function.getReturnType() != null ? " -> " + function.getReturnType() : "";
            line("def " + PythonNames.name(function.getName()) + "(" + String.join(", ", parameters) + ")"
                    + returns + ":");
            continuePreludes.push(List.of());
            block(function.getBody());
            continuePreludes.pop();
        }

        private static String parameter(Parameter parameter) {
            String name = PythonNames.name(parameter.getName());
            Node defaultValue = parameter.getDefaultValue();
            if (parameter.getTypeHint() == null) {
                return defaultValue == null
                        ? name
                        : name + "=" + ExpressionRenderer.render(defaultValue, ExpressionRenderer.CONDITIONAL);
            }
            String annotated = name + ": " + parameter.getTypeHint();
            return defaultValue == null
                    ? annotated
                    : annotated + " = " + ExpressionRenderer.render(defaultValue, ExpressionRenderer.CONDITIONAL);
        }

        private void classDef(ClassDef classDef) {
            String bases = classDef.getBases().isEmpty()
                    ? ""
                    : "(" + String.join(", ", classDef.getBases().stream().map(PythonNames::qualified)
                    .toArray(String[]::new)) + ")";
            line("class " + PythonNames.name(classDef.getName()) + bases + ":");
            depth++;
            Node previous = null;
            for (Node member : classDef.getBody()) {
                if (previous != null && (previous instanceof FunctionDef || member instanceof FunctionDef)) {
                    blank(1);
                }
                statement(member);
                previous = member;
            }
            if (needsPass(classDef.getBody())) {
                line("pass");
            }
            depth--;
        }

        private void forLoop(ForLoop loop) {
            line("# C-style for loop translated as a while loop");
            if (loop.getInit() != null) {
                statement(loop.getInit());
            }
            String condition = loop.getCondition() != null ? ExpressionRenderer.render(loop.getCondition()) : "True";
            line("while " + condition + ":");
            List<Runnable> prelude = loop.getStep() != null
                    ? List.of(() -> statement(loop.getStep()))
                    : List.of();
            continuePreludes.push(prelude);
            depth++;
            for (Node statement : loop.getBody().getStatements()) {
                statement(statement);
            }
            if (loop.getStep() != null) {
                statement(loop.getStep());
            } else if (needsPass(loop.getBody().getStatements())) {
                line("pass");
            }
            depth--;
            continuePreludes.pop();
        }

        private void forRange(ForRange loop) {
            List<String> arguments = new ArrayList<>();
            boolean zeroStart = loop.getStart() instanceof Literal && ((Literal) loop.getStart()).isInteger(0);
            if (!zeroStart || loop.getStep() != null) {
                arguments.add(ExpressionRenderer.render(loop.getStart(), ExpressionRenderer.CONDITIONAL));
            }
            arguments.add(ExpressionRenderer.render(loop.getStop(), ExpressionRenderer.CONDITIONAL));
            if (loop.getStep() != null) {
                arguments.add(ExpressionRenderer.render(loop.getStep(), ExpressionRenderer.CONDITIONAL));
            }
            line("for " + PythonNames.name(loop.getTarget()) + " in range(" + String.join(", ", arguments) + "):");
            loopBody(loop.getBody(), List.of());
        }

        private void doWhile(DoWhileLoop loop) {
            line("while True:");
            Runnable exitTest = () -> {
                Node negated = new UnaryOp("not", loop.getCondition(), false, null, "bool");
                line("if " + ExpressionRenderer.render(negated) + ":");
                depth++;
                line("break");
                depth--;
            };
            continuePreludes.push(List.of(exitTest));
            depth++;
            for (Node statement : loop.getBody().getStatements()) {
                statement(statement);
            }
            exitTest.run();
            depth--;
            continuePreludes.pop();
        }

        private void loopBody(Block body, List<Runnable> prelude) {
            continuePreludes.push(prelude);
            block(body);
            continuePreludes.pop();
        }

        private void continueStatement() {
            List<Runnable> prelude = continuePreludes.isEmpty() ? List.of() : continuePreludes.peek();
            prelude.forEach(Runnable::run);
            line("continue");
        }

        private void ifChain(If node, String keyword) {
            line(keyword + " " + ExpressionRenderer.render(node.getCondition()) + ":");
            block(node.getThenBlock());
            Block elseBlock = node.getElseBlock();
            if (elseBlock == null || elseBlock.isEmpty()) {
                return;
            }
            List<Node> statements = elseBlock.getStatements();
            if (statements.size() == 1 && statements.get(0) instanceof If) {
                ifChain((If) statements.get(0), "elif");
            } else {
                line("else:");
                block(elseBlock);
            }
        }

        private void expressionStatement(ExpressionStatement statement) {
            Node expression = statement.getExpression();
            if (expression instanceof UnaryOp && ((UnaryOp) expression).isIncrementOrDecrement()) {
                UnaryOp increment = (UnaryOp) expression;
                String operator = "++".equals(increment.getOperator()) ? " += 1" : " -= 1";
                line(ExpressionRenderer.render(increment.getOperand()) + operator);
                return;
            }
            line(ExpressionRenderer.render(expression));
        }

        private void assignment(Assignment assignment) {
            Node target = assignment.getTarget();
            String targetText = target instanceof TupleLiteral
                    ? ExpressionRenderer.renderBare(((TupleLiteral) target).getElements())
                    : ExpressionRenderer.render(target);
            Node value = assignment.getValue();
            String valueText = value instanceof TupleLiteral && ((TupleLiteral) value).getElements().size() > 1
                    ? ExpressionRenderer.renderBare(((TupleLiteral) value).getElements())
                    : ExpressionRenderer.render(value);
            if (assignment.isDeclaration() && assignment.getTypeHint() != null
                    && (target instanceof Identifier || target instanceof MemberAccess)) {
                line(targetText + ": " + assignment.getTypeHint() + " = " + valueText);
            } else {
                line(targetText + " " + assignment.getOperator() + " " + valueText);
            }
        }

        private void opaque(Opaque opaque) {
            String where = opaque.getLocation() != null ? " (" + opaque.getLocation() + ")" : "";
            line("# UNTRANSLATED C++" + where + ": " + opaque.getReason());
            for (String original : opaque.getText().split("\\R", -1)) {
                String trimmed = original.stripTrailing();
                line(trimmed.isEmpty() ? "#" : "# " + trimmed);
            }
        }

        private void block(Block block) {
            depth++;
            for (Node statement : block.getStatements()) {
                statement(statement);
            }
            if (needsPass(block.getStatements())) {
                line("pass");
            }
            depth--;
        }

        /**
         * True when the statements render no executable line: empty, or comments only.
         */
        private static boolean needsPass(List<Node> statements) {
            return statements.stream().allMatch(s -> s instanceof Opaque);
        }

        @Override
        public String toString() {
            return String.join("\n", lines) + "\n";
        }
    }
}
