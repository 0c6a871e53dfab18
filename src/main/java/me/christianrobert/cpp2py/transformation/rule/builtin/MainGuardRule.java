package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.definition.FunctionDef;
import me.christianrobert.cpp2py.transformation.tree.definition.Module;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;
import me.christianrobert.cpp2py.transformation.tree.statement.If;

import java.util.ArrayList;
import java.util.List;

/**
 * Appends {@code if __name__ == "__main__": main()} to a module that defines a top-level
 * {@code main} function and has no such guard yet.
 */
public class MainGuardRule implements Rule {

    public static final String NAME = "main-guard";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "calls main() under if __name__ == \"__main__\"";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof Module)) {
            return node;
        }
        Module module = (Module) node;
        boolean hasMain = module.getBody().stream()
                .anyMatch(n -> n instanceof FunctionDef && "main".equals(((FunctionDef) n).getName()));
        if (!hasMain) {
            return node;
        }
        Node guardCondition = guardCondition();
        boolean guarded = module.getBody().stream()
                .anyMatch(n -> n instanceof If && ((If) n).getCondition().equals(guardCondition));
        if (guarded) {
            return node;
        }
        List<Node> body = new ArrayList<>(module.getBody());
        body.add(new If(guardCondition, Block.of(new ExpressionStatement(Call.of("main"))), null, null));
        return new Module(body);
    }

    private static Node guardCondition() {
        return new BinaryOp(new Identifier("__name__"), "==", Literal.string("__main__"), null, "bool");
    }
}
