package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.definition.ClassDef;
import me.christianrobert.cpp2py.transformation.tree.definition.FunctionDef;
import me.christianrobert.cpp2py.transformation.tree.definition.Parameter;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;
import me.christianrobert.cpp2py.transformation.tree.statement.ForEach;
import me.christianrobert.cpp2py.transformation.tree.statement.ForRange;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns C++ member functions into Python methods.
 *
 * <ul>
 *   <li>the constructor (named after the class) becomes {@code __init__}</li>
 *   <li>instance methods get a leading {@code self} parameter</li>
 *   <li>{@code this} becomes {@code self}</li>
 *   <li>bare references to instance fields and instance methods become {@code self.x}
 *       and {@code self.m()}, unless a parameter or local of the same name shadows them</li>
 *   <li>static fields, static methods, and any field referenced from a static method are
 *       qualified with the class name</li>
 * </ul>
 *
 * Shadowing is decided per method, not per block.
 */
public class ClassMethodRule implements Rule {

    public static final String NAME = "class-method";

    private static final String SELF = "self";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "adds self, renames constructors to __init__, qualifies member references";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof ClassDef)) {
            return node;
        }
        ClassDef classDef = (ClassDef) node;
        Members members = Members.of(classDef);

        List<Node> body = new ArrayList<>(classDef.getBody().size());
        boolean changed = false;
        for (Node member : classDef.getBody()) {
            Node rewritten = member instanceof FunctionDef
                    ? rewriteMethod((FunctionDef) member, classDef.getName(), members)
                    : member;
            changed |= rewritten != member;
            body.add(rewritten);
        }
        return changed ? classDef.withBody(body) : node;
    }

    private static Node rewriteMethod(FunctionDef method, String className, Members members) {
        FunctionDef result = method;
        if (method.getName().equals(className)) {
            result = result.withName("__init__");
        }

        List<Parameter> parameters = method.getParameters();
        if (!method.isStaticMethod() && (parameters.isEmpty() || !SELF.equals(parameters.get(0).getName()))) {
            List<Parameter> withSelf = new ArrayList<>(parameters.size() + 1);
            withSelf.add(new Parameter(SELF, null));
            withSelf.addAll(parameters);
            result = result.withParameters(withSelf);
        }

        Set<String> locals = localNames(method);
        Node receiver = method.isStaticMethod() ? null : new Identifier(SELF);
        Block body = (Block) Nodes.transformUp(method.getBody(),
                n -> qualify(n, className, receiver, members, locals));
        if (body != method.getBody()) {
            result = result.withBody(body);
        }
        return result;
    }

    /**
     * Qualifies a single node. {@code receiver} is {@code self} in instance methods and
     * null in static methods.
     */
    private static Node qualify(Node node, String className, Node receiver, Members members, Set<String> locals) {
        if (node instanceof Identifier) {
            Identifier identifier = (Identifier) node;
            String name = identifier.getName();
            if ("this".equals(name) && receiver != null) {
                return new Identifier(SELF, identifier.getLocation(), identifier.getInferredType());
            }
            if (locals.contains(name)) {
                return node;
            }
            Node owner;
            if (members.instanceFields.contains(name) && receiver != null) {
                owner = new Identifier(SELF);
            } else if (members.staticFields.contains(name) || members.instanceFields.contains(name)) {
                owner = new Identifier(className);
            } else {
                return node;
            }
            return new MemberAccess(owner, name, identifier.getLocation(), identifier.getInferredType());
        }
        if (node instanceof Call && ((Call) node).getCallee() instanceof Identifier) {
            Call call = (Call) node;
            String name = ((Identifier) call.getCallee()).getName();
            if (locals.contains(name)) {
                return node;
            }
            Node owner;
            if (members.staticMethods.contains(name)) {
                owner = new Identifier(className);
            } else if (members.instanceMethods.contains(name) && receiver != null) {
                owner = new Identifier(SELF);
            } else {
                return node;
            }
            return new Call(new MemberAccess(owner, name), call.getArguments(), call.getKeywords(),
                    call.getLocation(), call.getInferredType());
        }
        return node;
    }

    private static Set<String> localNames(FunctionDef method) {
        Set<String> locals = new HashSet<>();
        method.getParameters().forEach(p -> locals.add(p.getName()));
        Nodes.descendants(method.getBody()).forEach(n -> {
            if (n instanceof Assignment && ((Assignment) n).isDeclaration()
                    && ((Assignment) n).getTarget() instanceof Identifier) {
                locals.add(((Identifier) ((Assignment) n).getTarget()).getName());
            } else if (n instanceof ForRange) {
                locals.add(((ForRange) n).getTarget());
            } else if (n instanceof ForEach) {
                locals.add(((ForEach) n).getTarget());
            }
        });
        return locals;
    }

    private static final class Members {
        private final Set<String> staticFields = new HashSet<>();
        private final Set<String> instanceFields = new HashSet<>();
        private final Set<String> instanceMethods = new HashSet<>();
        private final Set<String> staticMethods = new HashSet<>();

        static Members of(ClassDef classDef) {
            Members members = new Members();
            for (Node member : classDef.getBody()) {
                if (member instanceof Assignment && ((Assignment) member).getTarget() instanceof Identifier) {
                    members.staticFields.add(((Identifier) ((Assignment) member).getTarget()).getName());
                } else if (member instanceof FunctionDef) {
                    FunctionDef method = (FunctionDef) member;
                    if (method.getName().equals(classDef.getName()) || "__init__".equals(method.getName())) {
                        members.addInstanceFields(method);
                        continue;
                    }
                    (method.isStaticMethod() ? members.staticMethods : members.instanceMethods).add(method.getName());
                }
            }
            return members;
        }

        /**
         * Instance fields are the {@code this.x} or {@code self.x} assignments at the top
         * level of the constructor.
         */
        private void addInstanceFields(FunctionDef constructor) {
            for (Node statement : constructor.getBody().getStatements()) {
                if (!(statement instanceof Assignment)
                        || !(((Assignment) statement).getTarget() instanceof MemberAccess)) {
                    continue;
                }
                MemberAccess target = (MemberAccess) ((Assignment) statement).getTarget();
                if (target.getObject() instanceof Identifier
                        && ("this".equals(((Identifier) target.getObject()).getName())
                        || SELF.equals(((Identifier) target.getObject()).getName()))) {
                    instanceFields.add(target.getAttribute());
                }
            }
        }
    }
}
