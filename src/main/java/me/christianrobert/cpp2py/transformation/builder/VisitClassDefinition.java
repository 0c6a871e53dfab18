package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;
import me.christianrobert.cpp2py.transformation.tree.definition.ClassDef;
import me.christianrobert.cpp2py.transformation.tree.definition.FunctionDef;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static helper for class and struct definitions.
 *
 * <p>Static fields become class-level annotated assignments. Instance fields become
 * {@code this.field: T = value} assignments at the start of the constructor, so that
 * every instance gets its own value; a class without a constructor gets one. Methods and
 * the constructor become function definitions. Python has no overloading, so a second
 * constructor or a second method of the same name is passed through as an opaque member.
 * Multiple inheritance makes the whole class opaque.</p>
 */
public class VisitClassDefinition {

    public static Node v(CppParser.ClassDefinitionContext ctx, TreeConverter b) {
        String name = ctx.className.getText();
        List<String> bases = bases(ctx.baseClause(), b);

        b.enterClass(name);
        try {
            return b.withScope(() -> {
                for (Map.Entry<String, String> field : b.index().fieldsOf(name).entrySet()) {
                    b.scope().declare(field.getKey(), field.getValue());
                }

                Set<String> definedFunctions = new HashSet<>();
                List<Node> body = new ArrayList<>();
                for (CppParser.MemberSpecificationContext member : ctx.memberSpecification()) {
                    body.addAll(b.failSoft(member, () -> member(member, name, bases, definedFunctions, b)));
                }
                SourceLocation location = TreeConverter.location(ctx);
                return new ClassDef(name, bases, withFieldInitializers(body, name, bases, location), location);
            });
        } finally {
            b.exitClass();
        }
    }

    private static List<String> bases(CppParser.BaseClauseContext ctx, TreeConverter b) {
        if (ctx == null) {
            return List.of();
        }
        if (ctx.baseSpecifier().size() > 1) {
            throw b.unsupported("multiple inheritance", ctx);
        }
        CppParser.BaseSpecifierContext base = ctx.baseSpecifier(0);
        if (base.templateArguments() != null) {
            throw b.unsupported("template base class", ctx);
        }
        return List.of(base.qualifiedName().getText());
    }

    private static List<Node> member(CppParser.MemberSpecificationContext ctx, String className, List<String> bases,
                                     Set<String> definedFunctions, TreeConverter b) {
        if (ctx instanceof CppParser.FieldMemberContext) {
            CppParser.SimpleDeclarationContext declaration = ((CppParser.FieldMemberContext) ctx).simpleDeclaration();
            List<Node> fields = VisitSimpleDeclaration.v(declaration, b);
            boolean isStatic = declaration.declSpecifier().stream().anyMatch(s -> "static".equals(s.getText()));
            return isStatic ? fields : instanceFields(fields, className);
        }
        if (ctx instanceof CppParser.ConstructorMemberContext) {
            if (definedFunctions.contains(className)) {
                throw b.unsupported("overloaded constructor", ctx);
            }
            Node constructor = VisitFunctionDefinition.constructor(
                    ((CppParser.ConstructorMemberContext) ctx).constructorDefinition(), className, bases, b);
            definedFunctions.add(className);
            return List.of(constructor);
        }
        if (ctx instanceof CppParser.DestructorMemberContext) {
            throw b.unsupported("destructor", ctx);
        }
        if (ctx instanceof CppParser.MethodMemberContext) {
            CppParser.FunctionDefinitionContext definition = ((CppParser.MethodMemberContext) ctx).functionDefinition();
            String methodName = definition.declaratorName().getText();
            if (definedFunctions.contains(methodName)) {
                throw b.unsupported("overloaded method " + methodName, ctx);
            }
            FunctionDef method = (FunctionDef) VisitFunctionDefinition.v(definition, true, b);
            definedFunctions.add(methodName);
            return List.of(method);
        }
        // access sections, prototypes, using declarations, stray semicolons
        return List.of();
    }

    private static List<Node> instanceFields(List<Node> fields, String className) {
        List<Node> result = new ArrayList<>(fields.size());
        for (Node field : fields) {
            if (!(field instanceof Assignment) || !(((Assignment) field).getTarget() instanceof Identifier)) {
                result.add(field);
                continue;
            }
            Assignment declaration = (Assignment) field;
            Identifier name = (Identifier) declaration.getTarget();
            Node target = new MemberAccess(new Identifier("this", name.getLocation(), className), name.getName(),
                    name.getLocation(), name.getInferredType());
            result.add(new Assignment(target, "=", declaration.getValue(), declaration.getTypeHint(), true,
                    declaration.getLocation()));
        }
        return result;
    }

    /**
     * Moves instance field initializers into the constructor. Fields that the member
     * initializer list sets are not initialized twice.
     */
    static List<Node> withFieldInitializers(List<Node> members, String className, List<String> bases,
                                            SourceLocation location) {
        List<Node> fieldInitializers = new ArrayList<>();
        List<Node> rest = new ArrayList<>(members.size());
        int firstField = -1;
        int constructorIndex = -1;
        for (Node member : members) {
            if (isFieldInitializer(member)) {
                if (firstField < 0) {
                    firstField = rest.size();
                }
                fieldInitializers.add(member);
                continue;
            }
            if (member instanceof FunctionDef && ((FunctionDef) member).getName().equals(className)) {
                constructorIndex = rest.size();
            }
            rest.add(member);
        }
        if (fieldInitializers.isEmpty()) {
            return members;
        }

        if (constructorIndex >= 0) {
            FunctionDef constructor = (FunctionDef) rest.get(constructorIndex);
            rest.set(constructorIndex, constructor.withBody(
                    new Block(initialize(constructor.getBody().getStatements(), fieldInitializers))));
        } else {
            List<Node> statements = new ArrayList<>();
            if (!bases.isEmpty()) {
                statements.add(new ExpressionStatement(new Call(new MemberAccess(Call.of("super"), "__init__"),
                        List.of(), List.of(), location, null), location));
            }
            statements.addAll(fieldInitializers);
            rest.add(firstField, new FunctionDef(className, List.of(), null, new Block(statements), false, location));
        }
        return rest;
    }

    /**
     * Field defaults go after the base class constructor call and before the member
     * initializers, skipping fields the member initializers set.
     */
    private static List<Node> initialize(List<Node> statements, List<Node> fieldInitializers) {
        int insertAt = 0;
        while (insertAt < statements.size() && isSuperInit(statements.get(insertAt))) {
            insertAt++;
        }
        Set<String> initialized = new HashSet<>();
        for (int i = insertAt; i < statements.size(); i++) {
            Node statement = statements.get(i);
            if (isSuperInit(statement)) {
                continue;
            }
            String member = thisMember(statement);
            if (member == null) {
                break;
            }
            initialized.add(member);
        }

        List<Node> result = new ArrayList<>(statements.subList(0, insertAt));
        for (Node field : fieldInitializers) {
            if (!initialized.contains(thisMember(field))) {
                result.add(field);
            }
        }
        result.addAll(statements.subList(insertAt, statements.size()));
        return result;
    }

    private static boolean isFieldInitializer(Node node) {
        return thisMember(node) != null && ((Assignment) node).isDeclaration();
    }

    /**
     * Member name when {@code node} is a plain {@code this.member = value} assignment.
     */
    private static String thisMember(Node node) {
        if (!(node instanceof Assignment) || ((Assignment) node).isAugmented()
                || !(((Assignment) node).getTarget() instanceof MemberAccess)) {
            return null;
        }
        MemberAccess target = (MemberAccess) ((Assignment) node).getTarget();
        if (!(target.getObject() instanceof Identifier) || !"this".equals(((Identifier) target.getObject()).getName())) {
            return null;
        }
        return target.getAttribute();
    }

    private static boolean isSuperInit(Node node) {
        if (!(node instanceof ExpressionStatement) || !(((ExpressionStatement) node).getExpression() instanceof Call)) {
            return false;
        }
        Node callee = ((Call) ((ExpressionStatement) node).getExpression()).getCallee();
        return callee instanceof MemberAccess && "__init__".equals(((MemberAccess) callee).getAttribute());
    }
}
