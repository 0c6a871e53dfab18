package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Names declared anywhere in a translation unit, collected before conversion so that
 * uses can be typed regardless of declaration order: class names with their field types,
 * and free function return types.
 */
class DeclarationIndex {

    private final Set<String> classNames = new HashSet<>();
    private final Map<String, Map<String, String>> fieldTypes = new HashMap<>();
    private final Map<String, String> functionReturnTypes = new HashMap<>();

    static DeclarationIndex build(CppParser.TranslationUnitContext tree) {
        DeclarationIndex index = new DeclarationIndex();
        index.scan(tree);
        return index;
    }

    private void scan(ParseTree node) {
        if (node instanceof CppParser.ClassDefinitionContext) {
            indexClass((CppParser.ClassDefinitionContext) node);
        } else if (node instanceof CppParser.ForwardDeclarationContext) {
            classNames.add(((CppParser.ForwardDeclarationContext) node).Identifier().getText());
        } else if (node instanceof CppParser.DeclarationContext) {
            CppParser.DeclarationContext declaration = (CppParser.DeclarationContext) node;
            if (declaration.functionDefinition() != null) {
                indexFunction(declaration.functionDefinition().declaratorName(),
                        declaration.functionDefinition().typeSpecifier());
            } else if (declaration.functionPrototype() != null) {
                indexFunction(declaration.functionPrototype().declaratorName(),
                        declaration.functionPrototype().typeSpecifier());
            }
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            scan(node.getChild(i));
        }
    }

    private void indexClass(CppParser.ClassDefinitionContext ctx) {
        String className = ctx.className.getText();
        classNames.add(className);
        Map<String, String> fields = fieldTypes.computeIfAbsent(className, k -> new HashMap<>());
        for (CppParser.MemberSpecificationContext member : ctx.memberSpecification()) {
            if (member instanceof CppParser.FieldMemberContext) {
                CppParser.SimpleDeclarationContext declaration = ((CppParser.FieldMemberContext) member).simpleDeclaration();
                String type = CppTypeMapper.normalize(TreeConverter.spacedText(declaration.typeSpecifier()));
                for (CppParser.InitDeclaratorContext declarator : declaration.initDeclarator()) {
                    fields.put(declarator.Identifier().getText(),
                            declarator.arraySuffix().isEmpty() ? type : "std::vector<" + type + ">");
                }
            }
        }
    }

    private void indexFunction(CppParser.DeclaratorNameContext name, CppParser.TypeSpecifierContext type) {
        if (name.qualifiedName() != null && name.qualifiedName().Identifier().size() == 1) {
            functionReturnTypes.put(name.getText(), CppTypeMapper.normalize(TreeConverter.spacedText(type)));
        }
    }

    Set<String> getClassNames() {
        return classNames;
    }

    /**
     * Normalized type of {@code field} in {@code className}, or null.
     */
    String fieldType(String className, String field) {
        Map<String, String> fields = fieldTypes.get(className);
        return fields == null ? null : fields.get(field);
    }

    Map<String, String> fieldsOf(String className) {
        return fieldTypes.getOrDefault(className, Map.of());
    }

    String functionReturnType(String name) {
        return functionReturnTypes.get(name);
    }
}
