package me.christianrobert.cpp2py.transformation.util;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.definition.ClassDef;
import me.christianrobert.cpp2py.transformation.tree.definition.FunctionDef;
import me.christianrobert.cpp2py.transformation.tree.definition.Parameter;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Cast;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.KeywordArgument;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.expression.UnaryOp;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.ForEach;
import me.christianrobert.cpp2py.transformation.tree.statement.ForRange;
import me.christianrobert.cpp2py.transformation.tree.statement.Opaque;

/**
 * Formats internal trees into human-readable, indented text.
 *
 * <p>Example output:</p>
 * <pre>
 * MODULE
 *   FUNCTION_DEF [main]
 *     BLOCK
 *       FOR_RANGE [i]
 *         LITERAL [0] (int)
 *         LITERAL [5] (int)
 *         BLOCK
 * </pre>
 */
public class NodeTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a tree into human-readable text.
   *
   * @param root Root of the tree
   * @return Formatted string representation
   */
  public static String format(Node root) {
    if (root == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(root, 0, sb);
    return sb.toString();
  }

  private static void formatNode(Node node, int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }

    sb.append(node.getKind());
    String label = label(node);
    if (label != null) {
      sb.append(" [").append(escapeAndTruncate(label)).append("]");
    }
    if (node.getInferredType() != null) {
      sb.append(" (").append(node.getInferredType()).append(")");
    }
    sb.append("\n");

    for (Node child : node.getChildren()) {
      formatNode(child, depth + 1, sb);
    }
  }

  /**
   * Short attribute summary per kind, null when the kind has no attributes worth showing.
   */
  private static String label(Node node) {
    return switch (node.getKind()) {
      case MODULE, BLOCK, FOR_LOOP, WHILE_LOOP, DO_WHILE_LOOP, IF, BREAK, CONTINUE, RETURN,
           EXPRESSION_STATEMENT, CALL, SUBSCRIPT, CONDITIONAL_EXPRESSION, LIST_LITERAL, TUPLE_LITERAL -> null;
      case FUNCTION_DEF -> {
        FunctionDef function = (FunctionDef) node;
        yield function.getName() + (function.isStaticMethod() ? " static" : "");
      }
      case PARAMETER -> {
        Parameter parameter = (Parameter) node;
        yield parameter.getTypeHint() == null
            ? parameter.getName()
            : parameter.getName() + ": " + parameter.getTypeHint();
      }
      case CLASS_DEF -> {
        ClassDef classDef = (ClassDef) node;
        yield classDef.getBases().isEmpty()
            ? classDef.getName()
            : classDef.getName() + "(" + String.join(", ", classDef.getBases()) + ")";
      }
      case FOR_RANGE -> ((ForRange) node).getTarget();
      case FOR_EACH -> ((ForEach) node).getTarget();
      case ASSIGNMENT -> {
        Assignment assignment = (Assignment) node;
        String hint = assignment.getTypeHint() != null ? " : " + assignment.getTypeHint() : "";
        yield assignment.getOperator() + hint + (assignment.isDeclaration() ? " decl" : "");
      }
      case OPAQUE -> ((Opaque) node).getReason();
      case KEYWORD_ARGUMENT -> ((KeywordArgument) node).getName();
      case IDENTIFIER -> ((Identifier) node).getName();
      case LITERAL -> ((Literal) node).getValue();
      case BINARY_OP -> ((BinaryOp) node).getOperator();
      case UNARY_OP -> {
        UnaryOp unary = (UnaryOp) node;
        yield unary.isPostfix() ? "postfix " + unary.getOperator() : unary.getOperator();
      }
      case MEMBER_ACCESS -> ((MemberAccess) node).getAttribute();
      case CAST -> ((Cast) node).getTargetType();
    };
  }

  private static String escapeAndTruncate(String text) {
    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");
    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }
    return text;
  }
}
