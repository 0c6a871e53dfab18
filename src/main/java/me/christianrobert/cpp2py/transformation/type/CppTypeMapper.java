package me.christianrobert.cpp2py.transformation.type;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.ListLiteral;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.LiteralType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps C++ type spellings to normalized C++ types (for inference) and to Python
 * annotations and default values.
 *
 * <p>Normalized spellings: {@code int} for every integral type, {@code double} for every
 * floating type, {@code bool}, {@code char}, {@code void}, {@code auto},
 * {@code std::string}, {@code std::vector<T>} and friends with normalized arguments,
 * and user class names as written.</p>
 */
public class CppTypeMapper {

  private static final Set<String> SEQUENCE_TYPES = Set.of("vector", "list", "deque", "array");
  private static final Set<String> MAP_TYPES = Set.of("map", "unordered_map", "multimap");
  private static final Set<String> SET_TYPES = Set.of("set", "unordered_set", "multiset");
  private static final Set<String> TUPLE_TYPES = Set.of("pair", "tuple");

  private final Set<String> knownClasses;

  public CppTypeMapper(Set<String> knownClasses) {
    this.knownClasses = Set.copyOf(knownClasses);
  }

  public boolean isKnownClass(String type) {
    return type != null && knownClasses.contains(type);
  }

  // ========== NORMALIZATION ==========

  /**
   * Normalizes a C++ type spelling such as {@code const std::vector<long long>&}.
   *
   * @param cppType Type text with tokens separated by single spaces where needed
   * @return Normalized type, or null for null input
   */
  public static String normalize(String cppType) {
    if (cppType == null) {
      return null;
    }
    String type = cppType.trim();
    type = type.replaceAll("\\b(const|volatile|typename|struct|class)\\b", " ");
    type = type.replaceAll("[&*]", " ");
    type = type.replaceAll("\\s+", " ").trim();
    type = type.replaceAll("\\s*(::|<|>|,)\\s*", "$1");
    if (type.isEmpty()) {
      return null;
    }

    int open = type.indexOf('<');
    if (open > 0 && type.endsWith(">")) {
      String name = qualifyStd(type.substring(0, open));
      List<String> arguments = new ArrayList<>();
      for (String argument : splitTopLevel(type.substring(open + 1, type.length() - 1))) {
        String normalized = normalize(argument);
        arguments.add(normalized == null ? argument : normalized);
      }
      return name + "<" + String.join(",", arguments) + ">";
    }

    if (type.matches("[a-z_ ]+") && isFundamentalWords(type)) {
      return normalizeFundamental(type);
    }

    switch (type) {
      case "size_t":
      case "std::size_t":
      case "ssize_t":
      case "ptrdiff_t":
      case "int8_t":
      case "int16_t":
      case "int32_t":
      case "int64_t":
      case "uint8_t":
      case "uint16_t":
      case "uint32_t":
      case "uint64_t":
      case "std::int64_t":
      case "std::uint64_t":
        return "int";
      case "string":
      case "std::string":
        return "std::string";
      default:
        return type;
    }
  }

  private static boolean isFundamentalWords(String type) {
    for (String word : type.split(" ")) {
      switch (word) {
        case "void":
        case "bool":
        case "char":
        case "wchar_t":
        case "short":
        case "int":
        case "long":
        case "float":
        case "double":
        case "signed":
        case "unsigned":
        case "auto":
          break;
        default:
          return false;
      }
    }
    return true;
  }

  private static String normalizeFundamental(String type) {
    if (type.contains("void")) {
      return "void";
    }
    if (type.contains("auto")) {
      return "auto";
    }
    if (type.contains("bool")) {
      return "bool";
    }
    if (type.contains("float") || type.contains("double")) {
      return "double";
    }
    if ((type.contains("char") || type.contains("wchar_t")) && !type.contains("int")) {
      return "char";
    }
    return "int";
  }

  private static String qualifyStd(String name) {
    if (SEQUENCE_TYPES.contains(name) || MAP_TYPES.contains(name) || SET_TYPES.contains(name)
        || TUPLE_TYPES.contains(name)) {
      return "std::" + name;
    }
    return name;
  }

  private static List<String> splitTopLevel(String arguments) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < arguments.length(); i++) {
      char c = arguments.charAt(i);
      if (c == '<') {
        depth++;
      } else if (c == '>') {
        depth--;
      } else if (c == ',' && depth == 0) {
        parts.add(arguments.substring(start, i));
        start = i + 1;
      }
    }
    parts.add(arguments.substring(start));
    return parts;
  }

  // ========== CLASSIFICATION ==========

  public static boolean isIntegral(String normalizedType) {
    return "int".equals(normalizedType);
  }

  public static boolean isFloating(String normalizedType) {
    return "double".equals(normalizedType);
  }

  public static boolean isNumeric(String normalizedType) {
    return isIntegral(normalizedType) || isFloating(normalizedType);
  }

  /**
   * True for {@code std::string} and {@code char}, which both become Python {@code str}.
   */
  public static boolean isString(String normalizedType) {
    return "std::string".equals(normalizedType) || "char".equals(normalizedType);
  }

  public static boolean isContainer(String normalizedType) {
    String base = templateName(normalizedType);
    if (base == null || !base.startsWith("std::")) {
      return false;
    }
    String name = base.substring(5);
    return SEQUENCE_TYPES.contains(name) || MAP_TYPES.contains(name) || SET_TYPES.contains(name);
  }

  /**
   * Template name of a normalized type ({@code std::vector} for {@code std::vector<int>}),
   * the type itself when it is not a template instance.
   */
  public static String templateName(String normalizedType) {
    if (normalizedType == null) {
      return null;
    }
    int open = normalizedType.indexOf('<');
    return open < 0 ? normalizedType : normalizedType.substring(0, open);
  }

  /**
   * Normalized template arguments, empty when the type is not a template instance.
   */
  public static List<String> templateArguments(String normalizedType) {
    if (normalizedType == null) {
      return List.of();
    }
    int open = normalizedType.indexOf('<');
    if (open < 0 || !normalizedType.endsWith(">")) {
      return List.of();
    }
    return splitTopLevel(normalizedType.substring(open + 1, normalizedType.length() - 1));
  }

  // ========== PYTHON MAPPING ==========

  /**
   * Python annotation for a normalized type, or null when the type has none
   * ({@code void}, {@code auto}, unknown library or template parameter types).
   */
  public String toPython(String normalizedType) {
    if (normalizedType == null) {
      return null;
    }

    switch (normalizedType) {
      case "int":
        return "int";
      case "double":
        return "float";
      case "bool":
        return "bool";
      case "char":
      case "std::string":
        return "str";
      case "void":
      case "auto":
        return null;
      default:
        break;
    }

    String base = templateName(normalizedType);
    List<String> arguments = templateArguments(normalizedType);
    if (base.startsWith("std::")) {
      String name = base.substring(5);
      if (SEQUENCE_TYPES.contains(name)) {
        return generic("list", arguments.isEmpty() ? List.of() : arguments.subList(0, 1));
      }
      if (MAP_TYPES.contains(name)) {
        return generic("dict", arguments.size() >= 2 ? arguments.subList(0, 2) : List.of());
      }
      if (SET_TYPES.contains(name)) {
        return generic("set", arguments.isEmpty() ? List.of() : arguments.subList(0, 1));
      }
      if (TUPLE_TYPES.contains(name)) {
        return generic("tuple", arguments);
      }
      return null;
    }

    return isKnownClass(normalizedType) ? normalizedType : null;
  }

  private String generic(String pythonName, List<String> arguments) {
    if (arguments.isEmpty()) {
      return pythonName;
    }
    List<String> mapped = new ArrayList<>(arguments.size());
    for (String argument : arguments) {
      String python = toPython(argument);
      if (python == null) {
        return pythonName;
      }
      mapped.add(python);
    }
    return pythonName + "[" + String.join(", ", mapped) + "]";
  }

  /**
   * Value an uninitialized declaration of the given type starts with: an empty container,
   * an empty string, a default-constructed user class, or {@code None}.
   */
  public Node defaultValue(String normalizedType) {
    if (normalizedType == null) {
      return Literal.none();
    }
    if ("std::string".equals(normalizedType)) {
      return Literal.string("");
    }
    if (isKnownClass(normalizedType)) {
      return Call.of(normalizedType);
    }
    String base = templateName(normalizedType);
    if (base.startsWith("std::")) {
      String name = base.substring(5);
      if (SEQUENCE_TYPES.contains(name)) {
        return new ListLiteral(List.of(), null, normalizedType);
      }
      if (MAP_TYPES.contains(name)) {
        return Call.of("dict");
      }
      if (SET_TYPES.contains(name)) {
        return Call.of("set");
      }
    }
    return Literal.none();
  }

  /**
   * Element default for {@code T a[n]} arrays: zero for numbers, empty string, False, None.
   */
  public Node elementDefault(String normalizedType) {
    if (isIntegral(normalizedType)) {
      return Literal.integer(0);
    }
    if (isFloating(normalizedType)) {
      return new Literal(LiteralType.FLOAT,
          "0.0", null, "double");
    }
    if ("bool".equals(normalizedType)) {
      return Literal.bool(false);
    }
    return defaultValue(normalizedType);
  }
}
