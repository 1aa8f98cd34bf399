/*
 * Copyright 2017 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.ts2fable;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.javascript.ts2fable.ir.FsAlias;
import com.google.javascript.ts2fable.ir.FsArray;
import com.google.javascript.ts2fable.ir.FsEnum;
import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.ir.FsFunction;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsModule;
import com.google.javascript.ts2fable.ir.FsNone;
import com.google.javascript.ts2fable.ir.FsParam;
import com.google.javascript.ts2fable.ir.FsProperty;
import com.google.javascript.ts2fable.ir.FsStringLiteral;
import com.google.javascript.ts2fable.ir.FsThis;
import com.google.javascript.ts2fable.ir.FsTodo;
import com.google.javascript.ts2fable.ir.FsTuple;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;
import com.google.javascript.ts2fable.ir.FsUnion;
import com.google.javascript.ts2fable.ir.FsVariable;
import com.google.javascript.ts2fable.parsing.SyntaxKind;
import com.google.javascript.ts2fable.parsing.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Lowers a declaration syntax tree into the F# type model.
 *
 * <p>Every statement, member and type node maps to exactly one {@link FsType}. Constructs the
 * model cannot express degrade to {@code obj}, {@link FsTodo} or {@link FsNone}; only a type
 * reference without a name stops the translation.
 */
final class DeclarationReader {

  private static final Logger logger = Logger.getLogger(DeclarationReader.class.getName());

  static final DiagnosticType UNSUPPORTED_TYPE =
      DiagnosticType.warning("TS2FABLE_UNSUPPORTED_TYPE", "unsupported {0} kind: {1}");

  static final DiagnosticType NULL_TYPE_NAME =
      DiagnosticType.error(
          "TS2FABLE_NULL_TYPE_NAME", "type reference has no type name: {0}");

  static final String INDEX_EMIT = "$0[$1]{{=$2}}";
  static final String INVOKE_EMIT = "$0($1...)";
  static final String CREATE_EMIT = "new $0($1...)";
  static final String NO_CLASS_NAME = "TODO_NoClassName";

  private final String sourceName;
  private final ErrorManager errorManager;

  DeclarationReader(String sourceName, ErrorManager errorManager) {
    this.sourceName = sourceName;
    this.errorManager = errorManager;
  }

  /**
   * Lowers a whole source file. All top-level statements go into a single global module, named
   * with the empty string.
   */
  FsFile readSourceFile(SyntaxNode sourceFile, String namespace, ImmutableList<String> opens) {
    ImmutableList<FsType> statements =
        sourceFile.getStatements().stream().map(this::readStatement).collect(toImmutableList());
    logger.fine(() -> "Read " + statements.size() + " statements from " + sourceName);
    return new FsFile(namespace, opens, ImmutableList.of(new FsModule("", statements)));
  }

  FsType readStatement(SyntaxNode statement) {
    switch (statement.getKind()) {
      case INTERFACE_DECLARATION:
        return readInterface(statement, statement.getName().getText());
      case CLASS_DECLARATION:
        SyntaxNode className = statement.getName();
        return readInterface(statement, className == null ? NO_CLASS_NAME : className.getText());
      case ENUM_DECLARATION:
        return readEnum(statement);
      case TYPE_ALIAS_DECLARATION:
        return readAlias(statement);
      case VARIABLE_STATEMENT:
        return readVariable(statement);
      case FUNCTION_DECLARATION:
        SyntaxNode functionName = statement.getName();
        return readFunction(
            statement,
            null,
            statement.hasModifier(SyntaxKind.STATIC_KEYWORD),
            functionName == null ? null : functionName.getText());
      case MODULE_DECLARATION:
        return readModule(statement);
      case EXPORT_ASSIGNMENT:
        return FsNone.INSTANCE;
      case IMPORT_DECLARATION:
      case IMPORT_EQUALS_DECLARATION:
      case NAMESPACE_EXPORT_DECLARATION:
      case EXPORT_DECLARATION:
        return FsTodo.INSTANCE;
      default:
        return unsupported("statement", statement);
    }
  }

  private FsInterface readInterface(SyntaxNode declaration, String name) {
    return new FsInterface(
        false,
        name,
        readTypeParameters(declaration),
        readInherits(declaration),
        declaration.getMembers().stream().map(this::readMember).collect(toImmutableList()));
  }

  private ImmutableList<FsType> readInherits(SyntaxNode declaration) {
    ImmutableList.Builder<FsType> inherits = ImmutableList.builder();
    for (SyntaxNode clause : declaration.getHeritageClauses()) {
      for (SyntaxNode type : clause.getTypes()) {
        inherits.add(FsTypes.generic(readTypeNode(type), readTypes(type.getTypeArguments())));
      }
    }
    return inherits.build();
  }

  private static ImmutableList<FsType> readTypeParameters(SyntaxNode declaration) {
    return declaration.getTypeParameters().stream()
        .map(tp -> (FsType) FsTypes.mapped(tp.getName().getText()))
        .collect(toImmutableList());
  }

  private FsEnum readEnum(SyntaxNode declaration) {
    return new FsEnum(
        declaration.getName().getText(),
        declaration.getMembers().stream()
            .map(DeclarationReader::readEnumCase)
            .collect(toImmutableList()));
  }

  private static FsEnum.Case readEnumCase(SyntaxNode member) {
    String name = getPropertyName(member.getName());
    SyntaxNode initializer = member.getInitializer();
    if (initializer != null) {
      switch (initializer.getKind()) {
        case NUMERIC_LITERAL:
          return new FsEnum.Case(name, FsEnum.CaseType.NUMERIC, initializer.getText());
        case STRING_LITERAL:
          return new FsEnum.Case(
              name, FsEnum.CaseType.STRING, removeQuotes(initializer.getText()));
        default:
          break;
      }
    }
    return new FsEnum.Case(name, FsEnum.CaseType.UNKNOWN, null);
  }

  /** A union made only of string literals becomes a string enum. */
  private FsType readAlias(SyntaxNode declaration) {
    String name = declaration.getName().getText();
    FsType type = readTypeNode(declaration.getType());
    if (type instanceof FsUnion union
        && union.types().stream().allMatch(FsTypes::isStringLiteral)) {
      return new FsEnum(
          name,
          union.types().stream()
              .map(t -> new FsEnum.Case(FsTypes.asStringLiteral(t), FsEnum.CaseType.STRING, null))
              .collect(toImmutableList()));
    }
    return new FsAlias(name, type, readTypeParameters(declaration));
  }

  private FsVariable readVariable(SyntaxNode statement) {
    ImmutableList<SyntaxNode> declarations = statement.getDeclarations();
    if (declarations.size() > 1) {
      logger.fine(
          () -> "Only the first of " + declarations.size() + " bindings is kept: "
              + statement.getText());
    }
    SyntaxNode declaration = declarations.get(0);
    SyntaxNode type = declaration.getType();
    return new FsVariable(
        statement.hasModifier(SyntaxKind.DECLARE_KEYWORD),
        declaration.getName().getText(),
        type == null ? FsTypes.OBJ : readTypeNode(type));
  }

  private FsModule readModule(SyntaxNode declaration) {
    List<FsType> types = new ArrayList<>();
    for (SyntaxNode child : declaration.getChildren()) {
      switch (child.getKind()) {
        case MODULE_BLOCK:
          child.getStatements().forEach(s -> types.add(readStatement(s)));
          break;
        case MODULE_DECLARATION:
          types.add(readModule(child));
          break;
        case DECLARE_KEYWORD:
        case EXPORT_KEYWORD:
        case IDENTIFIER:
        case STRING_LITERAL:
          break;
        default:
          report(child, "module child", child.getKind());
      }
    }
    return new FsModule(
        removeQuotes(declaration.getName().getText()), ImmutableList.copyOf(types));
  }

  // Members

  FsType readMember(SyntaxNode member) {
    String name;
    switch (member.getKind()) {
      case INDEX_SIGNATURE:
        return new FsProperty(
            INDEX_EMIT,
            readParameter(member.getParameters().get(0)),
            "Item",
            member.hasQuestionToken(),
            false,
            readOptionalType(member.getType()));
      case METHOD_SIGNATURE:
      case METHOD_DECLARATION:
        return readFunction(
            member,
            null,
            member.hasModifier(SyntaxKind.STATIC_KEYWORD),
            getPropertyName(member.getName()));
      case PROPERTY_SIGNATURE:
      case PROPERTY_DECLARATION:
        return new FsProperty(
            null,
            null,
            getPropertyName(member.getName()),
            member.hasQuestionToken(),
            member.hasModifier(SyntaxKind.STATIC_KEYWORD),
            readOptionalType(member.getType()));
      case GET_ACCESSOR:
        name = getPropertyName(member.getName());
        return new FsProperty(
            null,
            null,
            name,
            false,
            member.hasModifier(SyntaxKind.STATIC_KEYWORD),
            readOptionalType(member.getType()));
      case SET_ACCESSOR:
        name = getPropertyName(member.getName());
        ImmutableList<SyntaxNode> params = member.getParameters();
        return new FsProperty(
            null,
            null,
            name,
            false,
            member.hasModifier(SyntaxKind.STATIC_KEYWORD),
            params.isEmpty() ? FsNone.INSTANCE : readOptionalType(params.get(0).getType()));
      case CALL_SIGNATURE:
        return new FsFunction(
            INVOKE_EMIT,
            false,
            "Invoke",
            ImmutableList.of(),
            readParameters(member),
            readReturnType(member));
      case CONSTRUCT_SIGNATURE:
      case CONSTRUCTOR:
        return new FsFunction(
            CREATE_EMIT,
            true,
            "Create",
            readTypeParameters(member),
            readParameters(member),
            FsThis.INSTANCE);
      default:
        return unsupported("member", member);
    }
  }

  private FsFunction readFunction(
      SyntaxNode declaration, @Nullable String emit, boolean isStatic, @Nullable String name) {
    return new FsFunction(
        emit,
        isStatic,
        name,
        readTypeParameters(declaration),
        readParameters(declaration),
        readReturnType(declaration));
  }

  private ImmutableList<FsParam> readParameters(SyntaxNode declaration) {
    return declaration.getParameters().stream()
        .map(this::readParameter)
        .collect(toImmutableList());
  }

  FsParam readParameter(SyntaxNode parameter) {
    SyntaxNode type = parameter.getType();
    return new FsParam(
        parameter.getName().getText(),
        parameter.hasQuestionToken(),
        parameter.hasDotDotDotToken(),
        type == null ? FsTypes.OBJ : readTypeNode(type));
  }

  private FsType readReturnType(SyntaxNode declaration) {
    SyntaxNode type = declaration.getType();
    return type == null ? FsTypes.UNIT : readTypeNode(type);
  }

  private FsType readOptionalType(@Nullable SyntaxNode type) {
    return type == null ? FsNone.INSTANCE : readTypeNode(type);
  }

  // Types

  private ImmutableList<FsType> readTypes(List<SyntaxNode> types) {
    return types.stream().map(this::readTypeNode).collect(toImmutableList());
  }

  FsType readTypeNode(SyntaxNode type) {
    switch (type.getKind()) {
      case STRING_KEYWORD:
        return FsTypes.STRING;
      case NUMBER_KEYWORD:
        return FsTypes.FLOAT;
      case BOOLEAN_KEYWORD:
        return FsTypes.BOOL;
      case ANY_KEYWORD:
        return FsTypes.OBJ;
      case VOID_KEYWORD:
        return FsTypes.UNIT;
      case SYMBOL_KEYWORD:
        return FsTypes.mapped("Symbol");
      case FUNCTION_TYPE:
        return readFunction(type, null, type.hasModifier(SyntaxKind.STATIC_KEYWORD), null);
      case TYPE_REFERENCE:
        return readTypeReference(type);
      case ARRAY_TYPE:
        return new FsArray(readTypeNode(type.getElementType()));
      case UNION_TYPE:
        return readUnion(type);
      case TUPLE_TYPE:
        return new FsTuple(readTypes(type.getTypes()));
      case THIS_TYPE:
        return FsThis.INSTANCE;
      case TYPE_PREDICATE:
        return FsTypes.BOOL;
      case TYPE_LITERAL:
      case INTERSECTION_TYPE:
      case INDEXED_ACCESS_TYPE:
      case TYPE_QUERY:
      case PARENTHESIZED_TYPE:
      case MAPPED_TYPE:
        return FsTypes.OBJ;
      case LITERAL_TYPE:
        SyntaxNode literal = type.getLiteral();
        if (literal.getKind() == SyntaxKind.STRING_LITERAL) {
          return new FsStringLiteral(removeQuotes(literal.getText()));
        }
        return FsTypes.OBJ;
      case EXPRESSION_WITH_TYPE_ARGUMENTS:
        return FsTypes.mapped(readExpressionText(type.getExpression()));
      default:
        return unsupported("type node", type);
    }
  }

  /** Splits {@code null} and {@code undefined} alternatives off into the option flag. */
  private FsUnion readUnion(SyntaxNode union) {
    boolean option = false;
    ImmutableList.Builder<FsType> types = ImmutableList.builder();
    for (SyntaxNode alternative : union.getTypes()) {
      if (alternative.getKind() == SyntaxKind.NULL_KEYWORD
          || alternative.getKind() == SyntaxKind.UNDEFINED_KEYWORD) {
        option = true;
      } else {
        types.add(readTypeNode(alternative));
      }
    }
    return new FsUnion(option, types.build());
  }

  private FsType readTypeReference(SyntaxNode reference) {
    if (reference.getTypeArguments().isEmpty()) {
      String text = reference.getText();
      int dot = text.indexOf('.');
      return FsTypes.mapped(dot < 0 ? text : text.substring(0, dot));
    }
    SyntaxNode typeName = reference.getName();
    if (typeName == null) {
      throw new TranslationException(
          TranslationError.make(
              sourceName,
              reference.getLineno(),
              reference.getCharno(),
              NULL_TYPE_NAME,
              reference.getText()));
    }
    return FsTypes.generic(
        FsTypes.mapped(typeName.getText()), readTypes(reference.getTypeArguments()));
  }

  private String readExpressionText(SyntaxNode expression) {
    switch (expression.getKind()) {
      case IDENTIFIER:
      case PROPERTY_ACCESS_EXPRESSION:
        return expression.getText();
      default:
        report(expression, "expression", expression.getKind());
        return expression.getText();
    }
  }

  // Names

  private static String getPropertyName(SyntaxNode name) {
    switch (name.getKind()) {
      case STRING_LITERAL:
        return removeQuotes(name.getText());
      default:
        return name.getText().replace("\"", "");
    }
  }

  static String removeQuotes(String s) {
    return s.replace("\"", "").replace("'", "");
  }

  private FsTodo unsupported(String category, SyntaxNode node) {
    report(node, category, node.getKind());
    return FsTodo.INSTANCE;
  }

  private void report(SyntaxNode node, String category, SyntaxKind kind) {
    TranslationError error =
        TranslationError.make(
            sourceName,
            node.getLineno(),
            node.getCharno(),
            UNSUPPORTED_TYPE,
            category,
            kind.name());
    errorManager.report(error.defaultLevel(), error);
  }
}
