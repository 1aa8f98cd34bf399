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

package com.google.javascript.ts2fable.parsing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.javascript.ts2fable.parsing.DeclarationScanner.Token;
import com.google.javascript.ts2fable.parsing.DeclarationScanner.TokenType;
import java.util.ArrayList;
import java.util.List;

/**
 * A recursive descent parser for TypeScript declaration files.
 *
 * <p>Only the declaration subset of the language is understood. Function and method bodies,
 * initializers and mapped types are skipped over and kept only as source text.
 *
 * @see DeclarationScanner
 */
public final class DeclarationParser {

  private static final ImmutableSet<String> STATEMENT_MODIFIERS =
      ImmutableSet.of("export", "declare", "default", "abstract", "async");

  private static final ImmutableSet<String> MEMBER_MODIFIERS =
      ImmutableSet.of(
          "public",
          "private",
          "protected",
          "static",
          "readonly",
          "abstract",
          "declare",
          "async",
          "override");

  private static final ImmutableSet<String> PARAMETER_MODIFIERS =
      ImmutableSet.of("public", "private", "protected", "readonly", "override");

  private static final ImmutableSet<String> DECLARATION_KEYWORDS =
      ImmutableSet.of(
          "class",
          "interface",
          "function",
          "abstract",
          "enum",
          "namespace",
          "module",
          "declare",
          "const",
          "var",
          "let",
          "async");

  private final String sourceName;
  private final String source;
  private final ImmutableList<Token> tokens;
  private int index = 0;

  private DeclarationParser(String sourceName, String source) {
    this.sourceName = sourceName;
    this.source = source;
    this.tokens = new DeclarationScanner(sourceName, source).scan();
  }

  /**
   * Parses a declaration file.
   *
   * @param sourceName the file name used in error messages
   * @param source the declaration source text
   * @return a {@code SOURCE_FILE} node holding the top-level statements
   * @throws DeclarationSyntaxException if the source is not a valid declaration file
   */
  public static SyntaxNode parse(String sourceName, String source) {
    return new DeclarationParser(sourceName, source).parseSourceFile();
  }

  private SyntaxNode parseSourceFile() {
    SyntaxNode file = new SyntaxNode(SyntaxKind.SOURCE_FILE, source, 0, 1, 0);
    file.setStatements(parseStatements(false));
    file.setEnd(source.length());
    return file;
  }

  private List<SyntaxNode> parseStatements(boolean inBlock) {
    List<SyntaxNode> statements = new ArrayList<>();
    while (!atEof() && !(inBlock && at("}"))) {
      if (match(";")) {
        continue;
      }
      statements.add(parseStatement());
    }
    return statements;
  }

  // Statements

  private SyntaxNode parseStatement() {
    Token first = peek();
    if (first.is("import")) {
      return parseImport(first, new ArrayList<>());
    }
    if (first.is("export")) {
      Token after = peek(1);
      if (after.is("=")) {
        return parseExportAssignment(first);
      }
      if (after.is("{") || after.is("*") || (after.is("type") && peek(2).is("{"))) {
        return parseExportDeclaration(first);
      }
      if (after.is("as") && peek(2).is("namespace")) {
        return parseNamespaceExport(first);
      }
      if (after.is("default") && !DECLARATION_KEYWORDS.contains(peek(2).text())
          && !peek(2).is("interface")) {
        return parseExportAssignment(first);
      }
      if (after.is("import")) {
        List<SyntaxNode> modifiers = new ArrayList<>();
        modifiers.add(parseModifier());
        return parseImport(first, modifiers);
      }
    }

    List<SyntaxNode> modifiers = new ArrayList<>();
    while (isStatementModifier()) {
      modifiers.add(parseModifier());
    }

    Token keyword = peek();
    switch (keyword.text()) {
      case "interface":
        return parseInterface(first, modifiers);
      case "class":
        return parseClass(first, modifiers);
      case "enum":
        return parseEnum(first, modifiers);
      case "var":
      case "let":
      case "const":
        return parseVariableStatement(first, modifiers);
      case "function":
        return parseFunctionDeclaration(first, modifiers);
      case "namespace":
      case "module":
        return parseModuleDeclaration(first, modifiers);
      case "type":
        if (peek(1).type() == TokenType.IDENTIFIER) {
          return parseTypeAlias(first, modifiers);
        }
        break;
      case "global":
        if (peek(1).is("{")) {
          return parseGlobalModule(first, modifiers);
        }
        break;
      default:
        break;
    }
    throw error("unexpected '" + keyword.text() + "' where a declaration was expected");
  }

  private boolean isStatementModifier() {
    Token t = peek();
    Token following = peek(1);
    if (t.type() != TokenType.IDENTIFIER || following.type() != TokenType.IDENTIFIER) {
      return false;
    }
    if (t.is("const")) {
      return following.is("enum");
    }
    return STATEMENT_MODIFIERS.contains(t.text());
  }

  private SyntaxNode parseModifier() {
    Token t = next();
    SyntaxKind kind = SyntaxKind.forModifier(t.text());
    if (kind == null) {
      throw error(t, "'" + t.text() + "' is not a modifier");
    }
    return finish(newNode(kind, t));
  }

  private SyntaxNode parseInterface(Token first, List<SyntaxNode> modifiers) {
    SyntaxNode node = newNode(SyntaxKind.INTERFACE_DECLARATION, first);
    node.setModifiers(modifiers);
    expect("interface");
    node.setName(parseIdentifier());
    node.setTypeParameters(parseTypeParametersOpt());
    node.setHeritageClauses(parseHeritageClauses());
    node.setMembers(parseObjectMembers(false));
    return finish(node);
  }

  private SyntaxNode parseClass(Token first, List<SyntaxNode> modifiers) {
    SyntaxNode node = newNode(SyntaxKind.CLASS_DECLARATION, first);
    node.setModifiers(modifiers);
    expect("class");
    if (peek().type() == TokenType.IDENTIFIER && !at("extends") && !at("implements")) {
      node.setName(parseIdentifier());
    }
    node.setTypeParameters(parseTypeParametersOpt());
    node.setHeritageClauses(parseHeritageClauses());
    node.setMembers(parseObjectMembers(true));
    return finish(node);
  }

  private List<SyntaxNode> parseHeritageClauses() {
    List<SyntaxNode> clauses = new ArrayList<>();
    while (at("extends") || at("implements")) {
      SyntaxNode clause = newNode(SyntaxKind.HERITAGE_CLAUSE, next());
      List<SyntaxNode> types = new ArrayList<>();
      do {
        types.add(parseExpressionWithTypeArguments());
      } while (match(","));
      clause.setTypes(types);
      clauses.add(finish(clause));
    }
    return clauses;
  }

  private SyntaxNode parseExpressionWithTypeArguments() {
    SyntaxNode node = newNode(SyntaxKind.EXPRESSION_WITH_TYPE_ARGUMENTS, peek());
    node.setExpression(parseEntityNameExpression());
    if (at("<")) {
      node.setTypeArguments(parseTypeArguments());
    }
    return finish(node);
  }

  private SyntaxNode parseEnum(Token first, List<SyntaxNode> modifiers) {
    SyntaxNode node = newNode(SyntaxKind.ENUM_DECLARATION, first);
    node.setModifiers(modifiers);
    expect("enum");
    node.setName(parseIdentifier());
    expect("{");
    List<SyntaxNode> members = new ArrayList<>();
    while (!at("}")) {
      SyntaxNode member = newNode(SyntaxKind.ENUM_MEMBER, peek());
      member.setName(parsePropertyName());
      if (match("=")) {
        member.setInitializer(parseInitializer());
      }
      members.add(finish(member));
      if (!match(",")) {
        break;
      }
    }
    expect("}");
    node.setMembers(members);
    return finish(node);
  }

  private SyntaxNode parseTypeAlias(Token first, List<SyntaxNode> modifiers) {
    SyntaxNode node = newNode(SyntaxKind.TYPE_ALIAS_DECLARATION, first);
    node.setModifiers(modifiers);
    expect("type");
    node.setName(parseIdentifier());
    node.setTypeParameters(parseTypeParametersOpt());
    expect("=");
    node.setType(parseType());
    match(";");
    return finish(node);
  }

  private SyntaxNode parseVariableStatement(Token first, List<SyntaxNode> modifiers) {
    SyntaxNode node = newNode(SyntaxKind.VARIABLE_STATEMENT, first);
    node.setModifiers(modifiers);
    next(); // var, let or const
    List<SyntaxNode> declarations = new ArrayList<>();
    do {
      SyntaxNode declaration = newNode(SyntaxKind.VARIABLE_DECLARATION, peek());
      declaration.setName(parseBindingName());
      match("!");
      if (match(":")) {
        declaration.setType(parseType());
      }
      if (match("=")) {
        declaration.setInitializer(parseInitializer());
      }
      declarations.add(finish(declaration));
    } while (match(","));
    node.setDeclarations(declarations);
    match(";");
    return finish(node);
  }

  private SyntaxNode parseFunctionDeclaration(Token first, List<SyntaxNode> modifiers) {
    SyntaxNode node = newNode(SyntaxKind.FUNCTION_DECLARATION, first);
    node.setModifiers(modifiers);
    expect("function");
    if (peek().type() == TokenType.IDENTIFIER) {
      node.setName(parseIdentifier());
    }
    node.setTypeParameters(parseTypeParametersOpt());
    node.setParameters(parseParameters());
    if (match(":")) {
      node.setType(parseType());
    }
    if (at("{")) {
      skipBalanced("{", "}");
    }
    match(";");
    return finish(node);
  }

  private SyntaxNode parseModuleDeclaration(Token first, List<SyntaxNode> modifiers) {
    SyntaxNode node = newNode(SyntaxKind.MODULE_DECLARATION, first);
    node.setModifiers(modifiers);
    next(); // namespace or module
    if (peek().type() == TokenType.STRING) {
      node.setName(parseStringLiteral());
    } else {
      node.setName(parseIdentifier());
    }
    parseModuleBody(node);
    return finish(node);
  }

  /** Parses what follows a module name: a nested dotted name, a block, or nothing. */
  private void parseModuleBody(SyntaxNode module) {
    if (match(".")) {
      SyntaxNode nested = newNode(SyntaxKind.MODULE_DECLARATION, peek());
      nested.setName(parseIdentifier());
      parseModuleBody(nested);
      module.setBody(finish(nested));
    } else if (at("{")) {
      SyntaxNode block = newNode(SyntaxKind.MODULE_BLOCK, next());
      block.setStatements(parseStatements(true));
      expect("}");
      module.setBody(finish(block));
    } else {
      match(";");
    }
  }

  private SyntaxNode parseGlobalModule(Token first, List<SyntaxNode> modifiers) {
    SyntaxNode node = newNode(SyntaxKind.MODULE_DECLARATION, first);
    node.setModifiers(modifiers);
    node.setName(parseIdentifier());
    parseModuleBody(node);
    return finish(node);
  }

  private SyntaxNode parseImport(Token first, List<SyntaxNode> modifiers) {
    expect("import");
    boolean isTypeOnly = at("type") && peek(1).type() == TokenType.IDENTIFIER;
    int nameOffset = isTypeOnly ? 1 : 0;
    if (peek(nameOffset).type() == TokenType.IDENTIFIER && peek(nameOffset + 1).is("=")) {
      SyntaxNode node = newNode(SyntaxKind.IMPORT_EQUALS_DECLARATION, first);
      node.setModifiers(modifiers);
      if (isTypeOnly) {
        next();
      }
      node.setName(parseIdentifier());
      expect("=");
      if (at("require") && peek(1).is("(")) {
        next();
        expect("(");
        node.setExpression(parseStringLiteral());
        expect(")");
      } else {
        node.setExpression(parseEntityNameExpression());
      }
      match(";");
      return finish(node);
    }
    SyntaxNode node = newNode(SyntaxKind.IMPORT_DECLARATION, first);
    node.setModifiers(modifiers);
    // Everything up to and including the module specifier.
    while (!atEof() && !at(";")) {
      if (next().type() == TokenType.STRING) {
        break;
      }
    }
    match(";");
    return finish(node);
  }

  private SyntaxNode parseExportAssignment(Token first) {
    SyntaxNode node = newNode(SyntaxKind.EXPORT_ASSIGNMENT, first);
    expect("export");
    if (!match("=")) {
      expect("default");
    }
    node.setExpression(parseInitializer());
    match(";");
    return finish(node);
  }

  private SyntaxNode parseExportDeclaration(Token first) {
    SyntaxNode node = newNode(SyntaxKind.EXPORT_DECLARATION, first);
    expect("export");
    match("type");
    if (match("*")) {
      if (match("as")) {
        parseIdentifier();
      }
    } else {
      skipBalanced("{", "}");
    }
    if (match("from")) {
      parseStringLiteral();
    }
    match(";");
    return finish(node);
  }

  private SyntaxNode parseNamespaceExport(Token first) {
    SyntaxNode node = newNode(SyntaxKind.NAMESPACE_EXPORT_DECLARATION, first);
    expect("export");
    expect("as");
    expect("namespace");
    node.setName(parseIdentifier());
    match(";");
    return finish(node);
  }

  // Members

  private List<SyntaxNode> parseObjectMembers(boolean inClass) {
    expect("{");
    List<SyntaxNode> members = new ArrayList<>();
    while (!at("}")) {
      if (atEof()) {
        throw error("'}' expected");
      }
      if (match(";") || match(",")) {
        continue;
      }
      members.add(parseMember(inClass));
    }
    expect("}");
    return members;
  }

  private SyntaxNode parseMember(boolean inClass) {
    Token first = peek();
    List<SyntaxNode> modifiers = new ArrayList<>();
    while (MEMBER_MODIFIERS.contains(peek().text())
        && peek().type() == TokenType.IDENTIFIER
        && isPropertyNameStart(peek(1))) {
      modifiers.add(parseModifier());
    }

    SyntaxNode member;
    Token t = peek();
    if (t.is("[") && peek(1).type() == TokenType.IDENTIFIER && peek(2).is(":")) {
      member = newNode(SyntaxKind.INDEX_SIGNATURE, first);
      expect("[");
      member.setParameters(ImmutableList.of(parseParameter()));
      expect("]");
      member.setQuestionToken(match("?"));
      if (match(":")) {
        member.setType(parseType());
      }
    } else if (t.is("(") || t.is("<")) {
      member = newNode(SyntaxKind.CALL_SIGNATURE, first);
      parseSignature(member);
    } else if (t.is("new") && (peek(1).is("(") || peek(1).is("<"))) {
      member = newNode(SyntaxKind.CONSTRUCT_SIGNATURE, first);
      next();
      parseSignature(member);
    } else if (inClass && t.is("constructor") && peek(1).is("(")) {
      member = newNode(SyntaxKind.CONSTRUCTOR, first);
      next();
      parseSignature(member);
    } else if ((t.is("get") || t.is("set")) && isPropertyNameStart(peek(1))) {
      member =
          newNode(t.is("get") ? SyntaxKind.GET_ACCESSOR : SyntaxKind.SET_ACCESSOR, first);
      next();
      member.setName(parsePropertyName());
      parseSignature(member);
    } else {
      SyntaxNode name = parsePropertyName();
      boolean question = match("?");
      match("!");
      if (at("(") || at("<")) {
        member =
            newNode(inClass ? SyntaxKind.METHOD_DECLARATION : SyntaxKind.METHOD_SIGNATURE, first);
        member.setName(name);
        member.setQuestionToken(question);
        parseSignature(member);
      } else {
        member =
            newNode(
                inClass ? SyntaxKind.PROPERTY_DECLARATION : SyntaxKind.PROPERTY_SIGNATURE, first);
        member.setName(name);
        member.setQuestionToken(question);
        if (match(":")) {
          member.setType(parseType());
        }
        if (match("=")) {
          member.setInitializer(parseInitializer());
        }
      }
    }
    member.setModifiers(modifiers);
    if (inClass && at("{")) {
      skipBalanced("{", "}");
    }
    finish(member);
    if (!match(";")) {
      match(",");
    }
    return member;
  }

  /** Parses type parameters, parameters and return type into {@code node}. */
  private void parseSignature(SyntaxNode node) {
    node.setTypeParameters(parseTypeParametersOpt());
    node.setParameters(parseParameters());
    if (match(":")) {
      node.setType(parseType());
    }
  }

  private static boolean isPropertyNameStart(Token t) {
    return t.type() == TokenType.IDENTIFIER
        || t.type() == TokenType.STRING
        || t.type() == TokenType.NUMBER
        || t.is("[");
  }

  private SyntaxNode parsePropertyName() {
    Token t = peek();
    switch (t.type()) {
      case IDENTIFIER:
        return parseIdentifier();
      case STRING:
        return parseStringLiteral();
      case NUMBER:
        return finish(newNode(SyntaxKind.NUMERIC_LITERAL, next()));
      default:
        if (t.is("[")) {
          SyntaxNode computed = newNode(SyntaxKind.COMPUTED_PROPERTY_NAME, next());
          computed.setExpression(parseInitializer());
          expect("]");
          return finish(computed);
        }
        throw error("property name expected");
    }
  }

  private List<SyntaxNode> parseParameters() {
    expect("(");
    List<SyntaxNode> parameters = new ArrayList<>();
    while (!at(")")) {
      parameters.add(parseParameter());
      if (!match(",")) {
        break;
      }
    }
    expect(")");
    return parameters;
  }

  private SyntaxNode parseParameter() {
    SyntaxNode node = newNode(SyntaxKind.PARAMETER, peek());
    List<SyntaxNode> modifiers = new ArrayList<>();
    while (PARAMETER_MODIFIERS.contains(peek().text())
        && (peek(1).type() == TokenType.IDENTIFIER || peek(1).is("{") || peek(1).is("["))) {
      modifiers.add(parseModifier());
    }
    node.setModifiers(modifiers);
    node.setDotDotDotToken(match("..."));
    node.setName(parseBindingName());
    node.setQuestionToken(match("?"));
    if (match(":")) {
      node.setType(parseType());
    }
    if (match("=")) {
      node.setInitializer(parseInitializer());
    }
    return finish(node);
  }

  private SyntaxNode parseBindingName() {
    if (at("{")) {
      SyntaxNode pattern = newNode(SyntaxKind.OBJECT_BINDING_PATTERN, peek());
      skipBalanced("{", "}");
      return finish(pattern);
    }
    if (at("[")) {
      SyntaxNode pattern = newNode(SyntaxKind.ARRAY_BINDING_PATTERN, peek());
      skipBalanced("[", "]");
      return finish(pattern);
    }
    return parseIdentifier();
  }

  private List<SyntaxNode> parseTypeParametersOpt() {
    List<SyntaxNode> typeParameters = new ArrayList<>();
    if (!match("<")) {
      return typeParameters;
    }
    do {
      SyntaxNode node = newNode(SyntaxKind.TYPE_PARAMETER, peek());
      while ((at("in") || at("out") || at("const"))
          && peek(1).type() == TokenType.IDENTIFIER) {
        next();
      }
      node.setName(parseIdentifier());
      if (match("extends")) {
        node.setType(parseType());
      }
      if (match("=")) {
        node.setInitializer(parseType());
      }
      typeParameters.add(finish(node));
    } while (match(","));
    expect(">");
    return typeParameters;
  }

  private List<SyntaxNode> parseTypeArguments() {
    expect("<");
    List<SyntaxNode> typeArguments = new ArrayList<>();
    while (!at(">")) {
      typeArguments.add(parseType());
      if (!match(",")) {
        break;
      }
    }
    expect(">");
    return typeArguments;
  }

  // Types

  private SyntaxNode parseType() {
    Token first = peek();
    if (isStartOfFunctionType()) {
      SyntaxNode node = newNode(SyntaxKind.FUNCTION_TYPE, first);
      parseFunctionTypeRest(node);
      return node;
    }
    if (at("new") || (at("abstract") && peek(1).is("new"))) {
      SyntaxNode node = newNode(SyntaxKind.CONSTRUCTOR_TYPE, first);
      match("abstract");
      expect("new");
      parseFunctionTypeRest(node);
      return node;
    }
    SyntaxNode type = parseUnionType();
    if (at("extends") && !peek().newlineBefore()) {
      SyntaxNode conditional = newNode(SyntaxKind.CONDITIONAL_TYPE, first);
      next();
      SyntaxNode extendsType = parseUnionType();
      expect("?");
      SyntaxNode trueType = parseType();
      expect(":");
      SyntaxNode falseType = parseType();
      conditional.setTypes(ImmutableList.of(type, extendsType, trueType, falseType));
      return finish(conditional);
    }
    return type;
  }

  private void parseFunctionTypeRest(SyntaxNode node) {
    node.setTypeParameters(parseTypeParametersOpt());
    node.setParameters(parseParameters());
    expect("=>");
    node.setType(parseType());
    finish(node);
  }

  /** Looks ahead for {@code <} or a parenthesized list followed by {@code =>}. */
  private boolean isStartOfFunctionType() {
    if (at("<")) {
      return true;
    }
    if (!at("(")) {
      return false;
    }
    int depth = 0;
    for (int i = index; i < tokens.size(); i++) {
      Token t = tokens.get(i);
      if (t.type() == TokenType.EOF) {
        return false;
      }
      if (t.is("(")) {
        depth++;
      } else if (t.is(")")) {
        depth--;
        if (depth == 0) {
          return i + 1 < tokens.size() && tokens.get(i + 1).is("=>");
        }
      }
    }
    return false;
  }

  private SyntaxNode parseUnionType() {
    Token first = peek();
    match("|");
    SyntaxNode type = parseIntersectionType();
    if (!at("|")) {
      return type;
    }
    List<SyntaxNode> types = new ArrayList<>();
    types.add(type);
    while (match("|")) {
      types.add(parseIntersectionType());
    }
    SyntaxNode union = newNode(SyntaxKind.UNION_TYPE, first);
    union.setTypes(types);
    return finish(union);
  }

  private SyntaxNode parseIntersectionType() {
    Token first = peek();
    match("&");
    SyntaxNode type = parseTypeOperator();
    if (!at("&")) {
      return type;
    }
    List<SyntaxNode> types = new ArrayList<>();
    types.add(type);
    while (match("&")) {
      types.add(parseTypeOperator());
    }
    SyntaxNode intersection = newNode(SyntaxKind.INTERSECTION_TYPE, first);
    intersection.setTypes(types);
    return finish(intersection);
  }

  private SyntaxNode parseTypeOperator() {
    Token t = peek();
    if ((t.is("keyof") || t.is("unique") || t.is("readonly")) && isTypeStart(peek(1))) {
      SyntaxNode node = newNode(SyntaxKind.TYPE_OPERATOR, next());
      node.setType(parseTypeOperator());
      return finish(node);
    }
    if (t.is("infer") && peek(1).type() == TokenType.IDENTIFIER) {
      SyntaxNode node = newNode(SyntaxKind.INFER_TYPE, next());
      node.setName(parseIdentifier());
      return finish(node);
    }
    return parsePostfixType();
  }

  private static boolean isTypeStart(Token t) {
    return t.type() == TokenType.IDENTIFIER
        || t.type() == TokenType.STRING
        || t.type() == TokenType.NUMBER
        || t.is("(")
        || t.is("[")
        || t.is("{");
  }

  private SyntaxNode parsePostfixType() {
    Token first = peek();
    SyntaxNode type = parsePrimaryType();
    while (at("[") && !peek().newlineBefore()) {
      if (peek(1).is("]")) {
        next();
        next();
        SyntaxNode array = newNode(SyntaxKind.ARRAY_TYPE, first);
        array.setElementType(type);
        type = finish(array);
      } else {
        next();
        SyntaxNode indexType = parseType();
        expect("]");
        SyntaxNode access = newNode(SyntaxKind.INDEXED_ACCESS_TYPE, first);
        access.setTypes(ImmutableList.of(type, indexType));
        type = finish(access);
      }
    }
    return type;
  }

  private SyntaxNode parsePrimaryType() {
    Token t = peek();
    switch (t.type()) {
      case STRING:
        {
          SyntaxNode node = newNode(SyntaxKind.LITERAL_TYPE, t);
          node.setLiteral(parseStringLiteral());
          return finish(node);
        }
      case NUMBER:
        {
          SyntaxNode node = newNode(SyntaxKind.LITERAL_TYPE, t);
          node.setLiteral(finish(newNode(SyntaxKind.NUMERIC_LITERAL, next())));
          return finish(node);
        }
      case TEMPLATE:
        return finish(newNode(SyntaxKind.TEMPLATE_LITERAL_TYPE, next()));
      case IDENTIFIER:
        return parseNamedType();
      default:
        break;
    }
    if (t.is("(")) {
      SyntaxNode node = newNode(SyntaxKind.PARENTHESIZED_TYPE, next());
      node.setType(parseType());
      expect(")");
      return finish(node);
    }
    if (t.is("{")) {
      if (isMappedTypeStart()) {
        SyntaxNode node = newNode(SyntaxKind.MAPPED_TYPE, t);
        skipBalanced("{", "}");
        return finish(node);
      }
      SyntaxNode node = newNode(SyntaxKind.TYPE_LITERAL, t);
      node.setMembers(parseObjectMembers(false));
      return finish(node);
    }
    if (t.is("[")) {
      return parseTupleType();
    }
    if (t.is("-") && peek(1).type() == TokenType.NUMBER) {
      SyntaxNode node = newNode(SyntaxKind.LITERAL_TYPE, t);
      SyntaxNode negative = newNode(SyntaxKind.PREFIX_UNARY_EXPRESSION, next());
      negative.setExpression(finish(newNode(SyntaxKind.NUMERIC_LITERAL, next())));
      node.setLiteral(finish(negative));
      return finish(node);
    }
    throw error("type expected but found '" + t.text() + "'");
  }

  private SyntaxNode parseNamedType() {
    Token t = peek();
    Token following = peek(1);
    boolean sameLine = !following.newlineBefore();
    switch (t.text()) {
      case "this":
        if (following.is("is") && sameLine) {
          return parseTypePredicate();
        }
        return finish(newNode(SyntaxKind.THIS_TYPE, next()));
      case "typeof":
        {
          SyntaxNode node = newNode(SyntaxKind.TYPE_QUERY, next());
          node.setExpression(
              at("import") ? parseImportType() : parseEntityNameExpression());
          return finish(node);
        }
      case "true":
        {
          SyntaxNode node = newNode(SyntaxKind.LITERAL_TYPE, t);
          node.setLiteral(finish(newNode(SyntaxKind.TRUE_KEYWORD, next())));
          return finish(node);
        }
      case "false":
        {
          SyntaxNode node = newNode(SyntaxKind.LITERAL_TYPE, t);
          node.setLiteral(finish(newNode(SyntaxKind.FALSE_KEYWORD, next())));
          return finish(node);
        }
      case "import":
        if (following.is("(")) {
          return parseImportType();
        }
        break;
      case "asserts":
        if (following.type() == TokenType.IDENTIFIER && sameLine) {
          return parseTypePredicate();
        }
        break;
      default:
        break;
    }
    if (following.is("is") && sameLine) {
      return parseTypePredicate();
    }
    SyntaxKind keyword = SyntaxKind.forKeywordType(t.text());
    if (keyword != null && !following.is(".")) {
      return finish(newNode(keyword, next()));
    }
    SyntaxNode reference = newNode(SyntaxKind.TYPE_REFERENCE, t);
    reference.setName(parseEntityName());
    if (at("<") && !peek().newlineBefore()) {
      reference.setTypeArguments(parseTypeArguments());
    }
    return finish(reference);
  }

  private SyntaxNode parseTypePredicate() {
    SyntaxNode node = newNode(SyntaxKind.TYPE_PREDICATE, peek());
    match("asserts");
    node.setName(parseIdentifier());
    if (match("is")) {
      node.setType(parseType());
    }
    return finish(node);
  }

  private SyntaxNode parseImportType() {
    SyntaxNode node = newNode(SyntaxKind.IMPORT_TYPE, peek());
    expect("import");
    expect("(");
    node.setLiteral(parseStringLiteral());
    expect(")");
    while (match(".")) {
      parseIdentifier();
    }
    if (at("<")) {
      node.setTypeArguments(parseTypeArguments());
    }
    return finish(node);
  }

  private SyntaxNode parseTupleType() {
    SyntaxNode node = newNode(SyntaxKind.TUPLE_TYPE, peek());
    expect("[");
    List<SyntaxNode> elements = new ArrayList<>();
    while (!at("]")) {
      match("...");
      if (peek().type() == TokenType.IDENTIFIER
          && (peek(1).is(":") || (peek(1).is("?") && peek(2).is(":")))) {
        // Named tuple member; only the type is kept.
        next();
        match("?");
        expect(":");
      }
      elements.add(parseType());
      match("?");
      if (!match(",")) {
        break;
      }
    }
    expect("]");
    node.setTypes(elements);
    return finish(node);
  }

  private boolean isMappedTypeStart() {
    int offset = 1;
    if (peek(offset).is("+") || peek(offset).is("-")) {
      offset++;
    }
    if (peek(offset).is("readonly")) {
      offset++;
    }
    return peek(offset).is("[")
        && peek(offset + 1).type() == TokenType.IDENTIFIER
        && peek(offset + 2).is("in");
  }

  // Names and expressions

  private SyntaxNode parseIdentifier() {
    Token t = peek();
    if (t.type() != TokenType.IDENTIFIER) {
      throw error("identifier expected but found '" + t.text() + "'");
    }
    return finish(newNode(SyntaxKind.IDENTIFIER, next()));
  }

  private SyntaxNode parseStringLiteral() {
    Token t = peek();
    if (t.type() != TokenType.STRING) {
      throw error("string literal expected but found '" + t.text() + "'");
    }
    return finish(newNode(SyntaxKind.STRING_LITERAL, next()));
  }

  /** Parses {@code A.B.C} into nested {@code QUALIFIED_NAME} nodes. */
  private SyntaxNode parseEntityName() {
    Token first = peek();
    SyntaxNode name = parseIdentifier();
    while (at(".")) {
      next();
      SyntaxNode qualified = newNode(SyntaxKind.QUALIFIED_NAME, first);
      qualified.setExpression(name);
      qualified.setName(parseIdentifier());
      name = finish(qualified);
    }
    return name;
  }

  /** Parses {@code A.B.C} into nested {@code PROPERTY_ACCESS_EXPRESSION} nodes. */
  private SyntaxNode parseEntityNameExpression() {
    Token first = peek();
    SyntaxNode expression = parseIdentifier();
    while (at(".")) {
      next();
      SyntaxNode access = newNode(SyntaxKind.PROPERTY_ACCESS_EXPRESSION, first);
      access.setExpression(expression);
      access.setName(parseIdentifier());
      expression = finish(access);
    }
    return expression;
  }

  /**
   * Skips over an initializer expression and classifies it. Literals and dotted names keep their
   * own kinds; a leading unary operator gives a {@code PREFIX_UNARY_EXPRESSION}; anything else is
   * a {@code BINARY_EXPRESSION} covering the skipped text.
   */
  private SyntaxNode parseInitializer() {
    Token first = peek();
    if ((first.type() == TokenType.NUMBER || first.type() == TokenType.STRING)
        && isInitializerEnd(peek(1))) {
      return finish(
          newNode(
              first.type() == TokenType.NUMBER
                  ? SyntaxKind.NUMERIC_LITERAL
                  : SyntaxKind.STRING_LITERAL,
              next()));
    }
    boolean prefix = first.is("-") || first.is("+") || first.is("~") || first.is("!");
    boolean dottedName = first.type() == TokenType.IDENTIFIER;
    int depth = 0;
    int count = 0;
    while (!atEof()) {
      Token t = peek();
      if (depth == 0 && count > 0 && (isInitializerEnd(t) || startsNewLine(t))) {
        break;
      }
      if (t.is("(") || t.is("[") || t.is("{")) {
        depth++;
      } else if (t.is(")") || t.is("]") || t.is("}")) {
        if (depth == 0) {
          break;
        }
        depth--;
      }
      if (!(t.type() == TokenType.IDENTIFIER || t.is("."))) {
        dottedName = false;
      }
      next();
      count++;
    }
    if (count == 0) {
      throw error("expression expected");
    }
    SyntaxKind kind;
    if (prefix) {
      kind = SyntaxKind.PREFIX_UNARY_EXPRESSION;
    } else if (dottedName) {
      kind = count == 1 ? SyntaxKind.IDENTIFIER : SyntaxKind.PROPERTY_ACCESS_EXPRESSION;
    } else {
      kind = SyntaxKind.BINARY_EXPRESSION;
    }
    return finish(newNode(kind, first));
  }

  private static boolean isInitializerEnd(Token t) {
    return t.type() == TokenType.EOF
        || t.is(",")
        || t.is(";")
        || t.is("}")
        || t.is(")")
        || t.is("]");
  }

  private boolean startsNewLine(Token t) {
    if (!t.newlineBefore() || t.type() != TokenType.IDENTIFIER) {
      return false;
    }
    Token previous = tokens.get(index - 1);
    return previous.type() != TokenType.PUNCTUATOR
        || previous.is(")")
        || previous.is("]")
        || previous.is("}");
  }

  // Token helpers

  private Token peek() {
    return tokens.get(index);
  }

  private Token peek(int offset) {
    return tokens.get(Math.min(index + offset, tokens.size() - 1));
  }

  private Token next() {
    Token t = tokens.get(index);
    if (t.type() != TokenType.EOF) {
      index++;
    }
    return t;
  }

  private boolean atEof() {
    return peek().type() == TokenType.EOF;
  }

  private boolean at(String text) {
    return peek().is(text);
  }

  private boolean match(String text) {
    if (at(text)) {
      next();
      return true;
    }
    return false;
  }

  private void expect(String text) {
    if (!match(text)) {
      throw error("'" + text + "' expected but found '" + describe(peek()) + "'");
    }
  }

  private void skipBalanced(String open, String close) {
    expect(open);
    int depth = 1;
    while (depth > 0) {
      if (atEof()) {
        throw error("'" + close + "' expected");
      }
      Token t = next();
      if (t.is(open)) {
        depth++;
      } else if (t.is(close)) {
        depth--;
      }
    }
  }

  private SyntaxNode newNode(SyntaxKind kind, Token start) {
    return new SyntaxNode(kind, source, start.start(), start.lineno(), start.charno());
  }

  private SyntaxNode finish(SyntaxNode node) {
    if (index > 0) {
      node.setEnd(Math.max(tokens.get(index - 1).end(), 0));
    }
    return node;
  }

  private static String describe(Token t) {
    return t.type() == TokenType.EOF ? "end of file" : t.text();
  }

  private DeclarationSyntaxException error(String message) {
    return error(peek(), message);
  }

  private DeclarationSyntaxException error(Token at, String message) {
    return new DeclarationSyntaxException(message, sourceName, at.lineno(), at.charno());
  }
}
