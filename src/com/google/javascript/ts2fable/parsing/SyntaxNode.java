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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * A node of a declaration syntax tree.
 *
 * <p>Only the slots meaningful for a node's {@link SyntaxKind} are filled in; every other list
 * accessor returns an empty list and every other node accessor returns null. For example an
 * {@code INTERFACE_DECLARATION} has a name, type parameters, heritage clauses and members, while
 * a {@code UNION_TYPE} only has types.
 *
 * <p>The tree is built once by {@link DeclarationParser} and is not modified afterwards.
 */
public final class SyntaxNode {

  private final SyntaxKind kind;
  private final String source;
  private final int start;
  private int end;
  private final int lineno;
  private final int charno;

  private ImmutableList<SyntaxNode> modifiers = ImmutableList.of();
  private @Nullable SyntaxNode name;
  private ImmutableList<SyntaxNode> typeParameters = ImmutableList.of();
  private ImmutableList<SyntaxNode> heritageClauses = ImmutableList.of();
  private ImmutableList<SyntaxNode> parameters = ImmutableList.of();
  private ImmutableList<SyntaxNode> typeArguments = ImmutableList.of();
  private @Nullable SyntaxNode expression;
  private @Nullable SyntaxNode literal;
  private @Nullable SyntaxNode elementType;
  private ImmutableList<SyntaxNode> types = ImmutableList.of();
  private @Nullable SyntaxNode type;
  private @Nullable SyntaxNode initializer;
  private ImmutableList<SyntaxNode> declarations = ImmutableList.of();
  private ImmutableList<SyntaxNode> members = ImmutableList.of();
  private ImmutableList<SyntaxNode> statements = ImmutableList.of();
  private @Nullable SyntaxNode body;
  private boolean questionToken;
  private boolean dotDotDotToken;

  SyntaxNode(SyntaxKind kind, String source, int start, int lineno, int charno) {
    this.kind = checkNotNull(kind);
    this.source = source;
    this.start = start;
    this.end = start;
    this.lineno = lineno;
    this.charno = charno;
  }

  public SyntaxKind getKind() {
    return kind;
  }

  /** Returns the source text this node was parsed from. */
  public String getText() {
    return source.substring(start, end).trim();
  }

  /** One-based line of the first character of this node. */
  public int getLineno() {
    return lineno;
  }

  /** Zero-based column of the first character of this node. */
  public int getCharno() {
    return charno;
  }

  public ImmutableList<SyntaxNode> getModifiers() {
    return modifiers;
  }

  public boolean hasModifier(SyntaxKind modifier) {
    checkState(modifier.isModifier(), modifier);
    for (SyntaxNode m : modifiers) {
      if (m.getKind() == modifier) {
        return true;
      }
    }
    return false;
  }

  /** The declared name: an identifier, string or numeric literal, or computed property name. */
  public @Nullable SyntaxNode getName() {
    return name;
  }

  public ImmutableList<SyntaxNode> getTypeParameters() {
    return typeParameters;
  }

  public ImmutableList<SyntaxNode> getHeritageClauses() {
    return heritageClauses;
  }

  public ImmutableList<SyntaxNode> getParameters() {
    return parameters;
  }

  public ImmutableList<SyntaxNode> getTypeArguments() {
    return typeArguments;
  }

  /** The expression of a heritage type, type query, export assignment or computed name. */
  public @Nullable SyntaxNode getExpression() {
    return expression;
  }

  /** The literal of a {@code LITERAL_TYPE}. */
  public @Nullable SyntaxNode getLiteral() {
    return literal;
  }

  /** The element type of an {@code ARRAY_TYPE}. */
  public @Nullable SyntaxNode getElementType() {
    return elementType;
  }

  /**
   * The constituent types of a union, intersection or tuple, the inherited types of a heritage
   * clause, or the object and index types of an indexed access.
   */
  public ImmutableList<SyntaxNode> getTypes() {
    return types;
  }

  /** The annotated, aliased, returned or wrapped type. */
  public @Nullable SyntaxNode getType() {
    return type;
  }

  public @Nullable SyntaxNode getInitializer() {
    return initializer;
  }

  public ImmutableList<SyntaxNode> getDeclarations() {
    return declarations;
  }

  /** Members of an interface, class, type literal, or enum. */
  public ImmutableList<SyntaxNode> getMembers() {
    return members;
  }

  /** Statements of a source file or module block. */
  public ImmutableList<SyntaxNode> getStatements() {
    return statements;
  }

  /** The body of a module declaration: a module block or a nested module declaration. */
  public @Nullable SyntaxNode getBody() {
    return body;
  }

  public boolean hasQuestionToken() {
    return questionToken;
  }

  public boolean hasDotDotDotToken() {
    return dotDotDotToken;
  }

  /** Returns the direct children of this node, in source order. */
  public ImmutableList<SyntaxNode> getChildren() {
    ImmutableList.Builder<SyntaxNode> children = ImmutableList.builder();
    children.addAll(modifiers);
    addIfPresent(children, name);
    children.addAll(typeParameters);
    children.addAll(heritageClauses);
    children.addAll(parameters);
    addIfPresent(children, expression);
    children.addAll(typeArguments);
    addIfPresent(children, literal);
    addIfPresent(children, elementType);
    children.addAll(types);
    addIfPresent(children, type);
    addIfPresent(children, initializer);
    children.addAll(declarations);
    children.addAll(members);
    children.addAll(statements);
    addIfPresent(children, body);
    return children.build();
  }

  public void forEachChild(Consumer<SyntaxNode> callback) {
    getChildren().forEach(callback);
  }

  private static void addIfPresent(
      ImmutableList.Builder<SyntaxNode> builder, @Nullable SyntaxNode node) {
    if (node != null) {
      builder.add(node);
    }
  }

  @Override
  public String toString() {
    return kind + " " + getText();
  }

  // Setters used while parsing.

  void setEnd(int end) {
    this.end = end;
  }

  void setModifiers(List<SyntaxNode> modifiers) {
    this.modifiers = ImmutableList.copyOf(modifiers);
  }

  void setName(@Nullable SyntaxNode name) {
    this.name = name;
  }

  void setTypeParameters(List<SyntaxNode> typeParameters) {
    this.typeParameters = ImmutableList.copyOf(typeParameters);
  }

  void setHeritageClauses(List<SyntaxNode> heritageClauses) {
    this.heritageClauses = ImmutableList.copyOf(heritageClauses);
  }

  void setParameters(List<SyntaxNode> parameters) {
    this.parameters = ImmutableList.copyOf(parameters);
  }

  void setTypeArguments(List<SyntaxNode> typeArguments) {
    this.typeArguments = ImmutableList.copyOf(typeArguments);
  }

  void setExpression(@Nullable SyntaxNode expression) {
    this.expression = expression;
  }

  void setLiteral(@Nullable SyntaxNode literal) {
    this.literal = literal;
  }

  void setElementType(@Nullable SyntaxNode elementType) {
    this.elementType = elementType;
  }

  void setTypes(List<SyntaxNode> types) {
    this.types = ImmutableList.copyOf(types);
  }

  void setType(@Nullable SyntaxNode type) {
    this.type = type;
  }

  void setInitializer(@Nullable SyntaxNode initializer) {
    this.initializer = initializer;
  }

  void setDeclarations(List<SyntaxNode> declarations) {
    this.declarations = ImmutableList.copyOf(declarations);
  }

  void setMembers(List<SyntaxNode> members) {
    this.members = ImmutableList.copyOf(members);
  }

  void setStatements(List<SyntaxNode> statements) {
    this.statements = ImmutableList.copyOf(statements);
  }

  void setBody(@Nullable SyntaxNode body) {
    this.body = body;
  }

  void setQuestionToken(boolean questionToken) {
    this.questionToken = questionToken;
  }

  void setDotDotDotToken(boolean dotDotDotToken) {
    this.dotDotDotToken = dotDotDotToken;
  }
}
