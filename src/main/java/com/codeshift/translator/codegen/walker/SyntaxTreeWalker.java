package com.codeshift.translator.codegen.walker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeshift.translator.codegen.emitter.IndentedScope;
import com.codeshift.translator.codegen.emitter.ScopedEmitter;
import com.codeshift.translator.codegen.exception.MalformedTreeException;
import com.codeshift.translator.codegen.mapper.TypeMapper;
import com.codeshift.translator.model.AccessorDeclaration;
import com.codeshift.translator.model.Block;
import com.codeshift.translator.model.CatchClause;
import com.codeshift.translator.model.ClassDeclaration;
import com.codeshift.translator.model.CompilationUnit;
import com.codeshift.translator.model.ExpressionStatement;
import com.codeshift.translator.model.FieldDeclaration;
import com.codeshift.translator.model.MethodDeclaration;
import com.codeshift.translator.model.NamespaceDeclaration;
import com.codeshift.translator.model.NodeKind;
import com.codeshift.translator.model.Parameter;
import com.codeshift.translator.model.PropertyDeclaration;
import com.codeshift.translator.model.ReturnStatement;
import com.codeshift.translator.model.SyntaxNode;
import com.codeshift.translator.model.TryStatement;
import com.codeshift.translator.model.VariableDeclaration;
import com.codeshift.translator.model.VariableDeclarator;

/**
 * Depth-first walker that turns a syntax tree into output lines.
 *
 * Dispatch goes through a handler table keyed by {@link NodeKind}. Parameters, accessors and
 * catch clauses have no handler of their own: their owning declaration emits them.
 *
 * All output state lives in the {@link ScopedEmitter}; every bracket scope is opened in
 * try-with-resources so braces and depth stay paired when a nested visit fails.
 *
 * Return and expression statements are copied verbatim. Sub-expressions are not translated.
 */
public class SyntaxTreeWalker {
    private static final Logger log = LoggerFactory.getLogger(SyntaxTreeWalker.class);

    private static final String VAR_PREFIX = "var ";

    private final ScopedEmitter emitter;
    private final Map<NodeKind, Consumer<SyntaxNode>> handlers = new EnumMap<>(NodeKind.class);
    private final Map<NodeKind, Integer> visitCounts = new EnumMap<>(NodeKind.class);

    public SyntaxTreeWalker(ScopedEmitter emitter) {
        this.emitter = emitter;

        register(NodeKind.COMPILATION_UNIT, CompilationUnit.class, this::visitCompilationUnit);
        register(NodeKind.NAMESPACE, NamespaceDeclaration.class, this::visitNamespace);
        register(NodeKind.CLASS, ClassDeclaration.class, this::visitClass);
        register(NodeKind.FIELD, FieldDeclaration.class, this::visitField);
        register(NodeKind.PROPERTY, PropertyDeclaration.class, this::visitProperty);
        register(NodeKind.METHOD, MethodDeclaration.class, this::visitMethod);
        register(NodeKind.BLOCK, Block.class, this::visitBlock);
        register(NodeKind.TRY, TryStatement.class, this::visitTry);
        register(NodeKind.RETURN, ReturnStatement.class, this::visitReturn);
        register(NodeKind.EXPRESSION_STATEMENT, ExpressionStatement.class, this::visitExpressionStatement);
        register(NodeKind.VARIABLE_DECLARATION, VariableDeclaration.class, this::visitVariableDeclaration);
    }

    private <T extends SyntaxNode> void register(NodeKind kind, Class<T> type, Consumer<T> handler) {
        handlers.put(kind, node -> handler.accept(type.cast(node)));
    }

    /**
     * Visits {@code node} and everything it owns.
     *
     * @throws MalformedTreeException if the node, or a node below it, lacks a required attribute
     */
    public void visit(SyntaxNode node) {
        if (node == null) {
            throw new MalformedTreeException("Encountered a null node");
        }
        Consumer<SyntaxNode> handler = handlers.get(node.getKind());
        if (handler == null) {
            throw new MalformedTreeException(node.describe()
                    + " cannot be visited on its own; it is emitted by its owning declaration");
        }
        visitCounts.merge(node.getKind(), 1, Integer::sum);
        handler.accept(node);
    }

    /**
     * Number of nodes visited per kind, including nodes visited before a failure.
     */
    public Map<NodeKind, Integer> getVisitCounts() {
        return Collections.unmodifiableMap(visitCounts);
    }

    public int getVisitCount(NodeKind kind) {
        return visitCounts.getOrDefault(kind, 0);
    }

    // ---- declarations ----

    private void visitCompilationUnit(CompilationUnit unit) {
        visitAll(requireList(unit, unit.getMembers(), "members"));
    }

    private void visitNamespace(NamespaceDeclaration namespace) {
        String name = require(namespace, namespace.getName(), "name");
        log.debug("Visiting namespace {}", name);

        emitter.emitFormatted("module %s", name);
        try (IndentedScope scope = emitter.openScope()) {
            visitAll(requireList(namespace, namespace.getMembers(), "members"));
        }
    }

    private void visitClass(ClassDeclaration classDecl) {
        String name = require(classDecl, classDecl.getName(), "name");
        log.debug("Visiting class {}", name);

        emitter.emitFormatted("%s class %s", TypeMapper.mapVisibility(classDecl.getModifiers()), name);
        try (IndentedScope scope = emitter.openScope()) {
            visitAll(requireList(classDecl, classDecl.getMembers(), "members"));
        }
    }

    private void visitField(FieldDeclaration field) {
        String visibility = TypeMapper.mapVisibility(field.getModifiers());
        String mappedType = TypeMapper.mapType(require(field, field.getType(), "type"));

        for (VariableDeclarator variable : requireNonEmpty(field, field.getVariables(), "declarators")) {
            String identifier = require(field, variable.getIdentifier(), "identifier");
            emitter.emitFormatted("%s %s: %s;", visibility, identifier, mappedType);
        }
    }

    private void visitProperty(PropertyDeclaration property) {
        String name = require(property, property.getName(), "name");
        String mappedType = TypeMapper.mapType(require(property, property.getType(), "type"));
        // Accessors inherit the property's visibility, never their own.
        String visibility = TypeMapper.mapVisibility(property.getModifiers());
        log.debug("Visiting property {}", name);

        List<AccessorDeclaration> accessors = requireList(property, property.getAccessors(), "accessors");
        if (property.isAutoProperty()) {
            emitter.emitFormatted("%s %s: %s", visibility, name, mappedType);
            return;
        }

        for (AccessorDeclaration accessor : accessors) {
            if (!accessor.hasBody()) {
                continue;
            }
            require(accessor, accessor.getKeyword(), "keyword");
            if (accessor.isGetter()) {
                emitter.emitFormatted("%s get %s: %s", visibility, name, mappedType);
            } else {
                emitter.emitFormatted("%s set %s(value: %s)", visibility, name, mappedType);
            }
            try (IndentedScope scope = emitter.openScope()) {
                visitStatements(accessor.getBody());
            }
        }
    }

    private void visitMethod(MethodDeclaration method) {
        String name = require(method, method.getName(), "name");
        String returnType = TypeMapper.mapType(require(method, method.getReturnType(), "return type"));
        Block body = require(method, method.getBody(), "body");
        log.debug("Visiting method {}", name);

        String parameters = requireList(method, method.getParameters(), "parameters").stream()
                .map(this::formatParameter)
                .collect(Collectors.joining(", "));

        emitter.emitFormatted("%s %s(%s): %s",
                TypeMapper.mapVisibility(method.getModifiers()), name, parameters, returnType);
        try (IndentedScope scope = emitter.openScope()) {
            visitStatements(body);
        }
    }

    private String formatParameter(Parameter parameter) {
        String name = require(parameter, parameter.getName(), "name");
        return name + ": " + TypeMapper.mapType(require(parameter, parameter.getType(), "type"));
    }

    // ---- statements ----

    /**
     * A nested block is a statement container only; it adds no brackets of its own.
     */
    private void visitBlock(Block block) {
        visitStatements(block);
    }

    private void visitTry(TryStatement tryStatement) {
        Block block = require(tryStatement, tryStatement.getBlock(), "block");

        emitter.emitLine("try");
        try (IndentedScope scope = emitter.openScope()) {
            visitStatements(block);
        }

        for (CatchClause catchClause : requireList(tryStatement, tryStatement.getCatches(), "catches")) {
            Block catchBlock = require(catchClause, catchClause.getBlock(), "block");
            if (catchClause.hasIdentifier()) {
                emitter.emitFormatted("catch (%s)", catchClause.getIdentifier());
            } else {
                emitter.emitLine("catch");
            }
            try (IndentedScope scope = emitter.openScope()) {
                visitStatements(catchBlock);
            }
        }
    }

    private void visitReturn(ReturnStatement statement) {
        emitter.emitLine(require(statement, statement.getText(), "text"));
    }

    private void visitExpressionStatement(ExpressionStatement statement) {
        emitter.emitLine(require(statement, statement.getText(), "text"));
    }

    private void visitVariableDeclaration(VariableDeclaration declaration) {
        List<VariableDeclarator> variables = requireNonEmpty(declaration, declaration.getVariables(), "declarators");
        String typeClause = declaration.getType() == null || declaration.getType().isInferred()
                ? ""
                : ": " + TypeMapper.mapType(declaration.getType());

        // Only the last declarator's initializer is kept, as in a source declarator list.
        VariableDeclarator last = variables.get(variables.size() - 1);
        String initializer = last.hasInitializer() ? " = " + last.getInitializer() : "";

        if (variables.size() == 1) {
            String identifier = require(declaration, last.getIdentifier(), "identifier");
            emitter.emitLine(VAR_PREFIX + identifier + typeClause + initializer + ";");
            return;
        }

        List<String> segments = new ArrayList<>(variables.size());
        for (int i = 0; i < variables.size(); i++) {
            String identifier = require(declaration, variables.get(i).getIdentifier(), "identifier");
            if (i == 0) {
                segments.add(VAR_PREFIX + identifier + ",");
            } else if (i < variables.size() - 1) {
                segments.add(identifier + ",");
            } else {
                segments.add(identifier + typeClause + initializer + ";");
            }
        }
        emitter.emitContinued(segments, VAR_PREFIX.length());
    }

    // ---- helpers ----

    private void visitAll(List<? extends SyntaxNode> nodes) {
        for (SyntaxNode node : nodes) {
            visit(node);
        }
    }

    private void visitStatements(Block block) {
        visitAll(requireList(block, block.getStatements(), "statements"));
    }

    private static <T> T require(SyntaxNode node, T value, String attribute) {
        if (value == null || (value instanceof String s && s.isBlank())) {
            throw MalformedTreeException.missing(node, attribute);
        }
        return value;
    }

    /**
     * A list attribute may be empty but never absent, and holds no null entries.
     */
    private static <T> List<T> requireList(SyntaxNode node, List<T> values, String attribute) {
        if (values == null) {
            throw MalformedTreeException.missing(node, attribute);
        }
        if (values.stream().anyMatch(Objects::isNull)) {
            throw new MalformedTreeException(node.describe() + " has a null entry in its " + attribute);
        }
        return values;
    }

    private static <T> List<T> requireNonEmpty(SyntaxNode node, List<T> values, String attribute) {
        if (values == null || values.isEmpty()) {
            throw MalformedTreeException.missing(node, attribute);
        }
        return values;
    }
}
