package com.codeshift.translator.codegen.walker;

import com.codeshift.translator.codegen.emitter.ScopedEmitter;
import com.codeshift.translator.codegen.exception.MalformedTreeException;
import com.codeshift.translator.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the per-kind emission rules of the tree walker.
 */
class SyntaxTreeWalkerTest {

    private ScopedEmitter emitter = new ScopedEmitter(4, "\n");

    private List<String> translate(SyntaxNode node) {
        emitter = new ScopedEmitter(4, "\n");
        new SyntaxTreeWalker(emitter).visit(node);
        return emitter.getLines();
    }

    private static MethodDeclaration method(String name, String returnType, Block body, Parameter... parameters) {
        return MethodDeclaration.builder()
                .name(name)
                .modifier(Modifier.PUBLIC)
                .returnType(TypeReference.of(returnType))
                .parameters(List.of(parameters))
                .body(body)
                .build();
    }

    // ---- end-to-end scenarios ----

    @Test
    void testClassWithPrivateField() {
        ClassDeclaration foo = ClassDeclaration.builder()
                .name("Foo")
                .modifier(Modifier.PUBLIC)
                .member(FieldDeclaration.builder()
                        .modifier(Modifier.PRIVATE)
                        .type(TypeReference.of("int"))
                        .variable(VariableDeclarator.of("x"))
                        .build())
                .build();

        assertThat(translate(foo)).containsExactly(
                "public class Foo",
                "{",
                "    private x: number;",
                "}");
    }

    @Test
    void testMethodWithParametersAndReturn() {
        MethodDeclaration add = method("Add", "int",
                Block.of(ReturnStatement.of("return a + b;")),
                Parameter.of("a", "int"), Parameter.of("b", "int"));

        assertThat(translate(add)).containsExactly(
                "public Add(a: number, b: number): number",
                "{",
                "    return a + b;",
                "}");
    }

    @Test
    void testAutoPropertyIsSingleLine() {
        PropertyDeclaration name = PropertyDeclaration.builder()
                .name("Name")
                .modifier(Modifier.PUBLIC)
                .type(TypeReference.of("string"))
                .accessor(AccessorDeclaration.builder().keyword(AccessorKind.GET).build())
                .accessor(AccessorDeclaration.builder().keyword(AccessorKind.SET).build())
                .build();

        assertThat(translate(name)).containsExactly("public Name: string");
    }

    @Test
    void testPropertyWithGetterBody() {
        PropertyDeclaration name = PropertyDeclaration.builder()
                .name("Name")
                .modifier(Modifier.PUBLIC)
                .type(TypeReference.of("string"))
                .accessor(AccessorDeclaration.builder()
                        .keyword(AccessorKind.GET)
                        .body(Block.of(ReturnStatement.of("return _name;")))
                        .build())
                .build();

        assertThat(translate(name)).containsExactly(
                "public get Name: string",
                "{",
                "    return _name;",
                "}");
    }

    @Test
    void testTryWithNamedCatch() {
        TryStatement tryStatement = TryStatement.builder()
                .block(Block.of(ExpressionStatement.of("DoWork();")))
                .catchClause(CatchClause.builder()
                        .exceptionType(TypeReference.of("Exception"))
                        .identifier("ex")
                        .block(Block.of(ExpressionStatement.of("Log(ex);")))
                        .build())
                .build();

        assertThat(translate(tryStatement)).containsExactly(
                "try",
                "{",
                "    DoWork();",
                "}",
                "catch (ex)",
                "{",
                "    Log(ex);",
                "}");
    }

    @Test
    void testMultiIdentifierDeclarationAlignsContinuationLines() {
        VariableDeclaration declaration = VariableDeclaration.builder()
                .type(TypeReference.of("int"))
                .variable(VariableDeclarator.of("a"))
                .variable(VariableDeclarator.of("b"))
                .variable(VariableDeclarator.of("c", "5"))
                .build();

        assertThat(translate(declaration)).containsExactly(
                "var a,",
                "    b,",
                "    c: number = 5;");
    }

    // ---- declarations ----

    @Test
    void testNamespaceEmitsModule() {
        NamespaceDeclaration namespace = NamespaceDeclaration.builder()
                .name("Acme.Billing")
                .member(ClassDeclaration.builder().name("Invoice").build())
                .build();

        assertThat(translate(namespace)).containsExactly(
                "module Acme.Billing",
                "{",
                "    private class Invoice",
                "    {",
                "    }",
                "}");
    }

    @Test
    void testCompilationUnitEmitsMembersInOrder() {
        CompilationUnit unit = CompilationUnit.builder()
                .member(NamespaceDeclaration.builder().name("A").build())
                .member(NamespaceDeclaration.builder().name("B").build())
                .build();

        assertThat(translate(unit)).containsExactly("module A", "{", "}", "module B", "{", "}");
    }

    @Test
    void testFieldWithSeveralIdentifiersEmitsOneLineEach() {
        FieldDeclaration field = FieldDeclaration.builder()
                .modifier(Modifier.PUBLIC)
                .modifier(Modifier.STATIC)
                .type(TypeReference.of("string"))
                .variable(VariableDeclarator.of("first"))
                .variable(VariableDeclarator.of("second", "\"x\""))
                .build();

        assertThat(translate(field)).containsExactly(
                "public first: string;",
                "public second: string;");
    }

    @Test
    void testProtectedCollapsesToPrivate() {
        FieldDeclaration field = FieldDeclaration.builder()
                .modifier(Modifier.PROTECTED)
                .type(TypeReference.of("int"))
                .variable(VariableDeclarator.of("count"))
                .build();

        assertThat(translate(field)).containsExactly("private count: number;");
    }

    @Test
    void testMethodWithoutParametersAndVoidReturn() {
        MethodDeclaration run = method("Run", "void", Block.of(ExpressionStatement.of("Start();")));

        assertThat(translate(run)).containsExactly(
                "public Run(): void",
                "{",
                "    Start();",
                "}");
    }

    @Test
    void testExceptionParameterTypePassesThrough() {
        MethodDeclaration handle = method("Handle", "bool", Block.of(),
                Parameter.of("error", "InvalidOperationException"));

        assertThat(translate(handle)).containsExactly(
                "public Handle(error: InvalidOperationException): string",
                "{",
                "}");
    }

    @Test
    void testPropertyWithGetterAndSetterBodies() {
        PropertyDeclaration count = PropertyDeclaration.builder()
                .name("Count")
                .modifier(Modifier.PUBLIC)
                .type(TypeReference.of("int"))
                .accessor(AccessorDeclaration.builder()
                        .keyword(AccessorKind.GET)
                        .body(Block.of(ReturnStatement.of("return _count;")))
                        .build())
                .accessor(AccessorDeclaration.builder()
                        .keyword(AccessorKind.SET)
                        .body(Block.of(ExpressionStatement.of("_count = value;")))
                        .build())
                .build();

        assertThat(translate(count)).containsExactly(
                "public get Count: number",
                "{",
                "    return _count;",
                "}",
                "public set Count(value: number)",
                "{",
                "    _count = value;",
                "}");
    }

    @Test
    void testAccessorUsesPropertyVisibility() {
        PropertyDeclaration secret = PropertyDeclaration.builder()
                .name("Secret")
                .type(TypeReference.of("string"))
                .accessor(AccessorDeclaration.builder()
                        .keyword(AccessorKind.GET)
                        .modifier(Modifier.PUBLIC)
                        .body(Block.of(ReturnStatement.of("return _secret;")))
                        .build())
                .accessor(AccessorDeclaration.builder().keyword(AccessorKind.SET).build())
                .build();

        assertThat(translate(secret)).containsExactly(
                "private get Secret: string",
                "{",
                "    return _secret;",
                "}");
    }

    @Test
    void testNestedClassIndentation() {
        ClassDeclaration outer = ClassDeclaration.builder()
                .name("Outer")
                .modifier(Modifier.PUBLIC)
                .member(ClassDeclaration.builder()
                        .name("Inner")
                        .member(method("Ping", "string", Block.of(ReturnStatement.of("return \"pong\";"))))
                        .build())
                .build();

        assertThat(translate(outer)).containsExactly(
                "public class Outer",
                "{",
                "    private class Inner",
                "    {",
                "        public Ping(): string",
                "        {",
                "            return \"pong\";",
                "        }",
                "    }",
                "}");
    }

    // ---- statements ----

    @Test
    void testNestedBlockIsFlattened() {
        MethodDeclaration run = method("Run", "void", Block.of(
                ExpressionStatement.of("A();"),
                Block.of(ExpressionStatement.of("B();"), Block.of(ExpressionStatement.of("C();"))),
                ExpressionStatement.of("D();")));

        assertThat(translate(run)).containsExactly(
                "public Run(): void",
                "{",
                "    A();",
                "    B();",
                "    C();",
                "    D();",
                "}");
    }

    @Test
    void testCatchWithoutIdentifierAndMultipleClauses() {
        TryStatement tryStatement = TryStatement.builder()
                .block(Block.of(ExpressionStatement.of("Open();")))
                .catchClause(CatchClause.builder()
                        .exceptionType(TypeReference.of("IOException"))
                        .block(Block.of(ExpressionStatement.of("Retry();")))
                        .build())
                .catchClause(CatchClause.builder()
                        .identifier("e")
                        .block(Block.of())
                        .build())
                .build();

        assertThat(translate(tryStatement)).containsExactly(
                "try",
                "{",
                "    Open();",
                "}",
                "catch",
                "{",
                "    Retry();",
                "}",
                "catch (e)",
                "{",
                "}");
    }

    @Test
    void testTryNestedInsideCatch() {
        TryStatement inner = TryStatement.builder()
                .block(Block.of(ExpressionStatement.of("Rollback();")))
                .catchClause(CatchClause.builder().block(Block.of()).build())
                .build();
        TryStatement outer = TryStatement.builder()
                .block(Block.of())
                .catchClause(CatchClause.builder().identifier("ex").block(Block.of(inner)).build())
                .build();

        assertThat(translate(outer)).containsExactly(
                "try",
                "{",
                "}",
                "catch (ex)",
                "{",
                "    try",
                "    {",
                "        Rollback();",
                "    }",
                "    catch",
                "    {",
                "    }",
                "}");
    }

    @Test
    void testStatementsAreCopiedVerbatim() {
        Block body = Block.of(
                ExpressionStatement.of("Console.WriteLine($\"{a} {b}\");"),
                ReturnStatement.of("return a?.Length ?? 0;"));

        assertThat(translate(method("Len", "int", body))).contains(
                "    Console.WriteLine($\"{a} {b}\");",
                "    return a?.Length ?? 0;");
    }

    @Test
    void testInferredLocalOmitsTypeClause() {
        VariableDeclaration declaration = VariableDeclaration.builder()
                .type(TypeReference.inferred())
                .variable(VariableDeclarator.of("total", "a + b"))
                .build();

        assertThat(translate(declaration)).containsExactly("var total = a + b;");
    }

    @Test
    void testTypedLocalWithoutInitializer() {
        VariableDeclaration declaration = VariableDeclaration.builder()
                .type(TypeReference.of("string"))
                .variable(VariableDeclarator.of("label"))
                .build();

        assertThat(translate(declaration)).containsExactly("var label: string;");
    }

    @Test
    void testMultiIdentifierDeclarationInsideMethodKeepsOnlyLastInitializer() {
        VariableDeclaration declaration = VariableDeclaration.builder()
                .type(TypeReference.inferred())
                .variable(VariableDeclarator.of("x", "1"))
                .variable(VariableDeclarator.of("y", "2"))
                .build();

        assertThat(translate(method("Init", "void", Block.of(declaration)))).containsExactly(
                "public Init(): void",
                "{",
                "    var x,",
                "        y = 2;",
                "}");
    }

    // ---- malformed input ----

    @Test
    void testMethodWithoutBodyFailsAndLeavesScopesBalanced() {
        ClassDeclaration foo = ClassDeclaration.builder()
                .name("Foo")
                .member(MethodDeclaration.builder()
                        .line(7)
                        .name("Broken")
                        .returnType(TypeReference.of("void"))
                        .build())
                .build();

        assertThatThrownBy(() -> translate(foo))
                .isInstanceOf(MalformedTreeException.class)
                .hasMessage("METHOD 'Broken' (line 7) is missing its body");

        assertThat(emitter.getDepth()).isZero();
        assertThat(emitter.getLines()).containsExactly("private class Foo", "{", "}");
    }

    @Test
    void testFailureDeepInsideBodyClosesEveryOpenScope() {
        ClassDeclaration foo = ClassDeclaration.builder()
                .name("Foo")
                .member(method("Run", "void", Block.of(
                        ExpressionStatement.of("Ok();"),
                        ReturnStatement.builder().build())))
                .build();

        assertThatThrownBy(() -> translate(foo))
                .isInstanceOf(MalformedTreeException.class)
                .hasMessageContaining("RETURN")
                .hasMessageContaining("text");

        assertThat(emitter.getDepth()).isZero();
        assertThat(emitter.getLines()).containsExactly(
                "private class Foo",
                "{",
                "    public Run(): void",
                "    {",
                "        Ok();",
                "    }",
                "}");
    }

    @Test
    void testOwnedKindsCannotBeVisitedDirectly() {
        assertThatThrownBy(() -> translate(Parameter.of("a", "int")))
                .isInstanceOf(MalformedTreeException.class)
                .hasMessageContaining("PARAMETER 'a'");
        assertThatThrownBy(() -> translate(AccessorDeclaration.builder().keyword(AccessorKind.GET).build()))
                .isInstanceOf(MalformedTreeException.class);
    }

    @Test
    void testNullNodeFails() {
        assertThatThrownBy(() -> translate(null)).isInstanceOf(MalformedTreeException.class);
    }

    @Test
    void testFieldWithoutDeclaratorsFails() {
        FieldDeclaration field = FieldDeclaration.builder().type(TypeReference.of("int")).build();

        assertThatThrownBy(() -> translate(field))
                .isInstanceOf(MalformedTreeException.class)
                .hasMessage("FIELD is missing its declarators");
    }

    @Test
    void testAbsentListAttributeFails() {
        MethodDeclaration method = method("Run", "void", Block.of());
        method.setParameters(null);

        assertThatThrownBy(() -> translate(method))
                .isInstanceOf(MalformedTreeException.class)
                .hasMessage("METHOD 'Run' is missing its parameters");

        Block body = Block.of();
        body.setStatements(null);
        assertThatThrownBy(() -> translate(method("Run", "void", body)))
                .isInstanceOf(MalformedTreeException.class)
                .hasMessage("BLOCK is missing its statements");
        assertThat(emitter.getDepth()).isZero();

        TryStatement tryStatement = TryStatement.builder().block(Block.of()).build();
        tryStatement.setCatches(null);
        assertThatThrownBy(() -> translate(tryStatement))
                .isInstanceOf(MalformedTreeException.class)
                .hasMessage("TRY is missing its catches");
    }

    @Test
    void testNullListEntryFails() {
        PropertyDeclaration property = PropertyDeclaration.builder()
                .name("Name")
                .type(TypeReference.of("string"))
                .build();
        property.setAccessors(new ArrayList<>(Arrays.asList((AccessorDeclaration) null)));

        assertThatThrownBy(() -> translate(property))
                .isInstanceOf(MalformedTreeException.class)
                .hasMessage("PROPERTY 'Name' has a null entry in its accessors");
    }

    @Test
    void testUnlistedModifiersCollapseToPrivate() {
        FieldDeclaration field = FieldDeclaration.builder()
                .modifier(Modifier.fromKeyword("volatile"))
                .modifier(Modifier.fromKeyword("scoped"))
                .type(TypeReference.of("int"))
                .variable(VariableDeclarator.of("x"))
                .build();

        assertThat(translate(field)).containsExactly("private x: number;");
    }

    // ---- run behaviour ----

    @Test
    void testRepeatedRunsWithFreshEmittersAreIdentical() {
        ClassDeclaration foo = ClassDeclaration.builder()
                .name("Foo")
                .modifier(Modifier.PUBLIC)
                .member(method("Add", "int", Block.of(ReturnStatement.of("return 1;")), Parameter.of("a", "int")))
                .build();

        List<String> first = translate(foo);
        List<String> second = translate(foo);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void testVisitCounts() {
        ScopedEmitter fresh = new ScopedEmitter();
        SyntaxTreeWalker walker = new SyntaxTreeWalker(fresh);
        walker.visit(ClassDeclaration.builder()
                .name("Foo")
                .member(method("A", "void", Block.of(ReturnStatement.of("return;"))))
                .member(method("B", "void", Block.of()))
                .build());

        assertThat(walker.getVisitCount(NodeKind.CLASS)).isEqualTo(1);
        assertThat(walker.getVisitCount(NodeKind.METHOD)).isEqualTo(2);
        assertThat(walker.getVisitCount(NodeKind.RETURN)).isEqualTo(1);
        assertThat(walker.getVisitCount(NodeKind.FIELD)).isZero();
    }
}
