package com.bhagwad.playground.compiler.parser;

import com.bhagwad.playground.compiler.lexer.Lexer;
import com.bhagwad.playground.exception.CompilationException;
import com.bhagwad.playground.exception.SemanticErrorKind;
import com.bhagwad.playground.exception.SemanticException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SemanticAnalyzerTest {

    private static void check(String source) throws CompilationException {
        new Parser().parse(new Lexer().tokenize(source));
    }

    private static SemanticException reject(String source) {
        return assertThrows(SemanticException.class, () -> check(source));
    }

    private static void assertKind(SemanticErrorKind expected, String source) {
        assertEquals(expected, reject(source).getKind());
    }

    @Test
    public void constantReassignmentIsRejectedAtTheAssignment() {
        SemanticException e = reject("arjuna {\n  sankalpa sattva N = 1\n  N = 2\n}");
        assertEquals(SemanticErrorKind.CONSTANT_REASSIGNMENT, e.getKind());
        assertEquals(3, e.getLine());
        assertEquals(3, e.getColumn());
    }

    @Test
    public void elementOfConstantArrayMayChange() throws Exception {
        check("arjuna { sankalpa N = [1, 2]\n N[0] = 5 }");
    }

    @Test
    public void variablesMayBeReassigned() throws Exception {
        check("arjuna { maya x = 1\n x = 2 }");
    }

    @Test
    public void assigningToFunctionIsRejected() {
        assertKind(SemanticErrorKind.INVALID_ASSIGNMENT, "shloka f() { }\narjuna { f = 1 }");
        assertKind(SemanticErrorKind.INVALID_ASSIGNMENT, "yuga N { shloka f() { } }\narjuna { N = 1 }");
        assertKind(SemanticErrorKind.INVALID_ASSIGNMENT, "yuga N { shloka f() { } }\narjuna { N.f = 1 }");
    }

    @Test
    public void assigningToLengthIsRejected() {
        assertKind(SemanticErrorKind.INVALID_ASSIGNMENT, "arjuna { maya a = [1]\n a.length = 3 }");
    }

    @Test
    public void duplicateFunctions() {
        assertKind(SemanticErrorKind.DUPLICATE_FUNCTION, "shloka f() { }\nshloka f() { }\narjuna { }");
        assertKind(SemanticErrorKind.DUPLICATE_FUNCTION, "yuga N { shloka f() { }\nshloka f() { } }\narjuna { }");
        assertKind(SemanticErrorKind.DUPLICATE_FUNCTION, "shloka f() { }\nyuga N { shloka f() { } }\narjuna { }");
    }

    @Test
    public void namespaceCollidingWithFunction() {
        assertKind(SemanticErrorKind.DUPLICATE_DECLARATION, "shloka N() { }\nyuga N { }\narjuna { }");
        assertKind(SemanticErrorKind.DUPLICATE_DECLARATION, "yuga N { }\nshloka N() { }\narjuna { }");
    }

    @Test
    public void duplicateParameter() {
        SemanticException e = reject("shloka f(sattva a, rajas a) { }\narjuna { }");
        assertEquals(SemanticErrorKind.DUPLICATE_PARAMETER, e.getKind());
        assertEquals(20, e.getColumn());
    }

    @Test
    public void duplicateDeclarationInOneBlock() {
        assertKind(SemanticErrorKind.DUPLICATE_DECLARATION, "arjuna { maya x = 1\n maya x = 2 }");
    }

    @Test
    public void innerBlockMayShadow() throws Exception {
        check("arjuna { maya x = 1\n dharma (true) { maya x = \"inner\" } }");
        check("shloka f(sattva x) { maya x = 2 }\narjuna { }");
        check("shloka f() { }\narjuna { maya f = 1\n manifest f }");
    }

    @Test
    public void unresolvedIdentifier() {
        SemanticException e = reject("arjuna {\n  manifest missing\n}");
        assertEquals(SemanticErrorKind.UNRESOLVED_IDENTIFIER, e.getKind());
        assertEquals(2, e.getLine());
        assertEquals(12, e.getColumn());
    }

    @Test
    public void variableIsNotVisibleBeforeItsDeclaration() {
        assertKind(SemanticErrorKind.UNRESOLVED_IDENTIFIER, "arjuna { manifest x\n maya x = 1 }");
        assertKind(SemanticErrorKind.UNRESOLVED_IDENTIFIER, "arjuna { maya x = x }");
    }

    @Test
    public void blockScopedVariablesEndWithTheBlock() {
        assertKind(SemanticErrorKind.UNRESOLVED_IDENTIFIER, "arjuna { dharma (true) { maya y = 1 }\n manifest y }");
        assertKind(SemanticErrorKind.UNRESOLVED_IDENTIFIER, "arjuna { karma i from 1 to 3 { }\n manifest i }");
        assertKind(SemanticErrorKind.UNRESOLVED_IDENTIFIER,
                "arjuna { meditation { } disturbance (err) { }\n manifest err }");
    }

    @Test
    public void functionsAreHoisted() throws Exception {
        check("arjuna { manifest later(2) }\nshloka later(sattva n) -> sattva { moksha n }");
        check("shloka fact(sattva n) -> sattva { dharma (n < 2) { moksha 1 }\n moksha n * fact(n - 1) }\narjuna { }");
    }

    @Test
    public void namespaceMembersAreVisibleQualifiedAndFlat() throws Exception {
        check("yuga M { shloka sq(sattva x) -> sattva { moksha x * x } }\narjuna { manifest M.sq(2) + sq(3) }");
    }

    @Test
    public void unknownNamespaceMember() {
        assertKind(SemanticErrorKind.UNRESOLVED_IDENTIFIER,
                "yuga M { shloka sq(sattva x) -> sattva { moksha x * x } }\narjuna { manifest M.cube(2) }");
    }

    @Test
    public void functionLocalsAreNotVisibleElsewhere() {
        assertKind(SemanticErrorKind.UNRESOLVED_IDENTIFIER, "shloka f(sattva p) { }\narjuna { manifest p }");
    }

    @Test
    public void returnValueRules() {
        assertKind(SemanticErrorKind.UNEXPECTED_RETURN_VALUE, "shloka f() { moksha 1 }\narjuna { }");
        assertKind(SemanticErrorKind.UNEXPECTED_RETURN_VALUE, "arjuna { moksha 1 }");
        assertKind(SemanticErrorKind.MISSING_RETURN_VALUE, "shloka f() -> sattva { moksha }\narjuna { }");
    }

    @Test
    public void bareReturnIsAllowedWithoutReturnType() throws Exception {
        check("shloka f() { moksha }\narjuna { moksha }");
    }

    @Test
    public void loopAndCatchBindingsAreUsable() throws Exception {
        check("arjuna { karma i from 1 to 3 { manifest i }\n karma x in [1] { manifest x }\n"
                + "meditation { } disturbance (err) { manifest err } }");
    }

    @Test
    public void firstErrorInSourceOrderWins() {
        SemanticException e = reject("arjuna {\n manifest a\n manifest b\n}");
        assertEquals(2, e.getLine());
    }
}
