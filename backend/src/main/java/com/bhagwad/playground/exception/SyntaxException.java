package com.bhagwad.playground.exception;

import com.bhagwad.playground.compiler.lexer.Token;
import com.bhagwad.playground.compiler.lexer.TokenKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A token that cannot extend any production in the current parser state.
 */
public class SyntaxException extends CompilationException {

    private final Set<TokenKind> expectedKinds;
    private final Token foundToken;

    public SyntaxException(Set<TokenKind> expectedKinds, Token foundToken, String context) {
        super(buildMessage(expectedKinds, foundToken, context), foundToken.line(), foundToken.column());
        this.expectedKinds = expectedKinds.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(expectedKinds));
        this.foundToken = foundToken;
    }

    public Set<TokenKind> getExpectedKinds() {
        return expectedKinds;
    }

    public Token getFoundToken() {
        return foundToken;
    }

    private static String buildMessage(Set<TokenKind> expected, Token found, String context) {
        if (expected.isEmpty()) {
            return "unexpected " + found.describe() + (context == null ? "" : ": " + context);
        }
        String expectation = expected.stream()
                .map(TokenKind::display)
                .collect(Collectors.joining(", "));
        StringBuilder sb = new StringBuilder("expected ");
        sb.append(expected.size() == 1 ? expectation : "one of " + expectation);
        if (context != null && !context.isEmpty()) {
            sb.append(' ').append(context);
        }
        sb.append(" but found ").append(found.describe());
        return sb.toString();
    }
}
