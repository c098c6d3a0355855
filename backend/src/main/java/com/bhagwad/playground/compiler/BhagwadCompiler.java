package com.bhagwad.playground.compiler;

import com.bhagwad.playground.compiler.ast.Program;
import com.bhagwad.playground.compiler.generator.PythonGenerator;
import com.bhagwad.playground.compiler.lexer.Lexer;
import com.bhagwad.playground.compiler.lexer.Token;
import com.bhagwad.playground.compiler.parser.Parser;
import com.bhagwad.playground.exception.CompilationException;
import com.bhagwad.playground.exception.LexException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class BhagwadCompiler {

    private static final Logger logger = LoggerFactory.getLogger(BhagwadCompiler.class);

    private final Lexer lexer = new Lexer();
    private final PythonGenerator generator = new PythonGenerator();

    public List<Token> tokenize(String source) throws LexException {
        List<Token> tokens = lexer.tokenize(source);
        logger.debug("Lexed {} characters into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    public Program parse(List<Token> tokens) throws CompilationException {
        Program program = new Parser().parse(tokens);
        logger.debug("Parsed {} top-level declarations", program.declarations().size());
        return program;
    }

    public String generate(Program program) {
        String python = generator.generate(program);
        logger.debug("Generated {} characters of Python", python.length());
        return python;
    }

    /**
     * Source text to Python source text. Fails with the first error any stage detects.
     */
    public String compile(String source) throws CompilationException {
        return generate(parse(tokenize(source)));
    }
}
