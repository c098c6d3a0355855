package com.bhagwad.playground.dto;

public record ExampleProgram(String name, String sourceCode) {
}
