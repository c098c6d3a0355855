package com.bhagwad.playground.config;

import com.bhagwad.playground.compiler.BhagwadCompiler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CompilerConfiguration {

    @Bean
    public BhagwadCompiler bhagwadCompiler() {
        return new BhagwadCompiler();
    }
}
