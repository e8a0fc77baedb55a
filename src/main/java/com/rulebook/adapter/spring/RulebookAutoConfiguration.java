package com.rulebook.adapter.spring;

import com.rulebook.compiler.CompilationResult;
import com.rulebook.compiler.CompilerSettings;
import com.rulebook.compiler.RulebookCompiler;
import com.rulebook.explain.ExplainSpecGenerator;
import com.rulebook.schema.Rulebook;
import com.rulebook.schema.RulebookLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for the rulebook compiler.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "rulebook", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RulebookProperties.class)
public class RulebookAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RulebookAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CompilerSettings compilerSettings(RulebookProperties properties) {
        return properties.toSettings();
    }

    @Bean
    @ConditionalOnMissingBean
    public RulebookCompiler rulebookCompiler(CompilerSettings settings) {
        log.info("Creating RulebookCompiler (parallelism={}, package={})",
                settings.parallelism(), settings.generatedPackage());
        return new RulebookCompiler(settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExplainSpecGenerator explainSpecGenerator() {
        return new ExplainSpecGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "rulebook", name = "path")
    public Rulebook rulebook(RulebookProperties properties) {
        log.info("Loading rulebook from: {}", properties.getPath());
        return RulebookLoader.load(properties.getPath());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "rulebook", name = "path")
    public CompilationResult compilationResult(RulebookCompiler compiler, Rulebook rulebook) {
        CompilationResult result = compiler.compile(rulebook);
        result.errors().forEach(error -> log.warn("Rulebook field failed: {}", error));
        result.cycles().forEach(cycle -> log.warn("Rulebook dependency cycle: {}", cycle));
        return result;
    }
}
