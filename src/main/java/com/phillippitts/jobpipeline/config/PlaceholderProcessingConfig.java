package com.phillippitts.jobpipeline.config;

import com.phillippitts.jobpipeline.service.processing.ProcessingFunction;
import com.phillippitts.jobpipeline.service.processing.placeholder.PlaceholderCalculateFunction;
import com.phillippitts.jobpipeline.service.processing.placeholder.PlaceholderDocumentFunction;
import com.phillippitts.jobpipeline.service.processing.placeholder.PlaceholderValidateFunction;
import com.phillippitts.jobpipeline.service.processing.placeholder.PlaceholderVoiceFunction;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Canned processing functions used until real AI integrations are deployed.
 *
 * <p>Each placeholder backs off when a bean with the same name is defined elsewhere, so a
 * real integration replaces it by registering e.g. {@code voiceProcessingFunction}.
 */
@Configuration
public class PlaceholderProcessingConfig {

    @Bean
    @ConditionalOnMissingBean(name = "voiceProcessingFunction")
    public ProcessingFunction<?, ?> voiceProcessingFunction() {
        return new PlaceholderVoiceFunction();
    }

    @Bean
    @ConditionalOnMissingBean(name = "documentProcessingFunction")
    public ProcessingFunction<?, ?> documentProcessingFunction() {
        return new PlaceholderDocumentFunction();
    }

    @Bean
    @ConditionalOnMissingBean(name = "validateProcessingFunction")
    public ProcessingFunction<?, ?> validateProcessingFunction() {
        return new PlaceholderValidateFunction();
    }

    @Bean
    @ConditionalOnMissingBean(name = "calculateProcessingFunction")
    public ProcessingFunction<?, ?> calculateProcessingFunction() {
        return new PlaceholderCalculateFunction();
    }
}
