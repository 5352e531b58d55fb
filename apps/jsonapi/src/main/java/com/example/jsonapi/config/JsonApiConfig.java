package com.example.jsonapi.config;

import com.example.jsonapi.authz.HeaderRoleResolver;
import com.example.jsonapi.authz.ResourceAuthorizer;
import com.example.jsonapi.authz.RoleResolver;
import com.example.jsonapi.config.properties.JsonApiProperties;
import com.example.jsonapi.dispatch.JsonApiDispatcher;
import com.example.jsonapi.document.DocumentSerializer;
import com.example.jsonapi.document.ErrorLogger;
import com.example.jsonapi.document.JacksonDocumentSerializer;
import com.example.jsonapi.exception.ErrorNormalizer;
import com.example.jsonapi.lifecycle.ContentNegotiator;
import com.example.jsonapi.lifecycle.PayloadReader;
import com.example.jsonapi.lifecycle.RequestLifecycle;
import com.example.jsonapi.lifecycle.SanityChecker;
import com.example.jsonapi.lifecycle.TransactionHook;
import com.example.jsonapi.observability.LoggingErrorLogger;
import com.example.jsonapi.registry.ResourceConfig;
import com.example.jsonapi.resource.ResourceDefinition;
import com.example.jsonapi.resource.ResourceRegistrar;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wiring of the JSON:API layer. Role resolution, transactions and error logging can be
 * replaced by declaring a bean of the respective type.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(JsonApiProperties.class)
public class JsonApiConfig {

    @Bean
    public ResourceConfig resourceConfig() {
        return new ResourceConfig();
    }

    @Bean
    public ResourceAuthorizer resourceAuthorizer(ResourceConfig resourceConfig) {
        return new ResourceAuthorizer(resourceConfig);
    }

    @Bean
    public SanityChecker sanityChecker() {
        return new SanityChecker();
    }

    @Bean
    public PayloadReader payloadReader(ObjectMapper objectMapper) {
        return new PayloadReader(objectMapper);
    }

    @Bean
    public ContentNegotiator contentNegotiator() {
        return new ContentNegotiator();
    }

    @Bean
    public ErrorNormalizer errorNormalizer() {
        return new ErrorNormalizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentSerializer documentSerializer(ObjectMapper objectMapper) {
        return new JacksonDocumentSerializer(objectMapper);
    }

    @Bean
    public ResourceRegistrar resourceRegistrar(
            ResourceConfig resourceConfig,
            ResourceAuthorizer resourceAuthorizer,
            SanityChecker sanityChecker) {
        return new ResourceRegistrar(resourceConfig, resourceAuthorizer, sanityChecker);
    }

    @Bean
    public RequestLifecycle requestLifecycle(
            ContentNegotiator contentNegotiator,
            DocumentSerializer documentSerializer,
            ErrorNormalizer errorNormalizer,
            ObjectProvider<ErrorLogger> errorLogger,
            JsonApiProperties properties) {
        ErrorLogger logger = null;
        if (properties.errorLogging().enabled()) {
            logger = errorLogger.getIfAvailable(
                    () -> new LoggingErrorLogger(properties.errorLogging().includeClientErrors()));
        }
        return new RequestLifecycle(contentNegotiator, documentSerializer, errorNormalizer, logger);
    }

    @Bean
    public JsonApiDispatcher jsonApiDispatcher(
            ResourceRegistrar resourceRegistrar,
            RequestLifecycle requestLifecycle,
            ObjectProvider<RoleResolver> roleResolver,
            PayloadReader payloadReader,
            ObjectProvider<TransactionHook> transactionHook,
            JsonApiProperties properties) {
        RoleResolver resolver = roleResolver.getIfAvailable(() -> defaultRoleResolver(properties));
        return new JsonApiDispatcher(resourceRegistrar, requestLifecycle, resolver, payloadReader,
                transactionHook.getIfAvailable(() -> TransactionHook.NONE));
    }

    @Bean
    public ResourceTableLoader resourceTableLoader(ResourceConfig resourceConfig) {
        return new ResourceTableLoader(resourceConfig);
    }

    @Bean
    public JsonApiInitializer jsonApiInitializer(
            JsonApiProperties properties,
            ResourceTableLoader resourceTableLoader,
            ResourceRegistrar resourceRegistrar,
            ObjectProvider<ResourceDefinition<?>> definitions) {
        return new JsonApiInitializer(properties, resourceTableLoader, resourceRegistrar,
                definitions.orderedStream().toList());
    }

    private static RoleResolver defaultRoleResolver(JsonApiProperties properties) {
        if (properties.roleHeader().isBlank()) {
            log.info("Role header disabled; all callers resolve to the anonymous role");
            return RoleResolver.ANONYMOUS;
        }
        return new HeaderRoleResolver(properties.roleHeader());
    }
}
