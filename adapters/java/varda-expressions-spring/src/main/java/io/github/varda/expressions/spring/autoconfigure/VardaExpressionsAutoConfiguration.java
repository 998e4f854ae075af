package io.github.varda.expressions.spring.autoconfigure;

import io.github.varda.expressions.core.api.ExpressionParser;
import io.github.varda.expressions.core.config.ExpressionPolicy;
import io.github.varda.expressions.core.impl.BasicExpressionParser;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.logging.Logger;

/**
 * Publishes the {@link ExpressionPolicy} bound from {@code varda.expressions.*} and a
 * {@link BasicExpressionParser} using it. Both beans back off when the application defines its own.
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
@AutoConfiguration
@ConditionalOnClass(ExpressionParser.class)
@EnableConfigurationProperties(VardaExpressionsProperties.class)
public class VardaExpressionsAutoConfiguration {

    private static final Logger logger = Logger.getLogger(VardaExpressionsAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public ExpressionPolicy expressionPolicy(VardaExpressionsProperties properties) {
        return properties.toPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionParser expressionParser(ExpressionPolicy policy) {
        logger.info(() -> String.format("Query expression parser configured with %s (max length: %d, max depth: %d)",
                policy.policyName(), policy.maxExpressionLength(), policy.maxNestingDepth()));
        return new BasicExpressionParser(policy);
    }
}
