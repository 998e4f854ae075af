package io.github.varda.expressions.spring.autoconfigure;

import io.github.varda.expressions.core.api.ExpressionParser;
import io.github.varda.expressions.core.config.ExpressionPolicy;
import io.github.varda.expressions.core.exception.ExpressionSyntaxException;
import io.github.varda.expressions.core.impl.BasicExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VardaExpressionsAutoConfiguration Tests")
class VardaExpressionsAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(VardaExpressionsAutoConfiguration.class));

    @Test
    @DisplayName("Should publish a parser with the default policy")
    void shouldPublishDefaultParser() {
        contextRunner.run(context -> {
            ExpressionParser parser = context.getBean(ExpressionParser.class);

            assertEquals(ExpressionPolicy.defaults(), context.getBean(ExpressionPolicy.class));
            assertInstanceOf(BasicExpressionParser.class, parser);
            assertEquals(ExpressionPolicy.defaults(), ((BasicExpressionParser) parser).getPolicy());
            assertNotNull(parser.parse("sample:1 and not group:2"));
        });
    }

    @Test
    @DisplayName("Should bind a preset policy")
    void shouldBindPreset() {
        contextRunner
                .withPropertyValues("varda.expressions.policy=strict")
                .run(context -> assertEquals(ExpressionPolicy.strict(), context.getBean(ExpressionPolicy.class)));
    }

    @Test
    @DisplayName("Should override preset limits with explicit ones")
    void shouldBindExplicitLimits() {
        contextRunner
                .withPropertyValues(
                        "varda.expressions.policy=relaxed",
                        "varda.expressions.max-nesting-depth=2")
                .run(context -> {
                    ExpressionPolicy policy = context.getBean(ExpressionPolicy.class);
                    assertEquals(ExpressionPolicy.PolicyName.CUSTOM_POLICY.name(), policy.policyName());
                    assertEquals(10000, policy.maxExpressionLength());
                    assertEquals(2, policy.maxNestingDepth());

                    ExpressionParser parser = context.getBean(ExpressionParser.class);
                    assertNotNull(parser.parse("a:1 or b:2"));
                    assertThrows(ExpressionSyntaxException.class, () -> parser.parse("a:1 or b:2 or c:3"));
                });
    }

    @Test
    @DisplayName("Should fail startup on an invalid limit")
    void shouldRejectInvalidLimit() {
        contextRunner
                .withPropertyValues("varda.expressions.max-expression-length=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("Should back off when the application defines its own beans")
    void shouldBackOff() {
        contextRunner
                .withUserConfiguration(CustomParserConfiguration.class)
                .run(context -> {
                    assertSame(CustomParserConfiguration.POLICY, context.getBean(ExpressionPolicy.class));
                    assertEquals(CustomParserConfiguration.POLICY,
                            ((BasicExpressionParser) context.getBean(ExpressionParser.class)).getPolicy());
                });
    }

    @Test
    @DisplayName("Should register exactly one policy and one parser")
    void shouldRegisterSingleBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(ExpressionPolicy.class);
            assertThat(context).hasSingleBean(ExpressionParser.class);
            assertThat(context).hasSingleBean(VardaExpressionsProperties.class);
        });
    }

    @Test
    @DisplayName("Should keep a user-defined parser")
    void shouldKeepUserParser() {
        contextRunner
                .withBean("userParser", ExpressionParser.class, () -> new BasicExpressionParser(ExpressionPolicy.strict()))
                .run(context -> {
                    assertThat(context).hasSingleBean(ExpressionParser.class);
                    assertThat(context).getBean("userParser").isSameAs(context.getBean(ExpressionParser.class));
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomParserConfiguration {

        static final ExpressionPolicy POLICY = ExpressionPolicy.builder()
                .policyName("TEST_POLICY")
                .maxNestingDepth(8)
                .build();

        @Bean
        ExpressionPolicy testPolicy() {
            return POLICY;
        }
    }
}
