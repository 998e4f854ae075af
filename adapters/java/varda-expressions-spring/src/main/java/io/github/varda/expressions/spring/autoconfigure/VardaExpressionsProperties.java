package io.github.varda.expressions.spring.autoconfigure;

import io.github.varda.expressions.core.config.ExpressionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parser limits bound from {@code varda.expressions.*}.
 * <pre>
 * varda.expressions.policy=strict
 * varda.expressions.max-nesting-depth=32
 * </pre>
 * Explicit limits override the ones of the preset and make the policy a custom one.
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "varda.expressions")
public class VardaExpressionsProperties {

    private Preset policy = Preset.DEFAULT;
    private Integer maxExpressionLength;
    private Integer maxNestingDepth;

    public enum Preset {
        DEFAULT,
        STRICT,
        RELAXED
    }

    /**
     * @return the preset limits, overridden by the explicit ones
     * @throws IllegalArgumentException if an explicit limit is not positive
     */
    public ExpressionPolicy toPolicy() {
        ExpressionPolicy base = switch (policy) {
            case DEFAULT -> ExpressionPolicy.defaults();
            case STRICT -> ExpressionPolicy.strict();
            case RELAXED -> ExpressionPolicy.relaxed();
        };
        if (maxExpressionLength == null && maxNestingDepth == null) {
            return base;
        }
        return ExpressionPolicy.builder()
                .maxExpressionLength(maxExpressionLength != null ? maxExpressionLength : base.maxExpressionLength())
                .maxNestingDepth(maxNestingDepth != null ? maxNestingDepth : base.maxNestingDepth())
                .build();
    }

    public Preset getPolicy() {
        return policy;
    }

    public void setPolicy(Preset policy) {
        this.policy = policy;
    }

    public Integer getMaxExpressionLength() {
        return maxExpressionLength;
    }

    public void setMaxExpressionLength(Integer maxExpressionLength) {
        this.maxExpressionLength = maxExpressionLength;
    }

    public Integer getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(Integer maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }
}
