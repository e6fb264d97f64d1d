package com.github.salilvnair.statefuzzer.config;

import com.github.salilvnair.statefuzzer.engine.constants.StateFuzzerConstants;
import com.github.salilvnair.statefuzzer.engine.expression.type.MissingIdentifierPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "statefuzzer")
@Getter
@Setter
public class StateFuzzerConfig {

    private Explorer explorer = new Explorer();
    private Expression expression = new Expression();
    private Model model = new Model();

    @Getter
    @Setter
    public static class Explorer {
        private int maxDepth = StateFuzzerConstants.DEFAULT_MAX_DEPTH;
        private int maxBranchesPerState = StateFuzzerConstants.DEFAULT_MAX_BRANCHES_PER_STATE;
        private Long seed;
        private long maxIterations = 0L;
        private Duration timeBudget;
    }

    @Getter
    @Setter
    public static class Expression {
        private MissingIdentifierPolicy missingIdentifier = MissingIdentifierPolicy.ABSENT;
    }

    @Getter
    @Setter
    public static class Model {
        private String defaultSeverity = StateFuzzerConstants.DEFAULT_SEVERITY;
        private boolean validateExpressionsOnLoad = false;
    }
}
