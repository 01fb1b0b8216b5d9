package com.paywise.budget.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final PaywiseProperties props;

    public StartupDiagnostics(PaywiseProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var analysis = props.analysis();
        log.info("Analysis config: defaultPeriods={}, maxPeriods={}, zone='{}'",
                analysis.defaultPeriods(), analysis.maxPeriods(), analysis.zone());
        log.info("DB config: bootstrapEnabled={}, env(PAYWISE_DB_BOOTSTRAP)='{}'",
                props.db().bootstrapEnabledFlag(), System.getenv("PAYWISE_DB_BOOTSTRAP"));
    }
}
