package org.carball.srql.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SrqlConfigTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(SrqlConfig.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setLevel(null);
        logger.setAdditive(true);
    }

    @Test
    void shouldCreateDefaultConfig() {
        // When
        SrqlConfig config = SrqlConfig.defaults();

        // Then
        assertThat(config.getDefaultLimit()).isEqualTo(100);
        assertThat(config.getMaxLimit()).isEqualTo(500);
        assertThat(config.isStrictLimits()).isFalse();
        assertThat(config.getMaxStatsExpressions()).isEqualTo(25);
        assertThat(config.getPlaceholderStyle()).isEqualTo(PlaceholderStyle.DOLLAR_NUMBERED);
        assertThat(config.isCaseInsensitiveWildcards()).isFalse();
        assertThat(config.getCatalogFile()).isNull();
    }

    @Test
    void shouldClampLimits() {
        // Given
        SrqlConfig config = SrqlConfig.builder().defaultLimit(50).maxLimit(200).build();

        // Then
        assertThat(config.clampLimit(null)).isEqualTo(50);
        assertThat(config.clampLimit(0)).isEqualTo(1);
        assertThat(config.clampLimit(-5)).isEqualTo(1);
        assertThat(config.clampLimit(1000)).isEqualTo(200);
        assertThat(config.clampLimit(75)).isEqualTo(75);
    }

    @Test
    void shouldOnlyLogDebugForValidConfig() {
        // Given
        SrqlConfig config = SrqlConfig.builder().cursorSecret("production-secret").build();

        // When
        config.validate();

        // Then
        assertThat(logAppender.list).hasSize(1);
        assertThat(logAppender.list.get(0).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void shouldWarnWhenDefaultLimitExceedsMax() {
        // Given
        SrqlConfig config = SrqlConfig.builder()
                .defaultLimit(600)
                .maxLimit(500)
                .cursorSecret("production-secret")
                .build();

        // When
        config.validate();

        // Then
        List<ILoggingEvent> warnings = logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .toList();
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getFormattedMessage())
                .isEqualTo("Default limit (600) is greater than max limit (500); it will be clamped");
    }

    @Test
    void shouldWarnAboutDevelopmentCursorSecret() {
        // When
        SrqlConfig.defaults().validate();

        // Then
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .contains("Using the built-in development cursor secret; set SRQL_CURSOR_SECRET in production");
    }

    @Test
    void shouldSummarizeConfiguration() {
        assertThat(SrqlConfig.defaults().getConfigurationSummary())
                .contains("default=100")
                .contains("max=500")
                .contains("Catalog: bundled");
    }
}
