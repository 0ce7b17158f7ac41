package app.learngreek.core.config;

import app.learngreek.core.review.algorithm.SchedulingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Configuration
public class SrsConfig {

    private static final Logger log = LoggerFactory.getLogger(SrsConfig.class);

    @Bean
    public SchedulingConfig schedulingConfig(SrsProps props) {
        SchedulingConfig config = props.toSchedulingConfig();
        log.info("SRS config: ef=[{}, {}] initial={} stages={}/{}/{}d",
                config.minEasinessFactor(), config.maxEasinessFactor(), config.initialEasinessFactor(),
                config.learningThresholdDays(), config.reviewThresholdDays(), config.masteredThresholdDays());
        return config;
    }

    @Bean
    public Clock srsClock(SrsProps props) {
        ZoneId zone = (props.zone() == null || props.zone().isBlank())
                ? ZoneOffset.UTC
                : ZoneId.of(props.zone());
        return Clock.system(zone);
    }
}
