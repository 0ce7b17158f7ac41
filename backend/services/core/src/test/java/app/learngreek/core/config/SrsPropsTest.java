package app.learngreek.core.config;

import app.learngreek.core.review.algorithm.SchedulingConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SrsPropsTest {

    @Test
    void missingSections_fallBackToDefaults() {
        SrsProps props = new SrsProps(null, null, null, null, null);

        assertThat(props.toSchedulingConfig()).isEqualTo(SchedulingConfig.defaults());
        assertThat(props.examCategories()).containsExactly("history", "geography", "politics", "culture");
    }

    @Test
    void partialOverrides_keepOtherDefaults() {
        SrsProps props = new SrsProps(
                new SrsProps.Easiness(null, 2.8, null),
                new SrsProps.Stages(null, 10, 30),
                new SrsProps.Queue(50, null, null),
                new SrsProps.Readiness(null, null, null, 90.0, null, null, List.of("history")),
                "Europe/Athens"
        );

        SchedulingConfig config = props.toSchedulingConfig();

        assertThat(config.maxEasinessFactor()).isEqualTo(2.8);
        assertThat(config.minEasinessFactor()).isEqualTo(1.3);
        assertThat(config.reviewThresholdDays()).isEqualTo(10);
        assertThat(config.masteredThresholdDays()).isEqualTo(30);
        assertThat(config.defaultMaxDue()).isEqualTo(50);
        assertThat(config.defaultMaxNew()).isEqualTo(10);
        assertThat(config.thoroughlyPreparedThreshold()).isEqualTo(90.0);
        assertThat(props.examCategories()).containsExactly("history");
    }

    @Test
    void inconsistentBounds_areRejected() {
        SrsProps props = new SrsProps(new SrsProps.Easiness(2.6, 2.0, null), null, null, null, null);

        assertThatThrownBy(props::toSchedulingConfig).isInstanceOf(IllegalArgumentException.class);
    }
}
