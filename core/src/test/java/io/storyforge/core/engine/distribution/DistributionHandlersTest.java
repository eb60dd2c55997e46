package io.storyforge.core.engine.distribution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.storyforge.core.engine.DefaultRandomSource;
import io.storyforge.core.error.HandlerValidationException;
import io.storyforge.core.error.UnexpectedTypeException;
import io.storyforge.core.testkit.SequenceRandomSource;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DistributionHandlers")
class DistributionHandlersTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static JsonNode content(Map<String, Object> fields) {
        return JSON.valueToTree(fields);
    }

    @Nested
    @DisplayName("binomial")
    class Binomial {

        @Test
        void countsSuccessesAcrossTrials() {
            JsonNode c = content(Map.of("handler", "binomial-distribution", "values", List.of("zero", "one", "two")));
            var random = SequenceRandomSource.ofDoubles(0.1, 0.9);

            assertThat(DistributionHandlers.binomial(c, random)).isEqualTo(TextNode.valueOf("one"));
            assertThat(random.doubleCalls()).isEqualTo(2);
        }

        @Test
        void successRateBoundsSelectEnds() {
            JsonNode always = content(Map.of("success-rate", 1.0, "values", List.of("zero", "one", "two")));
            JsonNode never = content(Map.of("success-rate", 0, "values", List.of("zero", "one", "two")));
            var random = new DefaultRandomSource(7L);

            for (int i = 0; i < 20; i++) {
                assertThat(DistributionHandlers.binomial(always, random).asText()).isEqualTo("two");
                assertThat(DistributionHandlers.binomial(never, random).asText()).isEqualTo("zero");
            }
        }

        @Test
        void singleValueNeedsNoTrials() {
            var random = SequenceRandomSource.ofDoubles(0.0);

            assertThat(DistributionHandlers.binomial(content(Map.of("values", List.of("only"))), random).asText())
                    .isEqualTo("only");
            assertThat(random.doubleCalls()).isZero();
        }

        @Test
        void rejectsOutOfRangeRate() {
            JsonNode c = content(Map.of("success-rate", 1.5, "values", List.of("a", "b")));

            assertThatThrownBy(() -> DistributionHandlers.binomial(c, SequenceRandomSource.ofDoubles(0.5)))
                    .isInstanceOfSatisfying(HandlerValidationException.class, e -> assertThat(e.handlerName())
                            .isEqualTo(DistributionHandlers.BINOMIAL));
        }

        @Test
        void rejectsNonNumericRate() {
            JsonNode c = content(Map.of("success-rate", "high", "values", List.of("a", "b")));

            assertThatThrownBy(() -> DistributionHandlers.binomial(c, SequenceRandomSource.ofDoubles(0.5)))
                    .isInstanceOf(HandlerValidationException.class)
                    .hasMessageContaining("success-rate");
        }
    }

    @Nested
    @DisplayName("discrete")
    class Discrete {

        private final JsonNode weighted =
                content(Map.of("weights", List.of(1, 3), "values", List.of("rare", "common")));

        @Test
        void picksProportionallyToWeight() {
            assertThat(DistributionHandlers.discrete(weighted, SequenceRandomSource.ofDoubles(0.2)).asText())
                    .isEqualTo("rare");
            assertThat(DistributionHandlers.discrete(weighted, SequenceRandomSource.ofDoubles(0.5)).asText())
                    .isEqualTo("common");
        }

        @Test
        void topOfRangeLandsOnLastPositiveWeight() {
            JsonNode c = content(Map.of("weights", List.of(1, 0), "values", List.of("first", "second")));

            assertThat(DistributionHandlers.discrete(c, SequenceRandomSource.ofDoubles(1.0)).asText())
                    .isEqualTo("first");
        }

        @Test
        void rejectsMismatchedLengths() {
            JsonNode c = content(Map.of("weights", List.of(1), "values", List.of("a", "b")));

            assertThatThrownBy(() -> DistributionHandlers.discrete(c, SequenceRandomSource.ofDoubles(0.5)))
                    .isInstanceOf(HandlerValidationException.class)
                    .hasMessageContaining("1 entries");
        }

        @Test
        void rejectsNegativeOrAllZeroWeights() {
            JsonNode negative = content(Map.of("weights", List.of(-1, 2), "values", List.of("a", "b")));
            JsonNode zero = content(Map.of("weights", List.of(0, 0), "values", List.of("a", "b")));

            assertThatThrownBy(() -> DistributionHandlers.discrete(negative, SequenceRandomSource.ofDoubles(0.5)))
                    .isInstanceOf(HandlerValidationException.class);
            assertThatThrownBy(() -> DistributionHandlers.discrete(zero, SequenceRandomSource.ofDoubles(0.5)))
                    .isInstanceOf(HandlerValidationException.class);
        }

        @Test
        void rejectsMissingValues() {
            Map<String, Object> fields = new HashMap<>();
            fields.put("weights", List.of(1));

            assertThatThrownBy(() -> DistributionHandlers.discrete(content(fields), SequenceRandomSource.ofDoubles(0.5)))
                    .isInstanceOf(HandlerValidationException.class)
                    .hasMessageContaining("'values'");
        }
    }

    @Test
    void nonObjectContentIsUnexpectedType() {
        assertThatThrownBy(() -> DistributionHandlers.discrete(TextNode.valueOf("x"), SequenceRandomSource.ofDoubles(0)))
                .isInstanceOf(UnexpectedTypeException.class)
                .hasMessageContaining("STRING");
    }

    @Test
    void createReturnsFreshMap() {
        var first = DistributionHandlers.create();
        first.clear();

        assertThat(DistributionHandlers.create())
                .containsOnlyKeys(DistributionHandlers.BINOMIAL, DistributionHandlers.DISCRETE);
    }
}
