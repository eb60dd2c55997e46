package io.storyforge.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.storyforge.core.spi.RandomSource;
import java.util.List;
import org.junit.jupiter.api.Test;

class RandomSelectorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void picksIndexFromSource() {
        var selector = new RandomSelector(fixed(2));

        assertThat(selector.pick(JSON.valueToTree(List.of("a", "b", "c")))).hasValue(TextNode.valueOf("c"));
    }

    @Test
    void emptyArrayPicksNothing() {
        assertThat(new RandomSelector(fixed(0)).pick(JSON.createArrayNode())).isEmpty();
    }

    @Test
    void outOfRangeIndexWraps() {
        assertThat(new RandomSelector(fixed(5)).pickIndex(3)).isEqualTo(2);
        assertThat(new RandomSelector(fixed(-1)).pickIndex(3)).isEqualTo(2);
    }

    @Test
    void nonArrayRejected() {
        assertThatThrownBy(() -> new RandomSelector(fixed(0)).pick(TextNode.valueOf("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void seededSourcesAreReproducible() {
        var first = new DefaultRandomSource(99L);
        var second = new DefaultRandomSource(99L);

        for (int i = 0; i < 10; i++) {
            assertThat(first.nextInt(1000)).isEqualTo(second.nextInt(1000));
        }
    }

    private static RandomSource fixed(int value) {
        return new RandomSource() {
            @Override
            public int nextInt(int bound) {
                return value;
            }

            @Override
            public double nextDouble() {
                return 0.0;
            }
        };
    }
}
